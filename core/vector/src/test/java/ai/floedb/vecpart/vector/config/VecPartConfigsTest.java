/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.vecpart.vector.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class VecPartConfigsTest {

  @Test
  void load_appliesDefaults() {
    VecPartConfig config = VecPartConfigs.load(Map.of());

    assertThat(config.allocator().limit()).isEqualTo(Long.MAX_VALUE);
    assertThat(config.codec().maxElementBytes()).isEqualTo(268435456);
    assertThat(config.codec().vectorName()).isEqualTo("vector");
    assertThat(config.collection().defaultPartitions()).isEqualTo(2);
  }

  @Test
  void load_prefersOverrides() {
    VecPartConfig config =
        VecPartConfigs.load(
            Map.of(
                "vecpart.codec.max-element-bytes", "1024",
                "vecpart.codec.vector-name", "payload",
                "vecpart.collection.default-partitions", "8"));

    assertThat(config.codec().maxElementBytes()).isEqualTo(1024);
    assertThat(config.codec().vectorName()).isEqualTo("payload");
    assertThat(config.collection().defaultPartitions()).isEqualTo(8);
  }
}
