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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/** Tunables for partition externalization and slicing. */
@ConfigMapping(prefix = "vecpart")
public interface VecPartConfig {

  AllocatorConfig allocator();

  CodecConfig codec();

  CollectionConfig collection();

  interface AllocatorConfig {
    /** Byte limit of the process-wide allocator that decoded partitions allocate from. */
    @WithDefault("9223372036854775807")
    long limit();
  }

  interface CodecConfig {
    /** Largest length prefix accepted for a single variable-width element. */
    @WithDefault("268435456")
    int maxElementBytes();

    /** Field name given to vectors rebuilt by the codec. */
    @WithDefault("vector")
    String vectorName();
  }

  interface CollectionConfig {
    @WithDefault("2")
    int defaultPartitions();
  }
}
