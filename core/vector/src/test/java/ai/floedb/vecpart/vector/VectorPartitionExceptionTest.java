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

package ai.floedb.vecpart.vector;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VectorPartitionExceptionTest {

  @Test
  void forPartition_attachesIdentityAndKeepsKind() {
    IllegalStateException cause = new IllegalStateException("boom");
    VectorPartitionException error =
        VectorPartitionException.streamCorruption("Stream ended early", cause);

    VectorPartitionException attributed = error.forPartition(7L, 2);

    assertThat(error.hasPartition()).isFalse();
    assertThat(attributed.hasPartition()).isTrue();
    assertThat(attributed.kind()).isEqualTo(VectorPartitionException.Kind.STREAM_CORRUPTION);
    assertThat(attributed.collectionId()).isEqualTo(7L);
    assertThat(attributed.index()).isEqualTo(2);
    assertThat(attributed.getCause()).isSameAs(cause);
    assertThat(attributed.getMessage())
        .isEqualTo("STREAM_CORRUPTION: Stream ended early (collection=7, index=2)");
  }

  @Test
  void forPartition_keepsExistingIdentity() {
    VectorPartitionException error =
        VectorPartitionException.unsupportedType("FLOAT4").forPartition(1L, 0);

    assertThat(error.forPartition(9L, 9)).isSameAs(error);
    assertThat(error.getMessage()).isEqualTo(
        "UNSUPPORTED_TYPE: Unsupported vector type: FLOAT4 (collection=1, index=0)");
  }
}
