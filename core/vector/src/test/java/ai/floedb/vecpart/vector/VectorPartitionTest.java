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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.junit.jupiter.api.Test;

class VectorPartitionTest {

  @Test
  void create_infersElementTypeFromVector() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VectorPartition<?> partition = VectorPartition.create(7L, 2, ints(allocator, 1, 2, 3))) {
      assertThat(partition.type()).isSameAs(VectorTypes.INT);
      assertThat(partition.collectionId()).isEqualTo(7L);
      assertThat(partition.index()).isEqualTo(2);
      assertThat(partition.valueCount()).isEqualTo(3);
    }
  }

  @Test
  void iterator_yieldsSlotsInOrderThenStops() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VectorPartition<Integer> partition =
            VectorPartition.create(1L, 0, VectorTypes.INT, ints(allocator, 5, 4, 3))) {
      Iterator<Integer> iterator = partition.iterator();

      List<Integer> values = new ArrayList<>();
      iterator.forEachRemaining(values::add);

      assertThat(values).containsExactly(5, 4, 3);
      assertThat(iterator.hasNext()).isFalse();
      assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);

      assertThat(partition.iterator()).toIterable().containsExactly(5, 4, 3);
    }
  }

  @Test
  void iterator_isLazy() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VectorPartition<Integer> partition =
            VectorPartition.create(1L, 0, VectorTypes.INT, ints(allocator, 1, 2))) {
      Iterator<Integer> iterator = partition.iterator();
      assertThat(iterator.next()).isEqualTo(1);

      ((IntVector) partition.vector()).set(1, 20);

      assertThat(iterator.next()).isEqualTo(20);
    }
  }

  @Test
  void iterator_yieldsNullForNullSlots() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE)) {
      VarCharVector vector = new VarCharVector("names", allocator);
      vector.allocateNew();
      vector.setSafe(0, "a".getBytes(StandardCharsets.UTF_8));
      vector.setNull(1);
      vector.setSafe(2, "c".getBytes(StandardCharsets.UTF_8));
      vector.setValueCount(3);
      try (VectorPartition<String> partition =
          VectorPartition.create(1L, 0, VectorTypes.VARCHAR, vector)) {
        assertThat(partition.iterator()).toIterable().containsExactly("a", null, "c");
      }
    }
  }

  @Test
  void equality_dependsOnlyOnCollectionAndIndex() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VectorPartition<?> first = VectorPartition.create(3L, 1, ints(allocator, 1, 2));
        VectorPartition<?> sameSlot = VectorPartition.create(3L, 1, ints(allocator, 9, 9, 9));
        VectorPartition<?> otherIndex = VectorPartition.create(3L, 2, ints(allocator, 1, 2));
        VectorPartition<?> otherCollection = VectorPartition.create(4L, 1, ints(allocator, 1, 2))) {
      assertThat(first).isEqualTo(sameSlot);
      assertThat(first.hashCode()).isEqualTo(sameSlot.hashCode());
      assertThat(first).isNotEqualTo(otherIndex);
      assertThat(first).isNotEqualTo(otherCollection);
      assertThat(first.hashCode()).isEqualTo((int) (43 * (43 + 3L) + 1));
    }
  }

  @Test
  void as_narrowsOrFailsFast() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VectorPartition<?> partition = VectorPartition.create(5L, 0, ints(allocator, 1))) {
      assertThat(partition.as(VectorTypes.INT).iterator().next()).isEqualTo(1);

      assertThatThrownBy(() -> partition.as(VectorTypes.VARCHAR))
          .isInstanceOfSatisfying(
              VectorPartitionException.class,
              e -> {
                assertThat(e.kind()).isEqualTo(VectorPartitionException.Kind.TYPE_MISMATCH);
                assertThat(e.collectionId()).isEqualTo(5L);
                assertThat(e.index()).isZero();
              });
    }
  }

  @Test
  void create_rejectsMismatchedAndUnsupportedVectors() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        IntVector ints = ints(allocator, 1);
        Float4Vector floats = new Float4Vector("f", allocator)) {
      assertThatThrownBy(() -> VectorPartition.create(1L, 0, VectorTypes.BIGINT, ints))
          .isInstanceOf(VectorPartitionException.class)
          .hasMessageContaining("TYPE_MISMATCH");

      assertThatThrownBy(() -> VectorPartition.create(1L, 3, floats))
          .isInstanceOfSatisfying(
              VectorPartitionException.class,
              e -> {
                assertThat(e.kind()).isEqualTo(VectorPartitionException.Kind.UNSUPPORTED_TYPE);
                assertThat(e.index()).isEqualTo(3);
              });

      assertThatThrownBy(() -> VectorPartition.create(1L, -1, VectorTypes.INT, ints))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("index");
    }
  }

  @Test
  void close_releasesVectorOnce() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE)) {
      VectorPartition<?> partition = VectorPartition.create(1L, 0, ints(allocator, 1, 2, 3));
      assertThat(allocator.getAllocatedMemory()).isPositive();

      partition.close();
      partition.close();

      assertThat(partition.isClosed()).isTrue();
      assertThat(allocator.getAllocatedMemory()).isZero();
    }
  }

  static IntVector ints(BufferAllocator allocator, int... values) {
    IntVector vector = new IntVector("ints", allocator);
    vector.allocateNew(values.length);
    for (int i = 0; i < values.length; i++) {
      vector.set(i, values[i]);
    }
    vector.setValueCount(values.length);
    return vector;
  }
}
