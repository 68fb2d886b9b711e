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

package ai.floedb.vecpart.collection;

import ai.floedb.vecpart.engine.spi.TaskDispatcher;
import ai.floedb.vecpart.vector.VectorPartition;
import ai.floedb.vecpart.vector.VectorPartitionException;
import ai.floedb.vecpart.vector.VectorType;
import ai.floedb.vecpart.vector.VectorTypes;
import ai.floedb.vecpart.vector.config.VecPartConfigs;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Function;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.OutOfMemoryException;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.util.OversizedAllocationException;
import org.jboss.logging.Logger;

/**
 * A distributed collection backed by Arrow vectors, one vector per partition.
 *
 * <p>The input vectors are treated as one logical sequence and cut into contiguous slices. Each
 * slice is copied into a vector of its own, so partitions never share memory with each other or
 * with the inputs, which stay owned by the caller.
 */
public final class VectorCollection implements AutoCloseable {

  private static final Logger LOG = Logger.getLogger(VectorCollection.class);

  private final long id;
  private final VectorType<?> type;
  private final List<VectorPartition<?>> partitions;

  private VectorCollection(long id, VectorType<?> type, List<VectorPartition<?>> partitions) {
    this.id = id;
    this.type = type;
    this.partitions = List.copyOf(partitions);
  }

  /** Slices {@code vectors} into {@code vecpart.collection.default-partitions} partitions. */
  public static VectorCollection slice(
      long id, List<? extends FieldVector> vectors, BufferAllocator allocator) {
    return slice(
        id, vectors, VecPartConfigs.current().collection().defaultPartitions(), allocator);
  }

  /**
   * Slices the logical concatenation of {@code vectors} into {@code numPartitions} partitions.
   * Partition {@code i} holds elements {@code [i * n / numPartitions, (i + 1) * n / numPartitions)}
   * of the {@code n} input elements, so concatenating the partitions by ascending index restores
   * the input order.
   *
   * @throws VectorPartitionException of kind {@code TYPE_MISMATCH} if the vectors do not share one
   *     minor type, or {@code UNSUPPORTED_TYPE} if that type is not supported
   */
  public static VectorCollection slice(
      long id, List<? extends FieldVector> vectors, int numPartitions, BufferAllocator allocator) {
    Objects.requireNonNull(vectors, "vectors");
    Objects.requireNonNull(allocator, "allocator");
    if (vectors.isEmpty()) {
      throw new IllegalArgumentException("At least one vector is required");
    }
    if (numPartitions < 1) {
      throw new IllegalArgumentException("numPartitions must be >= 1: " + numPartitions);
    }
    VectorType<?> type = VectorTypes.of(vectors.get(0));
    for (FieldVector vector : vectors) {
      if (!type.accepts(vector)) {
        throw new VectorPartitionException(
            VectorPartitionException.Kind.TYPE_MISMATCH,
            "Collection "
                + id
                + " mixes "
                + type.tag()
                + " and "
                + vector.getMinorType()
                + " vectors");
      }
    }
    return sliceTyped(id, type, vectors, numPartitions, allocator);
  }

  private static <T> VectorCollection sliceTyped(
      long id,
      VectorType<T> type,
      List<? extends FieldVector> vectors,
      int numPartitions,
      BufferAllocator allocator) {
    long total = 0;
    for (FieldVector vector : vectors) {
      total += vector.getValueCount();
    }
    String name = vectors.get(0).getField().getName();
    List<VectorPartition<?>> slices = new ArrayList<>(numPartitions);
    boolean complete = false;
    try {
      int source = 0;
      int offset = 0;
      for (int i = 0; i < numPartitions; i++) {
        int start = (int) (i * total / numPartitions);
        int end = (int) ((i + 1) * total / numPartitions);
        int length = end - start;
        try {
          FieldVector target = type.allocate(allocator, name, length);
          slices.add(VectorPartition.create(id, i, type, target));
          for (int slot = 0; slot < length; slot++) {
            while (offset >= vectors.get(source).getValueCount()) {
              source++;
              offset = 0;
            }
            target.copyFromSafe(offset, slot, vectors.get(source));
            offset++;
          }
          target.setValueCount(length);
        } catch (OutOfMemoryException | OversizedAllocationException e) {
          throw new VectorPartitionException(
              VectorPartitionException.Kind.ALLOCATION_FAILURE,
              "Cannot allocate slice of " + length + " " + type.tag() + " values",
              e,
              id,
              i);
        }
      }
      complete = true;
    } finally {
      if (!complete) {
        slices.forEach(VectorPartition::close);
      }
    }
    LOG.debugf(
        "Sliced %d %s values from %d vectors into %d partitions of collection %d",
        total, type.tag(), vectors.size(), numPartitions, id);
    return new VectorCollection(id, type, slices);
  }

  public long id() {
    return id;
  }

  public VectorType<?> type() {
    return type;
  }

  public int numPartitions() {
    return partitions.size();
  }

  /** Partitions in ascending index order. */
  public List<VectorPartition<?>> partitions() {
    return partitions;
  }

  /** Typed iterator over one partition of this collection. */
  public <T> Iterator<T> compute(VectorPartition<?> partition, VectorType<T> elementType) {
    Objects.requireNonNull(partition, "partition");
    if (partition.collectionId() != id) {
      throw new IllegalArgumentException(
          "Partition " + partition + " does not belong to collection " + id);
    }
    return partition.as(elementType).iterator();
  }

  /**
   * Runs {@code task} over the typed iterator of every partition and returns the results ordered
   * by partition index.
   */
  public <T, R> List<R> runJob(
      VectorType<T> elementType, Function<Iterator<T>, R> task, TaskDispatcher dispatcher) {
    Objects.requireNonNull(elementType, "elementType");
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(dispatcher, "dispatcher");
    List<R> results = new ArrayList<>(partitions.size());
    for (VectorPartition<?> partition : partitions) {
      results.add(dispatcher.dispatch(partition, p -> task.apply(compute(p, elementType))));
    }
    return results;
  }

  /** All elements of the collection in partition order. */
  public <T> List<T> collect(VectorType<T> elementType, TaskDispatcher dispatcher) {
    List<List<T>> slices =
        runJob(
            elementType,
            iterator -> {
              List<T> values = new ArrayList<>();
              iterator.forEachRemaining(values::add);
              return values;
            },
            dispatcher);
    List<T> all = new ArrayList<>();
    slices.forEach(all::addAll);
    return all;
  }

  /**
   * Minimum of an integral collection, read straight from the vector slots. Null slots are
   * skipped; the result is empty when no slot holds a value.
   */
  public OptionalLong vectorMin(TaskDispatcher dispatcher) {
    Objects.requireNonNull(dispatcher, "dispatcher");
    if (type != VectorTypes.INT && type != VectorTypes.BIGINT) {
      throw new VectorPartitionException(
          VectorPartitionException.Kind.TYPE_MISMATCH,
          "vectorMin needs an INT or BIGINT collection, not " + type.tag());
    }
    OptionalLong min = OptionalLong.empty();
    for (VectorPartition<?> partition : partitions) {
      OptionalLong local = dispatcher.dispatch(partition, VectorCollection::minOf);
      if (local.isPresent() && (min.isEmpty() || local.getAsLong() < min.getAsLong())) {
        min = local;
      }
    }
    return min;
  }

  private static OptionalLong minOf(VectorPartition<?> partition) {
    FieldVector vector = partition.vector();
    int valueCount = vector.getValueCount();
    boolean found = false;
    long min = Long.MAX_VALUE;
    if (vector instanceof IntVector ints) {
      for (int i = 0; i < valueCount; i++) {
        if (!ints.isNull(i)) {
          found = true;
          min = Math.min(min, ints.get(i));
        }
      }
    } else if (vector instanceof BigIntVector longs) {
      for (int i = 0; i < valueCount; i++) {
        if (!longs.isNull(i)) {
          found = true;
          min = Math.min(min, longs.get(i));
        }
      }
    }
    return found ? OptionalLong.of(min) : OptionalLong.empty();
  }

  @Override
  public void close() {
    partitions.forEach(VectorPartition::close);
  }
}
