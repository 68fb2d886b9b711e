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

import ai.floedb.vecpart.engine.spi.Partition;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;

/**
 * A partition whose payload is a single Arrow vector.
 *
 * <p>The partition owns its vector exclusively and releases it on {@link #close()}. Its identity is
 * positional: two partitions are equal when they belong to the same collection and sit at the same
 * index, whatever their vectors hold.
 *
 * <p>Arrow memory cannot travel through Java serialization, so a partition serializes through
 * {@link VectorPartitionExternalForm}, which writes the vector value by value with {@link
 * VectorPartitionCodec} and resolves to a new partition on the receiving side. An existing
 * partition is never modified by deserialization.
 *
 * @param <T> Java type of the vector's slots, fixed by the vector's minor type
 */
public final class VectorPartition<T> implements Partition, AutoCloseable {

  private static final long serialVersionUID = 1L;

  private final long collectionId;
  private final int index;
  private final transient VectorType<T> type;
  private final transient FieldVector vector;
  private final transient BufferAllocator ownedAllocator;
  private transient boolean closed;

  private VectorPartition(
      long collectionId,
      int index,
      VectorType<T> type,
      FieldVector vector,
      BufferAllocator ownedAllocator) {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0: " + index);
    }
    this.collectionId = collectionId;
    this.index = index;
    this.type = Objects.requireNonNull(type, "type");
    this.vector = Objects.requireNonNull(vector, "vector");
    this.ownedAllocator = ownedAllocator;
  }

  /**
   * Wraps {@code vector}, inferring the element type from its minor type. Ownership of the vector
   * passes to the returned partition.
   *
   * @throws VectorPartitionException of kind {@code UNSUPPORTED_TYPE} for unregistered types
   */
  public static VectorPartition<?> create(long collectionId, int index, FieldVector vector) {
    Objects.requireNonNull(vector, "vector");
    VectorType<?> type;
    try {
      type = VectorTypes.of(vector);
    } catch (VectorPartitionException e) {
      throw e.forPartition(collectionId, index);
    }
    return create(collectionId, index, type, vector);
  }

  /**
   * Wraps {@code vector} as a partition of element type {@code T}.
   *
   * @throws VectorPartitionException of kind {@code TYPE_MISMATCH} if the vector is not of {@code
   *     type}
   */
  public static <T> VectorPartition<T> create(
      long collectionId, int index, VectorType<T> type, FieldVector vector) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(vector, "vector");
    if (!type.accepts(vector)) {
      throw VectorPartitionException.typeMismatch(type.tag(), String.valueOf(vector.getMinorType()))
          .forPartition(collectionId, index);
    }
    return new VectorPartition<>(collectionId, index, type, vector, null);
  }

  /** Partition rebuilt by the codec; it also owns the allocator its vector came from. */
  static <T> VectorPartition<T> decoded(
      long collectionId,
      int index,
      VectorType<T> type,
      FieldVector vector,
      BufferAllocator ownedAllocator) {
    return new VectorPartition<>(collectionId, index, type, vector, ownedAllocator);
  }

  public long collectionId() {
    return collectionId;
  }

  @Override
  public int index() {
    return index;
  }

  public VectorType<T> type() {
    return type;
  }

  /**
   * The owned vector. Callers must not keep it beyond the partition's lifetime and must not close
   * it themselves.
   */
  public FieldVector vector() {
    return vector;
  }

  public int valueCount() {
    return vector.getValueCount();
  }

  /**
   * Views this partition with element type {@code U}.
   *
   * @throws VectorPartitionException of kind {@code TYPE_MISMATCH} if {@code U} is not the element
   *     type of the vector
   */
  @SuppressWarnings("unchecked")
  public <U> VectorPartition<U> as(VectorType<U> expected) {
    Objects.requireNonNull(expected, "expected");
    if (expected != type) {
      throw VectorPartitionException.typeMismatch(expected.tag(), type.tag())
          .forPartition(collectionId, index);
    }
    return (VectorPartition<U>) this;
  }

  /**
   * Returns a lazy, single-pass iterator over the vector's slots in index order. Each call returns
   * an independent iterator starting at slot 0. Iterators are not thread-safe.
   */
  public Iterator<T> iterator() {
    return new SlotIterator();
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      try {
        vector.close();
      } finally {
        if (ownedAllocator != null) {
          ownedAllocator.close();
        }
      }
    }
  }

  @Override
  public int hashCode() {
    return (int) (43 * (43 + collectionId) + index);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof VectorPartition<?> that
        && collectionId == that.collectionId
        && index == that.index;
  }

  @Override
  public String toString() {
    return "VectorPartition{collectionId="
        + collectionId
        + ", index="
        + index
        + ", type="
        + type.tag()
        + ", valueCount="
        + (closed ? "closed" : String.valueOf(vector.getValueCount()))
        + "}";
  }

  private Object writeReplace() {
    return new VectorPartitionExternalForm(this);
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("VectorPartition is deserialized through its external form");
  }

  private final class SlotIterator implements Iterator<T> {

    private int cursor;

    @Override
    public boolean hasNext() {
      return cursor < vector.getValueCount();
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      T value = type.get(vector, cursor);
      cursor++;
      return value;
    }
  }
}
