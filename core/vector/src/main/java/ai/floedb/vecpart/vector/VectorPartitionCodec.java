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

import ai.floedb.vecpart.vector.config.VecPartConfig;
import ai.floedb.vecpart.vector.config.VecPartConfigs;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UTFDataFormatException;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.OutOfMemoryException;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.util.OversizedAllocationException;
import org.jboss.logging.Logger;

/**
 * Binary externalization of a {@link VectorPartition}.
 *
 * <p>Layout, all integers big-endian:
 *
 * <pre>
 *   collectionId  int64
 *   index         int32
 *   valueCount    int32
 *   typeTag       modified UTF-8 (Arrow minor type name)
 *   element       x valueCount, see {@link VectorType#writeElement}
 * </pre>
 *
 * <p>Decoding always rebuilds the vector value by value into freshly allocated memory. A decode
 * that fails for any reason releases everything it allocated before the error propagates.
 */
public final class VectorPartitionCodec {

  private static final Logger LOG = Logger.getLogger(VectorPartitionCodec.class);

  private static volatile SharedCodec shared;

  private final int maxElementBytes;
  private final String vectorName;

  public VectorPartitionCodec(int maxElementBytes, String vectorName) {
    if (maxElementBytes < 0) {
      throw new IllegalArgumentException("maxElementBytes must be >= 0: " + maxElementBytes);
    }
    this.maxElementBytes = maxElementBytes;
    this.vectorName = Objects.requireNonNull(vectorName, "vectorName");
  }

  public static VectorPartitionCodec fromConfig(VecPartConfig config) {
    Objects.requireNonNull(config, "config");
    return new VectorPartitionCodec(config.codec().maxElementBytes(), config.codec().vectorName());
  }

  /**
   * Codec built from {@link VecPartConfigs#current()}, used by Java serialization. It is rebuilt
   * whenever the current configuration is replaced.
   */
  public static VectorPartitionCodec shared() {
    VecPartConfig config = VecPartConfigs.current();
    SharedCodec cached = shared;
    if (cached == null || cached.config != config) {
      cached = new SharedCodec(config, fromConfig(config));
      shared = cached;
    }
    return cached.codec;
  }

  int maxElementBytes() {
    return maxElementBytes;
  }

  String vectorName() {
    return vectorName;
  }

  public void write(DataOutput out, VectorPartition<?> partition) throws IOException {
    Objects.requireNonNull(out, "out");
    Objects.requireNonNull(partition, "partition");
    if (partition.isClosed()) {
      throw new IllegalStateException("Cannot write closed partition " + partition);
    }
    writeTyped(out, partition);
  }

  private static <T> void writeTyped(DataOutput out, VectorPartition<T> partition)
      throws IOException {
    VectorType<T> type = partition.type();
    FieldVector vector = partition.vector();
    int valueCount = vector.getValueCount();
    out.writeLong(partition.collectionId());
    out.writeInt(partition.index());
    out.writeInt(valueCount);
    out.writeUTF(type.tag());
    try {
      for (int i = 0; i < valueCount; i++) {
        type.writeSlot(out, vector, i);
      }
    } catch (VectorPartitionException e) {
      throw e.forPartition(partition.collectionId(), partition.index());
    }
  }

  /**
   * Reads one partition. The returned partition allocates from a child of {@code allocator} and
   * must be closed by the caller.
   *
   * @throws VectorPartitionException if the stream names an unsupported type, is corrupt, or the
   *     vector cannot be allocated
   * @throws IOException if the underlying stream fails
   */
  public VectorPartition<?> read(DataInput in, BufferAllocator allocator) throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(allocator, "allocator");
    long collectionId;
    int index;
    int valueCount;
    String tag;
    try {
      collectionId = in.readLong();
      index = in.readInt();
      valueCount = in.readInt();
      tag = in.readUTF();
    } catch (EOFException e) {
      throw failure(
          VectorPartitionException.streamCorruption("Stream ended inside partition header", e));
    } catch (UTFDataFormatException e) {
      throw failure(VectorPartitionException.streamCorruption("Malformed type tag", e));
    }
    if (index < 0 || valueCount < 0) {
      throw failure(
          VectorPartitionException.streamCorruption(
                  "Invalid header: index=" + index + ", valueCount=" + valueCount)
              .forPartition(collectionId, index));
    }
    VectorType<?> type;
    try {
      type = VectorTypes.forTag(tag);
    } catch (VectorPartitionException e) {
      throw failure(e.forPartition(collectionId, index));
    }
    VectorPartition<?> partition = readVector(in, allocator, collectionId, index, valueCount, type);
    LOG.debugf(
        "Decoded partition collection=%d index=%d type=%s values=%d",
        collectionId, index, type.tag(), valueCount);
    return partition;
  }

  private <T> VectorPartition<T> readVector(
      DataInput in,
      BufferAllocator allocator,
      long collectionId,
      int index,
      int valueCount,
      VectorType<T> type)
      throws IOException {
    BufferAllocator child = null;
    FieldVector vector = null;
    boolean complete = false;
    int slot = 0;
    try {
      child =
          allocator.newChildAllocator(
              "vecpart-" + collectionId + "-" + index, 0, allocator.getLimit());
      vector = type.allocate(child, vectorName, valueCount);
      for (; slot < valueCount; slot++) {
        type.set(vector, slot, type.readElement(in, maxElementBytes));
      }
      vector.setValueCount(valueCount);
      VectorPartition<T> partition =
          VectorPartition.decoded(collectionId, index, type, vector, child);
      complete = true;
      return partition;
    } catch (EOFException e) {
      throw failure(
          VectorPartitionException.streamCorruption(
                  "Stream ended after " + slot + " of " + valueCount + " elements", e)
              .forPartition(collectionId, index));
    } catch (OutOfMemoryException | OversizedAllocationException e) {
      throw failure(
          VectorPartitionException.allocationFailure(
                  "Cannot allocate " + type.tag() + " vector of " + valueCount + " values", e)
              .forPartition(collectionId, index));
    } catch (VectorPartitionException e) {
      throw failure(e.forPartition(collectionId, index));
    } finally {
      if (!complete) {
        release(vector, child);
      }
    }
  }

  /** Encodes {@code partition} into a standalone byte array. */
  public byte[] encode(VectorPartition<?> partition) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      write(out, partition);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  /**
   * Decodes a byte array produced by {@link #encode}. Bytes left over after the declared elements
   * are treated as corruption.
   */
  public VectorPartition<?> decode(byte[] encoded, BufferAllocator allocator) {
    Objects.requireNonNull(encoded, "encoded");
    ByteArrayInputStream bytes = new ByteArrayInputStream(encoded);
    VectorPartition<?> partition;
    try {
      partition = read(new DataInputStream(bytes), allocator);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    int trailing = bytes.available();
    if (trailing > 0) {
      int valueCount = partition.valueCount();
      partition.close();
      throw failure(
          VectorPartitionException.streamCorruption(
                  trailing + " trailing bytes after " + valueCount + " elements")
              .forPartition(partition.collectionId(), partition.index()));
    }
    return partition;
  }

  private static VectorPartitionException failure(VectorPartitionException e) {
    LOG.warnf("Failed to decode vector partition: %s", e.getMessage());
    return e;
  }

  private static final class SharedCodec {
    private final VecPartConfig config;
    private final VectorPartitionCodec codec;

    SharedCodec(VecPartConfig config, VectorPartitionCodec codec) {
      this.config = config;
      this.codec = codec;
    }
  }

  private static void release(FieldVector vector, BufferAllocator child) {
    try {
      if (vector != null) {
        vector.close();
      }
    } finally {
      if (child != null) {
        child.close();
      }
    }
  }
}
