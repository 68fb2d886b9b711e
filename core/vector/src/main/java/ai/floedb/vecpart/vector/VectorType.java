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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.Types.MinorType;

/**
 * A supported vector element type: one Arrow minor type bound to the Java type its slots read as.
 *
 * <p>The set of types is closed. Instances exist only as the constants in {@link VectorTypes}, and
 * identity comparison is the intended way to test two types for equality.
 *
 * <p>Each element is externalized as a one-byte presence marker followed, for non-null slots, by
 * the value encoding of the concrete type. Variable-width values carry their own length prefix so
 * a stream of elements is self-delimiting.
 *
 * @param <T> the Java type of a slot value
 */
public abstract class VectorType<T> {

  static final byte NULL_MARKER = 0;
  static final byte VALUE_MARKER = 1;

  private final MinorType minorType;
  private final Class<T> elementClass;

  VectorType(MinorType minorType, Class<T> elementClass) {
    this.minorType = Objects.requireNonNull(minorType, "minorType");
    this.elementClass = Objects.requireNonNull(elementClass, "elementClass");
  }

  public MinorType minorType() {
    return minorType;
  }

  public Class<T> elementClass() {
    return elementClass;
  }

  /** Wire tag of this type. */
  public String tag() {
    return minorType.name();
  }

  /** Returns {@code true} if {@code vector} is a vector of this type. */
  public abstract boolean accepts(FieldVector vector);

  /**
   * Allocates an empty vector of this type with room for {@code capacity} slots. The vector is
   * released again if the allocation fails.
   */
  public abstract FieldVector allocate(BufferAllocator allocator, String name, int capacity);

  /** Reads slot {@code index}; null slots read as {@code null}. */
  public abstract T get(FieldVector vector, int index);

  /** Writes slot {@code index}, growing the vector if needed; {@code null} marks the slot null. */
  public abstract void set(FieldVector vector, int index, T value);

  public final void writeElement(DataOutput out, T value) throws IOException {
    if (value == null) {
      out.writeByte(NULL_MARKER);
      return;
    }
    out.writeByte(VALUE_MARKER);
    writeValue(out, value);
  }

  /**
   * Reads one element written by {@link #writeElement}.
   *
   * @param maxElementBytes upper bound accepted for a variable-width length prefix
   * @throws VectorPartitionException of kind {@code STREAM_CORRUPTION} if the element is malformed
   */
  public final T readElement(DataInput in, int maxElementBytes) throws IOException {
    byte marker = in.readByte();
    if (marker == NULL_MARKER) {
      return null;
    }
    if (marker != VALUE_MARKER) {
      throw VectorPartitionException.streamCorruption(
          "Invalid presence marker " + marker + " for " + tag() + " element");
    }
    return readValue(in, maxElementBytes);
  }

  /** Writes slot {@code index} of {@code vector} as one element. */
  void writeSlot(DataOutput out, FieldVector vector, int index) throws IOException {
    writeElement(out, get(vector, index));
  }

  abstract void writeValue(DataOutput out, T value) throws IOException;

  abstract T readValue(DataInput in, int maxElementBytes) throws IOException;

  @Override
  public String toString() {
    return tag() + "<" + elementClass.getSimpleName() + ">";
  }
}
