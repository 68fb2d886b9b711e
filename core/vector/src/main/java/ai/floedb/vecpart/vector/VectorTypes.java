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
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.Types.MinorType;

/**
 * Registry of the supported vector types.
 *
 * <p>The registry is closed: supporting another Arrow type means adding a constant here and a case
 * to {@link #forMinorType}. Lookups for anything else fail with {@code UNSUPPORTED_TYPE}.
 */
public final class VectorTypes {

  public static final VectorType<Integer> INT = new IntType();
  public static final VectorType<Long> BIGINT = new BigIntType();
  public static final VectorType<Double> FLOAT8 = new Float8Type();
  public static final VectorType<Boolean> BIT = new BitType();
  public static final VectorType<byte[]> VARBINARY = new VarBinaryType();
  public static final VectorType<String> VARCHAR = new VarCharType();

  private static final List<VectorType<?>> SUPPORTED =
      List.of(INT, BIGINT, FLOAT8, BIT, VARBINARY, VARCHAR);

  private VectorTypes() {}

  public static List<VectorType<?>> supported() {
    return SUPPORTED;
  }

  public static VectorType<?> forMinorType(MinorType minorType) {
    Objects.requireNonNull(minorType, "minorType");
    return switch (minorType) {
      case INT -> INT;
      case BIGINT -> BIGINT;
      case FLOAT8 -> FLOAT8;
      case BIT -> BIT;
      case VARBINARY -> VARBINARY;
      case VARCHAR -> VARCHAR;
      default -> throw VectorPartitionException.unsupportedType(minorType.name());
    };
  }

  /** Resolves a wire tag written by {@link VectorType#tag()}. */
  public static VectorType<?> forTag(String tag) {
    if (tag == null || tag.isBlank()) {
      throw VectorPartitionException.unsupportedType(String.valueOf(tag));
    }
    MinorType minorType;
    try {
      minorType = MinorType.valueOf(tag);
    } catch (IllegalArgumentException e) {
      throw VectorPartitionException.unsupportedType(tag);
    }
    return forMinorType(minorType);
  }

  public static VectorType<?> of(FieldVector vector) {
    Objects.requireNonNull(vector, "vector");
    return forMinorType(vector.getMinorType());
  }

  private static byte[] readLengthPrefixed(DataInput in, String tag, int maxElementBytes)
      throws IOException {
    int length = in.readInt();
    if (length < 0 || length > maxElementBytes) {
      throw VectorPartitionException.streamCorruption(
          "Invalid " + tag + " element length " + length + " (limit " + maxElementBytes + ")");
    }
    byte[] bytes = new byte[length];
    in.readFully(bytes);
    return bytes;
  }

  private static void writeLengthPrefixed(DataOutput out, byte[] bytes) throws IOException {
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  private static final class IntType extends TypedVectorType<IntVector, Integer> {

    IntType() {
      super(MinorType.INT, IntVector.class, Integer.class);
    }

    @Override
    Integer getSlot(IntVector vector, int index) {
      return vector.get(index);
    }

    @Override
    void setSlot(IntVector vector, int index, Integer value) {
      vector.setSafe(index, value);
    }

    @Override
    void setNull(IntVector vector, int index) {
      vector.setNull(index);
    }

    @Override
    void writeValue(DataOutput out, Integer value) throws IOException {
      out.writeInt(value);
    }

    @Override
    Integer readValue(DataInput in, int maxElementBytes) throws IOException {
      return in.readInt();
    }
  }

  private static final class BigIntType extends TypedVectorType<BigIntVector, Long> {

    BigIntType() {
      super(MinorType.BIGINT, BigIntVector.class, Long.class);
    }

    @Override
    Long getSlot(BigIntVector vector, int index) {
      return vector.get(index);
    }

    @Override
    void setSlot(BigIntVector vector, int index, Long value) {
      vector.setSafe(index, value);
    }

    @Override
    void setNull(BigIntVector vector, int index) {
      vector.setNull(index);
    }

    @Override
    void writeValue(DataOutput out, Long value) throws IOException {
      out.writeLong(value);
    }

    @Override
    Long readValue(DataInput in, int maxElementBytes) throws IOException {
      return in.readLong();
    }
  }

  private static final class Float8Type extends TypedVectorType<Float8Vector, Double> {

    Float8Type() {
      super(MinorType.FLOAT8, Float8Vector.class, Double.class);
    }

    @Override
    Double getSlot(Float8Vector vector, int index) {
      return vector.get(index);
    }

    @Override
    void setSlot(Float8Vector vector, int index, Double value) {
      vector.setSafe(index, value);
    }

    @Override
    void setNull(Float8Vector vector, int index) {
      vector.setNull(index);
    }

    @Override
    void writeValue(DataOutput out, Double value) throws IOException {
      out.writeDouble(value);
    }

    @Override
    Double readValue(DataInput in, int maxElementBytes) throws IOException {
      return in.readDouble();
    }
  }

  private static final class BitType extends TypedVectorType<BitVector, Boolean> {

    BitType() {
      super(MinorType.BIT, BitVector.class, Boolean.class);
    }

    @Override
    Boolean getSlot(BitVector vector, int index) {
      return vector.get(index) != 0;
    }

    @Override
    void setSlot(BitVector vector, int index, Boolean value) {
      vector.setSafe(index, value ? 1 : 0);
    }

    @Override
    void setNull(BitVector vector, int index) {
      vector.setNull(index);
    }

    @Override
    void writeValue(DataOutput out, Boolean value) throws IOException {
      out.writeBoolean(value);
    }

    @Override
    Boolean readValue(DataInput in, int maxElementBytes) throws IOException {
      byte b = in.readByte();
      if (b != 0 && b != 1) {
        throw VectorPartitionException.streamCorruption("Invalid BIT element value " + b);
      }
      return b == 1;
    }
  }

  private static final class VarBinaryType extends TypedVectorType<VarBinaryVector, byte[]> {

    VarBinaryType() {
      super(MinorType.VARBINARY, VarBinaryVector.class, byte[].class);
    }

    @Override
    byte[] getSlot(VarBinaryVector vector, int index) {
      return vector.get(index);
    }

    @Override
    void setSlot(VarBinaryVector vector, int index, byte[] value) {
      vector.setSafe(index, value);
    }

    @Override
    void setNull(VarBinaryVector vector, int index) {
      vector.setNull(index);
    }

    @Override
    void writeValue(DataOutput out, byte[] value) throws IOException {
      writeLengthPrefixed(out, value);
    }

    @Override
    byte[] readValue(DataInput in, int maxElementBytes) throws IOException {
      return readLengthPrefixed(in, tag(), maxElementBytes);
    }
  }

  private static final class VarCharType extends TypedVectorType<VarCharVector, String> {

    VarCharType() {
      super(MinorType.VARCHAR, VarCharVector.class, String.class);
    }

    @Override
    String getSlot(VarCharVector vector, int index) {
      return new String(vector.get(index), StandardCharsets.UTF_8);
    }

    @Override
    void setSlot(VarCharVector vector, int index, String value) {
      vector.setSafe(index, value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    void setNull(VarCharVector vector, int index) {
      vector.setNull(index);
    }

    @Override
    void writeSlot(DataOutput out, FieldVector vector, int index) throws IOException {
      VarCharVector typed = cast(vector);
      if (typed.isNull(index)) {
        out.writeByte(NULL_MARKER);
        return;
      }
      byte[] bytes = typed.get(index);
      try {
        StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes));
      } catch (CharacterCodingException e) {
        throw VectorPartitionException.streamCorruption(
            "VARCHAR slot " + index + " is not valid UTF-8", e);
      }
      out.writeByte(VALUE_MARKER);
      writeLengthPrefixed(out, bytes);
    }

    @Override
    void writeValue(DataOutput out, String value) throws IOException {
      writeLengthPrefixed(out, value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    String readValue(DataInput in, int maxElementBytes) throws IOException {
      byte[] bytes = readLengthPrefixed(in, tag(), maxElementBytes);
      try {
        return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
      } catch (CharacterCodingException e) {
        throw VectorPartitionException.streamCorruption("Malformed UTF-8 in VARCHAR element", e);
      }
    }
  }
}
