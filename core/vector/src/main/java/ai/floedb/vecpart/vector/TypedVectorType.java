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

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.Field;

/** Binds a {@link VectorType} to its concrete Arrow vector class. */
abstract class TypedVectorType<V extends FieldVector, T> extends VectorType<T> {

  private final Class<V> vectorClass;

  TypedVectorType(MinorType minorType, Class<V> vectorClass, Class<T> elementClass) {
    super(minorType, elementClass);
    this.vectorClass = vectorClass;
  }

  @Override
  public boolean accepts(FieldVector vector) {
    return vectorClass.isInstance(vector);
  }

  @Override
  public V allocate(BufferAllocator allocator, String name, int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0: " + capacity);
    }
    Field field = Field.nullable(name, minorType().getType());
    V vector = vectorClass.cast(field.createVector(allocator));
    boolean allocated = false;
    try {
      vector.setInitialCapacity(capacity);
      vector.allocateNew();
      allocated = true;
      return vector;
    } finally {
      if (!allocated) {
        vector.close();
      }
    }
  }

  @Override
  public T get(FieldVector vector, int index) {
    V typed = cast(vector);
    return typed.isNull(index) ? null : getSlot(typed, index);
  }

  @Override
  public void set(FieldVector vector, int index, T value) {
    V typed = cast(vector);
    if (value == null) {
      setNull(typed, index);
    } else {
      setSlot(typed, index, value);
    }
  }

  abstract T getSlot(V vector, int index);

  abstract void setSlot(V vector, int index, T value);

  abstract void setNull(V vector, int index);

  V cast(FieldVector vector) {
    if (!vectorClass.isInstance(vector)) {
      throw VectorPartitionException.typeMismatch(
          tag(), vector == null ? "null" : String.valueOf(vector.getMinorType()));
    }
    return vectorClass.cast(vector);
  }
}
