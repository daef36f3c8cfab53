/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.valuemap.transform.table;

import java.nio.charset.StandardCharsets;

import io.valuemap.transform.exceptions.UnsupportedTypeException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * The closed set of scalar types a value map can hold as keys, values or value items.
 *
 * <p>Each kind binds an Arrow type to the few operations the value map needs: creating a vector,
 * writing and reading a Java value, and producing the default value written for missing keys.
 * Java values are normalized as follows: {@link #INT32} is an {@link Integer}, {@link #UINT32} and
 * {@link #UINT64} are {@link Long}s (the latter holding the raw 64 bits), {@link #FLOAT32} is a
 * {@link Float}, {@link #FLOAT64} a {@link Double} and {@link #TEXT} a {@link String}.
 */
public enum ScalarKind {
  INT32((byte) 1, new ArrowType.Int(32, true)) {
    @Override
    public Object defaultValue() {
      return 0;
    }

    @Override
    public void set(FieldVector vector, int index, Object value) {
      ((IntVector) vector).setSafe(index, ((Number) value).intValue());
    }

    @Override
    public Object get(FieldVector vector, int index) {
      return ((IntVector) vector).get(index);
    }
  },
  UINT32((byte) 2, new ArrowType.Int(32, false)) {
    @Override
    public Object defaultValue() {
      return 0L;
    }

    @Override
    public void set(FieldVector vector, int index, Object value) {
      long longValue = ((Number) value).longValue();
      Preconditions.checkArgument(longValue >= 0 && longValue <= MAX_UINT32,
          "value %s is out of range for an unsigned 32-bit integer", longValue);
      ((UInt4Vector) vector).setSafe(index, (int) longValue);
    }

    @Override
    public Object get(FieldVector vector, int index) {
      return ((UInt4Vector) vector).getValueAsLong(index);
    }
  },
  UINT64((byte) 3, new ArrowType.Int(64, false)) {
    @Override
    public Object defaultValue() {
      return 0L;
    }

    @Override
    public void set(FieldVector vector, int index, Object value) {
      ((UInt8Vector) vector).setSafe(index, ((Number) value).longValue());
    }

    @Override
    public Object get(FieldVector vector, int index) {
      return ((UInt8Vector) vector).get(index);
    }
  },
  FLOAT32((byte) 4, new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE)) {
    @Override
    public Object defaultValue() {
      return 0f;
    }

    @Override
    public void set(FieldVector vector, int index, Object value) {
      ((Float4Vector) vector).setSafe(index, ((Number) value).floatValue());
    }

    @Override
    public Object get(FieldVector vector, int index) {
      return ((Float4Vector) vector).get(index);
    }
  },
  FLOAT64((byte) 5, new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)) {
    @Override
    public Object defaultValue() {
      return 0d;
    }

    @Override
    public void set(FieldVector vector, int index, Object value) {
      ((Float8Vector) vector).setSafe(index, ((Number) value).doubleValue());
    }

    @Override
    public Object get(FieldVector vector, int index) {
      return ((Float8Vector) vector).get(index);
    }
  },
  TEXT((byte) 6, ArrowType.Utf8.INSTANCE) {
    @Override
    public Object defaultValue() {
      return "";
    }

    @Override
    public void set(FieldVector vector, int index, Object value) {
      ((VarCharVector) vector).setSafe(index, value.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Object get(FieldVector vector, int index) {
      return new String(((VarCharVector) vector).get(index), StandardCharsets.UTF_8);
    }
  };

  /**
   * Largest value an unsigned 32-bit integer can hold.
   */
  public static final long MAX_UINT32 = 0xFFFFFFFFL;

  private final byte tag;
  private final ArrowType type;

  ScalarKind(byte tag, ArrowType type) {
    this.tag = tag;
    this.type = type;
  }

  /**
   * Gets the tag identifying this kind in the persisted layout.
   */
  public byte getTag() {
    return tag;
  }

  public ArrowType getType() {
    return type;
  }

  /**
   * Whether values of this kind can be used directly as key-type codes.
   */
  public boolean isUnsignedInteger() {
    return this == UINT32 || this == UINT64;
  }

  /**
   * Gets the value written in place of a missing key: numeric zero or the empty string.
   */
  public abstract Object defaultValue();

  /**
   * Writes a Java value at the given index, growing the vector when needed.
   */
  public abstract void set(FieldVector vector, int index, Object value);

  /**
   * Reads the normalized Java value at the given index. The slot must not be null.
   */
  public abstract Object get(FieldVector vector, int index);

  /**
   * Writes {@link #defaultValue()} at the given index.
   */
  public void setDefault(FieldVector vector, int index) {
    set(vector, index, defaultValue());
  }

  /**
   * Creates an empty nullable vector of this kind.
   */
  public FieldVector createVector(String name, BufferAllocator allocator) {
    return FieldType.nullable(type).createNewSingleVector(name, allocator, null);
  }

  /**
   * Resolves the kind for an Arrow type.
   *
   * @throws UnsupportedTypeException if the type is outside the supported set.
   */
  public static ScalarKind fromArrowType(ArrowType type) throws UnsupportedTypeException {
    for (ScalarKind kind : values()) {
      if (kind.type.equals(type)) {
        return kind;
      }
    }
    throw new UnsupportedTypeException("Unsupported value map type " + type);
  }

  /**
   * Resolves the kind for a persisted tag.
   *
   * @throws UnsupportedTypeException if no kind carries the tag.
   */
  public static ScalarKind fromTag(byte tag) throws UnsupportedTypeException {
    for (ScalarKind kind : values()) {
      if (kind.tag == tag) {
        return kind;
      }
    }
    throw new UnsupportedTypeException("Unknown value map type tag " + tag);
  }
}
