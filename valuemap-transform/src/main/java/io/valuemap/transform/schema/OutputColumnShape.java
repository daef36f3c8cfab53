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

package io.valuemap.transform.schema;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * The shape of a mapped output column, known before any row is read.
 */
public final class OutputColumnShape {

  /**
   * Field metadata entry holding the key count of a key-type column.
   */
  public static final String KEY_COUNT_METADATA = "valuemap.key_count";

  /**
   * Whether a column holds one item per row, or a vector of items.
   */
  public enum VectorKind {
    SCALAR,
    /** Every row holds a vector of the same length. */
    FIXED_VECTOR,
    /** The vector length varies from row to row. */
    VARIABLE_VECTOR
  }

  private final ArrowType itemType;
  private final VectorKind vectorKind;
  private final int fixedSize;
  private final boolean keyType;
  private final long keyCount;

  private OutputColumnShape(ArrowType itemType, VectorKind vectorKind, int fixedSize, boolean keyType, long keyCount) {
    this.itemType = itemType;
    this.vectorKind = vectorKind;
    this.fixedSize = fixedSize;
    this.keyType = keyType;
    this.keyCount = keyCount;
  }

  public static OutputColumnShape scalar(ArrowType itemType) {
    return new OutputColumnShape(itemType, VectorKind.SCALAR, 0, false, 0);
  }

  public static OutputColumnShape variableVector(ArrowType itemType) {
    return new OutputColumnShape(itemType, VectorKind.VARIABLE_VECTOR, 0, false, 0);
  }

  public static OutputColumnShape fixedVector(ArrowType itemType, int size) {
    return new OutputColumnShape(itemType, VectorKind.FIXED_VECTOR, size, false, 0);
  }

  /**
   * Gets the same shape with key-type items.
   *
   * @param codeType the unsigned integer type of the codes.
   * @param keyCount the number of codes in use, excluding the missing code.
   */
  public OutputColumnShape asKeyType(ArrowType.Int codeType, long keyCount) {
    return new OutputColumnShape(codeType, vectorKind, fixedSize, true, keyCount);
  }

  public ArrowType getItemType() {
    return itemType;
  }

  public VectorKind getVectorKind() {
    return vectorKind;
  }

  public boolean isVector() {
    return vectorKind != VectorKind.SCALAR;
  }

  /**
   * Gets the vector length of a {@link VectorKind#FIXED_VECTOR} column, 0 otherwise.
   */
  public int getFixedSize() {
    return fixedSize;
  }

  public boolean isKeyType() {
    return keyType;
  }

  /**
   * Gets the key count of a key-type column, 0 otherwise.
   */
  public long getKeyCount() {
    return keyCount;
  }

  /**
   * Builds the Arrow field for a column of this shape. Key-type items are dictionary encoded with
   * the given encoding and carry the key count as {@link #KEY_COUNT_METADATA}.
   *
   * @param name the column name.
   * @param encoding the encoding of key-type items, ignored otherwise.
   */
  public Field toField(String name, DictionaryEncoding encoding) {
    FieldType items;
    if (keyType) {
      Map<String, String> metadata = Collections.singletonMap(KEY_COUNT_METADATA, Long.toUnsignedString(keyCount));
      items = new FieldType(true, itemType, encoding, metadata);
    } else {
      items = FieldType.nullable(itemType);
    }

    switch (vectorKind) {
      case SCALAR:
        return new Field(name, items, null);
      case FIXED_VECTOR:
        return new Field(name, FieldType.nullable(new ArrowType.FixedSizeList(fixedSize)),
            Collections.singletonList(new Field(ListVector.DATA_VECTOR_NAME, items, null)));
      case VARIABLE_VECTOR:
        return new Field(name, FieldType.nullable(ArrowType.List.INSTANCE),
            Collections.singletonList(new Field(ListVector.DATA_VECTOR_NAME, items, null)));
      default:
        throw new IllegalStateException("Unknown vector kind " + vectorKind);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OutputColumnShape)) {
      return false;
    }
    OutputColumnShape that = (OutputColumnShape) o;
    return fixedSize == that.fixedSize &&
        keyType == that.keyType &&
        keyCount == that.keyCount &&
        vectorKind == that.vectorKind &&
        itemType.equals(that.itemType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(itemType, vectorKind, fixedSize, keyType, keyCount);
  }

  @Override
  public String toString() {
    return "OutputColumnShape{" +
        "itemType=" + itemType +
        ", vectorKind=" + vectorKind +
        (vectorKind == VectorKind.FIXED_VECTOR ? ", fixedSize=" + fixedSize : "") +
        (keyType ? ", keyCount=" + Long.toUnsignedString(keyCount) : "") +
        '}';
  }
}
