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

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.valuemap.transform.exceptions.UnsupportedTypeException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * The ordered (key, value) pairs of a value map, stored in their native Arrow vectors.
 *
 * <p>Keys are scalars of one {@link ScalarKind}. Values are either scalars of one kind, or
 * variable-length lists of one kind. The table owns copies of the vectors it was created from,
 * and is never modified after construction.
 */
public final class KeyValueTable implements AutoCloseable {

  public static final String KEY_COLUMN = "Key";

  public static final String VALUE_COLUMN = "Value";

  private final ScalarKind keyKind;
  private final ScalarKind valueKind;
  private final boolean valueVector;
  private final FieldVector keys;
  private final FieldVector values;

  private KeyValueTable(ScalarKind keyKind, ScalarKind valueKind, boolean valueVector,
      FieldVector keys, FieldVector values) {
    this.keyKind = keyKind;
    this.valueKind = valueKind;
    this.valueVector = valueVector;
    this.keys = keys;
    this.values = values;
  }

  /**
   * Creates a table by copying a key vector and a value vector.
   *
   * @param allocator the allocator for the copies.
   * @param keys the keys, a scalar vector without nulls.
   * @param values the values, a scalar vector or a list vector, without null entries.
   * @return the table, to be closed by the caller.
   * @throws UnsupportedTypeException if a type is outside the supported set.
   */
  public static KeyValueTable create(BufferAllocator allocator, FieldVector keys, FieldVector values)
      throws UnsupportedTypeException {
    Preconditions.checkArgument(keys.getValueCount() == values.getValueCount(),
        "key count %s does not match value count %s", keys.getValueCount(), values.getValueCount());
    ScalarKind keyKind = ScalarKind.fromArrowType(keys.getField().getType());

    boolean valueVector = values instanceof ListVector;
    ScalarKind valueKind;
    if (valueVector) {
      valueKind = ScalarKind.fromArrowType(((ListVector) values).getDataVector().getField().getType());
    } else {
      valueKind = ScalarKind.fromArrowType(values.getField().getType());
    }

    int count = keys.getValueCount();
    for (int i = 0; i < count; i++) {
      Preconditions.checkArgument(!keys.isNull(i), "key at position %s is null", i);
      Preconditions.checkArgument(!values.isNull(i), "value at position %s is null", i);
    }

    FieldVector keyCopy = keyKind.createVector(KEY_COLUMN, allocator);
    FieldVector valueCopy = valueVector ?
        createListVector(VALUE_COLUMN, valueKind, allocator) : valueKind.createVector(VALUE_COLUMN, allocator);
    try {
      keyCopy.allocateNew();
      valueCopy.allocateNew();
      for (int i = 0; i < count; i++) {
        keyCopy.copyFromSafe(i, i, keys);
        valueCopy.copyFromSafe(i, i, values);
      }
      keyCopy.setValueCount(count);
      valueCopy.setValueCount(count);
    } catch (RuntimeException e) {
      keyCopy.close();
      valueCopy.close();
      throw e;
    }
    return new KeyValueTable(keyKind, valueKind, valueVector, keyCopy, valueCopy);
  }

  /**
   * Creates a table from the key and value columns of a record batch.
   *
   * @param allocator the allocator for the copies.
   * @param lookupData the batch holding the pairs.
   * @param keyColumn name of the key column.
   * @param valueColumn name of the value column.
   */
  public static KeyValueTable create(BufferAllocator allocator, VectorSchemaRoot lookupData,
      String keyColumn, String valueColumn) throws UnsupportedTypeException {
    FieldVector keys = lookupData.getVector(keyColumn);
    FieldVector values = lookupData.getVector(valueColumn);
    Preconditions.checkArgument(keys != null, "key column '%s' not found in %s", keyColumn, lookupData.getSchema());
    Preconditions.checkArgument(values != null, "value column '%s' not found in %s",
        valueColumn, lookupData.getSchema());
    return create(allocator, keys, values);
  }

  /**
   * Creates a table with scalar values from Java objects.
   */
  public static KeyValueTable fromLists(BufferAllocator allocator, ScalarKind keyKind, List<?> keys,
      ScalarKind valueKind, List<?> values) {
    Preconditions.checkArgument(keys.size() == values.size(),
        "key count %s does not match value count %s", keys.size(), values.size());
    FieldVector keyVector = keyKind.createVector(KEY_COLUMN, allocator);
    FieldVector valueVector = valueKind.createVector(VALUE_COLUMN, allocator);
    try {
      writeKeys(keyKind, keys, keyVector);
      valueVector.allocateNew();
      for (int i = 0; i < values.size(); i++) {
        valueKind.set(valueVector, i, Preconditions.checkNotNull(values.get(i), "value at position %s is null", i));
      }
      valueVector.setValueCount(values.size());
    } catch (RuntimeException e) {
      keyVector.close();
      valueVector.close();
      throw e;
    }
    return new KeyValueTable(keyKind, valueKind, false, keyVector, valueVector);
  }

  /**
   * Creates a table whose values are lists, from Java objects.
   */
  public static KeyValueTable fromVectorLists(BufferAllocator allocator, ScalarKind keyKind, List<?> keys,
      ScalarKind valueKind, List<? extends List<?>> values) {
    Preconditions.checkArgument(keys.size() == values.size(),
        "key count %s does not match value count %s", keys.size(), values.size());
    FieldVector keyVector = keyKind.createVector(KEY_COLUMN, allocator);
    ListVector valueVector = createListVector(VALUE_COLUMN, valueKind, allocator);
    try {
      writeKeys(keyKind, keys, keyVector);
      valueVector.allocateNew();
      FieldVector items = valueVector.getDataVector();
      for (int i = 0; i < values.size(); i++) {
        List<?> entry = Preconditions.checkNotNull(values.get(i), "value at position %s is null", i);
        int start = valueVector.startNewValue(i);
        for (int j = 0; j < entry.size(); j++) {
          valueKind.set(items, start + j, entry.get(j));
        }
        valueVector.endValue(i, entry.size());
      }
      valueVector.setValueCount(values.size());
    } catch (RuntimeException e) {
      keyVector.close();
      valueVector.close();
      throw e;
    }
    return new KeyValueTable(keyKind, valueKind, true, keyVector, valueVector);
  }

  private static void writeKeys(ScalarKind keyKind, List<?> keys, FieldVector keyVector) {
    keyVector.allocateNew();
    for (int i = 0; i < keys.size(); i++) {
      keyKind.set(keyVector, i, Preconditions.checkNotNull(keys.get(i), "key at position %s is null", i));
    }
    keyVector.setValueCount(keys.size());
  }

  /**
   * Creates an empty list vector with items of the given kind.
   */
  public static ListVector createListVector(String name, ScalarKind itemKind, BufferAllocator allocator) {
    ListVector vector = ListVector.empty(name, allocator);
    vector.addOrGetVector(FieldType.nullable(itemKind.getType()));
    return vector;
  }

  /**
   * Gets the field describing a list of items of the given kind.
   */
  public static Field listField(String name, FieldType itemType) {
    return new Field(name, FieldType.nullable(ArrowType.List.INSTANCE),
        Collections.singletonList(new Field(ListVector.DATA_VECTOR_NAME, itemType, null)));
  }

  public int keyCount() {
    return keys.getValueCount();
  }

  public ScalarKind getKeyKind() {
    return keyKind;
  }

  /**
   * Gets the kind of the values, or of the value items when the values are lists.
   */
  public ScalarKind getValueKind() {
    return valueKind;
  }

  public boolean isValueVector() {
    return valueVector;
  }

  /**
   * Gets the key vector. Callers must not modify it.
   */
  public FieldVector getKeys() {
    return keys;
  }

  /**
   * Gets the value vector, a {@link ListVector} when {@link #isValueVector()}. Callers must not modify it.
   */
  public FieldVector getValues() {
    return values;
  }

  /**
   * Gets the key at the given position as a normalized Java value.
   */
  public Object getKey(int index) {
    return keyKind.get(keys, index);
  }

  /**
   * Gets the value at the given position: a normalized Java value, or a list of them.
   */
  public Object getValue(int index) {
    if (!valueVector) {
      return valueKind.get(values, index);
    }
    ListVector list = (ListVector) values;
    FieldVector items = list.getDataVector();
    int start = list.getElementStartIndex(index);
    int end = list.getElementEndIndex(index);
    List<Object> result = new ArrayList<>(end - start);
    for (int i = start; i < end; i++) {
      result.add(valueKind.get(items, i));
    }
    return result;
  }

  /**
   * Gets the pair at the given position.
   */
  public Map.Entry<Object, Object> get(int index) {
    Preconditions.checkElementIndex(index, keyCount());
    return new AbstractMap.SimpleImmutableEntry<>(getKey(index), getValue(index));
  }

  /**
   * Wraps the key and value vectors in a record batch. The batch shares the table's vectors
   * and must not be closed.
   */
  public VectorSchemaRoot asRecordBatch() {
    List<FieldVector> vectors = new ArrayList<>(2);
    vectors.add(keys);
    vectors.add(values);
    List<Field> fields = new ArrayList<>(2);
    fields.add(keys.getField());
    fields.add(values.getField());
    return new VectorSchemaRoot(fields, vectors, keyCount());
  }

  @Override
  public void close() {
    keys.close();
    values.close();
  }
}
