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

package io.valuemap.transform.dictionary;

import io.valuemap.transform.table.KeyValueTable;
import io.valuemap.transform.table.ScalarKind;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.ElementAddressableVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns a key-type code to every slot of a {@link KeyValueTable}.
 *
 * <p>Codes are 1-based; {@link #MISSING_CODE} is never assigned and marks keys that are not in
 * the table. Codes are either ordinals over the distinct values in order of first occurrence,
 * or, for unsigned integer values, the values themselves.
 */
public final class ValueOrdinalIndex implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ValueOrdinalIndex.class);

  /**
   * Code written for keys that are not in the table.
   */
  public static final long MISSING_CODE = 0;

  /**
   * Largest key count that 32-bit codes can express. Larger counts use 64-bit codes.
   */
  public static final long MAX_32_BIT_KEY_COUNT = ScalarKind.MAX_UINT32;

  public static final String KEY_VALUES_COLUMN = "KeyValues";

  private final long[] codes;
  private final long keyCount;
  private final ArrowType.Int codeType;
  private final boolean passThrough;

  /**
   * The distinct values, where code c stands for entry c - 1. May be null for pass-through codes.
   */
  private final FieldVector keyValues;

  private ValueOrdinalIndex(long[] codes, long keyCount, ArrowType.Int codeType, boolean passThrough,
      FieldVector keyValues) {
    this.codes = codes;
    this.keyCount = keyCount;
    this.codeType = codeType;
    this.passThrough = passThrough;
    this.keyValues = keyValues;
  }

  /**
   * Numbers the distinct values of the table in order of first occurrence, starting at 1.
   * Equal values share the code of their first occurrence; list values are compared element-wise.
   *
   * @param table the table.
   * @param allocator the allocator for the distinct value vector.
   * @return the index, owning the distinct value vector.
   */
  public static ValueOrdinalIndex assignOrdinals(KeyValueTable table, BufferAllocator allocator) {
    long[] codes = new long[table.keyCount()];
    FieldVector distinct;
    if (table.isValueVector()) {
      FieldVector dictionary = KeyValueTable.createListVector(KEY_VALUES_COLUMN, table.getValueKind(), allocator);
      dictionary.allocateNew();
      distinct = number(new ObjectDictionaryBuilder<>(dictionary), table.getValues(), codes);
    } else {
      FieldVector dictionary = table.getValueKind().createVector(KEY_VALUES_COLUMN, allocator);
      dictionary.allocateNew();
      distinct = (FieldVector) number(new PointerDictionaryBuilder<>((ElementAddressableVector) dictionary),
          (ElementAddressableVector) table.getValues(), codes);
    }

    long keyCount = distinct.getValueCount();
    logger.debug("Assigned {} ordinals to {} values", keyCount, codes.length);
    return new ValueOrdinalIndex(codes, keyCount, codeTypeFor(keyCount), false, distinct);
  }

  private static <V extends ValueVector> V number(DictionaryBuilder<V> builder, V values, long[] codes) {
    try {
      for (int i = 0; i < codes.length; i++) {
        codes[i] = builder.ordinalOf(values, i) + 1L;
      }
    } catch (RuntimeException e) {
      builder.close();
      throw e;
    }
    return builder.getDictionary();
  }

  /**
   * Uses unsigned integer values directly as codes.
   *
   * @param table a table with scalar {@link ScalarKind#UINT32} or {@link ScalarKind#UINT64} values.
   * @param keyCount the number of codes, or a negative number to use the largest value.
   * @param keyValues the values the codes stand for, or null. The index takes ownership.
   * @return the index.
   */
  public static ValueOrdinalIndex passThrough(KeyValueTable table, long keyCount, FieldVector keyValues) {
    Preconditions.checkArgument(!table.isValueVector() && table.getValueKind().isUnsignedInteger(),
        "codes can only be taken from scalar unsigned values, got %s", table.getValueKind());
    long[] codes = new long[table.keyCount()];
    long max = 0;
    for (int i = 0; i < codes.length; i++) {
      codes[i] = (Long) table.getValue(i);
      if (Long.compareUnsigned(codes[i], max) > 0) {
        max = codes[i];
      }
    }
    long count = keyCount < 0 ? max : keyCount;
    ArrowType.Int codeType = table.getValueKind() == ScalarKind.UINT64 ?
        new ArrowType.Int(64, false) : codeTypeFor(count);
    logger.debug("Using {} values as codes, key count {}", table.getValueKind(), Long.toUnsignedString(count));
    return new ValueOrdinalIndex(codes, count, codeType, true, keyValues);
  }

  /**
   * Gets the narrowest code type covering the key count: unsigned 32-bit, or unsigned 64-bit
   * above {@link #MAX_32_BIT_KEY_COUNT}.
   */
  public static ArrowType.Int codeTypeFor(long keyCount) {
    if (Long.compareUnsigned(keyCount, MAX_32_BIT_KEY_COUNT) > 0) {
      return new ArrowType.Int(64, false);
    }
    return new ArrowType.Int(32, false);
  }

  /**
   * Gets the code of a slot, or {@link #MISSING_CODE} for {@link LookupIndex#NOT_FOUND}.
   */
  public long codeOf(int slot) {
    return slot < 0 ? MISSING_CODE : codes[slot];
  }

  public long getKeyCount() {
    return keyCount;
  }

  public ArrowType.Int getCodeType() {
    return codeType;
  }

  public boolean isWide() {
    return codeType.getBitWidth() == 64;
  }

  /**
   * Whether the codes are the table values themselves rather than assigned ordinals.
   */
  public boolean isPassThrough() {
    return passThrough;
  }

  public boolean hasKeyValues() {
    return keyValues != null;
  }

  /**
   * Gets the values the codes stand for, in code order, or null when unknown.
   */
  public FieldVector getKeyValues() {
    return keyValues;
  }

  /**
   * Creates an Arrow dictionary for decoding codes. Entry 0 is null and stands for
   * {@link #MISSING_CODE}, entry c holds the value of code c.
   *
   * @param allocator the allocator for the dictionary vector.
   * @param encoding the encoding identifying the dictionary.
   * @return the dictionary, owned by the caller.
   */
  public Dictionary createDictionary(BufferAllocator allocator, DictionaryEncoding encoding) {
    Preconditions.checkState(keyValues != null, "no key values are known for these codes");
    FieldVector vector = keyValues.getField().createVector(allocator);
    try {
      vector.allocateNew();
      // slot 0 stays null
      for (int i = 0; i < keyValues.getValueCount(); i++) {
        vector.copyFromSafe(i, i + 1, keyValues);
      }
      vector.setValueCount(keyValues.getValueCount() + 1);
    } catch (RuntimeException e) {
      vector.close();
      throw e;
    }
    return new Dictionary(vector, encoding);
  }

  @Override
  public void close() {
    if (keyValues != null) {
      keyValues.close();
    }
  }
}
