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

import java.util.HashMap;

import io.valuemap.transform.exceptions.DuplicateKeyException;
import io.valuemap.transform.table.KeyValueTable;
import io.valuemap.transform.table.ScalarKind;
import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.memory.util.hash.ArrowBufHasher;
import org.apache.arrow.memory.util.hash.SimpleHasher;
import org.apache.arrow.vector.ElementAddressableVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.ValueVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hash index from the keys of a {@link KeyValueTable} to their positions ("slots") in the table.
 *
 * <p>Keys compare by their bytes, except that the floating point zeros 0.0 and -0.0 are the
 * same key. NaN keys match NaN elements with the same bits.
 *
 * <p>The index is built once and never modified; it references the key buffers of the table,
 * which must outlive it. Lookups go through a {@link Probe}, which carries the only mutable
 * state, so one index can serve any number of threads as long as each uses its own probe.
 */
public final class LookupIndex {

  private static final Logger logger = LoggerFactory.getLogger(LookupIndex.class);

  /**
   * Slot reported for keys that are not in the table.
   */
  public static final int NOT_FOUND = -1;

  private final ScalarKind keyKind;

  private final HashMap<ArrowBufPointer, Integer> hashMap;

  private final ArrowBufHasher hasher;

  /**
   * Slot of the key kind's default value, looked up for null elements.
   */
  private final int defaultSlot;

  /**
   * Slot of the zero key for floating point keys, where 0.0 and -0.0 are one key.
   */
  private final int zeroSlot;

  private LookupIndex(ScalarKind keyKind, HashMap<ArrowBufPointer, Integer> hashMap,
      ArrowBufHasher hasher, int defaultSlot, int zeroSlot) {
    this.keyKind = keyKind;
    this.hashMap = hashMap;
    this.hasher = hasher;
    this.defaultSlot = defaultSlot;
    this.zeroSlot = zeroSlot;
  }

  /**
   * Builds the index in one pass over the keys.
   *
   * @param table the table to index.
   * @return the index.
   * @throws DuplicateKeyException if a key occurs more than once, whatever its values.
   */
  public static LookupIndex build(KeyValueTable table) throws DuplicateKeyException {
    return build(table, SimpleHasher.INSTANCE);
  }

  /**
   * Builds the index in one pass over the keys.
   *
   * @param table the table to index.
   * @param hasher the hasher used to compute the hash code.
   * @return the index.
   * @throws DuplicateKeyException if a key occurs more than once, whatever its values.
   */
  public static LookupIndex build(KeyValueTable table, ArrowBufHasher hasher) throws DuplicateKeyException {
    ElementAddressableVector keys = (ElementAddressableVector) table.getKeys();
    ScalarKind keyKind = table.getKeyKind();
    HashMap<ArrowBufPointer, Integer> hashMap = new HashMap<>();
    int zeroSlot = NOT_FOUND;
    for (int i = 0; i < table.keyCount(); i++) {
      if (isFloatZero(keyKind, keys, i)) {
        if (zeroSlot != NOT_FOUND) {
          throw new DuplicateKeyException(table.getKey(i), zeroSlot, i);
        }
        zeroSlot = i;
        continue;
      }
      ArrowBufPointer pointer = new ArrowBufPointer(hasher);
      keys.getDataPointer(i, pointer);
      Integer previous = hashMap.putIfAbsent(pointer, i);
      if (previous != null) {
        throw new DuplicateKeyException(table.getKey(i), previous, i);
      }
    }

    int defaultSlot;
    if (isFloatingPoint(keyKind)) {
      defaultSlot = zeroSlot;
    } else {
      defaultSlot = findDefault(table, hashMap, hasher);
    }

    logger.debug("Built lookup index over {} {} keys", table.keyCount(), keyKind);
    return new LookupIndex(keyKind, hashMap, hasher, defaultSlot, zeroSlot);
  }

  private static int findDefault(KeyValueTable table, HashMap<ArrowBufPointer, Integer> hashMap,
      ArrowBufHasher hasher) {
    try (FieldVector defaultKey = table.getKeyKind().createVector("default", table.getKeys().getAllocator())) {
      defaultKey.allocateNew();
      table.getKeyKind().setDefault(defaultKey, 0);
      defaultKey.setValueCount(1);
      ArrowBufPointer pointer = new ArrowBufPointer(hasher);
      ((ElementAddressableVector) defaultKey).getDataPointer(0, pointer);
      return hashMap.getOrDefault(pointer, NOT_FOUND);
    }
  }

  private static boolean isFloatingPoint(ScalarKind kind) {
    return kind == ScalarKind.FLOAT32 || kind == ScalarKind.FLOAT64;
  }

  /**
   * Whether the element is 0.0 or -0.0 of a floating point kind.
   */
  private static boolean isFloatZero(ScalarKind kind, ValueVector vector, int index) {
    switch (kind) {
      case FLOAT32:
        return ((Float4Vector) vector).get(index) == 0.0f;
      case FLOAT64:
        return ((Float8Vector) vector).get(index) == 0.0d;
      default:
        return false;
    }
  }

  public ScalarKind getKeyKind() {
    return keyKind;
  }

  public int size() {
    return zeroSlot == NOT_FOUND ? hashMap.size() : hashMap.size() + 1;
  }

  /**
   * Gets the slot looked up for null elements, the slot of the key kind's default value.
   */
  public int getDefaultSlot() {
    return defaultSlot;
  }

  /**
   * Creates a probe for looking up elements of input vectors. Probes are cheap and must not be
   * shared between threads.
   */
  public Probe newProbe() {
    return new Probe();
  }

  /**
   * Looks up vector elements in the index, reusing a single pointer.
   */
  public final class Probe {

    private final ArrowBufPointer reusablePointer = new ArrowBufPointer(hasher);

    private Probe() {
    }

    /**
     * Finds the slot of an element. A null element is looked up as the key kind's default value.
     *
     * @param vector the vector holding the element, of the index's key type.
     * @param index the index of the element.
     * @return the slot, or {@link #NOT_FOUND}.
     */
    public int find(ElementAddressableVector vector, int index) {
      if (vector.isNull(index)) {
        return defaultSlot;
      }
      if (isFloatZero(keyKind, vector, index)) {
        return zeroSlot;
      }
      vector.getDataPointer(index, reusablePointer);
      Integer slot = hashMap.get(reusablePointer);
      return slot == null ? NOT_FOUND : slot;
    }
  }
}
