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

package io.valuemap.transform.evaluator;

import io.valuemap.transform.dictionary.ValueOrdinalIndex;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.complex.ListVector;

/**
 * Writes the output for one looked up slot. The writer is chosen once per column, so the
 * per-element path does not inspect types.
 */
@FunctionalInterface
interface ElementWriter {

  /**
   * Writes the output of a slot.
   *
   * @param slot the slot found in the lookup index, negative when the key is missing.
   * @param target the output vector.
   * @param targetIndex the index to write at, growing the target when needed.
   */
  void write(int slot, FieldVector target, int targetIndex);

  /**
   * Copies the value of the slot, or the default value for missing keys.
   *
   * @param values the table values.
   * @param defaults a single-entry vector holding the default value, of the same type as values.
   */
  static ElementWriter copyValues(FieldVector values, FieldVector defaults) {
    if (values instanceof ListVector) {
      return copyLists((ListVector) values, (ListVector) defaults);
    }
    return (slot, target, targetIndex) -> {
      if (slot < 0) {
        target.copyFromSafe(0, targetIndex, defaults);
      } else {
        target.copyFromSafe(slot, targetIndex, values);
      }
    };
  }

  /**
   * Copies list values item by item. {@link ListVector#copyFromSafe} positions the source's
   * shared reader, so it cannot be used by concurrent mappers over the same table.
   */
  static ElementWriter copyLists(ListVector values, ListVector defaults) {
    return (slot, target, targetIndex) -> {
      ListVector source = slot < 0 ? defaults : values;
      int index = slot < 0 ? 0 : slot;
      int start = source.getElementStartIndex(index);
      int end = source.getElementEndIndex(index);
      FieldVector from = source.getDataVector();

      ListVector out = (ListVector) target;
      FieldVector items = out.getDataVector();
      int outStart = out.startNewValue(targetIndex);
      for (int i = start; i < end; i++) {
        items.copyFromSafe(i, outStart + i - start, from);
      }
      out.endValue(targetIndex, end - start);
    };
  }

  /**
   * Writes the key-type code of the slot, 0 for missing keys.
   */
  static ElementWriter writeCodes(ValueOrdinalIndex ordinals) {
    if (ordinals.isWide()) {
      return (slot, target, targetIndex) -> ((UInt8Vector) target).setSafe(targetIndex, ordinals.codeOf(slot));
    }
    return (slot, target, targetIndex) -> ((UInt4Vector) target).setSafe(targetIndex, (int) ordinals.codeOf(slot));
  }
}
