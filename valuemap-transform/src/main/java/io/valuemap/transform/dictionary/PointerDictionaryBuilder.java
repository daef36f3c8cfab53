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

import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.memory.util.hash.ArrowBufHasher;
import org.apache.arrow.memory.util.hash.SimpleHasher;
import org.apache.arrow.vector.ElementAddressableVector;

/**
 * Numbers scalar values by the bytes of each element. Floating point values therefore compare
 * by bit pattern.
 *
 * <p>Keys point into the buffers of the vectors values come from, so those vectors must stay
 * open and unchanged while the builder is in use.
 *
 * @param <V> the dictionary vector type.
 */
public class PointerDictionaryBuilder<V extends ElementAddressableVector> implements DictionaryBuilder<V> {

  private final V dictionary;

  /**
   * Ordinals keyed by the bytes of the first occurrence of each value.
   */
  private final HashMap<ArrowBufPointer, Integer> ordinals = new HashMap<>();

  private final ArrowBufHasher hasher;

  private ArrowBufPointer probe;

  public PointerDictionaryBuilder(V dictionary) {
    this(dictionary, SimpleHasher.INSTANCE);
  }

  /**
   * @param dictionary the empty dictionary to populate.
   * @param hasher hashes element bytes.
   */
  public PointerDictionaryBuilder(V dictionary, ArrowBufHasher hasher) {
    this.dictionary = dictionary;
    this.hasher = hasher;
    this.probe = new ArrowBufPointer(hasher);
  }

  @Override
  public V getDictionary() {
    return dictionary;
  }

  @Override
  public int ordinalOf(V values, int index) {
    values.getDataPointer(index, probe);
    Integer ordinal = ordinals.get(probe);
    if (ordinal != null) {
      return ordinal;
    }

    int next = dictionary.getValueCount();
    dictionary.copyFromSafe(index, next, values);
    dictionary.setValueCount(next + 1);

    // the dictionary buffers move as it grows, so the key keeps pointing into the source vector
    ordinals.put(probe, next);
    probe = new ArrowBufPointer(hasher);
    return next;
  }

  @Override
  public void close() {
    dictionary.close();
  }
}
