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

import org.apache.arrow.vector.ValueVector;

/**
 * Builds a dictionary of values that have no flat byte representation, such as lists.
 * Elements are compared through {@link ValueVector#getObject(int)}, which gives deep,
 * element-wise equality for nested values.
 *
 * @param <V> the dictionary vector type.
 */
public class ObjectDictionaryBuilder<V extends ValueVector> implements DictionaryBuilder<V> {

  private final V dictionary;

  private final HashMap<Object, Integer> ordinals = new HashMap<>();

  public ObjectDictionaryBuilder(V dictionary) {
    this.dictionary = dictionary;
  }

  @Override
  public V getDictionary() {
    return dictionary;
  }

  @Override
  public int ordinalOf(V values, int index) {
    Object value = values.getObject(index);
    Integer ordinal = ordinals.get(value);
    if (ordinal != null) {
      return ordinal;
    }

    int next = dictionary.getValueCount();
    dictionary.copyFromSafe(index, next, values);
    dictionary.setValueCount(next + 1);
    ordinals.put(value, next);
    return next;
  }

  @Override
  public void close() {
    dictionary.close();
  }
}
