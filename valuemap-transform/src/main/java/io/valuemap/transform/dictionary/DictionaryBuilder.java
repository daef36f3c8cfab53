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

import org.apache.arrow.vector.ValueVector;

/**
 * Numbers distinct values in the order they are first seen, copying each new value into a
 * dictionary vector at its ordinal.
 *
 * <p>A builder populates a single dictionary and cannot be reused for another one.
 *
 * @param <V> the dictionary vector type.
 */
public interface DictionaryBuilder<V extends ValueVector> extends AutoCloseable {

  /**
   * Gets the ordinal of a value, appending the value to the dictionary when it is new.
   *
   * @param values the vector holding the value.
   * @param index the position of the value.
   * @return the 0-based position of the value in the dictionary.
   */
  int ordinalOf(V values, int index);

  /**
   * Gets the dictionary built.
   */
  V getDictionary();

  /**
   * Releases the dictionary. Callers that hand the dictionary to another owner must not close the builder.
   */
  @Override
  void close();
}
