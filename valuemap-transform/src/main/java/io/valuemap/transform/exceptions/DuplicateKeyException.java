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

package io.valuemap.transform.exceptions;

/**
 * Thrown when the lookup table supplies the same key more than once.
 */
public class DuplicateKeyException extends ValueMappingException {

  private final Object key;
  private final int firstIndex;
  private final int duplicateIndex;

  /**
   * Constructs the exception.
   *
   * @param key the repeated key.
   * @param firstIndex the position the key was first seen at.
   * @param duplicateIndex the position of the repetition.
   */
  public DuplicateKeyException(Object key, int firstIndex, int duplicateIndex) {
    super("Duplicate key '" + key + "' at positions " + firstIndex + " and " + duplicateIndex);
    this.key = key;
    this.firstIndex = firstIndex;
    this.duplicateIndex = duplicateIndex;
  }

  public Object getKey() {
    return key;
  }

  public int getFirstIndex() {
    return firstIndex;
  }

  public int getDuplicateIndex() {
    return duplicateIndex;
  }
}
