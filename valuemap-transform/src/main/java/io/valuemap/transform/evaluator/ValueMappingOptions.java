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

import java.util.Objects;

import io.valuemap.transform.table.KeyValueTable;
import org.apache.arrow.util.Preconditions;

/**
 * Options of a value mapping.
 */
public class ValueMappingOptions {
  private String keyColumn = KeyValueTable.KEY_COLUMN;
  private String valueColumn = KeyValueTable.VALUE_COLUMN;
  private boolean valuesAsKeyType = false;
  private long dictionaryId = 0L;

  public static ValueMappingOptions getDefault() {
    return new ValueMappingOptions();
  }

  public ValueMappingOptions() {
  }

  /**
   * Copies the settings of other options.
   */
  public ValueMappingOptions(ValueMappingOptions other) {
    this.keyColumn = other.keyColumn;
    this.valueColumn = other.valueColumn;
    this.valuesAsKeyType = other.valuesAsKeyType;
    this.dictionaryId = other.dictionaryId;
  }

  /**
   * Sets the name of the key column in the lookup data.
   */
  public ValueMappingOptions withKeyColumn(String keyColumn) {
    this.keyColumn = Preconditions.checkNotNull(keyColumn);
    return this;
  }

  /**
   * Sets the name of the value column in the lookup data.
   */
  public ValueMappingOptions withValueColumn(String valueColumn) {
    this.valueColumn = Preconditions.checkNotNull(valueColumn);
    return this;
  }

  /**
   * Sets whether the outputs are key-type codes rather than the values themselves.
   */
  public ValueMappingOptions withValuesAsKeyType(boolean valuesAsKeyType) {
    this.valuesAsKeyType = valuesAsKeyType;
    return this;
  }

  /**
   * Sets the id of the dictionary that decodes key-type outputs.
   */
  public ValueMappingOptions withDictionaryId(long dictionaryId) {
    this.dictionaryId = dictionaryId;
    return this;
  }

  public String getKeyColumn() {
    return keyColumn;
  }

  public String getValueColumn() {
    return valueColumn;
  }

  public boolean isValuesAsKeyType() {
    return valuesAsKeyType;
  }

  public long getDictionaryId() {
    return dictionaryId;
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyColumn, valueColumn, valuesAsKeyType, dictionaryId);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ValueMappingOptions)) {
      return false;
    }
    ValueMappingOptions other = (ValueMappingOptions) obj;
    return this.keyColumn.equals(other.keyColumn) &&
        this.valueColumn.equals(other.valueColumn) &&
        this.valuesAsKeyType == other.valuesAsKeyType &&
        this.dictionaryId == other.dictionaryId;
  }
}
