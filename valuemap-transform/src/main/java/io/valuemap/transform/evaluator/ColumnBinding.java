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

import org.apache.arrow.util.Preconditions;

/**
 * Pairs the input column that is looked up with the output column receiving the mapped values.
 */
public final class ColumnBinding {

  private final String outputColumn;
  private final String inputColumn;

  /**
   * Constructs a binding.
   *
   * @param outputColumn name of the column receiving the mapped values.
   * @param inputColumn name of the column holding the keys.
   */
  public ColumnBinding(String outputColumn, String inputColumn) {
    this.outputColumn = Preconditions.checkNotNull(outputColumn, "outputColumn");
    this.inputColumn = Preconditions.checkNotNull(inputColumn, "inputColumn");
  }

  public static ColumnBinding of(String outputColumn, String inputColumn) {
    return new ColumnBinding(outputColumn, inputColumn);
  }

  /**
   * Maps a column onto itself.
   */
  public static ColumnBinding inPlace(String column) {
    return new ColumnBinding(column, column);
  }

  public String getOutputColumn() {
    return outputColumn;
  }

  public String getInputColumn() {
    return inputColumn;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnBinding)) {
      return false;
    }
    ColumnBinding that = (ColumnBinding) o;
    return outputColumn.equals(that.outputColumn) && inputColumn.equals(that.inputColumn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(outputColumn, inputColumn);
  }

  @Override
  public String toString() {
    return outputColumn + ":" + inputColumn;
  }
}
