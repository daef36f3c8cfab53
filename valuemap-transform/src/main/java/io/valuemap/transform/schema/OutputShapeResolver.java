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

package io.valuemap.transform.schema;

import io.valuemap.transform.dictionary.ValueOrdinalIndex;
import io.valuemap.transform.exceptions.UnsupportedTypeException;
import io.valuemap.transform.table.ScalarKind;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * Computes the shape of a mapped column from the input field and the lookup table's types alone.
 *
 * <table>
 *   <caption>Output shapes</caption>
 *   <tr><th>input</th><th>scalar value</th><th>vector value</th></tr>
 *   <tr><td>scalar</td><td>scalar</td><td>variable vector</td></tr>
 *   <tr><td>list</td><td>variable vector</td><td>unsupported</td></tr>
 *   <tr><td>fixed size list of n</td><td>fixed vector of n</td><td>unsupported</td></tr>
 * </table>
 *
 * <p>In key-type mode the items are codes, so vector values behave like scalar ones.
 */
public final class OutputShapeResolver {

  private OutputShapeResolver() {
  }

  /**
   * Resolves the output shape of one binding.
   *
   * @param inputField the input column.
   * @param keyKind the kind of the table keys.
   * @param valueKind the kind of the table values, or value items.
   * @param valueVector whether the table values are vectors.
   * @param ordinals the key-type codes, or null when values are written as they are.
   * @return the shape.
   * @throws UnsupportedTypeException if the input item type is not the key type, or if both the
   *     input and the values are vectors.
   */
  public static OutputColumnShape resolve(Field inputField, ScalarKind keyKind, ScalarKind valueKind,
      boolean valueVector, ValueOrdinalIndex ordinals) throws UnsupportedTypeException {
    ArrowType inputType = inputField.getType();
    boolean inputVector = isVectorType(inputType);

    ArrowType inputItemType = inputVector ? itemType(inputField) : inputType;
    if (!keyKind.getType().equals(inputItemType)) {
      throw new UnsupportedTypeException("Column '" + inputField.getName() + "' has item type " +
          inputItemType + ", expected the key type " + keyKind.getType());
    }

    // codes are scalars, whatever the values they stand for
    boolean vectorItems = valueVector && ordinals == null;
    OutputColumnShape shape;
    if (!inputVector) {
      shape = vectorItems ?
          OutputColumnShape.variableVector(valueKind.getType()) : OutputColumnShape.scalar(valueKind.getType());
    } else if (vectorItems) {
      throw new UnsupportedTypeException("Column '" + inputField.getName() +
          "' is a vector and the lookup values are vectors, which cannot be mapped element-wise");
    } else if (inputType instanceof ArrowType.FixedSizeList) {
      shape = OutputColumnShape.fixedVector(valueKind.getType(), ((ArrowType.FixedSizeList) inputType).getListSize());
    } else {
      shape = OutputColumnShape.variableVector(valueKind.getType());
    }

    if (ordinals != null) {
      shape = shape.asKeyType(ordinals.getCodeType(), ordinals.getKeyCount());
    }
    return shape;
  }

  /**
   * Whether the type is one of the vector types the mapping reads element-wise.
   */
  public static boolean isVectorType(ArrowType type) {
    return type instanceof ArrowType.List || type instanceof ArrowType.FixedSizeList;
  }

  private static ArrowType itemType(Field inputField) throws UnsupportedTypeException {
    if (inputField.getChildren().size() != 1) {
      throw new UnsupportedTypeException("Column '" + inputField.getName() + "' has no item type");
    }
    return inputField.getChildren().get(0).getType();
  }
}
