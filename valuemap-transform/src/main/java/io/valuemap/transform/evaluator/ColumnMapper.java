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

import io.valuemap.transform.dictionary.LookupIndex;
import io.valuemap.transform.schema.OutputColumnShape;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ElementAddressableVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * Maps one bound input column into its output column.
 *
 * <p>Instances are immutable; all per-call state lives on the stack of {@link #map}, so a
 * mapper can be used from several threads at once.
 */
abstract class ColumnMapper {

  final ColumnBinding binding;
  final Field inputField;
  final OutputColumnShape shape;
  final Field outputField;
  final LookupIndex index;
  final ElementWriter writer;

  ColumnMapper(ColumnBinding binding, Field inputField, OutputColumnShape shape, Field outputField,
      LookupIndex index, ElementWriter writer) {
    this.binding = binding;
    this.inputField = inputField;
    this.shape = shape;
    this.outputField = outputField;
    this.index = index;
    this.writer = writer;
  }

  /**
   * Creates the mapper matching the input column's shape.
   */
  static ColumnMapper create(ColumnBinding binding, Field inputField, OutputColumnShape shape, Field outputField,
      LookupIndex index, ElementWriter writer) {
    ArrowType inputType = inputField.getType();
    if (inputType instanceof ArrowType.List) {
      return new ListMapper(binding, inputField, shape, outputField, index, writer);
    } else if (inputType instanceof ArrowType.FixedSizeList) {
      return new FixedSizeListMapper(binding, inputField, shape, outputField, index, writer);
    }
    return new ScalarMapper(binding, inputField, shape, outputField, index, writer);
  }

  /**
   * Creates an empty vector for the output column.
   */
  FieldVector createOutputVector(BufferAllocator allocator) {
    FieldVector vector = outputField.createVector(allocator);
    vector.allocateNew();
    return vector;
  }

  /**
   * Maps the first rowCount rows of the input into the output and sets the output value count.
   */
  abstract void map(FieldVector input, FieldVector output, int rowCount);

  /**
   * One key per row.
   */
  static final class ScalarMapper extends ColumnMapper {

    ScalarMapper(ColumnBinding binding, Field inputField, OutputColumnShape shape, Field outputField,
        LookupIndex index, ElementWriter writer) {
      super(binding, inputField, shape, outputField, index, writer);
    }

    @Override
    void map(FieldVector input, FieldVector output, int rowCount) {
      ElementAddressableVector keys = (ElementAddressableVector) input;
      LookupIndex.Probe probe = index.newProbe();
      for (int i = 0; i < rowCount; i++) {
        writer.write(probe.find(keys, i), output, i);
      }
      output.setValueCount(rowCount);
    }
  }

  /**
   * A variable-length list of keys per row, mapped element by element.
   */
  static final class ListMapper extends ColumnMapper {

    ListMapper(ColumnBinding binding, Field inputField, OutputColumnShape shape, Field outputField,
        LookupIndex index, ElementWriter writer) {
      super(binding, inputField, shape, outputField, index, writer);
    }

    @Override
    void map(FieldVector input, FieldVector output, int rowCount) {
      ListVector in = (ListVector) input;
      ListVector out = (ListVector) output;
      ElementAddressableVector keys = (ElementAddressableVector) in.getDataVector();
      FieldVector items = out.getDataVector();
      LookupIndex.Probe probe = index.newProbe();

      for (int row = 0; row < rowCount; row++) {
        int outStart = out.startNewValue(row);
        if (in.isNull(row)) {
          // no elements to look up
          out.endValue(row, 0);
          continue;
        }
        int start = in.getElementStartIndex(row);
        int end = in.getElementEndIndex(row);
        for (int i = start; i < end; i++) {
          writer.write(probe.find(keys, i), items, outStart + i - start);
        }
        out.endValue(row, end - start);
      }
      out.setValueCount(rowCount);
    }
  }

  /**
   * A fixed-length list of keys per row, mapped element by element into a list of the same length.
   */
  static final class FixedSizeListMapper extends ColumnMapper {

    private final int listSize;

    FixedSizeListMapper(ColumnBinding binding, Field inputField, OutputColumnShape shape, Field outputField,
        LookupIndex index, ElementWriter writer) {
      super(binding, inputField, shape, outputField, index, writer);
      this.listSize = ((ArrowType.FixedSizeList) inputField.getType()).getListSize();
    }

    @Override
    void map(FieldVector input, FieldVector output, int rowCount) {
      FixedSizeListVector in = (FixedSizeListVector) input;
      FixedSizeListVector out = (FixedSizeListVector) output;
      ElementAddressableVector keys = (ElementAddressableVector) in.getDataVector();
      FieldVector items = out.getDataVector();
      LookupIndex.Probe probe = index.newProbe();

      for (int row = 0; row < rowCount; row++) {
        out.setNotNull(row);
        boolean absent = in.isNull(row);
        int start = row * listSize;
        for (int i = start; i < start + listSize; i++) {
          // an absent row reads as a row of default keys
          int slot = absent ? index.getDefaultSlot() : probe.find(keys, i);
          writer.write(slot, items, i);
        }
      }
      out.setValueCount(rowCount);
    }
  }
}
