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

import java.util.ArrayList;
import java.util.List;

import io.valuemap.transform.exceptions.UnsupportedTypeException;
import io.valuemap.transform.exceptions.ValueMappingException;
import io.valuemap.transform.schema.OutputColumnShape;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Evaluates the bindings of a {@link ValueMappingTransformer} against record batches of one schema.
 * Follow these steps to use this class:
 * 1) Use {@link ValueMappingTransformer#bind(Schema)} to resolve the output columns for a schema
 * 2) Invoke evaluate() on record batches of that schema
 *
 * <p>A mapper holds no mutable state and may evaluate several batches concurrently, each into
 * its own output vectors. It stays usable until its transformer is closed.
 */
public class ValueMapper {

  private final ValueMappingTransformer transformer;
  private final List<ColumnMapper> columns;
  private final Schema outputSchema;

  ValueMapper(ValueMappingTransformer transformer, List<ColumnMapper> columns) {
    this.transformer = transformer;
    this.columns = columns;
    List<Field> fields = new ArrayList<>(columns.size());
    for (ColumnMapper column : columns) {
      fields.add(column.outputField);
    }
    this.outputSchema = new Schema(fields);
  }

  /**
   * Gets the schema of the mapped columns, in binding order.
   */
  public Schema getOutputSchema() {
    return outputSchema;
  }

  /**
   * Gets the shape of the output column of each binding, in binding order.
   */
  public List<OutputColumnShape> getOutputShapes() {
    List<OutputColumnShape> shapes = new ArrayList<>(columns.size());
    for (ColumnMapper column : columns) {
      shapes.add(column.shape);
    }
    return shapes;
  }

  /**
   * Creates empty output vectors matching {@link #getOutputSchema()}.
   *
   * @param allocator the allocator for the vectors.
   * @return the vectors, owned by the caller.
   */
  public List<FieldVector> createOutputVectors(BufferAllocator allocator) {
    List<FieldVector> vectors = new ArrayList<>(columns.size());
    try {
      for (ColumnMapper column : columns) {
        vectors.add(column.createOutputVector(allocator));
      }
    } catch (RuntimeException e) {
      AutoCloseables.close(e, vectors);
      throw e;
    }
    return vectors;
  }

  /**
   * Invoke this function to map the bound columns of a record batch.
   *
   * @param batch the record batch, with the schema this mapper was bound to.
   * @param outColumns the vectors receiving the mapped values, as created by
   *     {@link #createOutputVectors(BufferAllocator)}.
   */
  public void evaluate(VectorSchemaRoot batch, List<FieldVector> outColumns) throws ValueMappingException {
    transformer.checkOpen();
    Preconditions.checkArgument(outColumns.size() == columns.size(),
        "Expected %s output columns, got %s", columns.size(), outColumns.size());

    int rowCount = batch.getRowCount();
    for (int i = 0; i < columns.size(); i++) {
      ColumnMapper column = columns.get(i);
      FieldVector output = outColumns.get(i);
      Preconditions.checkArgument(output.getField().getType().equals(column.outputField.getType()),
          "Output column %s has type %s, expected %s", i, output.getField().getType(), column.outputField.getType());
      column.map(inputVector(batch, column), output, rowCount);
    }
  }

  /**
   * Invoke this function to map the bound columns of a record batch into new vectors.
   *
   * @param batch the record batch, with the schema this mapper was bound to.
   * @param allocator the allocator for the output vectors.
   * @return a batch holding one mapped column per binding, owned by the caller.
   */
  public VectorSchemaRoot evaluate(VectorSchemaRoot batch, BufferAllocator allocator) throws ValueMappingException {
    List<FieldVector> outColumns = createOutputVectors(allocator);
    try {
      evaluate(batch, outColumns);
    } catch (ValueMappingException | RuntimeException e) {
      AutoCloseables.close(e, outColumns);
      throw e;
    }
    return new VectorSchemaRoot(outputSchema.getFields(), outColumns, batch.getRowCount());
  }

  private static FieldVector inputVector(VectorSchemaRoot batch, ColumnMapper column)
      throws UnsupportedTypeException {
    FieldVector input = batch.getVector(column.binding.getInputColumn());
    if (input == null) {
      throw new UnsupportedTypeException("Input column '" + column.binding.getInputColumn() +
          "' is missing from " + batch.getSchema());
    }
    if (!input.getField().equals(column.inputField)) {
      throw new UnsupportedTypeException("Input column '" + column.binding.getInputColumn() + "' is " +
          input.getField() + ", but the mapper was bound to " + column.inputField);
    }
    return input;
  }
}
