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

import static io.valuemap.transform.VectorFixtures.fixedLists;
import static io.valuemap.transform.VectorFixtures.ints;
import static io.valuemap.transform.VectorFixtures.lists;
import static io.valuemap.transform.VectorFixtures.scalars;
import static io.valuemap.transform.VectorFixtures.strings;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.valuemap.transform.exceptions.DuplicateKeyException;
import io.valuemap.transform.exceptions.UnsupportedTypeException;
import io.valuemap.transform.schema.OutputColumnShape;
import io.valuemap.transform.schema.OutputColumnShape.VectorKind;
import io.valuemap.transform.table.KeyValueTable;
import io.valuemap.transform.table.ScalarKind;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestValueMappingTransformer {

  private static final List<String> KEYS = Arrays.asList("foo", "bar", "test", "wahoo");

  private static final List<ColumnBinding> DEF = Arrays.asList(
      ColumnBinding.of("D", "A"), ColumnBinding.of("E", "B"), ColumnBinding.of("F", "C"));

  private BufferAllocator allocator;

  @BeforeEach
  public void init() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  public void terminate() {
    allocator.close();
  }

  private VectorSchemaRoot abc(String a, String b, String c) {
    return VectorSchemaRoot.of(strings("A", allocator, a), strings("B", allocator, b), strings("C", allocator, c));
  }

  private VectorSchemaRoot lookupData(FieldVector values) {
    return VectorSchemaRoot.of(strings(KeyValueTable.KEY_COLUMN, allocator, KEYS.toArray(new String[0])), values);
  }

  @Test
  public void testOneValue() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 3, 4));
         ValueMappingTransformer transformer =
             ValueMappingTransformer.make(allocator, lookup, ValueMappingOptions.getDefault(), DEF);
         VectorSchemaRoot input = abc("bar", "test", "foo");
         VectorSchemaRoot output = transformer.evaluate(input)) {
      assertEquals(1, output.getRowCount());
      assertEquals(2, ((IntVector) output.getVector("D")).get(0));
      assertEquals(3, ((IntVector) output.getVector("E")).get(0));
      assertEquals(1, ((IntVector) output.getVector("F")).get(0));

      assertEquals(4, transformer.lookupValue("wahoo"));
      assertEquals(0, transformer.lookupValue("nope"));
      assertFalse(transformer.isValuesAsKeyType());
      assertTrue(transformer.getDictionaryIds().isEmpty());
    }
  }

  @Test
  public void testMissingKeysWriteDefaults() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(strings(KeyValueTable.VALUE_COLUMN, allocator, "a", "b", "c", "d"));
         ValueMappingTransformer transformer =
             ValueMappingTransformer.make(allocator, lookup, ValueMappingOptions.getDefault(), DEF);
         VectorSchemaRoot input = abc("baz", "test", null);
         VectorSchemaRoot output = transformer.evaluate(input)) {
      VarCharVector d = (VarCharVector) output.getVector("D");
      assertFalse(d.isNull(0));
      assertEquals("", d.getObject(0).toString());
      assertEquals("c", output.getVector("E").getObject(0).toString());
      // null looks up the empty string, which is not a key
      assertEquals("", output.getVector("F").getObject(0).toString());
    }
  }

  @Test
  public void testNullLooksUpDefaultKey() throws Exception {
    KeyValueTable table = KeyValueTable.fromLists(allocator, ScalarKind.INT32,
            Arrays.asList(0, 1), ScalarKind.TEXT, Arrays.asList("zero", "one"));
    try (ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, table,
            ValueMappingOptions.getDefault(), Collections.singletonList(ColumnBinding.of("out", "in")));
         VectorSchemaRoot input = VectorSchemaRoot.of(scalars("in", ScalarKind.INT32, allocator, 1, null, 2));
         VectorSchemaRoot output = transformer.evaluate(input)) {
      FieldVector out = output.getVector("out");
      assertEquals("one", out.getObject(0).toString());
      assertEquals("zero", out.getObject(1).toString());
      assertEquals("", out.getObject(2).toString());
    }
  }

  @Test
  public void testVectorInput() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 3, 4));
         ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, lookup,
             ValueMappingOptions.getDefault(), Collections.singletonList(ColumnBinding.inPlace("A")));
         VectorSchemaRoot input = VectorSchemaRoot.of(lists("A", ScalarKind.TEXT, allocator,
             Arrays.asList("bar", "test", "foo"), null, Arrays.asList("nope", "wahoo")))) {
      OutputColumnShape shape = transformer.resolveShapes(input.getSchema()).get(0);
      assertEquals(VectorKind.VARIABLE_VECTOR, shape.getVectorKind());

      try (VectorSchemaRoot output = transformer.evaluate(input)) {
        ListVector a = (ListVector) output.getVector("A");
        assertEquals(3, a.getValueCount());
        assertEquals(Arrays.asList(2, 3, 1), a.getObject(0));
        assertEquals(Collections.emptyList(), a.getObject(1));
        assertEquals(Arrays.asList(0, 4), a.getObject(2));
      }
    }
  }

  @Test
  public void testFixedSizeVectorInput() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 3, 4));
         ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, lookup,
             ValueMappingOptions.getDefault(), Collections.singletonList(ColumnBinding.of("out", "in")));
         VectorSchemaRoot input = VectorSchemaRoot.of(fixedLists("in", ScalarKind.TEXT, 3, allocator,
             Arrays.asList("bar", "baz", "foo"), null))) {
      OutputColumnShape shape = transformer.resolveShapes(input.getSchema()).get(0);
      assertEquals(VectorKind.FIXED_VECTOR, shape.getVectorKind());
      assertEquals(3, shape.getFixedSize());

      try (VectorSchemaRoot output = transformer.evaluate(input)) {
        FixedSizeListVector out = (FixedSizeListVector) output.getVector("out");
        assertEquals(new ArrowType.FixedSizeList(3), out.getField().getType());
        assertEquals(Arrays.asList(2, 0, 1), out.getObject(0));
        assertEquals(Arrays.asList(0, 0, 0), out.getObject(1));
      }
    }
  }

  @Test
  public void testVectorValues() throws Exception {
    KeyValueTable table = KeyValueTable.fromVectorLists(allocator, ScalarKind.TEXT,
            Arrays.asList("foo", "bar", "test"), ScalarKind.INT32,
            Arrays.asList(Arrays.asList(2, 3, 4), Arrays.asList(100, 200), Arrays.asList(400, 500, 600, 700)));
    try (ValueMappingTransformer transformer =
             ValueMappingTransformer.make(allocator, table, ValueMappingOptions.getDefault(), DEF);
         VectorSchemaRoot input = abc("bar", "test", "nope")) {
      // the shape is known before any row is read
      for (OutputColumnShape shape : transformer.resolveShapes(input.getSchema())) {
        assertEquals(VectorKind.VARIABLE_VECTOR, shape.getVectorKind());
        assertEquals(ScalarKind.INT32.getType(), shape.getItemType());
      }

      try (VectorSchemaRoot output = transformer.evaluate(input)) {
        assertEquals(Arrays.asList(100, 200), output.getVector("D").getObject(0));
        assertEquals(Arrays.asList(400, 500, 600, 700), output.getVector("E").getObject(0));
        assertEquals(Collections.emptyList(), output.getVector("F").getObject(0));
      }
      assertEquals(Arrays.asList(2, 3, 4), transformer.lookupValue("foo"));
      assertEquals(Collections.emptyList(), transformer.lookupValue("nope"));
    }
  }

  @Test
  public void testVectorStringValues() throws Exception {
    KeyValueTable table = KeyValueTable.fromVectorLists(allocator, ScalarKind.TEXT,
            Arrays.asList("foo", "bar", "test"), ScalarKind.TEXT,
            Arrays.asList(Arrays.asList("foo", "bar"), Arrays.asList("forest", "city", "town"),
                Arrays.asList("winter", "summer", "autumn", "spring")));
    try (ValueMappingTransformer transformer =
             ValueMappingTransformer.make(allocator, table, ValueMappingOptions.getDefault(), DEF);
         VectorSchemaRoot input = abc("bar", "test", "foo");
         VectorSchemaRoot output = transformer.evaluate(input)) {
      assertEquals(Arrays.asList("forest", "city", "town"), texts(output.getVector("D").getObject(0)));
      assertEquals(Arrays.asList("winter", "summer", "autumn", "spring"),
          texts(output.getVector("E").getObject(0)));
      assertEquals(Arrays.asList("foo", "bar"), texts(output.getVector("F").getObject(0)));
    }
  }

  @Test
  public void testVectorInputWithVectorValuesIsRejected() throws Exception {
    KeyValueTable table = KeyValueTable.fromVectorLists(allocator, ScalarKind.TEXT,
            Arrays.asList("foo"), ScalarKind.INT32, Collections.singletonList(Arrays.asList(1, 2)));
    try (ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, table,
            ValueMappingOptions.getDefault(), Collections.singletonList(ColumnBinding.inPlace("A")));
         VectorSchemaRoot input = VectorSchemaRoot.of(lists("A", ScalarKind.TEXT, allocator,
             Arrays.asList("foo")))) {
      assertThrows(UnsupportedTypeException.class, () -> transformer.bind(input.getSchema()));
      assertThrows(UnsupportedTypeException.class, () -> transformer.evaluate(input));
    }
  }

  @Test
  public void testMismatchedInputType() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 3, 4));
         ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, lookup,
             ValueMappingOptions.getDefault(), Collections.singletonList(ColumnBinding.of("out", "in")));
         VectorSchemaRoot input = VectorSchemaRoot.of(ints("in", allocator, 1))) {
      assertThrows(UnsupportedTypeException.class, () -> transformer.getOutputSchema(input.getSchema()));
      assertThrows(UnsupportedTypeException.class, () -> transformer.evaluate(input));
      assertThrows(UnsupportedTypeException.class, () -> transformer.getOutputSchema(new Schema(
          Collections.singletonList(Field.nullable("other", ArrowType.Utf8.INSTANCE)))));
    }
  }

  @Test
  public void testOutputSchema() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 3, 4));
         ValueMappingTransformer transformer =
             ValueMappingTransformer.make(allocator, lookup, ValueMappingOptions.getDefault(), DEF);
         VectorSchemaRoot input = abc("bar", "test", "foo")) {
      Schema schema = transformer.getOutputSchema(input.getSchema());
      assertEquals(6, schema.getFields().size());
      assertEquals(Arrays.asList("A", "B", "C", "D", "E", "F"), names(schema));
      assertEquals(ScalarKind.INT32.getType(), schema.findField("D").getType());
    }

    try (VectorSchemaRoot lookup = lookupData(ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 3, 4));
         ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, lookup,
             ValueMappingOptions.getDefault(), Arrays.asList(ColumnBinding.inPlace("B"), ColumnBinding.of("D", "A")));
         VectorSchemaRoot input = abc("bar", "test", "foo")) {
      Schema schema = transformer.getOutputSchema(input.getSchema());
      assertEquals(Arrays.asList("A", "B", "C", "D"), names(schema));
      assertEquals(ScalarKind.INT32.getType(), schema.findField("B").getType());
      assertEquals(ArrowType.Utf8.INSTANCE, schema.findField("A").getType());
    }
  }

  @Test
  public void testKeyTypeStringValues() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(strings(KeyValueTable.VALUE_COLUMN, allocator,
            "foo1", "foo2", "foo1", "foo3"));
         ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, lookup,
             new ValueMappingOptions().withValuesAsKeyType(true).withDictionaryId(5L), DEF);
         VectorSchemaRoot input = abc("bar", "test", "nope")) {
      assertTrue(transformer.isValuesAsKeyType());
      assertEquals(3, transformer.getKeyValues().getValueCount());

      Schema schema = transformer.getOutputSchema(input.getSchema());
      Field d = schema.findField("D");
      assertEquals(new ArrowType.Int(32, false), d.getType());
      assertNotNull(d.getDictionary());
      assertEquals(5L, d.getDictionary().getId());
      assertEquals("3", d.getMetadata().get(OutputColumnShape.KEY_COUNT_METADATA));

      try (VectorSchemaRoot output = transformer.evaluate(input)) {
        UInt4Vector codes = (UInt4Vector) output.getVector("D");
        assertEquals(2, codes.getValueAsLong(0));
        assertEquals(1, ((UInt4Vector) output.getVector("E")).getValueAsLong(0));
        assertEquals(0, ((UInt4Vector) output.getVector("F")).getValueAsLong(0));

        // reverse lookup through the provided dictionary
        assertEquals(Collections.singleton(5L), transformer.getDictionaryIds());
        assertNotNull(transformer.lookup(5L));
        try (ValueVector decoded = transformer.decode(codes)) {
          assertEquals("foo2", decoded.getObject(0).toString());
        }
        try (ValueVector decoded = transformer.decode(output.getVector("F"))) {
          assertTrue(decoded.isNull(0));
        }
      }

      assertEquals(2L, transformer.lookupCode("bar"));
      assertEquals(0L, transformer.lookupCode("nope"));
      assertEquals("foo2", transformer.decode(transformer.lookupCode("bar")));
      assertEquals("foo3", transformer.decode(3L));
      assertNull(transformer.decode(0L));
      assertThrows(IllegalArgumentException.class, () -> transformer.decode(4L));
    }
  }

  @Test
  public void testKeyTypeVectorInput() throws Exception {
    try (VectorSchemaRoot lookup = lookupData(strings(KeyValueTable.VALUE_COLUMN, allocator,
            "foo1", "foo2", "foo1", "foo3"));
         ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, lookup,
             new ValueMappingOptions().withValuesAsKeyType(true), Collections.singletonList(ColumnBinding.inPlace("A")));
         VectorSchemaRoot input = VectorSchemaRoot.of(lists("A", ScalarKind.TEXT, allocator,
             Arrays.asList("bar", "foo", "baz")));
         VectorSchemaRoot output = transformer.evaluate(input)) {
      ListVector codes = (ListVector) output.getVector("A");
      UInt4Vector items = (UInt4Vector) codes.getDataVector();
      assertEquals(3, items.getValueCount());
      assertEquals(2, items.getValueAsLong(0));
      assertEquals(1, items.getValueAsLong(1));
      assertEquals(0, items.getValueAsLong(2));
    }
  }

  @Test
  public void testKeyTypeVectorValues() throws Exception {
    KeyValueTable table = KeyValueTable.fromVectorLists(allocator, ScalarKind.TEXT,
            Arrays.asList("foo", "bar", "test"), ScalarKind.INT32,
            Arrays.asList(Arrays.asList(1, 2), Arrays.asList(3), Arrays.asList(1, 2)));
    try (ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, table,
            new ValueMappingOptions().withValuesAsKeyType(true), DEF);
         VectorSchemaRoot input = abc("test", "bar", "foo");
         VectorSchemaRoot output = transformer.evaluate(input)) {
      assertEquals(1, ((UInt4Vector) output.getVector("D")).getValueAsLong(0));
      assertEquals(2, ((UInt4Vector) output.getVector("E")).getValueAsLong(0));
      assertEquals(Arrays.asList(3), transformer.decode(2L));
    }
  }

  @Test
  public void testUnsignedValuesPassThrough() throws Exception {
    KeyValueTable table = KeyValueTable.fromLists(allocator, ScalarKind.TEXT, KEYS,
            ScalarKind.UINT32, Arrays.asList(51L, 25L, 42L, 61L));
    try (ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, table,
            new ValueMappingOptions().withValuesAsKeyType(true), DEF);
         VectorSchemaRoot input = abc("bar", "nope", "wahoo");
         VectorSchemaRoot output = transformer.evaluate(input)) {
      assertTrue(transformer.getOrdinals().isPassThrough());
      assertNull(transformer.getKeyValues());
      assertNull(transformer.getDictionary());

      assertEquals(25, ((UInt4Vector) output.getVector("D")).getValueAsLong(0));
      assertEquals(0, ((UInt4Vector) output.getVector("E")).getValueAsLong(0));
      assertEquals(61, ((UInt4Vector) output.getVector("F")).getValueAsLong(0));
      assertEquals("61", output.getVector("D").getField().getMetadata().get(OutputColumnShape.KEY_COUNT_METADATA));
      assertThrows(IllegalStateException.class, () -> transformer.decode(25L));
    }
  }

  @Test
  public void testUnsigned64BitValuesPassThrough() throws Exception {
    long large = 3_000_000_000L;
    KeyValueTable table = KeyValueTable.fromLists(allocator, ScalarKind.TEXT, KEYS,
            ScalarKind.UINT64, Arrays.asList(1L, 2L, large, 4L));
    try (ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, table,
            new ValueMappingOptions().withValuesAsKeyType(true), DEF);
         VectorSchemaRoot input = abc("test", "foo", "nope");
         VectorSchemaRoot output = transformer.evaluate(input)) {
      assertEquals(new ArrowType.Int(64, false), output.getVector("D").getField().getType());
      assertEquals(large, ((UInt8Vector) output.getVector("D")).get(0));
      assertEquals(1L, ((UInt8Vector) output.getVector("E")).get(0));
      assertEquals(0L, ((UInt8Vector) output.getVector("F")).get(0));
    }
  }

  @Test
  public void testNonDefaultColumnNamesAndOrder() throws Exception {
    Float[] prices = {3.14f, 2000f, 1.19f, 2.17f, 33.784f};
    try (VectorSchemaRoot lookup = VectorSchemaRoot.of(
            strings("PriceCategory", allocator, "Low", "High", "Low", "Low", "Medium"),
            scalars("Price", ScalarKind.FLOAT32, allocator, (Object[]) prices));
         ValueMappingTransformer transformer = ValueMappingTransformer.make(allocator, lookup,
             new ValueMappingOptions().withKeyColumn("Price").withValueColumn("PriceCategory"),
             Collections.singletonList(ColumnBinding.of("PriceCategory", "Price")));
         VectorSchemaRoot input = VectorSchemaRoot.of(scalars("Price", ScalarKind.FLOAT32, allocator,
             3.14f, 2000f, 1.19f, 2.17f, 33.784f, 5f));
         VectorSchemaRoot output = transformer.evaluate(input)) {
      List<String> categories = new ArrayList<>();
      FieldVector out = output.getVector("PriceCategory");
      for (int i = 0; i < output.getRowCount(); i++) {
        categories.add(out.getObject(i).toString());
      }
      assertEquals(Arrays.asList("Low", "High", "Low", "Low", "Medium", ""), categories);
    }
  }

  @Test
  public void testDuplicateKeys() {
    try (VectorSchemaRoot lookup = VectorSchemaRoot.of(
        strings(KeyValueTable.KEY_COLUMN, allocator, "foo", "bar", "foo"),
        ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 1))) {
      DuplicateKeyException e = assertThrows(DuplicateKeyException.class, () ->
          ValueMappingTransformer.make(allocator, lookup, ValueMappingOptions.getDefault(), DEF));
      assertEquals("foo", e.getKey());
      assertEquals(0, e.getFirstIndex());
      assertEquals(2, e.getDuplicateIndex());
    }
  }

  @Test
  public void testInvalidBindings() {
    try (VectorSchemaRoot lookup = lookupData(ints(KeyValueTable.VALUE_COLUMN, allocator, 1, 2, 3, 4))) {
      assertThrows(IllegalArgumentException.class, () -> ValueMappingTransformer.make(allocator, lookup,
          ValueMappingOptions.getDefault(), Collections.emptyList()));
      assertThrows(IllegalArgumentException.class, () -> ValueMappingTransformer.make(allocator, lookup,
          ValueMappingOptions.getDefault(), Arrays.asList(ColumnBinding.of("D", "A"), ColumnBinding.of("D", "B"))));
      assertThrows(IllegalArgumentException.class, () -> ValueMappingTransformer.make(allocator, lookup,
          new ValueMappingOptions().withKeyColumn("missing"), DEF));
    }
  }

  private static List<String> names(Schema schema) {
    List<String> names = new ArrayList<>();
    for (Field field : schema.getFields()) {
      names.add(field.getName());
    }
    return names;
  }

  private static List<String> texts(Object list) {
    List<String> result = new ArrayList<>();
    for (Object item : (List<?>) list) {
      result.add(item.toString());
    }
    return result;
  }
}
