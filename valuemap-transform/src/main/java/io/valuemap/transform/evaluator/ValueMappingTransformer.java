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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.valuemap.transform.dictionary.LookupIndex;
import io.valuemap.transform.dictionary.ValueOrdinalIndex;
import io.valuemap.transform.exceptions.DuplicateKeyException;
import io.valuemap.transform.exceptions.EvaluatorClosedException;
import io.valuemap.transform.exceptions.UnsupportedTypeException;
import io.valuemap.transform.exceptions.ValueMappingException;
import io.valuemap.transform.schema.OutputColumnShape;
import io.valuemap.transform.schema.OutputShapeResolver;
import io.valuemap.transform.table.KeyValueTable;
import io.valuemap.transform.table.ScalarKind;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.ElementAddressableVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryEncoder;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites columns of record batches by substituting each key of a fixed lookup table with its
 * value, or with a key-type code standing for the value.
 *
 * <p>All state is built in {@link #make} and frozen afterwards: a transformer can be bound to
 * any number of schemas and evaluated from any number of threads. Keys missing from the table
 * are not errors; they map to the default of the output type (0, the empty string, an empty
 * vector, or code 0).
 *
 * <p>Key-type outputs are dictionary encoded. When the values behind the codes are known, the
 * transformer provides the {@link Dictionary} decoding them; its entry 0 is null and stands for
 * missing keys.
 */
public class ValueMappingTransformer implements DictionaryProvider, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ValueMappingTransformer.class);

  private final BufferAllocator allocator;
  private final KeyValueTable table;
  private final LookupIndex index;
  private final ValueOrdinalIndex ordinals;
  private final ValueMappingOptions options;
  private final List<ColumnBinding> bindings;
  private final DictionaryEncoding encoding;
  private final Dictionary dictionary;
  private final FieldVector defaults;
  private volatile boolean closed;

  private ValueMappingTransformer(BufferAllocator allocator, KeyValueTable table, LookupIndex index,
      ValueOrdinalIndex ordinals, ValueMappingOptions options, List<ColumnBinding> bindings) {
    this.allocator = allocator;
    this.table = table;
    this.index = index;
    this.ordinals = ordinals;
    this.options = options;
    this.bindings = bindings;
    if (ordinals != null) {
      this.encoding = new DictionaryEncoding(options.getDictionaryId(), false, ordinals.getCodeType());
      this.dictionary = ordinals.hasKeyValues() ? ordinals.createDictionary(allocator, encoding) : null;
      this.defaults = null;
    } else {
      this.encoding = null;
      this.dictionary = null;
      this.defaults = createDefaults(table, allocator);
    }
    this.closed = false;
  }

  /**
   * Builds a transformer from the key and value columns of a record batch.
   *
   * @param allocator the allocator for the transformer's copies of the data.
   * @param lookupData the pairs, one per row; the column names are taken from the options.
   * @param options the options.
   * @param bindings the columns to map.
   * @return the transformer, to be closed by the caller.
   * @throws DuplicateKeyException if a key occurs more than once.
   * @throws UnsupportedTypeException if the key or value type is not supported.
   */
  public static ValueMappingTransformer make(BufferAllocator allocator, VectorSchemaRoot lookupData,
      ValueMappingOptions options, List<ColumnBinding> bindings) throws ValueMappingException {
    KeyValueTable table = KeyValueTable.create(allocator, lookupData, options.getKeyColumn(), options.getValueColumn());
    return make(allocator, table, options, bindings);
  }

  /**
   * Builds a transformer over a table.
   *
   * @param allocator the allocator for the transformer's own vectors.
   * @param table the pairs; the transformer takes ownership, also when it fails.
   * @param options the options.
   * @param bindings the columns to map.
   * @return the transformer, to be closed by the caller.
   * @throws DuplicateKeyException if a key occurs more than once.
   */
  public static ValueMappingTransformer make(BufferAllocator allocator, KeyValueTable table,
      ValueMappingOptions options, List<ColumnBinding> bindings) throws ValueMappingException {
    return build(allocator, table, options, bindings, -1, null);
  }

  /**
   * Rebuilds a transformer whose key-type codes are the unsigned integer values of the table,
   * with a known key count and, optionally, the values the codes stand for.
   *
   * @param allocator the allocator for the transformer's own vectors.
   * @param table the pairs; the transformer takes ownership, also when it fails.
   * @param options the options; values are always treated as key type.
   * @param bindings the columns to map.
   * @param keyCount the key count, or a negative number to use the largest value.
   * @param keyValues the values standing behind codes 1 to n, or null; the transformer takes ownership.
   */
  public static ValueMappingTransformer restore(BufferAllocator allocator, KeyValueTable table,
      ValueMappingOptions options, List<ColumnBinding> bindings, long keyCount, FieldVector keyValues)
      throws ValueMappingException {
    return build(allocator, table, options, bindings, keyCount, keyValues);
  }

  private static ValueMappingTransformer build(BufferAllocator allocator, KeyValueTable table,
      ValueMappingOptions requested, List<ColumnBinding> bindings, long keyCount, FieldVector keyValues)
      throws ValueMappingException {
    ValueOrdinalIndex ordinals = null;
    try {
      ValueMappingOptions options = new ValueMappingOptions(requested);
      List<ColumnBinding> checked = checkBindings(bindings);
      Preconditions.checkArgument(options.isValuesAsKeyType() || (keyValues == null && keyCount < 0),
          "restored codes require values as key type");
      LookupIndex index = LookupIndex.build(table);
      if (options.isValuesAsKeyType()) {
        if (!table.isValueVector() && table.getValueKind().isUnsignedInteger()) {
          ordinals = ValueOrdinalIndex.passThrough(table, keyCount, keyValues);
        } else {
          Preconditions.checkArgument(keyValues == null && keyCount < 0,
              "explicit key counts need unsigned integer values, got %s", table.getValueKind());
          ordinals = ValueOrdinalIndex.assignOrdinals(table, allocator);
        }
      }
      ValueMappingTransformer transformer =
          new ValueMappingTransformer(allocator, table, index, ordinals, options, checked);
      logger.debug("Created value mapping over {} keys: {} -> {}{}{}, bindings {}",
          table.keyCount(), table.getKeyKind(), table.isValueVector() ? "vector of " : "", table.getValueKind(),
          ordinals == null ? "" : " as key type with key count " + Long.toUnsignedString(ordinals.getKeyCount()),
          checked);
      return transformer;
    } catch (ValueMappingException | RuntimeException e) {
      table.close();
      if (ordinals != null) {
        ordinals.close();
      } else if (keyValues != null) {
        keyValues.close();
      }
      throw e;
    }
  }

  private static List<ColumnBinding> checkBindings(List<ColumnBinding> bindings) {
    Preconditions.checkArgument(!bindings.isEmpty(), "at least one column binding is required");
    Set<String> outputs = new HashSet<>();
    for (ColumnBinding binding : bindings) {
      Preconditions.checkArgument(outputs.add(binding.getOutputColumn()),
          "output column '%s' is bound more than once", binding.getOutputColumn());
    }
    return Collections.unmodifiableList(new ArrayList<>(bindings));
  }

  private static FieldVector createDefaults(KeyValueTable table, BufferAllocator allocator) {
    if (table.isValueVector()) {
      ListVector defaults = KeyValueTable.createListVector("default", table.getValueKind(), allocator);
      defaults.allocateNew();
      defaults.startNewValue(0);
      defaults.endValue(0, 0);
      defaults.setValueCount(1);
      return defaults;
    }
    FieldVector defaults = table.getValueKind().createVector("default", allocator);
    defaults.allocateNew();
    table.getValueKind().setDefault(defaults, 0);
    defaults.setValueCount(1);
    return defaults;
  }

  /**
   * Resolves the output shape of every binding for an input schema, without reading any row.
   *
   * @param inputSchema the schema of the batches to map.
   * @return one shape per binding, in binding order.
   * @throws UnsupportedTypeException if an input column does not hold keys of the table's key type,
   *     or if both an input column and the values are vectors.
   */
  public List<OutputColumnShape> resolveShapes(Schema inputSchema) throws ValueMappingException {
    List<OutputColumnShape> shapes = new ArrayList<>(bindings.size());
    for (ColumnBinding binding : bindings) {
      shapes.add(resolve(inputField(inputSchema, binding), binding));
    }
    return shapes;
  }

  /**
   * Gets the schema of mapped batches: the input columns followed by the output columns. An output
   * column named like an input column takes that column's place.
   *
   * @param inputSchema the schema of the batches to map.
   * @return the output schema.
   */
  public Schema getOutputSchema(Schema inputSchema) throws ValueMappingException {
    Map<String, Field> fields = new LinkedHashMap<>();
    for (Field field : inputSchema.getFields()) {
      fields.put(field.getName(), field);
    }
    List<OutputColumnShape> shapes = resolveShapes(inputSchema);
    for (int i = 0; i < bindings.size(); i++) {
      String name = bindings.get(i).getOutputColumn();
      fields.put(name, shapes.get(i).toField(name, encoding));
    }
    return new Schema(new ArrayList<>(fields.values()), inputSchema.getCustomMetadata());
  }

  /**
   * Binds the transformer to an input schema.
   *
   * @param inputSchema the schema of the batches to map.
   * @return a mapper evaluating batches of that schema.
   */
  public ValueMapper bind(Schema inputSchema) throws ValueMappingException {
    checkOpen();
    ElementWriter writer = ordinals != null ?
        ElementWriter.writeCodes(ordinals) : ElementWriter.copyValues(table.getValues(), defaults);
    List<ColumnMapper> columns = new ArrayList<>(bindings.size());
    for (ColumnBinding binding : bindings) {
      Field inputField = inputField(inputSchema, binding);
      OutputColumnShape shape = resolve(inputField, binding);
      Field outputField = shape.toField(binding.getOutputColumn(), encoding);
      columns.add(ColumnMapper.create(binding, inputField, shape, outputField, index, writer));
    }
    return new ValueMapper(this, columns);
  }

  /**
   * Maps the bound columns of a record batch into caller-allocated vectors.
   *
   * @param batch the record batch.
   * @param outColumns one vector per binding, of the types in {@link #getOutputSchema(Schema)}.
   */
  public void evaluate(VectorSchemaRoot batch, List<FieldVector> outColumns) throws ValueMappingException {
    bind(batch.getSchema()).evaluate(batch, outColumns);
  }

  /**
   * Maps the bound columns of a record batch.
   *
   * @param batch the record batch.
   * @return a batch holding one mapped column per binding, allocated from the transformer's allocator
   *     and owned by the caller.
   */
  public VectorSchemaRoot evaluate(VectorSchemaRoot batch) throws ValueMappingException {
    return bind(batch.getSchema()).evaluate(batch, allocator);
  }

  private OutputColumnShape resolve(Field inputField, ColumnBinding binding) throws UnsupportedTypeException {
    return OutputShapeResolver.resolve(inputField, table.getKeyKind(), table.getValueKind(),
        table.isValueVector(), ordinals);
  }

  private static Field inputField(Schema inputSchema, ColumnBinding binding) throws UnsupportedTypeException {
    for (Field field : inputSchema.getFields()) {
      if (field.getName().equals(binding.getInputColumn())) {
        return field;
      }
    }
    throw new UnsupportedTypeException("Input column '" + binding.getInputColumn() + "' for output '" +
        binding.getOutputColumn() + "' is missing from " + inputSchema);
  }

  /**
   * Looks up a single key.
   *
   * @param key the key, as a Java value of the key kind (see {@link ScalarKind}).
   * @return the value (a list for vector values), its code as a {@link Long} in key-type mode,
   *     or the default of the output type when the key is missing.
   */
  public Object lookupValue(Object key) throws ValueMappingException {
    int slot = findSlot(key);
    if (ordinals != null) {
      return ordinals.codeOf(slot);
    }
    if (slot == LookupIndex.NOT_FOUND) {
      return table.isValueVector() ? Collections.emptyList() : table.getValueKind().defaultValue();
    }
    return table.getValue(slot);
  }

  private int findSlot(Object key) throws EvaluatorClosedException {
    checkOpen();
    Preconditions.checkNotNull(key, "key");
    ScalarKind keyKind = table.getKeyKind();
    try (FieldVector probeVector = keyKind.createVector("probe", allocator)) {
      probeVector.allocateNew();
      keyKind.set(probeVector, 0, key);
      probeVector.setValueCount(1);
      return index.newProbe().find((ElementAddressableVector) probeVector, 0);
    }
  }

  /**
   * Looks up the key-type code of a single key.
   *
   * @param key the key, as a Java value of the key kind.
   * @return the code, {@link ValueOrdinalIndex#MISSING_CODE} when the key is missing.
   * @throws IllegalStateException if values are not written as key type.
   */
  public long lookupCode(Object key) throws ValueMappingException {
    Preconditions.checkState(ordinals != null, "values are not mapped to key type");
    return ordinals.codeOf(findSlot(key));
  }

  /**
   * Gets the value a key-type code stands for.
   *
   * @param code the code.
   * @return the value (a list for vector values), or null for the missing code.
   * @throws IllegalStateException if the values behind the codes are unknown.
   */
  public Object decode(long code) throws ValueMappingException {
    checkOpen();
    Preconditions.checkState(ordinals != null && ordinals.hasKeyValues(), "no key values to decode with");
    if (code == ValueOrdinalIndex.MISSING_CODE) {
      return null;
    }
    Preconditions.checkArgument(code > 0 && code <= ordinals.getKeyValues().getValueCount(),
        "code %s is out of range", code);
    FieldVector keyValues = ordinals.getKeyValues();
    int position = (int) (code - 1);
    if (keyValues instanceof ListVector) {
      ListVector list = (ListVector) keyValues;
      List<Object> result = new ArrayList<>();
      for (int i = list.getElementStartIndex(position); i < list.getElementEndIndex(position); i++) {
        result.add(table.getValueKind().get(list.getDataVector(), i));
      }
      return result;
    }
    return table.getValueKind().get(keyValues, position);
  }

  /**
   * Decodes a vector of key-type codes back into values. Missing codes decode to null.
   *
   * <p>List-valued dictionaries are copied through the dictionary vector's shared reader, so
   * decoding over them is serialized on that vector.
   *
   * @param codes the codes, a flat vector of the code type.
   * @return the values, allocated from the codes' allocator and owned by the caller.
   */
  public ValueVector decode(ValueVector codes) throws ValueMappingException {
    checkOpen();
    Preconditions.checkState(dictionary != null, "no key values to decode with");
    if (dictionary.getVector() instanceof ListVector) {
      synchronized (dictionary.getVector()) {
        return DictionaryEncoder.decode(codes, dictionary);
      }
    }
    return DictionaryEncoder.decode(codes, dictionary);
  }

  @Override
  public Dictionary lookup(long id) {
    return dictionary != null && id == encoding.getId() ? dictionary : null;
  }

  @Override
  public Set<Long> getDictionaryIds() {
    return dictionary != null ? Collections.singleton(encoding.getId()) : Collections.emptySet();
  }

  /**
   * Gets the dictionary decoding key-type outputs, or null when the values behind the codes are unknown.
   */
  public Dictionary getDictionary() {
    return dictionary;
  }

  public KeyValueTable getTable() {
    return table;
  }

  public List<ColumnBinding> getBindings() {
    return bindings;
  }

  /**
   * Gets a copy of the options the transformer was built with.
   */
  public ValueMappingOptions getOptions() {
    return new ValueMappingOptions(options);
  }

  public boolean isValuesAsKeyType() {
    return ordinals != null;
  }

  /**
   * Gets the key-type codes, or null when values are written as they are.
   */
  public ValueOrdinalIndex getOrdinals() {
    return ordinals;
  }

  /**
   * Gets the distinct values behind the key-type codes, in code order, or null when unknown.
   */
  public FieldVector getKeyValues() {
    return ordinals == null ? null : ordinals.getKeyValues();
  }

  /**
   * Gets the encoding of key-type outputs, or null when values are written as they are.
   */
  public DictionaryEncoding getEncoding() {
    return encoding;
  }

  void checkOpen() throws EvaluatorClosedException {
    if (closed) {
      throw new EvaluatorClosedException();
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (dictionary != null) {
      dictionary.getVector().close();
    }
    if (ordinals != null) {
      ordinals.close();
    }
    if (defaults != null) {
      defaults.close();
    }
    table.close();
  }
}
