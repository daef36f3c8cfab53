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

package io.valuemap.transform.ipc;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import io.valuemap.transform.evaluator.ColumnBinding;
import io.valuemap.transform.evaluator.ValueMappingOptions;
import io.valuemap.transform.evaluator.ValueMappingTransformer;
import io.valuemap.transform.exceptions.InvalidFormatException;
import io.valuemap.transform.exceptions.UnsupportedTypeException;
import io.valuemap.transform.exceptions.ValueMappingException;
import io.valuemap.transform.table.KeyValueTable;
import io.valuemap.transform.table.ScalarKind;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.util.TransferPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the layout of the older term lookup: a bare Arrow IPC stream with a {@code Term}
 * column of keys and a {@code Value} column of values.
 *
 * <p>A dictionary encoded {@code Value} column holds key-type values as 0-based indices into
 * its dictionary. Those are normalized to pass-through codes (index + 1), with the dictionary
 * size as key count and the dictionary entries as the values behind the codes.
 */
class LegacyTermLookupReader implements LayoutReader {
  private static final Logger logger = LoggerFactory.getLogger(LegacyTermLookupReader.class);

  static final String TERM_COLUMN = "Term";
  static final String VALUE_COLUMN = "Value";

  @Override
  public ValueMappingTransformer read(InputStream in, BufferAllocator allocator, List<ColumnBinding> bindings)
      throws IOException, ValueMappingException {
    if (bindings.isEmpty()) {
      throw new InvalidFormatException("A legacy term lookup does not store its columns; bindings are required");
    }
    byte[] bytes = in.readAllBytes();
    try (ArrowStreamReader reader = ValueMapCodec.openBatch(bytes, allocator, "Legacy term lookup")) {
      VectorSchemaRoot root = reader.getVectorSchemaRoot();
      FieldVector terms = root.getVector(TERM_COLUMN);
      FieldVector values = root.getVector(VALUE_COLUMN);
      if (terms == null || values == null) {
        throw new InvalidFormatException("Legacy term lookup lacks term or value column: " + root.getSchema());
      }

      DictionaryEncoding encoding = values.getField().getDictionary();
      if (encoding == null) {
        KeyValueTable table = createTable(allocator, terms, values);
        return ValueMappingTransformer.make(allocator, table, ValueMappingOptions.getDefault(), bindings);
      }
      Dictionary dictionary = reader.lookup(encoding.getId());
      if (dictionary == null) {
        throw new InvalidFormatException("Legacy term lookup lacks dictionary " + encoding.getId());
      }
      return readKeyTyped(allocator, terms, values, dictionary, bindings);
    }
  }

  private static KeyValueTable createTable(BufferAllocator allocator, FieldVector terms, FieldVector values)
      throws InvalidFormatException {
    try {
      return KeyValueTable.create(allocator, terms, values);
    } catch (UnsupportedTypeException | IllegalArgumentException e) {
      throw new InvalidFormatException("Legacy term lookup is not a valid key-value table", e);
    }
  }

  private static ValueMappingTransformer readKeyTyped(BufferAllocator allocator, FieldVector terms,
      FieldVector indices, Dictionary dictionary, List<ColumnBinding> bindings)
      throws ValueMappingException {
    FieldVector entries = dictionary.getVector();
    try {
      ScalarKind.fromArrowType(entries.getField().getType());
    } catch (UnsupportedTypeException e) {
      throw new InvalidFormatException("Unsupported legacy key value type", e);
    }
    int keyCount = entries.getValueCount();
    ScalarKind codeKind = dictionary.getEncoding().getIndexType().getBitWidth() == 64 ?
        ScalarKind.UINT64 : ScalarKind.UINT32;

    KeyValueTable table;
    try (FieldVector codes = codeKind.createVector(KeyValueTable.VALUE_COLUMN, allocator)) {
      codes.allocateNew();
      BaseIntVector stored = (BaseIntVector) indices;
      for (int i = 0; i < indices.getValueCount(); i++) {
        if (indices.isNull(i)) {
          throw new InvalidFormatException("Legacy key-type value at position " + i + " is null");
        }
        long index = stored.getValueAsLong(i);
        if (index < 0 || index >= keyCount) {
          throw new InvalidFormatException("Legacy key-type value " + index + " at position " + i +
              " is outside a dictionary of " + keyCount);
        }
        codeKind.set(codes, i, index + 1);
      }
      codes.setValueCount(indices.getValueCount());
      table = createTable(allocator, terms, codes);
    }

    TransferPair transfer = entries.getTransferPair(allocator);
    transfer.transfer();
    FieldVector keyValues = (FieldVector) transfer.getTo();
    logger.info("Normalized legacy term lookup over {} terms to key-type codes with key count {}",
        table.keyCount(), keyCount);
    ValueMappingOptions options = ValueMappingOptions.getDefault().withValuesAsKeyType(true)
        .withDictionaryId(dictionary.getEncoding().getId());
    return ValueMappingTransformer.restore(allocator, table, options, bindings, keyCount, keyValues);
  }
}
