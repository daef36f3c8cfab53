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

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import io.valuemap.transform.dictionary.ValueOrdinalIndex;
import io.valuemap.transform.evaluator.ColumnBinding;
import io.valuemap.transform.evaluator.ValueMappingOptions;
import io.valuemap.transform.evaluator.ValueMappingTransformer;
import io.valuemap.transform.exceptions.InvalidFormatException;
import io.valuemap.transform.exceptions.UnsupportedTypeException;
import io.valuemap.transform.exceptions.ValueMappingException;
import io.valuemap.transform.table.KeyValueTable;
import io.valuemap.transform.table.ScalarKind;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.util.TransferPair;

/**
 * Reads the layout written by {@link ValueMapCodec#save}.
 */
class CurrentLayoutReader implements LayoutReader {

  @Override
  public ValueMappingTransformer read(InputStream in, BufferAllocator allocator, List<ColumnBinding> bindings)
      throws IOException, ValueMappingException {
    DataInputStream data = new DataInputStream(in);
    Header header;
    try {
      header = readHeader(data);
    } catch (EOFException e) {
      throw new InvalidFormatException("Value mapping header is truncated", e);
    }

    KeyValueTable table = readTable(data, allocator);
    FieldVector keyValues = null;
    try {
      header.check(table);
      if (readFlag(data)) {
        if (header.explicitKeyCount < 0) {
          throw new InvalidFormatException("Key values are stored for a mapping without pass-through codes");
        }
        keyValues = readKeyValues(data, allocator);
      }
    } catch (IOException | ValueMappingException | RuntimeException e) {
      table.close();
      if (keyValues != null) {
        keyValues.close();
      }
      throw e;
    }

    ValueMappingOptions options = ValueMappingOptions.getDefault()
        .withValuesAsKeyType(header.keyTypeMode)
        .withDictionaryId(header.dictionaryId);
    if (header.explicitKeyCount >= 0 || keyValues != null) {
      return ValueMappingTransformer.restore(allocator, table, options, header.bindings,
          header.explicitKeyCount, keyValues);
    }
    return ValueMappingTransformer.make(allocator, table, options, header.bindings);
  }

  private static Header readHeader(DataInputStream data) throws IOException, InvalidFormatException {
    int magic = data.readInt();
    if (magic != ValueMapCodec.MAGIC) {
      throw new InvalidFormatException("Not a value mapping: header 0x" + Integer.toHexString(magic));
    }
    int version = data.readInt();
    if (version != ValueMapCodec.VERSION) {
      throw new InvalidFormatException("Unsupported value mapping layout version " + version);
    }
    Header header = new Header();
    try {
      header.keyKind = ScalarKind.fromTag(data.readByte());
      header.valueKind = ScalarKind.fromTag(data.readByte());
    } catch (UnsupportedTypeException e) {
      throw new InvalidFormatException("Unknown type tag in value mapping header", e);
    }
    header.valueVector = data.readBoolean();
    header.keyCount = data.readInt();
    header.keyTypeMode = data.readBoolean();
    header.dictionaryId = data.readLong();
    header.explicitKeyCount = data.readLong();
    if (header.explicitKeyCount >= 0 && !header.keyTypeMode) {
      throw new InvalidFormatException("Key count " + header.explicitKeyCount +
          " is stored for a mapping without key-type values");
    }
    int bindingCount = data.readInt();
    if (bindingCount <= 0) {
      throw new InvalidFormatException("Invalid column binding count " + bindingCount);
    }
    header.bindings = new ArrayList<>(bindingCount);
    for (int i = 0; i < bindingCount; i++) {
      String output = data.readUTF();
      String input = data.readUTF();
      header.bindings.add(ColumnBinding.of(output, input));
    }
    return header;
  }

  private static boolean readFlag(DataInputStream data) throws IOException, InvalidFormatException {
    try {
      return data.readBoolean();
    } catch (EOFException e) {
      throw new InvalidFormatException("Value mapping is truncated after the stored table", e);
    }
  }

  private static KeyValueTable readTable(DataInputStream data, BufferAllocator allocator)
      throws IOException, ValueMappingException {
    try (ArrowStreamReader reader = openStream(data, allocator, "Stored table")) {
      VectorSchemaRoot root = reader.getVectorSchemaRoot();
      if (root.getVector(KeyValueTable.KEY_COLUMN) == null || root.getVector(KeyValueTable.VALUE_COLUMN) == null) {
        throw new InvalidFormatException("Stored table lacks key or value column: " + root.getSchema());
      }
      try {
        return KeyValueTable.create(allocator, root, KeyValueTable.KEY_COLUMN, KeyValueTable.VALUE_COLUMN);
      } catch (UnsupportedTypeException | IllegalArgumentException e) {
        throw new InvalidFormatException("Stored table is not a valid key-value table", e);
      }
    }
  }

  private static FieldVector readKeyValues(DataInputStream data, BufferAllocator allocator)
      throws IOException, ValueMappingException {
    try (ArrowStreamReader reader = openStream(data, allocator, "Stored key values")) {
      FieldVector stored = reader.getVectorSchemaRoot().getVector(ValueOrdinalIndex.KEY_VALUES_COLUMN);
      if (stored == null) {
        throw new InvalidFormatException("Stored key values lack column " + ValueOrdinalIndex.KEY_VALUES_COLUMN);
      }
      TransferPair transfer = stored.getTransferPair(allocator);
      transfer.transfer();
      return (FieldVector) transfer.getTo();
    }
  }

  /**
   * Reads the next length-prefixed Arrow stream and loads its single batch.
   */
  private static ArrowStreamReader openStream(DataInputStream data, BufferAllocator allocator, String section)
      throws IOException, InvalidFormatException {
    byte[] bytes;
    try {
      int length = data.readInt();
      if (length < 0) {
        throw new InvalidFormatException("Invalid length " + length + " of " + section);
      }
      bytes = new byte[length];
      data.readFully(bytes);
    } catch (EOFException e) {
      throw new InvalidFormatException(section + " is truncated", e);
    }
    return ValueMapCodec.openBatch(bytes, allocator, section);
  }

  private static final class Header {
    ScalarKind keyKind;
    ScalarKind valueKind;
    boolean valueVector;
    int keyCount;
    boolean keyTypeMode;
    long dictionaryId;
    long explicitKeyCount;
    List<ColumnBinding> bindings;

    void check(KeyValueTable table) throws InvalidFormatException {
      if (table.getKeyKind() != keyKind || table.getValueKind() != valueKind ||
          table.isValueVector() != valueVector || table.keyCount() != keyCount) {
        throw new InvalidFormatException(String.format(
            "Header describes %s keys %s -> %s%s, but the stored table holds %s keys %s -> %s%s",
            keyCount, keyKind, valueVector ? "vector of " : "", valueKind,
            table.keyCount(), table.getKeyKind(), table.isValueVector() ? "vector of " : "", table.getValueKind()));
      }
      if (explicitKeyCount >= 0 && (valueVector || !valueKind.isUnsignedInteger())) {
        throw new InvalidFormatException("Key count " + explicitKeyCount + " is stored for " + valueKind +
            " values, which are not used as codes");
      }
    }
  }
}
