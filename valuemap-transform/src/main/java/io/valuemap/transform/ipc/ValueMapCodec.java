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

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.util.Collections;
import java.util.List;

import io.valuemap.transform.dictionary.ValueOrdinalIndex;
import io.valuemap.transform.evaluator.ColumnBinding;
import io.valuemap.transform.evaluator.ValueMappingTransformer;
import io.valuemap.transform.exceptions.InvalidFormatException;
import io.valuemap.transform.exceptions.ValueMappingException;
import io.valuemap.transform.table.KeyValueTable;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.ipc.ReadChannel;
import org.apache.arrow.vector.ipc.message.MessageMetadataResult;
import org.apache.arrow.vector.ipc.message.MessageSerializer;
import org.apache.arrow.vector.types.pojo.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves and loads value mappings.
 *
 * <p>The current layout is a small binary header written with {@link DataOutputStream}
 * followed by length-prefixed Arrow IPC streams holding the table and, for pass-through
 * key-type codes, the values behind the codes:
 *
 * <pre>
 * magic "VMAP" | int version | byte keyKind | byte valueKind | bool valueVector | int keyCount
 * | bool keyTypeMode | long dictionaryId | long explicitKeyCount (-1 if derived)
 * | int bindingCount | (UTF output, UTF input)*
 * | int length | Arrow IPC stream (Key, Value)
 * | bool hasKeyValues | [int length | Arrow IPC stream (KeyValues)]
 * </pre>
 *
 * <p>Loading also accepts the layout of the older term lookup: a bare Arrow IPC stream with a
 * {@code Term} and a {@code Value} column. The layout is detected from the first four bytes.
 */
public final class ValueMapCodec {
  private static final Logger logger = LoggerFactory.getLogger(ValueMapCodec.class);

  /**
   * "VMAP" in ASCII.
   */
  public static final int MAGIC = 0x564D4150;

  public static final int VERSION = 1;

  /**
   * First four bytes of an Arrow IPC stream.
   */
  static final int IPC_CONTINUATION_MARKER = 0xFFFFFFFF;

  private static final int PROBE_LENGTH = 4;

  private ValueMapCodec() {
  }

  /**
   * Writes a transformer in the current layout. The stream is flushed, not closed.
   *
   * @param transformer the transformer.
   * @param out the stream to write to.
   */
  public static void save(ValueMappingTransformer transformer, OutputStream out) throws IOException {
    KeyValueTable table = transformer.getTable();
    ValueOrdinalIndex ordinals = transformer.getOrdinals();
    boolean passThrough = ordinals != null && ordinals.isPassThrough();
    DataOutputStream data = new DataOutputStream(out);

    data.writeInt(MAGIC);
    data.writeInt(VERSION);
    data.writeByte(table.getKeyKind().getTag());
    data.writeByte(table.getValueKind().getTag());
    data.writeBoolean(table.isValueVector());
    data.writeInt(table.keyCount());
    data.writeBoolean(ordinals != null);
    data.writeLong(transformer.getEncoding() != null ? transformer.getEncoding().getId() : 0L);
    data.writeLong(passThrough ? ordinals.getKeyCount() : -1L);
    data.writeInt(transformer.getBindings().size());
    for (ColumnBinding binding : transformer.getBindings()) {
      data.writeUTF(binding.getOutputColumn());
      data.writeUTF(binding.getInputColumn());
    }

    writeStream(data, table.asRecordBatch());
    boolean hasKeyValues = passThrough && ordinals.hasKeyValues();
    data.writeBoolean(hasKeyValues);
    if (hasKeyValues) {
      FieldVector keyValues = ordinals.getKeyValues();
      Field field = new Field(ValueOrdinalIndex.KEY_VALUES_COLUMN, keyValues.getField().getFieldType(),
          keyValues.getField().getChildren());
      writeStream(data, new VectorSchemaRoot(Collections.singletonList(field),
          Collections.singletonList(keyValues), keyValues.getValueCount()));
    }
    data.flush();
    logger.debug("Saved value mapping over {} keys", table.keyCount());
  }

  /**
   * Reads a transformer saved in the current layout.
   *
   * @param in the stream to read from.
   * @param allocator the allocator for the transformer.
   * @return the transformer, owned by the caller.
   * @throws InvalidFormatException if the stream is not a persisted value mapping, or is a legacy
   *     term lookup, which does not store its columns.
   */
  public static ValueMappingTransformer load(InputStream in, BufferAllocator allocator)
      throws IOException, ValueMappingException {
    return load(in, allocator, Collections.emptyList());
  }

  /**
   * Reads a transformer saved in the current layout or in the legacy term lookup layout.
   *
   * @param in the stream to read from.
   * @param allocator the allocator for the transformer.
   * @param legacyBindings the columns to map when the stream holds a legacy term lookup; ignored
   *     for the current layout, which stores its own.
   * @return the transformer, owned by the caller.
   * @throws InvalidFormatException if the stream is not a persisted value mapping.
   */
  public static ValueMappingTransformer load(InputStream in, BufferAllocator allocator,
      List<ColumnBinding> legacyBindings) throws IOException, ValueMappingException {
    Preconditions.checkNotNull(legacyBindings, "legacyBindings");
    InputStream buffered = in.markSupported() ? in : new BufferedInputStream(in);
    buffered.mark(PROBE_LENGTH);
    int marker;
    try {
      marker = new DataInputStream(buffered).readInt();
    } catch (EOFException e) {
      throw new InvalidFormatException("Stream is too short to hold a value mapping", e);
    }
    buffered.reset();
    return probe(marker).read(buffered, allocator, legacyBindings);
  }

  static LayoutReader probe(int marker) throws InvalidFormatException {
    if (marker == MAGIC) {
      logger.debug("Reading value mapping in layout version {}", VERSION);
      return new CurrentLayoutReader();
    } else if (marker == IPC_CONTINUATION_MARKER) {
      logger.debug("Reading legacy term lookup");
      return new LegacyTermLookupReader();
    }
    throw new InvalidFormatException("Unrecognized value mapping header 0x" + Integer.toHexString(marker));
  }

  /**
   * Opens an Arrow IPC stream held in memory and loads its first batch. A stream that cannot
   * be decoded is reported as an {@link InvalidFormatException}.
   *
   * @param bytes the stream.
   * @param allocator the allocator for the batch.
   * @param section what the stream holds, for error messages.
   * @return the reader positioned on the batch, to be closed by the caller.
   */
  static ArrowStreamReader openBatch(byte[] bytes, BufferAllocator allocator, String section)
      throws IOException, InvalidFormatException {
    checkFraming(bytes, section);
    ArrowStreamReader reader = new ArrowStreamReader(new ByteArrayInputStream(bytes), allocator);
    boolean loaded;
    try {
      loaded = reader.loadNextBatch();
    } catch (IOException | RuntimeException e) {
      reader.close();
      throw new InvalidFormatException(section + " is not a readable Arrow stream", e);
    }
    if (!loaded) {
      reader.close();
      throw new InvalidFormatException(section + " holds no record batch");
    }
    return reader;
  }

  /**
   * Walks the messages of an in-memory IPC stream without allocating their bodies. Arrow does
   * not release a body buffer it cannot fill, so truncated streams are rejected here first.
   */
  private static void checkFraming(byte[] bytes, String section) throws InvalidFormatException {
    ByteArrayInputStream in = new ByteArrayInputStream(bytes);
    ReadChannel channel = new ReadChannel(Channels.newChannel(in));
    try {
      MessageMetadataResult message;
      while ((message = MessageSerializer.readMessage(channel)) != null) {
        long bodyLength = message.getMessageBodyLength();
        if (bodyLength < 0 || bodyLength > in.available()) {
          throw new InvalidFormatException(section + " is truncated: message body of " + bodyLength +
              " bytes, " + in.available() + " left");
        }
        in.skip(bodyLength);
      }
    } catch (IOException | RuntimeException e) {
      throw new InvalidFormatException(section + " is not a readable Arrow stream", e);
    }
  }

  private static void writeStream(DataOutputStream data, VectorSchemaRoot root) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ArrowStreamWriter writer = new ArrowStreamWriter(root, null, bytes)) {
      writer.start();
      writer.writeBatch();
      writer.end();
    }
    data.writeInt(bytes.size());
    bytes.writeTo(data);
  }
}
