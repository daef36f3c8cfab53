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
import io.valuemap.transform.evaluator.ValueMappingTransformer;
import io.valuemap.transform.exceptions.ValueMappingException;
import org.apache.arrow.memory.BufferAllocator;

/**
 * Reads one persisted layout of a value mapping.
 */
interface LayoutReader {

  /**
   * Reads a transformer from the start of a persisted stream.
   *
   * @param in the stream, positioned at its first byte.
   * @param allocator the allocator for the transformer.
   * @param bindings column bindings supplied by the caller, used when the layout does not store any.
   * @return the transformer, owned by the caller.
   */
  ValueMappingTransformer read(InputStream in, BufferAllocator allocator, List<ColumnBinding> bindings)
      throws IOException, ValueMappingException;
}
