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

package io.valuemap.transform.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.valuemap.transform.exceptions.UnsupportedTypeException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestScalarKind {

  private BufferAllocator allocator;

  @BeforeEach
  public void init() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  public void terminate() {
    allocator.close();
  }

  @Test
  public void testFromArrowType() throws Exception {
    assertEquals(ScalarKind.INT32, ScalarKind.fromArrowType(new ArrowType.Int(32, true)));
    assertEquals(ScalarKind.UINT32, ScalarKind.fromArrowType(new ArrowType.Int(32, false)));
    assertEquals(ScalarKind.UINT64, ScalarKind.fromArrowType(new ArrowType.Int(64, false)));
    assertEquals(ScalarKind.FLOAT32,
        ScalarKind.fromArrowType(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE)));
    assertEquals(ScalarKind.FLOAT64,
        ScalarKind.fromArrowType(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)));
    assertEquals(ScalarKind.TEXT, ScalarKind.fromArrowType(ArrowType.Utf8.INSTANCE));

    assertThrows(UnsupportedTypeException.class, () -> ScalarKind.fromArrowType(new ArrowType.Int(64, true)));
    assertThrows(UnsupportedTypeException.class, () -> ScalarKind.fromArrowType(ArrowType.Binary.INSTANCE));
    assertThrows(UnsupportedTypeException.class, () -> ScalarKind.fromArrowType(ArrowType.List.INSTANCE));
  }

  @Test
  public void testTags() throws Exception {
    for (ScalarKind kind : ScalarKind.values()) {
      assertEquals(kind, ScalarKind.fromTag(kind.getTag()));
    }
    assertThrows(UnsupportedTypeException.class, () -> ScalarKind.fromTag((byte) 0));
    assertThrows(UnsupportedTypeException.class, () -> ScalarKind.fromTag((byte) 42));
  }

  @Test
  public void testDefaults() {
    assertEquals(0, ScalarKind.INT32.defaultValue());
    assertEquals(0L, ScalarKind.UINT32.defaultValue());
    assertEquals(0L, ScalarKind.UINT64.defaultValue());
    assertEquals(0f, ScalarKind.FLOAT32.defaultValue());
    assertEquals(0d, ScalarKind.FLOAT64.defaultValue());
    assertEquals("", ScalarKind.TEXT.defaultValue());

    assertTrue(ScalarKind.UINT32.isUnsignedInteger());
    assertTrue(ScalarKind.UINT64.isUnsignedInteger());
    assertFalse(ScalarKind.INT32.isUnsignedInteger());
    assertFalse(ScalarKind.TEXT.isUnsignedInteger());
  }

  @Test
  public void testUnsignedValues() {
    try (FieldVector vector = ScalarKind.UINT32.createVector("v", allocator)) {
      vector.allocateNew();
      ScalarKind.UINT32.set(vector, 0, 4_000_000_000L);
      ScalarKind.UINT32.set(vector, 1, 7);
      vector.setValueCount(2);

      assertEquals(4_000_000_000L, ScalarKind.UINT32.get(vector, 0));
      assertEquals(7L, ScalarKind.UINT32.get(vector, 1));
      assertThrows(IllegalArgumentException.class, () -> ScalarKind.UINT32.set(vector, 2, -1L));
      assertThrows(IllegalArgumentException.class, () -> ScalarKind.UINT32.set(vector, 2, 1L << 32));
    }

    try (FieldVector vector = ScalarKind.UINT64.createVector("v", allocator)) {
      vector.allocateNew();
      ScalarKind.UINT64.set(vector, 0, -1L);
      vector.setValueCount(1);
      assertEquals("18446744073709551615", Long.toUnsignedString((Long) ScalarKind.UINT64.get(vector, 0)));
    }
  }

  @Test
  public void testText() {
    try (FieldVector vector = ScalarKind.TEXT.createVector("v", allocator)) {
      vector.allocateNew();
      ScalarKind.TEXT.set(vector, 0, "café");
      ScalarKind.TEXT.setDefault(vector, 1);
      vector.setValueCount(2);

      assertEquals(ArrowType.Utf8.INSTANCE, vector.getField().getType());
      assertEquals("café", ScalarKind.TEXT.get(vector, 0));
      assertEquals("", ScalarKind.TEXT.get(vector, 1));
      assertFalse(vector.isNull(1));
    }
  }
}
