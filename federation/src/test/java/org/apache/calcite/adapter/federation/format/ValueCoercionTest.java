/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.federation.format;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.sql.type.SqlTypeName;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ValueCoercion}.
 */
@Tag("unit")
public class ValueCoercionTest {
  @Test void testMerge() {
    assertEquals(SqlTypeName.DOUBLE, ValueCoercion.merge(SqlTypeName.BIGINT, SqlTypeName.DOUBLE));
    assertEquals(SqlTypeName.VARCHAR,
        ValueCoercion.merge(SqlTypeName.BIGINT, SqlTypeName.BOOLEAN));
    assertEquals(SqlTypeName.BIGINT, ValueCoercion.merge(null, SqlTypeName.BIGINT));
    assertEquals(SqlTypeName.VARCHAR, ValueCoercion.finish(null));
  }

  @Test void testDoubleAsVarcharIsPlain() {
    ScanColumn column = ScanColumn.of("v", SqlTypeName.VARCHAR);
    assertEquals("10000000000", ValueCoercion.coerce(1.0E10, column));
    assertEquals("0.0001", ValueCoercion.coerce(1.0E-4, column));
    assertEquals("2.5", ValueCoercion.coerce(2.5, column));
    assertEquals("Infinity", ValueCoercion.coerce(Double.POSITIVE_INFINITY, column));
    assertEquals("abc", ValueCoercion.coerce("abc", column));
    assertNull(ValueCoercion.coerce(null, column));
  }

  @Test void testIntegralDoubleAsBigint() {
    ScanColumn column = ScanColumn.of("v", SqlTypeName.BIGINT);
    assertEquals(3L, ValueCoercion.coerce(3.0, column));
    FederationException e = assertThrows(FederationException.class,
        () -> ValueCoercion.coerce(3.5, column));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
  }
}
