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
package org.apache.calcite.adapter.federation.ddl;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DdlParser}.
 */
@Tag("unit")
public class DdlParserTest {

  @Test void testCreateCredential() {
    DdlStatement statement = DdlParser.parse("CREATE CREDENTIAL aws1 PROVIDER aws OPTIONS ("
        + "access_key_id = 'AKIA', secret_access_key => 'secret') COMMENT 'prod keys';");
    DdlStatement.CreateCredential create =
        assertInstanceOf(DdlStatement.CreateCredential.class, statement);
    assertEquals("aws1", create.getName());
    assertEquals("aws", create.getProvider());
    assertFalse(create.isReplace());
    assertEquals("AKIA", create.getOptions().getString("access_key_id"));
    assertEquals("prod keys", create.getComment());
    assertFalse(create.toString().contains("secret"));
  }

  @Test void testCreateOrReplaceCredentials() {
    DdlStatement.CreateCredential create = assertInstanceOf(
        DdlStatement.CreateCredential.class,
        DdlParser.parse("create or replace credentials \"My Key\" provider gcp "
            + "options (service_account_key = '{}')"));
    assertTrue(create.isReplace());
    assertEquals("My Key", create.getName());
    assertNull(create.getComment());
  }

  @Test void testCreateExternalTable() {
    DdlStatement.CreateExternalTable create = assertInstanceOf(
        DdlStatement.CreateExternalTable.class,
        DdlParser.parse("CREATE EXTERNAL TABLE events FROM ndjson "
            + "OPTIONS (location = ['/a.json', '/b.json'], infer_rows = 10)"));
    assertEquals("events", create.getName());
    assertEquals("ndjson", create.getProvider());
    assertEquals(10L, create.getOptions().getLong("infer_rows"));
    assertEquals(2, create.getOptions().getStringList("location").size());
  }

  @Test void testDrop() {
    DdlStatement.DropCredential dropCredential = assertInstanceOf(
        DdlStatement.DropCredential.class, DdlParser.parse("DROP CREDENTIAL IF EXISTS aws1"));
    assertTrue(dropCredential.isIfExists());
    assertEquals("aws1", dropCredential.getName());

    DdlStatement.DropExternalTable dropTable = assertInstanceOf(
        DdlStatement.DropExternalTable.class, DdlParser.parse("drop external table events"));
    assertFalse(dropTable.isIfExists());
  }

  @Test void testAccepts() {
    assertTrue(DdlParser.accepts("CREATE CREDENTIAL x PROVIDER aws"));
    assertTrue(DdlParser.accepts("create or replace external table t from iceberg"));
    assertTrue(DdlParser.accepts("DROP EXTERNAL TABLE t"));
    assertFalse(DdlParser.accepts("SELECT 1"));
    assertFalse(DdlParser.accepts("CREATE TABLE t (x INT)"));
    assertFalse(DdlParser.accepts(""));
  }

  @Test void testParseErrors() {
    FederationException e = assertThrows(FederationException.class,
        () -> DdlParser.parse("CREATE CREDENTIAL x aws"));
    assertEquals(ErrorKind.PARSE_ERROR, e.getKind());

    e = assertThrows(FederationException.class,
        () -> DdlParser.parse("DROP EXTERNAL TABLE t extra"));
    assertEquals(ErrorKind.PARSE_ERROR, e.getKind());

    e = assertThrows(FederationException.class,
        () -> DdlParser.parse("CREATE EXTERNAL TABLE t FROM ndjson OPTIONS (location = 'x'"));
    assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
  }
}
