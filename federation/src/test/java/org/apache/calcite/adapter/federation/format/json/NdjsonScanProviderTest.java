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
package org.apache.calcite.adapter.federation.format.json;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.Rows;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link NdjsonScanProvider}.
 */
@Tag("unit")
public class NdjsonScanProviderTest {
  @TempDir
  Path tempDir;

  private Path write(String name, String... lines) throws IOException {
    return Files.write(tempDir.resolve(name),
        (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
  }

  private static NdjsonScanProvider provider(int inferRows, Path... paths) {
    ImmutableList.Builder<String> locations = ImmutableList.builder();
    for (Path path : paths) {
      locations.add(path.toString());
    }
    return new NdjsonScanProvider(LocationResolver.anonymous(), locations.build(), inferRows);
  }

  @Test void testInferSchema() throws IOException {
    Path file = write("a.json",
        "{\"id\": 1, \"name\": \"ann\", \"score\": 1, \"ok\": true}",
        "{\"id\": 2, \"name\": \"bob\", \"score\": 2.5, \"tags\": [1, 2]}");
    try (NdjsonScanProvider provider = provider(100, file)) {
      ScanSchema schema = provider.schema();
      assertEquals(ImmutableList.of("id", "name", "score", "ok", "tags"),
          schema.getFieldNames());
      assertEquals(SqlTypeName.BIGINT, schema.getColumn(0).getType());
      assertEquals(SqlTypeName.VARCHAR, schema.getColumn(1).getType());
      assertEquals(SqlTypeName.DOUBLE, schema.getColumn(2).getType());
      assertEquals(SqlTypeName.BOOLEAN, schema.getColumn(3).getType());
      assertEquals(SqlTypeName.VARCHAR, schema.getColumn(4).getType());

      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals(2, rows.size());
      assertArrayEquals(new Object[] {1L, "ann", 1.0d, true, null}, rows.get(0));
      assertArrayEquals(new Object[] {2L, "bob", 2.5d, null, "[1,2]"}, rows.get(1));
    }
  }

  @Test void testGzipAndListOfFiles() throws IOException {
    Path plain = write("a.json", "{\"id\": 1}");
    Path gz = tempDir.resolve("b.json.gz");
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(gz))) {
      out.write("{\"id\": 2}\n{\"id\": 3}\n".getBytes(StandardCharsets.UTF_8));
    }
    try (NdjsonScanProvider provider = provider(100, gz, plain)) {
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals(3, rows.size());
      assertEquals(2L, rows.get(0)[0]);
      assertEquals(3L, rows.get(1)[0]);
      assertEquals(1L, rows.get(2)[0]);
    }
  }

  @Test void testProjection() throws IOException {
    Path file = write("a.json", "{\"a\": 1, \"b\": \"x\", \"c\": false}");
    try (NdjsonScanProvider provider = provider(100, file)) {
      List<@Nullable Object[]> rows = Rows.of(provider, ScanRequest.of(new int[] {2, 0}));
      assertArrayEquals(new Object[] {false, 1L}, rows.get(0));
    }
  }

  @Test void testInferRowsBoundsSampling() throws IOException {
    Path file = write("a.json", "{\"v\": 1}", "{\"v\": \"text\"}");
    try (NdjsonScanProvider provider = provider(1, file)) {
      assertEquals(ScanSchema.of(ScanColumn.of("v", SqlTypeName.BIGINT)), provider.schema());
      FederationException e = assertThrows(FederationException.class,
          () -> Rows.of(provider));
      assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
    }
    try (NdjsonScanProvider provider = provider(2, file)) {
      assertEquals(SqlTypeName.VARCHAR, provider.schema().getColumn(0).getType());
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals("1", rows.get(0)[0]);
      assertEquals("text", rows.get(1)[0]);
    }
  }

  @Test void testMissingFieldIsNull() throws IOException {
    Path file = write("a.json", "{\"a\": 1, \"b\": 2}", "{\"a\": 3}");
    try (NdjsonScanProvider provider = provider(100, file)) {
      assertNull(Rows.of(provider).get(1)[1]);
    }
  }

  @Test void testMalformedJson() throws IOException {
    Path file = write("a.json", "{\"a\": 1}", "{\"a\": ");
    try (NdjsonScanProvider provider = provider(1, file)) {
      FederationException e = assertThrows(FederationException.class,
          () -> Rows.of(provider));
      assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
    }
  }

  @Test void testNonObjectRecord() throws IOException {
    Path file = write("a.json", "{\"a\": 1}", "[1, 2]");
    try (NdjsonScanProvider provider = provider(1, file)) {
      FederationException e = assertThrows(FederationException.class,
          () -> Rows.of(provider));
      assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
    }
  }

  @Test void testNoFields() throws IOException {
    Path file = write("a.json", "{}");
    try (NdjsonScanProvider provider = provider(100, file)) {
      FederationException e = assertThrows(FederationException.class, provider::schema);
      assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
    }
  }
}
