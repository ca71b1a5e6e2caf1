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
package org.apache.calcite.adapter.federation;

import org.apache.calcite.adapter.federation.connector.ConnectorRegistry;
import org.apache.calcite.adapter.federation.connector.ProviderKind;
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.options.ExternalOptions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ExternalTableCatalog}.
 */
@Tag("unit")
public class ExternalTableCatalogTest {
  @TempDir
  Path tempDir;

  private ExternalTableCatalog catalog;
  private ExternalOptions ndjsonOptions;

  @BeforeEach
  void setUp() throws IOException {
    catalog = new ExternalTableCatalog(new ConnectorRegistry(), new CredentialStore());
    Path file = Files.write(tempDir.resolve("events.json"),
        "{\"id\": 1}\n{\"id\": 2}\n".getBytes(StandardCharsets.UTF_8));
    ndjsonOptions = ExternalOptions.of(ImmutableMap.of("location", file.toString()));
  }

  @Test void testCreateAndLookup() {
    ExternalTableDescriptor descriptor = catalog.create("events", "NDJSON", ndjsonOptions, false);
    assertEquals("events", descriptor.getTableName());
    assertEquals(ProviderKind.NDJSON, descriptor.getKind());
    assertEquals(descriptor, catalog.lookup("events"));
    assertTrue(catalog.tables().containsKey("events"));
  }

  @Test void testDuplicateName() {
    catalog.create("events", "ndjson", ndjsonOptions, false);
    FederationException e = assertThrows(FederationException.class,
        () -> catalog.create("events", "ndjson", ndjsonOptions, false));
    assertEquals(ErrorKind.DUPLICATE_NAME, e.getKind());

    ExternalTableDescriptor replaced = catalog.create("events", "json",
        ndjsonOptions.with("infer_rows", 1L), true);
    assertEquals(1L, replaced.getOptions().getLong("infer_rows"));
    assertEquals(1, catalog.list().size());
  }

  @Test void testReservedName() {
    FederationException e = assertThrows(FederationException.class,
        () -> catalog.create(ExternalTableCatalog.CREDENTIALS_TABLE, "ndjson",
            ndjsonOptions, true));
    assertEquals(ErrorKind.DUPLICATE_NAME, e.getKind());
  }

  @Test void testFailedCreateLeavesNoTable() {
    FederationException unknown = assertThrows(FederationException.class,
        () -> catalog.create("t", "parquet", ndjsonOptions, false));
    assertEquals(ErrorKind.INVALID_OPTION, unknown.getKind());

    FederationException iceberg = assertThrows(FederationException.class,
        () -> catalog.create("t", "iceberg",
            ExternalOptions.of(ImmutableMap.of("location", tempDir.toString())), false));
    assertEquals(ErrorKind.NO_VALID_TABLE_AT_LOCATION, iceberg.getKind());
    assertTrue(catalog.list().isEmpty());
  }

  @Test void testListSorted() {
    catalog.create("zeta", "ndjson", ndjsonOptions, false);
    catalog.create("alpha", "ndjson", ndjsonOptions, false);
    assertEquals(ImmutableList.of("alpha", "zeta"),
        catalog.list().stream().map(ExternalTableDescriptor::getTableName)
            .collect(Collectors.toList()));
  }

  @Test void testDrop() {
    catalog.create("events", "ndjson", ndjsonOptions, false);
    assertTrue(catalog.drop("events", false));
    assertFalse(catalog.drop("events", true));
    FederationException e = assertThrows(FederationException.class,
        () -> catalog.drop("events", false));
    assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    FederationException lookup = assertThrows(FederationException.class,
        () -> catalog.lookup("events"));
    assertEquals(ErrorKind.NOT_FOUND, lookup.getKind());
  }
}
