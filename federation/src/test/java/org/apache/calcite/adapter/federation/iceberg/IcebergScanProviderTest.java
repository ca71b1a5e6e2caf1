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
package org.apache.calcite.adapter.federation.iceberg;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.Rows;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.apache.hadoop.conf.Configuration;
import org.apache.iceberg.DataFile;
import org.apache.iceberg.DataFiles;
import org.apache.iceberg.FileFormat;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Schema;
import org.apache.iceberg.Table;
import org.apache.iceberg.TableProperties;
import org.apache.iceberg.data.GenericRecord;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.data.parquet.GenericParquetWriter;
import org.apache.iceberg.hadoop.HadoopTables;
import org.apache.iceberg.io.FileAppender;
import org.apache.iceberg.io.OutputFile;
import org.apache.iceberg.parquet.Parquet;
import org.apache.iceberg.types.Types;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the Iceberg scan, snapshot and data file providers over a table
 * written with {@link HadoopTables}.
 */
@Tag("unit")
public class IcebergScanProviderTest {
  private static final Schema SCHEMA = new Schema(
      Types.NestedField.required(1, "id", Types.LongType.get()),
      Types.NestedField.optional(2, "name", Types.StringType.get()));

  @TempDir
  Path tempDir;

  private String location;
  private long firstSnapshot;
  private long secondSnapshot;

  @BeforeEach void createTable() throws IOException {
    location = tempDir.resolve("events").toString();
    Table table = new HadoopTables(new Configuration()).create(SCHEMA,
        PartitionSpec.unpartitioned(),
        ImmutableMap.of(TableProperties.PARQUET_COMPRESSION, "uncompressed"), location);
    append(table, "a", record(1L, "one"), record(2L, "two"));
    firstSnapshot = table.currentSnapshot().snapshotId();
    append(table, "b", record(3L, null));
    secondSnapshot = table.currentSnapshot().snapshotId();
  }

  private static Record record(long id, @Nullable String name) {
    Record record = GenericRecord.create(SCHEMA);
    record.setField("id", id);
    record.setField("name", name);
    return record;
  }

  private void append(Table table, String name, Record... records) throws IOException {
    OutputFile out = table.io().newOutputFile(location + "/data/" + name + ".parquet");
    FileAppender<Record> appender = Parquet.write(out)
        .forTable(table)
        .createWriterFunc(GenericParquetWriter::buildWriter)
        .build();
    try {
      for (Record record : records) {
        appender.add(record);
      }
    } finally {
      appender.close();
    }
    DataFile dataFile = DataFiles.builder(PartitionSpec.unpartitioned())
        .withInputFile(out.toInputFile())
        .withMetrics(appender.metrics())
        .withFormat(FileFormat.PARQUET)
        .build();
    table.newAppend().appendFile(dataFile).commit();
  }

  private static List<@Nullable Object[]> sortedById(List<@Nullable Object[]> rows) {
    List<@Nullable Object[]> sorted = new ArrayList<>(rows);
    sorted.sort(Comparator.comparing(row -> (Long) row[0]));
    return sorted;
  }

  @Test void testScanCurrentSnapshot() {
    try (IcebergScanProvider provider =
             new IcebergScanProvider(LocationResolver.anonymous(), location, null)) {
      ScanSchema schema = provider.schema();
      assertEquals(ImmutableList.of("id", "name"), schema.getFieldNames());
      assertEquals(SqlTypeName.BIGINT, schema.getColumn(0).getType());
      assertEquals(SqlTypeName.VARCHAR, schema.getColumn(1).getType());

      List<@Nullable Object[]> rows = sortedById(Rows.of(provider));
      assertEquals(3, rows.size());
      assertArrayEquals(new Object[] {1L, "one"}, rows.get(0));
      assertArrayEquals(new Object[] {3L, null}, rows.get(2));
    }
  }

  @Test void testScanOlderSnapshot() {
    try (IcebergScanProvider provider =
             new IcebergScanProvider(LocationResolver.anonymous(), location, firstSnapshot)) {
      assertEquals(2, Rows.of(provider).size());
    }
  }

  @Test void testProjection() {
    try (IcebergScanProvider provider =
             new IcebergScanProvider(LocationResolver.anonymous(), location, null)) {
      List<@Nullable Object[]> rows = Rows.of(provider, ScanRequest.of(new int[] {1}));
      assertEquals(3, rows.size());
      for (Object[] row : rows) {
        assertEquals(1, row.length);
      }
    }
  }

  @Test void testUnknownSnapshot() {
    try (IcebergScanProvider provider =
             new IcebergScanProvider(LocationResolver.anonymous(), location, 42L)) {
      FederationException e = assertThrows(FederationException.class,
          () -> Rows.of(provider));
      assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    }
  }

  @Test void testSnapshots() {
    try (IcebergSnapshotsProvider provider =
             new IcebergSnapshotsProvider(LocationResolver.anonymous(), location)) {
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals(2, rows.size());
      assertEquals(firstSnapshot, rows.get(0)[0]);
      assertNull(rows.get(0)[1]);
      assertEquals(secondSnapshot, rows.get(1)[0]);
      assertEquals(firstSnapshot, rows.get(1)[1]);
      assertEquals("append", rows.get(1)[4]);
      assertTrue(((String) rows.get(1)[6]).contains("added-records"));
    }
  }

  @Test void testDataFiles() {
    try (IcebergDataFilesProvider provider =
             new IcebergDataFilesProvider(LocationResolver.anonymous(), location, null)) {
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals(2, rows.size());
      long records = 0;
      for (Object[] row : rows) {
        assertEquals(secondSnapshot, row[0]);
        assertEquals("PARQUET", row[3]);
        records += (Long) row[5];
      }
      assertEquals(3L, records);
    }
    try (IcebergDataFilesProvider provider =
             new IcebergDataFilesProvider(LocationResolver.anonymous(), location, firstSnapshot)) {
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals(1, rows.size());
      assertTrue(((String) rows.get(0)[2]).endsWith("a.parquet"));
      assertEquals(2L, rows.get(0)[5]);
    }
  }

  @Test void testLocationWithoutMetadata() throws IOException {
    Path empty = Files.createDirectory(tempDir.resolve("empty"));
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      FederationException e = assertThrows(FederationException.class,
          () -> IcebergTableLoader.load(resolver, empty.toString()));
      assertEquals(ErrorKind.NO_VALID_TABLE_AT_LOCATION, e.getKind());
    }
  }

  @Test void testLoadFromMetadataFile() {
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      Table table = IcebergTableLoader.load(resolver, location + "/metadata/v2.metadata.json");
      assertEquals(firstSnapshot, table.currentSnapshot().snapshotId());
    }
  }

  @Test void testMetadataVersion() {
    assertEquals(12L, IcebergTableLoader.version("v12.metadata.json"));
    assertEquals(3L, IcebergTableLoader.version("00003-6b4a.metadata.json"));
    assertEquals(-1L, IcebergTableLoader.version("version-hint.text"));
  }
}
