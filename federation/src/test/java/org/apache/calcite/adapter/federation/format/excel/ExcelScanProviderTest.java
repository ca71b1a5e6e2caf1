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
package org.apache.calcite.adapter.federation.format.excel;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.Rows;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;

import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ExcelScanProvider} over workbooks built with POI.
 */
@Tag("unit")
public class ExcelScanProviderTest {
  @TempDir
  Path tempDir;

  private Path writeWorkbook(String name, Workbook workbook) throws IOException {
    Path path = tempDir.resolve(name);
    try (Workbook wb = workbook; OutputStream out = Files.newOutputStream(path)) {
      wb.write(out);
    }
    return path;
  }

  private Path numbersWorkbook(int dataRows) throws IOException {
    XSSFWorkbook workbook = new XSSFWorkbook();
    Sheet sheet = workbook.createSheet("numbers");
    Row header = sheet.createRow(0);
    header.createCell(0).setCellValue("id");
    header.createCell(1).setCellValue("label");
    for (int i = 1; i <= dataRows; i++) {
      Row row = sheet.createRow(i);
      row.createCell(0).setCellValue(i);
      row.createCell(1).setCellValue("row " + i);
    }
    return writeWorkbook("numbers.xlsx", workbook);
  }

  private static ExcelScanProvider provider(Path path, @Nullable String sheet,
      boolean hasHeader) {
    return new ExcelScanProvider(LocationResolver.anonymous(), path.toString(), sheet,
        hasHeader, ExcelReader.DEFAULT_INFER_ROWS);
  }

  @Test void testHeaderRowCount() throws IOException {
    Path path = numbersWorkbook(1000);
    try (ExcelScanProvider provider = provider(path, null, true)) {
      ScanSchema schema = provider.schema();
      assertEquals(ImmutableList.of("id", "label"), schema.getFieldNames());
      assertEquals(SqlTypeName.BIGINT, schema.getColumn(0).getType());
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals(1000, rows.size());
      assertArrayEquals(new Object[] {1L, "row 1"}, rows.get(0));
      assertArrayEquals(new Object[] {1000L, "row 1000"}, rows.get(999));
    }
    try (ExcelScanProvider provider = provider(path, null, false)) {
      assertEquals(ImmutableList.of("col1", "col2"), provider.schema().getFieldNames());
      assertEquals(SqlTypeName.VARCHAR, provider.schema().getColumn(0).getType());
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertEquals(1001, rows.size());
      assertArrayEquals(new Object[] {"id", "label"}, rows.get(0));
      assertEquals("1", rows.get(1)[0]);
    }
  }

  @Test void testSheetByName() throws IOException {
    XSSFWorkbook workbook = new XSSFWorkbook();
    workbook.createSheet("first").createRow(0).createCell(0).setCellValue("ignored");
    Sheet second = workbook.createSheet("second");
    second.createRow(0).createCell(0).setCellValue("flag");
    second.createRow(1).createCell(0).setCellValue(true);
    Path path = writeWorkbook("sheets.xlsx", workbook);

    try (ExcelScanProvider provider = provider(path, "second", true)) {
      assertEquals(SqlTypeName.BOOLEAN, provider.schema().getColumn(0).getType());
      assertEquals(true, Rows.of(provider).get(0)[0]);
    }
    try (ExcelScanProvider provider = provider(path, "third", true)) {
      FederationException e = assertThrows(FederationException.class, provider::schema);
      assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    }
  }

  @Test void testDuplicateAndBlankHeaders() throws IOException {
    XSSFWorkbook workbook = new XSSFWorkbook();
    Sheet sheet = workbook.createSheet("s");
    Row header = sheet.createRow(0);
    header.createCell(0).setCellValue("a");
    header.createCell(1).setCellValue("a");
    Row data = sheet.createRow(1);
    data.createCell(0).setCellValue(1);
    data.createCell(1).setCellValue(2);
    data.createCell(2).setCellValue(3);
    Path path = writeWorkbook("dups.xlsx", workbook);

    try (ExcelScanProvider provider = provider(path, null, true)) {
      assertEquals(ImmutableList.of("a", "a_1", "col3"), provider.schema().getFieldNames());
    }
  }

  @Test void testDatesAndDoubles() throws IOException {
    XSSFWorkbook workbook = new XSSFWorkbook();
    CellStyle dateStyle = workbook.createCellStyle();
    dateStyle.setDataFormat(
        workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm"));
    Sheet sheet = workbook.createSheet("s");
    Row header = sheet.createRow(0);
    header.createCell(0).setCellValue("at");
    header.createCell(1).setCellValue("amount");
    LocalDateTime at = LocalDateTime.of(2024, 3, 1, 12, 30);
    Row row = sheet.createRow(1);
    row.createCell(0).setCellValue(at);
    row.getCell(0).setCellStyle(dateStyle);
    row.createCell(1).setCellValue(2.5);
    Row row2 = sheet.createRow(2);
    row2.createCell(1).setCellValue(4);
    Path path = writeWorkbook("dates.xlsx", workbook);

    try (ExcelScanProvider provider = provider(path, null, true)) {
      assertEquals(SqlTypeName.TIMESTAMP, provider.schema().getColumn(0).getType());
      assertEquals(SqlTypeName.DOUBLE, provider.schema().getColumn(1).getType());
      List<@Nullable Object[]> rows = Rows.of(provider);
      assertArrayEquals(
          new Object[] {at.toInstant(ZoneOffset.UTC).toEpochMilli(), 2.5d}, rows.get(0));
      assertArrayEquals(new Object[] {null, 4.0d}, rows.get(1));
    }
  }

  @Test void testGlobMatchingTwoWorkbooks() throws IOException {
    numbersWorkbook(1);
    Files.copy(tempDir.resolve("numbers.xlsx"), tempDir.resolve("numbers2.xlsx"));
    try (ExcelScanProvider provider =
             new ExcelScanProvider(LocationResolver.anonymous(), tempDir + "/*.xlsx", null,
                 true, ExcelReader.DEFAULT_INFER_ROWS)) {
      FederationException e = assertThrows(FederationException.class, provider::schema);
      assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
    }
  }
}
