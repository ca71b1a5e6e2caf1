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
import org.apache.calcite.adapter.federation.format.ValueCoercion;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.sql.type.SqlTypeName;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads one sheet of an XLSX workbook.
 *
 * <p>Fully empty rows are skipped. With a header, the first non-empty row
 * names the columns; blank names become {@code col<N>} and repeated names get
 * a {@code _<k>} suffix. Without a header, columns are {@code col1..colN}.
 */
public class ExcelReader implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExcelReader.class);

  /** Rows sampled for type inference when no bound is given. */
  public static final int DEFAULT_INFER_ROWS = 100;

  private final Workbook workbook;
  private final Sheet sheet;
  private final List<String> columnNames;
  private final List<Row> dataRows;

  private ExcelReader(Workbook workbook, Sheet sheet, boolean hasHeader) {
    this.workbook = workbook;
    this.sheet = sheet;

    List<Row> rows = new ArrayList<>();
    int width = 0;
    for (int i = sheet.getFirstRowNum(); i <= sheet.getLastRowNum(); i++) {
      Row row = sheet.getRow(i);
      if (row == null || isEmpty(row)) {
        continue;
      }
      rows.add(row);
      width = Math.max(width, row.getLastCellNum());
    }

    List<String> names = new ArrayList<>(width);
    if (hasHeader && !rows.isEmpty()) {
      Row header = rows.remove(0);
      DataFormatter formatter = new DataFormatter();
      Set<String> used = new HashSet<>();
      for (int c = 0; c < width; c++) {
        Cell cell = header.getCell(c);
        String name = cell == null ? "" : formatter.formatCellValue(cell).trim();
        if (name.isEmpty()) {
          name = "col" + (c + 1);
        }
        names.add(uniqueName(name, used));
      }
    } else {
      for (int c = 0; c < width; c++) {
        names.add("col" + (c + 1));
      }
    }
    this.columnNames = names;
    this.dataRows = rows;
  }

  /**
   * Opens a workbook and selects a sheet.
   *
   * @param in Workbook bytes; consumed and closed
   * @param sheetName Sheet to read, or null for the first sheet
   * @throws FederationException with {@link ErrorKind#NOT_FOUND} if the
   *     sheet does not exist
   */
  public static ExcelReader open(InputStream in, @Nullable String sheetName, boolean hasHeader)
      throws IOException {
    Workbook workbook;
    try (InputStream input = in) {
      workbook = WorkbookFactory.create(input);
    } catch (EncryptedDocumentException e) {
      throw new IOException("workbook is encrypted", e);
    }
    Sheet sheet = sheetName != null
        ? workbook.getSheet(sheetName)
        : workbook.getNumberOfSheets() > 0 ? workbook.getSheetAt(0) : null;
    if (sheet == null) {
      workbook.close();
      throw FederationException.notFound("sheet '%s' does not exist", sheetName);
    }
    ExcelReader reader = new ExcelReader(workbook, sheet, hasHeader);
    LOGGER.debug("Opened sheet '{}' with {} data row(s) and {} column(s)",
        sheet.getSheetName(), reader.dataRows.size(), reader.columnNames.size());
    return reader;
  }

  public String getSheetName() {
    return sheet.getSheetName();
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  /** Non-empty rows after the header, in sheet order. */
  public List<Row> getDataRows() {
    return dataRows;
  }

  /** Infers column types from the first {@code inferRows} data rows. */
  public ScanSchema inferSchema(int inferRows) {
    List<ScanColumn> columns = new ArrayList<>(columnNames.size());
    int sample = Math.min(inferRows, dataRows.size());
    for (int c = 0; c < columnNames.size(); c++) {
      SqlTypeName type = null;
      for (int r = 0; r < sample; r++) {
        type = ValueCoercion.merge(type, ValueCoercion.typeOf(cellValue(dataRows.get(r).getCell(c))));
      }
      columns.add(ScanColumn.of(columnNames.get(c), ValueCoercion.finish(type)));
    }
    return new ScanSchema(columns);
  }

  /** Value of cell {@code column} in {@code row}, coerced to the column's type. */
  public static @Nullable Object columnValue(Row row, int column, ScanColumn scanColumn) {
    return ValueCoercion.coerce(cellValue(row.getCell(column)), scanColumn);
  }

  /**
   * Plain value of a cell: String, Long for integral numbers, Double,
   * Boolean, or LocalDateTime for date-formatted numbers. Formula cells use
   * their cached result.
   */
  static @Nullable Object cellValue(@Nullable Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
    case STRING:
      String text = cell.getStringCellValue();
      return text.isEmpty() ? null : text;
    case NUMERIC:
      if (DateUtil.isCellDateFormatted(cell)) {
        return cell.getLocalDateTimeCellValue();
      }
      double num = cell.getNumericCellValue();
      if (num == Math.floor(num) && !Double.isInfinite(num)
          && Math.abs(num) < 9.007199254740992E15) {
        return (long) num;
      }
      return num;
    case BOOLEAN:
      return cell.getBooleanCellValue();
    default:
      return null;
    }
  }

  private static boolean isEmpty(Row row) {
    for (Cell cell : row) {
      if (cellValue(cell) != null) {
        return false;
      }
    }
    return true;
  }

  private static String uniqueName(String name, Set<String> used) {
    String candidate = name;
    for (int k = 1; !used.add(candidate); k++) {
      candidate = name + "_" + k;
    }
    return candidate;
  }

  @Override public void close() throws IOException {
    workbook.close();
  }
}
