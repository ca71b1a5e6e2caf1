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

import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.BatchEnumerator;
import org.apache.calcite.adapter.federation.scan.RowBatch;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.adapter.federation.storage.ResolvedLocation;
import org.apache.calcite.linq4j.Enumerator;

import com.google.common.collect.ImmutableList;

import org.apache.poi.ss.usermodel.Row;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Scan provider over one sheet of an XLSX workbook.
 */
public class ExcelScanProvider implements ScanProvider {
  private final LocationResolver resolver;
  private final String location;
  private final @Nullable String sheetName;
  private final boolean hasHeader;
  private final int inferRows;
  private @Nullable ExcelReader reader;
  private @Nullable ScanSchema schema;

  public ExcelScanProvider(LocationResolver resolver, String location,
      @Nullable String sheetName, boolean hasHeader, int inferRows) {
    this.resolver = resolver;
    this.location = location;
    this.sheetName = sheetName;
    this.hasHeader = hasHeader;
    this.inferRows = inferRows;
  }

  private ExcelReader reader() {
    if (reader == null) {
      List<ResolvedLocation> resolved = resolver.resolve(ImmutableList.of(location));
      if (resolved.size() != 1) {
        throw FederationException.invalidOption(
            "excel location '%s' must name a single workbook, matched %d", location,
            resolved.size());
      }
      ResolvedLocation workbook = resolved.get(0);
      try {
        reader = ExcelReader.open(workbook.open(), sheetName, hasHeader);
      } catch (IOException e) {
        throw FederationException.io("failed to read workbook " + workbook, e);
      }
    }
    return reader;
  }

  @Override public ScanSchema schema() {
    if (schema == null) {
      schema = reader().inferSchema(inferRows);
    }
    return schema;
  }

  @Override public Enumerator<RowBatch> scan(ScanRequest request) {
    ScanSchema scanSchema = schema();
    int[] projection = scanSchema.resolveProjection(request.getProjection());
    ScanColumn[] columns = new ScanColumn[projection.length];
    for (int i = 0; i < projection.length; i++) {
      columns[i] = scanSchema.getColumn(projection[i]);
    }
    List<Row> rows = reader().getDataRows();
    return new BatchEnumerator(request, projection.length) {
      private int next;

      @Override protected @Nullable Object @Nullable [] nextRow() {
        if (next >= rows.size()) {
          return null;
        }
        Row row = rows.get(next++);
        Object[] values = new Object[projection.length];
        for (int i = 0; i < projection.length; i++) {
          values[i] = ExcelReader.columnValue(row, projection[i], columns[i]);
        }
        return values;
      }

      @Override protected void closeSource() {
        // workbook is closed with the provider
      }
    };
  }

  @Override public void close() {
    try {
      if (reader != null) {
        reader.close();
      }
    } catch (IOException e) {
      throw FederationException.io("failed to close workbook " + location, e);
    } finally {
      reader = null;
      resolver.close();
    }
  }
}
