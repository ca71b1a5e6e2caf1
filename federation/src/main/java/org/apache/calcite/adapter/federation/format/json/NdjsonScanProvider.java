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

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Scan provider over newline-delimited JSON. A list of locations is read as
 * one logical table, in list order.
 */
public class NdjsonScanProvider implements ScanProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(NdjsonScanProvider.class);

  private final LocationResolver resolver;
  private final List<String> locations;
  private final int inferRows;
  private @Nullable List<ResolvedLocation> resolved;
  private @Nullable ScanSchema schema;
  private @Nullable NdjsonReader reader;

  public NdjsonScanProvider(LocationResolver resolver, List<String> locations, int inferRows) {
    this.resolver = resolver;
    this.locations = locations;
    this.inferRows = inferRows;
  }

  private List<ResolvedLocation> resolved() {
    if (resolved == null) {
      resolved = resolver.resolve(locations);
    }
    return resolved;
  }

  @Override public ScanSchema schema() {
    if (schema == null) {
      schema = NdjsonReader.inferSchema(resolved(), inferRows);
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
    NdjsonReader records = new NdjsonReader(resolved());
    reader = records;
    return new BatchEnumerator(request, columns.length) {
      @Override protected @Nullable Object @Nullable [] nextRow() {
        ObjectNode record = records.next();
        if (record == null) {
          return null;
        }
        Object[] row = new Object[columns.length];
        for (int i = 0; i < columns.length; i++) {
          row[i] = NdjsonReader.columnValue(record, columns[i]);
        }
        return row;
      }

      @Override protected void closeSource() {
        closeReader(records);
      }
    };
  }

  private static void closeReader(NdjsonReader records) {
    try {
      records.close();
    } catch (IOException e) {
      throw FederationException.io("failed to close NDJSON source", e);
    }
  }

  @Override public void close() {
    try {
      if (reader != null) {
        closeReader(reader);
      }
    } finally {
      reader = null;
      resolver.close();
      LOGGER.debug("Closed NDJSON scan over {}", locations);
    }
  }
}
