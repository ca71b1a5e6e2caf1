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

import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.BatchEnumerator;
import org.apache.calcite.adapter.federation.scan.RowBatch;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.linq4j.Linq4j;

import org.apache.iceberg.Schema;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.data.IcebergGenerics;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.io.CloseableIterator;
import org.apache.iceberg.types.Types;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the rows of an Iceberg table snapshot with Iceberg's generic reader.
 * Only projected columns are selected from the data files.
 */
public class IcebergScanProvider extends AbstractIcebergProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(IcebergScanProvider.class);

  private @Nullable ScanSchema schema;

  public IcebergScanProvider(LocationResolver resolver, String location,
      @Nullable Long snapshotId) {
    super(resolver, location, snapshotId);
  }

  private Schema icebergSchema() {
    Snapshot snapshot = selectedSnapshot();
    if (snapshot != null && snapshot.schemaId() != null) {
      Schema snapshotSchema = table().schemas().get(snapshot.schemaId());
      if (snapshotSchema != null) {
        return snapshotSchema;
      }
    }
    return table().schema();
  }

  @Override public ScanSchema schema() {
    if (schema == null) {
      schema = IcebergTypes.toScanSchema(icebergSchema());
    }
    return schema;
  }

  @Override public Enumerator<RowBatch> scan(ScanRequest request) {
    ScanSchema scanSchema = schema();
    int[] projection = scanSchema.resolveProjection(request.getProjection());
    Snapshot snapshot = selectedSnapshot();
    if (snapshot == null) {
      LOGGER.debug("Iceberg table {} has no snapshots", location);
      return Linq4j.emptyEnumerator();
    }
    List<Types.NestedField> fields = icebergSchema().columns();
    List<String> selected = new ArrayList<>();
    for (int index : projection) {
      selected.add(fields.get(index).name());
    }
    IcebergGenerics.ScanBuilder builder =
        IcebergGenerics.read(table()).useSnapshot(snapshot.snapshotId());
    if (!selected.isEmpty()) {
      builder = builder.select(selected.toArray(new String[0]));
    }
    CloseableIterable<Record> records = builder.build();
    CloseableIterator<Record> iterator = records.iterator();
    LOGGER.debug("Scanning Iceberg table {} at snapshot {}", location, snapshot.snapshotId());
    return new BatchEnumerator(request, projection.length) {
      @Override protected @Nullable Object @Nullable [] nextRow() {
        if (!iterator.hasNext()) {
          return null;
        }
        Record record = iterator.next();
        Object[] row = new Object[projection.length];
        for (int i = 0; i < projection.length; i++) {
          Types.NestedField field = fields.get(projection[i]);
          row[i] = IcebergTypes.toCalcite(record.getField(field.name()), field.type());
        }
        return row;
      }

      @Override protected void closeSource() {
        try {
          iterator.close();
          records.close();
        } catch (IOException e) {
          throw FederationException.io("failed to close Iceberg scan of " + location, e);
        }
      }
    };
  }
}
