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

import org.apache.calcite.adapter.federation.scan.BatchEnumerator;
import org.apache.calcite.adapter.federation.scan.RowBatch;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;

import org.apache.iceberg.Snapshot;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;
import java.util.List;

/** Lists the snapshots of an Iceberg table in commit order. */
public class IcebergSnapshotsProvider extends AbstractIcebergProvider {
  public static final ScanSchema SCHEMA =
      ScanSchema.of(ScanColumn.notNull("snapshot_id", SqlTypeName.BIGINT),
          ScanColumn.of("parent_snapshot_id", SqlTypeName.BIGINT),
          ScanColumn.of("sequence_number", SqlTypeName.BIGINT),
          ScanColumn.of("timestamp_ms", SqlTypeName.TIMESTAMP),
          ScanColumn.of("operation", SqlTypeName.VARCHAR),
          ScanColumn.of("manifest_list", SqlTypeName.VARCHAR),
          ScanColumn.of("summary", SqlTypeName.VARCHAR));

  public IcebergSnapshotsProvider(LocationResolver resolver, String location) {
    super(resolver, location, null);
  }

  @Override public ScanSchema schema() {
    return SCHEMA;
  }

  @Override public Enumerator<RowBatch> scan(ScanRequest request) {
    int[] projection = SCHEMA.resolveProjection(request.getProjection());
    List<Snapshot> snapshots = ImmutableList.copyOf(table().snapshots());
    Iterator<Snapshot> iterator = snapshots.iterator();
    return new BatchEnumerator(request, projection.length) {
      @Override protected @Nullable Object @Nullable [] nextRow() {
        if (!iterator.hasNext()) {
          return null;
        }
        Snapshot snapshot = iterator.next();
        Object[] row = new Object[projection.length];
        for (int i = 0; i < projection.length; i++) {
          row[i] = value(snapshot, projection[i]);
        }
        return row;
      }

      @Override protected void closeSource() {
        // snapshots are held in memory
      }
    };
  }

  private static @Nullable Object value(Snapshot snapshot, int column) {
    switch (column) {
    case 0:
      return snapshot.snapshotId();
    case 1:
      return snapshot.parentId();
    case 2:
      return snapshot.sequenceNumber();
    case 3:
      return snapshot.timestampMillis();
    case 4:
      return snapshot.operation();
    case 5:
      return snapshot.manifestListLocation();
    case 6:
      return snapshot.summary() == null ? null : IcebergTypes.toJson(snapshot.summary());
    default:
      throw new IllegalArgumentException("no snapshot column " + column);
    }
  }
}
