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
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.sql.type.SqlTypeName;

import org.apache.iceberg.DataFile;
import org.apache.iceberg.FileScanTask;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.StructLike;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.io.CloseableIterator;
import org.apache.iceberg.types.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the data files that make up the current or selected snapshot of an
 * Iceberg table.
 */
public class IcebergDataFilesProvider extends AbstractIcebergProvider {
  public static final ScanSchema SCHEMA =
      ScanSchema.of(ScanColumn.notNull("snapshot_id", SqlTypeName.BIGINT),
          ScanColumn.of("content", SqlTypeName.VARCHAR),
          ScanColumn.of("file_path", SqlTypeName.VARCHAR),
          ScanColumn.of("file_format", SqlTypeName.VARCHAR),
          ScanColumn.of("partition", SqlTypeName.VARCHAR),
          ScanColumn.of("record_count", SqlTypeName.BIGINT),
          ScanColumn.of("file_size_in_bytes", SqlTypeName.BIGINT));

  public IcebergDataFilesProvider(LocationResolver resolver, String location,
      @Nullable Long snapshotId) {
    super(resolver, location, snapshotId);
  }

  @Override public ScanSchema schema() {
    return SCHEMA;
  }

  @Override public Enumerator<RowBatch> scan(ScanRequest request) {
    int[] projection = SCHEMA.resolveProjection(request.getProjection());
    Snapshot snapshot = selectedSnapshot();
    if (snapshot == null) {
      return Linq4j.emptyEnumerator();
    }
    long snapshotId = snapshot.snapshotId();
    CloseableIterable<FileScanTask> tasks =
        table().newScan().useSnapshot(snapshotId).planFiles();
    CloseableIterator<FileScanTask> iterator = tasks.iterator();
    return new BatchEnumerator(request, projection.length) {
      @Override protected @Nullable Object @Nullable [] nextRow() {
        if (!iterator.hasNext()) {
          return null;
        }
        DataFile file = iterator.next().file();
        Object[] row = new Object[projection.length];
        for (int i = 0; i < projection.length; i++) {
          row[i] = value(snapshotId, file, projection[i]);
        }
        return row;
      }

      @Override protected void closeSource() {
        try {
          iterator.close();
          tasks.close();
        } catch (IOException e) {
          throw FederationException.io("failed to close file listing of " + location, e);
        }
      }
    };
  }

  private @Nullable Object value(long snapshotId, DataFile file, int column) {
    switch (column) {
    case 0:
      return snapshotId;
    case 1:
      return file.content().name();
    case 2:
      return file.path().toString();
    case 3:
      return file.format().name();
    case 4:
      return partitionJson(file);
    case 5:
      return file.recordCount();
    case 6:
      return file.fileSizeInBytes();
    default:
      throw new IllegalArgumentException("no data file column " + column);
    }
  }

  /** Renders the partition tuple as a JSON object keyed by partition field. */
  private String partitionJson(DataFile file) {
    PartitionSpec spec = table().specs().get(file.specId());
    StructLike partition = file.partition();
    Map<String, @Nullable Object> values = new LinkedHashMap<>();
    if (spec != null && partition != null) {
      List<Types.NestedField> fields = spec.partitionType().fields();
      for (int i = 0; i < fields.size() && i < partition.size(); i++) {
        Types.NestedField field = fields.get(i);
        values.put(field.name(),
            IcebergTypes.toPlain(partition.get(i, Object.class), field.type()));
      }
    }
    return IcebergTypes.toJson(values);
  }
}
