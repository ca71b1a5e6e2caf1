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
package org.apache.calcite.adapter.federation.format.blob;

import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.BatchEnumerator;
import org.apache.calcite.adapter.federation.scan.RowBatch;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.adapter.federation.storage.ResolvedLocation;
import org.apache.calcite.avatica.util.ByteString;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.io.ByteStreams;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * One row per object matched by a location or glob, with its name, size,
 * modification time and raw bytes.
 *
 * <p>Each output value is computed from the column it belongs to, never from
 * its position in the projection, and content is only fetched when the
 * {@code content} column is projected.
 */
public class BlobScanProvider implements ScanProvider {
  public static final int FILENAME = 0;
  public static final int SIZE = 1;
  public static final int LAST_MODIFIED = 2;
  public static final int CONTENT = 3;

  public static final ScanSchema SCHEMA =
      ScanSchema.of(ScanColumn.notNull("filename", SqlTypeName.VARCHAR),
          ScanColumn.of("size", SqlTypeName.BIGINT),
          ScanColumn.of("last_modified", SqlTypeName.TIMESTAMP),
          ScanColumn.of("content", SqlTypeName.VARBINARY));

  private final LocationResolver resolver;
  private final List<String> locations;

  public BlobScanProvider(LocationResolver resolver, List<String> locations) {
    this.resolver = resolver;
    this.locations = locations;
  }

  @Override public ScanSchema schema() {
    return SCHEMA;
  }

  @Override public Enumerator<RowBatch> scan(ScanRequest request) {
    int[] projection = SCHEMA.resolveProjection(request.getProjection());
    List<ResolvedLocation> objects = resolver.resolve(locations);
    return new BatchEnumerator(request, projection.length) {
      private int next;

      @Override protected @Nullable Object @Nullable [] nextRow() {
        if (next >= objects.size()) {
          return null;
        }
        ResolvedLocation object = objects.get(next++);
        Object[] row = new Object[projection.length];
        try {
          for (int i = 0; i < projection.length; i++) {
            row[i] = value(object, projection[i]);
          }
        } catch (IOException e) {
          throw FederationException.io("failed to read " + object, e);
        }
        return row;
      }

      @Override protected void closeSource() {
        // each object stream is closed after it is read
      }
    };
  }

  private static Object value(ResolvedLocation object, int column) throws IOException {
    switch (column) {
    case FILENAME:
      return object.getUri();
    case SIZE:
      return object.getSize();
    case LAST_MODIFIED:
      return object.getLastModified();
    case CONTENT:
      try (InputStream in = object.open()) {
        return new ByteString(ByteStreams.toByteArray(in));
      }
    default:
      throw new IllegalArgumentException("no blob column " + column);
    }
  }

  @Override public void close() {
    resolver.close();
  }
}
