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
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.storage.LocationResolver;

import org.apache.iceberg.Snapshot;
import org.apache.iceberg.Table;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base for providers that read one Iceberg table. The table is loaded on
 * first use; the resolver, and with it every storage client, is released on
 * {@link #close()}.
 */
abstract class AbstractIcebergProvider implements ScanProvider {
  protected final LocationResolver resolver;
  protected final String location;
  private final @Nullable Long snapshotId;
  private @Nullable Table table;

  AbstractIcebergProvider(LocationResolver resolver, String location,
      @Nullable Long snapshotId) {
    this.resolver = resolver;
    this.location = location;
    this.snapshotId = snapshotId;
  }

  protected Table table() {
    if (table == null) {
      table = IcebergTableLoader.load(resolver, location);
    }
    return table;
  }

  /**
   * The snapshot to read: the one named by {@code snapshot_id}, else the
   * current one. Null for a table without commits.
   */
  protected @Nullable Snapshot selectedSnapshot() {
    Table t = table();
    if (snapshotId == null) {
      return t.currentSnapshot();
    }
    Snapshot snapshot = t.snapshot(snapshotId);
    if (snapshot == null) {
      throw FederationException.notFound("snapshot %s not found in Iceberg table %s",
          snapshotId, location);
    }
    return snapshot;
  }

  @Override public void close() {
    resolver.close();
  }
}
