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
package org.apache.calcite.adapter.federation.connector;

import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.iceberg.IcebergDataFilesProvider;
import org.apache.calcite.adapter.federation.iceberg.IcebergScanProvider;
import org.apache.calcite.adapter.federation.iceberg.IcebergSnapshotsProvider;
import org.apache.calcite.adapter.federation.iceberg.IcebergTableLoader;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;
import org.apache.calcite.adapter.federation.storage.LocationResolver;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Connector for Iceberg tables. One instance per access pattern: table rows,
 * snapshot history or data files.
 */
public class IcebergConnector extends FileConnector {
  public static final String SNAPSHOT_ID = "snapshot_id";

  public IcebergConnector(ProviderKind kind) {
    super(kind, OptionSpec.required(LOCATION, OptionType.STRING),
        ImmutableList.of(OptionSpec.optional(SNAPSHOT_ID, OptionType.INTEGER)));
    switch (kind) {
    case ICEBERG:
    case ICEBERG_SNAPSHOTS:
    case ICEBERG_DATA_FILES:
      break;
    default:
      throw new IllegalArgumentException("not an Iceberg kind: " + kind);
    }
  }

  @Override protected ScanProviderFactory bindLocations(List<String> locations,
      ExternalOptions options, CredentialStore credentials) {
    String location = locations.get(0);
    @Nullable Long snapshotId = options.getLong(SNAPSHOT_ID);
    return new ScanProviderFactory() {
      @Override public ScanProvider create() {
        LocationResolver resolver = resolver(options, credentials);
        switch (getKind()) {
        case ICEBERG_SNAPSHOTS:
          return new IcebergSnapshotsProvider(resolver, location);
        case ICEBERG_DATA_FILES:
          return new IcebergDataFilesProvider(resolver, location, snapshotId);
        default:
          return new IcebergScanProvider(resolver, location, snapshotId);
        }
      }

      /** Checks that a metadata root exists and parses. */
      @Override public void verify() {
        try (LocationResolver resolver = resolver(options, credentials)) {
          IcebergTableLoader.load(resolver, location);
        }
      }
    };
  }
}
