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
package org.apache.calcite.adapter.federation.functions;

import org.apache.calcite.adapter.federation.connector.AbstractConnector;
import org.apache.calcite.adapter.federation.connector.ConnectorRegistry;
import org.apache.calcite.adapter.federation.connector.ExcelConnector;
import org.apache.calcite.adapter.federation.connector.IcebergConnector;
import org.apache.calcite.adapter.federation.connector.NdjsonConnector;
import org.apache.calcite.adapter.federation.connector.ProviderKind;
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.schema.Function;
import org.apache.calcite.schema.impl.ScalarFunctionImpl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultimap;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.util.List;

/**
 * Functions a federation schema exposes: the table functions over external
 * sources and the scalar hash functions.
 */
public final class TableFunctionRegistry {
  private static final List<String> FILE_OPTIONS = ImmutableList.of(
      AbstractConnector.CREDENTIAL, AbstractConnector.REGION, AbstractConnector.ENDPOINT);

  private TableFunctionRegistry() {
  }

  /** Table macros, keyed by function name. */
  public static ImmutableMultimap<String, Function> tableFunctions(ConnectorRegistry connectors,
      CredentialStore credentials) {
    ImmutableMultimap.Builder<String, Function> builder = ImmutableMultimap.builder();
    List<String> excelOptions = ImmutableList.<String>builder()
        .add(ExcelConnector.SHEET_NAME, ExcelConnector.HAS_HEADER, ExcelConnector.INFER_ROWS)
        .addAll(FILE_OPTIONS)
        .build();
    for (String name : ImmutableList.of("read_excel", "read_xlsx")) {
      builder.put(name, new ExternalTableMacro(name, connectors.get(ProviderKind.EXCEL),
          credentials, "path", excelOptions));
    }
    List<String> ndjsonOptions = ImmutableList.<String>builder()
        .add(NdjsonConnector.INFER_ROWS)
        .addAll(FILE_OPTIONS)
        .build();
    for (String name : ImmutableList.of("read_ndjson", "ndjson_scan")) {
      builder.put(name, new ExternalTableMacro(name, connectors.get(ProviderKind.NDJSON),
          credentials, "path", ndjsonOptions));
    }
    builder.put("read_blob", new ExternalTableMacro("read_blob",
        connectors.get(ProviderKind.BLOB), credentials, "glob", FILE_OPTIONS));
    List<String> icebergOptions = ImmutableList.<String>builder()
        .add(AbstractConnector.CREDENTIAL, AbstractConnector.REGION,
            IcebergConnector.SNAPSHOT_ID, AbstractConnector.ENDPOINT)
        .build();
    builder.put("iceberg_scan", new ExternalTableMacro("iceberg_scan",
        connectors.get(ProviderKind.ICEBERG), credentials, "location", icebergOptions));
    builder.put("iceberg_snapshots", new ExternalTableMacro("iceberg_snapshots",
        connectors.get(ProviderKind.ICEBERG_SNAPSHOTS), credentials, "location",
        icebergOptions));
    builder.put("iceberg_data_files", new ExternalTableMacro("iceberg_data_files",
        connectors.get(ProviderKind.ICEBERG_DATA_FILES), credentials, "location",
        icebergOptions));
    return builder.build();
  }

  /** {@code siphash}, {@code fnv} and {@code partition_results}. */
  public static ImmutableMultimap<String, Function> scalarFunctions() {
    ImmutableMultimap.Builder<String, Function> builder = ImmutableMultimap.builder();
    for (Method method : HashFunctions.class.getMethods()) {
      String name = method.getName();
      if ((name.equals("siphash") || name.equals("fnv"))
          && method.getReturnType() == BigDecimal.class) {
        builder.put(name, ScalarFunctionImpl.create(method));
      }
    }
    builder.put("partition_results",
        ScalarFunctionImpl.create(PartitionResults.class, "partitionResults"));
    return builder.build();
  }
}
