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

import org.apache.calcite.adapter.federation.FederationException;

import com.google.common.collect.ImmutableMap;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps provider keywords used in DDL and model files to connectors.
 */
public class ConnectorRegistry {
  private final ImmutableMap<String, Connector> byKeyword;
  private final Map<ProviderKind, Connector> byKind = new EnumMap<>(ProviderKind.class);

  public ConnectorRegistry() {
    Connector postgres = register(new PostgresConnector());
    Connector bigquery = register(new BigQueryConnector());
    Connector iceberg = register(new IcebergConnector(ProviderKind.ICEBERG));
    register(new IcebergConnector(ProviderKind.ICEBERG_SNAPSHOTS));
    register(new IcebergConnector(ProviderKind.ICEBERG_DATA_FILES));
    Connector excel = register(new ExcelConnector());
    Connector ndjson = register(new NdjsonConnector());
    Connector blob = register(new BlobConnector());
    this.byKeyword = ImmutableMap.<String, Connector>builder()
        .put("postgres", postgres)
        .put("bigquery", bigquery)
        .put("iceberg", iceberg)
        .put("excel", excel)
        .put("xlsx", excel)
        .put("ndjson", ndjson)
        .put("json", ndjson)
        .put("blob", blob)
        .build();
  }

  private Connector register(Connector connector) {
    byKind.put(connector.getKind(), connector);
    return connector;
  }

  /**
   * Returns the connector for a provider keyword, ignoring case.
   *
   * @throws FederationException with
   *     {@link org.apache.calcite.adapter.federation.ErrorKind#INVALID_OPTION}
   *     for an unknown keyword
   */
  public Connector get(String keyword) {
    Connector connector = byKeyword.get(keyword.toLowerCase(Locale.ROOT));
    if (connector == null) {
      throw FederationException.invalidOption("unknown provider '%s'; expected one of %s",
          keyword, byKeyword.keySet());
    }
    return connector;
  }

  public Connector get(ProviderKind kind) {
    Connector connector = byKind.get(kind);
    if (connector == null) {
      throw new IllegalArgumentException("no connector for " + kind);
    }
    return connector;
  }

  public Set<String> keywords() {
    return byKeyword.keySet();
  }
}
