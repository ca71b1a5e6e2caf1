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

/**
 * Kind of external source behind a table. The Iceberg metadata variants are
 * only reachable through table functions.
 */
public enum ProviderKind {
  POSTGRES("postgres"),
  BIGQUERY("bigquery"),
  ICEBERG("iceberg"),
  ICEBERG_SNAPSHOTS("iceberg_snapshots"),
  ICEBERG_DATA_FILES("iceberg_data_files"),
  EXCEL("excel"),
  NDJSON("ndjson"),
  BLOB("blob");

  private final String keyword;

  ProviderKind(String keyword) {
    this.keyword = keyword;
  }

  public String getKeyword() {
    return keyword;
  }
}
