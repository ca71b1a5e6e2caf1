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
package org.apache.calcite.adapter.federation.credential;

import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog view over a {@link CredentialStore}. Exposes
 * {@code credentials_name}, {@code provider} and {@code comment}; payloads are
 * never reachable from here.
 */
public class CredentialsTable extends AbstractTable implements ScannableTable {
  private final CredentialStore store;

  public CredentialsTable(CredentialStore store) {
    this.store = store;
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return typeFactory.builder()
        .add("credentials_name", SqlTypeName.VARCHAR)
        .add("provider", SqlTypeName.VARCHAR)
        .add("comment", SqlTypeName.VARCHAR)
        .build();
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    List<@Nullable Object[]> rows = new ArrayList<>();
    for (CredentialView view : store.list()) {
      rows.add(new Object[] {view.getName(), view.getProvider(), view.getComment()});
    }
    return Linq4j.asEnumerable(rows);
  }

  @Override public String toString() {
    return "CredentialsTable";
  }
}
