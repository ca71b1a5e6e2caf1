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
package org.apache.calcite.adapter.federation;

import org.apache.calcite.adapter.federation.credential.CredentialsTable;
import org.apache.calcite.adapter.federation.functions.TableFunctionRegistry;
import org.apache.calcite.schema.Function;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultimap;
import com.google.common.collect.Multimap;

import java.util.Map;

/**
 * Schema of a {@link FederationSession}: its external tables, the
 * {@code credentials} view, the table functions and the hash functions.
 *
 * <p>The table map reflects DDL executed after the schema was registered.
 */
public class FederationSchema extends AbstractSchema {
  private final FederationSession session;
  private final CredentialsTable credentialsTable;
  private final ImmutableMultimap<String, Function> functions;

  FederationSchema(FederationSession session) {
    this.session = session;
    this.credentialsTable = new CredentialsTable(session.getCredentials());
    this.functions = ImmutableMultimap.<String, Function>builder()
        .putAll(TableFunctionRegistry.tableFunctions(session.getConnectors(),
            session.getCredentials()))
        .putAll(TableFunctionRegistry.scalarFunctions())
        .build();
  }

  public FederationSession getSession() {
    return session;
  }

  @Override protected Map<String, Table> getTableMap() {
    return ImmutableMap.<String, Table>builder()
        .put(ExternalTableCatalog.CREDENTIALS_TABLE, credentialsTable)
        .putAll(session.getCatalog().tables())
        .build();
  }

  @Override protected Multimap<String, Function> getFunctionMultimap() {
    return functions;
  }

  @Override public boolean isMutable() {
    return true;
  }
}
