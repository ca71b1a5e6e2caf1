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

import org.apache.calcite.adapter.federation.connector.ConnectorRegistry;
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.ddl.DdlExecutor;
import org.apache.calcite.schema.SchemaPlus;

/**
 * State of one federation session: credentials, external tables and the
 * connectors that read them.
 */
public class FederationSession {
  private final CredentialStore credentials = new CredentialStore();
  private final ConnectorRegistry connectors = new ConnectorRegistry();
  private final ExternalTableCatalog catalog = new ExternalTableCatalog(connectors, credentials);
  private final DdlExecutor ddlExecutor = new DdlExecutor(credentials, catalog);
  private final FederationSchema schema = new FederationSchema(this);

  public CredentialStore getCredentials() {
    return credentials;
  }

  public ConnectorRegistry getConnectors() {
    return connectors;
  }

  public ExternalTableCatalog getCatalog() {
    return catalog;
  }

  public FederationSchema getSchema() {
    return schema;
  }

  /**
   * Adds this session's schema under {@code parent}. Caching is turned off so
   * that later DDL is visible to queries.
   */
  public SchemaPlus register(SchemaPlus parent, String name) {
    SchemaPlus schemaPlus = parent.add(name, schema);
    schemaPlus.setCacheEnabled(false);
    return schemaPlus;
  }

  /** Executes a federation DDL statement. */
  public void execute(String ddl) {
    ddlExecutor.execute(ddl);
  }
}
