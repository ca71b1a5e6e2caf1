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
package org.apache.calcite.adapter.federation.ddl;

import org.apache.calcite.adapter.federation.ExternalTableCatalog;
import org.apache.calcite.adapter.federation.credential.CredentialStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes federation DDL against a credential store and a table catalog.
 */
public class DdlExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(DdlExecutor.class);

  private final CredentialStore credentials;
  private final ExternalTableCatalog catalog;

  public DdlExecutor(CredentialStore credentials, ExternalTableCatalog catalog) {
    this.credentials = credentials;
    this.catalog = catalog;
  }

  /** Parses and executes one statement. */
  public void execute(String sql) {
    execute(DdlParser.parse(sql));
  }

  public void execute(DdlStatement statement) {
    LOGGER.debug("Executing {}", statement);
    if (statement instanceof DdlStatement.CreateCredential) {
      DdlStatement.CreateCredential create = (DdlStatement.CreateCredential) statement;
      if (create.isReplace()) {
        credentials.createOrReplace(create.getName(), create.getProvider(),
            create.getOptions(), create.getComment());
      } else {
        credentials.create(create.getName(), create.getProvider(), create.getOptions(),
            create.getComment());
      }
    } else if (statement instanceof DdlStatement.CreateExternalTable) {
      DdlStatement.CreateExternalTable create = (DdlStatement.CreateExternalTable) statement;
      catalog.create(create.getName(), create.getProvider(), create.getOptions(),
          create.isReplace());
    } else if (statement instanceof DdlStatement.DropCredential) {
      DdlStatement.DropCredential drop = (DdlStatement.DropCredential) statement;
      credentials.drop(drop.getName(), drop.isIfExists());
    } else if (statement instanceof DdlStatement.DropExternalTable) {
      DdlStatement.DropExternalTable drop = (DdlStatement.DropExternalTable) statement;
      catalog.drop(drop.getName(), drop.isIfExists());
    } else {
      throw new AssertionError("unknown statement " + statement);
    }
  }
}
