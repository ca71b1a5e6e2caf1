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

import org.apache.calcite.adapter.federation.connector.Connector;
import org.apache.calcite.adapter.federation.connector.ConnectorRegistry;
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.scan.ExternalTable;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;
import org.apache.calcite.schema.Table;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Named external tables of a session.
 *
 * <p>Creating a table validates its options, then performs the I/O checks
 * its connector needs (a metadata root, a workbook, a remote table) before
 * the name becomes visible.
 */
public class ExternalTableCatalog {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExternalTableCatalog.class);

  /** Table name taken by the credentials view. */
  public static final String CREDENTIALS_TABLE = "credentials";

  private final ConnectorRegistry connectors;
  private final CredentialStore credentials;
  private final ConcurrentMap<String, Entry> tables = new ConcurrentHashMap<>();

  public ExternalTableCatalog(ConnectorRegistry connectors, CredentialStore credentials) {
    this.connectors = connectors;
    this.credentials = credentials;
  }

  /**
   * Creates or replaces an external table.
   *
   * @throws FederationException with {@link ErrorKind#DUPLICATE_NAME} if the
   *     name is taken and {@code replace} is false; other kinds for invalid
   *     options or failed I/O checks
   */
  public ExternalTableDescriptor create(String name, String provider, ExternalOptions options,
      boolean replace) {
    if (CREDENTIALS_TABLE.equals(name)) {
      throw new FederationException(ErrorKind.DUPLICATE_NAME,
          "table name '" + name + "' is reserved");
    }
    if (!replace && tables.containsKey(name)) {
      throw duplicate(name);
    }
    Connector connector = connectors.get(provider);
    ScanProviderFactory factory = connector.bind(options, credentials);
    factory.verify();
    ExternalTableDescriptor descriptor =
        new ExternalTableDescriptor(name, connector.getKind(), options);
    Entry entry = new Entry(descriptor, new ExternalTable(name, factory));
    if (replace) {
      tables.put(name, entry);
    } else if (tables.putIfAbsent(name, entry) != null) {
      throw duplicate(name);
    }
    LOGGER.info("Created external table '{}' from {}", name, connector.getKind().getKeyword());
    return descriptor;
  }

  /**
   * Drops an external table.
   *
   * @return whether a table was removed
   */
  public boolean drop(String name, boolean ifExists) {
    if (tables.remove(name) == null) {
      if (ifExists) {
        return false;
      }
      throw FederationException.notFound("external table '%s' does not exist", name);
    }
    LOGGER.info("Dropped external table '{}'", name);
    return true;
  }

  public ExternalTableDescriptor lookup(String name) {
    Entry entry = tables.get(name);
    if (entry == null) {
      throw FederationException.notFound("external table '%s' does not exist", name);
    }
    return entry.descriptor;
  }

  /** Descriptors sorted by table name. */
  public List<ExternalTableDescriptor> list() {
    List<ExternalTableDescriptor> descriptors = new ArrayList<>();
    for (Entry entry : tables.values()) {
      descriptors.add(entry.descriptor);
    }
    descriptors.sort(Comparator.comparing(ExternalTableDescriptor::getTableName));
    return descriptors;
  }

  /** Calcite tables by name, as of now. */
  public Map<String, Table> tables() {
    ImmutableMap.Builder<String, Table> builder = ImmutableMap.builder();
    for (Map.Entry<String, Entry> entry : tables.entrySet()) {
      builder.put(entry.getKey(), entry.getValue().table);
    }
    return builder.build();
  }

  private static FederationException duplicate(String name) {
    return new FederationException(ErrorKind.DUPLICATE_NAME,
        "external table '" + name + "' already exists");
  }

  /** Descriptor and the table built from it. */
  private static final class Entry {
    final ExternalTableDescriptor descriptor;
    final ExternalTable table;

    Entry(ExternalTableDescriptor descriptor, ExternalTable table) {
      this.descriptor = descriptor;
      this.table = table;
    }
  }
}
