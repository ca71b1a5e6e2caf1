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
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.jdbc.PostgresScanProvider;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;
import org.apache.calcite.adapter.federation.scan.ScanFilter;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Properties;

/**
 * Connector for PostgreSQL tables. The server is given either as a
 * {@code connection_string} (JDBC URL, {@code postgresql://} URI or libpq
 * {@code key=value} list) or as separate host, port, user, password and
 * database options.
 */
public class PostgresConnector extends AbstractConnector {
  public static final String CONNECTION_STRING = "connection_string";
  public static final String HOST = "host";
  public static final String PORT = "port";
  public static final String USER = "user";
  public static final String PASSWORD = "password";
  public static final String DATABASE = "database";
  public static final String SCHEMA = "schema";
  public static final String TABLE = "table";

  static final String JDBC_PREFIX = "jdbc:postgresql:";

  public PostgresConnector() {
    super(ProviderKind.POSTGRES, ImmutableList.of(
        OptionSpec.optional(CONNECTION_STRING, OptionType.STRING),
        OptionSpec.optional(HOST, OptionType.STRING),
        OptionSpec.optional(PORT, OptionType.INTEGER).withRange(1L, 65535L).withDefault(5432L),
        OptionSpec.optional(USER, OptionType.STRING),
        OptionSpec.optional(PASSWORD, OptionType.STRING),
        OptionSpec.optional(DATABASE, OptionType.STRING),
        OptionSpec.optional(SCHEMA, OptionType.STRING).withDefault("public"),
        OptionSpec.required(TABLE, OptionType.STRING)));
  }

  @Override protected ScanProviderFactory bindValidated(ExternalOptions options,
      CredentialStore credentials) {
    Properties info = new Properties();
    String url = jdbcUrl(options, info);
    String schema = options.getString(SCHEMA);
    String table = options.getString(TABLE);
    return new ScanProviderFactory() {
      @Override public ScanProvider create() {
        return new PostgresScanProvider(url, info, schema, table);
      }

      @Override public boolean canPushDown(ScanFilter filter) {
        return PostgresScanProvider.canPushDown(filter);
      }
    };
  }

  /**
   * Builds the JDBC URL for the options and puts user and password into
   * {@code info}.
   */
  static String jdbcUrl(ExternalOptions options, Properties info) {
    String connectionString = options.getString(CONNECTION_STRING);
    String host = options.getString(HOST);
    if (connectionString != null) {
      if (host != null || options.getString(DATABASE) != null) {
        throw FederationException.invalidOption(
            "give either '%s' or host and database options, not both", CONNECTION_STRING);
      }
      putIfPresent(info, USER, options.getString(USER));
      putIfPresent(info, PASSWORD, options.getString(PASSWORD));
      return fromConnectionString(connectionString.trim(), info);
    }
    String database = options.getString(DATABASE);
    if (host == null || database == null) {
      throw FederationException.invalidOption(
          "postgres needs '%s' or both 'host' and 'database'", CONNECTION_STRING);
    }
    putIfPresent(info, USER, options.getString(USER));
    putIfPresent(info, PASSWORD, options.getString(PASSWORD));
    return JDBC_PREFIX + "//" + host + ":" + options.getLong(PORT) + "/" + database;
  }

  static String fromConnectionString(String connectionString, Properties info) {
    if (connectionString.startsWith(JDBC_PREFIX)) {
      return connectionString;
    }
    if (connectionString.startsWith("postgresql://")
        || connectionString.startsWith("postgres://")) {
      return fromUri(connectionString, info);
    }
    return fromKeyValues(connectionString, info);
  }

  private static String fromUri(String connectionString, Properties info) {
    URI uri;
    try {
      uri = new URI(connectionString);
    } catch (URISyntaxException e) {
      throw FederationException.invalidOption("malformed connection_string: %s",
          e.getMessage());
    }
    String userInfo = uri.getUserInfo();
    if (userInfo != null) {
      int colon = userInfo.indexOf(':');
      info.setProperty(USER, colon < 0 ? userInfo : userInfo.substring(0, colon));
      if (colon >= 0) {
        info.setProperty(PASSWORD, userInfo.substring(colon + 1));
      }
    }
    if (uri.getHost() == null) {
      throw FederationException.invalidOption("connection_string has no host");
    }
    StringBuilder url = new StringBuilder(JDBC_PREFIX).append("//").append(uri.getHost());
    if (uri.getPort() > 0) {
      url.append(':').append(uri.getPort());
    }
    url.append(uri.getPath() == null || uri.getPath().isEmpty() ? "/" : uri.getPath());
    if (uri.getQuery() != null) {
      url.append('?').append(uri.getQuery());
    }
    return url.toString();
  }

  /** Parses libpq syntax: {@code host=h port=5432 dbname=d user=u password='p w'}. */
  private static String fromKeyValues(String connectionString, Properties info) {
    String host = "localhost";
    String port = "5432";
    String database = null;
    int i = 0;
    int n = connectionString.length();
    while (i < n) {
      while (i < n && Character.isWhitespace(connectionString.charAt(i))) {
        i++;
      }
      if (i >= n) {
        break;
      }
      int eq = connectionString.indexOf('=', i);
      if (eq < 0) {
        throw FederationException.invalidOption(
            "malformed connection_string near '%s'", connectionString.substring(i));
      }
      String key = connectionString.substring(i, eq).trim().toLowerCase(Locale.ROOT);
      StringBuilder value = new StringBuilder();
      i = eq + 1;
      if (i < n && connectionString.charAt(i) == '\'') {
        i++;
        while (i < n && connectionString.charAt(i) != '\'') {
          char c = connectionString.charAt(i);
          if (c == '\\' && i + 1 < n) {
            c = connectionString.charAt(++i);
          }
          value.append(c);
          i++;
        }
        if (i >= n) {
          throw FederationException.invalidOption("unterminated quote in connection_string");
        }
        i++;
      } else {
        while (i < n && !Character.isWhitespace(connectionString.charAt(i))) {
          value.append(connectionString.charAt(i++));
        }
      }
      switch (key) {
      case "host":
        host = value.toString();
        break;
      case "port":
        port = value.toString();
        break;
      case "dbname":
      case "database":
        database = value.toString();
        break;
      case "user":
        info.setProperty(USER, value.toString());
        break;
      case "password":
        info.setProperty(PASSWORD, value.toString());
        break;
      default:
        info.setProperty(key, value.toString());
        break;
      }
    }
    if (database == null) {
      throw FederationException.invalidOption("connection_string has no dbname");
    }
    return JDBC_PREFIX + "//" + host + ":" + port + "/" + database;
  }

  private static void putIfPresent(Properties info, String key, @Nullable String value) {
    if (value != null) {
      info.setProperty(key, value);
    }
  }
}
