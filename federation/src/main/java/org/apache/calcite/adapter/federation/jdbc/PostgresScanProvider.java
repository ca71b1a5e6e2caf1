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
package org.apache.calcite.adapter.federation.jdbc;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.BatchEnumerator;
import org.apache.calcite.adapter.federation.scan.RowBatch;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanFilter;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanRequest;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.avatica.util.ByteString;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.sql.SqlDialect;
import org.apache.calcite.sql.dialect.PostgresqlSqlDialect;
import org.apache.calcite.sql.type.SqlTypeName;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Reads one PostgreSQL table over JDBC. Projection becomes the select list
 * and pushed filters become bind parameters.
 */
public class PostgresScanProvider implements ScanProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(PostgresScanProvider.class);

  private static final SqlDialect DIALECT = PostgresqlSqlDialect.DEFAULT;

  /** SQLSTATEs for a missing relation or schema. */
  private static final String UNDEFINED_TABLE = "42P01";
  private static final String INVALID_SCHEMA_NAME = "3F000";

  /** Largest DECIMAL precision Calcite represents by default. */
  private static final int MAX_DECIMAL_PRECISION = 19;

  private final String url;
  private final Properties info;
  private final String schemaName;
  private final String tableName;
  private @Nullable Connection connection;
  private @Nullable ScanSchema schema;

  public PostgresScanProvider(String url, Properties info, String schemaName,
      String tableName) {
    this.url = url;
    this.info = info;
    this.schemaName = schemaName;
    this.tableName = tableName;
  }

  /** Whether a filter evaluates identically in PostgreSQL and Calcite. */
  public static boolean canPushDown(ScanFilter filter) {
    if (filter.getOp().isUnary()) {
      return true;
    }
    Object literal = filter.getLiteral();
    if (literal instanceof String) {
      // string ordering follows the database collation
      return filter.getOp() == ScanFilter.Op.EQ || filter.getOp() == ScanFilter.Op.NE;
    }
    return literal instanceof Number || literal instanceof Boolean;
  }

  String qualifiedName() {
    return DIALECT.quoteIdentifier(schemaName) + "." + DIALECT.quoteIdentifier(tableName);
  }

  private Connection connection() throws SQLException {
    if (connection == null) {
      connection = DriverManager.getConnection(url, info);
    }
    return connection;
  }

  @Override public ScanSchema schema() {
    if (schema == null) {
      String sql = "SELECT * FROM " + qualifiedName() + " WHERE 1 = 0";
      try (PreparedStatement stmt = connection().prepareStatement(sql);
           ResultSet rs = stmt.executeQuery()) {
        schema = toScanSchema(rs.getMetaData());
      } catch (SQLException e) {
        throw translate(e);
      }
    }
    return schema;
  }

  static ScanSchema toScanSchema(ResultSetMetaData metaData) throws SQLException {
    List<ScanColumn> columns = new ArrayList<>();
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      boolean nullable = metaData.isNullable(i) != ResultSetMetaData.columnNoNulls;
      String name = metaData.getColumnLabel(i);
      SqlTypeName type = toSqlType(metaData.getColumnType(i), metaData.getColumnTypeName(i));
      if (type == SqlTypeName.DECIMAL) {
        int precision = metaData.getPrecision(i);
        int scale = metaData.getScale(i);
        columns.add(precision > 0 && precision <= MAX_DECIMAL_PRECISION
            ? new ScanColumn(name, type, precision, scale, nullable)
            : new ScanColumn(name, type, -1, -1, nullable));
      } else {
        columns.add(new ScanColumn(name, type, -1, -1, nullable));
      }
    }
    return new ScanSchema(columns);
  }

  static SqlTypeName toSqlType(int jdbcType, @Nullable String typeName) {
    switch (jdbcType) {
    case Types.BIT:
    case Types.BOOLEAN:
      return SqlTypeName.BOOLEAN;
    case Types.TINYINT:
    case Types.SMALLINT:
      return SqlTypeName.SMALLINT;
    case Types.INTEGER:
      return SqlTypeName.INTEGER;
    case Types.BIGINT:
      return SqlTypeName.BIGINT;
    case Types.REAL:
      return SqlTypeName.REAL;
    case Types.FLOAT:
    case Types.DOUBLE:
      return SqlTypeName.DOUBLE;
    case Types.NUMERIC:
    case Types.DECIMAL:
      return SqlTypeName.DECIMAL;
    case Types.DATE:
      return SqlTypeName.DATE;
    case Types.TIME:
      return SqlTypeName.TIME;
    case Types.TIMESTAMP:
      return "timestamptz".equalsIgnoreCase(typeName)
          ? SqlTypeName.TIMESTAMP_WITH_LOCAL_TIME_ZONE : SqlTypeName.TIMESTAMP;
    case Types.TIMESTAMP_WITH_TIMEZONE:
      return SqlTypeName.TIMESTAMP_WITH_LOCAL_TIME_ZONE;
    case Types.BINARY:
    case Types.VARBINARY:
    case Types.LONGVARBINARY:
      return SqlTypeName.VARBINARY;
    default:
      // text, json, uuid, arrays and other types are read as their text form
      return SqlTypeName.VARCHAR;
    }
  }

  /** Builds the query for a projection and a list of pushed filters. */
  String buildQuery(ScanSchema scanSchema, int[] projection, List<ScanFilter> filters) {
    StringBuilder sql = new StringBuilder("SELECT ");
    if (projection.length == 0) {
      sql.append("NULL");
    }
    for (int i = 0; i < projection.length; i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(DIALECT.quoteIdentifier(scanSchema.getColumn(projection[i]).getName()));
    }
    sql.append(" FROM ").append(qualifiedName());
    for (int i = 0; i < filters.size(); i++) {
      ScanFilter filter = filters.get(i);
      sql.append(i == 0 ? " WHERE " : " AND ")
          .append(DIALECT.quoteIdentifier(scanSchema.getColumn(filter.getColumn()).getName()))
          .append(' ').append(filter.getOp().getSql());
      if (!filter.getOp().isUnary()) {
        sql.append(" ?");
      }
    }
    return sql.toString();
  }

  @Override public Enumerator<RowBatch> scan(ScanRequest request) {
    ScanSchema scanSchema = schema();
    int[] projection = scanSchema.resolveProjection(request.getProjection());
    String sql = buildQuery(scanSchema, projection, request.getFilters());
    LOGGER.debug("Executing {}", sql);
    PreparedStatement stmt = null;
    ResultSet rs;
    try {
      Connection conn = connection();
      // a cursor is only used outside auto-commit
      conn.setAutoCommit(false);
      stmt = conn.prepareStatement(sql);
      stmt.setFetchSize(request.getBatchSize());
      int parameter = 1;
      for (ScanFilter filter : request.getFilters()) {
        if (!filter.getOp().isUnary()) {
          stmt.setObject(parameter++, filter.getLiteral());
        }
      }
      rs = stmt.executeQuery();
    } catch (SQLException e) {
      closeQuietly(stmt);
      throw translate(e);
    }
    PreparedStatement statement = stmt;
    return new BatchEnumerator(request, projection.length) {
      @Override protected @Nullable Object @Nullable [] nextRow() {
        try {
          if (!rs.next()) {
            return null;
          }
          Object[] row = new Object[projection.length];
          for (int i = 0; i < projection.length; i++) {
            row[i] = value(rs, i + 1, scanSchema.getColumn(projection[i]));
          }
          return row;
        } catch (SQLException e) {
          throw translate(e);
        }
      }

      @Override protected void closeSource() {
        try {
          rs.close();
          statement.close();
        } catch (SQLException e) {
          throw translate(e);
        }
      }
    };
  }

  private static @Nullable Object value(ResultSet rs, int index, ScanColumn column)
      throws SQLException {
    Object value;
    switch (column.getType()) {
    case BOOLEAN:
      value = rs.getBoolean(index);
      break;
    case SMALLINT:
      value = rs.getShort(index);
      break;
    case INTEGER:
      value = rs.getInt(index);
      break;
    case BIGINT:
      value = rs.getLong(index);
      break;
    case REAL:
      value = rs.getFloat(index);
      break;
    case DOUBLE:
      value = rs.getDouble(index);
      break;
    case DECIMAL:
      return rs.getBigDecimal(index);
    case DATE:
      LocalDate date = rs.getObject(index, LocalDate.class);
      return date == null ? null : (int) date.toEpochDay();
    case TIME:
      LocalTime time = rs.getObject(index, LocalTime.class);
      return time == null ? null : (int) (time.toNanoOfDay() / 1_000_000L);
    case TIMESTAMP:
      LocalDateTime timestamp = rs.getObject(index, LocalDateTime.class);
      return timestamp == null ? null : timestamp.toInstant(ZoneOffset.UTC).toEpochMilli();
    case TIMESTAMP_WITH_LOCAL_TIME_ZONE:
      OffsetDateTime instant = rs.getObject(index, OffsetDateTime.class);
      return instant == null ? null : instant.toInstant().toEpochMilli();
    case VARBINARY:
      byte[] bytes = rs.getBytes(index);
      return bytes == null ? null : new ByteString(bytes);
    default:
      return rs.getString(index);
    }
    return rs.wasNull() ? null : value;
  }

  private FederationException translate(SQLException e) {
    String state = e.getSQLState();
    if (UNDEFINED_TABLE.equals(state) || INVALID_SCHEMA_NAME.equals(state)) {
      return new FederationException(ErrorKind.NOT_FOUND,
          "PostgreSQL table " + schemaName + "." + tableName + " does not exist", e);
    }
    return FederationException.io("PostgreSQL error on " + schemaName + "." + tableName
        + ": " + e.getMessage(), e);
  }

  private static void closeQuietly(@Nullable PreparedStatement stmt) {
    if (stmt == null) {
      return;
    }
    try {
      stmt.close();
    } catch (SQLException e) {
      LOGGER.debug("Failed to close statement", e);
    }
  }

  @Override public void close() {
    if (connection != null) {
      try {
        connection.close();
      } catch (SQLException e) {
        throw FederationException.io("failed to close PostgreSQL connection", e);
      } finally {
        connection = null;
      }
    }
  }
}
