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
package org.apache.calcite.adapter.federation.bigquery;

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
import org.apache.calcite.sql.dialect.BigQuerySqlDialect;
import org.apache.calcite.sql.type.SqlTypeName;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableResult;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one BigQuery table by running a generated standard SQL query.
 * Projection becomes the select list; pushed filters become positional
 * query parameters.
 */
public class BigQueryScanProvider implements ScanProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(BigQueryScanProvider.class);

  private static final SqlDialect DIALECT = BigQuerySqlDialect.DEFAULT;
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final BigQuery client;
  private final TableId tableId;
  private @Nullable ScanSchema schema;
  private @Nullable FieldList fields;

  public BigQueryScanProvider(BigQuery client, TableId tableId) {
    this.client = client;
    this.tableId = tableId;
  }

  /** Creates a client authenticated with a service account key. */
  public static BigQuery createClient(String projectId, String serviceAccountKey) {
    ServiceAccountCredentials credentials;
    try {
      credentials = ServiceAccountCredentials.fromStream(
          new ByteArrayInputStream(serviceAccountKey.getBytes(StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new FederationException(ErrorKind.INVALID_OPTION,
          "service_account_key is not a valid service account key", e);
    }
    return BigQueryOptions.newBuilder()
        .setProjectId(projectId)
        .setCredentials(credentials)
        .build()
        .getService();
  }

  /** Whether a filter evaluates identically in BigQuery and Calcite. */
  public static boolean canPushDown(ScanFilter filter) {
    if (filter.getOp().isUnary()) {
      return true;
    }
    Object literal = filter.getLiteral();
    if (literal instanceof String) {
      return filter.getOp() == ScanFilter.Op.EQ || filter.getOp() == ScanFilter.Op.NE;
    }
    return literal instanceof Long || literal instanceof Double
        || literal instanceof BigDecimal || literal instanceof Boolean;
  }

  private FieldList fields() {
    if (fields == null) {
      Table table;
      try {
        table = client.getTable(tableId);
      } catch (BigQueryException e) {
        throw FederationException.io("failed to read BigQuery table " + tableId, e);
      }
      if (table == null) {
        throw FederationException.notFound("BigQuery table %s.%s.%s does not exist",
            tableId.getProject(), tableId.getDataset(), tableId.getTable());
      }
      Schema tableSchema = table.getDefinition().getSchema();
      fields = tableSchema == null ? FieldList.of() : tableSchema.getFields();
    }
    return fields;
  }

  @Override public ScanSchema schema() {
    if (schema == null) {
      List<ScanColumn> columns = new ArrayList<>();
      for (Field field : fields()) {
        columns.add(toScanColumn(field));
      }
      schema = new ScanSchema(columns);
    }
    return schema;
  }

  static ScanColumn toScanColumn(Field field) {
    boolean nullable = field.getMode() != Field.Mode.REQUIRED;
    if (field.getMode() == Field.Mode.REPEATED) {
      return new ScanColumn(field.getName(), SqlTypeName.VARCHAR, -1, -1, true);
    }
    return new ScanColumn(field.getName(), toSqlType(field.getType().getStandardType()),
        -1, -1, nullable);
  }

  static SqlTypeName toSqlType(StandardSQLTypeName type) {
    switch (type) {
    case BOOL:
      return SqlTypeName.BOOLEAN;
    case INT64:
      return SqlTypeName.BIGINT;
    case FLOAT64:
      return SqlTypeName.DOUBLE;
    case NUMERIC:
    case BIGNUMERIC:
      return SqlTypeName.DECIMAL;
    case BYTES:
      return SqlTypeName.VARBINARY;
    case DATE:
      return SqlTypeName.DATE;
    case TIME:
      return SqlTypeName.TIME;
    case DATETIME:
      return SqlTypeName.TIMESTAMP;
    case TIMESTAMP:
      return SqlTypeName.TIMESTAMP_WITH_LOCAL_TIME_ZONE;
    default:
      // STRING, JSON, GEOGRAPHY, INTERVAL and STRUCT values are read as text
      return SqlTypeName.VARCHAR;
    }
  }

  String qualifiedName() {
    return DIALECT.quoteIdentifier(
        tableId.getProject() + "." + tableId.getDataset() + "." + tableId.getTable());
  }

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

  static QueryParameterValue toParameter(Object literal) {
    if (literal instanceof Long) {
      return QueryParameterValue.int64((Long) literal);
    }
    if (literal instanceof Double) {
      return QueryParameterValue.float64((Double) literal);
    }
    if (literal instanceof BigDecimal) {
      return QueryParameterValue.bigNumeric((BigDecimal) literal);
    }
    if (literal instanceof Boolean) {
      return QueryParameterValue.bool((Boolean) literal);
    }
    return QueryParameterValue.string(literal.toString());
  }

  @Override public Enumerator<RowBatch> scan(ScanRequest request) {
    ScanSchema scanSchema = schema();
    FieldList tableFields = fields();
    int[] projection = scanSchema.resolveProjection(request.getProjection());
    String sql = buildQuery(scanSchema, projection, request.getFilters());
    QueryJobConfiguration.Builder config =
        QueryJobConfiguration.newBuilder(sql).setUseLegacySql(false);
    for (ScanFilter filter : request.getFilters()) {
      Object literal = filter.getLiteral();
      if (!filter.getOp().isUnary() && literal != null) {
        config.addPositionalParameter(toParameter(literal));
      }
    }
    LOGGER.debug("Running BigQuery query {}", sql);
    TableResult result;
    try {
      result = client.query(config.build());
    } catch (BigQueryException e) {
      throw FederationException.io("BigQuery query failed on " + tableId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw FederationException.io("interrupted while querying " + tableId, e);
    }
    Iterator<FieldValueList> rows = result.iterateAll().iterator();
    return new BatchEnumerator(request, projection.length) {
      @Override protected @Nullable Object @Nullable [] nextRow() {
        if (!rows.hasNext()) {
          return null;
        }
        FieldValueList values = rows.next();
        Object[] row = new Object[projection.length];
        for (int i = 0; i < projection.length; i++) {
          row[i] = value(values.get(i), tableFields.get(projection[i]),
              scanSchema.getColumn(projection[i]));
        }
        return row;
      }

      @Override protected void closeSource() {
        // result pages are fetched on demand and hold no connection
      }
    };
  }

  static @Nullable Object value(FieldValue value, Field field, ScanColumn column) {
    if (value.isNull()) {
      return null;
    }
    if (field.getMode() == Field.Mode.REPEATED
        || field.getType().getStandardType() == StandardSQLTypeName.STRUCT) {
      return toJson(toPlain(value, field, field.getMode() == Field.Mode.REPEATED));
    }
    switch (column.getType()) {
    case BOOLEAN:
      return value.getBooleanValue();
    case BIGINT:
      return value.getLongValue();
    case DOUBLE:
      return value.getDoubleValue();
    case DECIMAL:
      return value.getNumericValue();
    case VARBINARY:
      return new ByteString(value.getBytesValue());
    case DATE:
      return (int) LocalDate.parse(value.getStringValue()).toEpochDay();
    case TIME:
      return (int) (LocalTime.parse(value.getStringValue()).toNanoOfDay() / 1_000_000L);
    case TIMESTAMP:
      return LocalDateTime.parse(value.getStringValue())
          .toInstant(ZoneOffset.UTC).toEpochMilli();
    case TIMESTAMP_WITH_LOCAL_TIME_ZONE:
      return value.getTimestampValue() / 1000L;
    default:
      return value.getStringValue();
    }
  }

  private static @Nullable Object toPlain(FieldValue value, Field field, boolean repeated) {
    if (value.isNull()) {
      return null;
    }
    if (repeated) {
      List<@Nullable Object> list = new ArrayList<>();
      for (FieldValue item : value.getRepeatedValue()) {
        list.add(toPlain(item, field, false));
      }
      return list;
    }
    if (field.getType().getStandardType() == StandardSQLTypeName.STRUCT) {
      FieldList subFields = field.getSubFields();
      FieldValueList record = value.getRecordValue();
      Map<String, @Nullable Object> map = new LinkedHashMap<>();
      for (int i = 0; i < subFields.size() && i < record.size(); i++) {
        Field subField = subFields.get(i);
        map.put(subField.getName(),
            toPlain(record.get(i), subField, subField.getMode() == Field.Mode.REPEATED));
      }
      return map;
    }
    return value.getValue();
  }

  private static String toJson(@Nullable Object plain) {
    try {
      return MAPPER.writeValueAsString(plain);
    } catch (JsonProcessingException e) {
      throw new FederationException(ErrorKind.TYPE_MISMATCH,
          "cannot render BigQuery value as JSON", e);
    }
  }

  @Override public void close() {
    // the BigQuery client holds no connection between requests
  }
}
