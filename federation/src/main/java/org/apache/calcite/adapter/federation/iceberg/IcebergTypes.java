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
package org.apache.calcite.adapter.federation.iceberg;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.avatica.util.ByteString;
import org.apache.calcite.sql.type.SqlTypeName;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.iceberg.Schema;
import org.apache.iceberg.StructLike;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.types.Type;
import org.apache.iceberg.types.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.ByteBuffer;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps Iceberg types and generic values onto Calcite column types and
 * internal values. Structs, lists and maps are exposed as JSON text.
 */
public final class IcebergTypes {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private IcebergTypes() {
  }

  public static ScanSchema toScanSchema(Schema schema) {
    List<ScanColumn> columns = new ArrayList<>();
    for (Types.NestedField field : schema.columns()) {
      columns.add(toScanColumn(field));
    }
    return new ScanSchema(columns);
  }

  static ScanColumn toScanColumn(Types.NestedField field) {
    Type type = field.type();
    boolean nullable = field.isOptional();
    switch (type.typeId()) {
    case BOOLEAN:
      return column(field, SqlTypeName.BOOLEAN, nullable);
    case INTEGER:
      return column(field, SqlTypeName.INTEGER, nullable);
    case LONG:
      return column(field, SqlTypeName.BIGINT, nullable);
    case FLOAT:
      return column(field, SqlTypeName.REAL, nullable);
    case DOUBLE:
      return column(field, SqlTypeName.DOUBLE, nullable);
    case DATE:
      return column(field, SqlTypeName.DATE, nullable);
    case TIME:
      return column(field, SqlTypeName.TIME, nullable);
    case TIMESTAMP:
      return column(field,
          ((Types.TimestampType) type).shouldAdjustToUTC()
              ? SqlTypeName.TIMESTAMP_WITH_LOCAL_TIME_ZONE
              : SqlTypeName.TIMESTAMP,
          nullable);
    case DECIMAL:
      Types.DecimalType decimal = (Types.DecimalType) type;
      return new ScanColumn(field.name(), SqlTypeName.DECIMAL,
          decimal.precision(), decimal.scale(), nullable);
    case BINARY:
    case FIXED:
      return column(field, SqlTypeName.VARBINARY, nullable);
    default:
      // STRING, UUID and nested types
      return column(field, SqlTypeName.VARCHAR, nullable);
    }
  }

  private static ScanColumn column(Types.NestedField field, SqlTypeName type, boolean nullable) {
    return new ScanColumn(field.name(), type, -1, -1, nullable);
  }

  /** Converts a value read by Iceberg generics to Calcite's representation. */
  public static @Nullable Object toCalcite(@Nullable Object value, Type type) {
    if (value == null) {
      return null;
    }
    switch (type.typeId()) {
    case STRING:
    case UUID:
      return value.toString();
    case DATE:
      return (int) ((LocalDate) value).toEpochDay();
    case TIME:
      return (int) (((LocalTime) value).toNanoOfDay() / 1_000_000L);
    case TIMESTAMP:
      if (value instanceof OffsetDateTime) {
        return ((OffsetDateTime) value).toInstant().toEpochMilli();
      }
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toEpochMilli();
    case BINARY:
      return new ByteString(bytes((ByteBuffer) value));
    case FIXED:
      return new ByteString((byte[]) value);
    case STRUCT:
    case LIST:
    case MAP:
      return toJson(toPlain(value, type));
    default:
      return value;
    }
  }

  /** JSON-friendly form of a value: nested types become maps and lists. */
  static @Nullable Object toPlain(@Nullable Object value, Type type) {
    if (value == null) {
      return null;
    }
    switch (type.typeId()) {
    case STRUCT:
      Types.StructType struct = type.asStructType();
      Map<String, @Nullable Object> map = new LinkedHashMap<>();
      List<Types.NestedField> fields = struct.fields();
      for (int i = 0; i < fields.size(); i++) {
        Types.NestedField field = fields.get(i);
        Object fieldValue = value instanceof Record
            ? ((Record) value).getField(field.name())
            : ((StructLike) value).get(i, Object.class);
        map.put(field.name(), toPlain(fieldValue, field.type()));
      }
      return map;
    case LIST:
      Type element = type.asListType().elementType();
      List<@Nullable Object> list = new ArrayList<>();
      for (Object item : (List<?>) value) {
        list.add(toPlain(item, element));
      }
      return list;
    case MAP:
      Types.MapType mapType = type.asMapType();
      Map<String, @Nullable Object> entries = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        entries.put(String.valueOf(toPlain(entry.getKey(), mapType.keyType())),
            toPlain(entry.getValue(), mapType.valueType()));
      }
      return entries;
    case BOOLEAN:
    case INTEGER:
    case LONG:
    case FLOAT:
    case DOUBLE:
    case DECIMAL:
      return value;
    default:
      return value instanceof ByteBuffer ? ByteString.toString(bytes((ByteBuffer) value), 16)
          : value.toString();
    }
  }

  static String toJson(@Nullable Object plain) {
    try {
      return MAPPER.writeValueAsString(plain);
    } catch (JsonProcessingException e) {
      throw new FederationException(ErrorKind.TYPE_MISMATCH,
          "cannot render nested Iceberg value as JSON", e);
    }
  }

  private static byte[] bytes(ByteBuffer buffer) {
    ByteBuffer copy = buffer.duplicate();
    byte[] bytes = new byte[copy.remaining()];
    copy.get(bytes);
    return bytes;
  }
}
