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
package org.apache.calcite.adapter.federation.format;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.sql.type.SqlTypeName;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Type inference and coercion shared by the file format readers.
 *
 * <p>Readers first turn source values into plain Java values
 * ({@link String}, {@link Long}, {@link Double}, {@link Boolean},
 * {@link LocalDateTime}); this class infers a column type from a sample of
 * them and converts later values to Calcite's internal representation.
 */
public final class ValueCoercion {
  private ValueCoercion() {
  }

  /** SQL type of a single plain value, or null for null. */
  public static @Nullable SqlTypeName typeOf(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Long) {
      return SqlTypeName.BIGINT;
    }
    if (value instanceof Double) {
      return SqlTypeName.DOUBLE;
    }
    if (value instanceof Boolean) {
      return SqlTypeName.BOOLEAN;
    }
    if (value instanceof LocalDateTime) {
      return SqlTypeName.TIMESTAMP;
    }
    return SqlTypeName.VARCHAR;
  }

  /**
   * Combines two observed types: unknown yields to known, BIGINT and DOUBLE
   * widen to DOUBLE, any other conflict becomes VARCHAR.
   */
  public static @Nullable SqlTypeName merge(@Nullable SqlTypeName a, @Nullable SqlTypeName b) {
    if (a == null) {
      return b;
    }
    if (b == null || a == b) {
      return a;
    }
    if ((a == SqlTypeName.BIGINT && b == SqlTypeName.DOUBLE)
        || (a == SqlTypeName.DOUBLE && b == SqlTypeName.BIGINT)) {
      return SqlTypeName.DOUBLE;
    }
    return SqlTypeName.VARCHAR;
  }

  /** Type for a column after sampling; all-null columns are VARCHAR. */
  public static SqlTypeName finish(@Nullable SqlTypeName type) {
    return type == null ? SqlTypeName.VARCHAR : type;
  }

  /**
   * Converts a plain value to the column's type.
   *
   * @throws FederationException with {@link ErrorKind#TYPE_MISMATCH} if the
   *     value cannot be represented
   */
  public static @Nullable Object coerce(@Nullable Object value, ScanColumn column) {
    if (value == null) {
      return null;
    }
    switch (column.getType()) {
    case VARCHAR:
      if (value instanceof Double && Double.isFinite((Double) value)) {
        return BigDecimal.valueOf((Double) value).toPlainString();
      }
      return value.toString();
    case BIGINT:
      if (value instanceof Long) {
        return value;
      }
      if (value instanceof Double) {
        double d = (Double) value;
        if (d == Math.rint(d) && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
          return (long) d;
        }
      }
      break;
    case DOUBLE:
      if (value instanceof Long || value instanceof Double) {
        return ((Number) value).doubleValue();
      }
      break;
    case BOOLEAN:
      if (value instanceof Boolean) {
        return value;
      }
      break;
    case TIMESTAMP:
      if (value instanceof LocalDateTime) {
        return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toEpochMilli();
      }
      break;
    default:
      break;
    }
    throw new FederationException(ErrorKind.TYPE_MISMATCH,
        "cannot convert value '" + value + "' to " + column.getType()
            + " for column '" + column.getName() + "'");
  }
}
