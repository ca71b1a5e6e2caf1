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
package org.apache.calcite.adapter.federation.scan;

import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

import java.util.Objects;

/**
 * One column of a {@link ScanSchema}.
 */
public final class ScanColumn {
  private final String name;
  private final SqlTypeName type;
  private final int precision;
  private final int scale;
  private final boolean nullable;

  public ScanColumn(String name, SqlTypeName type, int precision, int scale, boolean nullable) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.precision = precision;
    this.scale = scale;
    this.nullable = nullable;
  }

  public static ScanColumn of(String name, SqlTypeName type) {
    return new ScanColumn(name, type, -1, -1, true);
  }

  public static ScanColumn notNull(String name, SqlTypeName type) {
    return new ScanColumn(name, type, -1, -1, false);
  }

  public static ScanColumn decimal(String name, int precision, int scale) {
    return new ScanColumn(name, SqlTypeName.DECIMAL, precision, scale, true);
  }

  public String getName() {
    return name;
  }

  public SqlTypeName getType() {
    return type;
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  public boolean isNullable() {
    return nullable;
  }

  RelDataType toRelDataType(RelDataTypeFactory typeFactory) {
    RelDataType relType;
    if (precision >= 0 && scale >= 0 && type.allowsScale()) {
      relType = typeFactory.createSqlType(type, precision, scale);
    } else if (precision >= 0 && type.allowsPrec()) {
      relType = typeFactory.createSqlType(type, precision);
    } else {
      relType = typeFactory.createSqlType(type);
    }
    return typeFactory.createTypeWithNullability(relType, nullable);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScanColumn)) {
      return false;
    }
    ScanColumn that = (ScanColumn) o;
    return name.equals(that.name) && type == that.type
        && precision == that.precision && scale == that.scale && nullable == that.nullable;
  }

  @Override public int hashCode() {
    return Objects.hash(name, type, precision, scale, nullable);
  }

  @Override public String toString() {
    return name + " " + type + (nullable ? "" : " NOT NULL");
  }
}
