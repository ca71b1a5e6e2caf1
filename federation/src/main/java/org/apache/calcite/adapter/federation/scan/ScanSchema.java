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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, immutable column list declared by a {@link ScanProvider}.
 */
public final class ScanSchema {
  private final ImmutableList<ScanColumn> columns;

  public ScanSchema(List<ScanColumn> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  public static ScanSchema of(ScanColumn... columns) {
    return new ScanSchema(ImmutableList.copyOf(columns));
  }

  public List<ScanColumn> getColumns() {
    return columns;
  }

  public ScanColumn getColumn(int index) {
    return columns.get(index);
  }

  public int size() {
    return columns.size();
  }

  public List<String> getFieldNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (ScanColumn column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  /** Index of the named column, or -1. Names compare exactly. */
  public int indexOf(String name) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getName().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /** Column indexes a projection selects; {@code null} selects all. */
  public int[] resolveProjection(int @Nullable [] projection) {
    if (projection != null) {
      return projection;
    }
    int[] all = new int[columns.size()];
    for (int i = 0; i < all.length; i++) {
      all[i] = i;
    }
    return all;
  }

  public RelDataType toRelDataType(RelDataTypeFactory typeFactory) {
    RelDataTypeFactory.Builder builder = typeFactory.builder();
    for (ScanColumn column : columns) {
      builder.add(column.getName(), column.toRelDataType(typeFactory));
    }
    return builder.build();
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof ScanSchema && columns.equals(((ScanSchema) o).columns);
  }

  @Override public int hashCode() {
    return columns.hashCode();
  }

  @Override public String toString() {
    return columns.toString();
  }
}
