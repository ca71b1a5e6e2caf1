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

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, column-major chunk of rows.
 *
 * <p>Values use Calcite's internal representation: TIMESTAMP as {@code Long}
 * epoch millis, DATE as {@code Integer} epoch days, VARBINARY as
 * {@link org.apache.calcite.avatica.util.ByteString}.
 */
public final class RowBatch {
  private final int rowCount;
  private final List<List<@Nullable Object>> columns;

  private RowBatch(int rowCount, List<List<@Nullable Object>> columns) {
    this.rowCount = rowCount;
    this.columns = columns;
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public boolean isEmpty() {
    return rowCount == 0;
  }

  public @Nullable Object get(int row, int column) {
    return columns.get(column).get(row);
  }

  public List<@Nullable Object> getColumn(int column) {
    return columns.get(column);
  }

  /** Copies one row out of the batch. */
  public @Nullable Object[] getRow(int row) {
    Object[] values = new Object[columns.size()];
    for (int c = 0; c < values.length; c++) {
      values[c] = columns.get(c).get(row);
    }
    return values;
  }

  public static Builder builder(int columnCount) {
    return new Builder(columnCount);
  }

  @Override public String toString() {
    return "RowBatch{rows=" + rowCount + ", columns=" + columns.size() + "}";
  }

  /** Accumulates rows; {@link #build()} freezes them. */
  public static final class Builder {
    private final int columnCount;
    private final List<@Nullable Object[]> rows = new ArrayList<>();

    private Builder(int columnCount) {
      this.columnCount = columnCount;
    }

    public Builder add(@Nullable Object[] row) {
      Preconditions.checkArgument(row.length == columnCount,
          "row has %s values, expected %s", row.length, columnCount);
      rows.add(row);
      return this;
    }

    public int size() {
      return rows.size();
    }

    public RowBatch build() {
      List<List<@Nullable Object>> columns = new ArrayList<>(columnCount);
      for (int c = 0; c < columnCount; c++) {
        Object[] column = new Object[rows.size()];
        for (int r = 0; r < column.length; r++) {
          column[r] = rows.get(r)[c];
        }
        columns.add(Collections.unmodifiableList(Arrays.asList(column)));
      }
      return new RowBatch(rows.size(), Collections.unmodifiableList(columns));
    }
  }
}
