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

import org.apache.calcite.DataContext;
import org.apache.calcite.DataContexts;
import org.apache.calcite.jdbc.JavaTypeFactoryImpl;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ExternalTable}, filter translation and cancellation.
 */
@Tag("unit")
public class ExternalTableTest {
  private static final ScanSchema SCHEMA = ScanSchema.of(
      ScanColumn.of("id", SqlTypeName.BIGINT),
      ScanColumn.of("name", SqlTypeName.VARCHAR));

  private final RelDataTypeFactory typeFactory = new JavaTypeFactoryImpl();
  private final RexBuilder rexBuilder = new RexBuilder(typeFactory);

  /** In-memory provider that counts opens and closes and keeps its request. */
  private static class ListProvider implements ScanProvider {
    final List<Object[]> rows;
    final AtomicInteger closed;
    @Nullable ScanRequest request;

    ListProvider(List<Object[]> rows, AtomicInteger closed) {
      this.rows = rows;
      this.closed = closed;
    }

    @Override public ScanSchema schema() {
      return SCHEMA;
    }

    @Override public Enumerator<RowBatch> scan(ScanRequest scanRequest) {
      this.request = scanRequest;
      int[] projection = SCHEMA.resolveProjection(scanRequest.getProjection());
      return new BatchEnumerator(scanRequest, projection.length) {
        private int next;

        @Override protected @Nullable Object @Nullable [] nextRow() {
          if (next >= rows.size()) {
            return null;
          }
          Object[] source = rows.get(next++);
          Object[] row = new Object[projection.length];
          for (int i = 0; i < projection.length; i++) {
            row[i] = source[projection[i]];
          }
          return row;
        }

        @Override protected void closeSource() {
          // rows are in memory
        }
      };
    }

    @Override public void close() {
      closed.incrementAndGet();
    }
  }

  private static List<Object[]> rows(int count) {
    List<Object[]> rows = new ArrayList<>();
    for (long i = 0; i < count; i++) {
      rows.add(new Object[] {i, "n" + i});
    }
    return rows;
  }

  private RexNode ref(int index) {
    RelDataType rowType = SCHEMA.toRelDataType(typeFactory);
    return rexBuilder.makeInputRef(rowType.getFieldList().get(index).getType(), index);
  }

  @Test void testRowType() {
    ExternalTable table = new ExternalTable("t",
        () -> new ListProvider(rows(0), new AtomicInteger()));
    RelDataType rowType = table.getRowType(typeFactory);
    assertEquals("id", rowType.getFieldList().get(0).getName());
    assertEquals(SqlTypeName.VARCHAR, rowType.getFieldList().get(1).getType().getSqlTypeName());
  }

  @Test void testToScanFilter() {
    RexNode gt = rexBuilder.makeCall(SqlStdOperatorTable.GREATER_THAN, ref(0),
        rexBuilder.makeExactLiteral(BigDecimal.valueOf(5)));
    assertEquals(new ScanFilter(0, ScanFilter.Op.GT, 5L), ExternalTable.toScanFilter(gt, SCHEMA));

    RexNode reversed = rexBuilder.makeCall(SqlStdOperatorTable.LESS_THAN,
        rexBuilder.makeExactLiteral(BigDecimal.valueOf(5)), ref(0));
    assertEquals(new ScanFilter(0, ScanFilter.Op.GT, 5L),
        ExternalTable.toScanFilter(reversed, SCHEMA));

    RexNode eq = rexBuilder.makeCall(SqlStdOperatorTable.EQUALS, ref(1),
        rexBuilder.makeLiteral("n1"));
    assertEquals(new ScanFilter(1, ScanFilter.Op.EQ, "n1"), ExternalTable.toScanFilter(eq, SCHEMA));

    RexNode isNull = rexBuilder.makeCall(SqlStdOperatorTable.IS_NULL, ref(1));
    assertEquals(new ScanFilter(1, ScanFilter.Op.IS_NULL, null),
        ExternalTable.toScanFilter(isNull, SCHEMA));

    RexNode fractional = rexBuilder.makeCall(SqlStdOperatorTable.EQUALS, ref(0),
        rexBuilder.makeExactLiteral(new BigDecimal("1.5")));
    assertNull(ExternalTable.toScanFilter(fractional, SCHEMA));

    RexNode like = rexBuilder.makeCall(SqlStdOperatorTable.LIKE, ref(1),
        rexBuilder.makeLiteral("n%"));
    assertNull(ExternalTable.toScanFilter(like, SCHEMA));
  }

  @Test void testPushDownRemovesAcceptedFilters() {
    AtomicInteger closed = new AtomicInteger();
    List<ListProvider> created = new ArrayList<>();
    ExternalTable table = new ExternalTable("t", new ScanProviderFactory() {
      @Override public ScanProvider create() {
        ListProvider provider = new ListProvider(rows(3), closed);
        created.add(provider);
        return provider;
      }

      @Override public boolean canPushDown(ScanFilter filter) {
        return filter.getLiteral() instanceof Long;
      }
    });
    RexNode numeric = rexBuilder.makeCall(SqlStdOperatorTable.GREATER_THAN_OR_EQUAL, ref(0),
        rexBuilder.makeExactLiteral(BigDecimal.ONE));
    RexNode string = rexBuilder.makeCall(SqlStdOperatorTable.GREATER_THAN, ref(1),
        rexBuilder.makeLiteral("a"));
    List<RexNode> filters = new ArrayList<>();
    filters.add(numeric);
    filters.add(string);

    List<@Nullable Object[]> result =
        table.scan(DataContexts.EMPTY, filters, new int[] {1}).toList();
    assertEquals(1, filters.size());
    assertEquals(string, filters.get(0));
    assertEquals(3, result.size());
    assertArrayEquals(new Object[] {"n0"}, result.get(0));

    ScanRequest request = created.get(0).request;
    assertEquals(1, request.getFilters().size());
    assertEquals(new ScanFilter(0, ScanFilter.Op.GE, 1L), request.getFilters().get(0));
    assertEquals(1, closed.get());
  }

  @Test void testCancellation() {
    AtomicBoolean cancel = new AtomicBoolean();
    ScanRequest request = new ScanRequest(null, new ArrayList<>(), cancel, 10);
    AtomicInteger closed = new AtomicInteger();
    ListProvider provider = new ListProvider(rows(25), closed);
    try (Enumerator<RowBatch> batches = provider.scan(request)) {
      assertTrue(batches.moveNext());
      assertEquals(10, batches.current().getRowCount());
      cancel.set(true);
      assertFalse(batches.moveNext());
      assertFalse(batches.moveNext());
    }
  }

  @Test void testCancelFlagFromDataContext() {
    AtomicBoolean cancel = new AtomicBoolean(true);
    AtomicInteger closed = new AtomicInteger();
    ExternalTable table = new ExternalTable("t", () -> new ListProvider(rows(5), closed));
    DataContext root = DataContexts.of(
        ImmutableMap.of(DataContext.Variable.CANCEL_FLAG.camelName, cancel));
    assertEquals(0, table.scan(root, new ArrayList<>(), null).toList().size());
    assertEquals(1, closed.get());
  }

  @Test void testBatchSize() {
    ScanRequest request = ScanRequest.all().withBatchSize(2);
    ListProvider provider = new ListProvider(rows(5), new AtomicInteger());
    List<Integer> sizes = new ArrayList<>();
    try (Enumerator<RowBatch> batches = provider.scan(request)) {
      while (batches.moveNext()) {
        sizes.add(batches.current().getRowCount());
      }
    }
    assertEquals(ImmutableList.of(2, 2, 1), sizes);
  }
}
