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
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.schema.ProjectableFilterableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.type.SqlTypeName;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Calcite table over a {@link ScanProviderFactory}.
 *
 * <p>Each call to {@link #scan(DataContext, List, int[])} opens a fresh
 * {@link ScanProvider}, so concurrent scans share no mutable state. Simple
 * {@code column op literal} filters the factory accepts are pushed down and
 * removed from the list Calcite passes in; the rest are left for Calcite to
 * evaluate.
 */
public class ExternalTable extends AbstractTable implements ProjectableFilterableTable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExternalTable.class);

  private final String name;
  private final ScanProviderFactory factory;
  private volatile @Nullable ScanSchema schema;

  public ExternalTable(String name, ScanProviderFactory factory) {
    this.name = name;
    this.factory = factory;
  }

  public String getName() {
    return name;
  }

  public ScanProviderFactory getFactory() {
    return factory;
  }

  /** Declared schema, read from a short-lived provider on first use. */
  public ScanSchema getScanSchema() {
    ScanSchema result = schema;
    if (result == null) {
      try (ScanProvider provider = factory.create()) {
        result = provider.schema();
      }
      schema = result;
    }
    return result;
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return getScanSchema().toRelDataType(typeFactory);
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root,
      List<RexNode> filters, int @Nullable [] projects) {
    AtomicBoolean cancelFlag = DataContext.Variable.CANCEL_FLAG.get(root);
    AtomicBoolean flag = cancelFlag != null ? cancelFlag : new AtomicBoolean();
    ScanSchema scanSchema = getScanSchema();

    List<ScanFilter> pushed = new ArrayList<>();
    for (Iterator<RexNode> it = filters.iterator(); it.hasNext();) {
      ScanFilter filter = toScanFilter(it.next(), scanSchema);
      if (filter != null && factory.canPushDown(filter)) {
        pushed.add(filter);
        it.remove();
      }
    }
    if (!pushed.isEmpty()) {
      LOGGER.debug("Pushing {} filter(s) into scan of '{}': {}", pushed.size(), name, pushed);
    }

    ScanRequest request =
        new ScanRequest(projects, pushed, flag, ScanRequest.DEFAULT_BATCH_SIZE);
    return new AbstractEnumerable<@Nullable Object[]>() {
      @Override public Enumerator<@Nullable Object[]> enumerator() {
        ScanProvider provider = factory.create();
        try {
          return new RowEnumerator(provider, provider.scan(request));
        } catch (RuntimeException e) {
          provider.close();
          throw e;
        }
      }
    };
  }

  /** Translates {@code $i op literal}, {@code literal op $i} and null checks. */
  static @Nullable ScanFilter toScanFilter(RexNode node, ScanSchema scanSchema) {
    if (!(node instanceof RexCall)) {
      return null;
    }
    RexCall call = (RexCall) node;
    List<RexNode> operands = call.getOperands();
    ScanFilter.Op op;
    switch (call.getKind()) {
    case IS_NULL:
    case IS_NOT_NULL:
      if (operands.get(0) instanceof RexInputRef) {
        return new ScanFilter(((RexInputRef) operands.get(0)).getIndex(),
            call.getKind() == SqlKind.IS_NULL
                ? ScanFilter.Op.IS_NULL : ScanFilter.Op.IS_NOT_NULL, null);
      }
      return null;
    case EQUALS:
      op = ScanFilter.Op.EQ;
      break;
    case NOT_EQUALS:
      op = ScanFilter.Op.NE;
      break;
    case LESS_THAN:
      op = ScanFilter.Op.LT;
      break;
    case LESS_THAN_OR_EQUAL:
      op = ScanFilter.Op.LE;
      break;
    case GREATER_THAN:
      op = ScanFilter.Op.GT;
      break;
    case GREATER_THAN_OR_EQUAL:
      op = ScanFilter.Op.GE;
      break;
    default:
      return null;
    }
    RexNode left = operands.get(0);
    RexNode right = operands.get(1);
    if (left instanceof RexLiteral && right instanceof RexInputRef) {
      RexNode tmp = left;
      left = right;
      right = tmp;
      op = op.reverse();
    }
    if (!(left instanceof RexInputRef) || !(right instanceof RexLiteral)) {
      return null;
    }
    int index = ((RexInputRef) left).getIndex();
    Object value = literalValue((RexLiteral) right, scanSchema.getColumn(index));
    return value == null ? null : new ScanFilter(index, op, value);
  }

  private static @Nullable Object literalValue(RexLiteral literal, ScanColumn column) {
    if (literal.isNull()) {
      return null;
    }
    SqlTypeName literalType = literal.getTypeName();
    switch (column.getType()) {
    case CHAR:
    case VARCHAR:
      return SqlTypeName.CHAR_TYPES.contains(literalType)
          ? literal.getValueAs(String.class) : null;
    case TINYINT:
    case SMALLINT:
    case INTEGER:
    case BIGINT:
      if (!SqlTypeName.NUMERIC_TYPES.contains(literalType)) {
        return null;
      }
      BigDecimal number = literal.getValueAs(BigDecimal.class);
      if (number == null || number.stripTrailingZeros().scale() > 0) {
        return null;
      }
      return number.longValue();
    case FLOAT:
    case REAL:
    case DOUBLE:
      return SqlTypeName.NUMERIC_TYPES.contains(literalType)
          ? literal.getValueAs(Double.class) : null;
    case DECIMAL:
      return SqlTypeName.NUMERIC_TYPES.contains(literalType)
          ? literal.getValueAs(BigDecimal.class) : null;
    case BOOLEAN:
      return literalType == SqlTypeName.BOOLEAN ? literal.getValueAs(Boolean.class) : null;
    default:
      return null;
    }
  }

  @Override public String toString() {
    return "ExternalTable{" + name + "}";
  }

  /** Flattens batches into rows and closes the provider at the end. */
  private static class RowEnumerator implements Enumerator<@Nullable Object[]> {
    private final ScanProvider provider;
    private final Enumerator<RowBatch> batches;
    private @Nullable RowBatch batch;
    private int row = -1;
    private @Nullable Object @Nullable [] current;
    private boolean closed;

    RowEnumerator(ScanProvider provider, Enumerator<RowBatch> batches) {
      this.provider = provider;
      this.batches = batches;
    }

    @Override public @Nullable Object[] current() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      return current;
    }

    @Override public boolean moveNext() {
      while (batch == null || row + 1 >= batch.getRowCount()) {
        if (closed || !batches.moveNext()) {
          current = null;
          close();
          return false;
        }
        batch = batches.current();
        row = -1;
      }
      row++;
      current = batch.getRow(row);
      return true;
    }

    @Override public void reset() {
      throw new UnsupportedOperationException();
    }

    @Override public void close() {
      if (!closed) {
        closed = true;
        try {
          batches.close();
        } finally {
          provider.close();
        }
      }
    }
  }
}
