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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Engine-neutral predicate {@code column op literal} offered to providers
 * that can evaluate it at the source.
 */
public final class ScanFilter {
  /** Comparison operator. */
  public enum Op {
    EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">="),
    IS_NULL("IS NULL"), IS_NOT_NULL("IS NOT NULL");

    private final String sql;

    Op(String sql) {
      this.sql = sql;
    }

    public String getSql() {
      return sql;
    }

    public boolean isUnary() {
      return this == IS_NULL || this == IS_NOT_NULL;
    }

    /** Operator obtained by swapping the operands. */
    public Op reverse() {
      switch (this) {
      case LT:
        return GT;
      case LE:
        return GE;
      case GT:
        return LT;
      case GE:
        return LE;
      default:
        return this;
      }
    }
  }

  private final int column;
  private final Op op;
  private final @Nullable Object literal;

  public ScanFilter(int column, Op op, @Nullable Object literal) {
    this.column = column;
    this.op = Objects.requireNonNull(op, "op");
    this.literal = literal;
  }

  public int getColumn() {
    return column;
  }

  public Op getOp() {
    return op;
  }

  public @Nullable Object getLiteral() {
    return literal;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScanFilter)) {
      return false;
    }
    ScanFilter that = (ScanFilter) o;
    return column == that.column && op == that.op && Objects.equals(literal, that.literal);
  }

  @Override public int hashCode() {
    return Objects.hash(column, op, literal);
  }

  @Override public String toString() {
    return "$" + column + " " + op.getSql() + (op.isUnary() ? "" : " " + literal);
  }
}
