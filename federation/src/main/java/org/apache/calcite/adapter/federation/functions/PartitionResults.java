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
package org.apache.calcite.adapter.federation.functions;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.List;

/**
 * SQL predicate {@code partition_results(value, num_shards, shard_id)}.
 *
 * <p>Returns whether the unsigned SipHash of {@code value} modulo
 * {@code num_shards} equals {@code shard_id}. For any value exactly one
 * shard in {@code [0, num_shards)} accepts it.
 */
public final class PartitionResults {
  private PartitionResults() {
  }

  public static boolean partitionResults(@Nullable Object value, @Nullable Object numShards,
      @Nullable Object shardId) {
    long shards = integral("num_shards", numShards);
    long shard = integral("shard_id", shardId);
    if (shards <= 0) {
      throw FederationException.invalidOption("num_shards must be positive, got %d", shards);
    }
    if (shard < 0 || shard >= shards) {
      throw FederationException.invalidOption(
          "shard_id must be in [0, %d), got %d", shards, shard);
    }
    return shardOf(value, shards) == shard;
  }

  /**
   * Evaluates the predicate over an argument list.
   *
   * @throws FederationException with {@link ErrorKind#ARITY_ERROR} unless
   *     there are exactly three arguments
   */
  public static boolean evaluate(List<?> args) {
    if (args.size() != 3) {
      throw new FederationException(ErrorKind.ARITY_ERROR,
          "partition_results takes 3 arguments, got " + args.size());
    }
    return partitionResults(args.get(0), args.get(1), args.get(2));
  }

  /** Shard in {@code [0, numShards)} that {@code value} belongs to. */
  public static long shardOf(@Nullable Object value, long numShards) {
    return Long.remainderUnsigned(HashFunctions.siphash64(value), numShards);
  }

  /** Accepts integral numbers, including decimals such as {@code 10.0}. */
  static long integral(String name, @Nullable Object value) {
    BigDecimal decimal;
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    } else if (value instanceof BigDecimal) {
      decimal = (BigDecimal) value;
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw FederationException.invalidOption("%s must be an integer, got %s", name, value);
      }
      decimal = BigDecimal.valueOf(d);
    } else {
      throw FederationException.invalidOption("%s must be an integer, got %s", name, value);
    }
    try {
      return decimal.stripTrailingZeros().longValueExact();
    } catch (ArithmeticException e) {
      throw FederationException.invalidOption("%s must be an integer, got %s",
          name, decimal.toPlainString());
    }
  }
}
