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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.UnsignedLong;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.List;

/**
 * SQL hash functions {@code siphash} and {@code fnv}.
 *
 * <p>Both take zero or one argument and return the unsigned 64-bit hash of
 * the argument's {@link ValueEncoder canonical encoding} as a
 * {@code DECIMAL}. The zero-argument form hashes null. Keys and offsets are
 * fixed, so results are stable across calls and sessions.
 *
 * <p>Calcite matches user-defined function overloads by argument count;
 * the two- and three-argument overloads exist only to report
 * {@link ErrorKind#ARITY_ERROR}.
 */
public final class HashFunctions {
  private static final HashFunction SIPHASH = Hashing.sipHash24(0L, 0L);

  private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
  private static final long FNV_PRIME = 0x100000001b3L;

  private HashFunctions() {
  }

  public static BigDecimal siphash() {
    return unsigned(siphash64(null));
  }

  public static BigDecimal siphash(@Nullable Object value) {
    return unsigned(siphash64(value));
  }

  public static BigDecimal siphash(@Nullable Object a, @Nullable Object b) {
    throw arityError("siphash", 2);
  }

  public static BigDecimal siphash(@Nullable Object a, @Nullable Object b,
      @Nullable Object c) {
    throw arityError("siphash", 3);
  }

  public static BigDecimal fnv() {
    return unsigned(fnv64(null));
  }

  public static BigDecimal fnv(@Nullable Object value) {
    return unsigned(fnv64(value));
  }

  public static BigDecimal fnv(@Nullable Object a, @Nullable Object b) {
    throw arityError("fnv", 2);
  }

  public static BigDecimal fnv(@Nullable Object a, @Nullable Object b, @Nullable Object c) {
    throw arityError("fnv", 3);
  }

  /**
   * Evaluates {@code siphash} or {@code fnv} over an argument list of any
   * length.
   *
   * @throws FederationException with {@link ErrorKind#ARITY_ERROR} unless
   *     there are zero or one arguments
   */
  public static BigDecimal evaluate(String name, List<?> args) {
    if (args.size() > 1) {
      throw arityError(name, args.size());
    }
    Object value = args.isEmpty() ? null : args.get(0);
    switch (name) {
    case "siphash":
      return unsigned(siphash64(value));
    case "fnv":
      return unsigned(fnv64(value));
    default:
      throw new IllegalArgumentException("unknown hash function " + name);
    }
  }

  /** SipHash-2-4 with an all-zero key, as signed 64 bits. */
  public static long siphash64(@Nullable Object value) {
    return SIPHASH.hashBytes(ValueEncoder.encode(value)).asLong();
  }

  /** 64-bit FNV-1a, as signed 64 bits. */
  public static long fnv64(@Nullable Object value) {
    long hash = FNV_OFFSET_BASIS;
    for (byte b : ValueEncoder.encode(value)) {
      hash ^= b & 0xFF;
      hash *= FNV_PRIME;
    }
    return hash;
  }

  static BigDecimal unsigned(long bits) {
    return new BigDecimal(UnsignedLong.fromLongBits(bits).bigIntegerValue());
  }

  static FederationException arityError(String name, int count) {
    return new FederationException(ErrorKind.ARITY_ERROR,
        name + " takes zero or one argument, got " + count);
  }
}
