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
package org.apache.calcite.adapter.federation.options;

import org.apache.calcite.adapter.federation.FederationException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Canonical option map shared by credentials, external tables and table
 * functions.
 *
 * <p>Keys are lower-cased. Values are normalized to {@link String},
 * {@link Long}, {@link BigDecimal}, {@link Boolean} or an immutable
 * {@link List} of those, so two option lists that differ only in spelling
 * ({@code key = value} versus {@code key => value}, {@code 10} versus
 * {@code 10L}) compare equal.
 */
public final class ExternalOptions {
  public static final ExternalOptions EMPTY = new ExternalOptions(ImmutableMap.of());

  /** Keys whose values are never rendered by {@link #toString()}. */
  private static final Set<String> SECRET_KEYS =
      ImmutableSet.of("password", "secret_access_key", "access_key_id",
          "service_account_key", "connection_string");

  private final ImmutableMap<String, Object> values;

  private ExternalOptions(ImmutableMap<String, Object> values) {
    this.values = values;
  }

  /** Creates options from a raw map; null values are dropped. */
  public static ExternalOptions of(Map<String, ?> raw) {
    Builder builder = builder();
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      builder.put(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable Object get(String key) {
    return values.get(key.toLowerCase(Locale.ROOT));
  }

  public boolean containsKey(String key) {
    return values.containsKey(key.toLowerCase(Locale.ROOT));
  }

  public Set<String> keySet() {
    return values.keySet();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Returns a copy with {@code key} removed. */
  public ExternalOptions without(String key) {
    String normalized = key.toLowerCase(Locale.ROOT);
    if (!values.containsKey(normalized)) {
      return this;
    }
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.remove(normalized);
    return new ExternalOptions(ImmutableMap.copyOf(copy));
  }

  /** Returns a copy with {@code key} set to {@code value}. */
  public ExternalOptions with(String key, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(key.toLowerCase(Locale.ROOT), normalizeValue(key, value));
    return new ExternalOptions(ImmutableMap.copyOf(copy));
  }

  public @Nullable String getString(String key) {
    return (String) get(key);
  }

  public @Nullable Long getLong(String key) {
    return (Long) get(key);
  }

  public @Nullable Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  @SuppressWarnings("unchecked")
  public @Nullable List<String> getStringList(String key) {
    return (List<String>) get(key);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof ExternalOptions
        && values.equals(((ExternalOptions) o).values);
  }

  @Override public int hashCode() {
    return Objects.hash(values);
  }

  @Override public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    values.forEach((k, v) ->
        joiner.add(k + "=" + (SECRET_KEYS.contains(k) ? "***" : v)));
    return joiner.toString();
  }

  /** Converts a raw option value to its canonical representation. */
  static Object normalizeValue(String key, Object value) {
    if (value instanceof String || value instanceof Boolean || value instanceof Long) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger) {
      BigInteger big = (BigInteger) value;
      return big.bitLength() < 64 ? (Object) big.longValue() : new BigDecimal(big);
    }
    if (value instanceof BigDecimal) {
      BigDecimal decimal = (BigDecimal) value;
      if (decimal.scale() <= 0) {
        try {
          return decimal.longValueExact();
        } catch (ArithmeticException e) {
          return decimal;
        }
      }
      return decimal;
    }
    if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(((Number) value).doubleValue());
    }
    if (value instanceof Character) {
      return value.toString();
    }
    if (value instanceof List) {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (Object element : (List<?>) value) {
        if (element == null) {
          throw FederationException.invalidOption(
              "option '%s' must not contain null elements", key);
        }
        list.add(normalizeValue(key, element));
      }
      return list.build();
    }
    throw FederationException.invalidOption("option '%s' has unsupported value type %s",
        key, value.getClass().getSimpleName());
  }

  /** Builder for {@link ExternalOptions}. */
  public static final class Builder {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {
    }

    /** Adds an option; a key that differs only in case from an earlier one
     * is rejected. */
    public Builder put(String key, @Nullable Object value) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      if (normalized.isEmpty()) {
        throw FederationException.invalidOption("option name must not be empty");
      }
      if (values.containsKey(normalized)) {
        throw FederationException.invalidOption("option '%s' specified more than once",
            normalized);
      }
      if (value != null) {
        values.put(normalized, normalizeValue(normalized, value));
      }
      return this;
    }

    public ExternalOptions build() {
      return values.isEmpty() ? EMPTY : new ExternalOptions(ImmutableMap.copyOf(values));
    }
  }
}
