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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Declares one option accepted by a connector or credential provider.
 */
public final class OptionSpec {
  private final String name;
  private final OptionType type;
  private final boolean required;
  private final @Nullable Object defaultValue;
  private final @Nullable Long minValue;
  private final @Nullable Long maxValue;

  private OptionSpec(String name, OptionType type, boolean required,
      @Nullable Object defaultValue, @Nullable Long minValue, @Nullable Long maxValue) {
    this.name = name;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    this.minValue = minValue;
    this.maxValue = maxValue;
  }

  public static OptionSpec required(String name, OptionType type) {
    return new OptionSpec(name, type, true, null, null, null);
  }

  public static OptionSpec optional(String name, OptionType type) {
    return new OptionSpec(name, type, false, null, null, null);
  }

  public OptionSpec withDefault(Object value) {
    return new OptionSpec(name, type, false, value, minValue, maxValue);
  }

  public OptionSpec withRange(@Nullable Long min, @Nullable Long max) {
    return new OptionSpec(name, type, required, defaultValue, min, max);
  }

  public String getName() {
    return name;
  }

  public OptionType getType() {
    return type;
  }

  public boolean isRequired() {
    return required;
  }

  /**
   * Validates {@code options} against {@code specs}: rejects unknown keys,
   * missing required keys, wrong types and out-of-range integers, and fills
   * in defaults. No I/O happens here.
   *
   * @param owner Name used in error messages, e.g. "excel"
   * @return Options holding only declared keys with coerced values
   */
  public static ExternalOptions validate(String owner, List<OptionSpec> specs,
      ExternalOptions options) {
    Map<String, OptionSpec> byName = new LinkedHashMap<>();
    for (OptionSpec spec : specs) {
      byName.put(spec.name, spec);
    }
    for (String key : options.keySet()) {
      if (!byName.containsKey(key)) {
        throw FederationException.invalidOption("unknown option '%s' for %s; expected one of %s",
            key, owner, new TreeSet<>(byName.keySet()));
      }
    }
    ExternalOptions.Builder builder = ExternalOptions.builder();
    for (OptionSpec spec : specs) {
      Object raw = options.get(spec.name);
      if (raw == null) {
        if (spec.required) {
          throw FederationException.invalidOption("missing required option '%s' for %s",
              spec.name, owner);
        }
        builder.put(spec.name, spec.defaultValue);
        continue;
      }
      builder.put(spec.name, spec.check(spec.type.coerce(spec.name, raw)));
    }
    return builder.build();
  }

  private Object check(Object value) {
    if (value instanceof Long) {
      long v = (Long) value;
      if (minValue != null && v < minValue) {
        throw FederationException.invalidOption("option '%s' must be >= %d, got %d",
            name, minValue, v);
      }
      if (maxValue != null && v > maxValue) {
        throw FederationException.invalidOption("option '%s' must be <= %d, got %d",
            name, maxValue, v);
      }
    }
    return value;
  }

  @Override public String toString() {
    return name + ":" + type + (required ? " (required)" : "");
  }
}
