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

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Value type of a declared option, with the coercion each type allows.
 */
public enum OptionType {
  STRING {
    @Override Object coerce(String name, Object value) {
      if (value instanceof String) {
        return value;
      }
      throw mismatch(name, value);
    }
  },
  INTEGER {
    @Override Object coerce(String name, Object value) {
      if (value instanceof Long) {
        return value;
      }
      if (value instanceof BigDecimal) {
        BigDecimal decimal = (BigDecimal) value;
        try {
          return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
          throw FederationException.invalidOption(
              "option '%s' must be an integer, got %s", name, decimal.toPlainString());
        }
      }
      throw mismatch(name, value);
    }
  },
  BOOLEAN {
    @Override Object coerce(String name, Object value) {
      if (value instanceof Boolean) {
        return value;
      }
      if (value instanceof String) {
        switch (((String) value).trim().toLowerCase(Locale.ROOT)) {
        case "true":
          return Boolean.TRUE;
        case "false":
          return Boolean.FALSE;
        default:
          break;
        }
      }
      throw mismatch(name, value);
    }
  },
  /** A single string or a list of strings; always coerced to a list. */
  STRING_LIST {
    @Override Object coerce(String name, Object value) {
      if (value instanceof String) {
        return ImmutableList.of(value);
      }
      if (value instanceof List) {
        for (Object element : (List<?>) value) {
          if (!(element instanceof String)) {
            throw mismatch(name, element);
          }
        }
        return value;
      }
      throw mismatch(name, value);
    }
  };

  abstract Object coerce(String name, Object value);

  FederationException mismatch(String name, Object value) {
    return FederationException.invalidOption("option '%s' expects %s, got %s '%s'",
        name, toString().toLowerCase(Locale.ROOT).replace('_', ' '),
        value.getClass().getSimpleName(), value);
  }
}
