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
package org.apache.calcite.adapter.federation;

import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Factory that creates a {@link FederationSchema} from a model.
 *
 * <p>Operand:
 * <pre>
 * {
 *   "credentials": [
 *     {"name": "aws1", "provider": "aws", "options": {...}, "comment": "..."}
 *   ],
 *   "tables": [
 *     {"name": "events", "provider": "ndjson", "options": {"location": "..."}}
 *   ]
 * }
 * </pre>
 * Set {@code "cache": false} on the schema to see tables created by DDL
 * after the model is loaded.
 */
@SuppressWarnings("UnusedDeclaration")
public class FederationSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(FederationSchemaFactory.class);

  /** Public singleton, per factory contract. */
  public static final FederationSchemaFactory INSTANCE = new FederationSchemaFactory();

  private FederationSchemaFactory() {
  }

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    FederationSession session = new FederationSession();
    for (Map<String, Object> credential : entries(operand, "credentials")) {
      session.getCredentials().create(required(credential, "name"),
          required(credential, "provider"), options(credential),
          (String) credential.get("comment"));
    }
    for (Map<String, Object> table : entries(operand, "tables")) {
      session.getCatalog().create(required(table, "name"), required(table, "provider"),
          options(table), false);
    }
    LOGGER.debug("Created federation schema '{}'", name);
    return session.getSchema();
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> entries(Map<String, Object> operand, String key) {
    Object value = operand.get(key);
    if (value == null) {
      return ImmutableList.of();
    }
    if (!(value instanceof List)) {
      throw FederationException.invalidOption("operand '%s' must be a list", key);
    }
    return (List<Map<String, Object>>) value;
  }

  private static String required(Map<String, Object> entry, String key) {
    Object value = entry.get(key);
    if (!(value instanceof String)) {
      throw FederationException.invalidOption("model entry needs a string '%s': %s",
          key, entry.keySet());
    }
    return (String) value;
  }

  @SuppressWarnings("unchecked")
  private static ExternalOptions options(Map<String, Object> entry) {
    @Nullable Object options = entry.get("options");
    if (options == null) {
      return ExternalOptions.EMPTY;
    }
    if (!(options instanceof Map)) {
      throw FederationException.invalidOption("'options' must be an object");
    }
    return ExternalOptions.of((Map<String, ?>) options);
  }
}
