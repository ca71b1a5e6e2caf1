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

import org.apache.calcite.adapter.federation.connector.Connector;
import org.apache.calcite.adapter.federation.connector.FileConnector;
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.scan.ExternalTable;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;
import org.apache.calcite.interpreter.Bindables;
import org.apache.calcite.plan.RelOptTable;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.FunctionParameter;
import org.apache.calcite.schema.TableMacro;
import org.apache.calcite.schema.TranslatableTable;
import org.apache.calcite.util.NlsString;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table function such as {@code read_ndjson('/data/*.json', 10)} or
 * {@code read_ndjson(path => '/data/*.json', infer_rows => 10)}.
 *
 * <p>The first parameter is the location; the rest map one to one onto
 * connector options. Calcite binds a call either by position or by name,
 * not both at once. Arguments are validated when the call is bound, without
 * I/O; locations are resolved and the schema inferred when the row type is
 * first needed.
 */
public class ExternalTableMacro implements TableMacro {
  private final String name;
  private final Connector connector;
  private final CredentialStore credentials;
  private final ImmutableList<FunctionParameter> parameters;

  /**
   * Creates a macro.
   *
   * @param name Function name
   * @param connector Connector that binds the arguments
   * @param credentials Store credentials are looked up in
   * @param locationParameter Name of the first, required parameter
   * @param optionParameters Names of the optional parameters, each also the
   *     name of a connector option
   */
  public ExternalTableMacro(String name, Connector connector, CredentialStore credentials,
      String locationParameter, List<String> optionParameters) {
    this.name = name;
    this.connector = connector;
    this.credentials = credentials;
    List<FunctionParameter> params = new ArrayList<>();
    params.add(parameter(0, locationParameter, false));
    for (String option : optionParameters) {
      params.add(parameter(params.size(), option, true));
    }
    this.parameters = ImmutableList.copyOf(params);
  }

  public String getName() {
    return name;
  }

  @Override public List<FunctionParameter> getParameters() {
    return parameters;
  }

  @Override public TranslatableTable apply(List<? extends @Nullable Object> arguments) {
    ExternalOptions options = toOptions(arguments);
    ScanProviderFactory factory = connector.bind(options, credentials);
    return new MacroTable(name, factory);
  }

  /** Maps positional arguments onto option names; omitted ones are null. */
  ExternalOptions toOptions(List<? extends @Nullable Object> arguments) {
    Map<String, @Nullable Object> options = new LinkedHashMap<>();
    for (int i = 0; i < arguments.size() && i < parameters.size(); i++) {
      String key = i == 0 ? FileConnector.LOCATION : parameters.get(i).getName();
      options.put(key, toJava(arguments.get(i)));
    }
    return ExternalOptions.of(options);
  }

  /** Unwraps SQL character literals, also inside array arguments. */
  private static @Nullable Object toJava(@Nullable Object value) {
    if (value instanceof NlsString) {
      return ((NlsString) value).getValue();
    }
    if (value instanceof List) {
      List<@Nullable Object> list = new ArrayList<>();
      for (Object element : (List<?>) value) {
        list.add(toJava(element));
      }
      return list;
    }
    return value;
  }

  private static FunctionParameter parameter(int ordinal, String name, boolean optional) {
    return new FunctionParameter() {
      @Override public int getOrdinal() {
        return ordinal;
      }

      @Override public String getName() {
        return name;
      }

      @Override public RelDataType getType(RelDataTypeFactory typeFactory) {
        // typed by the connector's option specs, not by SQL
        return typeFactory.createJavaType(Object.class);
      }

      @Override public boolean isOptional() {
        return optional;
      }
    };
  }

  @Override public String toString() {
    return name + parameters;
  }

  /** Table returned by a macro call. It is not registered in any schema, so
   * its scan carries the table object instead of a name to look up. */
  static class MacroTable extends ExternalTable implements TranslatableTable {
    MacroTable(String name, ScanProviderFactory factory) {
      super(name, factory);
    }

    @Override public RelNode toRel(RelOptTable.ToRelContext context,
        RelOptTable relOptTable) {
      return Bindables.BindableTableScan.create(context.getCluster(), relOptTable);
    }
  }
}
