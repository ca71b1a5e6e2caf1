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

import org.apache.calcite.adapter.federation.connector.AbstractConnector;
import org.apache.calcite.adapter.federation.connector.ProviderKind;
import org.apache.calcite.adapter.federation.options.ExternalOptions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Definition of a catalog external table. The credential is kept by name
 * and resolved on every scan.
 */
public final class ExternalTableDescriptor {
  private final String tableName;
  private final ProviderKind kind;
  private final ExternalOptions options;

  public ExternalTableDescriptor(String tableName, ProviderKind kind, ExternalOptions options) {
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.options = Objects.requireNonNull(options, "options");
  }

  public String getTableName() {
    return tableName;
  }

  public ProviderKind getKind() {
    return kind;
  }

  public ExternalOptions getOptions() {
    return options;
  }

  public @Nullable String getCredentialName() {
    Object name = options.get(AbstractConnector.CREDENTIAL);
    return name instanceof String ? (String) name : null;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ExternalTableDescriptor)) {
      return false;
    }
    ExternalTableDescriptor that = (ExternalTableDescriptor) o;
    return tableName.equals(that.tableName) && kind == that.kind
        && options.equals(that.options);
  }

  @Override public int hashCode() {
    return Objects.hash(tableName, kind, options);
  }

  @Override public String toString() {
    return "ExternalTableDescriptor{" + tableName + ", " + kind.getKeyword() + ", " + options + "}";
  }
}
