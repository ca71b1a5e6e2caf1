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
package org.apache.calcite.adapter.federation.ddl;

import org.apache.calcite.adapter.federation.options.ExternalOptions;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parsed federation DDL statement.
 */
public abstract class DdlStatement {
  private final String name;

  DdlStatement(String name) {
    this.name = name;
  }

  /** Name of the credential or table the statement acts on. */
  public String getName() {
    return name;
  }

  /** {@code CREATE [OR REPLACE] CREDENTIAL name PROVIDER p OPTIONS (...) [COMMENT '...']}. */
  public static final class CreateCredential extends DdlStatement {
    private final boolean replace;
    private final String provider;
    private final ExternalOptions options;
    private final @Nullable String comment;

    CreateCredential(String name, boolean replace, String provider, ExternalOptions options,
        @Nullable String comment) {
      super(name);
      this.replace = replace;
      this.provider = provider;
      this.options = options;
      this.comment = comment;
    }

    public boolean isReplace() {
      return replace;
    }

    public String getProvider() {
      return provider;
    }

    public ExternalOptions getOptions() {
      return options;
    }

    public @Nullable String getComment() {
      return comment;
    }

    @Override public String toString() {
      // options hold secrets
      return "CREATE " + (replace ? "OR REPLACE " : "") + "CREDENTIAL " + getName()
          + " PROVIDER " + provider;
    }
  }

  /** {@code CREATE [OR REPLACE] EXTERNAL TABLE name FROM p OPTIONS (...)}. */
  public static final class CreateExternalTable extends DdlStatement {
    private final boolean replace;
    private final String provider;
    private final ExternalOptions options;

    CreateExternalTable(String name, boolean replace, String provider,
        ExternalOptions options) {
      super(name);
      this.replace = replace;
      this.provider = provider;
      this.options = options;
    }

    public boolean isReplace() {
      return replace;
    }

    public String getProvider() {
      return provider;
    }

    public ExternalOptions getOptions() {
      return options;
    }

    @Override public String toString() {
      return "CREATE " + (replace ? "OR REPLACE " : "") + "EXTERNAL TABLE " + getName()
          + " FROM " + provider + " OPTIONS " + options;
    }
  }

  /** {@code DROP CREDENTIAL [IF EXISTS] name}. */
  public static final class DropCredential extends DdlStatement {
    private final boolean ifExists;

    DropCredential(String name, boolean ifExists) {
      super(name);
      this.ifExists = ifExists;
    }

    public boolean isIfExists() {
      return ifExists;
    }

    @Override public String toString() {
      return "DROP CREDENTIAL " + (ifExists ? "IF EXISTS " : "") + getName();
    }
  }

  /** {@code DROP EXTERNAL TABLE [IF EXISTS] name}. */
  public static final class DropExternalTable extends DdlStatement {
    private final boolean ifExists;

    DropExternalTable(String name, boolean ifExists) {
      super(name);
      this.ifExists = ifExists;
    }

    public boolean isIfExists() {
      return ifExists;
    }

    @Override public String toString() {
      return "DROP EXTERNAL TABLE " + (ifExists ? "IF EXISTS " : "") + getName();
    }
  }
}
