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
package org.apache.calcite.adapter.federation.credential;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A named, provider-typed secret. Immutable; replacement creates a new
 * instance that keeps the name and {@link #getId() id} of the old one.
 */
public final class Credential {
  private final long id;
  private final String name;
  private final CredentialProvider provider;
  private final CredentialPayload payload;
  private final @Nullable String comment;

  Credential(long id, String name, CredentialProvider provider,
      CredentialPayload payload, @Nullable String comment) {
    this.id = id;
    this.name = Objects.requireNonNull(name, "name");
    this.provider = Objects.requireNonNull(provider, "provider");
    this.payload = Objects.requireNonNull(payload, "payload");
    this.comment = comment;
  }

  public long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public CredentialProvider getProvider() {
    return provider;
  }

  public CredentialPayload getPayload() {
    return payload;
  }

  public @Nullable String getComment() {
    return comment;
  }

  /** Returns the view that is safe to expose through catalog queries. */
  public CredentialView redact() {
    return new CredentialView(name, provider.getKeyword(), comment == null ? "" : comment);
  }

  @Override public String toString() {
    return "Credential{name=" + name + ", provider=" + provider.getKeyword()
        + ", comment=" + comment + "}";
  }
}
