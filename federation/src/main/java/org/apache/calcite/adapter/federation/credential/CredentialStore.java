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

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.options.ExternalOptions;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session-scoped store of named credentials.
 *
 * <p>Reads are lock-free. {@link #create} races resolve through
 * {@code putIfAbsent}, so exactly one caller wins and the others get
 * {@link ErrorKind#DUPLICATE_NAME}; {@link #createOrReplace} runs inside
 * {@code compute} and is therefore serialized per name. Names are
 * case-sensitive.
 */
public class CredentialStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(CredentialStore.class);

  private final ConcurrentMap<String, Credential> credentials = new ConcurrentHashMap<>();
  private final AtomicLong nextId = new AtomicLong(1);

  /**
   * Creates a credential.
   *
   * @throws FederationException with {@link ErrorKind#DUPLICATE_NAME} if the
   *     name is taken, or {@link ErrorKind#INVALID_OPTION} if the provider or
   *     options are invalid
   */
  public Credential create(String name, String provider, ExternalOptions options,
      @Nullable String comment) {
    CredentialProvider kind = CredentialProvider.of(provider);
    CredentialPayload payload = kind.createPayload(options);
    Credential credential = new Credential(nextId.getAndIncrement(), name, kind, payload, comment);
    Credential existing = credentials.putIfAbsent(name, credential);
    if (existing != null) {
      throw new FederationException(ErrorKind.DUPLICATE_NAME,
          "credential '" + name + "' already exists");
    }
    LOGGER.info("Created credential '{}' ({})", name, kind.getKeyword());
    return credential;
  }

  /**
   * Creates a credential, or atomically replaces the provider, payload and
   * comment of an existing one. The replacement keeps the original id.
   */
  public Credential createOrReplace(String name, String provider, ExternalOptions options,
      @Nullable String comment) {
    CredentialProvider kind = CredentialProvider.of(provider);
    CredentialPayload payload = kind.createPayload(options);
    Credential result = credentials.compute(name, (key, existing) ->
        new Credential(existing == null ? nextId.getAndIncrement() : existing.getId(),
            key, kind, payload, comment));
    LOGGER.info("Created or replaced credential '{}' ({})", name, kind.getKeyword());
    return result;
  }

  /**
   * Returns the credential with the given name, payload included. For
   * connector use only.
   *
   * @throws FederationException with {@link ErrorKind#NOT_FOUND} if absent
   */
  public Credential lookup(String name) {
    Credential credential = credentials.get(name);
    if (credential == null) {
      throw FederationException.notFound("credential '%s' does not exist", name);
    }
    return credential;
  }

  /**
   * Returns the payload of a credential, checking that it belongs to the
   * expected provider.
   */
  public <T extends CredentialPayload> T lookupPayload(String name, Class<T> payloadType) {
    CredentialPayload payload = lookup(name).getPayload();
    if (!payloadType.isInstance(payload)) {
      throw FederationException.invalidOption("credential '%s' is a %s credential",
          name, payload.getProvider().getKeyword());
    }
    return payloadType.cast(payload);
  }

  /** Redacted views of all credentials, sorted by name. */
  public List<CredentialView> list() {
    List<CredentialView> views = new ArrayList<>();
    for (Credential credential : credentials.values()) {
      views.add(credential.redact());
    }
    views.sort(Comparator.comparing(CredentialView::getName));
    return views;
  }

  /**
   * Drops a credential.
   *
   * @return whether a credential was removed
   * @throws FederationException with {@link ErrorKind#NOT_FOUND} if absent
   *     and {@code ifExists} is false
   */
  public boolean drop(String name, boolean ifExists) {
    Credential removed = credentials.remove(name);
    if (removed == null) {
      if (ifExists) {
        return false;
      }
      throw FederationException.notFound("credential '%s' does not exist", name);
    }
    LOGGER.info("Dropped credential '{}'", name);
    return true;
  }

  public int size() {
    return credentials.size();
  }
}
