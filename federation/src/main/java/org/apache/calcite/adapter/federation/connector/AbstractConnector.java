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
package org.apache.calcite.adapter.federation.connector;

import org.apache.calcite.adapter.federation.credential.AwsCredentialPayload;
import org.apache.calcite.adapter.federation.credential.CredentialPayload;
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Base class for connectors. Validates options against the declared specs
 * before handing them to {@link #bindValidated}.
 */
public abstract class AbstractConnector implements Connector {
  public static final String CREDENTIAL = "credential";
  public static final String REGION = "region";
  public static final String ENDPOINT = "endpoint";

  static final OptionSpec CREDENTIAL_SPEC = OptionSpec.optional(CREDENTIAL, OptionType.STRING);
  static final OptionSpec REGION_SPEC = OptionSpec.optional(REGION, OptionType.STRING);
  static final OptionSpec ENDPOINT_SPEC = OptionSpec.optional(ENDPOINT, OptionType.STRING);

  private final ProviderKind kind;
  private final ImmutableList<OptionSpec> optionSpecs;

  protected AbstractConnector(ProviderKind kind, List<OptionSpec> optionSpecs) {
    this.kind = kind;
    this.optionSpecs = ImmutableList.copyOf(optionSpecs);
  }

  @Override public ProviderKind getKind() {
    return kind;
  }

  @Override public List<OptionSpec> getOptionSpecs() {
    return optionSpecs;
  }

  @Override public final ScanProviderFactory bind(ExternalOptions options,
      CredentialStore credentials) {
    ExternalOptions validated = OptionSpec.validate(kind.getKeyword(), optionSpecs, options);
    return bindValidated(validated, credentials);
  }

  /** Binds options that passed validation, defaults filled in. */
  protected abstract ScanProviderFactory bindValidated(ExternalOptions options,
      CredentialStore credentials);

  /** Looks up the payload of the credential named by the options, if any. */
  protected static <T extends CredentialPayload> @Nullable T credential(
      ExternalOptions options, CredentialStore credentials, Class<T> payloadType) {
    String name = options.getString(CREDENTIAL);
    return name == null ? null : credentials.lookupPayload(name, payloadType);
  }

  protected static @Nullable AwsCredentialPayload awsCredential(ExternalOptions options,
      CredentialStore credentials) {
    return credential(options, credentials, AwsCredentialPayload.class);
  }
}
