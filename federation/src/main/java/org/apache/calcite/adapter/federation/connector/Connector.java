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

import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;

import java.util.List;

/**
 * Builds scan providers for one kind of external source.
 */
public interface Connector {
  ProviderKind getKind();

  /** Options this connector accepts. */
  List<OptionSpec> getOptionSpecs();

  /**
   * Validates {@code options} without doing any I/O and returns a factory
   * for providers over the configured source.
   *
   * <p>A credential named by the {@code credential} option must exist and
   * belong to the expected provider now; it is looked up again on every
   * {@link ScanProviderFactory#create()}, so replacing it takes effect on
   * the next scan.
   *
   * @throws org.apache.calcite.adapter.federation.FederationException if
   *     the options are invalid
   */
  ScanProviderFactory bind(ExternalOptions options, CredentialStore credentials);
}
