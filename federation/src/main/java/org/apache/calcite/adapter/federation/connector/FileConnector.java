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
import org.apache.calcite.adapter.federation.storage.LocationResolver;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Base class for connectors that read objects from local, S3 or HTTP
 * locations. Locations are checked without I/O when binding; each provider
 * gets its own {@link LocationResolver}.
 */
public abstract class FileConnector extends AbstractConnector {
  public static final String LOCATION = "location";

  protected FileConnector(ProviderKind kind, OptionSpec locationSpec,
      List<OptionSpec> formatSpecs) {
    super(kind, ImmutableList.<OptionSpec>builder()
        .add(locationSpec)
        .addAll(formatSpecs)
        .add(CREDENTIAL_SPEC, REGION_SPEC, ENDPOINT_SPEC)
        .build());
  }

  @Override protected final ScanProviderFactory bindValidated(ExternalOptions options,
      CredentialStore credentials) {
    List<String> locations = locations(options);
    try (LocationResolver resolver = resolver(options, credentials)) {
      resolver.validate(locations);
    }
    return bindLocations(locations, options, credentials);
  }

  /** Locations named by the options; a single string becomes a list of one. */
  protected List<String> locations(ExternalOptions options) {
    Object value = options.get(LOCATION);
    if (value instanceof List) {
      return options.getStringList(LOCATION);
    }
    return value == null ? ImmutableList.of() : ImmutableList.of((String) value);
  }

  /** Creates a resolver with the current payload of the named credential. */
  protected static LocationResolver resolver(ExternalOptions options,
      CredentialStore credentials) {
    return new LocationResolver(awsCredential(options, credentials),
        options.getString(REGION), options.getString(ENDPOINT));
  }

  protected abstract ScanProviderFactory bindLocations(List<String> locations,
      ExternalOptions options, CredentialStore credentials);
}
