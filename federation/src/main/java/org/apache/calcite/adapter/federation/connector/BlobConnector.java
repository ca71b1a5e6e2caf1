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
import org.apache.calcite.adapter.federation.format.blob.BlobScanProvider;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;
import org.apache.calcite.adapter.federation.storage.LocationResolver;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** Connector exposing matched objects as rows of raw bytes. */
public class BlobConnector extends FileConnector {
  public BlobConnector() {
    super(ProviderKind.BLOB, OptionSpec.required(LOCATION, OptionType.STRING_LIST),
        ImmutableList.of());
  }

  @Override protected ScanProviderFactory bindLocations(List<String> locations,
      ExternalOptions options, CredentialStore credentials) {
    return new ScanProviderFactory() {
      @Override public ScanProvider create() {
        return new BlobScanProvider(resolver(options, credentials), locations);
      }

      /** The schema is fixed, so check that the locations match something. */
      @Override public void verify() {
        try (LocationResolver resolver = resolver(options, credentials)) {
          resolver.resolve(locations);
        }
      }
    };
  }
}
