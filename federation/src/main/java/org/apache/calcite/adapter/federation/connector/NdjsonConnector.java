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
import org.apache.calcite.adapter.federation.format.json.NdjsonReader;
import org.apache.calcite.adapter.federation.format.json.NdjsonScanProvider;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Connector for newline-delimited JSON. Keywords {@code ndjson} and
 * {@code json}; {@code location} may be a list.
 */
public class NdjsonConnector extends FileConnector {
  public static final String INFER_ROWS = "infer_rows";

  public NdjsonConnector() {
    super(ProviderKind.NDJSON, OptionSpec.required(LOCATION, OptionType.STRING_LIST),
        ImmutableList.of(
            OptionSpec.optional(INFER_ROWS, OptionType.INTEGER)
                .withRange(1L, (long) Integer.MAX_VALUE)
                .withDefault((long) NdjsonReader.DEFAULT_INFER_ROWS)));
  }

  @Override protected ScanProviderFactory bindLocations(List<String> locations,
      ExternalOptions options, CredentialStore credentials) {
    int inferRows = Math.toIntExact(options.getLong(INFER_ROWS));
    return () -> new NdjsonScanProvider(resolver(options, credentials), locations, inferRows);
  }
}
