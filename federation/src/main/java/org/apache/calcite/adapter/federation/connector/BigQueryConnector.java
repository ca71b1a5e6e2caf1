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

import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.bigquery.BigQueryScanProvider;
import org.apache.calcite.adapter.federation.credential.CredentialStore;
import org.apache.calcite.adapter.federation.credential.GcpCredentialPayload;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;
import org.apache.calcite.adapter.federation.scan.ScanFilter;
import org.apache.calcite.adapter.federation.scan.ScanProvider;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;

import com.google.cloud.bigquery.TableId;
import com.google.common.collect.ImmutableList;

/**
 * Connector for BigQuery tables. Authenticates with a GCP credential or an
 * inline {@code service_account_key}.
 */
public class BigQueryConnector extends AbstractConnector {
  public static final String PROJECT_ID = "project_id";
  public static final String DATASET_ID = "dataset_id";
  public static final String TABLE_ID = "table_id";
  public static final String SERVICE_ACCOUNT_KEY = "service_account_key";

  public BigQueryConnector() {
    super(ProviderKind.BIGQUERY, ImmutableList.of(
        OptionSpec.required(PROJECT_ID, OptionType.STRING),
        OptionSpec.required(DATASET_ID, OptionType.STRING),
        OptionSpec.required(TABLE_ID, OptionType.STRING),
        CREDENTIAL_SPEC,
        OptionSpec.optional(SERVICE_ACCOUNT_KEY, OptionType.STRING)));
  }

  @Override protected ScanProviderFactory bindValidated(ExternalOptions options,
      CredentialStore credentials) {
    boolean hasCredential = options.getString(CREDENTIAL) != null;
    boolean hasKey = options.getString(SERVICE_ACCOUNT_KEY) != null;
    if (hasCredential == hasKey) {
      throw FederationException.invalidOption(
          "bigquery needs exactly one of '%s' and '%s'", CREDENTIAL, SERVICE_ACCOUNT_KEY);
    }
    // fails now on a missing or non-GCP credential
    serviceAccountKey(options, credentials);
    String projectId = options.getString(PROJECT_ID);
    TableId tableId = TableId.of(projectId, options.getString(DATASET_ID),
        options.getString(TABLE_ID));
    return new ScanProviderFactory() {
      @Override public ScanProvider create() {
        return new BigQueryScanProvider(
            BigQueryScanProvider.createClient(projectId, serviceAccountKey(options, credentials)),
            tableId);
      }

      @Override public boolean canPushDown(ScanFilter filter) {
        return BigQueryScanProvider.canPushDown(filter);
      }
    };
  }

  private static String serviceAccountKey(ExternalOptions options,
      CredentialStore credentials) {
    GcpCredentialPayload payload = credential(options, credentials, GcpCredentialPayload.class);
    if (payload != null) {
      return payload.getServiceAccountKey();
    }
    return options.getString(SERVICE_ACCOUNT_KEY);
  }
}
