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

import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of credential, each with the options its payload is built from.
 */
public enum CredentialProvider {
  AWS("aws",
      ImmutableList.of(
          OptionSpec.required("access_key_id", OptionType.STRING),
          OptionSpec.required("secret_access_key", OptionType.STRING))) {
    @Override CredentialPayload buildPayload(ExternalOptions options) {
      return new AwsCredentialPayload(options.getString("access_key_id"),
          options.getString("secret_access_key"));
    }
  },
  GCP("gcp",
      ImmutableList.of(
          OptionSpec.required("service_account_key", OptionType.STRING))) {
    @Override CredentialPayload buildPayload(ExternalOptions options) {
      String key = options.getString("service_account_key");
      try {
        JsonNode node = MAPPER.readTree(key);
        if (node == null || !node.isObject()) {
          throw FederationException.invalidOption(
              "option 'service_account_key' must be a JSON object");
        }
      } catch (JsonProcessingException e) {
        throw FederationException.invalidOption(
            "option 'service_account_key' is not valid JSON: %s", e.getOriginalMessage());
      }
      return new GcpCredentialPayload(key);
    }
  };

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String keyword;
  private final List<OptionSpec> optionSpecs;

  CredentialProvider(String keyword, List<OptionSpec> optionSpecs) {
    this.keyword = keyword;
    this.optionSpecs = optionSpecs;
  }

  public String getKeyword() {
    return keyword;
  }

  public List<OptionSpec> getOptionSpecs() {
    return optionSpecs;
  }

  /** Validates options and builds the payload. */
  public CredentialPayload createPayload(ExternalOptions options) {
    return buildPayload(OptionSpec.validate(keyword + " credential", optionSpecs, options));
  }

  abstract CredentialPayload buildPayload(ExternalOptions validated);

  /** Looks up a provider by keyword, case-insensitively. */
  public static CredentialProvider of(String keyword) {
    String normalized = keyword.trim().toLowerCase(Locale.ROOT);
    for (CredentialProvider provider : values()) {
      if (provider.keyword.equals(normalized)) {
        return provider;
      }
    }
    throw FederationException.invalidOption("unknown credential provider '%s'", keyword);
  }
}
