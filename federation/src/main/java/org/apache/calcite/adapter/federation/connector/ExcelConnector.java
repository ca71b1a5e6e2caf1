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
import org.apache.calcite.adapter.federation.format.excel.ExcelReader;
import org.apache.calcite.adapter.federation.format.excel.ExcelScanProvider;
import org.apache.calcite.adapter.federation.options.ExternalOptions;
import org.apache.calcite.adapter.federation.options.OptionSpec;
import org.apache.calcite.adapter.federation.options.OptionType;
import org.apache.calcite.adapter.federation.scan.ScanProviderFactory;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** Connector for XLSX workbooks. Keywords {@code excel} and {@code xlsx}. */
public class ExcelConnector extends FileConnector {
  public static final String SHEET_NAME = "sheet_name";
  public static final String HAS_HEADER = "has_header";
  public static final String INFER_ROWS = "infer_rows";

  public ExcelConnector() {
    super(ProviderKind.EXCEL, OptionSpec.required(LOCATION, OptionType.STRING),
        ImmutableList.of(
            OptionSpec.optional(SHEET_NAME, OptionType.STRING),
            OptionSpec.optional(HAS_HEADER, OptionType.BOOLEAN).withDefault(true),
            OptionSpec.optional(INFER_ROWS, OptionType.INTEGER)
                .withRange(0L, (long) Integer.MAX_VALUE)
                .withDefault((long) ExcelReader.DEFAULT_INFER_ROWS)));
  }

  @Override protected ScanProviderFactory bindLocations(List<String> locations,
      ExternalOptions options, CredentialStore credentials) {
    String location = locations.get(0);
    String sheetName = options.getString(SHEET_NAME);
    boolean hasHeader = Boolean.TRUE.equals(options.getBoolean(HAS_HEADER));
    int inferRows = Math.toIntExact(options.getLong(INFER_ROWS));
    return () -> new ExcelScanProvider(resolver(options, credentials), location, sheetName,
        hasHeader, inferRows);
  }
}
