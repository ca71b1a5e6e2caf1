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
package org.apache.calcite.adapter.federation.scan;

import org.apache.calcite.linq4j.Enumerator;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the rows of a scan for assertions.
 */
public final class Rows {
  private Rows() {
  }

  public static List<@Nullable Object[]> of(ScanProvider provider) {
    return of(provider, ScanRequest.all());
  }

  public static List<@Nullable Object[]> of(ScanProvider provider, ScanRequest request) {
    List<@Nullable Object[]> rows = new ArrayList<>();
    try (Enumerator<RowBatch> batches = provider.scan(request)) {
      while (batches.moveNext()) {
        RowBatch batch = batches.current();
        for (int r = 0; r < batch.getRowCount(); r++) {
          rows.add(batch.getRow(r));
        }
      }
    }
    return rows;
  }
}
