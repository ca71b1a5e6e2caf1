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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Projection, pushed filters and cancellation handle for one scan.
 */
public final class ScanRequest {
  public static final int DEFAULT_BATCH_SIZE = 1024;

  private final int @Nullable [] projection;
  private final ImmutableList<ScanFilter> filters;
  private final AtomicBoolean cancelFlag;
  private final int batchSize;

  public ScanRequest(int @Nullable [] projection, List<ScanFilter> filters,
      AtomicBoolean cancelFlag, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    this.projection = projection == null ? null : projection.clone();
    this.filters = ImmutableList.copyOf(filters);
    this.cancelFlag = cancelFlag;
    this.batchSize = batchSize;
  }

  /** Scan of all columns, no filters, never cancelled. */
  public static ScanRequest all() {
    return new ScanRequest(null, ImmutableList.of(), new AtomicBoolean(), DEFAULT_BATCH_SIZE);
  }

  public static ScanRequest of(int @Nullable [] projection) {
    return new ScanRequest(projection, ImmutableList.of(), new AtomicBoolean(),
        DEFAULT_BATCH_SIZE);
  }

  /** Selected column indexes in output order, or null for all columns. */
  public int @Nullable [] getProjection() {
    return projection == null ? null : projection.clone();
  }

  public List<ScanFilter> getFilters() {
    return filters;
  }

  public AtomicBoolean getCancelFlag() {
    return cancelFlag;
  }

  public boolean isCancelled() {
    return cancelFlag.get();
  }

  public int getBatchSize() {
    return batchSize;
  }

  public ScanRequest withBatchSize(int batchSize) {
    return new ScanRequest(projection, filters, cancelFlag, batchSize);
  }
}
