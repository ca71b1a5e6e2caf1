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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;

/**
 * Assembles {@link RowBatch}es from a row-at-a-time source.
 *
 * <p>The cancel flag of the request is checked before every row. When it is
 * set the partially assembled batch is dropped and the enumerator reports
 * end of data.
 */
public abstract class BatchEnumerator implements Enumerator<RowBatch> {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchEnumerator.class);

  private final ScanRequest request;
  private final int width;
  private @Nullable RowBatch current;
  private boolean done;
  private boolean closed;

  protected BatchEnumerator(ScanRequest request, int width) {
    this.request = request;
    this.width = width;
  }

  /**
   * Returns the next row, already projected to the request's columns, or
   * null when the source is exhausted.
   */
  protected abstract @Nullable Object @Nullable [] nextRow();

  /** Releases the underlying source. Called once. */
  protected abstract void closeSource();

  @Override public RowBatch current() {
    if (current == null) {
      throw new NoSuchElementException();
    }
    return current;
  }

  @Override public boolean moveNext() {
    if (done) {
      current = null;
      return false;
    }
    RowBatch.Builder builder = RowBatch.builder(width);
    while (builder.size() < request.getBatchSize()) {
      if (request.isCancelled()) {
        LOGGER.debug("Scan cancelled; dropping {} buffered row(s)", builder.size());
        done = true;
        current = null;
        return false;
      }
      Object[] row = nextRow();
      if (row == null) {
        done = true;
        break;
      }
      builder.add(row);
    }
    if (builder.size() == 0) {
      current = null;
      return false;
    }
    current = builder.build();
    return true;
  }

  @Override public void reset() {
    throw new UnsupportedOperationException();
  }

  @Override public void close() {
    if (!closed) {
      closed = true;
      closeSource();
    }
  }
}
