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

/**
 * Runtime object a scan pulls {@link RowBatch}es from.
 *
 * <p>A provider serves a single scan and holds its connections, streams and
 * clients until {@link #close()}, which must release them whether the scan
 * completed, failed or was cancelled. Batches carry exactly the columns of
 * {@link ScanRequest#getProjection()}, in that order.
 */
public interface ScanProvider extends AutoCloseable {
  /** Declared schema; may perform I/O (metadata reads, type inference). */
  ScanSchema schema();

  /** Starts the scan. The returned enumerator is closed by the caller. */
  Enumerator<RowBatch> scan(ScanRequest request);

  @Override void close();
}
