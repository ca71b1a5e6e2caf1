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

/**
 * Validated, bound configuration that creates one {@link ScanProvider} per
 * scan.
 */
public interface ScanProviderFactory {
  /** Creates a fresh provider. Credentials are resolved on each call. */
  ScanProvider create();

  /** Whether providers from this factory evaluate {@code filter} exactly. */
  default boolean canPushDown(ScanFilter filter) {
    return false;
  }

  /**
   * Performs the I/O checks needed before a catalog table can be registered,
   * such as confirming that a metadata root exists. The default opens a
   * provider and reads its schema.
   */
  default void verify() {
    try (ScanProvider provider = create()) {
      provider.schema();
    }
  }
}
