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
package org.apache.calcite.adapter.federation.iceberg;

import org.apache.calcite.adapter.federation.storage.LocationResolver;

import org.apache.iceberg.io.FileIO;
import org.apache.iceberg.io.InputFile;
import org.apache.iceberg.io.OutputFile;

/**
 * Read-only {@link FileIO} that serves every path through the storage
 * providers of a {@link LocationResolver}.
 */
public class StorageProviderFileIO implements FileIO {
  private final LocationResolver resolver;

  public StorageProviderFileIO(LocationResolver resolver) {
    this.resolver = resolver;
  }

  @Override public InputFile newInputFile(String path) {
    String normalized = normalize(path);
    return new StorageProviderInputFile(resolver.providerFor(normalized), normalized, null);
  }

  @Override public InputFile newInputFile(String path, long length) {
    String normalized = normalize(path);
    return new StorageProviderInputFile(resolver.providerFor(normalized), normalized, length);
  }

  @Override public OutputFile newOutputFile(String path) {
    throw new UnsupportedOperationException("external Iceberg tables are read-only: " + path);
  }

  @Override public void deleteFile(String path) {
    throw new UnsupportedOperationException("external Iceberg tables are read-only: " + path);
  }

  /** Maps Hadoop S3 scheme aliases onto {@code s3://}. */
  static String normalize(String path) {
    if (path.startsWith("s3a://")) {
      return "s3://" + path.substring("s3a://".length());
    }
    if (path.startsWith("s3n://")) {
      return "s3://" + path.substring("s3n://".length());
    }
    return path;
  }
}
