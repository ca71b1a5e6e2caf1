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
package org.apache.calcite.adapter.federation.storage;

import java.io.IOException;
import java.io.InputStream;

/**
 * One concrete readable object produced by {@link LocationResolver}.
 * Size and modification time are filled from listings when available and
 * fetched lazily otherwise.
 */
public final class ResolvedLocation {
  private final String uri;
  private final LocationKind kind;
  private final StorageProvider storageProvider;
  private long size;
  private long lastModified;

  ResolvedLocation(String uri, LocationKind kind, StorageProvider storageProvider,
      long size, long lastModified) {
    this.uri = uri;
    this.kind = kind;
    this.storageProvider = storageProvider;
    this.size = size;
    this.lastModified = lastModified;
  }

  public String getUri() {
    return uri;
  }

  public LocationKind getKind() {
    return kind;
  }

  public StorageProvider getStorageProvider() {
    return storageProvider;
  }

  /** File name: the last path segment of the uri. */
  public String getName() {
    String trimmed = uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
    int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
    return slash < 0 ? trimmed : trimmed.substring(slash + 1);
  }

  public long getSize() throws IOException {
    if (size < 0) {
      loadMetadata();
    }
    return size;
  }

  /** Last modification time in epoch milliseconds. */
  public long getLastModified() throws IOException {
    if (lastModified < 0) {
      loadMetadata();
    }
    return lastModified;
  }

  public InputStream open() throws IOException {
    return storageProvider.openInputStream(uri);
  }

  private void loadMetadata() throws IOException {
    StorageProvider.FileMetadata metadata = storageProvider.getMetadata(uri);
    size = metadata.getSize();
    lastModified = metadata.getLastModified();
  }

  @Override public String toString() {
    return kind + ":" + uri;
  }
}
