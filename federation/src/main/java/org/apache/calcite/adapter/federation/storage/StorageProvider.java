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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Read-only access to the objects behind a location: local files, S3 objects
 * or HTTP resources.
 *
 * <p>Implementations throw {@link IOException}; callers outside this package
 * translate failures into {@link org.apache.calcite.adapter.federation.FederationException}.
 */
public interface StorageProvider extends AutoCloseable {

  /**
   * Lists files below a directory or key prefix.
   *
   * @param path The directory or prefix
   * @param recursive Whether to descend into subdirectories
   * @return File entries; order is unspecified
   * @throws IOException If an I/O error occurs
   */
  List<FileEntry> listFiles(String path, boolean recursive) throws IOException;

  /**
   * Gets metadata for a single file.
   *
   * @param path The file path
   * @return File metadata
   * @throws java.io.FileNotFoundException If the file does not exist
   * @throws IOException If an I/O error occurs
   */
  FileMetadata getMetadata(String path) throws IOException;

  /**
   * Opens an input stream for reading file content. The caller closes it.
   *
   * @param path The file path
   * @return Input stream for the file
   * @throws IOException If an I/O error occurs
   */
  InputStream openInputStream(String path) throws IOException;

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Checks if a path is a directory (or, for object stores, a prefix with
   * at least one object below it).
   *
   * @param path The path to check
   * @return true if the path is a directory
   * @throws IOException If an I/O error occurs
   */
  boolean isDirectory(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type ("local", "s3", "http")
   */
  String getStorageType();

  /**
   * Resolves a relative path against a directory path.
   *
   * @param basePath The directory path
   * @param relativePath The relative path
   * @return The resolved path
   */
  default String resolvePath(String basePath, String relativePath) {
    return basePath.endsWith("/") ? basePath + relativePath : basePath + "/" + relativePath;
  }

  /** Releases clients held by this provider. */
  @Override default void close() {
  }

  /**
   * Entry returned by {@link #listFiles}.
   */
  class FileEntry {
    private final String path;
    private final String name;
    private final boolean isDirectory;
    private final long size;
    private final long lastModified;

    public FileEntry(String path, String name, boolean isDirectory,
                     long size, long lastModified) {
      this.path = path;
      this.name = name;
      this.isDirectory = isDirectory;
      this.size = size;
      this.lastModified = lastModified;
    }

    public String getPath() {
      return path;
    }

    public String getName() {
      return name;
    }

    public boolean isDirectory() {
      return isDirectory;
    }

    public long getSize() {
      return size;
    }

    /** Last modification time in epoch milliseconds. */
    public long getLastModified() {
      return lastModified;
    }
  }

  /**
   * File metadata containing detailed information about a file.
   */
  class FileMetadata {
    private final String path;
    private final long size;
    private final long lastModified;
    private final @Nullable String contentType;
    private final @Nullable String etag;

    public FileMetadata(String path, long size, long lastModified,
                        @Nullable String contentType, @Nullable String etag) {
      this.path = path;
      this.size = size;
      this.lastModified = lastModified;
      this.contentType = contentType;
      this.etag = etag;
    }

    public String getPath() {
      return path;
    }

    public long getSize() {
      return size;
    }

    public long getLastModified() {
      return lastModified;
    }

    public @Nullable String getContentType() {
      return contentType;
    }

    public @Nullable String getEtag() {
      return etag;
    }
  }
}
