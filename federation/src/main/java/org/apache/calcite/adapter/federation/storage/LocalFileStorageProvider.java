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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Storage provider for the local file system. Accepts bare paths and
 * {@code file://} URIs; listed paths are returned as absolute bare paths.
 */
public class LocalFileStorageProvider implements StorageProvider {

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    Path dir = toPath(path);
    if (!Files.isDirectory(dir)) {
      throw new FileNotFoundException("Not a directory: " + path);
    }
    List<Path> paths;
    try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
      paths = stream.filter(p -> !p.equals(dir)).collect(Collectors.toList());
    }
    List<FileEntry> entries = new ArrayList<>(paths.size());
    for (Path p : paths) {
      BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
      entries.add(
          new FileEntry(p.toAbsolutePath().toString(),
          p.getFileName().toString(),
          attrs.isDirectory(),
          attrs.isDirectory() ? 0 : attrs.size(),
          attrs.lastModifiedTime().toMillis()));
    }
    return entries;
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    Path p = toPath(path);
    if (!Files.exists(p)) {
      throw new FileNotFoundException("File not found: " + path);
    }
    BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
    return new FileMetadata(path, attrs.size(), attrs.lastModifiedTime().toMillis(),
        Files.probeContentType(p), null);
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    Path p = toPath(path);
    if (!Files.isRegularFile(p)) {
      throw new FileNotFoundException("File not found: " + path);
    }
    return Files.newInputStream(p);
  }

  @Override public boolean exists(String path) throws IOException {
    return Files.exists(toPath(path));
  }

  @Override public boolean isDirectory(String path) throws IOException {
    return Files.isDirectory(toPath(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    return toPath(basePath).resolve(relativePath).toString();
  }

  static Path toPath(String path) {
    if (path.startsWith("file:")) {
      return Paths.get(URI.create(path));
    }
    return Paths.get(path);
  }
}
