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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.List;

/**
 * Storage provider for {@code http://} and {@code https://} resources.
 * Listing is not supported, so HTTP locations cannot be globbed.
 */
public class HttpStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpStorageProvider.class);

  static final int CONNECT_TIMEOUT_MS = 30_000;
  static final int READ_TIMEOUT_MS = 60_000;

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    throw new IOException("Listing is not supported for http urls: " + path);
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    HttpURLConnection conn = open(path, "HEAD");
    try {
      int responseCode = conn.getResponseCode();
      if (responseCode == HttpURLConnection.HTTP_BAD_METHOD) {
        // Some servers only answer GET
        conn.disconnect();
        conn = open(path, "GET");
        responseCode = conn.getResponseCode();
      }
      checkResponse(path, responseCode);
      return new FileMetadata(path, conn.getContentLengthLong(), conn.getLastModified(),
          conn.getContentType(), conn.getHeaderField("ETag"));
    } finally {
      conn.disconnect();
    }
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    HttpURLConnection conn = open(path, "GET");
    int responseCode = conn.getResponseCode();
    if (responseCode >= 400) {
      conn.disconnect();
      checkResponse(path, responseCode);
    }
    LOGGER.debug("GET {} -> {}", path, responseCode);
    return conn.getInputStream();
  }

  @Override public boolean exists(String path) throws IOException {
    try {
      getMetadata(path);
      return true;
    } catch (FileNotFoundException e) {
      return false;
    }
  }

  @Override public boolean isDirectory(String path) {
    return false;
  }

  @Override public String getStorageType() {
    return "http";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    try {
      return new URL(new URL(basePath.endsWith("/") ? basePath : basePath + "/"),
          relativePath).toString();
    } catch (MalformedURLException e) {
      return StorageProvider.super.resolvePath(basePath, relativePath);
    }
  }

  private static HttpURLConnection open(String path, String method) throws IOException {
    URL url;
    try {
      url = new URL(path);
    } catch (MalformedURLException e) {
      throw new FileNotFoundException("Malformed url: " + path);
    }
    HttpURLConnection conn = (HttpURLConnection) url.openConnection();
    conn.setRequestMethod(method);
    conn.setConnectTimeout(CONNECT_TIMEOUT_MS);
    conn.setReadTimeout(READ_TIMEOUT_MS);
    conn.setInstanceFollowRedirects(true);
    return conn;
  }

  private static void checkResponse(String path, int responseCode) throws IOException {
    if (responseCode == HttpURLConnection.HTTP_NOT_FOUND
        || responseCode == HttpURLConnection.HTTP_GONE) {
      throw new FileNotFoundException("HTTP " + responseCode + " for " + path);
    }
    if (responseCode >= 400) {
      throw new IOException("HTTP " + responseCode + " for " + path);
    }
  }
}
