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

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.storage.LocationResolver;
import org.apache.calcite.adapter.federation.storage.StorageProvider;

import com.google.common.io.ByteStreams;

import org.apache.iceberg.BaseTable;
import org.apache.iceberg.StaticTableOperations;
import org.apache.iceberg.Table;
import org.apache.iceberg.exceptions.NotFoundException;
import org.apache.iceberg.exceptions.RuntimeIOException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads an Iceberg table from its location without a catalog.
 *
 * <p>The metadata root is {@code metadata/v<N>.metadata.json} where
 * {@code N} comes from {@code metadata/version-hint.text}; without a hint the
 * highest versioned {@code *.metadata.json} in {@code metadata/} is used. A
 * location that already names a {@code .metadata.json} file is used as is.
 */
public final class IcebergTableLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(IcebergTableLoader.class);

  private static final String METADATA_DIR = "metadata";
  private static final String VERSION_HINT = "version-hint.text";
  private static final String METADATA_SUFFIX = ".metadata.json";

  /** Matches {@code v12.metadata.json} and {@code 00012-<uuid>.metadata.json}. */
  private static final Pattern VERSIONED =
      Pattern.compile("^(?:v(\\d+)|(\\d+)-[^.]*)(?:\\.[a-z0-9]+)?\\.metadata\\.json$");

  private IcebergTableLoader() {
  }

  /**
   * Loads the table at {@code location}.
   *
   * @throws FederationException with
   *     {@link ErrorKind#NO_VALID_TABLE_AT_LOCATION} if no readable metadata
   *     root exists
   */
  public static Table load(LocationResolver resolver, String location) {
    String normalized = trimTrailingSlash(
        StorageProviderFileIO.normalize(LocationResolver.normalize(location)));
    StorageProvider provider = resolver.providerFor(normalized);
    String metadataLocation = findMetadataLocation(provider, normalized);
    LOGGER.debug("Loading Iceberg table {} from {}", location, metadataLocation);
    StaticTableOperations ops =
        new StaticTableOperations(metadataLocation, new StorageProviderFileIO(resolver));
    try {
      ops.current();
    } catch (NotFoundException | RuntimeIOException | IllegalArgumentException e) {
      throw new FederationException(ErrorKind.NO_VALID_TABLE_AT_LOCATION,
          "cannot read Iceberg metadata " + metadataLocation + ": " + e.getMessage(), e);
    }
    return new BaseTable(ops, tableName(normalized));
  }

  static String findMetadataLocation(StorageProvider provider, String location) {
    try {
      if (location.endsWith(METADATA_SUFFIX)) {
        if (provider.exists(location)) {
          return location;
        }
        throw noTable(location, null);
      }
      String metadataDir = provider.resolvePath(location, METADATA_DIR);
      String hint = provider.resolvePath(metadataDir, VERSION_HINT);
      if (provider.exists(hint)) {
        String version = readHint(provider, hint);
        if (version != null) {
          String candidate = provider.resolvePath(metadataDir, "v" + version + METADATA_SUFFIX);
          if (provider.exists(candidate)) {
            return candidate;
          }
          LOGGER.debug("Version hint {} points at missing {}", hint, candidate);
        }
      }
      if (!provider.isDirectory(metadataDir)) {
        throw noTable(location, null);
      }
      String best = null;
      long bestVersion = -1;
      for (StorageProvider.FileEntry entry : provider.listFiles(metadataDir, false)) {
        if (entry.isDirectory()) {
          continue;
        }
        long version = version(entry.getName());
        if (version > bestVersion
            || version == bestVersion && best != null && entry.getPath().compareTo(best) > 0) {
          bestVersion = version;
          best = entry.getPath();
        }
      }
      if (best == null) {
        throw noTable(location, null);
      }
      return best;
    } catch (IOException e) {
      throw noTable(location, e);
    }
  }

  /** Version number encoded in a metadata file name, or -1. */
  static long version(String fileName) {
    Matcher matcher = VERSIONED.matcher(fileName);
    if (!matcher.matches()) {
      return -1;
    }
    String digits = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
    try {
      return Long.parseLong(digits);
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static @Nullable String readHint(StorageProvider provider, String hint)
      throws IOException {
    try (InputStream in = provider.openInputStream(hint)) {
      String text = new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8).trim();
      return text.matches("\\d+") ? text : null;
    }
  }

  private static String trimTrailingSlash(String location) {
    return location.length() > 1 && location.endsWith("/")
        ? location.substring(0, location.length() - 1) : location;
  }

  private static String tableName(String location) {
    int slash = location.lastIndexOf('/');
    return slash >= 0 && slash + 1 < location.length() ? location.substring(slash + 1) : location;
  }

  private static FederationException noTable(String location, @Nullable Throwable cause) {
    String message = "no valid Iceberg table at location " + location;
    return cause == null
        ? new FederationException(ErrorKind.NO_VALID_TABLE_AT_LOCATION, message)
        : new FederationException(ErrorKind.NO_VALID_TABLE_AT_LOCATION, message, cause);
  }
}
