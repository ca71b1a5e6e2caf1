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

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.credential.AwsCredentialPayload;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns location strings (paths, globs, URLs, object-store URIs, or lists
 * of them) into an ordered list of {@link ResolvedLocation}s.
 *
 * <p>A resolver owns the storage providers it creates and closes them in
 * {@link #close()}; create one per scan.
 */
public class LocationResolver implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocationResolver.class);

  private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*)://.*");
  private static final String GLOB_CHARS = "*?[{";

  private final @Nullable AwsCredentialPayload awsCredential;
  private final @Nullable String region;
  private final @Nullable String endpoint;
  private final Map<LocationKind, StorageProvider> providers = new EnumMap<>(LocationKind.class);

  public LocationResolver(@Nullable AwsCredentialPayload awsCredential,
      @Nullable String region, @Nullable String endpoint) {
    this.awsCredential = awsCredential;
    this.region = region;
    this.endpoint = endpoint;
  }

  /** Creates a resolver that can only serve local and HTTP locations. */
  public static LocationResolver anonymous() {
    return new LocationResolver(null, null, null);
  }

  /**
   * Classifies a location by scheme.
   *
   * @throws FederationException with {@link ErrorKind#INVALID_OPTION} for an
   *     unsupported scheme
   */
  public static LocationKind classify(String location) {
    Matcher matcher = SCHEME.matcher(location);
    if (!matcher.matches()) {
      return LocationKind.LOCAL;
    }
    String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
    switch (scheme) {
    case "file":
      return LocationKind.LOCAL;
    case "s3":
      return LocationKind.S3;
    case "http":
    case "https":
      return LocationKind.HTTP;
    default:
      throw FederationException.invalidOption("unsupported location scheme '%s' in '%s'",
          scheme, location);
    }
  }

  /** Whether a location carries wildcards. For HTTP URLs only the path
   * counts, so query strings such as presigned signatures are not globs. */
  public static boolean isGlob(String location) {
    return firstGlobIndex(wildcardScope(location)) >= 0;
  }

  private static String wildcardScope(String location) {
    Matcher matcher = SCHEME.matcher(location);
    if (!matcher.matches()) {
      return location;
    }
    String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      return location;
    }
    int end = location.length();
    int query = location.indexOf('?');
    if (query >= 0) {
      end = query;
    }
    int fragment = location.indexOf('#');
    if (fragment >= 0 && fragment < end) {
      end = fragment;
    }
    return location.substring(0, end);
  }

  /**
   * Checks the locations without doing any I/O: the list is not empty, every
   * scheme is supported, HTTP locations carry no wildcard, and S3 locations
   * have a credential and region.
   */
  public void validate(List<String> locations) {
    if (locations.isEmpty()) {
      throw new FederationException(ErrorKind.EMPTY_LOCATION_LIST, "expected at least one url");
    }
    for (String location : locations) {
      LocationKind kind = classify(location);
      if (kind == LocationKind.HTTP && isGlob(location)) {
        throw new FederationException(ErrorKind.UNSUPPORTED_GLOB_FOR_SCHEME,
            "globbing is not supported for http urls: " + location);
      }
      if (kind == LocationKind.S3) {
        if (awsCredential == null) {
          throw FederationException.invalidOption(
              "location '%s' requires an aws credential", location);
        }
        if (region == null) {
          throw FederationException.invalidOption("location '%s' requires a region", location);
        }
      }
    }
  }

  /**
   * Resolves every location in order and concatenates the results.
   *
   * @throws FederationException with {@link ErrorKind#PATH_NOT_FOUND} if a
   *     literal location does not exist or a glob matches nothing
   */
  public List<ResolvedLocation> resolve(List<String> locations) {
    validate(locations);
    List<ResolvedLocation> resolved = new ArrayList<>();
    for (String location : locations) {
      resolved.addAll(resolveOne(location));
    }
    LOGGER.debug("Resolved {} location(s) to {} object(s)", locations.size(), resolved.size());
    return resolved;
  }

  /** Returns the (cached) storage provider for a location. */
  public StorageProvider providerFor(String location) {
    LocationKind kind = classify(location);
    return providers.computeIfAbsent(kind, this::createProvider);
  }

  /** Strips a {@code file:} prefix so local paths can carry glob characters. */
  public static String normalize(String location) {
    if (classify(location) != LocationKind.LOCAL) {
      return location;
    }
    if (location.startsWith("file://")) {
      return location.substring("file://".length());
    }
    if (location.startsWith("file:")) {
      return location.substring("file:".length());
    }
    return location;
  }

  private List<ResolvedLocation> resolveOne(String rawLocation) {
    LocationKind kind = classify(rawLocation);
    String location = normalize(rawLocation);
    StorageProvider provider = providerFor(location);
    try {
      if (isGlob(location)) {
        return expandGlob(kind, provider, location);
      }
      if (kind == LocationKind.HTTP) {
        if (!provider.exists(location)) {
          throw pathNotFound(rawLocation, null);
        }
        return single(kind, provider, location);
      }
      if (kind == LocationKind.S3 && provider.exists(location)) {
        return single(kind, provider, location);
      }
      if (provider.isDirectory(location)) {
        List<ResolvedLocation> files = list(kind, provider, location, location, null);
        if (files.isEmpty()) {
          throw pathNotFound(rawLocation, null);
        }
        return files;
      }
      if (kind == LocationKind.LOCAL && provider.exists(location)) {
        return single(kind, provider, location);
      }
      throw pathNotFound(rawLocation, null);
    } catch (IOException e) {
      throw pathNotFound(rawLocation, e);
    }
  }

  private static List<ResolvedLocation> single(LocationKind kind, StorageProvider provider,
      String location) {
    List<ResolvedLocation> list = new ArrayList<>(1);
    list.add(new ResolvedLocation(location, kind, provider, -1L, -1L));
    return list;
  }

  private List<ResolvedLocation> expandGlob(LocationKind kind, StorageProvider provider,
      String location) throws IOException {
    int globIndex = firstGlobIndex(location);
    int lastSlash = location.lastIndexOf('/', globIndex);
    String baseDir;
    String pattern;
    if (lastSlash < 0) {
      baseDir = ".";
      pattern = location;
    } else {
      baseDir = lastSlash == 0 ? "/" : location.substring(0, lastSlash);
      pattern = location.substring(lastSlash + 1);
    }
    if (kind == LocationKind.S3 && baseDir.equals("s3:/")) {
      throw FederationException.invalidOption("glob in bucket name is not supported: %s",
          location);
    }
    if (!provider.isDirectory(baseDir)) {
      throw pathNotFound(location, null);
    }
    PathMatcher matcher;
    try {
      matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    } catch (IllegalArgumentException e) {
      throw FederationException.invalidOption("invalid glob pattern '%s': %s",
          pattern, e.getMessage());
    }
    List<ResolvedLocation> matches = list(kind, provider, baseDir, location, matcher);
    if (matches.isEmpty()) {
      throw new FederationException(ErrorKind.PATH_NOT_FOUND,
          "no files match pattern '" + location + "'");
    }
    LOGGER.debug("Glob '{}' matched {} object(s)", location, matches.size());
    return matches;
  }

  /** Lists regular files below {@code baseDir}, keeping those whose path
   * relative to {@code baseDir} satisfies {@code matcher}; sorted by uri. */
  private static List<ResolvedLocation> list(LocationKind kind, StorageProvider provider,
      String baseDir, String location, @Nullable PathMatcher matcher) throws IOException {
    List<ResolvedLocation> result = new ArrayList<>();
    boolean recursive = matcher != null || kind == LocationKind.S3;
    for (StorageProvider.FileEntry entry : provider.listFiles(baseDir, recursive)) {
      if (entry.isDirectory()) {
        continue;
      }
      if (matcher != null) {
        Path relative = relativePath(kind, baseDir, entry.getPath());
        if (relative == null || !matcher.matches(relative)) {
          continue;
        }
      }
      result.add(
          new ResolvedLocation(entry.getPath(), kind, provider, entry.getSize(),
              entry.getLastModified()));
    }
    result.sort(Comparator.comparing(ResolvedLocation::getUri));
    LOGGER.debug("Listed {} file(s) for '{}'", result.size(), location);
    return result;
  }

  /** Path of {@code fullPath} below {@code baseDir}, or null if it is not
   * below it. Local paths are compared absolute and normalized. */
  private static @Nullable Path relativePath(LocationKind kind, String baseDir,
      String fullPath) {
    try {
      if (kind == LocationKind.LOCAL) {
        Path base = LocalFileStorageProvider.toPath(baseDir).toAbsolutePath().normalize();
        Path full = LocalFileStorageProvider.toPath(fullPath).toAbsolutePath().normalize();
        return full.startsWith(base) ? base.relativize(full) : null;
      }
      String base = baseDir.endsWith("/") ? baseDir : baseDir + "/";
      return fullPath.startsWith(base) ? Paths.get(fullPath.substring(base.length())) : null;
    } catch (InvalidPathException e) {
      LOGGER.debug("Skipping '{}': {}", fullPath, e.getMessage());
      return null;
    }
  }

  private StorageProvider createProvider(LocationKind kind) {
    switch (kind) {
    case LOCAL:
      return new LocalFileStorageProvider();
    case HTTP:
      return new HttpStorageProvider();
    case S3:
      if (awsCredential == null || region == null) {
        throw FederationException.invalidOption("s3 locations require a credential and region");
      }
      return S3StorageProvider.create(awsCredential, region, endpoint);
    default:
      throw new AssertionError(kind);
    }
  }

  private static int firstGlobIndex(String location) {
    for (int i = 0; i < location.length(); i++) {
      if (GLOB_CHARS.indexOf(location.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }

  private static FederationException pathNotFound(String location, @Nullable Throwable cause) {
    String message = "path not found: " + location;
    return cause == null
        ? new FederationException(ErrorKind.PATH_NOT_FOUND, message)
        : new FederationException(ErrorKind.PATH_NOT_FOUND,
            message + " (" + cause.getMessage() + ")", cause);
  }

  @Override public void close() {
    for (StorageProvider provider : providers.values()) {
      provider.close();
    }
    providers.clear();
  }
}
