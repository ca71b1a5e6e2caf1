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

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LocationResolver}.
 */
@Tag("unit")
public class LocationResolverTest {
  @TempDir
  Path tempDir;

  @Test void testClassify() {
    assertEquals(LocationKind.LOCAL, LocationResolver.classify("/data/a.json"));
    assertEquals(LocationKind.LOCAL, LocationResolver.classify("file:///data/a.json"));
    assertEquals(LocationKind.S3, LocationResolver.classify("s3://bucket/key"));
    assertEquals(LocationKind.HTTP, LocationResolver.classify("HTTPS://host/a"));
    FederationException e = assertThrows(FederationException.class,
        () -> LocationResolver.classify("gs://bucket/key"));
    assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
  }

  @Test void testIsGlob() {
    assertTrue(LocationResolver.isGlob("/data/*.json"));
    assertTrue(LocationResolver.isGlob("/data/part-?.json"));
    assertFalse(LocationResolver.isGlob("/data/a.json"));
    assertTrue(LocationResolver.isGlob("https://host/*.json"));
    assertFalse(LocationResolver.isGlob("https://host/data.ndjson?X-Amz-Signature=abc"));
    assertFalse(LocationResolver.isGlob("https://host/data.ndjson#part?1"));
  }

  @Test void testSignedHttpUrlIsNotAGlob() {
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      resolver.validate(
          ImmutableList.of("https://example.com/data.ndjson?X-Amz-Signature=abc&X-Amz-Date=*"));
    }
  }

  @Test void testRelativeGlobSkipsNestedFiles() throws IOException {
    Files.write(tempDir.resolve("a.json"), "{}\n".getBytes(StandardCharsets.UTF_8));
    Files.createDirectories(tempDir.resolve("sub"));
    Files.write(tempDir.resolve("sub/b.json"), "{}\n".getBytes(StandardCharsets.UTF_8));
    Path relative = Paths.get("").toAbsolutePath().relativize(tempDir);
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      List<ResolvedLocation> resolved =
          resolver.resolve(ImmutableList.of(relative + "/*.json"));
      assertEquals(1, resolved.size());
      assertTrue(resolved.get(0).getUri().endsWith("a.json"), resolved.get(0).getUri());
    }
  }

  @Test void testEmptyList() {
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      FederationException e = assertThrows(FederationException.class,
          () -> resolver.resolve(ImmutableList.of()));
      assertEquals(ErrorKind.EMPTY_LOCATION_LIST, e.getKind());
    }
  }

  @Test void testHttpGlobIsRejected() {
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      FederationException e = assertThrows(FederationException.class,
          () -> resolver.validate(ImmutableList.of("https://example.com/data/*.json")));
      assertEquals(ErrorKind.UNSUPPORTED_GLOB_FOR_SCHEME, e.getKind());
    }
  }

  @Test void testS3NeedsCredentialAndRegion() {
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      FederationException e = assertThrows(FederationException.class,
          () -> resolver.validate(ImmutableList.of("s3://bucket/key.json")));
      assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
    }
    AwsCredentialPayload aws = new AwsCredentialPayload("AKIA", "secret");
    try (LocationResolver resolver = new LocationResolver(aws, null, null)) {
      FederationException e = assertThrows(FederationException.class,
          () -> resolver.validate(ImmutableList.of("s3://bucket/key.json")));
      assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
    }
    try (LocationResolver resolver = new LocationResolver(aws, "us-east-1", null)) {
      resolver.validate(ImmutableList.of("s3://bucket/key.json"));
    }
  }

  @Test void testLocalGlobIsSorted() throws IOException {
    Files.write(tempDir.resolve("b.json"), new byte[] {1});
    Files.write(tempDir.resolve("a.json"), new byte[] {1, 2});
    Files.write(tempDir.resolve("c.txt"), new byte[] {1});
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      List<ResolvedLocation> resolved =
          resolver.resolve(ImmutableList.of(tempDir + "/*.json"));
      assertEquals(2, resolved.size());
      assertEquals("a.json", resolved.get(0).getName());
      assertEquals("b.json", resolved.get(1).getName());
      assertEquals(2L, resolved.get(0).getSize());
      assertEquals(LocationKind.LOCAL, resolved.get(0).getKind());
    }
  }

  @Test void testListKeepsOrder() throws IOException {
    Path a = Files.write(tempDir.resolve("a.json"), new byte[] {1});
    Path b = Files.write(tempDir.resolve("b.json"), new byte[] {1});
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      List<ResolvedLocation> resolved =
          resolver.resolve(ImmutableList.of(b.toString(), "file://" + a));
      assertEquals(2, resolved.size());
      assertEquals("b.json", resolved.get(0).getName());
      assertEquals("a.json", resolved.get(1).getName());
    }
  }

  @Test void testDirectoryListsFiles() throws IOException {
    Files.write(tempDir.resolve("2.json"), new byte[] {1});
    Files.write(tempDir.resolve("1.json"), new byte[] {1});
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      List<ResolvedLocation> resolved =
          resolver.resolve(ImmutableList.of(tempDir.toString()));
      assertEquals(2, resolved.size());
      assertEquals("1.json", resolved.get(0).getName());
    }
  }

  @Test void testMissingPath() {
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      FederationException missing = assertThrows(FederationException.class,
          () -> resolver.resolve(ImmutableList.of(tempDir.resolve("nope.json").toString())));
      assertEquals(ErrorKind.PATH_NOT_FOUND, missing.getKind());

      FederationException noMatch = assertThrows(FederationException.class,
          () -> resolver.resolve(ImmutableList.of(tempDir + "/*.parquet")));
      assertEquals(ErrorKind.PATH_NOT_FOUND, noMatch.getKind());
    }
  }

  @Test void testHttpLocation() throws IOException {
    byte[] body = "{\"a\": 1}\n".getBytes(StandardCharsets.UTF_8);
    HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/data.json", exchange -> {
      boolean head = "HEAD".equals(exchange.getRequestMethod());
      exchange.sendResponseHeaders(200, head ? -1 : body.length);
      if (!head) {
        try (OutputStream out = exchange.getResponseBody()) {
          out.write(body);
        }
      }
      exchange.close();
    });
    server.start();
    try (LocationResolver resolver = LocationResolver.anonymous()) {
      String base = "http://127.0.0.1:" + server.getAddress().getPort();
      List<ResolvedLocation> resolved = resolver.resolve(ImmutableList.of(base + "/data.json"));
      assertEquals(1, resolved.size());
      assertEquals(LocationKind.HTTP, resolved.get(0).getKind());
      try (InputStream in = resolved.get(0).open()) {
        assertEquals("{\"a\": 1}\n",
            new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8));
      }

      List<String> missing = new ArrayList<>();
      missing.add(base + "/missing.json");
      FederationException e = assertThrows(FederationException.class,
          () -> resolver.resolve(missing));
      assertEquals(ErrorKind.PATH_NOT_FOUND, e.getKind());
    } finally {
      server.stop(0);
    }
  }
}
