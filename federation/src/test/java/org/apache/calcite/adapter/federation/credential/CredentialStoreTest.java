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
package org.apache.calcite.adapter.federation.credential;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.options.ExternalOptions;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CredentialStore} and the redacted catalog view.
 */
@Tag("unit")
public class CredentialStoreTest {
  private static final ExternalOptions AWS_OPTIONS = ExternalOptions.of(
      ImmutableMap.of("access_key_id", "AKIAEXAMPLE", "secret_access_key", "s3cr3t"));

  @Test void testCreateAndLookup() {
    CredentialStore store = new CredentialStore();
    Credential credential = store.create("aws1", "AWS", AWS_OPTIONS, "prod");
    assertEquals(CredentialProvider.AWS, credential.getProvider());
    AwsCredentialPayload payload = store.lookupPayload("aws1", AwsCredentialPayload.class);
    assertEquals("AKIAEXAMPLE", payload.getAccessKeyId());
    assertEquals("s3cr3t", payload.getSecretAccessKey());
    assertEquals(1, store.size());
  }

  @Test void testDuplicateName() {
    CredentialStore store = new CredentialStore();
    store.create("aws1", "aws", AWS_OPTIONS, null);
    FederationException e = assertThrows(FederationException.class,
        () -> store.create("aws1", "aws", AWS_OPTIONS, null));
    assertEquals(ErrorKind.DUPLICATE_NAME, e.getKind());
  }

  @Test void testNamesAreCaseSensitive() {
    CredentialStore store = new CredentialStore();
    store.create("aws1", "aws", AWS_OPTIONS, null);
    store.create("AWS1", "aws", AWS_OPTIONS, null);
    assertEquals(2, store.size());
  }

  @Test void testReplaceKeepsId() {
    CredentialStore store = new CredentialStore();
    Credential original = store.create("key", "aws", AWS_OPTIONS, "old");
    Credential replaced = store.createOrReplace("key", "gcp",
        ExternalOptions.of(ImmutableMap.of("service_account_key", "{\"type\": \"x\"}")),
        "new");
    assertEquals(original.getId(), replaced.getId());
    assertEquals(CredentialProvider.GCP, store.lookup("key").getProvider());
    assertEquals("new", store.lookup("key").getComment());
    assertInstanceOf(GcpCredentialPayload.class, store.lookup("key").getPayload());
  }

  @Test void testInvalidOptions() {
    CredentialStore store = new CredentialStore();
    FederationException missing = assertThrows(FederationException.class,
        () -> store.create("a", "aws",
            ExternalOptions.of(ImmutableMap.of("access_key_id", "x")), null));
    assertEquals(ErrorKind.INVALID_OPTION, missing.getKind());

    FederationException unknownProvider = assertThrows(FederationException.class,
        () -> store.create("a", "azure", AWS_OPTIONS, null));
    assertEquals(ErrorKind.INVALID_OPTION, unknownProvider.getKind());

    FederationException notJson = assertThrows(FederationException.class,
        () -> store.create("g", "gcp",
            ExternalOptions.of(ImmutableMap.of("service_account_key", "not json")), null));
    assertEquals(ErrorKind.INVALID_OPTION, notJson.getKind());
    assertEquals(0, store.size());
  }

  @Test void testWrongPayloadType() {
    CredentialStore store = new CredentialStore();
    store.create("aws1", "aws", AWS_OPTIONS, null);
    FederationException e = assertThrows(FederationException.class,
        () -> store.lookupPayload("aws1", GcpCredentialPayload.class));
    assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
  }

  @Test void testDrop() {
    CredentialStore store = new CredentialStore();
    store.create("aws1", "aws", AWS_OPTIONS, null);
    assertTrue(store.drop("aws1", false));
    assertFalse(store.drop("aws1", true));
    FederationException e = assertThrows(FederationException.class,
        () -> store.drop("aws1", false));
    assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    assertEquals(ErrorKind.NOT_FOUND,
        assertThrows(FederationException.class, () -> store.lookup("aws1")).getKind());
  }

  @Test void testListIsRedacted() {
    CredentialStore store = new CredentialStore();
    store.create("zeta", "aws", AWS_OPTIONS, null);
    store.create("alpha", "aws", AWS_OPTIONS, "test account");
    List<CredentialView> views = store.list();
    assertEquals(2, views.size());
    assertEquals(new CredentialView("alpha", "aws", "test account"), views.get(0));
    assertEquals(new CredentialView("zeta", "aws", ""), views.get(1));
    for (CredentialView view : views) {
      assertFalse(view.toString().contains("s3cr3t"));
    }
    assertFalse(store.lookup("alpha").toString().contains("s3cr3t"));
  }

  @Test void testCredentialsTable() {
    CredentialStore store = new CredentialStore();
    store.create("aws1", "aws", AWS_OPTIONS, "c");
    CredentialsTable table = new CredentialsTable(store);
    List<@Nullable Object[]> rows = table.scan(null).toList();
    assertEquals(1, rows.size());
    assertArrayEquals(new Object[] {"aws1", "aws", "c"}, rows.get(0));
  }

  @Test void testConcurrentCreateHasOneWinner() throws Exception {
    CredentialStore store = new CredentialStore();
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          try {
            store.create("shared", "aws", AWS_OPTIONS, null);
            return true;
          } catch (FederationException e) {
            assertEquals(ErrorKind.DUPLICATE_NAME, e.getKind());
            return false;
          }
        }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(30, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertEquals(1, winners);
      assertEquals(1, store.size());
    } finally {
      executor.shutdownNow();
    }
  }
}
