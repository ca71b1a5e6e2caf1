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
package org.apache.calcite.adapter.federation.functions;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HashFunctions} and {@link ValueEncoder}.
 */
@Tag("unit")
public class HashFunctionsTest {

  @Test void testZeroArgumentConstants() {
    assertEquals(new BigDecimal("13715208377448023093"), HashFunctions.siphash());
    assertEquals(new BigDecimal("12478008331234465636"), HashFunctions.fnv());
    assertEquals(HashFunctions.siphash(), HashFunctions.siphash(null));
    assertEquals(HashFunctions.fnv(), HashFunctions.evaluate("fnv", Collections.emptyList()));
  }

  @Test void testKnownValues() {
    assertEquals(new BigDecimal("16970111936452869753"), HashFunctions.siphash(1L));
    assertEquals(new BigDecimal("6349179348336612933"), HashFunctions.fnv(1L));
    assertEquals(new BigDecimal("7564728698212669116"), HashFunctions.siphash("abc"));
  }

  @Test void testRepeatable() {
    Object[] inputs = {
        42L, "hello", 3.25d, true, new byte[] {1, 2}, new BigDecimal("12.50"),
        LocalDate.of(2024, 1, 31), Arrays.asList(1L, null, "x")
    };
    for (Object input : inputs) {
      assertEquals(HashFunctions.siphash(input), HashFunctions.siphash(input));
      assertEquals(HashFunctions.fnv(input), HashFunctions.fnv(input));
    }
  }

  @Test void testOutputIsUnsigned64Bit() {
    BigDecimal max = new BigDecimal("18446744073709551615");
    for (long i = 0; i < 100; i++) {
      BigDecimal hash = HashFunctions.siphash(i);
      assertTrue(hash.signum() >= 0);
      assertTrue(hash.compareTo(max) <= 0);
    }
  }

  @Test void testIntegralTypesHashAlike() {
    assertEquals(HashFunctions.siphash(7L), HashFunctions.siphash(7));
    assertEquals(HashFunctions.fnv(7L), HashFunctions.fnv((short) 7));
  }

  @Test void testDistinctInputs() {
    assertNotEquals(HashFunctions.siphash("a"), HashFunctions.siphash("b"));
    assertNotEquals(HashFunctions.siphash(""), HashFunctions.siphash(null));
    assertNotEquals(HashFunctions.fnv(ImmutableList.of("ab", "c")),
        HashFunctions.fnv(ImmutableList.of("a", "bc")));
  }

  @Test void testArity() {
    assertEquals(ErrorKind.ARITY_ERROR, assertThrows(FederationException.class,
        () -> HashFunctions.siphash(1, 2)).getKind());
    assertEquals(ErrorKind.ARITY_ERROR, assertThrows(FederationException.class,
        () -> HashFunctions.siphash(1, 2, 3)).getKind());
    assertEquals(ErrorKind.ARITY_ERROR, assertThrows(FederationException.class,
        () -> HashFunctions.fnv(1, 2)).getKind());
    assertEquals(ErrorKind.ARITY_ERROR, assertThrows(FederationException.class,
        () -> HashFunctions.fnv(1, 2, 3)).getKind());
    assertEquals(ErrorKind.ARITY_ERROR, assertThrows(FederationException.class,
        () -> HashFunctions.evaluate("siphash", Arrays.asList(1, 2, 3, 4))).getKind());
  }

  @Test void testUnsupportedType() {
    FederationException e = assertThrows(FederationException.class,
        () -> HashFunctions.siphash(new Object()));
    assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
  }

  @Test void testNullEncoding() {
    assertArrayEquals(new byte[] {1, 0, 0, 0}, ValueEncoder.encode(null));
    assertArrayEquals(new byte[] {1, 0, 0, 0, 0, 0, 0, 0, 5, 0, 0, 0, 0, 0, 0, 0},
        ValueEncoder.encode(5L));
    assertArrayEquals(new byte[] {1, 0, 0, 0, 0, 0, 0, 0, 'a', (byte) 0xFF},
        ValueEncoder.encode("a"));
  }
}
