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
import org.apache.calcite.avatica.util.ByteString;
import org.apache.calcite.util.NlsString;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Collection;

/**
 * Canonical byte encoding of SQL values fed to the hash functions.
 *
 * <p>Null is the little-endian 32-bit integer 1. Any other value is the
 * little-endian 64-bit integer 1 followed by a payload:
 * <ul>
 *   <li>integral numbers: 64-bit little-endian
 *   <li>floating point: bits of the value widened to double
 *   <li>strings: UTF-8 bytes followed by {@code 0xFF}
 *   <li>binary: 64-bit length, then the bytes
 *   <li>booleans: one byte
 *   <li>decimals: length-prefixed unscaled two's-complement bytes, then the
 *       scale as 64-bit
 *   <li>lists and arrays: 64-bit length, then each element encoded
 *   <li>dates: epoch day; timestamps: epoch microseconds (UTC); times:
 *       microseconds of the day
 * </ul>
 * The encoding never changes; hash outputs depend on it.
 */
public final class ValueEncoder {
  private static final int NULL_MARKER = 1;
  private static final long VALUE_MARKER = 1L;
  private static final int STRING_TERMINATOR = 0xFF;

  private ValueEncoder() {
  }

  public static byte[] encode(@Nullable Object value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    write(out, value);
    return out.toByteArray();
  }

  private static void write(ByteArrayOutputStream out, @Nullable Object value) {
    if (value == null) {
      writeInt(out, NULL_MARKER);
      return;
    }
    writeLong(out, VALUE_MARKER);
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      writeLong(out, ((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      writeLong(out, Double.doubleToLongBits(((Number) value).doubleValue()));
    } else if (value instanceof BigInteger) {
      BigInteger integer = (BigInteger) value;
      if (integer.bitLength() < Long.SIZE) {
        writeLong(out, integer.longValue());
      } else {
        writeDecimal(out, new BigDecimal(integer));
      }
    } else if (value instanceof BigDecimal) {
      writeDecimal(out, (BigDecimal) value);
    } else if (value instanceof String || value instanceof Character
        || value instanceof NlsString) {
      String s = value instanceof NlsString
          ? ((NlsString) value).getValue() : value.toString();
      out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
      out.write(STRING_TERMINATOR);
    } else if (value instanceof Boolean) {
      out.write((Boolean) value ? 1 : 0);
    } else if (value instanceof ByteString) {
      writeBytes(out, ((ByteString) value).getBytes());
    } else if (value instanceof byte[]) {
      writeBytes(out, (byte[]) value);
    } else if (value instanceof ByteBuffer) {
      ByteBuffer buffer = ((ByteBuffer) value).duplicate();
      byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      writeBytes(out, bytes);
    } else if (value instanceof Collection) {
      Collection<?> list = (Collection<?>) value;
      writeLong(out, list.size());
      for (Object element : list) {
        write(out, element);
      }
    } else if (value instanceof Object[]) {
      Object[] array = (Object[]) value;
      writeLong(out, array.length);
      for (Object element : array) {
        write(out, element);
      }
    } else if (value instanceof LocalDate) {
      writeLong(out, ((LocalDate) value).toEpochDay());
    } else if (value instanceof java.sql.Date) {
      writeLong(out, ((java.sql.Date) value).toLocalDate().toEpochDay());
    } else if (value instanceof LocalDateTime) {
      writeLong(out, epochMicros(((LocalDateTime) value).toInstant(ZoneOffset.UTC)));
    } else if (value instanceof OffsetDateTime) {
      writeLong(out, epochMicros(((OffsetDateTime) value).toInstant()));
    } else if (value instanceof Instant) {
      writeLong(out, epochMicros((Instant) value));
    } else if (value instanceof java.sql.Timestamp) {
      writeLong(out, epochMicros(((java.sql.Timestamp) value).toInstant()));
    } else if (value instanceof LocalTime) {
      writeLong(out, ((LocalTime) value).toNanoOfDay() / 1_000L);
    } else if (value instanceof java.sql.Time) {
      writeLong(out, ((java.sql.Time) value).toLocalTime().toNanoOfDay() / 1_000L);
    } else {
      throw new FederationException(ErrorKind.TYPE_MISMATCH,
          "cannot hash value of type " + value.getClass().getName());
    }
  }

  private static long epochMicros(Instant instant) {
    return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
  }

  private static void writeDecimal(ByteArrayOutputStream out, BigDecimal decimal) {
    writeBytes(out, decimal.unscaledValue().toByteArray());
    writeLong(out, decimal.scale());
  }

  private static void writeBytes(ByteArrayOutputStream out, byte[] bytes) {
    writeLong(out, bytes.length);
    out.writeBytes(bytes);
  }

  private static void writeInt(ByteArrayOutputStream out, int v) {
    for (int i = 0; i < Integer.BYTES; i++) {
      out.write(v >>> (8 * i));
    }
  }

  private static void writeLong(ByteArrayOutputStream out, long v) {
    for (int i = 0; i < Long.BYTES; i++) {
      out.write((int) (v >>> (8 * i)));
    }
  }
}
