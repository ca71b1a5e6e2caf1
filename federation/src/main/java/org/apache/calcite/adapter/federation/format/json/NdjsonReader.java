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
package org.apache.calcite.adapter.federation.format.json;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.format.CompressedStreams;
import org.apache.calcite.adapter.federation.format.ValueCoercion;
import org.apache.calcite.adapter.federation.scan.ScanColumn;
import org.apache.calcite.adapter.federation.scan.ScanSchema;
import org.apache.calcite.adapter.federation.storage.ResolvedLocation;
import org.apache.calcite.sql.type.SqlTypeName;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams JSON objects from one or more newline-delimited JSON sources, in
 * order. Sources ending in {@code .gz} or {@code .gzip} are
 * decompressed on the fly; blank lines are skipped.
 */
public class NdjsonReader implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(NdjsonReader.class);

  /** Records sampled for type inference when no bound is given. */
  public static final int DEFAULT_INFER_ROWS = 100;

  private static final ObjectReader JSON_READER = new ObjectMapper().readerFor(JsonNode.class);

  private final List<ResolvedLocation> sources;
  private int nextSource;
  private @Nullable ResolvedLocation current;
  private @Nullable InputStream stream;
  private @Nullable MappingIterator<JsonNode> records;
  private long recordNumber;

  public NdjsonReader(List<ResolvedLocation> sources) {
    this.sources = sources;
  }

  /**
   * Returns the next record, or null when every source is exhausted.
   *
   * @throws FederationException with {@link ErrorKind#TYPE_MISMATCH} for a
   *     value that is not a JSON object, {@link ErrorKind#PARSE_ERROR} for
   *     malformed JSON, {@link ErrorKind#IO_ERROR} for read failures
   */
  public @Nullable ObjectNode next() {
    try {
      while (true) {
        if (records == null) {
          if (nextSource >= sources.size()) {
            return null;
          }
          openNext();
          continue;
        }
        if (records.hasNextValue()) {
          JsonNode node = records.nextValue();
          recordNumber++;
          if (!(node instanceof ObjectNode)) {
            throw new FederationException(ErrorKind.TYPE_MISMATCH,
                "expected a JSON object in " + current + " at record " + recordNumber
                    + ", got " + node.getNodeType());
          }
          return (ObjectNode) node;
        }
        closeCurrent();
      }
    } catch (JsonProcessingException e) {
      throw new FederationException(ErrorKind.PARSE_ERROR,
          "malformed JSON in " + current + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw FederationException.io("failed to read " + current, e);
    }
  }

  private void openNext() throws IOException {
    current = sources.get(nextSource++);
    LOGGER.debug("Opening NDJSON source {}", current);
    stream = CompressedStreams.decompress(current.getName(), current.open());
    records = JSON_READER.readValues(stream);
    recordNumber = 0;
  }

  private void closeCurrent() throws IOException {
    MappingIterator<JsonNode> it = records;
    InputStream in = stream;
    records = null;
    stream = null;
    try {
      if (it != null) {
        it.close();
      }
    } finally {
      if (in != null) {
        in.close();
      }
    }
  }

  @Override public void close() throws IOException {
    closeCurrent();
  }

  /**
   * Infers a schema from the first {@code inferRows} records across all
   * sources. Columns appear in order of first appearance.
   */
  public static ScanSchema inferSchema(List<ResolvedLocation> sources, int inferRows) {
    Map<String, @Nullable SqlTypeName> types = new LinkedHashMap<>();
    int sampled = 0;
    try (NdjsonReader reader = new NdjsonReader(sources)) {
      ObjectNode record;
      while (sampled < inferRows && (record = reader.next()) != null) {
        sampled++;
        for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext();) {
          Map.Entry<String, JsonNode> field = it.next();
          SqlTypeName observed = ValueCoercion.typeOf(toPlain(field.getValue()));
          types.put(field.getKey(), ValueCoercion.merge(types.get(field.getKey()), observed));
        }
      }
    } catch (IOException e) {
      throw FederationException.io("failed to close NDJSON source", e);
    }
    if (types.isEmpty()) {
      throw new FederationException(ErrorKind.PARSE_ERROR,
          "cannot infer a schema: no JSON fields found in the first " + inferRows
              + " record(s) of " + sources);
    }
    List<ScanColumn> columns = new ArrayList<>(types.size());
    types.forEach((name, type) -> columns.add(ScanColumn.of(name, ValueCoercion.finish(type))));
    LOGGER.debug("Inferred NDJSON schema from {} record(s): {}", sampled, columns);
    return new ScanSchema(columns);
  }

  /**
   * Converts a JSON value to a plain Java value. Objects and arrays become
   * their JSON text.
   */
  static @Nullable Object toPlain(@Nullable JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? (Object) node.longValue() : (Object) node.doubleValue();
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isTextual()) {
      return node.textValue();
    }
    return node.toString();
  }

  /** Value of {@code column} in {@code record}, coerced to its type. */
  static @Nullable Object columnValue(ObjectNode record, ScanColumn column) {
    return ValueCoercion.coerce(toPlain(record.get(column.getName())), column);
  }
}
