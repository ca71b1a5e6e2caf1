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
package org.apache.calcite.adapter.federation.format;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Wraps raw streams in a decompressor chosen by file name suffix.
 */
public final class CompressedStreams {
  private CompressedStreams() {
  }

  /** Returns a stream that yields decompressed bytes for {@code name}. */
  public static InputStream decompress(String name, InputStream raw) throws IOException {
    String lower = name.toLowerCase(Locale.ROOT);
    InputStream buffered = new BufferedInputStream(raw);
    if (lower.endsWith(".gz") || lower.endsWith(".gzip")) {
      return new GZIPInputStream(buffered);
    }
    return buffered;
  }
}
