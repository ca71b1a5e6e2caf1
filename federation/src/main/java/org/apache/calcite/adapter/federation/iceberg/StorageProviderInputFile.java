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

import org.apache.calcite.adapter.federation.storage.StorageProvider;

import com.google.common.io.ByteStreams;

import org.apache.iceberg.exceptions.NotFoundException;
import org.apache.iceberg.exceptions.RuntimeIOException;
import org.apache.iceberg.io.InputFile;
import org.apache.iceberg.io.SeekableInputStream;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Iceberg {@link InputFile} that reads through a {@link StorageProvider},
 * so metadata, manifests and data files can live on local disk, S3 or HTTP.
 */
public class StorageProviderInputFile implements InputFile {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageProviderInputFile.class);

  private final StorageProvider storageProvider;
  private final String path;
  private @Nullable Long cachedLength;

  public StorageProviderInputFile(StorageProvider storageProvider, String path,
      @Nullable Long length) {
    this.storageProvider = storageProvider;
    this.path = path;
    this.cachedLength = length;
  }

  @Override public long getLength() {
    if (cachedLength == null) {
      LOGGER.debug("Getting file length for: {}", path);
      try {
        cachedLength = storageProvider.getMetadata(path).getSize();
      } catch (FileNotFoundException e) {
        throw new NotFoundException(e, "File does not exist: %s", path);
      } catch (IOException e) {
        throw new RuntimeIOException(e, "Failed to get length of %s", path);
      }
    }
    return cachedLength;
  }

  @Override public SeekableInputStream newStream() {
    LOGGER.debug("Opening stream for: {}", path);
    try (InputStream in = storageProvider.openInputStream(path)) {
      return new ByteArraySeekableInputStream(ByteStreams.toByteArray(in));
    } catch (FileNotFoundException e) {
      throw new NotFoundException(e, "File does not exist: %s", path);
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to open %s", path);
    }
  }

  @Override public String location() {
    return path;
  }

  @Override public boolean exists() {
    try {
      return storageProvider.exists(path);
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to check %s", path);
    }
  }

  /**
   * Seekable stream over a fully buffered file. Parquet needs random access
   * to read footers and column chunks.
   */
  private static class ByteArraySeekableInputStream extends SeekableInputStream {
    private final byte[] content;
    private int position;

    ByteArraySeekableInputStream(byte[] content) {
      this.content = content;
    }

    @Override public long getPos() {
      return position;
    }

    @Override public void seek(long newPos) throws IOException {
      if (newPos < 0 || newPos > content.length) {
        throw new EOFException("Invalid seek position: " + newPos);
      }
      position = (int) newPos;
    }

    @Override public int read() {
      if (position >= content.length) {
        return -1;
      }
      return content[position++] & 0xFF;
    }

    @Override public int read(byte[] b, int off, int len) {
      if (position >= content.length) {
        return -1;
      }
      int actualLen = Math.min(len, content.length - position);
      System.arraycopy(content, position, b, off, actualLen);
      position += actualLen;
      return actualLen;
    }

    @Override public int available() {
      return content.length - position;
    }
  }
}
