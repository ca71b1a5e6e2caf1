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
package org.apache.calcite.adapter.federation;

import java.util.Locale;

/**
 * Unchecked exception raised by connectors, readers, the credential store and
 * the function layer. The {@link ErrorKind} tells callers which rule was
 * violated.
 */
public class FederationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public FederationException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public FederationException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public static FederationException invalidOption(String format, Object... args) {
    return new FederationException(ErrorKind.INVALID_OPTION,
        String.format(Locale.ROOT, format, args));
  }

  public static FederationException notFound(String format, Object... args) {
    return new FederationException(ErrorKind.NOT_FOUND,
        String.format(Locale.ROOT, format, args));
  }

  public static FederationException io(String message, Throwable cause) {
    return new FederationException(ErrorKind.IO_ERROR, message, cause);
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
  }
}
