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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/** Redacted credential: name, provider keyword and comment only. */
public final class CredentialView {
  private final String name;
  private final String provider;
  private final String comment;

  public CredentialView(String name, String provider, String comment) {
    this.name = name;
    this.provider = provider;
    this.comment = comment;
  }

  public String getName() {
    return name;
  }

  public String getProvider() {
    return provider;
  }

  /** Comment, or the empty string when none was given. */
  public String getComment() {
    return comment;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CredentialView)) {
      return false;
    }
    CredentialView that = (CredentialView) o;
    return name.equals(that.name)
        && provider.equals(that.provider)
        && comment.equals(that.comment);
  }

  @Override public int hashCode() {
    return Objects.hash(name, provider, comment);
  }

  @Override public String toString() {
    return name + " (" + provider + ")";
  }
}
