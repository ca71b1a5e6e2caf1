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

/**
 * Classifies every failure raised by the federation layer.
 */
public enum ErrorKind {
  /** A credential or external table with the same name already exists. */
  DUPLICATE_NAME,
  /** A named credential, table or sheet does not exist. */
  NOT_FOUND,
  /** An option is missing, unknown, of the wrong type or out of range. */
  INVALID_OPTION,
  /** A location list contained no entries. */
  EMPTY_LOCATION_LIST,
  /** A wildcard was used with a scheme that cannot be listed. */
  UNSUPPORTED_GLOB_FOR_SCHEME,
  /** A location did not resolve to any readable object. */
  PATH_NOT_FOUND,
  /** A location holds no table-format metadata root. */
  NO_VALID_TABLE_AT_LOCATION,
  /** A function was called with the wrong number of arguments. */
  ARITY_ERROR,
  /** A value could not be coerced to the column type. */
  TYPE_MISMATCH,
  /** Reading from a source failed. */
  IO_ERROR,
  /** A statement or option list could not be parsed. */
  PARSE_ERROR
}
