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
package org.apache.calcite.eda.error;

/**
 * Kind of failure an operation can report to its caller.
 *
 * <p>Each kind carries the tag shown to callers and the JSON-RPC error code
 * the server uses when the failure is returned as a protocol error.
 */
public enum ErrorKind {
  /** Resolved path escapes the data root. */
  SECURITY_VIOLATION("SecurityViolation", -32001),
  /** Referenced file does not exist or is not a regular file. */
  NOT_FOUND("NotFound", -32002),
  /** CSV content is malformed or has duplicate/empty headers. */
  PARSE_ERROR("ParseError", -32003),
  /** Operation-specific semantic failure caused by caller arguments. */
  VALUE_ERROR("ValueError", -32602);

  private final String tag;
  private final int code;

  ErrorKind(String tag, int code) {
    this.tag = tag;
    this.code = code;
  }

  public String getTag() {
    return tag;
  }

  public int getCode() {
    return code;
  }
}
