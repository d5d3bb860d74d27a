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
 * Base class of all failures an analysis operation reports to its caller.
 *
 * <p>Failures are deterministic functions of the caller's input and the
 * state of the file system, so they are never retried.
 */
public abstract class EdaException extends Exception {
  private static final long serialVersionUID = 1L;

  protected EdaException(String message) {
    super(message);
  }

  protected EdaException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the kind tag of this failure.
   */
  public abstract ErrorKind getKind();
}
