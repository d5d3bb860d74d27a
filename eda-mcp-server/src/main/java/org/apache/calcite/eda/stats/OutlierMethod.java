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
package org.apache.calcite.eda.stats;

import org.apache.calcite.eda.error.InvalidArgumentException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * Rule used to flag outlying values of a numeric column.
 */
public enum OutlierMethod {
  /** Outside Q1 - 1.5 IQR .. Q3 + 1.5 IQR. */
  IQR("iqr"),
  /** Absolute z-score, using the population standard deviation, above 3. */
  ZSCORE("zscore");

  private final String methodName;

  OutlierMethod(String methodName) {
    this.methodName = methodName;
  }

  public String getMethodName() {
    return methodName;
  }

  /**
   * Parses a method name, ignoring case and surrounding whitespace.
   *
   * @param name Method name; {@code null} means iqr
   * @throws InvalidArgumentException if the method is not supported
   */
  public static OutlierMethod parse(@Nullable String name) throws InvalidArgumentException {
    if (name == null) {
      return IQR;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (OutlierMethod method : values()) {
      if (method.methodName.equals(normalized)) {
        return method;
      }
    }
    throw new InvalidArgumentException("Unsupported outlier method: '" + name
        + "' (supported: iqr, zscore)");
  }
}
