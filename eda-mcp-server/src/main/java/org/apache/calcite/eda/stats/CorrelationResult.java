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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Square matrix of pairwise correlation coefficients.
 *
 * <p>Rows and columns are indexed by {@link #getColumns()}. The matrix is
 * symmetric and its diagonal is exactly 1.0.
 */
public final class CorrelationResult {
  private final CorrelationMethod method;
  private final ImmutableList<String> columns;
  private final double[][] matrix;

  CorrelationResult(CorrelationMethod method, List<String> columns, double[][] matrix) {
    this.method = method;
    this.columns = ImmutableList.copyOf(columns);
    this.matrix = matrix;
  }

  public CorrelationMethod getMethod() {
    return method;
  }

  public List<String> getColumns() {
    return columns;
  }

  public int size() {
    return columns.size();
  }

  /**
   * Returns the coefficient of columns {@code i} and {@code j}; NaN when it is
   * undefined for that pair.
   */
  public double get(int i, int j) {
    return matrix[i][j];
  }

  /**
   * Returns the coefficient of two named columns.
   *
   * @throws IllegalArgumentException if either column is not in the result
   */
  public double get(String a, String b) {
    int i = columns.indexOf(a);
    int j = columns.indexOf(b);
    if (i < 0 || j < 0) {
      throw new IllegalArgumentException("Column not in result: " + (i < 0 ? a : b));
    }
    return matrix[i][j];
  }
}
