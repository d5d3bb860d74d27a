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
import org.apache.calcite.eda.table.Column;
import org.apache.calcite.eda.table.Table;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes correlation matrices over the numeric columns of a table.
 *
 * <p>Each coefficient uses only the rows where both columns of the pair have
 * a value (pairwise-complete observations).
 */
public class CorrelationEngine {

  /**
   * Correlates numeric columns.
   *
   * @param table Table to analyze
   * @param requestedColumns Columns to include, in the desired order; names
   *     that are absent or not numeric are dropped. {@code null} or empty
   *     selects every numeric column
   * @param method Correlation method
   * @return symmetric matrix with unit diagonal
   * @throws InvalidArgumentException if no numeric column is selected
   */
  public CorrelationResult correlate(Table table, @Nullable List<String> requestedColumns,
      CorrelationMethod method) throws InvalidArgumentException {
    List<Column> selected = select(table, requestedColumns);
    if (selected.isEmpty()) {
      if (requestedColumns == null || requestedColumns.isEmpty()) {
        throw new InvalidArgumentException(
            "No numeric columns available for correlation computation");
      }
      throw new InvalidArgumentException(
          "None of the requested columns are numeric columns of the dataset: "
              + requestedColumns);
    }

    int n = selected.size();
    double[][] matrix = new double[n][n];
    List<String> names = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      names.add(selected.get(i).getName());
      matrix[i][i] = 1.0d;
      for (int j = i + 1; j < n; j++) {
        double coefficient = pairwise(selected.get(i), selected.get(j), method);
        matrix[i][j] = coefficient;
        matrix[j][i] = coefficient;
      }
    }
    return new CorrelationResult(method, names, matrix);
  }

  private static List<Column> select(Table table, @Nullable List<String> requestedColumns) {
    if (requestedColumns == null || requestedColumns.isEmpty()) {
      return table.getNumericColumns();
    }
    Set<String> unique = new LinkedHashSet<>(requestedColumns);
    List<Column> selected = new ArrayList<>();
    for (String name : unique) {
      Column column = name == null ? null : table.getColumn(name);
      if (column != null && column.isNumeric()) {
        selected.add(column);
      }
    }
    return selected;
  }

  private static double pairwise(Column a, Column b, CorrelationMethod method) {
    int rows = a.size();
    double[] x = new double[rows];
    double[] y = new double[rows];
    int complete = 0;
    for (int row = 0; row < rows; row++) {
      if (!a.isMissing(row) && !b.isMissing(row)) {
        x[complete] = a.getDouble(row);
        y[complete] = b.getDouble(row);
        complete++;
      }
    }
    return method.correlate(Arrays.copyOf(x, complete), Arrays.copyOf(y, complete));
  }
}
