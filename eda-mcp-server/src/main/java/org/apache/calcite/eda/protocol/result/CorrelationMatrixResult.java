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
package org.apache.calcite.eda.protocol.result;

import org.apache.calcite.eda.stats.CorrelationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@code correlation_matrix}.
 *
 * <p>The matrix is nested by column name; undefined coefficients are null.
 */
public class CorrelationMatrixResult extends ToolResult {
  private final String path;
  private final String method;
  private final List<String> selectedColumns;
  private final Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();

  public CorrelationMatrixResult(String path, CorrelationResult result) {
    this.path = path;
    this.method = result.getMethod().getMethodName();
    this.selectedColumns = result.getColumns();
    for (int i = 0; i < result.size(); i++) {
      Map<String, Double> row = new LinkedHashMap<>();
      for (int j = 0; j < result.size(); j++) {
        row.put(selectedColumns.get(j), result.get(i, j));
      }
      matrix.put(selectedColumns.get(i), row);
    }
  }

  @Override public String getToolName() {
    return "correlation_matrix";
  }

  public String getPath() {
    return path;
  }

  public String getMethod() {
    return method;
  }

  public List<String> getSelectedColumns() {
    return selectedColumns;
  }

  public Map<String, Map<String, Double>> getMatrix() {
    return matrix;
  }
}
