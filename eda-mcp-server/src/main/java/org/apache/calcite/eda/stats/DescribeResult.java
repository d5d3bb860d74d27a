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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Shape of a table plus descriptive statistics of its numeric columns.
 */
public final class DescribeResult {
  private final int rowCount;
  private final int columnCount;
  private final ImmutableMap<String, NumericSummary> statistics;

  public DescribeResult(int rowCount, int columnCount, Map<String, NumericSummary> statistics) {
    this.rowCount = rowCount;
    this.columnCount = columnCount;
    this.statistics = ImmutableMap.copyOf(statistics);
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columnCount;
  }

  /**
   * Statistics keyed by numeric column name, in column order; empty when the
   * table has no numeric columns.
   */
  public Map<String, NumericSummary> getStatistics() {
    return statistics;
  }
}
