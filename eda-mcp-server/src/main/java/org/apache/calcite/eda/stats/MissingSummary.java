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
 * Missing-value counts and rates per column.
 */
public final class MissingSummary {
  private final int totalRows;
  private final ImmutableMap<String, ColumnMissing> columns;

  public MissingSummary(int totalRows, Map<String, ColumnMissing> columns) {
    this.totalRows = totalRows;
    this.columns = ImmutableMap.copyOf(columns);
  }

  public int getTotalRows() {
    return totalRows;
  }

  /**
   * Per-column entries keyed by column name, in column order.
   */
  public Map<String, ColumnMissing> getColumns() {
    return columns;
  }

  /**
   * Missing count and rate of a single column.
   */
  public static final class ColumnMissing {
    private final int missingCount;
    private final double missingRate;

    public ColumnMissing(int missingCount, double missingRate) {
      this.missingCount = missingCount;
      this.missingRate = missingRate;
    }

    public int getMissingCount() {
      return missingCount;
    }

    /**
     * Fraction of rows missing, in [0, 1]; 0 for a table without rows.
     */
    public double getMissingRate() {
      return missingRate;
    }
  }
}
