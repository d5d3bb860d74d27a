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
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Outliers found in one numeric column.
 */
public final class OutlierReport {
  private final String column;
  private final OutlierMethod method;
  private final int totalOutliers;
  private final double outlierPercentage;
  private final ImmutableList<Outlier> outliers;
  private final ImmutableMap<String, Double> thresholds;

  public OutlierReport(String column, OutlierMethod method, int totalOutliers,
      double outlierPercentage, List<Outlier> outliers, Map<String, Double> thresholds) {
    this.column = column;
    this.method = method;
    this.totalOutliers = totalOutliers;
    this.outlierPercentage = outlierPercentage;
    this.outliers = ImmutableList.copyOf(outliers);
    this.thresholds = ImmutableMap.copyOf(thresholds);
  }

  public String getColumn() {
    return column;
  }

  public OutlierMethod getMethod() {
    return method;
  }

  /** Number of outliers, including those beyond the reported top list. */
  public int getTotalOutliers() {
    return totalOutliers;
  }

  /** Outliers as a percentage of the column's non-missing values. */
  public double getOutlierPercentage() {
    return outlierPercentage;
  }

  /** Highest-scoring outliers, best first. */
  public List<Outlier> getOutliers() {
    return outliers;
  }

  /** Bounds or threshold the method applied, keyed by name. */
  public Map<String, Double> getThresholds() {
    return thresholds;
  }

  /**
   * One outlying value.
   */
  public static final class Outlier {
    private final int index;
    private final double value;
    private final double score;

    public Outlier(int index, double value, double score) {
      this.index = index;
      this.value = value;
      this.score = score;
    }

    /** Zero-based row index. */
    public int getIndex() {
      return index;
    }

    public double getValue() {
      return value;
    }

    public double getScore() {
      return score;
    }
  }
}
