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

import org.apache.calcite.eda.table.ColumnType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Table-wide data quality metrics, per-column quality and recommendations.
 */
public final class QualityReport {
  private final int totalRows;
  private final int totalColumns;
  private final int duplicateRows;
  private final double duplicatePercentage;
  private final ImmutableMap<String, ColumnQuality> columns;
  private final ImmutableList<String> recommendations;
  private final double severityScore;

  public QualityReport(int totalRows, int totalColumns, int duplicateRows,
      double duplicatePercentage, Map<String, ColumnQuality> columns,
      List<String> recommendations, double severityScore) {
    this.totalRows = totalRows;
    this.totalColumns = totalColumns;
    this.duplicateRows = duplicateRows;
    this.duplicatePercentage = duplicatePercentage;
    this.columns = ImmutableMap.copyOf(columns);
    this.recommendations = ImmutableList.copyOf(recommendations);
    this.severityScore = severityScore;
  }

  public int getTotalRows() {
    return totalRows;
  }

  public int getTotalColumns() {
    return totalColumns;
  }

  /** Rows identical to an earlier row in every column. */
  public int getDuplicateRows() {
    return duplicateRows;
  }

  public double getDuplicatePercentage() {
    return duplicatePercentage;
  }

  /** Quality per column, in column order. */
  public Map<String, ColumnQuality> getColumns() {
    return columns;
  }

  public List<String> getRecommendations() {
    return recommendations;
  }

  /** Aggregate severity in [0, 100]; higher is worse. */
  public double getSeverityScore() {
    return severityScore;
  }

  /**
   * Quality of a single column.
   *
   * <p>Numeric columns carry {@link NumericQuality}; text and temporal
   * columns carry {@link TextQuality}; boolean columns carry neither.
   */
  public static final class ColumnQuality {
    private final ColumnType type;
    private final int nonMissingCount;
    private final int missingCount;
    private final double missingPercentage;
    private final int distinctCount;
    private final @Nullable NumericQuality numeric;
    private final @Nullable TextQuality text;

    public ColumnQuality(ColumnType type, int nonMissingCount, int missingCount,
        double missingPercentage, int distinctCount, @Nullable NumericQuality numeric,
        @Nullable TextQuality text) {
      this.type = type;
      this.nonMissingCount = nonMissingCount;
      this.missingCount = missingCount;
      this.missingPercentage = missingPercentage;
      this.distinctCount = distinctCount;
      this.numeric = numeric;
      this.text = text;
    }

    public ColumnType getType() {
      return type;
    }

    public int getNonMissingCount() {
      return nonMissingCount;
    }

    public int getMissingCount() {
      return missingCount;
    }

    public double getMissingPercentage() {
      return missingPercentage;
    }

    public int getDistinctCount() {
      return distinctCount;
    }

    public @Nullable NumericQuality getNumeric() {
      return numeric;
    }

    public @Nullable TextQuality getText() {
      return text;
    }
  }

  /**
   * Value checks of a numeric column.
   */
  public static final class NumericQuality {
    private final double mean;
    private final double std;
    private final double min;
    private final double max;
    private final int zeroCount;
    private final int negativeCount;

    public NumericQuality(double mean, double std, double min, double max,
        int zeroCount, int negativeCount) {
      this.mean = mean;
      this.std = std;
      this.min = min;
      this.max = max;
      this.zeroCount = zeroCount;
      this.negativeCount = negativeCount;
    }

    public double getMean() {
      return mean;
    }

    public double getStd() {
      return std;
    }

    public double getMin() {
      return min;
    }

    public double getMax() {
      return max;
    }

    public int getZeroCount() {
      return zeroCount;
    }

    public int getNegativeCount() {
      return negativeCount;
    }
  }

  /**
   * Frequency checks of a text or temporal column.
   */
  public static final class TextQuality {
    private final @Nullable String mostFrequent;
    private final int mostFrequentCount;
    private final double cardinalityRatio;

    public TextQuality(@Nullable String mostFrequent, int mostFrequentCount,
        double cardinalityRatio) {
      this.mostFrequent = mostFrequent;
      this.mostFrequentCount = mostFrequentCount;
      this.cardinalityRatio = cardinalityRatio;
    }

    /** Most frequent value, or {@code null} when the column is empty. */
    public @Nullable String getMostFrequent() {
      return mostFrequent;
    }

    public int getMostFrequentCount() {
      return mostFrequentCount;
    }

    /** Distinct values divided by total rows. */
    public double getCardinalityRatio() {
      return cardinalityRatio;
    }
  }
}
