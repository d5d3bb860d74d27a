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

import org.apache.calcite.eda.stats.QualityReport;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@code data_quality_report}.
 */
public class DataQualityResult extends ToolResult {
  private final String path;
  private final Metrics metrics;
  private final Map<String, ColumnQualityInfo> columnQuality = new LinkedHashMap<>();
  private final List<String> recommendations;
  private final double severityScore;

  public DataQualityResult(String path, QualityReport report) {
    this.path = path;
    this.metrics = new Metrics(report);
    for (Map.Entry<String, QualityReport.ColumnQuality> entry : report.getColumns().entrySet()) {
      columnQuality.put(entry.getKey(), new ColumnQualityInfo(entry.getValue()));
    }
    this.recommendations = report.getRecommendations();
    this.severityScore = report.getSeverityScore();
  }

  @Override public String getToolName() {
    return "data_quality_report";
  }

  public String getPath() {
    return path;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Map<String, ColumnQualityInfo> getColumnQuality() {
    return columnQuality;
  }

  public List<String> getRecommendations() {
    return recommendations;
  }

  public double getSeverityScore() {
    return severityScore;
  }

  /** Table-wide metrics. */
  public static class Metrics {
    private final int totalRows;
    private final int totalColumns;
    private final int duplicateRows;
    private final double duplicatePercentage;
    private final Map<String, MissingInfo> missingDataSummary = new LinkedHashMap<>();
    private final Map<String, String> dataTypesSummary = new LinkedHashMap<>();

    Metrics(QualityReport report) {
      this.totalRows = report.getTotalRows();
      this.totalColumns = report.getTotalColumns();
      this.duplicateRows = report.getDuplicateRows();
      this.duplicatePercentage = report.getDuplicatePercentage();
      for (Map.Entry<String, QualityReport.ColumnQuality> entry
          : report.getColumns().entrySet()) {
        QualityReport.ColumnQuality quality = entry.getValue();
        missingDataSummary.put(entry.getKey(),
            new MissingInfo(quality.getMissingCount(), quality.getMissingPercentage()));
        dataTypesSummary.put(entry.getKey(), quality.getType().getDtype());
      }
    }

    public int getDuplicateRows() {
      return duplicateRows;
    }

    public Map<String, String> getDataTypesSummary() {
      return dataTypesSummary;
    }
  }

  /** Missing count and percentage of one column. */
  public static class MissingInfo {
    private final int missingCount;
    private final double missingPercentage;

    MissingInfo(int missingCount, double missingPercentage) {
      this.missingCount = missingCount;
      this.missingPercentage = missingPercentage;
    }
  }

  /** Quality details of one column. */
  public static class ColumnQualityInfo {
    private final String dataType;
    private final int nonNullCount;
    private final int nullCount;
    private final int uniqueCount;
    private final QualityReport.@Nullable NumericQuality numeric;
    private final QualityReport.@Nullable TextQuality categorical;

    ColumnQualityInfo(QualityReport.ColumnQuality quality) {
      this.dataType = quality.getType().getDtype();
      this.nonNullCount = quality.getNonMissingCount();
      this.nullCount = quality.getMissingCount();
      this.uniqueCount = quality.getDistinctCount();
      this.numeric = quality.getNumeric();
      this.categorical = quality.getText();
    }

    public String getDataType() {
      return dataType;
    }
  }
}
