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
package org.apache.calcite.eda.tools;

import org.apache.calcite.eda.error.EdaException;
import org.apache.calcite.eda.error.InvalidArgumentException;
import org.apache.calcite.eda.path.PathResolver;
import org.apache.calcite.eda.protocol.result.CategoricalAnalysisResult;
import org.apache.calcite.eda.protocol.result.DataQualityResult;
import org.apache.calcite.eda.protocol.result.OutlierDetectionResult;
import org.apache.calcite.eda.stats.CategoricalAnalyzer;
import org.apache.calcite.eda.stats.OutlierDetector;
import org.apache.calcite.eda.stats.OutlierMethod;
import org.apache.calcite.eda.stats.QualityReporter;
import org.apache.calcite.eda.table.TableLoader;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * MCP tools for data quality checks: outliers, categorical distributions and
 * an overall quality report.
 */
public class QualityTools extends DatasetTools {
  private final OutlierDetector outlierDetector = new OutlierDetector();
  private final CategoricalAnalyzer categoricalAnalyzer = new CategoricalAnalyzer();
  private final QualityReporter qualityReporter = new QualityReporter();

  public QualityTools(PathResolver resolver, TableLoader loader) {
    super(resolver, loader);
  }

  /**
   * Detect outliers in a numeric column.
   *
   * @param path Dataset path
   * @param column Column name
   * @param method iqr or zscore; null means iqr
   * @return outlier counts, the top outliers and the thresholds applied
   * @throws EdaException if the path is rejected, the file cannot be parsed,
   *     or the column or method is invalid
   */
  public OutlierDetectionResult detectOutliers(@Nullable String path,
      @Nullable String column, @Nullable String method) throws EdaException {
    OutlierMethod outlierMethod = OutlierMethod.parse(method);
    String columnName = requireColumn(column);
    LoadedDataset loaded = load(path);
    return new OutlierDetectionResult(loaded.path(),
        outlierDetector.detect(loaded.table, columnName, outlierMethod));
  }

  /**
   * Analyze the value distribution of a column.
   *
   * @param path Dataset path
   * @param column Column name
   * @return value counts, mode, entropy and recommendations
   * @throws EdaException if the path is rejected, the file cannot be parsed,
   *     or the column is absent or empty
   */
  public CategoricalAnalysisResult analyzeCategorical(@Nullable String path,
      @Nullable String column) throws EdaException {
    String columnName = requireColumn(column);
    LoadedDataset loaded = load(path);
    return new CategoricalAnalysisResult(loaded.path(),
        categoricalAnalyzer.analyze(loaded.table, columnName));
  }

  /**
   * Generate a data quality report.
   *
   * @param path Dataset path
   * @return metrics, per-column quality, recommendations and severity score
   * @throws EdaException if the path is rejected or the file cannot be parsed
   */
  public DataQualityResult dataQualityReport(@Nullable String path) throws EdaException {
    LoadedDataset loaded = load(path);
    return new DataQualityResult(loaded.path(), qualityReporter.report(loaded.table));
  }

  private static String requireColumn(@Nullable String column)
      throws InvalidArgumentException {
    if (column == null || column.isEmpty()) {
      throw new InvalidArgumentException("Parameter 'column' is required");
    }
    return column;
  }
}
