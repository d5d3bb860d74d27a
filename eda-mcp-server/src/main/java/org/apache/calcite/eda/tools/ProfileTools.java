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
import org.apache.calcite.eda.path.PathResolver;
import org.apache.calcite.eda.protocol.result.ColumnInfoResult;
import org.apache.calcite.eda.protocol.result.CorrelationMatrixResult;
import org.apache.calcite.eda.protocol.result.DescribeCsvResult;
import org.apache.calcite.eda.protocol.result.MissingValuesResult;
import org.apache.calcite.eda.stats.ColumnProfiler;
import org.apache.calcite.eda.stats.CorrelationEngine;
import org.apache.calcite.eda.stats.CorrelationMethod;
import org.apache.calcite.eda.stats.DescriptiveStatistics;
import org.apache.calcite.eda.stats.MissingValueSummarizer;
import org.apache.calcite.eda.table.TableLoader;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * MCP tools for table profiling and statistics.
 *
 * <p>Provides column types and counts, missing-value summaries, descriptive
 * statistics and correlation matrices.
 */
public class ProfileTools extends DatasetTools {
  private final ColumnProfiler columnProfiler = new ColumnProfiler();
  private final MissingValueSummarizer missingValueSummarizer = new MissingValueSummarizer();
  private final DescriptiveStatistics descriptiveStatistics = new DescriptiveStatistics();
  private final CorrelationEngine correlationEngine = new CorrelationEngine();

  public ProfileTools(PathResolver resolver, TableLoader loader) {
    super(resolver, loader);
  }

  /**
   * Return dtype and basic counts for each column.
   *
   * @param path Dataset path
   * @return per-column dtype, non-null, null and unique counts
   * @throws EdaException if the path is rejected or the file cannot be parsed
   */
  public ColumnInfoResult columnInfo(@Nullable String path) throws EdaException {
    LoadedDataset loaded = load(path);
    return new ColumnInfoResult(loaded.path(), columnProfiler.profile(loaded.table));
  }

  /**
   * Summarize missing value counts and rates.
   *
   * @param path Dataset path
   * @return total rows and per-column missing count and rate
   * @throws EdaException if the path is rejected or the file cannot be parsed
   */
  public MissingValuesResult missingValues(@Nullable String path) throws EdaException {
    LoadedDataset loaded = load(path);
    return new MissingValuesResult(loaded.path(), missingValueSummarizer.summarize(loaded.table));
  }

  /**
   * Return descriptive statistics of the numeric columns.
   *
   * @param path Dataset path
   * @return shape and per-numeric-column statistics
   * @throws EdaException if the path is rejected or the file cannot be parsed
   */
  public DescribeCsvResult describeCsv(@Nullable String path) throws EdaException {
    LoadedDataset loaded = load(path);
    return new DescribeCsvResult(loaded.path(), descriptiveStatistics.describe(loaded.table));
  }

  /**
   * Compute a correlation matrix for numeric columns.
   *
   * @param path Dataset path
   * @param columns Columns to correlate; null or empty means all numeric columns
   * @param method Method name: pearson, spearman or kendall; null means pearson
   * @return selected columns and the coefficient matrix
   * @throws EdaException if the path is rejected, the file cannot be parsed,
   *     the method is unknown, or no numeric column is selected
   */
  public CorrelationMatrixResult correlationMatrix(@Nullable String path,
      @Nullable List<String> columns, @Nullable String method) throws EdaException {
    CorrelationMethod correlationMethod = CorrelationMethod.parse(method);
    LoadedDataset loaded = load(path);
    return new CorrelationMatrixResult(loaded.path(),
        correlationEngine.correlate(loaded.table, columns, correlationMethod));
  }
}
