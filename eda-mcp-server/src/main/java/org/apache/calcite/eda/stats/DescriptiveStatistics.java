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

import org.apache.calcite.eda.table.Column;
import org.apache.calcite.eda.table.Table;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes count, mean, standard deviation, minimum, quartiles and maximum of
 * numeric columns.
 *
 * <p>Quartiles interpolate linearly between order statistics (estimation
 * type R-7).
 */
public class DescriptiveStatistics {

  /**
   * Describes every numeric column of a table.
   *
   * <p>A table without numeric columns yields an empty statistics map.
   */
  public DescribeResult describe(Table table) {
    Map<String, NumericSummary> statistics = new LinkedHashMap<>();
    for (Column column : table.getNumericColumns()) {
      statistics.put(column.getName(), summarize(column.getNonMissingDoubles()));
    }
    return new DescribeResult(table.getRowCount(), table.getColumnCount(), statistics);
  }

  /**
   * Summarizes a sample of values; all statistics but the count are NaN for
   * an empty sample.
   */
  public static NumericSummary summarize(double[] values) {
    return new NumericSummary(values.length,
        StatUtils.mean(values),
        sampleStd(values),
        StatUtils.min(values),
        percentile(values, 25d),
        percentile(values, 50d),
        percentile(values, 75d),
        StatUtils.max(values));
  }

  /**
   * Sample standard deviation; NaN for fewer than two values.
   */
  public static double sampleStd(double[] values) {
    if (values.length < 2) {
      return Double.NaN;
    }
    return new StandardDeviation(true).evaluate(values);
  }

  /**
   * Percentile with linear interpolation; NaN for an empty sample.
   *
   * @param values Sample
   * @param p Percentile in (0, 100]
   */
  public static double percentile(double[] values, double p) {
    if (values.length == 0) {
      return Double.NaN;
    }
    // An exact order statistic is returned as is; interpolating towards an
    // infinite neighbor would yield 0 * Infinity.
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double position = (sorted.length - 1) * p / 100d;
    int k = (int) Math.floor(position);
    if (k >= sorted.length - 1 || position == k || sorted[k] == sorted[k + 1]) {
      return sorted[Math.min(k, sorted.length - 1)];
    }
    return new Percentile()
        .withEstimationType(Percentile.EstimationType.R_7)
        .evaluate(values, p);
  }
}
