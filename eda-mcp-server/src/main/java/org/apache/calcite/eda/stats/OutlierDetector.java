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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags outlying values of a numeric column.
 */
public class OutlierDetector {
  /** Maximum number of outliers listed in a report. */
  public static final int MAX_REPORTED = 20;

  static final double IQR_FACTOR = 1.5d;
  static final double ZSCORE_THRESHOLD = 3.0d;

  /**
   * Detects outliers.
   *
   * @throws InvalidArgumentException if the column does not exist or is not
   *     numeric
   */
  public OutlierReport detect(Table table, String columnName, OutlierMethod method)
      throws InvalidArgumentException {
    Column column = table.getColumn(columnName);
    if (column == null) {
      throw new InvalidArgumentException("Column '" + columnName + "' not found in dataset");
    }
    if (!column.isNumeric()) {
      throw new InvalidArgumentException("Column '" + columnName + "' is not numeric");
    }

    List<Integer> rows = new ArrayList<>();
    for (int row = 0; row < column.size(); row++) {
      if (!column.isMissing(row)) {
        rows.add(row);
      }
    }
    double[] values = column.getNonMissingDoubles();

    Map<String, Double> thresholds = new LinkedHashMap<>();
    List<OutlierReport.Outlier> outliers = new ArrayList<>();
    switch (method) {
      case IQR:
        double q1 = DescriptiveStatistics.percentile(values, 25d);
        double q3 = DescriptiveStatistics.percentile(values, 75d);
        double iqr = q3 - q1;
        double lower = q1 - IQR_FACTOR * iqr;
        double upper = q3 + IQR_FACTOR * iqr;
        thresholds.put("Q1", q1);
        thresholds.put("Q3", q3);
        thresholds.put("IQR", iqr);
        thresholds.put("lower_bound", lower);
        thresholds.put("upper_bound", upper);
        for (int i = 0; i < values.length; i++) {
          double v = values[i];
          if (v < lower || v > upper) {
            double score = Math.min(Math.abs(v - lower), Math.abs(v - upper));
            outliers.add(new OutlierReport.Outlier(rows.get(i), v, score));
          }
        }
        break;
      case ZSCORE:
        thresholds.put("threshold", ZSCORE_THRESHOLD);
        double mean = StatUtils.mean(values);
        double std = new StandardDeviation(false).evaluate(values);
        if (std > 0d) {
          for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / std;
            if (z > ZSCORE_THRESHOLD) {
              outliers.add(new OutlierReport.Outlier(rows.get(i), values[i], z));
            }
          }
        }
        break;
      default:
        throw new AssertionError("unknown method " + method);
    }

    outliers.sort(Comparator.comparingDouble(OutlierReport.Outlier::getScore).reversed());
    double percentage = values.length == 0 ? 0d : 100d * outliers.size() / values.length;
    List<OutlierReport.Outlier> top =
        outliers.subList(0, Math.min(MAX_REPORTED, outliers.size()));
    return new OutlierReport(columnName, method, outliers.size(), percentage, top, thresholds);
  }
}
