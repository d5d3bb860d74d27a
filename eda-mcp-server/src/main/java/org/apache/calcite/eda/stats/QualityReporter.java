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
import org.apache.calcite.eda.table.ColumnType;
import org.apache.calcite.eda.table.Table;

import org.apache.commons.math3.stat.StatUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a data quality report with a severity score.
 *
 * <p>Severity adds 10 per column with more than 20% missing values, the
 * duplicate percentage when it exceeds 5%, and 5 per text column whose
 * distinct values exceed 90% of the rows; it is capped at 100.
 */
public class QualityReporter {
  static final double HIGH_MISSING_PERCENTAGE = 20d;
  static final double HIGH_DUPLICATE_PERCENTAGE = 5d;
  static final double HIGH_CARDINALITY_RATIO = 0.9d;
  static final double MAX_SEVERITY = 100d;

  /** Column names listed in a recommendation before it is cut short. */
  private static final int LISTED_COLUMNS = 3;

  public QualityReport report(Table table) {
    int rows = table.getRowCount();
    int duplicates = countDuplicateRows(table);
    double duplicatePercentage = percentage(duplicates, rows);

    Map<String, QualityReport.ColumnQuality> columns = new LinkedHashMap<>();
    List<String> highMissing = new ArrayList<>();
    List<String> highCardinality = new ArrayList<>();
    for (Column column : table.getColumns()) {
      QualityReport.ColumnQuality quality = assess(column, rows);
      columns.put(column.getName(), quality);
      if (quality.getMissingPercentage() > HIGH_MISSING_PERCENTAGE) {
        highMissing.add(column.getName());
      }
      QualityReport.TextQuality text = quality.getText();
      if (text != null && text.getCardinalityRatio() > HIGH_CARDINALITY_RATIO) {
        highCardinality.add(column.getName());
      }
    }

    List<String> recommendations = new ArrayList<>();
    double severity = 0d;
    if (!highMissing.isEmpty()) {
      recommendations.add("High missing rate columns (" + highMissing.size() + "): "
          + abbreviate(highMissing));
      severity += highMissing.size() * 10d;
    }
    if (duplicatePercentage > HIGH_DUPLICATE_PERCENTAGE) {
      recommendations.add(
          String.format(Locale.ROOT,
              "Many duplicate rows (%.1f%%): data cleaning recommended", duplicatePercentage));
      severity += duplicatePercentage;
    }
    if (!highCardinality.isEmpty()) {
      recommendations.add("High cardinality columns: " + abbreviate(highCardinality));
      severity += highCardinality.size() * 5d;
    }

    return new QualityReport(rows, table.getColumnCount(), duplicates, duplicatePercentage,
        columns, recommendations, Math.min(severity, MAX_SEVERITY));
  }

  private static QualityReport.ColumnQuality assess(Column column, int rows) {
    int missing = column.getMissingCount();
    int distinct = column.getDistinctCount();
    QualityReport.NumericQuality numeric = null;
    QualityReport.TextQuality text = null;

    if (column.isNumeric()) {
      double[] values = column.getNonMissingDoubles();
      int zeros = 0;
      int negatives = 0;
      for (double v : values) {
        if (v == 0d) {
          zeros++;
        } else if (v < 0d) {
          negatives++;
        }
      }
      numeric = new QualityReport.NumericQuality(StatUtils.mean(values),
          DescriptiveStatistics.sampleStd(values), StatUtils.min(values),
          StatUtils.max(values), zeros, negatives);
    } else if (column.getType() == ColumnType.TEXT
        || column.getType() == ColumnType.TEMPORAL) {
      Map<String, Integer> counts = CategoricalAnalyzer.valueCounts(column);
      String mostFrequent = null;
      int mostFrequentCount = 0;
      if (!counts.isEmpty()) {
        Map.Entry<String, Integer> top = counts.entrySet().iterator().next();
        mostFrequent = top.getKey();
        mostFrequentCount = top.getValue();
      }
      text = new QualityReport.TextQuality(mostFrequent, mostFrequentCount,
          rows == 0 ? 0d : (double) distinct / rows);
    }

    return new QualityReport.ColumnQuality(column.getType(), rows - missing, missing,
        percentage(missing, rows), distinct, numeric, text);
  }

  static int countDuplicateRows(Table table) {
    Set<List<Object>> seen = new HashSet<>();
    int duplicates = 0;
    for (int row = 0; row < table.getRowCount(); row++) {
      Object[] values = new Object[table.getColumnCount()];
      for (int i = 0; i < values.length; i++) {
        values[i] = table.getColumns().get(i).get(row);
      }
      if (!seen.add(Arrays.asList(values))) {
        duplicates++;
      }
    }
    return duplicates;
  }

  private static double percentage(int count, int total) {
    return MissingValueSummarizer.rate(count, total) * 100d;
  }

  private static String abbreviate(List<String> names) {
    return String.join(", ", names.subList(0, Math.min(LISTED_COLUMNS, names.size())));
  }
}
