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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Analyzes the value distribution of a single column.
 *
 * <p>Values are compared by their string form, so the analysis applies to
 * columns of any type.
 */
public class CategoricalAnalyzer {
  static final int HIGH_CARDINALITY = 50;
  static final double DOMINANT_SHARE = 0.9d;

  /**
   * Analyzes a column.
   *
   * @throws InvalidArgumentException if the column does not exist or has no
   *     values
   */
  public CategoricalProfile analyze(Table table, String columnName)
      throws InvalidArgumentException {
    Column column = table.getColumn(columnName);
    if (column == null) {
      throw new InvalidArgumentException("Column '" + columnName + "' not found in dataset");
    }
    Map<String, Integer> counts = valueCounts(column);
    if (counts.isEmpty()) {
      throw new InvalidArgumentException("Column '" + columnName + "' has no non-missing values");
    }

    int total = column.getNonMissingCount();
    Map<String, Double> percentages = new LinkedHashMap<>();
    double entropy = 0d;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      double p = (double) entry.getValue() / total;
      percentages.put(entry.getKey(), p * 100d);
      entropy += p * (Math.log(1d / p) / Math.log(2d));
    }

    Map.Entry<String, Integer> mode = counts.entrySet().iterator().next();
    List<String> recommendations = new ArrayList<>();
    if (counts.size() > HIGH_CARDINALITY) {
      recommendations.add(
          String.format(Locale.ROOT,
              "High cardinality (%d unique values): consider grouping categories",
              counts.size()));
    }
    if ((double) mode.getValue() / total > DOMINANT_SHARE) {
      recommendations.add("Dominant category present: watch for skewed data");
    }
    if (counts.size() == total) {
      recommendations.add("All values are distinct: possibly an identifier column");
    }

    return new CategoricalProfile(columnName, counts, percentages, mode.getKey(),
        mode.getValue(), entropy, recommendations);
  }

  /**
   * Counts non-missing values by string form, most frequent first; ties keep
   * the order in which values first appear.
   */
  static Map<String, Integer> valueCounts(Column column) {
    Map<String, Integer> firstSeen = new LinkedHashMap<>();
    for (Object value : column.getValues()) {
      if (value != null) {
        firstSeen.merge(String.valueOf(value), 1, Integer::sum);
      }
    }
    List<Map.Entry<String, Integer>> entries = new ArrayList<>(firstSeen.entrySet());
    entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
    Map<String, Integer> sorted = new LinkedHashMap<>();
    for (Map.Entry<String, Integer> entry : entries) {
      sorted.put(entry.getKey(), entry.getValue());
    }
    return sorted;
  }
}
