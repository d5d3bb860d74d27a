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

import org.apache.calcite.eda.stats.DescribeResult;
import org.apache.calcite.eda.stats.NumericSummary;

import com.google.gson.annotations.SerializedName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of {@code describe_csv}.
 */
public class DescribeCsvResult extends ToolResult {
  private final String path;
  private final Shape shape;
  private final Map<String, Statistics> statistics = new LinkedHashMap<>();

  public DescribeCsvResult(String path, DescribeResult result) {
    this.path = path;
    this.shape = new Shape(result.getRowCount(), result.getColumnCount());
    for (Map.Entry<String, NumericSummary> entry : result.getStatistics().entrySet()) {
      statistics.put(entry.getKey(), new Statistics(entry.getValue()));
    }
  }

  @Override public String getToolName() {
    return "describe_csv";
  }

  public String getPath() {
    return path;
  }

  public Shape getShape() {
    return shape;
  }

  public Map<String, Statistics> getStatistics() {
    return statistics;
  }

  /** Row and column counts. */
  public static class Shape {
    private final int rows;
    private final int columns;

    Shape(int rows, int columns) {
      this.rows = rows;
      this.columns = columns;
    }

    public int getRows() {
      return rows;
    }

    public int getColumns() {
      return columns;
    }
  }

  /** Statistics of one numeric column, keyed the way dataframe summaries are. */
  public static class Statistics {
    private final int count;
    private final double mean;
    private final double std;
    private final double min;
    @SerializedName("25%")
    private final double percentile25;
    @SerializedName("50%")
    private final double median;
    @SerializedName("75%")
    private final double percentile75;
    private final double max;

    Statistics(NumericSummary summary) {
      this.count = summary.getCount();
      this.mean = summary.getMean();
      this.std = summary.getStd();
      this.min = summary.getMin();
      this.percentile25 = summary.getPercentile25();
      this.median = summary.getMedian();
      this.percentile75 = summary.getPercentile75();
      this.max = summary.getMax();
    }

    public int getCount() {
      return count;
    }

    public double getMean() {
      return mean;
    }

    public double getStd() {
      return std;
    }
  }
}
