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

/**
 * Descriptive statistics of one numeric column.
 *
 * <p>Statistics that are undefined for the column's values, such as the
 * standard deviation of fewer than two values, are NaN.
 */
public final class NumericSummary {
  private final int count;
  private final double mean;
  private final double std;
  private final double min;
  private final double percentile25;
  private final double median;
  private final double percentile75;
  private final double max;

  public NumericSummary(int count, double mean, double std, double min,
      double percentile25, double median, double percentile75, double max) {
    this.count = count;
    this.mean = mean;
    this.std = std;
    this.min = min;
    this.percentile25 = percentile25;
    this.median = median;
    this.percentile75 = percentile75;
    this.max = max;
  }

  /** Number of non-missing values. */
  public int getCount() {
    return count;
  }

  public double getMean() {
    return mean;
  }

  /** Sample standard deviation (denominator n - 1). */
  public double getStd() {
    return std;
  }

  public double getMin() {
    return min;
  }

  public double getPercentile25() {
    return percentile25;
  }

  public double getMedian() {
    return median;
  }

  public double getPercentile75() {
    return percentile75;
  }

  public double getMax() {
    return max;
  }
}
