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

import org.apache.calcite.eda.stats.OutlierReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of {@code detect_outliers}.
 */
public class OutlierDetectionResult extends ToolResult {
  private final String path;
  private final String column;
  private final String method;
  private final int totalOutliers;
  private final double outlierPercentage;
  private final List<OutlierInfo> outliers = new ArrayList<>();
  private final Map<String, Double> thresholdInfo;

  public OutlierDetectionResult(String path, OutlierReport report) {
    this.path = path;
    this.column = report.getColumn();
    this.method = report.getMethod().getMethodName();
    this.totalOutliers = report.getTotalOutliers();
    this.outlierPercentage = report.getOutlierPercentage();
    for (OutlierReport.Outlier outlier : report.getOutliers()) {
      outliers.add(new OutlierInfo(outlier, method));
    }
    this.thresholdInfo = report.getThresholds();
  }

  @Override public String getToolName() {
    return "detect_outliers";
  }

  public String getPath() {
    return path;
  }

  public String getColumn() {
    return column;
  }

  public int getTotalOutliers() {
    return totalOutliers;
  }

  public List<OutlierInfo> getOutliers() {
    return outliers;
  }

  /** One reported outlier. */
  public static class OutlierInfo {
    private final int index;
    private final double value;
    private final double score;
    private final String method;

    OutlierInfo(OutlierReport.Outlier outlier, String method) {
      this.index = outlier.getIndex();
      this.value = outlier.getValue();
      this.score = outlier.getScore();
      this.method = method;
    }

    public int getIndex() {
      return index;
    }

    public double getValue() {
      return value;
    }

    public double getScore() {
      return score;
    }

    public String getMethod() {
      return method;
    }
  }
}
