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

import org.apache.calcite.eda.stats.CategoricalProfile;

import java.util.List;
import java.util.Map;

/**
 * Result of {@code analyze_categorical}.
 */
public class CategoricalAnalysisResult extends ToolResult {
  private final String path;
  private final String column;
  private final Info info;
  private final List<String> recommendations;

  public CategoricalAnalysisResult(String path, CategoricalProfile profile) {
    this.path = path;
    this.column = profile.getColumn();
    this.info = new Info(profile);
    this.recommendations = profile.getRecommendations();
  }

  @Override public String getToolName() {
    return "analyze_categorical";
  }

  public String getPath() {
    return path;
  }

  public String getColumn() {
    return column;
  }

  public Info getInfo() {
    return info;
  }

  public List<String> getRecommendations() {
    return recommendations;
  }

  /** Frequency distribution details. */
  public static class Info {
    private final int uniqueCount;
    private final Map<String, Integer> valueCounts;
    private final Map<String, Double> valuePercentages;
    private final String mode;
    private final int modeFrequency;
    private final double entropy;

    Info(CategoricalProfile profile) {
      this.uniqueCount = profile.getUniqueCount();
      this.valueCounts = profile.getValueCounts();
      this.valuePercentages = profile.getValuePercentages();
      this.mode = profile.getMode();
      this.modeFrequency = profile.getModeFrequency();
      this.entropy = profile.getEntropy();
    }

    public int getUniqueCount() {
      return uniqueCount;
    }

    public String getMode() {
      return mode;
    }

    public double getEntropy() {
      return entropy;
    }
  }
}
