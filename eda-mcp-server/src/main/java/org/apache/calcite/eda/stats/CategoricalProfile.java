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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Frequency distribution of a column's values.
 */
public final class CategoricalProfile {
  private final String column;
  private final ImmutableMap<String, Integer> valueCounts;
  private final ImmutableMap<String, Double> valuePercentages;
  private final String mode;
  private final int modeFrequency;
  private final double entropy;
  private final ImmutableList<String> recommendations;

  public CategoricalProfile(String column, Map<String, Integer> valueCounts,
      Map<String, Double> valuePercentages, String mode, int modeFrequency,
      double entropy, List<String> recommendations) {
    this.column = column;
    this.valueCounts = ImmutableMap.copyOf(valueCounts);
    this.valuePercentages = ImmutableMap.copyOf(valuePercentages);
    this.mode = mode;
    this.modeFrequency = modeFrequency;
    this.entropy = entropy;
    this.recommendations = ImmutableList.copyOf(recommendations);
  }

  public String getColumn() {
    return column;
  }

  public int getUniqueCount() {
    return valueCounts.size();
  }

  /** Occurrences per value, most frequent first. */
  public Map<String, Integer> getValueCounts() {
    return valueCounts;
  }

  public Map<String, Double> getValuePercentages() {
    return valuePercentages;
  }

  public String getMode() {
    return mode;
  }

  public int getModeFrequency() {
    return modeFrequency;
  }

  /** Shannon entropy of the distribution, in bits. */
  public double getEntropy() {
    return entropy;
  }

  public List<String> getRecommendations() {
    return recommendations;
  }
}
