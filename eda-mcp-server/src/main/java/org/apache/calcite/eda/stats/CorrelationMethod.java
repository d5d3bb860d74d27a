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

import org.apache.commons.math3.stat.correlation.KendallsCorrelation;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Measure of association between two numeric sequences.
 */
public enum CorrelationMethod {
  /** Linear, covariance-normalized coefficient. */
  PEARSON("pearson") {
    @Override double coefficient(double[] x, double[] y) {
      return new PearsonsCorrelation().correlation(x, y);
    }
  },

  /** Pearson coefficient of the ranks; ties get their average rank. */
  SPEARMAN("spearman") {
    @Override double coefficient(double[] x, double[] y) {
      return new SpearmansCorrelation(
          new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE))
          .correlation(x, y);
    }
  },

  /** Kendall tau-b: concordant minus discordant pairs, corrected for ties. */
  KENDALL("kendall") {
    @Override double coefficient(double[] x, double[] y) {
      return new KendallsCorrelation().correlation(x, y);
    }
  };

  private final String methodName;

  CorrelationMethod(String methodName) {
    this.methodName = methodName;
  }

  public String getMethodName() {
    return methodName;
  }

  /**
   * Computes the coefficient of two complete, equally long sequences.
   *
   * <p>Returns NaN when fewer than two observations are available or when
   * either sequence is constant.
   */
  public double correlate(double[] x, double[] y) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("Length mismatch: " + x.length + " vs " + y.length);
    }
    if (x.length < 2 || isConstant(x) || isConstant(y)) {
      return Double.NaN;
    }
    return coefficient(x, y);
  }

  abstract double coefficient(double[] x, double[] y);

  private static boolean isConstant(double[] values) {
    for (int i = 1; i < values.length; i++) {
      if (Double.compare(values[i], values[0]) != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Parses a method name, ignoring case and surrounding whitespace.
   *
   * @param name Method name; {@code null} means pearson
   * @throws InvalidArgumentException if the name is not a supported method
   */
  public static CorrelationMethod parse(@Nullable String name)
      throws InvalidArgumentException {
    if (name == null) {
      return PEARSON;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (CorrelationMethod method : values()) {
      if (method.methodName.equals(normalized)) {
        return method;
      }
    }
    throw new InvalidArgumentException("Unsupported correlation method: '" + name
        + "' (supported: " + supportedNames() + ")");
  }

  static String supportedNames() {
    return Arrays.stream(values())
        .map(CorrelationMethod::getMethodName)
        .collect(Collectors.joining(", "));
  }
}
