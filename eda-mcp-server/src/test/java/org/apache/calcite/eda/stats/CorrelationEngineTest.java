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
import org.apache.calcite.eda.table.Table;
import org.apache.calcite.eda.table.Tables;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for CorrelationEngine and CorrelationMethod.
 */
@Tag("unit")
public class CorrelationEngineTest {
  private static final double EPSILON = 1e-6;

  private final CorrelationEngine engine = new CorrelationEngine();

  @Test void testAllNumericColumnsByDefault() throws Exception {
    CorrelationResult result =
        engine.correlate(Tables.people(), null, CorrelationMethod.PEARSON);

    assertThat(result.getColumns(), contains("age", "income"));
    assertThat(result.size(), equalTo(2));
    assertThat(result.get(0, 0), equalTo(1.0d));
    assertThat(result.get(1, 1), equalTo(1.0d));
    assertThat(result.getMethod(), equalTo(CorrelationMethod.PEARSON));
  }

  @Test void testEmptyRequestMeansAllColumns() throws Exception {
    CorrelationResult result = engine.correlate(Tables.people(),
        Collections.emptyList(), CorrelationMethod.SPEARMAN);

    assertThat(result.getColumns(), contains("age", "income"));
  }

  @Test void testPerfectCorrelationForEveryMethod() throws Exception {
    Table table = Tables.table(
        Tables.doubles("x", 1d, 2d, 3d, 4d, 5d),
        Tables.doubles("up", 2d, 4d, 6d, 8d, 10d),
        Tables.doubles("down", 5d, 4d, 3d, 2d, 1d));

    for (CorrelationMethod method : CorrelationMethod.values()) {
      CorrelationResult result = engine.correlate(table, null, method);
      assertThat(method.getMethodName(), result.get("x", "up"), closeTo(1d, EPSILON));
      assertThat(method.getMethodName(), result.get("x", "down"), closeTo(-1d, EPSILON));
    }
  }

  @Test void testSpearmanUsesAverageRanksForTies() throws Exception {
    Table table = Tables.table(
        Tables.doubles("x", 1d, 2d, 2d, 3d),
        Tables.doubles("y", 1d, 2d, 3d, 4d));

    double rho = engine.correlate(table, null, CorrelationMethod.SPEARMAN).get("x", "y");
    assertThat(rho, closeTo(4.5 / Math.sqrt(22.5), EPSILON));
  }

  @Test void testKendallTauB() throws Exception {
    Table table = Tables.table(
        Tables.doubles("x", 1d, 2d, 2d, 3d),
        Tables.doubles("y", 1d, 2d, 3d, 4d));

    double tau = engine.correlate(table, null, CorrelationMethod.KENDALL).get("x", "y");
    assertThat(tau, closeTo(5d / Math.sqrt(30d), EPSILON));
  }

  @Test void testPairwiseCompleteObservations() throws Exception {
    Table table = Tables.table(
        Tables.doubles("a", 1d, 2d, 3d, null, 5d),
        Tables.doubles("b", 1d, 2d, 3d, 100d, 5d),
        Tables.doubles("c", null, 3d, 2d, 1d, 0d));

    CorrelationResult result = engine.correlate(table, null, CorrelationMethod.PEARSON);
    assertThat(result.get("a", "b"), closeTo(1d, EPSILON));
    assertThat(result.get("a", "c"), closeTo(-1d, EPSILON));
  }

  @Test void testUndefinedCoefficientIsNaN() throws Exception {
    Table table = Tables.table(
        Tables.doubles("x", 1d, 2d, 3d),
        Tables.doubles("constant", 7d, 7d, 7d),
        Tables.doubles("sparse", null, null, 4d));

    CorrelationResult result = engine.correlate(table, null, CorrelationMethod.PEARSON);
    assertThat(Double.isNaN(result.get("x", "constant")), is(true));
    assertThat(Double.isNaN(result.get("x", "sparse")), is(true));
    assertThat(result.get("constant", "constant"), equalTo(1.0d));
    assertThat(result.get("sparse", "sparse"), equalTo(1.0d));
  }

  @Test void testRequestedOrderIsKeptAndUnknownNamesDropped() throws Exception {
    CorrelationResult result = engine.correlate(Tables.people(),
        Arrays.asList("income", "city", "age", "missing", "income"),
        CorrelationMethod.PEARSON);

    assertThat(result.getColumns(), contains("income", "age"));
  }

  @Test void testSymmetricWithUnitDiagonal() throws Exception {
    Table table = Tables.table(
        Tables.doubles("a", 3d, 1d, 4d, 1d, 5d, 9d),
        Tables.integers("b", 2L, 7L, 1L, 8L, 2L, 8L),
        Tables.doubles("c", 0.5d, null, 0.25d, 0.75d, 1d, 0d));

    for (CorrelationMethod method : CorrelationMethod.values()) {
      CorrelationResult result = engine.correlate(table, null, method);
      for (int i = 0; i < result.size(); i++) {
        assertThat(result.get(i, i), equalTo(1.0d));
        for (int j = 0; j < result.size(); j++) {
          assertThat(Double.compare(result.get(i, j), result.get(j, i)), equalTo(0));
          if (!Double.isNaN(result.get(i, j))) {
            assertThat(Math.abs(result.get(i, j)) <= 1d + EPSILON, is(true));
          }
        }
      }
    }
  }

  @Test void testNoNumericColumns() {
    Table table = Tables.table(Tables.text("city", "a", "b"));

    InvalidArgumentException e = assertThrows(InvalidArgumentException.class,
        () -> engine.correlate(table, null, CorrelationMethod.PEARSON));
    assertThat(e.getMessage(), containsString("No numeric columns"));
  }

  @Test void testNoRequestedColumnIsNumeric() {
    assertThrows(InvalidArgumentException.class,
        () -> engine.correlate(Tables.people(), Arrays.asList("city", "nope"),
            CorrelationMethod.PEARSON));
  }

  @Test void testParseMethod() throws Exception {
    assertThat(CorrelationMethod.parse(null), equalTo(CorrelationMethod.PEARSON));
    assertThat(CorrelationMethod.parse("Spearman "), equalTo(CorrelationMethod.SPEARMAN));
    assertThat(CorrelationMethod.parse("KENDALL"), equalTo(CorrelationMethod.KENDALL));

    InvalidArgumentException e = assertThrows(InvalidArgumentException.class,
        () -> CorrelationMethod.parse("foo"));
    assertThat(e.getMessage(), containsString("pearson, spearman, kendall"));
  }
}
