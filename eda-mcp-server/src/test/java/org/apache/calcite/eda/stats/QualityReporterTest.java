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

import org.apache.calcite.eda.table.ColumnType;
import org.apache.calcite.eda.table.Table;
import org.apache.calcite.eda.table.Tables;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

/**
 * Tests for QualityReporter.
 */
@Tag("unit")
public class QualityReporterTest {
  private static final double EPSILON = 1e-9;

  private final QualityReporter reporter = new QualityReporter();

  @Test void testDuplicatesAndMissing() {
    Table table = Tables.table(
        Tables.integers("a", 1L, 1L, 2L, 2L),
        Tables.text("b", "x", "x", null, null));
    QualityReport report = reporter.report(table);

    assertThat(report.getTotalRows(), equalTo(4));
    assertThat(report.getTotalColumns(), equalTo(2));
    assertThat(report.getDuplicateRows(), equalTo(2));
    assertThat(report.getDuplicatePercentage(), closeTo(50d, EPSILON));

    QualityReport.ColumnQuality b = report.getColumns().get("b");
    assertThat(b.getType(), equalTo(ColumnType.TEXT));
    assertThat(b.getMissingCount(), equalTo(2));
    assertThat(b.getMissingPercentage(), closeTo(50d, EPSILON));
    assertThat(b.getText().getMostFrequent(), equalTo("x"));
    assertThat(b.getNumeric(), nullValue());

    assertThat(report.getRecommendations(), hasItem(containsString("High missing rate")));
    assertThat(report.getRecommendations(), hasItem(containsString("duplicate rows")));
    assertThat(report.getSeverityScore(), closeTo(60d, EPSILON));
  }

  @Test void testNumericQuality() {
    Table table = Tables.table(Tables.doubles("v", -1d, 0d, 0d, 3d));
    QualityReport.NumericQuality numeric = reporter.report(table).getColumns().get("v").getNumeric();

    assertThat(numeric, notNullValue());
    assertThat(numeric.getMean(), closeTo(0.5d, EPSILON));
    assertThat(numeric.getMin(), equalTo(-1d));
    assertThat(numeric.getMax(), equalTo(3d));
    assertThat(numeric.getZeroCount(), equalTo(2));
    assertThat(numeric.getNegativeCount(), equalTo(1));
  }

  @Test void testHighCardinalityText() {
    Table table = Tables.table(Tables.text("id", "k1", "k2", "k3", "k4", "k5"));
    QualityReport report = reporter.report(table);

    assertThat(report.getColumns().get("id").getText().getCardinalityRatio(),
        closeTo(1d, EPSILON));
    assertThat(report.getRecommendations(), hasItem(containsString("High cardinality")));
    assertThat(report.getSeverityScore(), closeTo(5d, EPSILON));
  }

  @Test void testSeverityIsCapped() {
    Table table = Tables.table(
        Tables.text("c1", null, null), Tables.text("c2", null, null),
        Tables.text("c3", null, null), Tables.text("c4", null, null),
        Tables.text("c5", null, null), Tables.text("c6", null, null),
        Tables.text("c7", null, null), Tables.text("c8", null, null),
        Tables.text("c9", null, null), Tables.text("c10", null, null),
        Tables.text("c11", null, null));

    assertThat(reporter.report(table).getSeverityScore(), equalTo(100d));
  }

  @Test void testCleanData() {
    Table table = Tables.table(
        Tables.integers("a", 1L, 2L, 3L),
        Tables.text("b", "x", "x", "y"));
    QualityReport report = reporter.report(table);

    assertThat(report.getDuplicateRows(), equalTo(0));
    assertThat(report.getRecommendations(), empty());
    assertThat(report.getSeverityScore(), equalTo(0d));
  }

  @Test void testEmptyTable() {
    QualityReport report = reporter.report(Tables.table(Tables.text("a")));

    assertThat(report.getTotalRows(), equalTo(0));
    assertThat(report.getSeverityScore(), equalTo(0d));
    assertThat(report.getColumns().get("a").getMissingPercentage(), equalTo(0d));
  }
}
