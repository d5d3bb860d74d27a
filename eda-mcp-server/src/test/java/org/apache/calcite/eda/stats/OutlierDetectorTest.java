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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for OutlierDetector.
 */
@Tag("unit")
public class OutlierDetectorTest {
  private static final double EPSILON = 1e-4;

  private final OutlierDetector detector = new OutlierDetector();

  @Test void testInterquartileRange() throws Exception {
    Table table = Tables.table(Tables.doubles("v", 10d, 12d, 11d, 13d, 12d, 11d, 100d));
    OutlierReport report = detector.detect(table, "v", OutlierMethod.IQR);

    assertThat(report.getThresholds().keySet(),
        contains("Q1", "Q3", "IQR", "lower_bound", "upper_bound"));
    assertThat(report.getThresholds().get("Q1"), closeTo(11d, EPSILON));
    assertThat(report.getThresholds().get("Q3"), closeTo(12.5d, EPSILON));
    assertThat(report.getThresholds().get("lower_bound"), closeTo(8.75d, EPSILON));
    assertThat(report.getThresholds().get("upper_bound"), closeTo(14.75d, EPSILON));

    assertThat(report.getTotalOutliers(), equalTo(1));
    assertThat(report.getOutliers(), hasSize(1));
    assertThat(report.getOutliers().get(0).getIndex(), equalTo(6));
    assertThat(report.getOutliers().get(0).getValue(), equalTo(100d));
    assertThat(report.getOutliers().get(0).getScore(), closeTo(85.25d, EPSILON));
    assertThat(report.getOutlierPercentage(), closeTo(100d / 7d, EPSILON));
  }

  @Test void testIndexRefersToTableRow() throws Exception {
    Table table = Tables.table(
        Tables.integers("v", null, 10L, 12L, 11L, 13L, 12L, 11L, 100L));
    OutlierReport report = detector.detect(table, "v", OutlierMethod.IQR);

    assertThat(report.getOutliers().get(0).getIndex(), equalTo(7));
    assertThat(report.getOutlierPercentage(), closeTo(100d / 7d, EPSILON));
  }

  @Test void testZScore() throws Exception {
    Double[] values = new Double[20];
    for (int i = 0; i < 19; i++) {
      values[i] = 10d;
    }
    values[19] = 100d;
    OutlierReport report =
        detector.detect(Tables.table(Tables.doubles("v", values)), "v", OutlierMethod.ZSCORE);

    assertThat(report.getThresholds().get("threshold"), equalTo(3d));
    assertThat(report.getTotalOutliers(), equalTo(1));
    assertThat(report.getOutliers().get(0).getIndex(), equalTo(19));
    assertThat(report.getOutliers().get(0).getScore(), closeTo(85.5d / Math.sqrt(384.75d), EPSILON));
  }

  @Test void testConstantColumnHasNoZScoreOutliers() throws Exception {
    OutlierReport report = detector.detect(
        Tables.table(Tables.doubles("v", 5d, 5d, 5d, 5d)), "v", OutlierMethod.ZSCORE);

    assertThat(report.getTotalOutliers(), equalTo(0));
    assertThat(report.getOutliers(), empty());
  }

  @Test void testListIsCappedAndSortedByScore() throws Exception {
    Long[] values = new Long[100];
    for (int i = 0; i < 75; i++) {
      values[i] = 0L;
    }
    for (int i = 75; i < 100; i++) {
      values[i] = (long) (i - 74);
    }
    OutlierReport report =
        detector.detect(Tables.table(Tables.integers("v", values)), "v", OutlierMethod.IQR);

    assertThat(report.getTotalOutliers(), equalTo(25));
    assertThat(report.getOutliers(), hasSize(OutlierDetector.MAX_REPORTED));
    assertThat(report.getOutliers().get(0).getValue(), equalTo(25d));
    assertThat(report.getOutliers().get(1).getValue(), equalTo(24d));
    assertThat(report.getOutlierPercentage(), closeTo(25d, EPSILON));
  }

  @Test void testRejectsUnsuitableColumns() {
    Table table = Tables.people();

    assertThrows(InvalidArgumentException.class,
        () -> detector.detect(table, "city", OutlierMethod.IQR));
    assertThrows(InvalidArgumentException.class,
        () -> detector.detect(table, "nope", OutlierMethod.IQR));
  }

  @Test void testParseMethod() throws Exception {
    assertThat(OutlierMethod.parse(null), equalTo(OutlierMethod.IQR));
    assertThat(OutlierMethod.parse(" ZScore"), equalTo(OutlierMethod.ZSCORE));
    assertThrows(InvalidArgumentException.class,
        () -> OutlierMethod.parse("isolation_forest"));
  }
}
