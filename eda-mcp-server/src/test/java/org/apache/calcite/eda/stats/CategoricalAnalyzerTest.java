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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for CategoricalAnalyzer.
 */
@Tag("unit")
public class CategoricalAnalyzerTest {
  private static final double EPSILON = 1e-6;

  private final CategoricalAnalyzer analyzer = new CategoricalAnalyzer();

  @Test void testDistribution() throws Exception {
    Table table = Tables.table(
        Tables.text("city", "Tokyo", "Osaka", "Tokyo", null, "Kyoto", "Tokyo"));
    CategoricalProfile profile = analyzer.analyze(table, "city");

    assertThat(profile.getUniqueCount(), equalTo(3));
    assertThat(profile.getValueCounts().keySet(), contains("Tokyo", "Osaka", "Kyoto"));
    assertThat(profile.getValueCounts().get("Tokyo"), equalTo(3));
    assertThat(profile.getValuePercentages().get("Tokyo"), closeTo(60d, EPSILON));
    assertThat(profile.getValuePercentages().get("Kyoto"), closeTo(20d, EPSILON));
    assertThat(profile.getMode(), equalTo("Tokyo"));
    assertThat(profile.getModeFrequency(), equalTo(3));
    assertThat(profile.getEntropy(), closeTo(1.370951, EPSILON));
    assertThat(profile.getRecommendations(), empty());
  }

  @Test void testNumericColumnsAreComparedAsText() throws Exception {
    Table table = Tables.table(Tables.integers("n", 1L, 2L, 2L));
    CategoricalProfile profile = analyzer.analyze(table, "n");

    assertThat(profile.getValueCounts().keySet(), contains("2", "1"));
  }

  @Test void testSingleValueHasZeroEntropy() throws Exception {
    Table table = Tables.table(
        Tables.text("c", "a", "a", "a", "a", "a", "a", "a", "a", "a", "a"));
    CategoricalProfile profile = analyzer.analyze(table, "c");

    assertThat(profile.getEntropy(), equalTo(0d));
    assertThat(profile.getRecommendations(), hasItem(containsString("Dominant category")));
  }

  @Test void testIdentifierLikeColumn() throws Exception {
    Table table = Tables.table(Tables.text("id", "a1", "b2", "c3"));
    CategoricalProfile profile = analyzer.analyze(table, "id");

    assertThat(profile.getRecommendations(), hasItem(containsString("identifier")));
  }

  @Test void testHighCardinality() throws Exception {
    String[] values = new String[120];
    for (int i = 0; i < values.length; i++) {
      values[i] = "v" + (i % 60);
    }
    CategoricalProfile profile = analyzer.analyze(Tables.table(Tables.text("c", values)), "c");

    assertThat(profile.getUniqueCount(), equalTo(60));
    assertThat(profile.getRecommendations(), hasItem(containsString("High cardinality")));
  }

  @Test void testRejectsMissingOrEmptyColumn() {
    Table table = Tables.table(Tables.text("empty", null, null));

    assertThrows(InvalidArgumentException.class, () -> analyzer.analyze(table, "empty"));
    assertThrows(InvalidArgumentException.class, () -> analyzer.analyze(table, "nope"));
  }
}
