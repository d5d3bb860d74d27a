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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for PreviewGenerator.
 */
@Tag("unit")
public class PreviewGeneratorTest {
  private final PreviewGenerator generator = new PreviewGenerator();

  private static Table tenRows() {
    Long[] ids = new Long[10];
    String[] names = new String[10];
    for (int i = 0; i < 10; i++) {
      ids[i] = (long) i;
      names[i] = "row" + i;
    }
    return Tables.table(Tables.integers("id", ids), Tables.text("name", names));
  }

  @Test void testFirstRows() throws Exception {
    Preview preview = generator.preview(tenRows(), 3);

    assertThat(preview.getRows(), hasSize(3));
    assertThat(preview.getColumnNames(), contains("id", "name"));
    assertThat(preview.getRows().get(0).get("id"), equalTo(0L));
    assertThat(preview.getRows().get(2).get("name"), equalTo("row2"));
  }

  @Test void testLimitBeyondRowCount() throws Exception {
    assertThat(generator.preview(tenRows(), 100).getRows(), hasSize(10));
  }

  @Test void testZeroRowsKeepsColumnNames() throws Exception {
    Preview preview = generator.preview(tenRows(), 0);

    assertThat(preview.getRows(), empty());
    assertThat(preview.getColumnNames(), contains("id", "name"));
  }

  @Test void testMissingCellsAreNull() throws Exception {
    Preview preview = generator.preview(Tables.people(), PreviewGenerator.DEFAULT_ROWS);

    assertThat(preview.getRows(), hasSize(5));
    assertThat(preview.getRows().get(1).get("age"), nullValue());
  }

  @Test void testNegativeLimit() {
    assertThrows(InvalidArgumentException.class, () -> generator.preview(tenRows(), -1));
  }
}
