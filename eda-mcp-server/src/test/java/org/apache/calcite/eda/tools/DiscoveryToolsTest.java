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
package org.apache.calcite.eda.tools;

import org.apache.calcite.eda.DataRootConfig;
import org.apache.calcite.eda.error.CsvParseException;
import org.apache.calcite.eda.error.DatasetNotFoundException;
import org.apache.calcite.eda.error.InvalidArgumentException;
import org.apache.calcite.eda.error.SecurityViolationException;
import org.apache.calcite.eda.protocol.result.DatasetListResult;
import org.apache.calcite.eda.protocol.result.PreviewResult;

import com.google.gson.JsonObject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for DiscoveryTools.
 */
@Tag("unit")
public class DiscoveryToolsTest {
  @TempDir
  Path tempDir;

  private DataRootConfig config;
  private DiscoveryTools tools;

  @BeforeEach
  void setUp() throws Exception {
    config = DatasetFixtures.createDataRoot(tempDir);
    tools = DatasetFixtures.discoveryTools(config);
  }

  @Test void testListDatasets() throws Exception {
    DatasetListResult result = tools.listDatasets();

    assertThat(result.getDatasets(),
        contains("broken.csv", "people.csv", "sample.csv", "sub/nested.csv"));
    assertThat(result.getDataRoot(), equalTo(config.getRoot().toString()));

    JsonObject json = result.toJson();
    assertThat(json.get("data_root").getAsString(), equalTo(config.getRoot().toString()));
    assertThat(json.getAsJsonArray("datasets").size(), equalTo(4));
  }

  @Test void testPreview() throws Exception {
    PreviewResult result = tools.previewCsv("sample.csv", 3);

    assertThat(result.getPath(), equalTo("sample.csv"));
    assertThat(result.getRowCountReturned(), equalTo(3));
    assertThat(result.getRows(), hasSize(3));
    assertThat(result.getColumnNames(), contains("id", "value"));

    JsonObject json = result.toJson();
    assertThat(json.get("row_count_returned").getAsInt(), equalTo(3));
    JsonObject first = json.getAsJsonArray("rows").get(0).getAsJsonObject();
    assertThat(first.get("id").getAsLong(), equalTo(1L));
    assertThat(first.get("value").getAsDouble(), equalTo(1.5d));
  }

  @Test void testPreviewMoreRowsThanExist() throws Exception {
    assertThat(tools.previewCsv("sample.csv", 100).getRows(), hasSize(10));
  }

  @Test void testPreviewWritesMissingCellsAsNull() throws Exception {
    JsonObject json = tools.previewCsv("people.csv", 5).toJson();
    JsonObject second = json.getAsJsonArray("rows").get(1).getAsJsonObject();

    assertThat(second.has("age"), is(true));
    assertThat(second.get("age").isJsonNull(), is(true));
  }

  @Test void testPreviewByAbsolutePath() throws Exception {
    String absolute = config.getRoot().resolve("sub/nested.csv").toString();
    assertThat(tools.previewCsv(absolute, 5).getPath(), equalTo("sub/nested.csv"));
  }

  @Test void testPreviewFailures() {
    assertThrows(SecurityViolationException.class,
        () -> tools.previewCsv("../outside.csv", 5));
    assertThrows(DatasetNotFoundException.class,
        () -> tools.previewCsv("missing.csv", 5));
    assertThrows(CsvParseException.class,
        () -> tools.previewCsv("broken.csv", 5));
    assertThrows(InvalidArgumentException.class,
        () -> tools.previewCsv("sample.csv", -1));
  }
}
