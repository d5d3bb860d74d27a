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
package org.apache.calcite.eda.path;

import org.apache.calcite.eda.DataRootConfig;
import org.apache.calcite.eda.error.DatasetNotFoundException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for DatasetCatalog.
 */
@Tag("unit")
public class DatasetCatalogTest {
  @TempDir
  Path tempDir;

  private Path createRoot() throws IOException {
    return Files.createDirectories(tempDir.resolve("data"));
  }

  @Test void testListsNestedFilesSorted() throws Exception {
    Path root = createRoot();
    Files.createDirectories(root.resolve("sub"));
    Files.writeString(root.resolve("sub/nested.csv"), "a\n1\n");
    Files.writeString(root.resolve("sample.csv"), "a\n1\n");

    DatasetCatalog catalog = new DatasetCatalog(DataRootConfig.of(root));

    assertThat(catalog.listDatasets(), contains("sample.csv", "sub/nested.csv"));
  }

  @Test void testExtensionIsCaseInsensitiveAndOthersIgnored() throws Exception {
    Path root = createRoot();
    Files.createDirectories(root.resolve("b"));
    Files.writeString(root.resolve("UPPER.CSV"), "a\n");
    Files.writeString(root.resolve("b/a.csv"), "a\n");
    Files.writeString(root.resolve("notes.txt"), "hello");
    Files.writeString(root.resolve("data.csv.bak"), "a\n");
    Files.createDirectories(root.resolve("dir.csv"));

    DatasetCatalog catalog = new DatasetCatalog(DataRootConfig.of(root));

    assertThat(catalog.listDatasets(), contains("UPPER.CSV", "b/a.csv"));
  }

  @Test void testSymlinkLeavingRootIsNotListed() throws Exception {
    Path root = createRoot();
    Path outside = Files.writeString(tempDir.resolve("secret.csv"), "a\n");
    Files.createSymbolicLink(root.resolve("link.csv"), outside);
    Files.writeString(root.resolve("real.csv"), "a\n");

    DatasetCatalog catalog = new DatasetCatalog(DataRootConfig.of(root));

    assertThat(catalog.listDatasets(), contains("real.csv"));
  }

  @Test void testEmptyRoot() throws Exception {
    DatasetCatalog catalog = new DatasetCatalog(DataRootConfig.of(createRoot()));
    assertThat(catalog.listDatasets(), empty());
  }

  @Test void testMissingRoot() {
    DatasetCatalog catalog = new DatasetCatalog(DataRootConfig.of(tempDir.resolve("absent")));
    assertThrows(DatasetNotFoundException.class, catalog::listDatasets);
  }
}
