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

import org.apache.calcite.eda.error.EdaException;
import org.apache.calcite.eda.path.DatasetCatalog;
import org.apache.calcite.eda.path.PathResolver;
import org.apache.calcite.eda.protocol.result.DatasetListResult;
import org.apache.calcite.eda.protocol.result.PreviewResult;
import org.apache.calcite.eda.stats.PreviewGenerator;
import org.apache.calcite.eda.table.TableLoader;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * MCP tools for dataset discovery.
 *
 * <p>Lists the CSV files under the data root and previews their first rows.
 */
public class DiscoveryTools extends DatasetTools {
  private final DatasetCatalog catalog;
  private final PreviewGenerator previewGenerator = new PreviewGenerator();

  public DiscoveryTools(DatasetCatalog catalog, PathResolver resolver, TableLoader loader) {
    super(resolver, loader);
    this.catalog = catalog;
  }

  /**
   * List CSV files under the data root.
   *
   * @return data root and relative paths, sorted
   * @throws EdaException if the data root does not exist
   */
  public DatasetListResult listDatasets() throws EdaException {
    return new DatasetListResult(catalog.getRoot().toString(), catalog.listDatasets());
  }

  /**
   * Return the first rows of a CSV file.
   *
   * @param path Dataset path, relative to the data root or absolute
   * @param rowLimit Number of rows to return; all rows when the file is shorter
   * @return column names and rows
   * @throws EdaException if the path is rejected, the file cannot be parsed,
   *     or {@code rowLimit} is negative
   */
  public PreviewResult previewCsv(@Nullable String path, int rowLimit) throws EdaException {
    LoadedDataset loaded = load(path);
    return new PreviewResult(loaded.path(), previewGenerator.preview(loaded.table, rowLimit));
  }
}
