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
import org.apache.calcite.eda.path.DatasetReference;
import org.apache.calcite.eda.path.PathResolver;
import org.apache.calcite.eda.table.Table;
import org.apache.calcite.eda.table.TableLoader;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base of the tool groups that operate on a single dataset.
 *
 * <p>Every call resolves the caller's path and loads the table afresh; the
 * table is owned by the call and discarded when it completes.
 */
abstract class DatasetTools {
  private final PathResolver resolver;
  private final TableLoader loader;

  DatasetTools(PathResolver resolver, TableLoader loader) {
    this.resolver = resolver;
    this.loader = loader;
  }

  /**
   * Resolves and loads a dataset.
   */
  LoadedDataset load(@Nullable String path) throws EdaException {
    DatasetReference dataset = resolver.resolve(path);
    return new LoadedDataset(dataset, loader.load(dataset));
  }

  /**
   * A resolved dataset together with its freshly loaded table.
   */
  static final class LoadedDataset {
    final DatasetReference dataset;
    final Table table;

    LoadedDataset(DatasetReference dataset, Table table) {
      this.dataset = dataset;
      this.table = table;
    }

    String path() {
      return dataset.getRelativePath();
    }
  }
}
