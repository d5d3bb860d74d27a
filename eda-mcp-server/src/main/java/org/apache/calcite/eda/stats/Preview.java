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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * The first rows of a table, keyed by column name.
 */
public final class Preview {
  private final ImmutableList<String> columnNames;
  private final ImmutableList<Map<String, @Nullable Object>> rows;

  public Preview(List<String> columnNames, List<Map<String, @Nullable Object>> rows) {
    this.columnNames = ImmutableList.copyOf(columnNames);
    this.rows = ImmutableList.copyOf(rows);
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  /**
   * Rows in table order; each maps column name to value, {@code null} when
   * missing.
   */
  public List<Map<String, @Nullable Object>> getRows() {
    return rows;
  }
}
