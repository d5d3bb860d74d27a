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
import org.apache.calcite.eda.table.Column;
import org.apache.calcite.eda.table.Table;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the first rows of a table.
 */
public class PreviewGenerator {

  /** Rows returned when the caller does not say how many. */
  public static final int DEFAULT_ROWS = 5;

  /**
   * Returns up to {@code rowLimit} rows; all rows when the table is shorter.
   *
   * @throws InvalidArgumentException if {@code rowLimit} is negative
   */
  public Preview preview(Table table, int rowLimit) throws InvalidArgumentException {
    if (rowLimit < 0) {
      throw new InvalidArgumentException("n_rows must be a non-negative integer, got " + rowLimit);
    }
    int count = Math.min(rowLimit, table.getRowCount());
    List<Map<String, @Nullable Object>> rows = new ArrayList<>(count);
    for (int row = 0; row < count; row++) {
      Map<String, @Nullable Object> values = new LinkedHashMap<>();
      for (Column column : table.getColumns()) {
        values.put(column.getName(), column.get(row));
      }
      rows.add(Collections.unmodifiableMap(values));
    }
    return new Preview(table.getColumnNames(), rows);
  }
}
