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
package org.apache.calcite.eda.table;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory table loaded from a CSV file.
 *
 * <p>An ordered sequence of uniquely named columns of equal length. A table
 * is created fresh for each call and never shared between calls.
 */
public final class Table {
  private final ImmutableList<Column> columns;
  private final Map<String, Column> columnsByName;
  private final int rowCount;

  public Table(List<Column> columns, int rowCount) {
    this.columns = ImmutableList.copyOf(columns);
    this.rowCount = rowCount;
    this.columnsByName = new LinkedHashMap<>();
    for (Column column : this.columns) {
      if (column.size() != rowCount) {
        throw new IllegalArgumentException("Column '" + column.getName() + "' has "
            + column.size() + " values, expected " + rowCount);
      }
      if (columnsByName.put(column.getName(), column) != null) {
        throw new IllegalArgumentException("Duplicate column: " + column.getName());
      }
    }
  }

  public List<Column> getColumns() {
    return columns;
  }

  public List<String> getColumnNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Column column : columns) {
      names.add(column.getName());
    }
    return names.build();
  }

  public @Nullable Column getColumn(String name) {
    return columnsByName.get(name);
  }

  /**
   * Returns the integer and floating-point columns, in column order.
   */
  public List<Column> getNumericColumns() {
    ImmutableList.Builder<Column> numeric = ImmutableList.builder();
    for (Column column : columns) {
      if (column.isNumeric()) {
        numeric.add(column);
      }
    }
    return numeric.build();
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columns.size();
  }
}
