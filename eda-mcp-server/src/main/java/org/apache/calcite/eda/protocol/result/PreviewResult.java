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
package org.apache.calcite.eda.protocol.result;

import org.apache.calcite.eda.stats.Preview;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Result of {@code preview_csv}.
 */
public class PreviewResult extends ToolResult {
  private final String path;
  private final int rowCountReturned;
  private final List<String> columnNames;
  private final List<Map<String, @Nullable Object>> rows;

  public PreviewResult(String path, Preview preview) {
    this.path = path;
    this.rowCountReturned = preview.getRows().size();
    this.columnNames = preview.getColumnNames();
    this.rows = preview.getRows();
  }

  @Override public String getToolName() {
    return "preview_csv";
  }

  public String getPath() {
    return path;
  }

  public int getRowCountReturned() {
    return rowCountReturned;
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public List<Map<String, @Nullable Object>> getRows() {
    return rows;
  }
}
