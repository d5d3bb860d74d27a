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

import org.apache.calcite.eda.stats.ColumnProfile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@code column_info}.
 */
public class ColumnInfoResult extends ToolResult {
  private final String path;
  private final Map<String, ColumnInfo> columns = new LinkedHashMap<>();

  public ColumnInfoResult(String path, List<ColumnProfile> profiles) {
    this.path = path;
    for (ColumnProfile profile : profiles) {
      columns.put(profile.getName(), new ColumnInfo(profile));
    }
  }

  @Override public String getToolName() {
    return "column_info";
  }

  public String getPath() {
    return path;
  }

  public Map<String, ColumnInfo> getColumns() {
    return columns;
  }

  /**
   * Counts and dtype of one column.
   */
  public static class ColumnInfo {
    private final String dtype;
    private final int nonNullCount;
    private final int nullCount;
    private final int uniqueCount;

    ColumnInfo(ColumnProfile profile) {
      this.dtype = profile.getType().getDtype();
      this.nonNullCount = profile.getNonMissingCount();
      this.nullCount = profile.getMissingCount();
      this.uniqueCount = profile.getDistinctCount();
    }

    public String getDtype() {
      return dtype;
    }

    public int getNonNullCount() {
      return nonNullCount;
    }

    public int getNullCount() {
      return nullCount;
    }

    public int getUniqueCount() {
      return uniqueCount;
    }
  }
}
