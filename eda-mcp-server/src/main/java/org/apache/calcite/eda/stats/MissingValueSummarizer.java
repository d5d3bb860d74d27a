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

import org.apache.calcite.eda.table.Column;
import org.apache.calcite.eda.table.Table;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summarizes missing values per column.
 */
public class MissingValueSummarizer {

  public MissingSummary summarize(Table table) {
    int totalRows = table.getRowCount();
    Map<String, MissingSummary.ColumnMissing> columns = new LinkedHashMap<>();
    for (Column column : table.getColumns()) {
      int missing = column.getMissingCount();
      columns.put(column.getName(),
          new MissingSummary.ColumnMissing(missing, rate(missing, totalRows)));
    }
    return new MissingSummary(totalRows, columns);
  }

  /**
   * Returns {@code count / total}, or 0 when {@code total} is 0.
   */
  static double rate(int count, int total) {
    return total == 0 ? 0d : (double) count / total;
  }
}
