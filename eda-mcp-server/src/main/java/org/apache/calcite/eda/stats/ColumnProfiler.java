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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Computes a {@link ColumnProfile} for every column of a table.
 */
public class ColumnProfiler {

  /**
   * Profiles each column, in column order.
   *
   * <p>For every profile the non-missing and missing counts add up to the
   * table's row count.
   */
  public List<ColumnProfile> profile(Table table) {
    ImmutableList.Builder<ColumnProfile> profiles = ImmutableList.builder();
    for (Column column : table.getColumns()) {
      int missing = column.getMissingCount();
      profiles.add(
          new ColumnProfile(column.getName(), column.getType(),
              table.getRowCount() - missing, missing, column.getDistinctCount()));
    }
    return profiles.build();
  }
}
