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

import org.apache.calcite.eda.table.ColumnType;

import static java.util.Objects.requireNonNull;

/**
 * Type, null and distinct-value summary of one column.
 */
public final class ColumnProfile {
  private final String name;
  private final ColumnType type;
  private final int nonMissingCount;
  private final int missingCount;
  private final int distinctCount;

  public ColumnProfile(String name, ColumnType type, int nonMissingCount,
      int missingCount, int distinctCount) {
    this.name = requireNonNull(name, "name");
    this.type = requireNonNull(type, "type");
    this.nonMissingCount = nonMissingCount;
    this.missingCount = missingCount;
    this.distinctCount = distinctCount;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public int getNonMissingCount() {
    return nonMissingCount;
  }

  public int getMissingCount() {
    return missingCount;
  }

  /**
   * Number of distinct non-missing values.
   */
  public int getDistinctCount() {
    return distinctCount;
  }
}
