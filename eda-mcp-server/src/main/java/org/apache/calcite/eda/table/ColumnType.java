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

/**
 * Semantic type inferred for a column.
 */
public enum ColumnType {
  INTEGER("int64", true),
  FLOAT("float64", true),
  BOOLEAN("bool", false),
  TEMPORAL("datetime64[ns]", false),
  TEXT("object", false);

  private final String dtype;
  private final boolean numeric;

  ColumnType(String dtype, boolean numeric) {
    this.dtype = dtype;
    this.numeric = numeric;
  }

  /**
   * Returns the dtype name reported to callers, following dataframe naming.
   */
  public String getDtype() {
    return dtype;
  }

  /**
   * Whether values of this type take part in numeric statistics.
   */
  public boolean isNumeric() {
    return numeric;
  }
}
