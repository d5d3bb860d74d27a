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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A named, typed column of a {@link Table}.
 *
 * <p>Values are {@link Long}, {@link Double}, {@link Boolean} or
 * {@link String} according to the column type; temporal values are kept as
 * ISO-8601 text. A {@code null} value is a missing cell.
 */
public final class Column {
  private final String name;
  private final ColumnType type;
  private final List<@Nullable Object> values;

  public Column(String name, ColumnType type, List<@Nullable Object> values) {
    this.name = requireNonNull(name, "name");
    this.type = requireNonNull(type, "type");
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public boolean isNumeric() {
    return type.isNumeric();
  }

  /**
   * Returns the values in row order; missing cells are {@code null}.
   */
  public List<@Nullable Object> getValues() {
    return values;
  }

  public @Nullable Object get(int row) {
    return values.get(row);
  }

  public boolean isMissing(int row) {
    return values.get(row) == null;
  }

  public int size() {
    return values.size();
  }

  public int getMissingCount() {
    int count = 0;
    for (Object value : values) {
      if (value == null) {
        count++;
      }
    }
    return count;
  }

  public int getNonMissingCount() {
    return values.size() - getMissingCount();
  }

  /**
   * Counts distinct non-missing values.
   */
  public int getDistinctCount() {
    Set<Object> distinct = new HashSet<>();
    for (Object value : values) {
      if (value != null) {
        distinct.add(value);
      }
    }
    return distinct.size();
  }

  /**
   * Returns the value at a row as a double, or NaN when the cell is missing.
   *
   * @throws IllegalStateException if the column is not numeric
   */
  public double getDouble(int row) {
    if (!type.isNumeric()) {
      throw new IllegalStateException("Column '" + name + "' is not numeric");
    }
    Object value = values.get(row);
    return value == null ? Double.NaN : ((Number) value).doubleValue();
  }

  /**
   * Returns the non-missing values of a numeric column, in row order.
   *
   * @throws IllegalStateException if the column is not numeric
   */
  public double[] getNonMissingDoubles() {
    double[] result = new double[getNonMissingCount()];
    int i = 0;
    for (int row = 0; row < values.size(); row++) {
      if (values.get(row) != null) {
        result[i++] = getDouble(row);
      }
    }
    return result;
  }

  @Override public String toString() {
    return name + ":" + type.getDtype();
  }
}
