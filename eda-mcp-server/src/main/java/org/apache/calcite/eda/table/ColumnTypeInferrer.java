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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers the type of a column from its raw cell text and converts the cells
 * to typed values.
 *
 * <p>Inference is a single pass that keeps, for each candidate type, whether
 * every non-missing cell seen so far is consistent with it. The most specific
 * surviving candidate wins, in the order integer, floating-point, boolean,
 * temporal, text.
 */
public final class ColumnTypeInferrer {
  /** Cell text treated as a missing value, compared after trimming. */
  static final Set<String> MISSING_TOKENS = ImmutableSet.of(
      "", "NA", "N/A", "n/a", "NaN", "nan", "-NaN", "-nan", "null", "NULL",
      "None", "<NA>", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN",
      "1.#IND", "1.#QNAN");

  private static final Set<String> TRUE_TOKENS = ImmutableSet.of("true", "True", "TRUE");
  private static final Set<String> FALSE_TOKENS = ImmutableSet.of("false", "False", "FALSE");

  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern INFINITY =
      Pattern.compile("[+-]?(inf|infinity)", Pattern.CASE_INSENSITIVE);

  private ColumnTypeInferrer() {
  }

  /**
   * Whether a raw cell denotes a missing value.
   */
  public static boolean isMissing(@Nullable String cell) {
    return cell == null || MISSING_TOKENS.contains(cell.trim());
  }

  /**
   * Infers the type of a column.
   *
   * @param cells Raw cell text in row order
   * @return inferred type; {@link ColumnType#TEXT} when every cell is missing
   */
  public static ColumnType infer(List<@Nullable String> cells) {
    boolean integer = true;
    boolean floating = true;
    boolean bool = true;
    boolean temporal = true;
    boolean seen = false;

    for (String cell : cells) {
      if (isMissing(cell)) {
        continue;
      }
      seen = true;
      String text = cell.trim();
      if (integer && !isInteger(text)) {
        integer = false;
      }
      if (floating && !integer && !isFloat(text)) {
        floating = false;
      }
      if (bool && !isBoolean(text)) {
        bool = false;
      }
      if (temporal && parseTemporal(text) == null) {
        temporal = false;
      }
      if (!integer && !floating && !bool && !temporal) {
        return ColumnType.TEXT;
      }
    }

    if (!seen) {
      return ColumnType.TEXT;
    }
    if (integer) {
      return ColumnType.INTEGER;
    }
    if (floating) {
      return ColumnType.FLOAT;
    }
    if (bool) {
      return ColumnType.BOOLEAN;
    }
    return temporal ? ColumnType.TEMPORAL : ColumnType.TEXT;
  }

  /**
   * Converts raw cells to values of the given type.
   *
   * @param type Type previously inferred for the same cells
   * @param cells Raw cell text in row order
   * @return typed values, {@code null} for missing cells
   */
  public static List<@Nullable Object> convert(ColumnType type, List<@Nullable String> cells) {
    List<@Nullable Object> values = new ArrayList<>(cells.size());
    for (String cell : cells) {
      values.add(isMissing(cell) ? null : convertCell(type, cell.trim()));
    }
    return values;
  }

  private static Object convertCell(ColumnType type, String text) {
    switch (type) {
      case INTEGER:
        return Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
      case FLOAT:
        return parseFloat(text);
      case BOOLEAN:
        return TRUE_TOKENS.contains(text);
      case TEMPORAL:
        Object temporal = parseTemporal(text);
        return temporal == null ? text : temporal.toString();
      default:
        return text;
    }
  }

  static boolean isInteger(String text) {
    if (!INTEGER.matcher(text).matches()) {
      return false;
    }
    try {
      Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
      return true;
    } catch (NumberFormatException e) {
      // beyond 64 bits; still a valid floating-point literal
      return false;
    }
  }

  static boolean isFloat(String text) {
    return DECIMAL.matcher(text).matches() || INFINITY.matcher(text).matches();
  }

  static boolean isBoolean(String text) {
    return TRUE_TOKENS.contains(text) || FALSE_TOKENS.contains(text);
  }

  private static double parseFloat(String text) {
    if (INFINITY.matcher(text).matches()) {
      return text.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return Double.parseDouble(text);
  }

  /**
   * Parses ISO-8601 dates and date-times; returns null if the text is neither.
   */
  static @Nullable Object parseTemporal(String text) {
    if (text.length() < 10 || !Character.isDigit(text.charAt(0))) {
      return null;
    }
    if (text.length() == 10) {
      try {
        return LocalDate.parse(text);
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    String isoText = text.indexOf('T') < 0 && text.charAt(10) == ' '
        ? text.substring(0, 10) + 'T' + text.substring(11)
        : text;
    try {
      return LocalDateTime.parse(isoText);
    } catch (DateTimeParseException e) {
      // may still carry an offset
    }
    try {
      return OffsetDateTime.parse(isoText.toUpperCase(Locale.ROOT));
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
