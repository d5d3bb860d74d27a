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
package org.apache.calcite.eda.protocol;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Names, descriptions and input schemas of the tools the server exposes,
 * as returned by {@code tools/list}.
 */
public final class ToolDefinitions {
  public static final String LIST_DATASETS = "list_datasets";
  public static final String PREVIEW_CSV = "preview_csv";
  public static final String COLUMN_INFO = "column_info";
  public static final String MISSING_VALUES = "missing_values";
  public static final String DESCRIBE_CSV = "describe_csv";
  public static final String CORRELATION_MATRIX = "correlation_matrix";
  public static final String DETECT_OUTLIERS = "detect_outliers";
  public static final String ANALYZE_CATEGORICAL = "analyze_categorical";
  public static final String DATA_QUALITY_REPORT = "data_quality_report";

  private static final String PATH_DESCRIPTION =
      "CSV path relative to the data directory, or an absolute path inside it";

  private ToolDefinitions() {
  }

  /**
   * Build the {@code tools} array of a {@code tools/list} result.
   */
  public static JsonArray listTools() {
    JsonArray tools = new JsonArray();

    tools.add(
        tool(LIST_DATASETS, "List CSV files available under the data directory.",
        schema()));

    JsonObject preview = schema();
    addPath(preview);
    addProperty(preview, "n_rows", "integer", "Number of rows to return (default 5)");
    tools.add(tool(PREVIEW_CSV, "Return the first n_rows rows from the CSV file.", preview));

    tools.add(
        tool(COLUMN_INFO, "Return dtype and basic counts for each column.",
        pathOnly()));

    tools.add(
        tool(MISSING_VALUES, "Summarise missing value counts and ratios.",
        pathOnly()));

    tools.add(
        tool(DESCRIBE_CSV, "Return descriptive statistics for the numeric columns.",
        pathOnly()));

    JsonObject correlation = schema();
    addPath(correlation);
    JsonObject columns = new JsonObject();
    columns.addProperty("type", "array");
    JsonObject items = new JsonObject();
    items.addProperty("type", "string");
    columns.add("items", items);
    columns.addProperty("description",
        "Columns to correlate; non-numeric or unknown names are ignored (default: all numeric)");
    correlation.getAsJsonObject("properties").add("columns", columns);
    addEnum(correlation, "method", "Correlation method (default pearson)",
        "pearson", "spearman", "kendall");
    tools.add(
        tool(CORRELATION_MATRIX, "Compute a correlation matrix for numeric columns.",
        correlation));

    JsonObject outliers = schema();
    addPath(outliers);
    addProperty(outliers, "column", "string", "Numeric column to inspect");
    addEnum(outliers, "method", "Detection method (default iqr)", "iqr", "zscore");
    require(outliers, "column");
    tools.add(tool(DETECT_OUTLIERS, "Detect outliers in a numeric column.", outliers));

    JsonObject categorical = schema();
    addPath(categorical);
    addProperty(categorical, "column", "string", "Column to analyze");
    require(categorical, "column");
    tools.add(
        tool(ANALYZE_CATEGORICAL, "Analyze the value distribution of a column.",
        categorical));

    tools.add(
        tool(DATA_QUALITY_REPORT, "Generate a comprehensive data quality report.",
        pathOnly()));

    return tools;
  }

  private static JsonObject tool(String name, String description, JsonObject inputSchema) {
    JsonObject tool = new JsonObject();
    tool.addProperty("name", name);
    tool.addProperty("description", description);
    tool.add("inputSchema", inputSchema);
    return tool;
  }

  private static JsonObject schema() {
    JsonObject schema = new JsonObject();
    schema.addProperty("type", "object");
    schema.add("properties", new JsonObject());
    schema.add("required", new JsonArray());
    return schema;
  }

  private static JsonObject pathOnly() {
    JsonObject schema = schema();
    addPath(schema);
    return schema;
  }

  private static void addPath(JsonObject schema) {
    addProperty(schema, "path", "string", PATH_DESCRIPTION);
    require(schema, "path");
  }

  private static void addProperty(JsonObject schema, String name, String type,
      String description) {
    JsonObject property = new JsonObject();
    property.addProperty("type", type);
    property.addProperty("description", description);
    schema.getAsJsonObject("properties").add(name, property);
  }

  private static void addEnum(JsonObject schema, String name, String description,
      String... values) {
    addProperty(schema, name, "string", description);
    JsonArray allowed = new JsonArray();
    for (String value : values) {
      allowed.add(value);
    }
    schema.getAsJsonObject("properties").getAsJsonObject(name).add("enum", allowed);
  }

  private static void require(JsonObject schema, String name) {
    schema.getAsJsonArray("required").add(name);
  }
}
