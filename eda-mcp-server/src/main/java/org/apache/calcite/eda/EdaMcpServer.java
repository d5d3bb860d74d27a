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
package org.apache.calcite.eda;

import org.apache.calcite.eda.error.EdaException;
import org.apache.calcite.eda.error.InvalidArgumentException;
import org.apache.calcite.eda.path.DatasetCatalog;
import org.apache.calcite.eda.path.PathResolver;
import org.apache.calcite.eda.protocol.JsonSupport;
import org.apache.calcite.eda.protocol.McpRequest;
import org.apache.calcite.eda.protocol.McpResponse;
import org.apache.calcite.eda.protocol.ToolDefinitions;
import org.apache.calcite.eda.protocol.result.ToolResult;
import org.apache.calcite.eda.stats.PreviewGenerator;
import org.apache.calcite.eda.table.TableLoader;
import org.apache.calcite.eda.tools.DiscoveryTools;
import org.apache.calcite.eda.tools.ProfileTools;
import org.apache.calcite.eda.tools.QualityTools;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * EDA MCP Server - Model Context Protocol server for exploratory analysis of
 * CSV files.
 *
 * <p>Lets MCP clients list, preview, profile and correlate CSV files kept
 * under a single data directory, through a JSON-RPC stdio interface. Every
 * dataset path is confined to that directory.
 *
 * <p>Usage:
 * <pre>
 * java -jar eda-mcp-server.jar --data-root /srv/data
 * </pre>
 */
public class EdaMcpServer {
  private static final Logger logger = LoggerFactory.getLogger(EdaMcpServer.class);

  static final String SERVER_NAME = "calcite-eda";
  static final String SERVER_VERSION = "1.0.0";
  static final String PROTOCOL_VERSION = "2024-11-05";

  private final DataRootConfig config;
  private final DiscoveryTools discoveryTools;
  private final ProfileTools profileTools;
  private final QualityTools qualityTools;

  public static void main(String[] args) {
    try {
      DataRootConfig config = DataRootConfig.fromArgs(args, System.getenv());
      EdaMcpServer server = new EdaMcpServer(config);
      server.start(System.in, System.out);

    } catch (Exception e) {
      logger.error("Failed to start MCP server", e);
      System.exit(1);
    }
  }

  public EdaMcpServer(DataRootConfig config) {
    this.config = config;
    PathResolver resolver = new PathResolver(config);
    TableLoader loader = new TableLoader();
    this.discoveryTools = new DiscoveryTools(new DatasetCatalog(config), resolver, loader);
    this.profileTools = new ProfileTools(resolver, loader);
    this.qualityTools = new QualityTools(resolver, loader);
  }

  /**
   * Start JSON-RPC stdio protocol loop.
   *
   * <p>Reads one request per line until end of input. Failures are answered
   * with error responses; they never stop the loop.
   */
  public void start(InputStream input, OutputStream output) {
    logger.info("EDA MCP Server starting, data root {}", config.getRoot());

    try (BufferedReader in = new BufferedReader(
             new InputStreamReader(input, StandardCharsets.UTF_8));
         PrintWriter out = new PrintWriter(output, true, StandardCharsets.UTF_8)) {

      String line;
      while ((line = in.readLine()) != null) {
        if (line.trim().isEmpty()) {
          continue;
        }
        McpResponse response = handleLine(line);
        if (response != null) {
          out.println(JsonSupport.GSON.toJson(response.toJsonObject()));
        }
      }

    } catch (Exception e) {
      logger.error("Fatal error in stdio loop", e);
    }
    logger.info("EDA MCP Server stopped");
  }

  /**
   * Parse one line and handle it; null when no response is due.
   */
  @Nullable McpResponse handleLine(String line) {
    McpRequest request;
    try {
      request = JsonSupport.GSON.fromJson(line, McpRequest.class);
    } catch (JsonParseException e) {
      logger.warn("Unparseable request: {}", e.getMessage());
      return McpResponse.error(null, -32700, "Parse error: " + e.getMessage());
    }
    if (request == null || request.getMethod() == null) {
      return McpResponse.error(request == null ? null : request.getId(), -32600,
          "Invalid request: missing method");
    }
    return handleRequest(request);
  }

  /**
   * Handle MCP request and return response; null for notifications.
   */
  @Nullable McpResponse handleRequest(McpRequest request) {
    String method = String.valueOf(request.getMethod());
    JsonObject params = request.getParams();
    McpResponse response;

    try {
      JsonElement result;

      switch (method) {
        case "initialize":
          result = initializeResult();
          break;

        case "ping":
          result = new JsonObject();
          break;

        case "tools/list":
          JsonObject tools = new JsonObject();
          tools.add("tools", ToolDefinitions.listTools());
          result = tools;
          break;

        case "tools/call":
          result = callTool(params);
          break;

        default:
          if (method.startsWith("notifications/")) {
            logger.debug("Notification {}", method);
            return null;
          }
          if (!isTool(method)) {
            return request.isNotification() ? null
                : McpResponse.error(request.getId(), -32601, "Method not found: " + method);
          }
          result = invokeTool(method, params).toJson();
          break;
      }

      response = McpResponse.success(request.getId(), result);

    } catch (EdaException e) {
      logger.warn("{} failed [{}]: {}", method, e.getKind().getTag(), e.getMessage());
      response = McpResponse.error(request.getId(), e.getKind(), e.getMessage());
    } catch (Exception e) {
      logger.error("Error handling request: " + method, e);
      response = McpResponse.error(request.getId(), -32603,
          "Internal error: " + e.getMessage());
    }

    return request.isNotification() ? null : response;
  }

  /**
   * Handle {@code tools/call}. Operation failures are reported inside the
   * result with {@code isError} set, as MCP clients expect.
   */
  private JsonObject callTool(@Nullable JsonObject params) throws EdaException {
    String name = getParam(params, "name", null);
    if (name == null) {
      throw new InvalidArgumentException("Parameter 'name' is required");
    }
    JsonObject arguments = null;
    if (params != null && params.has("arguments") && !params.get("arguments").isJsonNull()) {
      if (!params.get("arguments").isJsonObject()) {
        throw new InvalidArgumentException("Parameter 'arguments' must be an object");
      }
      arguments = params.getAsJsonObject("arguments");
    }

    try {
      return toolContent(invokeTool(name, arguments).toJson(), false);
    } catch (EdaException e) {
      logger.warn("Tool {} failed [{}]: {}", name, e.getKind().getTag(), e.getMessage());
      JsonObject error = new JsonObject();
      error.addProperty("kind", e.getKind().getTag());
      error.addProperty("message", e.getMessage());
      JsonObject structured = new JsonObject();
      structured.add("error", error);
      return toolContent(structured, true);
    }
  }

  /**
   * Dispatch a tool by name.
   */
  ToolResult invokeTool(String name, @Nullable JsonObject args) throws EdaException {
    logger.debug("Invoking {} with {}", name, args);
    switch (name) {
      // Discovery tools
      case ToolDefinitions.LIST_DATASETS:
        return discoveryTools.listDatasets();

      case ToolDefinitions.PREVIEW_CSV:
        return discoveryTools.previewCsv(getParam(args, "path", null),
            getParam(args, "n_rows", PreviewGenerator.DEFAULT_ROWS));

      // Profile tools
      case ToolDefinitions.COLUMN_INFO:
        return profileTools.columnInfo(getParam(args, "path", null));

      case ToolDefinitions.MISSING_VALUES:
        return profileTools.missingValues(getParam(args, "path", null));

      case ToolDefinitions.DESCRIBE_CSV:
        return profileTools.describeCsv(getParam(args, "path", null));

      case ToolDefinitions.CORRELATION_MATRIX:
        return profileTools.correlationMatrix(getParam(args, "path", null),
            getStringList(args, "columns"), getParam(args, "method", "pearson"));

      // Quality tools
      case ToolDefinitions.DETECT_OUTLIERS:
        return qualityTools.detectOutliers(getParam(args, "path", null),
            getParam(args, "column", null), getParam(args, "method", "iqr"));

      case ToolDefinitions.ANALYZE_CATEGORICAL:
        return qualityTools.analyzeCategorical(getParam(args, "path", null),
            getParam(args, "column", null));

      case ToolDefinitions.DATA_QUALITY_REPORT:
        return qualityTools.dataQualityReport(getParam(args, "path", null));

      default:
        throw new InvalidArgumentException("Unknown tool: " + name);
    }
  }

  private static boolean isTool(String method) {
    for (JsonElement tool : ToolDefinitions.listTools()) {
      if (method.equals(tool.getAsJsonObject().get("name").getAsString())) {
        return true;
      }
    }
    return false;
  }

  private static JsonObject initializeResult() {
    JsonObject result = new JsonObject();
    result.addProperty("protocolVersion", PROTOCOL_VERSION);
    JsonObject capabilities = new JsonObject();
    capabilities.add("tools", new JsonObject());
    result.add("capabilities", capabilities);
    JsonObject serverInfo = new JsonObject();
    serverInfo.addProperty("name", SERVER_NAME);
    serverInfo.addProperty("version", SERVER_VERSION);
    result.add("serverInfo", serverInfo);
    return result;
  }

  private static JsonObject toolContent(JsonObject structured, boolean isError) {
    JsonObject text = new JsonObject();
    text.addProperty("type", "text");
    text.addProperty("text", JsonSupport.GSON.toJson(structured));
    JsonArray content = new JsonArray();
    content.add(text);

    JsonObject result = new JsonObject();
    result.add("content", content);
    result.add("structuredContent", structured);
    result.addProperty("isError", isError);
    return result;
  }

  /**
   * Get string parameter from JSON object.
   */
  private static @Nullable String getParam(@Nullable JsonObject params, String name,
      @Nullable String defaultValue) throws InvalidArgumentException {
    JsonElement value = lookup(params, name);
    if (value == null) {
      return defaultValue;
    }
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
      throw new InvalidArgumentException("Parameter '" + name + "' must be a string");
    }
    return value.getAsString();
  }

  /**
   * Get int parameter from JSON object.
   */
  private static int getParam(@Nullable JsonObject params, String name, int defaultValue)
      throws InvalidArgumentException {
    JsonElement value = lookup(params, name);
    if (value == null) {
      return defaultValue;
    }
    if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
      double number = value.getAsDouble();
      if (number == Math.rint(number) && Math.abs(number) <= Integer.MAX_VALUE) {
        return (int) number;
      }
    }
    throw new InvalidArgumentException("Parameter '" + name + "' must be an integer, got "
        + value);
  }

  /**
   * Get string list parameter from JSON object; null when absent.
   */
  private static @Nullable List<String> getStringList(@Nullable JsonObject params, String name)
      throws InvalidArgumentException {
    JsonElement value = lookup(params, name);
    if (value == null) {
      return null;
    }
    if (!value.isJsonArray()) {
      throw new InvalidArgumentException("Parameter '" + name + "' must be a list of strings");
    }
    List<String> values = new ArrayList<>();
    for (JsonElement element : value.getAsJsonArray()) {
      if (!element.isJsonPrimitive() || !((JsonPrimitive) element).isString()) {
        throw new InvalidArgumentException(
            "Parameter '" + name + "' must be a list of strings, got " + element);
      }
      values.add(element.getAsString());
    }
    return values;
  }

  private static @Nullable JsonElement lookup(@Nullable JsonObject params, String name) {
    if (params == null || !params.has(name) || params.get(name).isJsonNull()) {
      return null;
    }
    return params.get(name);
  }
}
