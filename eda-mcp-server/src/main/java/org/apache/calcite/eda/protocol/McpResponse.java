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

import org.apache.calcite.eda.error.ErrorKind;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * MCP JSON-RPC response message.
 *
 * <p>Exactly one of {@code result} and {@code error} is set. Errors raised by
 * an analysis operation carry their kind tag in {@code error.data.kind}.
 */
public class McpResponse {
  private String jsonrpc = "2.0";
  private @Nullable JsonElement id;
  private @Nullable JsonElement result;
  private @Nullable JsonObject error;

  public McpResponse(@Nullable JsonElement id) {
    this.id = id;
  }

  public String getJsonrpc() {
    return jsonrpc;
  }

  public void setJsonrpc(String jsonrpc) {
    this.jsonrpc = jsonrpc;
  }

  public @Nullable JsonElement getId() {
    return id;
  }

  public void setId(@Nullable JsonElement id) {
    this.id = id;
  }

  public @Nullable JsonElement getResult() {
    return result;
  }

  public void setResult(JsonElement result) {
    this.result = result;
  }

  public @Nullable JsonObject getError() {
    return error;
  }

  public void setError(JsonObject error) {
    this.error = error;
  }

  /**
   * Returns the wire form of this response.
   *
   * <p>Only the member that is set among {@code result} and {@code error} is
   * written, while nulls nested inside a result are kept.
   */
  public JsonObject toJsonObject() {
    JsonObject json = new JsonObject();
    json.addProperty("jsonrpc", jsonrpc);
    json.add("id", id == null ? JsonNull.INSTANCE : id);
    if (error != null) {
      json.add("error", error);
    } else {
      json.add("result", result == null ? JsonNull.INSTANCE : result);
    }
    return json;
  }

  public static McpResponse success(@Nullable JsonElement id, JsonElement result) {
    McpResponse response = new McpResponse(id);
    response.setResult(result);
    return response;
  }

  public static McpResponse error(@Nullable JsonElement id, int code, String message) {
    McpResponse response = new McpResponse(id);
    JsonObject error = new JsonObject();
    error.addProperty("code", code);
    error.addProperty("message", message);
    response.setError(error);
    return response;
  }

  /**
   * Creates an error response for a failure of a known kind.
   *
   * @param id Request id
   * @param kind Failure kind; its code becomes the error code and its tag is
   *     reported as {@code data.kind}
   * @param message Human-readable message
   */
  public static McpResponse error(@Nullable JsonElement id, ErrorKind kind, String message) {
    McpResponse response = error(id, kind.getCode(), message);
    JsonObject data = new JsonObject();
    data.addProperty("kind", kind.getTag());
    requireNonNull(response.getError(), "error").add("data", data);
    return response;
  }
}
