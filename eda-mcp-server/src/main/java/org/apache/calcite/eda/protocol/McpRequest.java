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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * MCP JSON-RPC request message.
 *
 * <p>A request without an id is a notification and receives no response.
 */
public class McpRequest {
  private String jsonrpc = "2.0";
  private @Nullable JsonElement id;
  private @Nullable String method;
  private @Nullable JsonObject params;

  public McpRequest() {
  }

  public McpRequest(@Nullable JsonElement id, String method, @Nullable JsonObject params) {
    this.id = id;
    this.method = method;
    this.params = params;
  }

  public String getJsonrpc() {
    return jsonrpc;
  }

  public @Nullable JsonElement getId() {
    return id;
  }

  public @Nullable String getMethod() {
    return method;
  }

  public @Nullable JsonObject getParams() {
    return params;
  }

  public boolean isNotification() {
    return id == null || id.isJsonNull();
  }
}
