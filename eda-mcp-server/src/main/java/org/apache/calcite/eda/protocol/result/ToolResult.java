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
package org.apache.calcite.eda.protocol.result;

import org.apache.calcite.eda.protocol.JsonSupport;

import com.google.gson.JsonObject;

/**
 * Result of one analysis operation.
 *
 * <p>Each operation has its own subclass whose fields define the JSON shape
 * returned to callers.
 */
public abstract class ToolResult {

  /**
   * Returns the name of the operation that produced this result.
   */
  public abstract String getToolName();

  /**
   * Serializes this result.
   */
  public JsonObject toJson() {
    return JsonSupport.GSON.toJsonTree(this).getAsJsonObject();
  }
}
