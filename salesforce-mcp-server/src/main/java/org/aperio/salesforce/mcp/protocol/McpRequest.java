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
package org.aperio.salesforce.mcp.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * MCP JSON-RPC request message.
 */
public class McpRequest {
  private String jsonrpc = "2.0";
  private JsonElement id;
  private String method;
  private JsonObject params;

  public String getJsonrpc() {
    return jsonrpc;
  }

  public void setJsonrpc(String jsonrpc) {
    this.jsonrpc = jsonrpc;
  }

  /** Request id; null for notifications, which get no response. */
  public JsonElement getId() {
    return id;
  }

  public void setId(JsonElement id) {
    this.id = id;
  }

  public String getMethod() {
    return method;
  }

  public void setMethod(String method) {
    this.method = method;
  }

  public JsonObject getParams() {
    return params;
  }

  public void setParams(JsonObject params) {
    this.params = params;
  }

  public boolean isNotification() {
    return id == null || id.isJsonNull();
  }
}
