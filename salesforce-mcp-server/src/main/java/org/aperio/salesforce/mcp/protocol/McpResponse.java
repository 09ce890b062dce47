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
 * MCP JSON-RPC response message.
 */
public class McpResponse {
  public static final int PARSE_ERROR = -32700;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;
  /** The API call failed. */
  public static final int SALESFORCE_ERROR = -32000;
  /** The session token expired; refresh it and repeat the call. */
  public static final int AUTH_EXPIRED = -32001;

  private String jsonrpc = "2.0";
  private JsonElement id;
  private JsonElement result;
  private JsonObject error;

  public McpResponse(JsonElement id) {
    this.id = id;
  }

  public String getJsonrpc() {
    return jsonrpc;
  }

  public JsonElement getId() {
    return id;
  }

  public JsonElement getResult() {
    return result;
  }

  public void setResult(JsonElement result) {
    this.result = result;
  }

  public JsonObject getError() {
    return error;
  }

  public void setError(JsonObject error) {
    this.error = error;
  }

  public boolean isError() {
    return error != null;
  }

  public static McpResponse success(JsonElement id, JsonElement result) {
    McpResponse response = new McpResponse(id);
    response.setResult(result);
    return response;
  }

  public static McpResponse error(JsonElement id, int code, String message) {
    McpResponse response = new McpResponse(id);
    JsonObject error = new JsonObject();
    error.addProperty("code", code);
    error.addProperty("message", message);
    response.setError(error);
    return response;
  }
}
