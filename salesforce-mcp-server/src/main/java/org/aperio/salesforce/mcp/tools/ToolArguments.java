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
package org.aperio.salesforce.mcp.tools;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the arguments of a tool call.
 *
 * <p>Absent and JSON-null arguments are treated alike. Missing required arguments and
 * values of the wrong shape raise {@link IllegalArgumentException}, which the server reports
 * as invalid params.
 */
public class ToolArguments {
  private static final Gson GSON = new GsonBuilder()
      .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
      .create();

  private final JsonObject params;

  public ToolArguments(JsonObject params) {
    this.params = params == null ? new JsonObject() : params;
  }

  public String requireString(String name) {
    String value = getString(name, null);
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException("Missing required argument: " + name);
    }
    return value;
  }

  public String getString(String name, String defaultValue) {
    JsonElement value = get(name);
    return value == null ? defaultValue : primitive(name, value).getAsString();
  }

  public int getInt(String name, int defaultValue) {
    JsonElement value = get(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return primitive(name, value).getAsInt();
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Argument " + name + " must be an integer", e);
    }
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    JsonElement value = get(name);
    if (value == null) {
      return defaultValue;
    }
    JsonPrimitive primitive = primitive(name, value);
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean();
    }
    String text = primitive.getAsString().trim();
    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
      return Boolean.parseBoolean(text);
    }
    throw new IllegalArgumentException("Argument " + name + " must be a boolean");
  }

  /** A list of strings; null when absent. */
  public List<String> getStringList(String name) {
    JsonElement value = get(name);
    if (value == null) {
      return null;
    }
    List<String> items = new ArrayList<>();
    for (JsonElement item : array(name, value)) {
      items.add(primitive(name, item).getAsString());
    }
    return items;
  }

  /** A list of JSON objects as maps; empty when absent. */
  public List<Map<String, Object>> getObjectList(String name) {
    JsonElement value = get(name);
    List<Map<String, Object>> items = new ArrayList<>();
    if (value == null) {
      return items;
    }
    for (JsonElement item : array(name, value)) {
      if (!item.isJsonObject()) {
        throw new IllegalArgumentException("Items of " + name + " must be objects");
      }
      items.add(toMap(item.getAsJsonObject()));
    }
    return items;
  }

  /** A required JSON object as a map. */
  public Map<String, Object> requireObject(String name) {
    JsonElement value = get(name);
    if (value == null || !value.isJsonObject()) {
      throw new IllegalArgumentException("Missing required object argument: " + name);
    }
    return toMap(value.getAsJsonObject());
  }

  private JsonElement get(String name) {
    JsonElement value = params.get(name);
    return value == null || value.isJsonNull() ? null : value;
  }

  private static JsonPrimitive primitive(String name, JsonElement value) {
    if (!value.isJsonPrimitive()) {
      throw new IllegalArgumentException("Argument " + name + " must be a scalar value");
    }
    return value.getAsJsonPrimitive();
  }

  private static JsonArray array(String name, JsonElement value) {
    if (!value.isJsonArray()) {
      throw new IllegalArgumentException("Argument " + name + " must be an array");
    }
    return value.getAsJsonArray();
  }

  private static Map<String, Object> toMap(JsonObject object) {
    Map<String, Object> map = GSON.fromJson(object,
        new TypeToken<LinkedHashMap<String, Object>>() { }.getType());
    return map == null ? new LinkedHashMap<>() : map;
  }
}
