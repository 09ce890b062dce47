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

import org.aperio.salesforce.schema.FieldDescriptor;
import org.aperio.salesforce.transport.QueryResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.util.List;

/**
 * Conversions from client results to Gson trees.
 */
final class JsonResults {
  private static final Gson GSON = new GsonBuilder().serializeNulls().create();

  private JsonResults() {
  }

  static JsonElement tree(Object value) {
    return value == null ? JsonNull.INSTANCE : GSON.toJsonTree(value);
  }

  static JsonElement tree(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return JsonNull.INSTANCE;
    }
    return JsonParser.parseString(node.toString());
  }

  static JsonObject queryResult(QueryResult result) {
    JsonObject json = new JsonObject();
    json.addProperty("totalSize", result.getTotalSize());
    json.addProperty("done", result.isDone());
    if (result.getNextRecordsUrl() != null) {
      json.addProperty("nextRecordsUrl", result.getNextRecordsUrl());
    }
    json.add("records", tree(result.getRecords()));
    return json;
  }

  static JsonArray fields(List<FieldDescriptor> fields) {
    JsonArray array = new JsonArray();
    for (FieldDescriptor field : fields) {
      JsonObject json = new JsonObject();
      json.addProperty("name", field.getName());
      json.addProperty("type", field.getPlatformType());
      json.addProperty("referenceTo", field.getReferenceTarget());
      array.add(json);
    }
    return array;
  }
}
