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

import org.aperio.salesforce.SalesforceClient;
import org.aperio.salesforce.navigation.NavigationResult;
import org.aperio.salesforce.navigation.RelationalNavigator;
import org.aperio.salesforce.search.SearchResult;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * MCP tools for walking relationships and finding records.
 */
public class NavigationTools {
  private final SalesforceClient client;

  public NavigationTools(SalesforceClient client) {
    this.client = client;
  }

  /**
   * Related records of one record.
   *
   * @param relationshipName child relationship to read; null to sample every relationship
   */
  public JsonObject relationships(String objectName, String recordId, String relationshipName)
      throws IOException {
    JsonObject result = new JsonObject();
    if (relationshipName != null && !relationshipName.trim().isEmpty()) {
      result.addProperty("relationship", relationshipName);
      result.add("records", JsonResults.queryResult(
          client.navigateNamed(objectName, recordId, relationshipName.trim())));
      return result;
    }
    NavigationResult related = client.related(objectName, recordId);
    result.add("relationships", JsonResults.tree(related.getChildren()));
    return result;
  }

  /**
   * Find records of one object by term.
   *
   * @param fields fields to match; null for Name only
   * @return records plus the strategy and query that produced them
   */
  public JsonObject lookup(String objectName, String searchTerm, List<String> fields, int limit)
      throws IOException {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    SearchResult found = client.search(objectName, searchTerm, fields, limit);
    JsonObject result = new JsonObject();
    result.addProperty("searchTerm", searchTerm);
    result.addProperty("objectName", objectName);
    result.addProperty("searchType", found.getProvenance() == SearchResult.Provenance.FULL_TEXT
        ? "SOSL" : "SOQL");
    result.addProperty("query", found.getQuery());
    result.addProperty("totalSize", found.getRecords().size());
    result.add("records", JsonResults.tree(found.getRecords()));
    return result;
  }

  /**
   * Walk to parents ({@code up}) or children ({@code down}).
   */
  public JsonObject hierarchy(String objectName, String recordId, String direction)
      throws IOException {
    String normalized = direction == null ? "down" : direction.trim().toLowerCase(Locale.ROOT);
    JsonObject result = new JsonObject();
    switch (normalized) {
    case "up":
      NavigationResult up = client.navigateUp(objectName, recordId,
          RelationalNavigator.DEFAULT_MAX_PARENT_FIELDS);
      if (up.getParentFields().isEmpty()) {
        result.addProperty("message", "No parent relationships found");
        result.add("parents", new JsonArray());
        return result;
      }
      result.add("record", JsonResults.tree(up.getRecord()));
      result.add("parentFields", JsonResults.fields(up.getParentFields()));
      return result;
    case "down":
      NavigationResult down = client.navigateDown(objectName, recordId,
          RelationalNavigator.DEFAULT_MAX_CHILD_RELATIONSHIPS);
      result.add("children", JsonResults.tree(down.getChildren()));
      return result;
    default:
      throw new IllegalArgumentException("direction must be 'up' or 'down': " + direction);
    }
  }
}
