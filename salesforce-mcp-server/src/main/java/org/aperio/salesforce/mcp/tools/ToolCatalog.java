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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * Descriptors returned by {@code tools/list}.
 */
public final class ToolCatalog {
  public static final String QUERY = "salesforce_query";
  public static final String SOBJECTS = "salesforce_sobjects";
  public static final String RECENT = "salesforce_recent";
  public static final String SEARCH = "salesforce_search";
  public static final String DESCRIBE = "salesforce_describe";
  public static final String CREATE = "salesforce_create";
  public static final String UPDATE = "salesforce_update";
  public static final String DELETE = "salesforce_delete";
  public static final String RELATIONSHIPS = "salesforce_relationships";
  public static final String LOOKUP = "salesforce_lookup";
  public static final String HIERARCHY = "salesforce_hierarchy";
  public static final String AGGREGATE = "salesforce_aggregate";
  public static final String REPORTS = "salesforce_reports";
  public static final String TREND_ANALYSIS = "salesforce_trend_analysis";
  public static final String PIPELINE = "salesforce_pipeline";
  public static final String CASE_INSIGHTS = "salesforce_case_insights";
  public static final String LEAD_FUNNEL = "salesforce_lead_funnel";

  private static final String AGGREGATE_ITEMS = "Items with \"function\" (COUNT, SUM, AVG, MAX,"
      + " MIN), optional \"field\" (default Id) and optional \"alias\"";

  private ToolCatalog() {
  }

  public static List<String> names() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (JsonElement tool : tools()) {
      names.add(tool.getAsJsonObject().get("name").getAsString());
    }
    return names.build();
  }

  /** The tools array of a {@code tools/list} result. */
  public static JsonArray tools() {
    JsonArray tools = new JsonArray();
    tools.add(tool(QUERY, "Execute SOQL queries against Salesforce.",
        required(string("q", "The SOQL query to execute"))));
    tools.add(tool(SOBJECTS, "List all available Salesforce objects.", new Param[0]));
    tools.add(tool(RECENT, "Fetch recently accessed Salesforce records.",
        integer("limit", "Maximum number of recent records to return (default: 20)")));
    tools.add(tool(SEARCH, "Execute SOSL searches against Salesforce.",
        required(string("q", "The SOSL search query to execute"))));
    tools.add(tool(DESCRIBE,
        "Get detailed metadata for a Salesforce object including field information.",
        required(string("object_name", "The object to describe (e.g., Account, Contact)"))));
    tools.add(tool(CREATE, "Create a new record in Salesforce.",
        required(string("object_name", "The Salesforce object (e.g., Account, Contact)")),
        required(object("record_data", "The field values for the new record"))));
    tools.add(tool(UPDATE, "Update an existing record in Salesforce.",
        required(string("object_name", "The Salesforce object (e.g., Account, Contact)")),
        required(string("record_id", "The ID of the record to update")),
        required(object("record_data", "The field values to update"))));
    tools.add(tool(DELETE, "Delete a record from Salesforce.",
        required(string("object_name", "The Salesforce object (e.g., Account, Contact)")),
        required(string("record_id", "The ID of the record to delete"))));
    tools.add(tool(RELATIONSHIPS,
        "Get related records for a Salesforce record (e.g., Contacts for an Account).",
        required(string("object_name", "The parent object (e.g., Account)")),
        required(string("record_id", "The ID of the parent record")),
        string("relationship_name",
            "Optional relationship to query (e.g., Contacts); all relationships if omitted")));
    tools.add(tool(LOOKUP, "Search for Salesforce records by name, email, or other fields.",
        required(string("object_name", "The object to search in (e.g., Account, Lead)")),
        required(string("search_term", "The term to search for (e.g., \"acme\")")),
        stringArray("search_fields", "Fields to search in (default: [\"Name\"])"),
        integer("limit", "Maximum number of results to return (default: 10)")));
    tools.add(tool(HIERARCHY, "Navigate parent-child relationships in Salesforce records.",
        required(string("object_name", "The Salesforce object (e.g., Account, Contact)")),
        required(string("record_id", "The ID of the record")),
        string("direction", "\"up\" for parent records, \"down\" for child records"
            + " (default: \"down\")")));
    tools.add(tool(AGGREGATE,
        "Get statistical analysis of Salesforce data (COUNT, SUM, AVG, MAX, MIN).",
        required(string("object_name", "The object to analyze (e.g., Opportunity, Case)")),
        required(objectArray("aggregates", AGGREGATE_ITEMS)),
        string("group_by", "Field to group results by (e.g., StageName, Owner.Name)"),
        string("where_clause", "Optional WHERE condition (e.g., \"CreatedDate = THIS_MONTH\")"),
        integer("limit", "Maximum number of results (default: 100)")));
    tools.add(tool(REPORTS, "Access and run existing Salesforce reports.",
        string("report_id", "Specific report ID to run"),
        string("report_name", "Name of the report to find and run")));
    tools.add(tool(TREND_ANALYSIS, "Analyze trends over time for Salesforce data.",
        required(string("object_name", "The object to analyze (e.g., Opportunity, Case)")),
        string("date_field", "Date field to analyze trends (default: CreatedDate)"),
        string("period", "Grouping period: \"day\", \"week\" or \"month\" (default: month)"),
        objectArray("metrics", AGGREGATE_ITEMS + ". Default: COUNT of records"),
        integer("timeframe", "Number of periods to look back (default: 6)")));
    tools.add(tool(PIPELINE,
        "Sales pipeline analysis with forecasting and conversion rates.",
        string("timeframe", "Date literal to analyze (default: THIS_QUARTER)"),
        string("owner_id", "Optional sales rep ID to analyze"),
        bool("include_forecasting", "Include forecast calculations (default: false)")));
    tools.add(tool(CASE_INSIGHTS,
        "Support case analysis including volume, priorities and top owners.",
        string("timeframe", "Date literal to analyze (default: THIS_MONTH)"),
        string("priority", "Filter by case priority (e.g., High, Medium, Low)"),
        string("status", "Filter by case status (e.g., New, Working, Escalated)")));
    tools.add(tool(LEAD_FUNNEL, "Lead conversion funnel analysis by source.",
        string("source", "Optional lead source filter (e.g., Website, Partner)"),
        string("timeframe", "Date literal to analyze (default: THIS_QUARTER)"),
        string("conversion_stage", "Target conversion stage (default: Opportunity)")));
    return tools;
  }

  private static JsonObject tool(String name, String description, Param... params) {
    JsonObject properties = new JsonObject();
    JsonArray required = new JsonArray();
    for (Param param : params) {
      properties.add(param.name, param.schema);
      if (param.required) {
        required.add(param.name);
      }
    }
    JsonObject schema = new JsonObject();
    schema.addProperty("type", "object");
    schema.add("properties", properties);
    schema.add("required", required);

    JsonObject tool = new JsonObject();
    tool.addProperty("name", name);
    tool.addProperty("description", description);
    tool.add("inputSchema", schema);
    return tool;
  }

  private static Param string(String name, String description) {
    return new Param(name, schema("string", description));
  }

  private static Param integer(String name, String description) {
    return new Param(name, schema("integer", description));
  }

  private static Param bool(String name, String description) {
    return new Param(name, schema("boolean", description));
  }

  private static Param object(String name, String description) {
    return new Param(name, schema("object", description));
  }

  private static Param stringArray(String name, String description) {
    JsonObject schema = schema("array", description);
    JsonObject items = new JsonObject();
    items.addProperty("type", "string");
    schema.add("items", items);
    return new Param(name, schema);
  }

  private static Param objectArray(String name, String description) {
    JsonObject schema = schema("array", description);
    JsonObject items = new JsonObject();
    items.addProperty("type", "object");
    schema.add("items", items);
    return new Param(name, schema);
  }

  private static Param required(Param param) {
    param.required = true;
    return param;
  }

  private static JsonObject schema(String type, String description) {
    JsonObject schema = new JsonObject();
    schema.addProperty("type", type);
    schema.addProperty("description", description);
    return schema;
  }

  /** One input property of a tool. */
  private static class Param {
    final String name;
    final JsonObject schema;
    boolean required;

    Param(String name, JsonObject schema) {
      this.name = name;
      this.schema = schema;
    }
  }
}
