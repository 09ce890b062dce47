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
package org.aperio.salesforce.mcp;

import org.aperio.salesforce.AuthExpiredException;
import org.aperio.salesforce.SalesforceClient;
import org.aperio.salesforce.SalesforceException;
import org.aperio.salesforce.config.SalesforceConfig;
import org.aperio.salesforce.mcp.protocol.McpRequest;
import org.aperio.salesforce.mcp.protocol.McpResponse;
import org.aperio.salesforce.mcp.tools.AnalyticsTools;
import org.aperio.salesforce.mcp.tools.InsightTools;
import org.aperio.salesforce.mcp.tools.NavigationTools;
import org.aperio.salesforce.mcp.tools.RecordTools;
import org.aperio.salesforce.mcp.tools.ToolArguments;
import org.aperio.salesforce.mcp.tools.ToolCatalog;
import org.aperio.salesforce.query.QuerySpec;
import org.aperio.salesforce.query.TrendSpec;
import org.aperio.salesforce.search.SearchResolver;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.aperio.salesforce.analytics.BusinessInsights.DEFAULT_CASE_TIMEFRAME;
import static org.aperio.salesforce.analytics.BusinessInsights.DEFAULT_CONVERSION_STAGE;
import static org.aperio.salesforce.analytics.BusinessInsights.DEFAULT_FUNNEL_TIMEFRAME;
import static org.aperio.salesforce.analytics.BusinessInsights.DEFAULT_PIPELINE_TIMEFRAME;

/**
 * Salesforce MCP Server - Model Context Protocol server for one Salesforce org.
 *
 * <p>Exposes record access, relationship navigation, aggregates, trends and business
 * reports as MCP tools over a JSON-RPC stdio interface. Logging goes to stderr since stdout
 * carries the protocol.
 *
 * <p>Usage:
 * <pre>
 * SALESFORCE_BASE_URL=https://acme.my.salesforce.com/services/data/v59.0 \
 * SALESFORCE_ACCESS_TOKEN=... java -jar aperio-salesforce-mcp-server.jar [--config file]
 * </pre>
 */
public class SalesforceMcpServer {
  private static final Logger LOGGER = LoggerFactory.getLogger(SalesforceMcpServer.class);
  private static final Gson GSON = new Gson();
  private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().serializeNulls()
      .create();

  static final String PROTOCOL_VERSION = "2024-11-05";
  static final String SERVER_NAME = "aperio-salesforce-mcp";

  private final SalesforceClient client;
  private final RecordTools recordTools;
  private final NavigationTools navigationTools;
  private final AnalyticsTools analyticsTools;
  private final InsightTools insightTools;

  public static void main(String[] args) {
    try {
      SalesforceConfig config = SalesforceConfig.load(parseConfigPath(args), System.getenv());
      LOGGER.info("Connecting to {}", config.getBaseUrl());
      SalesforceMcpServer server = new SalesforceMcpServer(new SalesforceClient(config));
      server.start(System.in, System.out);
    } catch (Exception e) {
      LOGGER.error("Failed to start MCP server", e);
      System.exit(1);
    }
  }

  public SalesforceMcpServer(SalesforceClient client) {
    this.client = client;
    this.recordTools = new RecordTools(client);
    this.navigationTools = new NavigationTools(client);
    this.analyticsTools = new AnalyticsTools(client);
    this.insightTools = new InsightTools(client);
  }

  /**
   * Start JSON-RPC stdio protocol loop. Returns at end of input and closes the client.
   */
  public void start(InputStream input, OutputStream output) {
    LOGGER.info("Salesforce MCP Server starting...");

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
          out.println(GSON.toJson(response));
        }
      }

    } catch (IOException e) {
      LOGGER.error("Fatal error in stdio loop", e);
    } finally {
      client.close();
    }
  }

  /**
   * Handle one line of input. Returns null for notifications.
   */
  McpResponse handleLine(String line) {
    McpRequest request;
    try {
      request = GSON.fromJson(line, McpRequest.class);
    } catch (JsonParseException e) {
      LOGGER.warn("Unparseable request: {}", e.getMessage());
      return McpResponse.error(null, McpResponse.PARSE_ERROR, "Parse error: " + e.getMessage());
    }
    if (request == null || request.getMethod() == null) {
      return McpResponse.error(request == null ? null : request.getId(),
          McpResponse.PARSE_ERROR, "Parse error: no method");
    }
    McpResponse response = handleRequest(request);
    return request.isNotification() ? null : response;
  }

  /**
   * Handle MCP request and return response.
   */
  McpResponse handleRequest(McpRequest request) {
    String method = request.getMethod();
    JsonObject params = request.getParams();

    try {
      switch (method) {
        case "initialize":
          return McpResponse.success(request.getId(), initializeResult());

        case "tools/list":
          JsonObject list = new JsonObject();
          list.add("tools", ToolCatalog.tools());
          return McpResponse.success(request.getId(), list);

        case "tools/call":
          ToolArguments call = new ToolArguments(params);
          String name = call.requireString("name");
          JsonElement arguments = params.get("arguments");
          JsonElement called = callTool(name, new ToolArguments(
              arguments != null && arguments.isJsonObject() ? arguments.getAsJsonObject() : null));
          if (called == null) {
            return McpResponse.error(request.getId(), McpResponse.METHOD_NOT_FOUND,
                "Unknown tool: " + name);
          }
          return McpResponse.success(request.getId(), textContent(called));

        default:
          if (method.startsWith("notifications/")) {
            return McpResponse.success(request.getId(), new JsonObject());
          }
          JsonElement result = callTool(method, new ToolArguments(params));
          if (result == null) {
            return McpResponse.error(request.getId(), McpResponse.METHOD_NOT_FOUND,
                "Method not found: " + method);
          }
          return McpResponse.success(request.getId(), result);
      }

    } catch (AuthExpiredException e) {
      LOGGER.warn("Session expired handling request: {}", method);
      return McpResponse.error(request.getId(), McpResponse.AUTH_EXPIRED, e.getMessage());
    } catch (SalesforceException e) {
      LOGGER.error("Salesforce error handling request: {}", method, e);
      return McpResponse.error(request.getId(), McpResponse.SALESFORCE_ERROR, e.getMessage());
    } catch (IllegalArgumentException e) {
      LOGGER.debug("Invalid params for {}: {}", method, e.getMessage());
      return McpResponse.error(request.getId(), McpResponse.INVALID_PARAMS,
          "Invalid params: " + e.getMessage());
    } catch (Exception e) {
      LOGGER.error("Error handling request: {}", method, e);
      return McpResponse.error(request.getId(), McpResponse.INTERNAL_ERROR,
          "Internal error: " + e.getMessage());
    }
  }

  /**
   * Dispatch a tool by name. Returns null when no tool has that name.
   */
  JsonElement callTool(String name, ToolArguments args) throws IOException {
    switch (name) {
      // Records
      case ToolCatalog.QUERY:
        return recordTools.query(args.requireString("q"));

      case ToolCatalog.SOBJECTS:
        return recordTools.listObjects();

      case ToolCatalog.RECENT:
        return recordTools.recent(args.getInt("limit", RecordTools.DEFAULT_RECENT_LIMIT));

      case ToolCatalog.SEARCH:
        return recordTools.search(args.requireString("q"));

      case ToolCatalog.DESCRIBE:
        return recordTools.describe(args.requireString("object_name"));

      case ToolCatalog.CREATE:
        return recordTools.create(args.requireString("object_name"),
            args.requireObject("record_data"));

      case ToolCatalog.UPDATE:
        return recordTools.update(args.requireString("object_name"),
            args.requireString("record_id"), args.requireObject("record_data"));

      case ToolCatalog.DELETE:
        return recordTools.delete(args.requireString("object_name"),
            args.requireString("record_id"));

      // Navigation
      case ToolCatalog.RELATIONSHIPS:
        return navigationTools.relationships(args.requireString("object_name"),
            args.requireString("record_id"), args.getString("relationship_name", null));

      case ToolCatalog.LOOKUP:
        return navigationTools.lookup(args.requireString("object_name"),
            args.requireString("search_term"), args.getStringList("search_fields"),
            args.getInt("limit", SearchResolver.DEFAULT_LIMIT));

      case ToolCatalog.HIERARCHY:
        return navigationTools.hierarchy(args.requireString("object_name"),
            args.requireString("record_id"), args.getString("direction", "down"));

      // Analytics
      case ToolCatalog.AGGREGATE:
        return analyticsTools.aggregate(args.requireString("object_name"),
            args.getObjectList("aggregates"), args.getString("group_by", null),
            args.getString("where_clause", null),
            args.getInt("limit", QuerySpec.DEFAULT_LIMIT));

      case ToolCatalog.REPORTS:
        return analyticsTools.reports(args.getString("report_id", null),
            args.getString("report_name", null));

      case ToolCatalog.TREND_ANALYSIS:
        return analyticsTools.trend(args.requireString("object_name"),
            args.getString("date_field", TrendSpec.DEFAULT_DATE_FIELD),
            args.getString("period", "month"), args.getObjectList("metrics"),
            args.getInt("timeframe", TrendSpec.DEFAULT_LOOKBACK));

      // Business insights
      case ToolCatalog.PIPELINE:
        return insightTools.pipeline(args.getString("timeframe", DEFAULT_PIPELINE_TIMEFRAME),
            args.getString("owner_id", null), args.getBoolean("include_forecasting", false));

      case ToolCatalog.CASE_INSIGHTS:
        return insightTools.caseInsights(args.getString("timeframe", DEFAULT_CASE_TIMEFRAME),
            args.getString("priority", null), args.getString("status", null));

      case ToolCatalog.LEAD_FUNNEL:
        return insightTools.leadFunnel(args.getString("source", null),
            args.getString("timeframe", DEFAULT_FUNNEL_TIMEFRAME),
            args.getString("conversion_stage", DEFAULT_CONVERSION_STAGE));

      default:
        return null;
    }
  }

  private static JsonObject initializeResult() {
    JsonObject serverInfo = new JsonObject();
    serverInfo.addProperty("name", SERVER_NAME);
    Package pkg = SalesforceMcpServer.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    serverInfo.addProperty("version", version == null ? "dev" : version);

    JsonObject capabilities = new JsonObject();
    capabilities.add("tools", new JsonObject());

    JsonObject result = new JsonObject();
    result.addProperty("protocolVersion", PROTOCOL_VERSION);
    result.add("capabilities", capabilities);
    result.add("serverInfo", serverInfo);
    return result;
  }

  /** Wraps a tool result as MCP text content. */
  private static JsonObject textContent(JsonElement value) {
    JsonObject text = new JsonObject();
    text.addProperty("type", "text");
    text.addProperty("text", PRETTY.toJson(value));
    JsonArray content = new JsonArray();
    content.add(text);
    JsonObject result = new JsonObject();
    result.add("content", content);
    return result;
  }

  /**
   * Parse the properties file path from command-line arguments.
   */
  static Path parseConfigPath(String[] args) {
    for (int i = 0; i < args.length - 1; i++) {
      if ("--config".equals(args[i])) {
        return Paths.get(args[i + 1]);
      }
    }
    return null;
  }
}
