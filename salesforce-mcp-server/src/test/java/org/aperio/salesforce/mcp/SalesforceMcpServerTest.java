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
import org.aperio.salesforce.RemoteApiException;
import org.aperio.salesforce.SalesforceClient;
import org.aperio.salesforce.mcp.protocol.McpResponse;
import org.aperio.salesforce.mcp.tools.ToolCatalog;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;

/**
 * Tests for request dispatch in {@link SalesforceMcpServer}.
 */
@Tag("unit")
public class SalesforceMcpServerTest {
  private static final Gson GSON = new Gson();

  private StubTransport transport;
  private SalesforceMcpServer server;

  @BeforeEach
  public void setUp() {
    transport = new StubTransport();
    server = new SalesforceMcpServer(new SalesforceClient(transport));
  }

  private JsonObject call(String line) {
    McpResponse response = server.handleLine(line);
    return JsonParser.parseString(GSON.toJson(response)).getAsJsonObject();
  }

  private static Map<String, Object> row(Object... keysAndValues) {
    ImmutableMap.Builder<String, Object> row = ImmutableMap.builder();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      row.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return row.build();
  }

  @Test
  public void testInitialize() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}");

    JsonObject result = response.getAsJsonObject("result");
    assertThat(response.get("id").getAsInt(), equalTo(1));
    assertThat(result.get("protocolVersion").getAsString(),
        equalTo(SalesforceMcpServer.PROTOCOL_VERSION));
    assertThat(result.getAsJsonObject("serverInfo").get("name").getAsString(),
        equalTo(SalesforceMcpServer.SERVER_NAME));
  }

  @Test
  public void testNotificationHasNoResponse() {
    assertThat(server.handleLine(
        "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"), nullValue());
  }

  @Test
  public void testToolsList() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"method\":\"tools/list\"}");

    JsonArray tools = response.getAsJsonObject("result").getAsJsonArray("tools");
    assertThat(tools.size(), equalTo(17));
    assertThat(ToolCatalog.names(), hasSize(17));
    assertThat(response.get("id").getAsString(), equalTo("a"));
  }

  @Test
  public void testToolsCallWrapsTextContent() {
    transport.thenRecords(ImmutableList.of(row("Id", "001A", "Name", "Acme")));

    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
        + "\"params\":{\"name\":\"salesforce_query\","
        + "\"arguments\":{\"q\":\"SELECT Id, Name FROM Account\"}}}");

    JsonArray content = response.getAsJsonObject("result").getAsJsonArray("content");
    assertThat(content.get(0).getAsJsonObject().get("type").getAsString(), equalTo("text"));
    JsonObject payload = JsonParser.parseString(
        content.get(0).getAsJsonObject().get("text").getAsString()).getAsJsonObject();
    assertThat(payload.get("totalSize").getAsInt(), equalTo(1));
    assertThat(transport.calls, contains("SELECT Id, Name FROM Account"));
  }

  @Test
  public void testToolNameAsMethod() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"salesforce_update\","
        + "\"params\":{\"object_name\":\"Account\",\"record_id\":\"001A\","
        + "\"record_data\":{\"Name\":\"Acme Ltd\"}}}");

    JsonObject result = response.getAsJsonObject("result");
    assertThat(result.get("success").getAsBoolean(), equalTo(true));
    assertThat(result.get("id").getAsString(), equalTo("001A"));
    assertThat(transport.calls, contains("update Account/001A {Name=Acme Ltd}"));
  }

  @Test
  public void testAggregateRelabelsCount() {
    transport.thenRecords(ImmutableList.of(
        row("StageName", "Prospecting", "expr0", 4, "Total", 1000.0)));

    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"salesforce_aggregate\","
        + "\"params\":{\"object_name\":\"Opportunity\",\"group_by\":\"StageName\","
        + "\"aggregates\":[{\"function\":\"COUNT\",\"field\":\"Id\",\"alias\":\"Deals\"},"
        + "{\"function\":\"sum\",\"field\":\"Amount\",\"alias\":\"Total\"}]}}");

    JsonObject result = response.getAsJsonObject("result");
    assertThat(result.get("query").getAsString(), equalTo("SELECT StageName, COUNT(Id),"
        + " SUM(Amount) Total FROM Opportunity GROUP BY StageName LIMIT 100"));
    JsonObject first = result.getAsJsonArray("results").get(0).getAsJsonObject();
    assertThat(first.get("Deals").getAsInt(), equalTo(4));
    assertThat(result.get("groupBy").getAsString(), equalTo("StageName"));
  }

  @Test
  public void testHierarchyDefaultsDown() throws Exception {
    transport.thenJson("{\"name\": \"Account\", \"fields\": [], \"childRelationships\": ["
        + "{\"childSObject\": \"Account\", \"field\": \"ParentId\","
        + " \"relationshipName\": \"ChildAccounts\"}]}").thenRecords(ImmutableList.of());

    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"salesforce_hierarchy\","
        + "\"params\":{\"object_name\":\"Account\",\"record_id\":\"001A\"}}");

    JsonObject children = response.getAsJsonObject("result").getAsJsonObject("children");
    assertThat(children.getAsJsonArray("ChildAccounts").size(), equalTo(0));
  }

  @Test
  public void testHierarchyUpWithoutParents() throws Exception {
    transport.thenJson("{\"name\": \"Note\", \"fields\": [{\"name\": \"Id\", \"type\": \"id\"}]}");

    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"salesforce_hierarchy\","
        + "\"params\":{\"object_name\":\"Note\",\"record_id\":\"002A\",\"direction\":\"up\"}}");

    JsonObject result = response.getAsJsonObject("result");
    assertThat(result.get("message").getAsString(), equalTo("No parent relationships found"));
    assertThat(transport.calls, hasSize(1));
  }

  @Test
  public void testTrendRowsUseCountAlias() {
    transport.thenRecords(ImmutableList.of(
        row("expr0", 2024, "expr1", 5, "expr2", 12)));

    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":10,"
        + "\"method\":\"salesforce_trend_analysis\",\"params\":{\"object_name\":\"Lead\","
        + "\"metrics\":[{\"function\":\"COUNT\",\"field\":\"Id\",\"alias\":\"Total\"}]}}");

    JsonObject result = response.getAsJsonObject("result");
    JsonObject metric = result.getAsJsonArray("metrics").get(0).getAsJsonObject();
    assertThat(metric.get("alias").getAsString(), equalTo("Total"));
    JsonObject first = result.getAsJsonArray("trends").get(0).getAsJsonObject();
    assertThat(first.get("Total").getAsInt(), equalTo(12));
    assertThat(first.get("expr1").getAsInt(), equalTo(5));
    assertThat(first.has("expr2"), equalTo(false));
  }

  @Test
  public void testDescribeServedFromCache() throws Exception {
    transport.thenJson("{\"name\": \"Account\", \"label\": \"Account\","
        + " \"fields\": [{\"name\": \"Id\", \"type\": \"id\"}]}");
    String request = "{\"jsonrpc\":\"2.0\",\"id\":11,\"method\":\"salesforce_describe\","
        + "\"params\":{\"object_name\":\"Account\"}}";

    JsonObject first = call(request).getAsJsonObject("result");
    JsonObject second = call(request).getAsJsonObject("result");

    assertThat(first.get("label").getAsString(), equalTo("Account"));
    assertThat(second, equalTo(first));
    assertThat(transport.calls, contains("describe Account"));
  }

  @Test
  public void testCreateKeepsIntegerFields() {
    call("{\"jsonrpc\":\"2.0\",\"id\":12,\"method\":\"salesforce_create\","
        + "\"params\":{\"object_name\":\"Account\","
        + "\"record_data\":{\"Name\":\"Acme\",\"NumberOfEmployees\":5}}}");

    assertThat(transport.calls,
        contains("create Account {Name=Acme, NumberOfEmployees=5}"));
  }

  @Test
  public void testStructuredValueForScalarArgumentIsInvalidParams() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":13,\"method\":\"salesforce_query\","
        + "\"params\":{\"q\":{\"text\":\"SELECT Id FROM Account\"}}}");

    assertThat(errorCode(response), equalTo(McpResponse.INVALID_PARAMS));
  }

  @Test
  public void testBadDirectionIsInvalidParams() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"salesforce_hierarchy\","
        + "\"params\":{\"object_name\":\"Account\",\"record_id\":\"001A\",\"direction\":\"sideways\"}}");

    assertThat(errorCode(response), equalTo(McpResponse.INVALID_PARAMS));
  }

  @Test
  public void testMissingArgumentIsInvalidParams() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":8,\"method\":\"salesforce_describe\"}");

    assertThat(errorCode(response), equalTo(McpResponse.INVALID_PARAMS));
    assertThat(response.getAsJsonObject("error").get("message").getAsString(),
        containsString("object_name"));
  }

  @Test
  public void testExpiredSession() {
    transport.thenFail(new AuthExpiredException());

    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"salesforce_sobjects\"}");

    assertThat(errorCode(response), equalTo(McpResponse.AUTH_EXPIRED));
  }

  @Test
  public void testApiError() {
    transport.thenFail(new RemoteApiException(400, "MALFORMED_QUERY",
        "Salesforce API Error: unexpected token: FORM"));

    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"salesforce_query\","
        + "\"params\":{\"q\":\"SELECT Id FORM Account\"}}");

    assertThat(errorCode(response), equalTo(McpResponse.SALESFORCE_ERROR));
    assertThat(response.getAsJsonObject("error").get("message").getAsString(),
        equalTo("Salesforce API Error: unexpected token: FORM"));
  }

  @Test
  public void testUnknownMethod() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":11,\"method\":\"salesforce_nope\"}");

    assertThat(errorCode(response), equalTo(McpResponse.METHOD_NOT_FOUND));
  }

  @Test
  public void testUnknownToolCall() {
    JsonObject response = call("{\"jsonrpc\":\"2.0\",\"id\":12,\"method\":\"tools/call\","
        + "\"params\":{\"name\":\"salesforce_nope\"}}");

    assertThat(errorCode(response), equalTo(McpResponse.METHOD_NOT_FOUND));
  }

  @Test
  public void testParseError() {
    JsonObject response = call("{not json");

    assertThat(errorCode(response), equalTo(McpResponse.PARSE_ERROR));
  }

  @Test
  public void testStdioLoopContinuesAfterBadLine() {
    String input = "{not json\n"
        + "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}\n"
        + "\n"
        + "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}\n";
    ByteArrayOutputStream output = new ByteArrayOutputStream();

    server.start(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), output);

    String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\n");
    assertThat(lines.length, equalTo(2));
    assertThat(errorCode(JsonParser.parseString(lines[0]).getAsJsonObject()),
        equalTo(McpResponse.PARSE_ERROR));
    JsonElement second = JsonParser.parseString(lines[1]);
    assertThat(second.getAsJsonObject().getAsJsonObject("result").getAsJsonArray("tools").size(),
        equalTo(17));
    assertThat(transport.closed, equalTo(true));
  }

  @Test
  public void testParseConfigPath() {
    assertThat(SalesforceMcpServer.parseConfigPath(new String[] {"--config", "sf.properties"}),
        equalTo(Paths.get("sf.properties")));
    assertThat(SalesforceMcpServer.parseConfigPath(new String[0]), nullValue());
  }

  private static int errorCode(JsonObject response) {
    return response.getAsJsonObject("error").get("code").getAsInt();
  }
}
