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
package org.aperio.salesforce.transport;

import org.aperio.salesforce.AuthExpiredException;
import org.aperio.salesforce.RemoteApiException;
import org.aperio.salesforce.config.SalesforceConfig;

import com.google.common.collect.ImmutableMap;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link HttpSalesforceTransport} against a local HTTP server.
 */
@Tag("unit")
public class HttpSalesforceTransportTest {
  private static final String API = "/services/data/v59.0";

  private HttpServer server;
  private HttpSalesforceTransport transport;
  private final List<String> requests = new CopyOnWriteArrayList<>();
  private final List<String> authHeaders = new CopyOnWriteArrayList<>();
  private final List<String> bodies = new CopyOnWriteArrayList<>();

  @BeforeEach
  public void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
    SalesforceConfig config = SalesforceConfig.builder()
        .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + API + "/")
        .accessToken("test-token")
        .build();
    transport = new HttpSalesforceTransport(config);
  }

  @AfterEach
  public void stopServer() {
    transport.close();
    server.stop(0);
  }

  private void respond(String path, int status, String body) {
    server.createContext(API + path, exchange -> {
      String query = exchange.getRequestURI().getRawQuery();
      requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath()
          + (query == null ? "" : "?" + URLDecoder.decode(query, StandardCharsets.UTF_8)));
      authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
      bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      send(exchange, status, body);
    });
  }

  private static void send(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  @Test
  public void testQuery() throws Exception {
    respond("/query", 200, "{\"totalSize\": 2, \"done\": false,"
        + " \"nextRecordsUrl\": \"" + API + "/query/01gxx-2000\","
        + " \"records\": [{\"Id\": \"001A\", \"Name\": \"Acme\"}]}");

    QueryResult result = transport.query("SELECT Id, Name FROM Account WHERE Name = 'A&B'");

    assertThat(requests,
        contains("GET " + API + "/query?q=SELECT Id, Name FROM Account WHERE Name = 'A&B'"));
    assertThat(authHeaders, contains("Bearer test-token"));
    assertThat(result.getTotalSize(), equalTo(2));
    assertThat(result.isDone(), equalTo(false));
    assertThat(result.getNextRecordsUrl(), equalTo(API + "/query/01gxx-2000"));
    assertThat(result.getRecords().get(0).get("Name"), equalTo("Acme"));
  }

  @Test
  public void testQueryMoreFollowsNextRecordsUrl() throws Exception {
    respond("/query/01gxx-2000", 200, "{\"totalSize\": 2, \"done\": true,"
        + " \"records\": [{\"Id\": \"001B\"}]}");

    QueryResult result = transport.queryMore(API + "/query/01gxx-2000");

    assertThat(result.isDone(), equalTo(true));
    assertThat(result.getRecords(), hasSize(1));
  }

  @Test
  public void testUpdateSendsPatch() throws Exception {
    respond("/sobjects/Account/001A", 204, "");

    Map<String, Object> result =
        transport.update("Account", "001A", ImmutableMap.of("Name", "Acme Ltd"));

    assertThat(requests, contains("PATCH " + API + "/sobjects/Account/001A"));
    assertThat(bodies, contains("{\"Name\":\"Acme Ltd\"}"));
    assertThat(result.get("success"), equalTo(true));
    assertThat(result.get("id"), equalTo("001A"));
  }

  @Test
  public void testCreateReturnsResponse() throws Exception {
    respond("/sobjects/Contact", 201, "{\"id\": \"003NEW\", \"success\": true, \"errors\": []}");

    Map<String, Object> result =
        transport.create("Contact", ImmutableMap.of("LastName", "Lovelace"));

    assertThat(requests, contains("POST " + API + "/sobjects/Contact"));
    assertThat(result.get("id"), equalTo("003NEW"));
  }

  @Test
  public void testDelete() throws Exception {
    respond("/sobjects/Lead/00QA", 204, "");

    Map<String, Object> result = transport.delete("Lead", "00QA");

    assertThat(requests, contains("DELETE " + API + "/sobjects/Lead/00QA"));
    assertThat(result.get("success"), equalTo(true));
  }

  @Test
  public void testExpiredSession() {
    respond("/sobjects", 401,
        "[{\"message\": \"Session expired or invalid\", \"errorCode\": \"INVALID_SESSION_ID\"}]");

    assertThrows(AuthExpiredException.class, () -> transport.listObjects());
  }

  @Test
  public void testApiError() {
    respond("/sobjects/Nope__c/describe", 404,
        "[{\"message\": \"The requested resource does not exist\", \"errorCode\": \"NOT_FOUND\"}]");

    RemoteApiException e =
        assertThrows(RemoteApiException.class, () -> transport.describe("Nope__c"));
    assertThat(e.getStatusCode(), equalTo(404));
    assertThat(e.getMessage(),
        equalTo("Salesforce API Error: The requested resource does not exist"));
  }

  @Test
  public void testRecent() throws Exception {
    respond("/recent", 200, "[{\"Id\": \"001A\"}, {\"Id\": \"003A\"}]");

    List<Map<String, Object>> recent = transport.recent(5);

    assertThat(recent, hasSize(2));
    assertThat(requests, contains("GET " + API + "/recent?limit=5"));
  }

  @Test
  public void testInterruptedCallRestoresFlag() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    server.createContext(API + "/query", exchange -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      send(exchange, 200, "{\"totalSize\": 0, \"done\": true, \"records\": []}");
    });

    Thread.currentThread().interrupt();
    try {
      assertThrows(InterruptedIOException.class,
          () -> transport.query("SELECT Id FROM Account"));
      assertThat(Thread.currentThread().isInterrupted(), equalTo(true));
    } finally {
      Thread.interrupted();
      release.countDown();
    }
  }
}
