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

import org.aperio.salesforce.SalesforceException;
import org.aperio.salesforce.config.SalesforceConfig;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * {@link SalesforceTransport} over the JDK HTTP client.
 *
 * <p>One instance holds one {@link HttpClient} for the lifetime of the owning
 * {@link org.aperio.salesforce.SalesforceClient}. Requests carry the configured bearer token;
 * there is no token refresh and no retry.
 */
public class HttpSalesforceTransport implements SalesforceTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSalesforceTransport.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> RECORD_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private final SalesforceConfig config;
  private final HttpClient httpClient;

  public HttpSalesforceTransport(SalesforceConfig config) {
    this.config = config;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(config.getTimeout())
        .build();
  }

  @Override public QueryResult query(String soql) throws IOException {
    LOGGER.debug("Executing SOQL: {}", soql);
    return toQueryResult(send(newRequest("/query?q=" + encode(soql)).GET()));
  }

  @Override public QueryResult queryMore(String nextRecordsUrl) throws IOException {
    LOGGER.debug("Fetching next batch: {}", nextRecordsUrl);
    URI uri = URI.create(config.getBaseUrl()).resolve(nextRecordsUrl);
    return toQueryResult(send(newRequest(uri).GET()));
  }

  @Override public JsonNode search(String sosl) throws IOException {
    LOGGER.debug("Executing SOSL: {}", sosl);
    return send(newRequest("/search?q=" + encode(sosl)).GET());
  }

  @Override public JsonNode describe(String objectName) throws IOException {
    return send(newRequest("/sobjects/" + encodePath(objectName) + "/describe").GET());
  }

  @Override public JsonNode listObjects() throws IOException {
    return send(newRequest("/sobjects").GET());
  }

  @Override public List<Map<String, Object>> recent(int limit) throws IOException {
    JsonNode json = send(newRequest("/recent?limit=" + limit).GET());
    return Records.fromJson(json);
  }

  @Override public Map<String, Object> create(String objectName, Map<String, Object> fields)
      throws IOException {
    JsonNode json = send(
        newRequest("/sobjects/" + encodePath(objectName))
            .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(fields))));
    return MAPPER.convertValue(json, RECORD_TYPE);
  }

  @Override public Map<String, Object> update(String objectName, String recordId,
      Map<String, Object> fields) throws IOException {
    send(newRequest("/sobjects/" + encodePath(objectName) + "/" + encodePath(recordId))
        .method("PATCH", HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(fields))));
    return ImmutableMap.of("success", true, "id", recordId);
  }

  @Override public Map<String, Object> delete(String objectName, String recordId)
      throws IOException {
    send(newRequest("/sobjects/" + encodePath(objectName) + "/" + encodePath(recordId))
        .DELETE());
    return ImmutableMap.of("success", true, "id", recordId);
  }

  @Override public JsonNode get(String path) throws IOException {
    String relative = path.startsWith("/") ? path : "/" + path;
    return send(newRequest(relative).GET());
  }

  @Override public void close() {
    // HttpClient has no close() before JDK 21; its threads are daemons
  }

  private HttpRequest.Builder newRequest(String relativePath) {
    return newRequest(URI.create(config.getBaseUrl() + relativePath));
  }

  private HttpRequest.Builder newRequest(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .header("Authorization", "Bearer " + config.getAccessToken())
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .timeout(config.getTimeout());
  }

  private JsonNode send(HttpRequest.Builder builder) throws IOException {
    HttpRequest request = builder.build();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted =
          new InterruptedIOException("Interrupted calling " + request.uri().getPath());
      interrupted.initCause(e);
      throw interrupted;
    }
    LOGGER.debug("{} {} -> {}", request.method(), request.uri().getPath(),
        response.statusCode());

    SalesforceException error = SalesforceErrors.classify(response.statusCode(), response.body());
    if (error != null) {
      throw error;
    }
    String body = response.body();
    if (body == null || body.isEmpty()) {
      return MissingNode.getInstance();
    }
    return MAPPER.readTree(body);
  }

  private static QueryResult toQueryResult(JsonNode json) {
    List<Map<String, Object>> records = Records.fromJson(json.path("records"));
    int totalSize = json.path("totalSize").asInt(records.size());
    boolean done = json.path("done").asBoolean(true);
    String next = json.path("nextRecordsUrl").asText(null);
    return new QueryResult(records, totalSize, done, next);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String encodePath(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
