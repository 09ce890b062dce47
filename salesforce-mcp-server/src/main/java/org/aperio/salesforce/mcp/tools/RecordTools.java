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
import org.aperio.salesforce.transport.SalesforceTransport;

import com.google.gson.JsonElement;

import java.io.IOException;
import java.util.Map;

/**
 * MCP tools for raw SOQL/SOSL and single-record operations.
 *
 * <p>Queries and searches are passed through verbatim; the caller owns their syntax.
 */
public class RecordTools {
  public static final int DEFAULT_RECENT_LIMIT = 20;

  private final SalesforceClient client;
  private final SalesforceTransport transport;

  public RecordTools(SalesforceClient client) {
    this.client = client;
    this.transport = client.transport();
  }

  /**
   * Execute a SOQL query.
   *
   * @param soql query text
   * @return first page of results with totalSize, done and records
   */
  public JsonElement query(String soql) throws IOException {
    return JsonResults.queryResult(transport.query(soql));
  }

  /** List the objects the org exposes. */
  public JsonElement listObjects() throws IOException {
    return JsonResults.tree(transport.listObjects());
  }

  public JsonElement recent(int limit) throws IOException {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return JsonResults.tree(transport.recent(limit));
  }

  /**
   * Execute a SOSL search.
   *
   * @param sosl search text, e.g. {@code FIND {Acme} IN NAME FIELDS RETURNING Account(Name)}
   */
  public JsonElement search(String sosl) throws IOException {
    return JsonResults.tree(transport.search(sosl));
  }

  /** Full describe of an object, as returned by the API. Served from the schema cache. */
  public JsonElement describe(String objectName) throws IOException {
    return JsonResults.tree(client.describe(objectName).getDescribe());
  }

  public JsonElement create(String objectName, Map<String, Object> fields) throws IOException {
    return JsonResults.tree(transport.create(objectName, fields));
  }

  public JsonElement update(String objectName, String recordId, Map<String, Object> fields)
      throws IOException {
    return JsonResults.tree(transport.update(objectName, recordId, fields));
  }

  public JsonElement delete(String objectName, String recordId) throws IOException {
    return JsonResults.tree(transport.delete(objectName, recordId));
  }
}
