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

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Executes calls against one Salesforce org's REST API.
 *
 * <p>Implementations do not retry. Every failed call surfaces as an {@link IOException}:
 * {@link org.aperio.salesforce.SalesforceException} subclasses for responses with status 400
 * or above, plain {@code IOException}s for network failures and timeouts.
 */
public interface SalesforceTransport extends AutoCloseable {

  /**
   * Executes a SOQL query.
   *
   * @param soql query text
   * @return first batch of records
   * @throws IOException if the call fails
   */
  QueryResult query(String soql) throws IOException;

  /**
   * Fetches the next batch of a query whose result was not {@link QueryResult#isDone() done}.
   *
   * @param nextRecordsUrl locator returned with the previous batch
   * @return next batch of records
   * @throws IOException if the call fails
   */
  QueryResult queryMore(String nextRecordsUrl) throws IOException;

  /**
   * Executes a SOSL search.
   *
   * @param sosl search text
   * @return raw search response; matches are under {@code searchRecords}
   * @throws IOException if the call fails
   */
  JsonNode search(String sosl) throws IOException;

  /**
   * Fetches describe metadata for an sObject.
   *
   * @param objectName API name, e.g. {@code Account}
   * @return raw describe response
   * @throws IOException if the object is unknown, unreadable or the call fails
   */
  JsonNode describe(String objectName) throws IOException;

  /** Lists every sObject visible to the session. */
  JsonNode listObjects() throws IOException;

  /** Lists recently viewed records. */
  List<Map<String, Object>> recent(int limit) throws IOException;

  /** Creates a record and returns the platform response ({@code id}, {@code success}). */
  Map<String, Object> create(String objectName, Map<String, Object> fields) throws IOException;

  /** Updates a record. */
  Map<String, Object> update(String objectName, String recordId, Map<String, Object> fields)
      throws IOException;

  /** Deletes a record. */
  Map<String, Object> delete(String objectName, String recordId) throws IOException;

  /**
   * Issues a GET against a path relative to the REST base, for endpoints without a
   * dedicated method (e.g. {@code /analytics/reports/{id}}).
   */
  JsonNode get(String path) throws IOException;

  @Override void close();
}
