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
package org.aperio.salesforce.search;

import org.aperio.salesforce.query.SOQLBuilder;
import org.aperio.salesforce.transport.Records;
import org.aperio.salesforce.transport.SalesforceTransport;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;

/**
 * Finds records of one object by keyword.
 *
 * <p>A SOSL full-text search is tried first. Whatever it returns is final, an empty result
 * included. Only when the search call itself fails does the resolver fall back to a SOQL
 * query ORing {@code LIKE '%term%'} over the requested fields; a failure of that query
 * reaches the caller unchanged.
 */
public class SearchResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(SearchResolver.class);

  public static final List<String> DEFAULT_FIELDS = ImmutableList.of("Name");
  public static final int DEFAULT_LIMIT = 10;

  private final SalesforceTransport transport;

  public SearchResolver(SalesforceTransport transport) {
    this.transport = transport;
  }

  public SearchResult lookup(String objectName, String searchTerm) throws IOException {
    return lookup(objectName, searchTerm, null, DEFAULT_LIMIT);
  }

  /**
   * Looks up records.
   *
   * @param objectName object to search, e.g. {@code Contact}
   * @param searchTerm keyword; matched as a prefix by SOSL, as a substring by the fallback
   * @param fields fields to return and, for the fallback, to match; null or empty means
   *     {@code Name}
   * @param limit row cap
   * @throws IOException if the fallback query fails
   */
  public SearchResult lookup(String objectName, String searchTerm,
      @Nullable List<String> fields, int limit) throws IOException {
    List<String> searchFields = fields == null || fields.isEmpty() ? DEFAULT_FIELDS : fields;

    String sosl = SOQLBuilder.buildFullTextSearch(objectName, searchTerm, searchFields, limit);
    try {
      JsonNode response = transport.search(sosl);
      JsonNode matches = response.isArray() ? response : response.path("searchRecords");
      return new SearchResult(Records.fromJson(matches), SearchResult.Provenance.FULL_TEXT, sosl);
    } catch (IOException e) {
      if (e instanceof InterruptedIOException && Thread.currentThread().isInterrupted()) {
        throw e;
      }
      LOGGER.debug("Full-text search on {} failed, falling back to LIKE: {}", objectName,
          e.getMessage());
    }

    String soql = SOQLBuilder.buildPatternQuery(objectName, searchTerm, searchFields, limit);
    return new SearchResult(transport.query(soql).getRecords(),
        SearchResult.Provenance.FIELD_PATTERN, soql);
  }
}
