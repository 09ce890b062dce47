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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Records matched by a lookup, with the strategy that produced them.
 */
public class SearchResult {

  /** Strategy that produced a {@link SearchResult}. */
  public enum Provenance {
    /** SOSL full-text search. */
    FULL_TEXT,
    /** SOQL {@code LIKE} predicates, used when full-text search failed. */
    FIELD_PATTERN
  }

  private final List<Map<String, Object>> records;
  private final Provenance provenance;
  private final String query;

  public SearchResult(List<Map<String, Object>> records, Provenance provenance, String query) {
    this.records = Collections.unmodifiableList(records);
    this.provenance = provenance;
    this.query = query;
  }

  public List<Map<String, Object>> getRecords() {
    return records;
  }

  public Provenance getProvenance() {
    return provenance;
  }

  /** The SOSL or SOQL text that was executed. */
  public String getQuery() {
    return query;
  }
}
