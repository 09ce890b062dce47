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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One batch of a SOQL query response.
 *
 * <p>Records map field names to values. Relationship projections such as {@code Owner.Name}
 * appear as nested maps, aggregate results as top-level keys named by their alias
 * (or {@code expr0}, {@code expr1}, ... when not aliased).
 */
public class QueryResult {
  private final List<Map<String, Object>> records;
  private final int totalSize;
  private final boolean done;
  private final @Nullable String nextRecordsUrl;

  public QueryResult(List<Map<String, Object>> records, int totalSize, boolean done,
      @Nullable String nextRecordsUrl) {
    // records may hold null field values, so no ImmutableMap copies of the rows
    this.records = Collections.unmodifiableList(records);
    this.totalSize = totalSize;
    this.done = done;
    this.nextRecordsUrl = nextRecordsUrl;
  }

  /** A complete single-batch result. */
  public static QueryResult of(List<Map<String, Object>> records) {
    return new QueryResult(records, records.size(), true, null);
  }

  public static QueryResult empty() {
    return of(ImmutableList.of());
  }

  public List<Map<String, Object>> getRecords() {
    return records;
  }

  public int getTotalSize() {
    return totalSize;
  }

  public boolean isDone() {
    return done;
  }

  public @Nullable String getNextRecordsUrl() {
    return nextRecordsUrl;
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
