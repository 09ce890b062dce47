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
import org.aperio.salesforce.query.AggregateRows;
import org.aperio.salesforce.query.AggregateSpec;
import org.aperio.salesforce.query.QuerySpec;
import org.aperio.salesforce.query.SOQLBuilder;
import org.aperio.salesforce.query.TrendPeriod;
import org.aperio.salesforce.query.TrendSpec;
import org.aperio.salesforce.transport.QueryResult;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MCP tools for aggregates, trends and reports.
 */
public class AnalyticsTools {
  private final SalesforceClient client;

  public AnalyticsTools(SalesforceClient client) {
    this.client = client;
  }

  /**
   * Grouped aggregate over one object.
   *
   * @param aggregates items with {@code function}, optional {@code field} and {@code alias}
   * @param groupBy optional grouping field
   * @param where optional condition
   * @return the generated query, the aggregates as understood and the result rows
   */
  public JsonObject aggregate(String objectName, List<Map<String, Object>> aggregates,
      String groupBy, String where, int limit) throws IOException {
    if (aggregates.isEmpty()) {
      throw new IllegalArgumentException("At least one aggregate is required");
    }
    QuerySpec.Builder builder = QuerySpec.builder(objectName)
        .groupBy(groupBy)
        .where(where)
        .limit(limit);
    for (Map<String, Object> aggregate : aggregates) {
      builder.aggregate(AggregateSpec.fromMap(aggregate));
    }
    QuerySpec spec = builder.build();

    QueryResult rows = client.aggregate(spec);
    JsonObject result = new JsonObject();
    result.addProperty("query", SOQLBuilder.buildAggregateQuery(spec));
    result.add("aggregates", describe(spec.getAggregates()));
    result.addProperty("groupBy", spec.getGroupBy());
    result.add("results", JsonResults.tree(AggregateRows.relabel(spec, rows.getRecords())));
    return result;
  }

  /**
   * Metrics bucketed by calendar period over a trailing window.
   *
   * @param period {@code day}, {@code week} or {@code month}
   * @param metrics metric items as for {@link #aggregate}; empty for a record count
   * @param lookback number of periods to look back
   */
  public JsonObject trend(String objectName, String dateField, String period,
      List<Map<String, Object>> metrics, int lookback) throws IOException {
    TrendSpec.Builder builder = TrendSpec.trendBuilder(objectName)
        .dateField(dateField)
        .period(TrendPeriod.parse(period))
        .lookback(lookback);
    for (Map<String, Object> metric : metrics) {
      builder.metric(AggregateSpec.fromMap(metric));
    }
    TrendSpec spec = builder.build();

    QueryResult rows = client.trend(spec);
    JsonObject result = new JsonObject();
    result.addProperty("query", SOQLBuilder.buildTrendQuery(spec));
    result.addProperty("period", spec.getPeriod().name().toLowerCase(Locale.ROOT));
    result.addProperty("timeframe", spec.getLookback());
    result.addProperty("dateField", spec.getDateField());
    result.add("metrics", describe(spec.getAggregates()));
    result.add("trends", JsonResults.tree(AggregateRows.relabel(spec, rows.getRecords())));
    return result;
  }

  /** Locate a report by id or name, or list recently run reports. */
  public JsonElement reports(String reportId, String reportName) throws IOException {
    return JsonResults.tree(client.reports().find(reportId, reportName));
  }

  private static JsonArray describe(List<AggregateSpec> aggregates) {
    JsonArray array = new JsonArray();
    for (AggregateSpec aggregate : aggregates) {
      JsonObject json = new JsonObject();
      json.addProperty("function", aggregate.getFunction().name());
      json.addProperty("field", aggregate.getField());
      json.addProperty("alias",
          aggregate.isBareCount() ? aggregate.getExplicitAlias() : aggregate.getAlias());
      array.add(json);
    }
    return array;
  }
}
