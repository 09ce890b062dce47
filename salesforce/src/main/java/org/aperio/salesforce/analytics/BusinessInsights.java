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
package org.aperio.salesforce.analytics;

import org.aperio.salesforce.query.AggregateFunction;
import org.aperio.salesforce.query.AggregateRows;
import org.aperio.salesforce.query.AggregateSpec;
import org.aperio.salesforce.query.QuerySpec;
import org.aperio.salesforce.query.SOQLBuilder;
import org.aperio.salesforce.query.SOQLLiterals;
import org.aperio.salesforce.transport.QueryResult;
import org.aperio.salesforce.transport.Records;
import org.aperio.salesforce.transport.SalesforceTransport;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline, support-case and lead-funnel summaries.
 *
 * <p>Each summary issues a few independent aggregate queries, one after another, and
 * combines the rows in memory. Any failing query fails the summary, except the optional
 * pipeline forecast which is reported as unavailable instead.
 */
public class BusinessInsights {
  private static final Logger LOGGER = LoggerFactory.getLogger(BusinessInsights.class);

  public static final String DEFAULT_PIPELINE_TIMEFRAME = "THIS_QUARTER";
  public static final String DEFAULT_CASE_TIMEFRAME = "THIS_MONTH";
  public static final String DEFAULT_FUNNEL_TIMEFRAME = "THIS_QUARTER";
  public static final String DEFAULT_CONVERSION_STAGE = "Opportunity";

  private static final int GROUP_ROW_CAP = 200;
  private static final int TOP_OWNERS = 10;
  private static final int TOP_OPPORTUNITIES = 20;

  private final SalesforceTransport transport;

  public BusinessInsights(SalesforceTransport transport) {
    this.transport = transport;
  }

  /**
   * Open pipeline by stage, win/loss of closed deals and stage counts for deals closing in
   * the timeframe.
   *
   * @param timeframe SOQL date literal, e.g. {@code THIS_QUARTER}
   * @param ownerId optional owner to restrict to
   * @param includeForecast whether to add total and expected revenue of open deals
   */
  public Map<String, Object> pipeline(String timeframe, @Nullable String ownerId,
      boolean includeForecast) throws IOException {
    String period = SOQLLiterals.dateLiteral(timeframe);
    String ownerFilter = ownerId == null || ownerId.isEmpty()
        ? ""
        : " AND " + SOQLBuilder.equalsPredicate("OwnerId", ownerId);

    QuerySpec stages = QuerySpec.builder("Opportunity")
        .groupBy("StageName")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "RecordCount"))
        .aggregate(AggregateSpec.of(AggregateFunction.SUM, "Amount", "TotalValue"))
        .aggregate(AggregateSpec.of(AggregateFunction.AVG, "Amount", "AvgDealSize"))
        .aggregate(AggregateSpec.of(AggregateFunction.AVG, "Probability", "AvgProbability"))
        .where("CloseDate >= " + period + " AND IsClosed = false" + ownerFilter)
        .orderBy("SUM(Amount) DESC")
        .limit(GROUP_ROW_CAP)
        .build();

    QuerySpec winLoss = QuerySpec.builder("Opportunity")
        .groupBy("IsWon")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "Count"))
        .aggregate(AggregateSpec.of(AggregateFunction.SUM, "Amount", "Value"))
        .where("CloseDate = " + period + " AND IsClosed = true" + ownerFilter)
        .limit(GROUP_ROW_CAP)
        .build();

    QuerySpec stageCounts = QuerySpec.builder("Opportunity")
        .groupBy("StageName")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "OppsInStage"))
        .where("CloseDate >= " + period + ownerFilter)
        .limit(GROUP_ROW_CAP)
        .build();

    List<Map<String, Object>> stageRows = run(stages);
    List<Map<String, Object>> winLossRows = run(winLoss);
    List<Map<String, Object>> stageCountRows = run(stageCounts);

    Object forecast = null;
    if (includeForecast) {
      QuerySpec forecastSpec = QuerySpec.builder("Opportunity")
          .aggregate(AggregateSpec.of(AggregateFunction.SUM, "Amount", "TotalValue"))
          .aggregate(AggregateSpec.of(AggregateFunction.SUM, "ExpectedRevenue", "ForecastAmount"))
          .where("CloseDate = " + period + " AND IsClosed = false" + ownerFilter)
          .limit(1)
          .build();
      try {
        List<Map<String, Object>> rows = run(forecastSpec);
        forecast = rows.isEmpty() ? null : rows.get(0);
      } catch (IOException e) {
        LOGGER.warn("Forecast query failed: {}", e.getMessage());
        Map<String, Object> unavailable = new LinkedHashMap<>();
        unavailable.put("error", "Forecasting data not available");
        forecast = unavailable;
      }
    }

    double totalValue = 0;
    long totalOpportunities = 0;
    for (Map<String, Object> row : stageRows) {
      totalValue += Records.number(row, "TotalValue");
      totalOpportunities += (long) Records.number(row, "RecordCount");
    }

    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("totalPipelineValue", totalValue);
    summary.put("totalOpportunities", totalOpportunities);
    summary.put("stageBreakdown", stageRows);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("timeframe", period);
    result.put("ownerId", ownerId);
    result.put("summary", summary);
    result.put("winLossAnalysis", winLossRows);
    result.put("conversionRates", stageCountRows);
    result.put("forecasting", forecast);
    return result;
  }

  /**
   * Case volume by status and priority, total count, account-type breakdown and the
   * busiest owners for cases created in the timeframe.
   */
  public Map<String, Object> caseInsights(String timeframe, @Nullable String priority,
      @Nullable String status) throws IOException {
    String period = SOQLLiterals.dateLiteral(timeframe);
    StringBuilder filters = new StringBuilder("CreatedDate = ").append(period);
    if (priority != null && !priority.isEmpty()) {
      filters.append(" AND ").append(SOQLBuilder.equalsPredicate("Priority", priority));
    }
    if (status != null && !status.isEmpty()) {
      filters.append(" AND ").append(SOQLBuilder.equalsPredicate("Status", status));
    }

    QuerySpec volume = QuerySpec.builder("Case")
        .groupBy("Status, Priority")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "CaseCount"))
        .where(filters.toString())
        .orderBy("Priority, Status")
        .limit(GROUP_ROW_CAP)
        .build();

    QuerySpec total = QuerySpec.builder("Case")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "TotalCases"))
        .where(filters.toString())
        .limit(1)
        .build();

    QuerySpec channels = QuerySpec.builder("Case")
        .groupBy("Account.Type")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "CaseCount"))
        .where(filters + " AND Account.Type != null")
        .orderBy("COUNT(Id) DESC")
        .limit(GROUP_ROW_CAP)
        .build();

    QuerySpec owners = QuerySpec.builder("Case")
        .groupBy("Owner.Name")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "CasesHandled"))
        .where(filters.toString())
        .orderBy("COUNT(Id) DESC")
        .limit(TOP_OWNERS)
        .build();

    List<Map<String, Object>> volumeRows = run(volume);
    List<Map<String, Object>> totalRows = run(total);
    List<Map<String, Object>> channelRows = run(channels);
    List<Map<String, Object>> ownerRows = run(owners);

    Map<String, Object> appliedFilters = new LinkedHashMap<>();
    appliedFilters.put("priority", priority);
    appliedFilters.put("status", status);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("timeframe", period);
    result.put("filters", appliedFilters);
    result.put("volumeMetrics", volumeRows);
    result.put("escalationMetrics",
        totalRows.isEmpty() ? new LinkedHashMap<String, Object>() : totalRows.get(0));
    result.put("channelBreakdown", channelRows);
    result.put("ownerPerformance", ownerRows);
    return result;
  }

  /**
   * Lead volume, per-source conversion rates, rating breakdown and the largest converted
   * opportunities for leads created in the timeframe.
   *
   * @param source optional lead source to restrict to
   * @param conversionStage echoed back; conversion is measured by {@code IsConverted}
   */
  public Map<String, Object> leadFunnel(@Nullable String source, String timeframe,
      String conversionStage) throws IOException {
    String period = SOQLLiterals.dateLiteral(timeframe);
    String sourceFilter = source == null || source.isEmpty()
        ? ""
        : " AND " + SOQLBuilder.equalsPredicate("LeadSource", source);
    String created = "CreatedDate = " + period;

    QuerySpec volume = QuerySpec.builder("Lead")
        .groupBy("LeadSource, Status")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "LeadCount"))
        .where(created + sourceFilter)
        .orderBy("LeadSource, Status")
        .limit(GROUP_ROW_CAP)
        .build();

    QuerySpec totals = QuerySpec.builder("Lead")
        .groupBy("LeadSource")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "TotalLeads"))
        .where(created + sourceFilter)
        .orderBy("COUNT(Id) DESC")
        .limit(GROUP_ROW_CAP)
        .build();

    QuerySpec converted = QuerySpec.builder("Lead")
        .groupBy("LeadSource")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "ConvertedLeads"))
        .where(created + " AND IsConverted = true" + sourceFilter)
        .limit(GROUP_ROW_CAP)
        .build();

    QuerySpec quality = QuerySpec.builder("Lead")
        .groupBy("LeadSource, Rating")
        .aggregate(AggregateSpec.of(AggregateFunction.COUNT, "Id", "Count"))
        .where(created + " AND Rating != null" + sourceFilter)
        .orderBy("LeadSource, Rating")
        .limit(GROUP_ROW_CAP)
        .build();

    String topOpportunities = SOQLBuilder.buildSelectQuery("Lead",
        ImmutableList.of("ConvertedAccount.Name", "ConvertedOpportunity.Amount",
            "ConvertedOpportunity.StageName", "ConvertedOpportunity.CloseDate", "LeadSource"),
        created + " AND IsConverted = true AND ConvertedOpportunityId != null" + sourceFilter,
        "ConvertedOpportunity.Amount DESC NULLS LAST",
        TOP_OPPORTUNITIES);

    List<Map<String, Object>> volumeRows = run(volume);
    List<Map<String, Object>> totalRows = run(totals);
    List<Map<String, Object>> convertedRows = run(converted);
    List<Map<String, Object>> qualityRows = run(quality);
    List<Map<String, Object>> opportunityRows = transport.query(topOpportunities).getRecords();

    Map<Object, Double> convertedBySource = new HashMap<>();
    for (Map<String, Object> row : convertedRows) {
      convertedBySource.merge(row.get("LeadSource"), Records.number(row, "ConvertedLeads"),
          Double::sum);
    }

    List<Map<String, Object>> funnel = new ArrayList<>();
    for (Map<String, Object> row : totalRows) {
      Object leadSource = row.get("LeadSource");
      double total = Records.number(row, "TotalLeads");
      double convertedCount = convertedBySource.getOrDefault(leadSource, 0d);

      Map<String, Object> metric = new LinkedHashMap<>();
      metric.put("source", leadSource);
      metric.put("totalLeads", (long) total);
      metric.put("convertedLeads", (long) convertedCount);
      metric.put("conversionRate",
          ConversionRate.format(ConversionRate.percent(convertedCount, total)));
      funnel.add(metric);
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("timeframe", period);
    result.put("sourceFilter", source);
    result.put("conversionStage", conversionStage);
    result.put("leadVolume", volumeRows);
    result.put("funnelMetrics", funnel);
    result.put("qualityAnalysis", qualityRows);
    result.put("topOpportunities", opportunityRows);
    return result;
  }

  private List<Map<String, Object>> run(QuerySpec spec) throws IOException {
    QueryResult result = transport.query(SOQLBuilder.buildAggregateQuery(spec));
    return AggregateRows.relabel(spec, result.getRecords());
  }
}
