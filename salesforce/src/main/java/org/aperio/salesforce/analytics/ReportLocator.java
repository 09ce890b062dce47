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

import org.aperio.salesforce.RecordNotFoundException;
import org.aperio.salesforce.query.SOQLBuilder;
import org.aperio.salesforce.query.SOQLLiterals;
import org.aperio.salesforce.transport.SalesforceTransport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Finds saved reports and reads their metadata.
 */
public class ReportLocator {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReportLocator.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Pattern RECORD_ID = Pattern.compile("[A-Za-z0-9]{15}([A-Za-z0-9]{3})?");

  private static final int NAME_MATCH_CAP = 10;
  private static final int RECENT_REPORT_CAP = 20;

  private final SalesforceTransport transport;

  public ReportLocator(SalesforceTransport transport) {
    this.transport = transport;
  }

  /**
   * Resolves a report.
   *
   * <ul>
   *   <li>Neither argument: lists reports that have been run, most recent first.</li>
   *   <li>Name only: matches Name or DeveloperName; several matches are returned as
   *   candidates instead of picking one.</li>
   *   <li>Id (given or resolved): reads the analytics API metadata, falling back to the
   *   Report record when that API is not reachable.</li>
   * </ul>
   *
   * @throws RecordNotFoundException if no report matches the name
   * @throws IllegalArgumentException if the id is not a record id
   */
  public Map<String, Object> find(@Nullable String reportId, @Nullable String reportName)
      throws IOException {
    String targetId = isBlank(reportId) ? null : reportId.trim();
    Map<String, Object> result = new LinkedHashMap<>();

    if (targetId == null && !isBlank(reportName)) {
      String pattern = "'%" + SOQLLiterals.escapeLike(reportName.trim()) + "%'";
      String soql = SOQLBuilder.buildSelectQuery("Report",
          ImmutableList.of("Id", "Name", "DeveloperName"),
          "Name LIKE " + pattern + " OR DeveloperName LIKE " + pattern, null, NAME_MATCH_CAP);
      List<Map<String, Object>> matches = transport.query(soql).getRecords();

      if (matches.isEmpty()) {
        throw new RecordNotFoundException("No reports found matching: " + reportName);
      }
      if (matches.size() > 1) {
        List<Map<String, Object>> candidates = new ArrayList<>();
        for (Map<String, Object> match : matches) {
          Map<String, Object> candidate = new LinkedHashMap<>();
          candidate.put("id", match.get("Id"));
          candidate.put("name", match.get("Name"));
          candidate.put("developerName", match.get("DeveloperName"));
          candidates.add(candidate);
        }
        result.put("message",
            "Multiple reports found. Please specify reportId or be more specific.");
        result.put("availableReports", candidates);
        return result;
      }
      targetId = String.valueOf(matches.get(0).get("Id"));
    }

    if (targetId == null) {
      String soql = SOQLBuilder.buildSelectQuery("Report",
          ImmutableList.of("Id", "Name", "DeveloperName", "LastRunDate"),
          "LastRunDate != null", "LastRunDate DESC", RECENT_REPORT_CAP);
      result.put("message", "Available reports in your org:");
      result.put("reports", transport.query(soql).getRecords());
      return result;
    }

    if (!RECORD_ID.matcher(targetId).matches()) {
      throw new IllegalArgumentException("Not a report id: " + targetId);
    }

    try {
      JsonNode metadata = transport.get("/analytics/reports/" + targetId);
      result.put("reportId", targetId);
      result.put("metadata", MAPPER.convertValue(metadata, Object.class));
      return result;
    } catch (IOException e) {
      LOGGER.debug("Analytics API unavailable for report {}: {}", targetId, e.getMessage());
    }

    String soql = SOQLBuilder.buildSelectQuery("Report",
        ImmutableList.of("Id", "Name", "DeveloperName", "Description", "LastRunDate"),
        SOQLBuilder.equalsPredicate("Id", targetId), null, 1);
    List<Map<String, Object>> records = transport.query(soql).getRecords();
    result.put("message", "Report found but analytics API access may be limited");
    result.put("report", records.isEmpty() ? null : records.get(0));
    return result;
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.trim().isEmpty();
  }
}
