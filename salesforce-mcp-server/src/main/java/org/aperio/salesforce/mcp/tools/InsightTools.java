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
import org.aperio.salesforce.analytics.BusinessInsights;

import com.google.gson.JsonElement;

import java.io.IOException;

/**
 * MCP tools for the canned business reports: pipeline, support cases and lead funnel.
 */
public class InsightTools {
  private final BusinessInsights insights;

  public InsightTools(SalesforceClient client) {
    this.insights = client.insights();
  }

  public JsonElement pipeline(String timeframe, String ownerId, boolean includeForecast)
      throws IOException {
    return JsonResults.tree(insights.pipeline(timeframe, ownerId, includeForecast));
  }

  public JsonElement caseInsights(String timeframe, String priority, String status)
      throws IOException {
    return JsonResults.tree(insights.caseInsights(timeframe, priority, status));
  }

  public JsonElement leadFunnel(String source, String timeframe, String conversionStage)
      throws IOException {
    return JsonResults.tree(insights.leadFunnel(source, timeframe, conversionStage));
  }
}
