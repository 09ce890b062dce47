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
package org.aperio.salesforce;

import org.aperio.salesforce.analytics.BusinessInsights;
import org.aperio.salesforce.analytics.ReportLocator;
import org.aperio.salesforce.config.SalesforceConfig;
import org.aperio.salesforce.navigation.NavigationResult;
import org.aperio.salesforce.navigation.RelationalNavigator;
import org.aperio.salesforce.query.QuerySpec;
import org.aperio.salesforce.query.SOQLBuilder;
import org.aperio.salesforce.query.TrendSpec;
import org.aperio.salesforce.schema.ObjectSchema;
import org.aperio.salesforce.schema.SchemaIntrospector;
import org.aperio.salesforce.search.SearchResolver;
import org.aperio.salesforce.search.SearchResult;
import org.aperio.salesforce.transport.HttpSalesforceTransport;
import org.aperio.salesforce.transport.QueryResult;
import org.aperio.salesforce.transport.SalesforceTransport;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Handle on one Salesforce org.
 *
 * <p>Owns the transport and the schema cache. Construct one per process and pass it to
 * whatever needs it; close it on shutdown.
 *
 * <pre>{@code
 * try (SalesforceClient client = new SalesforceClient(SalesforceConfig.fromEnvironment())) {
 *   QueryResult byStage = client.aggregate(
 *       QuerySpec.builder("Opportunity")
 *           .groupBy("StageName")
 *           .aggregate(AggregateSpec.countAll())
 *           .build());
 * }
 * }</pre>
 */
public class SalesforceClient implements AutoCloseable {
  private final SalesforceTransport transport;
  private final SchemaIntrospector introspector;
  private final RelationalNavigator navigator;
  private final SearchResolver searchResolver;
  private final BusinessInsights insights;
  private final ReportLocator reports;

  /**
   * Creates a client over HTTP.
   *
   * @throws SalesforceConfigurationException if the configuration is incomplete
   */
  public SalesforceClient(SalesforceConfig config) {
    this(new HttpSalesforceTransport(config));
  }

  public SalesforceClient(SalesforceTransport transport) {
    this.transport = transport;
    this.introspector = new SchemaIntrospector(transport);
    this.navigator = new RelationalNavigator(transport, introspector);
    this.searchResolver = new SearchResolver(transport);
    this.insights = new BusinessInsights(transport);
    this.reports = new ReportLocator(transport);
  }

  /** Raw access for record operations and ad-hoc SOQL/SOSL. */
  public SalesforceTransport transport() {
    return transport;
  }

  public BusinessInsights insights() {
    return insights;
  }

  public ReportLocator reports() {
    return reports;
  }

  public ObjectSchema describe(String objectName) throws IOException {
    return introspector.describe(objectName);
  }

  /** Runs {@link SOQLBuilder#buildAggregateQuery}. */
  public QueryResult aggregate(QuerySpec spec) throws IOException {
    return transport.query(SOQLBuilder.buildAggregateQuery(spec));
  }

  /** Runs {@link SOQLBuilder#buildTrendQuery}. */
  public QueryResult trend(TrendSpec spec) throws IOException {
    return transport.query(SOQLBuilder.buildTrendQuery(spec));
  }

  public NavigationResult navigateUp(String objectName, String recordId, int maxFields)
      throws IOException {
    return navigator.resolveParents(objectName, recordId, maxFields);
  }

  public NavigationResult navigateDown(String objectName, String recordId, int maxRelationships)
      throws IOException {
    return navigator.resolveChildren(objectName, recordId, maxRelationships);
  }

  public QueryResult navigateNamed(String objectName, String recordId, String relationshipName)
      throws IOException {
    return navigator.resolveNamedRelationship(objectName, recordId, relationshipName);
  }

  public NavigationResult related(String objectName, String recordId) throws IOException {
    return navigator.resolveRelated(objectName, recordId);
  }

  public SearchResult search(String objectName, String term, @Nullable List<String> fields,
      int limit) throws IOException {
    return searchResolver.lookup(objectName, term, fields, limit);
  }

  @Override public void close() {
    transport.close();
  }
}
