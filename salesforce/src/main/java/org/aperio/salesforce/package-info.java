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
/**
 * Salesforce REST client used by the MCP server.
 *
 * <p>The package is organised leaf-first:
 * <ul>
 *   <li>{@code transport} issues SOQL, SOSL and record calls over HTTP and classifies failures;</li>
 *   <li>{@code schema} fetches and caches sObject describe metadata;</li>
 *   <li>{@code query} renders SOQL and SOSL text from structured specs;</li>
 *   <li>{@code navigation} walks parent and child relationships discovered at runtime;</li>
 *   <li>{@code search} resolves keyword lookups with a full-text first strategy;</li>
 *   <li>{@code analytics} composes the above into pipeline, case and funnel summaries.</li>
 * </ul>
 *
 * <p>{@link org.aperio.salesforce.SalesforceClient} wires the pieces together and is the handle
 * that callers construct once and pass down.
 */
package org.aperio.salesforce;
