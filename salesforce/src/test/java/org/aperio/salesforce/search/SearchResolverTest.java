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

import org.aperio.salesforce.RemoteApiException;
import org.aperio.salesforce.transport.FakeTransport;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.InterruptedIOException;

import static org.aperio.salesforce.transport.FakeTransport.record;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SearchResolver}.
 */
@Tag("unit")
public class SearchResolverTest {

  @AfterEach
  public void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  public void testFullTextSearch() throws Exception {
    FakeTransport transport = new FakeTransport().onSearch("{\"searchRecords\": ["
        + "{\"attributes\": {\"type\": \"Contact\"}, \"Id\": \"003A\", \"Name\": \"John Smith\"}]}");

    SearchResult result = new SearchResolver(transport).lookup("Contact", "John");

    assertThat(result.getProvenance(), equalTo(SearchResult.Provenance.FULL_TEXT));
    assertThat(result.getRecords(), hasSize(1));
    assertThat(result.getRecords().get(0).get("Name"), equalTo("John Smith"));
    assertThat(result.getQuery(),
        equalTo("FIND {John*} IN ALL FIELDS RETURNING Contact(Id, Name) LIMIT 10"));
    assertThat(transport.queries, empty());
  }

  @Test
  public void testBareArrayResponse() throws Exception {
    FakeTransport transport = new FakeTransport()
        .onSearch("[{\"Id\": \"001A\", \"Name\": \"Acme\"}, {\"Id\": \"001B\", \"Name\": \"Acme EU\"}]");

    SearchResult result = new SearchResolver(transport).lookup("Account", "acme");

    assertThat(result.getRecords(), hasSize(2));
  }

  @Test
  public void testEmptyFullTextResultIsNotRetried() throws Exception {
    FakeTransport transport = new FakeTransport().onSearch("{\"searchRecords\": []}");

    SearchResult result = new SearchResolver(transport).lookup("Lead", "nobody");

    assertThat(result.getRecords(), empty());
    assertThat(result.getProvenance(), equalTo(SearchResult.Provenance.FULL_TEXT));
    assertThat(transport.queries, empty());
  }

  @Test
  public void testFallsBackToPatternQuery() throws Exception {
    FakeTransport transport = new FakeTransport()
        .failSearch(new RemoteApiException(400, "INVALID_SEARCH", "Salesforce API Error: bad"))
        .onQuery("FROM Contact", ImmutableList.of(
            record("Id", "003A", "Name", "John Smith", "Email", "john@example.com")));

    SearchResult result = new SearchResolver(transport).lookup("Contact", "john",
        ImmutableList.of("Name", "Email"), 5);

    assertThat(result.getProvenance(), equalTo(SearchResult.Provenance.FIELD_PATTERN));
    assertThat(result.getRecords(), hasSize(1));
    assertThat(transport.queries, contains("SELECT Id, Name, Email FROM Contact"
        + " WHERE Name LIKE '%john%' OR Email LIKE '%john%' LIMIT 5"));
    assertThat(result.getQuery(), equalTo(transport.queries.get(0)));
  }

  @Test
  public void testEmptyFieldListMeansName() throws Exception {
    FakeTransport transport = new FakeTransport();

    new SearchResolver(transport).lookup("Account", "acme", ImmutableList.of(), 3);

    assertThat(transport.searches,
        contains("FIND {acme*} IN ALL FIELDS RETURNING Account(Id, Name) LIMIT 3"));
  }

  @Test
  public void testFallbackFailurePropagates() {
    FakeTransport transport = new FakeTransport()
        .failSearch(new RemoteApiException(400, "INVALID_SEARCH", "Salesforce API Error: bad"))
        .failQuery("FROM Contact", new RemoteApiException(400, "INVALID_FIELD",
            "Salesforce API Error: No such column 'Nickname__c'"));

    RemoteApiException e = assertThrows(RemoteApiException.class,
        () -> new SearchResolver(transport).lookup("Contact", "jo",
            ImmutableList.of("Nickname__c"), 10));
    assertThat(e.getErrorCode(), equalTo("INVALID_FIELD"));
  }

  @Test
  public void testInterruptDuringFullTextIsNotFallenBackFrom() {
    FakeTransport transport = new FakeTransport().interruptSearch();

    assertThrows(InterruptedIOException.class,
        () -> new SearchResolver(transport).lookup("Contact", "John"));
    assertThat(Thread.currentThread().isInterrupted(), equalTo(true));
    assertThat(transport.queries, empty());
  }
}
