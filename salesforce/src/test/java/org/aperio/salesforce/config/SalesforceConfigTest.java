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
package org.aperio.salesforce.config;

import org.aperio.salesforce.SalesforceConfigurationException;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SalesforceConfig}.
 */
@Tag("unit")
public class SalesforceConfigTest {
  private static final String URL = "https://acme.my.salesforce.com/services/data/v59.0";

  @Test
  public void testFromMap() {
    SalesforceConfig config = SalesforceConfig.fromMap(ImmutableMap.of(
        SalesforceConfig.BASE_URL, URL + "/",
        SalesforceConfig.ACCESS_TOKEN, " 00Dxx!token ",
        SalesforceConfig.TIMEOUT_SECONDS, "45"));

    assertThat(config.getBaseUrl(), equalTo(URL));
    assertThat(config.getAccessToken(), equalTo("00Dxx!token"));
    assertThat(config.getTimeout(), equalTo(Duration.ofSeconds(45)));
  }

  @Test
  public void testSessionIdStandsInForToken() {
    SalesforceConfig config = SalesforceConfig.fromMap(ImmutableMap.of(
        SalesforceConfig.BASE_URL, URL,
        SalesforceConfig.SESSION_ID, "sid"));

    assertThat(config.getAccessToken(), equalTo("sid"));
    assertThat(config.getTimeout(), equalTo(SalesforceConfig.DEFAULT_TIMEOUT));
  }

  @Test
  public void testMissingToken() {
    SalesforceConfigurationException e = assertThrows(SalesforceConfigurationException.class,
        () -> SalesforceConfig.fromMap(ImmutableMap.of(SalesforceConfig.BASE_URL, URL)));
    assertThat(e.getMessage(), containsString(SalesforceConfig.ACCESS_TOKEN));
  }

  @Test
  public void testNonHttpUrl() {
    assertThrows(SalesforceConfigurationException.class,
        () -> SalesforceConfig.builder().baseUrl("ftp://example.com").accessToken("t").build());
  }

  @Test
  public void testBadTimeout() {
    assertThrows(SalesforceConfigurationException.class,
        () -> SalesforceConfig.fromMap(ImmutableMap.of(
            SalesforceConfig.BASE_URL, URL,
            SalesforceConfig.ACCESS_TOKEN, "t",
            SalesforceConfig.TIMEOUT_SECONDS, "soon")));
    assertThrows(SalesforceConfigurationException.class,
        () -> SalesforceConfig.builder().baseUrl(URL).accessToken("t")
            .timeout(Duration.ZERO).build());
  }

  @Test
  public void testNullTimeout() {
    assertThrows(SalesforceConfigurationException.class,
        () -> SalesforceConfig.builder().baseUrl(URL).accessToken("t").timeout(null).build());
  }

  @Test
  public void testBuildLeavesBuilderReusable() {
    SalesforceConfig.Builder builder = SalesforceConfig.builder()
        .baseUrl(" " + URL + " ")
        .accessToken(" first ");
    SalesforceConfig first = builder.build();
    SalesforceConfig second = builder.accessToken(" second ").build();

    assertThat(first.getAccessToken(), equalTo("first"));
    assertThat(second.getAccessToken(), equalTo("second"));
    assertThat(second.getBaseUrl(), equalTo(URL));
  }

  @Test
  public void testFileOverlaysEnvironment(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("salesforce.properties");
    Files.write(file, ("SALESFORCE_ACCESS_TOKEN=from-file\n"
        + "SALESFORCE_TIMEOUT_SECONDS=10\n").getBytes(StandardCharsets.UTF_8));

    SalesforceConfig config = SalesforceConfig.load(file, ImmutableMap.of(
        SalesforceConfig.BASE_URL, URL,
        SalesforceConfig.ACCESS_TOKEN, "from-env"));

    assertThat(config.getAccessToken(), equalTo("from-file"));
    assertThat(config.getBaseUrl(), equalTo(URL));
    assertThat(config.getTimeout(), equalTo(Duration.ofSeconds(10)));
  }

  @Test
  public void testUnreadableFile(@TempDir Path dir) {
    assertThrows(SalesforceConfigurationException.class,
        () -> SalesforceConfig.load(dir.resolve("missing.properties"), ImmutableMap.of()));
  }

  @Test
  public void testToStringHidesToken() {
    SalesforceConfig config = SalesforceConfig.builder().baseUrl(URL).accessToken("secret")
        .build();

    assertThat(config.toString(), not(containsString("secret")));
  }
}
