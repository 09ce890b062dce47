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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Connection settings for the Salesforce REST API.
 *
 * <p>Settings are usually read from the process environment:
 * <ul>
 *   <li>{@code SALESFORCE_BASE_URL}: REST base, e.g.
 *       {@code https://example.my.salesforce.com/services/data/v58.0}</li>
 *   <li>{@code SALESFORCE_ACCESS_TOKEN} (or {@code SALESFORCE_SID}): bearer token</li>
 *   <li>{@code SALESFORCE_TIMEOUT_SECONDS}: connect and request timeout, default 30</li>
 * </ul>
 *
 * <p>A properties file using the same keys may overlay the environment, see
 * {@link #load(Path, Map)}.
 */
public final class SalesforceConfig {
  public static final String BASE_URL = "SALESFORCE_BASE_URL";
  public static final String ACCESS_TOKEN = "SALESFORCE_ACCESS_TOKEN";
  public static final String SESSION_ID = "SALESFORCE_SID";
  public static final String TIMEOUT_SECONDS = "SALESFORCE_TIMEOUT_SECONDS";

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final String baseUrl;
  private final String accessToken;
  private final Duration timeout;

  private SalesforceConfig(String baseUrl, String accessToken, Duration timeout) {
    this.baseUrl = stripTrailingSlash(baseUrl);
    this.accessToken = accessToken;
    this.timeout = timeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads settings from a key/value map using the environment variable names.
   *
   * @throws SalesforceConfigurationException if base URL or token is missing
   */
  public static SalesforceConfig fromMap(Map<String, String> values) {
    Builder builder = builder()
        .baseUrl(values.get(BASE_URL))
        .accessToken(firstNonEmpty(values.get(ACCESS_TOKEN), values.get(SESSION_ID)));

    String timeout = values.get(TIMEOUT_SECONDS);
    if (timeout != null && !timeout.trim().isEmpty()) {
      try {
        builder.timeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
      } catch (NumberFormatException e) {
        throw new SalesforceConfigurationException(
            TIMEOUT_SECONDS + " must be a whole number of seconds: " + timeout, e);
      }
    }
    return builder.build();
  }

  public static SalesforceConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  /**
   * Reads settings from the given environment, overlaid by a properties file when one is given.
   *
   * @param propertiesFile optional file with the same keys as the environment
   * @param environment environment variables
   */
  public static SalesforceConfig load(@Nullable Path propertiesFile,
      Map<String, String> environment) {
    Map<String, String> values = new HashMap<>(environment);
    if (propertiesFile != null) {
      Properties properties = new Properties();
      try (InputStream in = Files.newInputStream(propertiesFile)) {
        properties.load(in);
      } catch (IOException e) {
        throw new SalesforceConfigurationException(
            "Cannot read configuration file " + propertiesFile, e);
      }
      for (String name : properties.stringPropertyNames()) {
        values.put(name, properties.getProperty(name).trim());
      }
    }
    return fromMap(values);
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public Duration getTimeout() {
    return timeout;
  }

  @Override public String toString() {
    // never print the token
    return "SalesforceConfig{baseUrl=" + baseUrl + ", timeout=" + timeout + "}";
  }

  private static @Nullable String firstNonEmpty(@Nullable String first, @Nullable String second) {
    if (first != null && !first.trim().isEmpty()) {
      return first;
    }
    return second;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  /**
   * Builder for {@link SalesforceConfig}.
   */
  public static class Builder {
    private @Nullable String baseUrl;
    private @Nullable String accessToken;
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;

    public Builder baseUrl(@Nullable String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder accessToken(@Nullable String accessToken) {
      this.accessToken = accessToken;
      return this;
    }

    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public SalesforceConfig build() {
      if (isBlank(baseUrl) || isBlank(accessToken)) {
        throw new SalesforceConfigurationException(
            "Missing required settings: " + BASE_URL + " and "
            + ACCESS_TOKEN + " (or " + SESSION_ID + ")");
      }
      String lower = baseUrl.trim().toLowerCase(Locale.ROOT);
      if (!lower.startsWith("https://") && !lower.startsWith("http://")) {
        throw new SalesforceConfigurationException(
            BASE_URL + " must be an http(s) URL: " + baseUrl);
      }
      if (timeout == null || timeout.isNegative() || timeout.isZero()) {
        throw new SalesforceConfigurationException(TIMEOUT_SECONDS + " must be positive");
      }
      return new SalesforceConfig(baseUrl.trim(), accessToken.trim(), timeout);
    }

    private static boolean isBlank(@Nullable String value) {
      return value == null || value.trim().isEmpty();
    }
  }
}
