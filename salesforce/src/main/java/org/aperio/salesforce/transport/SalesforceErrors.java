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

import org.aperio.salesforce.AuthExpiredException;
import org.aperio.salesforce.RemoteApiException;
import org.aperio.salesforce.SalesforceException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps HTTP error responses to the exception taxonomy.
 *
 * <p>The platform reports failures as a JSON list:
 * <pre>
 * [{"message": "Session expired or invalid", "errorCode": "INVALID_SESSION_ID"}]
 * </pre>
 * Status 401 with {@code INVALID_SESSION_ID} becomes {@link AuthExpiredException}; every
 * other status of 400 or above becomes {@link RemoteApiException}.
 */
public final class SalesforceErrors {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SalesforceErrors() {
  }

  /**
   * Classifies a response.
   *
   * @param statusCode HTTP status
   * @param body response body, possibly empty
   * @return the exception to throw, or null if the status is not an error
   */
  public static @Nullable SalesforceException classify(int statusCode, @Nullable String body) {
    if (statusCode < 400) {
      return null;
    }
    String text = body == null ? "" : body;
    JsonNode json = parse(text);

    List<String> messages = new ArrayList<>();
    String firstErrorCode = null;
    if (json != null && json.isArray()) {
      for (JsonNode error : json) {
        String errorCode = error.path("errorCode").asText(null);
        if (statusCode == 401 && AuthExpiredException.INVALID_SESSION_ID.equals(errorCode)) {
          return new AuthExpiredException();
        }
        if (firstErrorCode == null) {
          firstErrorCode = errorCode;
        }
        messages.add(error.has("message") ? error.get("message").asText() : error.toString());
      }
    }

    String detail;
    if (!messages.isEmpty()) {
      detail = String.join(", ", messages);
    } else if (json != null) {
      detail = json.toString();
    } else {
      detail = text;
    }
    return new RemoteApiException(statusCode, firstErrorCode, "Salesforce API Error: " + detail);
  }

  private static @Nullable JsonNode parse(String text) {
    if (text.trim().isEmpty()) {
      return null;
    }
    try {
      return MAPPER.readTree(text);
    } catch (IOException e) {
      return null;
    }
  }
}
