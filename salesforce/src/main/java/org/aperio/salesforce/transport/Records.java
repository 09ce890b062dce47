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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Helpers for record maps returned by the API.
 */
public final class Records {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> RECORD_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private Records() {
  }

  /** Converts a JSON array of records; anything else yields an empty list. */
  public static List<Map<String, Object>> fromJson(@Nullable JsonNode array) {
    List<Map<String, Object>> records = new ArrayList<>();
    if (array != null && array.isArray()) {
      for (JsonNode node : array) {
        records.add(MAPPER.convertValue(node, RECORD_TYPE));
      }
    }
    return records;
  }

  /**
   * Reads a numeric field, treating null, missing and non-numeric values as zero.
   * Aggregate results over empty groups come back as null.
   */
  public static double number(Map<String, Object> record, String key) {
    Object value = record.get(key);
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      try {
        return Double.parseDouble((String) value);
      } catch (NumberFormatException e) {
        return 0d;
      }
    }
    return 0d;
  }
}
