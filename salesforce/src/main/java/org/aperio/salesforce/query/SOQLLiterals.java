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
package org.aperio.salesforce.query;

import java.util.regex.Pattern;

/**
 * Escaping and validation for values embedded in SOQL and SOSL text.
 */
public final class SOQLLiterals {
  private static final Pattern DATE_LITERAL =
      Pattern.compile("[A-Z][A-Z_]*(:\\d+)?|\\d{4}-\\d{2}-\\d{2}");
  private static final String SOSL_RESERVED = "?&|!{}[]()^~*:\\\"'+-";

  private SOQLLiterals() {
  }

  /** Escapes backslashes and single quotes for use inside a quoted SOQL string. */
  public static String escape(String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  /** Returns {@code value} as a quoted SOQL string literal. */
  public static String quote(String value) {
    return "'" + escape(value) + "'";
  }

  /**
   * Escapes a term for a LIKE pattern so that {@code %} and {@code _} in the term match
   * literally.
   */
  public static String escapeLike(String value) {
    return escape(value).replace("%", "\\%").replace("_", "\\_");
  }

  /** Escapes SOSL reserved characters for use inside {@code FIND {...}}. */
  public static String escapeSosl(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      if (SOSL_RESERVED.indexOf(c) >= 0) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }

  /**
   * Checks a date literal such as {@code THIS_QUARTER}, {@code LAST_N_DAYS:30} or
   * {@code 2024-01-31}.
   *
   * @return the literal, trimmed
   * @throws IllegalArgumentException if it is not a date literal
   */
  public static String dateLiteral(String value) {
    String trimmed = value.trim();
    if (!DATE_LITERAL.matcher(trimmed).matches()) {
      throw new IllegalArgumentException("Not a SOQL date literal: " + value);
    }
    return trimmed;
  }
}
