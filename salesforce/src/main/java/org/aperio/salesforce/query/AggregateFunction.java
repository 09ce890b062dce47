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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * SOQL aggregate functions.
 */
public enum AggregateFunction {
  COUNT,
  SUM,
  AVG,
  MAX,
  MIN;

  /**
   * Parses a function name case-insensitively; null means {@link #COUNT}.
   *
   * @throws IllegalArgumentException for names that are not aggregate functions
   */
  public static AggregateFunction parse(@Nullable String name) {
    if (name == null || name.trim().isEmpty()) {
      return COUNT;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported aggregate function: " + name, e);
    }
  }
}
