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

import java.time.LocalDate;
import java.util.Locale;

/**
 * Bucket size of a trend series.
 */
public enum TrendPeriod {
  /** Buckets by calendar year and day of month. */
  DAY("DAY_IN_MONTH"),
  /** Buckets by calendar year and week of year. */
  WEEK("WEEK_IN_YEAR"),
  /** Buckets by calendar year and month. */
  MONTH("CALENDAR_MONTH");

  private final String innerFunction;

  TrendPeriod(String innerFunction) {
    this.innerFunction = innerFunction;
  }

  /** Parses {@code day}, {@code week} or {@code month}; null means {@link #MONTH}. */
  public static TrendPeriod parse(@Nullable String name) {
    if (name == null || name.trim().isEmpty()) {
      return MONTH;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unsupported period: " + name + " (expected day, week or month)", e);
    }
  }

  /** Date functions that form the bucket, outermost first. */
  public String[] bucketExpressions(String dateField) {
    return new String[] {
        "CALENDAR_YEAR(" + dateField + ")",
        innerFunction + "(" + dateField + ")"
    };
  }

  /**
   * First day of a window reaching {@code lookback} periods back from {@code today}.
   * A month counts as 30 days.
   */
  public LocalDate startDate(LocalDate today, int lookback) {
    switch (this) {
    case MONTH:
      return today.minusDays(lookback * 30L);
    case WEEK:
      return today.minusWeeks(lookback);
    default:
      return today.minusDays(lookback);
    }
  }
}
