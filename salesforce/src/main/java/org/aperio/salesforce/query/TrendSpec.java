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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A {@link QuerySpec} bucketed over time.
 *
 * <p>The lookback is turned into an absolute start date at build time, so a built instance
 * renders the same query however late it is rendered. The row cap inherited from
 * {@link QuerySpec} is ignored by {@link SOQLBuilder#buildTrendQuery}, which always caps a
 * series at {@value SOQLBuilder#TREND_ROW_CAP} rows.
 */
public class TrendSpec extends QuerySpec {
  public static final String DEFAULT_DATE_FIELD = "CreatedDate";
  public static final int DEFAULT_LOOKBACK = 6;

  private final String dateField;
  private final TrendPeriod period;
  private final int lookback;
  private final LocalDate startDate;

  private TrendSpec(Builder builder, List<AggregateSpec> metrics, LocalDate startDate) {
    super(builder.objectName, metrics, null, builder.where, null, builder.limit);
    this.dateField = builder.dateField;
    this.period = builder.period;
    this.lookback = builder.lookback;
    this.startDate = startDate;
  }

  public static Builder trendBuilder(String objectName) {
    return new Builder(objectName);
  }

  public String getDateField() {
    return dateField;
  }

  public TrendPeriod getPeriod() {
    return period;
  }

  public int getLookback() {
    return lookback;
  }

  /** Inclusive lower bound of the window. */
  public LocalDate getStartDate() {
    return startDate;
  }

  @Override protected List<String> leadingExpressions() {
    return Arrays.asList(period.bucketExpressions(dateField));
  }

  /**
   * Builder for {@link TrendSpec}.
   */
  public static class Builder {
    private final String objectName;
    private final List<AggregateSpec> metrics = new ArrayList<>();
    private String dateField = DEFAULT_DATE_FIELD;
    private TrendPeriod period = TrendPeriod.MONTH;
    private int lookback = DEFAULT_LOOKBACK;
    private @Nullable String where;
    private int limit = SOQLBuilder.TREND_ROW_CAP;
    private Clock clock = Clock.systemDefaultZone();

    Builder(String objectName) {
      this.objectName = objectName;
    }

    public Builder dateField(@Nullable String dateField) {
      if (dateField != null && !dateField.trim().isEmpty()) {
        this.dateField = dateField.trim();
      }
      return this;
    }

    public Builder period(TrendPeriod period) {
      this.period = period;
      return this;
    }

    public Builder lookback(int lookback) {
      if (lookback <= 0) {
        throw new IllegalArgumentException("lookback must be positive: " + lookback);
      }
      this.lookback = lookback;
      return this;
    }

    public Builder metric(AggregateSpec metric) {
      metrics.add(metric);
      return this;
    }

    public Builder metrics(List<AggregateSpec> metrics) {
      this.metrics.addAll(metrics);
      return this;
    }

    /** Extra trusted predicate ANDed with the date window. */
    public Builder where(@Nullable String where) {
      this.where = where;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public TrendSpec build() {
      List<AggregateSpec> resolved = metrics.isEmpty()
          ? ImmutableList.of(AggregateSpec.countAll())
          : metrics;
      LocalDate start = period.startDate(LocalDate.now(clock), lookback);
      return new TrendSpec(this, resolved, start);
    }
  }
}
