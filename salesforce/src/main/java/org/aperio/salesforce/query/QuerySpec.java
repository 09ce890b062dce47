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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured description of an aggregate SOQL query.
 *
 * <p>The WHERE predicate is trusted text and is emitted verbatim. The row cap is always
 * present and always rendered as the last clause.
 */
public class QuerySpec {
  public static final int DEFAULT_LIMIT = 100;

  private final String objectName;
  private final List<AggregateSpec> aggregates;
  private final @Nullable String groupBy;
  private final @Nullable String where;
  private final @Nullable String orderBy;
  private final int limit;

  protected QuerySpec(String objectName, List<AggregateSpec> aggregates,
      @Nullable String groupBy, @Nullable String where, @Nullable String orderBy, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    this.objectName = Objects.requireNonNull(objectName, "objectName");
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.groupBy = emptyToNull(groupBy);
    this.where = emptyToNull(where);
    this.orderBy = emptyToNull(orderBy);
    this.limit = limit;
  }

  public static Builder builder(String objectName) {
    return new Builder(objectName);
  }

  public String getObjectName() {
    return objectName;
  }

  public List<AggregateSpec> getAggregates() {
    return aggregates;
  }

  public @Nullable String getGroupBy() {
    return groupBy;
  }

  public @Nullable String getWhere() {
    return where;
  }

  public @Nullable String getOrderBy() {
    return orderBy;
  }

  public int getLimit() {
    return limit;
  }

  /**
   * Keys under which the platform reports each aggregate, in declaration order: the alias
   * for aliased aggregates, {@code exprN} for bare ones. The platform numbers every
   * unaliased select item, so function expressions ahead of the aggregates (such as
   * {@code CALENDAR_YEAR(CloseDate)}) take the first numbers.
   */
  public List<String> resultKeys() {
    int expr = 0;
    for (String expression : leadingExpressions()) {
      if (expression.contains("(")) {
        expr++;
      }
    }
    List<String> keys = new ArrayList<>(aggregates.size());
    for (AggregateSpec aggregate : aggregates) {
      keys.add(aggregate.isBareCount() ? "expr" + expr++ : aggregate.getAlias());
    }
    return keys;
  }

  /** Select items rendered before the aggregates. */
  protected List<String> leadingExpressions() {
    if (groupBy == null) {
      return ImmutableList.of();
    }
    List<String> items = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < groupBy.length(); i++) {
      char c = groupBy.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == ',' && depth == 0) {
        items.add(groupBy.substring(start, i).trim());
        start = i + 1;
      }
    }
    items.add(groupBy.substring(start).trim());
    return items;
  }

  static @Nullable String emptyToNull(@Nullable String value) {
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  /**
   * Builder for {@link QuerySpec}.
   */
  public static class Builder {
    private final String objectName;
    private final List<AggregateSpec> aggregates = new ArrayList<>();
    private @Nullable String groupBy;
    private @Nullable String where;
    private @Nullable String orderBy;
    private int limit = DEFAULT_LIMIT;

    Builder(String objectName) {
      this.objectName = objectName;
    }

    public Builder aggregate(AggregateSpec aggregate) {
      aggregates.add(aggregate);
      return this;
    }

    public Builder aggregates(List<AggregateSpec> aggregates) {
      this.aggregates.addAll(aggregates);
      return this;
    }

    public Builder groupBy(@Nullable String groupBy) {
      this.groupBy = groupBy;
      return this;
    }

    public Builder where(@Nullable String where) {
      this.where = where;
      return this;
    }

    public Builder orderBy(@Nullable String orderBy) {
      this.orderBy = orderBy;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public QuerySpec build() {
      return new QuerySpec(objectName, aggregates, groupBy, where, orderBy, limit);
    }
  }
}
