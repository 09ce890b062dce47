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

import org.aperio.salesforce.schema.ObjectSchema;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders SOQL and SOSL text.
 *
 * <p>All methods are pure: they do no I/O and, for well-formed specs, cannot fail.
 * Object and field names are emitted as given; values that originate from callers
 * (record ids, search terms) are escaped.
 */
public final class SOQLBuilder {
  /** Row cap of every trend series, whatever the caller asked for. */
  public static final int TREND_ROW_CAP = 50;

  private SOQLBuilder() {
  }

  /**
   * Renders an aggregate query:
   * {@code SELECT [groupBy, ]aggregates FROM object [WHERE ..] [GROUP BY ..] [ORDER BY ..] LIMIT n}.
   */
  public static String buildAggregateQuery(QuerySpec spec) {
    List<String> selectList = new ArrayList<>();
    if (spec.getGroupBy() != null) {
      selectList.add(spec.getGroupBy());
    }
    for (AggregateSpec aggregate : spec.getAggregates()) {
      selectList.add(aggregate.render());
    }

    StringBuilder soql = new StringBuilder();
    soql.append("SELECT ").append(String.join(", ", selectList));
    soql.append(" FROM ").append(spec.getObjectName());

    if (spec.getWhere() != null) {
      soql.append(" WHERE ").append(spec.getWhere());
    }

    if (spec.getGroupBy() != null) {
      soql.append(" GROUP BY ").append(spec.getGroupBy());
    }

    if (spec.getOrderBy() != null) {
      soql.append(" ORDER BY ").append(spec.getOrderBy());
    }

    soql.append(" LIMIT ").append(spec.getLimit());
    return soql.toString();
  }

  /**
   * Renders a time series: the metrics grouped by the period's bucket, restricted to
   * rows on or after the start date, newest bucket first, at most {@value #TREND_ROW_CAP}
   * rows.
   */
  public static String buildTrendQuery(TrendSpec spec) {
    String[] bucket = spec.getPeriod().bucketExpressions(spec.getDateField());
    String bucketList = String.join(", ", bucket);

    List<String> selectList = new ArrayList<>();
    selectList.add(bucketList);
    for (AggregateSpec metric : spec.getAggregates()) {
      selectList.add(metric.render());
    }

    String window = spec.getDateField() + " >= "
        + spec.getStartDate().format(DateTimeFormatter.ISO_LOCAL_DATE);

    List<String> descending = new ArrayList<>();
    for (String expression : bucket) {
      descending.add(expression + " DESC");
    }

    StringBuilder soql = new StringBuilder();
    soql.append("SELECT ").append(String.join(", ", selectList));
    soql.append(" FROM ").append(spec.getObjectName());
    soql.append(" WHERE ").append(window);
    if (spec.getWhere() != null) {
      soql.append(" AND (").append(spec.getWhere()).append(")");
    }
    soql.append(" GROUP BY ").append(bucketList);
    soql.append(" ORDER BY ").append(String.join(", ", descending));
    soql.append(" LIMIT ").append(TREND_ROW_CAP);
    return soql.toString();
  }

  /**
   * Renders a plain projection query.
   *
   * @param where trusted predicate, may be null
   * @param orderBy order expression, may be null
   */
  public static String buildSelectQuery(String objectName, List<String> fields,
      @Nullable String where, @Nullable String orderBy, int limit) {
    StringBuilder soql = new StringBuilder();
    soql.append("SELECT ").append(String.join(", ", fields));
    soql.append(" FROM ").append(objectName);
    if (where != null && !where.isEmpty()) {
      soql.append(" WHERE ").append(where);
    }
    if (orderBy != null && !orderBy.isEmpty()) {
      soql.append(" ORDER BY ").append(orderBy);
    }
    soql.append(" LIMIT ").append(limit);
    return soql.toString();
  }

  /** {@code field = 'value'} with the value escaped. */
  public static String equalsPredicate(String field, String value) {
    return field + " = " + SOQLLiterals.quote(value);
  }

  /**
   * Renders a SOSL prefix search over all fields, returning the identity field and
   * {@code fields} of one object.
   */
  public static String buildFullTextSearch(String objectName, String term, List<String> fields,
      int limit) {
    return "FIND {" + SOQLLiterals.escapeSosl(term) + "*} IN ALL FIELDS"
        + " RETURNING " + objectName + "(" + String.join(", ", withIdentity(fields)) + ")"
        + " LIMIT " + limit;
  }

  /**
   * Renders the pattern-match substitute for a full-text search: every field is tested
   * with {@code LIKE '%term%'} and the tests are ORed.
   */
  public static String buildPatternQuery(String objectName, String term, List<String> fields,
      int limit) {
    String pattern = "'%" + SOQLLiterals.escapeLike(term) + "%'";
    List<String> predicates = new ArrayList<>();
    for (String field : fields) {
      predicates.add(field + " LIKE " + pattern);
    }
    return buildSelectQuery(objectName, withIdentity(fields),
        String.join(" OR ", predicates), null, limit);
  }

  private static List<String> withIdentity(List<String> fields) {
    List<String> projection = new ArrayList<>();
    projection.add(ObjectSchema.IDENTITY_FIELD);
    for (String field : fields) {
      if (!ObjectSchema.IDENTITY_FIELD.equals(field)) {
        projection.add(field);
      }
    }
    return projection;
  }
}
