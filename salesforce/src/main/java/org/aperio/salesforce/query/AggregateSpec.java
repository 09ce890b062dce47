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

import java.util.Map;
import java.util.Objects;

/**
 * One aggregate of a SOQL select list, e.g. {@code SUM(Amount) TotalValue}.
 *
 * <p>{@code COUNT(Id)} is always rendered bare, without an alias, even when one was
 * supplied; the platform then reports it as {@code expr0}, {@code expr1}, ... Every other
 * aggregate is rendered with its alias, which defaults to {@code FUNCTION_field}.
 */
public class AggregateSpec {
  private final AggregateFunction function;
  private final String field;
  private final @Nullable String explicitAlias;

  public AggregateSpec(AggregateFunction function, String field, @Nullable String alias) {
    this.function = Objects.requireNonNull(function, "function");
    this.field = Objects.requireNonNull(field, "field");
    this.explicitAlias = alias == null || alias.trim().isEmpty() ? null : alias.trim();
  }

  public static AggregateSpec of(AggregateFunction function, String field) {
    return new AggregateSpec(function, field, null);
  }

  public static AggregateSpec of(AggregateFunction function, String field, String alias) {
    return new AggregateSpec(function, field, alias);
  }

  /** {@code COUNT(Id)}. */
  public static AggregateSpec countAll() {
    return new AggregateSpec(AggregateFunction.COUNT, ObjectSchema.IDENTITY_FIELD, null);
  }

  /**
   * Reads a spec from tool arguments: {@code function} (default COUNT), {@code field}
   * (default Id) and an optional {@code alias}.
   */
  public static AggregateSpec fromMap(Map<String, ?> map) {
    Object function = map.get("function");
    Object field = map.get("field");
    Object alias = map.get("alias");
    return new AggregateSpec(
        AggregateFunction.parse(function == null ? null : function.toString()),
        field == null ? ObjectSchema.IDENTITY_FIELD : field.toString(),
        alias == null ? null : alias.toString());
  }

  public AggregateFunction getFunction() {
    return function;
  }

  public String getField() {
    return field;
  }

  /** Alias exactly as supplied, null when none was. */
  public @Nullable String getExplicitAlias() {
    return explicitAlias;
  }

  /** Whether this is COUNT over the identity field, which never carries an alias. */
  public boolean isBareCount() {
    return function == AggregateFunction.COUNT
        && ObjectSchema.IDENTITY_FIELD.equals(field);
  }

  /**
   * Alias used when rendering: the supplied one, or {@code FUNCTION_field}. Dots of
   * relationship paths become underscores since aliases must be plain identifiers.
   */
  public String getAlias() {
    if (explicitAlias != null) {
      return explicitAlias;
    }
    return function.name() + "_" + field.replace('.', '_');
  }

  /** Renders the select-list item. */
  public String render() {
    if (isBareCount()) {
      return "COUNT(Id)";
    }
    return function.name() + "(" + field + ") " + getAlias();
  }

  @Override public String toString() {
    return render();
  }
}
