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
package org.aperio.salesforce.navigation;

import org.aperio.salesforce.schema.FieldDescriptor;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a navigation call.
 *
 * <p>Walking {@link Direction#UP up} yields the start record with the values of its parent
 * reference fields. Walking {@link Direction#DOWN down} yields, per relationship alias, a
 * bounded list of child records. Results are handed to the caller and not retained.
 */
public class NavigationResult {

  /** Which way a navigation walked. */
  public enum Direction {
    UP,
    DOWN
  }

  private final Direction direction;
  private final @Nullable Map<String, Object> record;
  private final List<FieldDescriptor> parentFields;
  private final Map<String, List<Map<String, Object>>> children;

  private NavigationResult(Direction direction, @Nullable Map<String, Object> record,
      List<FieldDescriptor> parentFields, Map<String, List<Map<String, Object>>> children) {
    this.direction = direction;
    this.record = record;
    this.parentFields = ImmutableList.copyOf(parentFields);
    this.children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
  }

  /**
   * Result of walking to parents.
   *
   * @param record matched record, null when the object has no parent reference fields
   * @param parentFields reference fields that were selected
   */
  public static NavigationResult up(@Nullable Map<String, Object> record,
      List<FieldDescriptor> parentFields) {
    return new NavigationResult(Direction.UP, record, parentFields,
        Collections.emptyMap());
  }

  /** Result of walking to children, keyed by relationship alias in discovery order. */
  public static NavigationResult down(Map<String, List<Map<String, Object>>> children) {
    return new NavigationResult(Direction.DOWN, null, ImmutableList.of(), children);
  }

  public Direction getDirection() {
    return direction;
  }

  public @Nullable Map<String, Object> getRecord() {
    return record;
  }

  public List<FieldDescriptor> getParentFields() {
    return parentFields;
  }

  public Map<String, List<Map<String, Object>>> getChildren() {
    return children;
  }
}
