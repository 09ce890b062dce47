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
package org.aperio.salesforce.schema;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A child relationship of an sObject: rows of {@code childObject} whose {@code field}
 * points back at the parent.
 */
public class ChildRelationship {
  private final String childObject;
  private final String field;
  private final @Nullable String relationshipName;

  public ChildRelationship(String childObject, String field, @Nullable String relationshipName) {
    this.childObject = childObject;
    this.field = field;
    this.relationshipName = relationshipName;
  }

  public String getChildObject() {
    return childObject;
  }

  /** Foreign-key field on the child object. */
  public String getField() {
    return field;
  }

  public @Nullable String getRelationshipName() {
    return relationshipName;
  }

  /** Relationship name when the platform gives one, otherwise the child object name. */
  public String getAlias() {
    return relationshipName != null ? relationshipName : childObject;
  }

  @Override public String toString() {
    return getAlias() + "(" + childObject + "." + field + ")";
  }
}
