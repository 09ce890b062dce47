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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * One field of an sObject as reported by the describe call.
 */
public class FieldDescriptor {
  private final String name;
  private final FieldType type;
  private final String platformType;
  private final boolean nullable;
  private final boolean updatable;
  private final @Nullable String referenceTarget;
  private final List<String> picklistValues;

  public FieldDescriptor(String name, String platformType, boolean nullable, boolean updatable,
      @Nullable String referenceTarget, List<String> picklistValues) {
    this.name = name;
    this.platformType = platformType;
    this.type = FieldType.fromPlatformType(platformType);
    this.nullable = nullable;
    this.updatable = updatable;
    this.referenceTarget = type == FieldType.REFERENCE ? referenceTarget : null;
    this.picklistValues = type == FieldType.PICKLIST
        ? ImmutableList.copyOf(picklistValues)
        : ImmutableList.of();
  }

  public String getName() {
    return name;
  }

  public FieldType getType() {
    return type;
  }

  /** Type name exactly as the platform reports it, e.g. {@code datetime}. */
  public String getPlatformType() {
    return platformType;
  }

  public boolean isNullable() {
    return nullable;
  }

  public boolean isUpdatable() {
    return updatable;
  }

  /** Target object of a reference field; null for other types. */
  public @Nullable String getReferenceTarget() {
    return referenceTarget;
  }

  /** Active picklist values; empty for other types. */
  public List<String> getPicklistValues() {
    return picklistValues;
  }

  @Override public String toString() {
    return name + ":" + platformType;
  }
}
