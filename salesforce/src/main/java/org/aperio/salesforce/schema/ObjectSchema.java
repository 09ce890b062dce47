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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Describe metadata of one sObject. Instances are immutable; fields and child relationships
 * keep the order the platform declared them in.
 */
public class ObjectSchema {
  /** Primary-key field of every sObject. */
  public static final String IDENTITY_FIELD = "Id";

  private final String name;
  private final List<FieldDescriptor> fields;
  private final List<ChildRelationship> childRelationships;
  private final JsonNode describe;

  public ObjectSchema(String name, List<FieldDescriptor> fields,
      List<ChildRelationship> childRelationships, JsonNode describe) {
    this.name = name;
    this.fields = ImmutableList.copyOf(fields);
    this.childRelationships = ImmutableList.copyOf(childRelationships);
    this.describe = describe.deepCopy();
  }

  public String getName() {
    return name;
  }

  public List<FieldDescriptor> getFields() {
    return fields;
  }

  public List<ChildRelationship> getChildRelationships() {
    return childRelationships;
  }

  public @Nullable FieldDescriptor getField(String fieldName) {
    for (FieldDescriptor field : fields) {
      if (field.getName().equalsIgnoreCase(fieldName)) {
        return field;
      }
    }
    return null;
  }

  /** The describe response this schema was read from; a copy, so callers may modify it. */
  public JsonNode getDescribe() {
    return describe.deepCopy();
  }
}
