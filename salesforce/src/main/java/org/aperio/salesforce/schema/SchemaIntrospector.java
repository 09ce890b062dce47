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

import org.aperio.salesforce.transport.SalesforceTransport;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fetches sObject describe metadata and caches it per object name.
 *
 * <p>Entries live as long as this introspector and are never invalidated. Two threads asking
 * for the same uncached object may both fetch it; the first schema stored wins and both
 * callers receive it. Describe results are idempotent, so the duplicate fetch only costs a
 * request.
 */
public class SchemaIntrospector {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaIntrospector.class);

  private final SalesforceTransport transport;
  private final ConcurrentMap<String, ObjectSchema> cache = new ConcurrentHashMap<>();

  public SchemaIntrospector(SalesforceTransport transport) {
    this.transport = transport;
  }

  /**
   * Returns the schema of an sObject, fetching it on first use.
   *
   * @param objectName API name, e.g. {@code Opportunity}
   * @throws IOException if the object is unknown, not readable, or the call fails
   */
  public ObjectSchema describe(String objectName) throws IOException {
    ObjectSchema cached = cache.get(objectName);
    if (cached != null) {
      LOGGER.debug("Schema cache hit for {}", objectName);
      return cached;
    }
    LOGGER.debug("Schema cache miss for {}, describing", objectName);
    ObjectSchema fetched = toSchema(objectName, transport.describe(objectName));
    ObjectSchema winner = cache.putIfAbsent(objectName, fetched);
    return winner != null ? winner : fetched;
  }

  /**
   * Converts a raw describe response.
   *
   * @param objectName name used when the response lacks one
   * @param describe describe response body
   */
  static ObjectSchema toSchema(String objectName, JsonNode describe) {
    List<FieldDescriptor> fields = new ArrayList<>();
    for (JsonNode field : describe.path("fields")) {
      JsonNode referenceTo = field.path("referenceTo");
      String target = referenceTo.isArray() && referenceTo.size() > 0
          ? referenceTo.get(0).asText()
          : null;

      List<String> picklistValues = new ArrayList<>();
      for (JsonNode entry : field.path("picklistValues")) {
        if (entry.path("active").asBoolean(true)) {
          picklistValues.add(entry.path("value").asText());
        }
      }

      fields.add(
          new FieldDescriptor(field.path("name").asText(),
              field.path("type").asText("string"),
              field.path("nillable").asBoolean(true),
              field.path("updateable").asBoolean(false),
              target,
              picklistValues));
    }

    List<ChildRelationship> children = new ArrayList<>();
    for (JsonNode rel : describe.path("childRelationships")) {
      String childObject = rel.path("childSObject").asText(null);
      String field = rel.path("field").asText(null);
      if (childObject == null || field == null || field.isEmpty()) {
        continue;
      }
      children.add(new ChildRelationship(childObject, field,
          rel.path("relationshipName").asText(null)));
    }

    String name = describe.path("name").asText(objectName);
    return new ObjectSchema(name, fields, children, describe);
  }
}
