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

import org.aperio.salesforce.RecordNotFoundException;
import org.aperio.salesforce.query.SOQLBuilder;
import org.aperio.salesforce.schema.ChildRelationship;
import org.aperio.salesforce.schema.FieldDescriptor;
import org.aperio.salesforce.schema.FieldType;
import org.aperio.salesforce.schema.ObjectSchema;
import org.aperio.salesforce.schema.SchemaIntrospector;
import org.aperio.salesforce.transport.QueryResult;
import org.aperio.salesforce.transport.SalesforceTransport;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks parent and child relationships of a record using describe metadata.
 *
 * <p>Two failure policies coexist on purpose:
 * <ul>
 *   <li>{@link #resolveChildren} and {@link #resolveRelated} fan out over several
 *   relationships and drop any relationship whose query fails (permission denied, unknown
 *   field, timeout). The call as a whole only fails if the describe or a parent lookup
 *   fails.</li>
 *   <li>{@link #resolveNamedRelationship} queries exactly one relationship and propagates
 *   its failure.</li>
 * </ul>
 * Sub-queries run one after another on the calling thread.
 */
public class RelationalNavigator {
  private static final Logger LOGGER = LoggerFactory.getLogger(RelationalNavigator.class);

  public static final int DEFAULT_MAX_PARENT_FIELDS = 3;
  public static final int DEFAULT_MAX_CHILD_RELATIONSHIPS = 3;
  public static final int CHILD_ROW_CAP = 5;
  public static final int RELATED_RELATIONSHIP_CAP = 5;
  public static final int RELATED_ROW_CAP = 10;
  public static final int NAMED_RELATIONSHIP_ROW_CAP = 100;

  private static final String FOREIGN_KEY_SUFFIX = "Id";
  private static final String PARENT_MARKER = "Parent";
  private static final List<String> CHILD_PROJECTION =
      ImmutableList.of(ObjectSchema.IDENTITY_FIELD, "Name");

  private final SalesforceTransport transport;
  private final SchemaIntrospector introspector;

  public RelationalNavigator(SalesforceTransport transport, SchemaIntrospector introspector) {
    this.transport = transport;
    this.introspector = introspector;
  }

  public NavigationResult resolveParents(String objectName, String recordId) throws IOException {
    return resolveParents(objectName, recordId, DEFAULT_MAX_PARENT_FIELDS);
  }

  /**
   * Reads the parent reference fields of a record.
   *
   * <p>Candidates are reference fields whose name ends in {@code Id} (other than
   * {@code Id} itself). The first {@code maxFields} in declared schema order are selected;
   * declaration order is the only tie-break.
   *
   * @throws RecordNotFoundException if the record does not exist
   * @throws IOException if the describe or the query fails
   */
  public NavigationResult resolveParents(String objectName, String recordId, int maxFields)
      throws IOException {
    ObjectSchema schema = introspector.describe(objectName);

    List<FieldDescriptor> selected = new ArrayList<>();
    for (FieldDescriptor field : schema.getFields()) {
      if (selected.size() >= maxFields) {
        break;
      }
      if (field.getType() == FieldType.REFERENCE
          && field.getName().endsWith(FOREIGN_KEY_SUFFIX)
          && !ObjectSchema.IDENTITY_FIELD.equals(field.getName())) {
        selected.add(field);
      }
    }

    if (selected.isEmpty()) {
      LOGGER.debug("{} has no parent reference fields", objectName);
      return NavigationResult.up(null, selected);
    }

    List<String> projection = new ArrayList<>();
    projection.add(ObjectSchema.IDENTITY_FIELD);
    for (FieldDescriptor field : selected) {
      projection.add(field.getName());
    }
    String soql = SOQLBuilder.buildSelectQuery(objectName, projection,
        SOQLBuilder.equalsPredicate(ObjectSchema.IDENTITY_FIELD, recordId), null, 1);

    QueryResult result = transport.query(soql);
    if (result.isEmpty()) {
      throw new RecordNotFoundException(objectName, recordId);
    }
    return NavigationResult.up(result.getRecords().get(0), selected);
  }

  public NavigationResult resolveChildren(String objectName, String recordId)
      throws IOException {
    return resolveChildren(objectName, recordId, DEFAULT_MAX_CHILD_RELATIONSHIPS);
  }

  /**
   * Lists child records over the record's child relationships, best effort.
   *
   * <p>Relationships whose foreign-key field or alias contains {@code Parent} are preferred;
   * when none does, every child relationship is eligible. The first
   * {@code maxRelationships} eligible relationships in discovery order are queried, at most
   * {@value #CHILD_ROW_CAP} rows each. A relationship whose query fails is left out of the
   * result.
   *
   * @throws IOException if the describe fails
   */
  public NavigationResult resolveChildren(String objectName, String recordId,
      int maxRelationships) throws IOException {
    List<ChildRelationship> discovered = introspector.describe(objectName).getChildRelationships();

    List<ChildRelationship> eligible = new ArrayList<>();
    for (ChildRelationship relationship : discovered) {
      if (looksParentOriented(relationship)) {
        eligible.add(relationship);
      }
    }
    if (eligible.isEmpty()) {
      LOGGER.debug("No parent-oriented relationship on {}, using all {}", objectName,
          discovered.size());
      eligible = discovered;
    }

    return NavigationResult.down(
        fanOut(limit(eligible, maxRelationships), recordId, CHILD_ROW_CAP));
  }

  /**
   * Lists records of the first {@value #RELATED_RELATIONSHIP_CAP} child relationships,
   * {@value #RELATED_ROW_CAP} rows each, with the same best-effort policy as
   * {@link #resolveChildren}.
   *
   * @throws IOException if the describe fails
   */
  public NavigationResult resolveRelated(String objectName, String recordId) throws IOException {
    List<ChildRelationship> discovered = introspector.describe(objectName).getChildRelationships();
    return NavigationResult.down(
        fanOut(limit(discovered, RELATED_RELATIONSHIP_CAP), recordId, RELATED_ROW_CAP));
  }

  /**
   * Lists records of one relationship the caller already knows, e.g. the {@code Contact}
   * rows of an {@code Account}. The child rows are matched on {@code <objectName>Id}.
   *
   * @throws RecordNotFoundException if the parent record does not exist
   * @throws IOException if either query fails
   */
  public QueryResult resolveNamedRelationship(String objectName, String recordId,
      String relationshipName) throws IOException {
    String parentSoql = SOQLBuilder.buildSelectQuery(objectName,
        ImmutableList.of(ObjectSchema.IDENTITY_FIELD),
        SOQLBuilder.equalsPredicate(ObjectSchema.IDENTITY_FIELD, recordId), null, 1);
    if (transport.query(parentSoql).isEmpty()) {
      throw new RecordNotFoundException(objectName, recordId);
    }

    String childSoql = SOQLBuilder.buildSelectQuery(relationshipName, CHILD_PROJECTION,
        SOQLBuilder.equalsPredicate(objectName + FOREIGN_KEY_SUFFIX, recordId), null,
        NAMED_RELATIONSHIP_ROW_CAP);
    return transport.query(childSoql);
  }

  private Map<String, List<Map<String, Object>>> fanOut(List<ChildRelationship> relationships,
      String recordId, int rowCap) throws InterruptedIOException {
    Map<String, List<Map<String, Object>>> children = new LinkedHashMap<>();
    for (ChildRelationship relationship : relationships) {
      String soql = SOQLBuilder.buildSelectQuery(relationship.getChildObject(),
          CHILD_PROJECTION, SOQLBuilder.equalsPredicate(relationship.getField(), recordId),
          null, rowCap);
      try {
        children.put(relationship.getAlias(), transport.query(soql).getRecords());
      } catch (IOException e) {
        if (e instanceof InterruptedIOException && Thread.currentThread().isInterrupted()) {
          throw (InterruptedIOException) e;
        }
        // timeouts land here too and are dropped like permission failures
        LOGGER.debug("Skipping relationship {}: {}", relationship, e.getMessage());
      }
    }
    return children;
  }

  private static boolean looksParentOriented(ChildRelationship relationship) {
    return relationship.getField().contains(PARENT_MARKER)
        || (relationship.getRelationshipName() != null
            && relationship.getRelationshipName().contains(PARENT_MARKER));
  }

  private static <T> List<T> limit(List<T> items, int max) {
    return items.size() <= max ? items : items.subList(0, Math.max(max, 0));
  }
}
