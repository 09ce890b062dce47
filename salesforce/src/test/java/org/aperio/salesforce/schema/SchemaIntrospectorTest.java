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

import org.aperio.salesforce.RemoteApiException;
import org.aperio.salesforce.transport.FakeTransport;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SchemaIntrospector}.
 */
@Tag("unit")
public class SchemaIntrospectorTest {
  private static final String OPPORTUNITY = "{\"name\": \"Opportunity\", \"fields\": ["
      + "{\"name\": \"Id\", \"type\": \"id\", \"nillable\": false},"
      + "{\"name\": \"AccountId\", \"type\": \"reference\", \"referenceTo\": [\"Account\"],"
      + " \"updateable\": true},"
      + "{\"name\": \"StageName\", \"type\": \"picklist\", \"picklistValues\": ["
      + "  {\"value\": \"Prospecting\", \"active\": true},"
      + "  {\"value\": \"Legacy\", \"active\": false},"
      + "  {\"value\": \"Closed Won\", \"active\": true}]},"
      + "{\"name\": \"Amount\", \"type\": \"currency\"},"
      + "{\"name\": \"CloseDate\", \"type\": \"date\"}],"
      + "\"childRelationships\": ["
      + "{\"childSObject\": \"OpportunityLineItem\", \"field\": \"OpportunityId\","
      + " \"relationshipName\": \"OpportunityLineItems\"},"
      + "{\"childSObject\": \"OpportunityHistory\", \"field\": \"OpportunityId\","
      + " \"relationshipName\": null},"
      + "{\"childSObject\": \"Broken\"}]}";

  @Test
  public void testParsesFields() throws Exception {
    FakeTransport transport = new FakeTransport().onDescribe("Opportunity", OPPORTUNITY);

    ObjectSchema schema = new SchemaIntrospector(transport).describe("Opportunity");

    assertThat(schema.getName(), equalTo("Opportunity"));
    assertThat(schema.getFields(), hasSize(5));

    FieldDescriptor account = schema.getField("AccountId");
    assertThat(account.getType(), equalTo(FieldType.REFERENCE));
    assertThat(account.getReferenceTarget(), equalTo("Account"));
    assertThat(account.isUpdatable(), equalTo(true));

    FieldDescriptor stage = schema.getField("StageName");
    assertThat(stage.getType(), equalTo(FieldType.PICKLIST));
    assertThat(stage.getPicklistValues(), equalTo(ImmutableList.of("Prospecting", "Closed Won")));

    assertThat(schema.getField("Id").isNullable(), equalTo(false));
    assertThat(schema.getField("Amount").getType(), equalTo(FieldType.CURRENCY));
    assertThat(schema.getField("CloseDate").getType(), equalTo(FieldType.DATE));
    assertThat(schema.getField("Missing"), nullValue());
  }

  @Test
  public void testParsesChildRelationships() throws Exception {
    FakeTransport transport = new FakeTransport().onDescribe("Opportunity", OPPORTUNITY);

    ObjectSchema schema = new SchemaIntrospector(transport).describe("Opportunity");

    assertThat(schema.getChildRelationships(), hasSize(2));
    ChildRelationship items = schema.getChildRelationships().get(0);
    assertThat(items.getChildObject(), equalTo("OpportunityLineItem"));
    assertThat(items.getAlias(), equalTo("OpportunityLineItems"));
    ChildRelationship history = schema.getChildRelationships().get(1);
    assertThat(history.getRelationshipName(), nullValue());
    assertThat(history.getAlias(), equalTo("OpportunityHistory"));
  }

  @Test
  public void testDescribesOncePerObject() throws Exception {
    FakeTransport transport = new FakeTransport().onDescribe("Opportunity", OPPORTUNITY);
    SchemaIntrospector introspector = new SchemaIntrospector(transport);

    ObjectSchema first = introspector.describe("Opportunity");
    ObjectSchema second = introspector.describe("Opportunity");

    assertThat(second, sameInstance(first));
    assertThat(transport.describeCalls, equalTo(ImmutableList.of("Opportunity")));
  }

  @Test
  public void testUnknownObjectFails() {
    SchemaIntrospector introspector = new SchemaIntrospector(new FakeTransport());

    RemoteApiException e =
        assertThrows(RemoteApiException.class, () -> introspector.describe("Nope__c"));
    assertThat(e.getStatusCode(), equalTo(404));
  }

  @Test
  public void testUnknownPlatformTypeIsString() {
    assertThat(FieldType.fromPlatformType("textarea"), equalTo(FieldType.STRING));
    assertThat(FieldType.fromPlatformType("DOUBLE"), equalTo(FieldType.NUMBER));
    assertThat(FieldType.fromPlatformType("multipicklist"), equalTo(FieldType.PICKLIST));
  }
}
