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

import java.util.Locale;

/**
 * Coarse type tag of an sObject field.
 */
public enum FieldType {
  STRING,
  NUMBER,
  BOOLEAN,
  REFERENCE,
  PICKLIST,
  DATE,
  CURRENCY;

  /**
   * Maps a describe {@code type} value to a tag. Unknown types are treated as strings.
   *
   * @param platformType type as reported by the describe call, e.g. {@code reference}
   */
  public static FieldType fromPlatformType(String platformType) {
    switch (platformType.toLowerCase(Locale.ROOT)) {
    case "reference":
      return REFERENCE;

    case "picklist":
    case "multipicklist":
      return PICKLIST;

    case "boolean":
      return BOOLEAN;

    case "int":
    case "integer":
    case "long":
    case "double":
    case "percent":
      return NUMBER;

    case "currency":
      return CURRENCY;

    case "date":
    case "datetime":
    case "time":
      return DATE;

    default:
      // id, string, textarea, phone, email, url, combobox, ...
      return STRING;
    }
  }
}
