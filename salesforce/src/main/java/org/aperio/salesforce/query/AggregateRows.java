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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-processing of aggregate query rows.
 */
public final class AggregateRows {
  private AggregateRows() {
  }

  /**
   * Renames the {@code exprN} keys of bare {@code COUNT(Id)} aggregates to the alias the
   * caller supplied for them, so rows read the same whichever way an aggregate was rendered.
   * Works for {@link TrendSpec} rows too, whose bucket expressions hold the first numbers.
   * Aggregates without a supplied alias keep their {@code exprN} key.
   */
  public static List<Map<String, Object>> relabel(QuerySpec spec,
      List<Map<String, Object>> rows) {
    List<String> keys = spec.resultKeys();
    List<Map<String, Object>> relabelled = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> copy = new LinkedHashMap<>(row);
      for (int i = 0; i < keys.size(); i++) {
        AggregateSpec aggregate = spec.getAggregates().get(i);
        String alias = aggregate.getExplicitAlias();
        if (aggregate.isBareCount() && alias != null && copy.containsKey(keys.get(i))) {
          copy.put(alias, copy.remove(keys.get(i)));
        }
      }
      relabelled.add(copy);
    }
    return relabelled;
  }
}
