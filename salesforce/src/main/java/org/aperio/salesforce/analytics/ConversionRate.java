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
package org.aperio.salesforce.analytics;

import java.util.Locale;

/**
 * Conversion-rate arithmetic.
 */
public final class ConversionRate {
  private ConversionRate() {
  }

  /** {@code converted / total * 100}, or 0 when {@code total} is not positive. */
  public static double percent(double converted, double total) {
    return total > 0 ? converted / total * 100d : 0d;
  }

  /** Formats a percentage with two decimals and a {@code %} suffix, e.g. {@code 12.50%}. */
  public static String format(double percent) {
    return String.format(Locale.ROOT, "%.2f%%", percent);
  }
}
