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
package org.neighborhoods.fusion.metrics;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient numeric coercion for source cells. Anything that cannot be read
 * as a number becomes {@code null}; nothing is coerced to zero.
 */
public final class NumericValues {
  private static final Logger LOGGER = LoggerFactory.getLogger(NumericValues.class);

  private NumericValues() {
  }

  /**
   * Reads a cell as a double. Empty strings, {@code "NaN"} and NaN values
   * yield {@code null}.
   */
  public static @Nullable Double toDouble(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      double d = ((Number) value).doubleValue();
      return Double.isNaN(d) ? null : d;
    }
    String text = value.toString().trim();
    if (text.isEmpty() || text.equalsIgnoreCase("nan")) {
      return null;
    }
    try {
      double d = Double.parseDouble(text);
      return Double.isNaN(d) ? null : d;
    } catch (NumberFormatException e) {
      LOGGER.debug("Not a number: '{}'", text);
      return null;
    }
  }

  /**
   * Reads a cell as a whole number, stripping thousands separators
   * ({@code "12,345"} is 12345). Fractional values yield {@code null}.
   */
  public static @Nullable Long toLong(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    Double d;
    if (value instanceof Number) {
      d = toDouble(value);
    } else {
      String text = value.toString().replace(",", "").trim();
      if (text.isEmpty()) {
        return null;
      }
      try {
        return Long.parseLong(text);
      } catch (NumberFormatException e) {
        d = toDouble(text);
      }
    }
    if (d == null || Double.isInfinite(d) || d != Math.rint(d)) {
      if (d != null) {
        LOGGER.debug("Not a whole number: {}", value);
      }
      return null;
    }
    return d.longValue();
  }
}
