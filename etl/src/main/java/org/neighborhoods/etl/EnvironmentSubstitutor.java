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
package org.neighborhoods.etl;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {env:VAR_NAME}} references in configuration strings.
 *
 * <p>A reference to an unset variable resolves to the empty string.
 */
public final class EnvironmentSubstitutor {
  private static final Pattern ENV_PATTERN = Pattern.compile("\\{env:([^}]+)\\}");

  private EnvironmentSubstitutor() {
  }

  public static String substitute(String value) {
    return substitute(value, System::getenv);
  }

  /**
   * Substitutes references using the given variable lookup.
   *
   * @param value String possibly containing references; null passes through
   * @param lookup Variable name to value, returning null when unset
   */
  public static String substitute(String value, Function<String, String> lookup) {
    if (value == null || value.indexOf('{') < 0) {
      return value;
    }
    Matcher matcher = ENV_PATTERN.matcher(value);
    StringBuffer sb = new StringBuffer();
    while (matcher.find()) {
      String resolved = lookup.apply(matcher.group(1));
      matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : ""));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}
