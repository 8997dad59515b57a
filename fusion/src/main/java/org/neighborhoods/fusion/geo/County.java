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
package org.neighborhoods.fusion.geo;

import java.util.Objects;

/**
 * A county identified by its two-digit state and three-digit county FIPS code.
 */
public final class County implements Comparable<County> {
  private final String stateFips;
  private final String countyFips;

  public County(String stateFips, String countyFips) {
    if (stateFips == null || !stateFips.matches("\\d{2}")) {
      throw new IllegalArgumentException("State FIPS must be two digits: " + stateFips);
    }
    if (countyFips == null || !countyFips.matches("\\d{3}")) {
      throw new IllegalArgumentException("County FIPS must be three digits: " + countyFips);
    }
    this.stateFips = stateFips;
    this.countyFips = countyFips;
  }

  /**
   * Parses a combined five-digit code such as {@code 06037}. Shorter codes
   * lost their leading zero in a numeric column and are padded
   * ({@code 6037} is {@code 06037}); a trailing {@code .0} is ignored.
   */
  public static County fromFips(Object fips) {
    String code = String.valueOf(fips).trim();
    if (code.endsWith(".0")) {
      code = code.substring(0, code.length() - 2);
    }
    if (code.isEmpty() || code.length() > 5 || !code.matches("\\d+")) {
      throw new IllegalArgumentException("Invalid county FIPS code: '" + fips + "'");
    }
    StringBuilder padded = new StringBuilder();
    for (int i = code.length(); i < 5; i++) {
      padded.append('0');
    }
    padded.append(code);
    return new County(padded.substring(0, 2), padded.substring(2));
  }

  public String getStateFips() {
    return stateFips;
  }

  public String getCountyFips() {
    return countyFips;
  }

  /** Five-digit combined code. */
  public String getFips() {
    return stateFips + countyFips;
  }

  @Override public int compareTo(County o) {
    return getFips().compareTo(o.getFips());
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof County)) {
      return false;
    }
    County that = (County) o;
    return stateFips.equals(that.stateFips) && countyFips.equals(that.countyFips);
  }

  @Override public int hashCode() {
    return Objects.hash(stateFips, countyFips);
  }

  @Override public String toString() {
    return getFips();
  }
}
