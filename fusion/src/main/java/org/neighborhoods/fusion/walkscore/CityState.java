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
package org.neighborhoods.fusion.walkscore;

import org.neighborhoods.etl.Relation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A city name and two-letter state code, as in the neighborhood point table.
 */
public final class CityState {
  private final String city;
  private final String state;

  public CityState(String city, String state) {
    this.city = Objects.requireNonNull(city, "city");
    this.state = Objects.requireNonNull(state, "state");
  }

  /**
   * Returns the distinct city/state pairs of a relation in first-seen order.
   * Rows missing either value are ignored.
   */
  public static List<CityState> distinct(Relation relation, String cityColumn,
      String stateColumn) {
    relation.requireColumns("city list", Arrays.asList(cityColumn, stateColumn));
    Set<CityState> cities = new LinkedHashSet<CityState>();
    for (int i = 0; i < relation.size(); i++) {
      Object city = relation.get(i, cityColumn);
      Object state = relation.get(i, stateColumn);
      if (city != null && state != null) {
        cities.add(new CityState(city.toString(), state.toString()));
      }
    }
    return new ArrayList<CityState>(cities);
  }

  public String getCity() {
    return city;
  }

  public String getState() {
    return state;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CityState)) {
      return false;
    }
    CityState that = (CityState) o;
    return city.equals(that.city) && state.equals(that.state);
  }

  @Override public int hashCode() {
    return Objects.hash(city, state);
  }

  @Override public String toString() {
    return city + ", " + state;
  }
}
