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
package org.neighborhoods.fusion.pipeline;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Column names of the source tables and of the fused output.
 */
public final class NeighborhoodColumns {
  private NeighborhoodColumns() {
  }

  // Neighborhood point table
  public static final String ID = "id";
  public static final String NEIGHBORHOOD = "neighborhood";
  public static final String CITY_NAME = "city_name";
  public static final String STATE_ID = "state_id";
  public static final String COUNTY_FIPS = "county_fips";
  public static final String LAT = "lat";
  public static final String LNG = "lng";

  /** Point table columns that are not carried into the output. */
  public static final List<String> DROPPED_POINT_COLUMNS =
      ImmutableList.of("neighborhood_ascii", "city_id", "timezone", "source");

  // Zillow tables
  public static final String REGION_NAME = "RegionName";
  public static final String STATE = "State";
  public static final String CITY = "City";

  // Derived
  public static final String NEIGHBORHOOD_ZHVI = "neighborhood_ZHVI";
  public static final String CITY_ZORI = "city_ZORI";
  public static final String CITY_ZHVI = "city_ZHVI";
  public static final String CITY_RTV = "city_RTV";
  public static final String POPULATION = "population";
  public static final String AREA_SQ_MI = "area_sq_mi";
  public static final String POP_DENSITY = "pop_density";

  /** Serialized boundary in the flat output. */
  public static final String GEOMETRY = "geometry";
}
