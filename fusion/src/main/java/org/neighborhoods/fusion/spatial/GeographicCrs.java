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
package org.neighborhoods.fusion.spatial;

/**
 * Geographic (longitude/latitude in degrees) reference systems.
 *
 * <p>Coordinates in these systems are for exchange and output only: degree
 * units make Euclidean distance and area meaningless.
 */
public enum GeographicCrs implements SpatialReference {
  WGS84("EPSG:4326", "+proj=longlat +datum=WGS84 +no_defs");

  private final String code;
  private final String proj4;

  GeographicCrs(String code, String proj4) {
    this.code = code;
    this.proj4 = proj4;
  }

  @Override public String getCode() {
    return code;
  }

  @Override public String getProj4() {
    return proj4;
  }

  /**
   * Looks up a system by authority code (case-insensitive) or enum name.
   */
  public static GeographicCrs fromCode(String code) {
    for (GeographicCrs crs : values()) {
      if (crs.code.equalsIgnoreCase(code) || crs.name().equalsIgnoreCase(code)) {
        return crs;
      }
    }
    throw new IllegalArgumentException("Unsupported geographic reference system: " + code);
  }
}
