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
 * Planar (projected, meter-based) reference systems in which distances and areas are computed.
 */
public enum PlanarCrs implements SpatialReference {
  /** NAD83 / Conus Albers. Equal-area, so polygon areas are true areas. */
  CONUS_ALBERS("EPSG:5070",
      "+proj=aea +lat_1=29.5 +lat_2=45.5 +lat_0=23 +lon_0=-96 +x_0=0 +y_0=0"
          + " +datum=NAD83 +units=m +no_defs"),

  /** Web Mercator. Conformal; areas grow with latitude. */
  WEB_MERCATOR("EPSG:3857",
      "+proj=merc +a=6378137 +b=6378137 +lat_ts=0 +lon_0=0 +x_0=0 +y_0=0 +k=1"
          + " +units=m +nadgrids=@null +wktext +no_defs");

  private final String code;
  private final String proj4;

  PlanarCrs(String code, String proj4) {
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
  public static PlanarCrs fromCode(String code) {
    for (PlanarCrs crs : values()) {
      if (crs.code.equalsIgnoreCase(code) || crs.name().equalsIgnoreCase(code)) {
        return crs;
      }
    }
    throw new IllegalArgumentException("Unsupported planar reference system: " + code);
  }
}
