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

import org.neighborhoods.fusion.spatial.GeographicLayer;

import java.io.IOException;

/**
 * Source of census geographic unit polygons for one county.
 */
@FunctionalInterface
public interface GeographyService {

  /**
   * Fetches every unit of the given granularity in a county.
   *
   * @param county County to query
   * @param geography Unit granularity
   * @return Units keyed by their unique identifier; may be empty
   * @throws IOException if the service cannot be reached or its response
   *     cannot be read
   */
  GeographicLayer fetchUnits(County county, CensusGeography geography) throws IOException;
}
