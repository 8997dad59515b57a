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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fetches walkability rows for many cities, one request per city. A city
 * whose page cannot be fetched or read is logged and skipped.
 */
public class WalkScoreCollector {
  private static final Logger LOGGER = LoggerFactory.getLogger(WalkScoreCollector.class);

  private final WalkabilityService service;

  public WalkScoreCollector(WalkabilityService service) {
    this.service = service;
  }

  /**
   * Concatenates the rows of every city that could be fetched.
   */
  public Relation collect(Collection<CityState> cities) {
    List<Object[]> rows = new ArrayList<Object[]>();
    int failed = 0;
    for (CityState city : cities) {
      try {
        Relation page = service.fetch(city).select(WalkScoreScraper.COLUMNS);
        for (int i = 0; i < page.size(); i++) {
          rows.add(page.row(i));
        }
      } catch (IOException e) {
        failed++;
        LOGGER.warn("Skipping walkability data for {}: {}", city, e.getMessage());
      }
    }
    LOGGER.info("Collected {} walkability rows for {} of {} cities",
        rows.size(), cities.size() - failed, cities.size());
    return Relation.of(WalkScoreScraper.COLUMNS, rows);
  }
}
