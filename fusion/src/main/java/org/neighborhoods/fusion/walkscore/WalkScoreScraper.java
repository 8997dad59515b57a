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

import org.neighborhoods.etl.HttpFetcher;
import org.neighborhoods.etl.Relation;
import org.neighborhoods.etl.RetryConfig;
import org.neighborhoods.etl.UrlConnectionFetcher;

import com.google.common.collect.ImmutableList;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the neighborhood ranking table of a city's Walk Score page.
 *
 * <p>The page lists one row per neighborhood with rank, name, walk, transit
 * and bike scores and population. Cells are kept as text; numeric parsing
 * happens downstream.
 */
public class WalkScoreScraper implements WalkabilityService {
  private static final Logger LOGGER = LoggerFactory.getLogger(WalkScoreScraper.class);

  public static final String BASE_URL = "https://www.walkscore.com";

  /** Columns of the scraped table, in page order. */
  public static final List<String> TABLE_COLUMNS = ImmutableList.of(
      "city_rank", "neighborhood", "walk_score", "transit_score", "bike_score", "population");

  /** Columns of the returned relation. */
  public static final List<String> COLUMNS = ImmutableList.<String>builder()
      .addAll(TABLE_COLUMNS).add("city_name", "state_id").build();

  private final HttpFetcher fetcher;
  private final String baseUrl;

  public WalkScoreScraper(RetryConfig retry) {
    this(new UrlConnectionFetcher(retry, 30000, 60000), BASE_URL);
  }

  public WalkScoreScraper(HttpFetcher fetcher, String baseUrl) {
    this.fetcher = fetcher;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  @Override public Relation fetch(CityState city) throws IOException {
    String url = buildUrl(city);
    LOGGER.info("Scraping walkability page {}", url);
    return parse(fetcher.get(url), city);
  }

  /**
   * Returns the page URL for a city. Washington, DC lives under
   * {@code /DC/Washington_D.C.}; other cities use their name with spaces
   * replaced by underscores.
   */
  public String buildUrl(CityState city) {
    if (city.getCity().equals("Washington") && city.getState().equals("DC")) {
      return baseUrl + "/DC/Washington_D.C.";
    }
    return baseUrl + "/" + city.getState() + "/" + city.getCity().replace(' ', '_');
  }

  /**
   * Extracts the neighborhood table of a city page.
   *
   * @throws IOException if the page has no neighborhood table
   */
  public Relation parse(String html, CityState city) throws IOException {
    Document doc = Jsoup.parse(html);
    Element table = doc.getElementById("hoods-list-table");
    if (table == null) {
      throw new IOException("No neighborhood table on walkability page for " + city);
    }
    Relation.Builder builder = Relation.builder(COLUMNS);
    int malformed = 0;
    for (Element row : table.select("tr")) {
      Elements cells = row.select("td");
      if (cells.isEmpty()) {
        continue;
      }
      if (cells.size() != TABLE_COLUMNS.size()) {
        malformed++;
        continue;
      }
      List<Object> values = new ArrayList<Object>(COLUMNS.size());
      for (Element cell : cells) {
        String text = cell.text().trim();
        values.add(text.isEmpty() ? null : text);
      }
      values.add(city.getCity());
      values.add(city.getState());
      builder.addRow(values.toArray());
    }
    if (malformed > 0) {
      LOGGER.warn("Skipped {} malformed row(s) on walkability page for {}", malformed, city);
    }
    Relation relation = builder.build();
    LOGGER.debug("Read {} neighborhoods for {}", relation.size(), city);
    return relation;
  }
}
