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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link WalkScoreScraper} and {@link WalkScoreCollector}.
 */
@Tag("unit")
class WalkScoreScraperTest {

  private static final String PAGE = "<html><body>"
      + "<table id=\"hoods-list-table\">"
      + "<thead><tr><th>Rank</th><th>Name</th><th>Walk Score</th><th>Transit Score</th>"
      + "<th>Bike Score</th><th>Population</th></tr></thead>"
      + "<tbody>"
      + "<tr><td>1</td><td><a href=\"/CA/Los_Angeles/Koreatown\">Koreatown</a></td>"
      + "<td>91</td><td>71</td><td>68</td><td>124,281</td></tr>"
      + "<tr><td>2</td><td> Westlake </td><td>90</td><td>73</td><td></td><td>103,839</td></tr>"
      + "<tr><td colspan=\"6\">Ad</td></tr>"
      + "</tbody></table></body></html>";

  private final List<String> requests = new ArrayList<String>();

  private WalkScoreScraper scraper() {
    return new WalkScoreScraper(url -> {
      requests.add(url);
      return PAGE;
    }, "https://walk.test/");
  }

  @Test
  void testCityUrls() {
    WalkScoreScraper scraper = scraper();

    assertEquals("https://walk.test/CA/Los_Angeles",
        scraper.buildUrl(new CityState("Los Angeles", "CA")));
    assertEquals("https://walk.test/DC/Washington_D.C.",
        scraper.buildUrl(new CityState("Washington", "DC")));
    assertEquals("https://walk.test/UT/Washington",
        scraper.buildUrl(new CityState("Washington", "UT")));
  }

  @Test
  void testNeighborhoodTableParsed() throws IOException {
    Relation rows = scraper().fetch(new CityState("Los Angeles", "CA"));

    assertEquals(Arrays.asList("https://walk.test/CA/Los_Angeles"), requests);
    assertEquals(WalkScoreScraper.COLUMNS, rows.getColumns());
    assertEquals(2, rows.size());
    assertEquals("Koreatown", rows.get(0, "neighborhood"));
    assertEquals("124,281", rows.get(0, "population"));
    assertEquals("Los Angeles", rows.get(0, "city_name"));
    assertEquals("CA", rows.get(0, "state_id"));
    assertEquals("Westlake", rows.get(1, "neighborhood"));
    assertNull(rows.get(1, "bike_score"));
  }

  @Test
  void testPageWithoutTableFails() {
    assertThrows(IOException.class, () -> scraper().parse("<html><body>Not found</body></html>",
        new CityState("Nowhere", "ZZ")));
  }

  @Test
  void testCollectorSkipsFailedCities() {
    WalkScoreCollector collector = new WalkScoreCollector(city -> {
      if (city.getCity().equals("Broken")) {
        throw new IOException("HTTP 404");
      }
      return scraper().parse(PAGE, city);
    });

    Relation rows = collector.collect(Arrays.asList(
        new CityState("Los Angeles", "CA"),
        new CityState("Broken", "CA"),
        new CityState("Pasadena", "CA")));

    assertEquals(WalkScoreScraper.COLUMNS, rows.getColumns());
    assertEquals(4, rows.size());
    assertEquals("Pasadena", rows.get(3, "city_name"));
  }

  @Test
  void testDistinctCities() {
    Relation points = Relation.builder("neighborhood", "city_name", "state_id")
        .addRow("Koreatown", "Los Angeles", "CA")
        .addRow("Westlake", "Los Angeles", "CA")
        .addRow("Downtown", "Portland", "OR")
        .addRow("Downtown", "Portland", "ME")
        .addRow("Unknown", null, "CA")
        .build();

    assertEquals(Arrays.asList(
            new CityState("Los Angeles", "CA"),
            new CityState("Portland", "OR"),
            new CityState("Portland", "ME")),
        CityState.distinct(points, "city_name", "state_id"));
  }
}
