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
package org.neighborhoods.fusion.metrics;

import org.neighborhoods.etl.Relation;
import org.neighborhoods.fusion.spatial.KeyedGeometry;
import org.neighborhoods.fusion.spatial.PlanarCrs;
import org.neighborhoods.fusion.spatial.PlanarLayer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link MetricsDeriver} and {@link NumericValues}.
 */
@Tag("unit")
class MetricsDeriverTest {

  private final MetricsDeriver deriver = new MetricsDeriver();

  @Test
  void testRatioIsRentOverValueTimesHundred() {
    assertEquals(0.5, deriver.ratio(2000, 400000), 1e-12);
    assertEquals(0.5, deriver.ratio("2000", "400000.0"), 1e-12);
  }

  @Test
  void testZeroOrMissingValueGivesMissingRatio() {
    assertNull(deriver.ratio(2500, 0));
    assertNull(deriver.ratio(2500, "0"));
    assertNull(deriver.ratio(2500, null));
    assertNull(deriver.ratio(null, 400000));
    assertNull(deriver.ratio(Double.NaN, 400000));
  }

  @Test
  void testPopulationParsing() {
    assertEquals(Long.valueOf(12345), deriver.parsePopulation("12,345"));
    assertEquals(Long.valueOf(1234567), deriver.parsePopulation(" 1,234,567 "));
    assertEquals(Long.valueOf(800), deriver.parsePopulation(800));
    assertEquals(Long.valueOf(800), deriver.parsePopulation(800.0));
    assertNull(deriver.parsePopulation(""));
    assertNull(deriver.parsePopulation("NaN"));
    assertNull(deriver.parsePopulation(Double.NaN));
    assertNull(deriver.parsePopulation("n/a"));
    assertNull(deriver.parsePopulation("12.5"));
    assertNull(deriver.parsePopulation(null));
  }

  @Test
  void testDensityUndefinedForMissingOrZeroOperands() {
    assertEquals(5000.0, deriver.density(10000L, 2.0), 1e-9);
    assertNull(deriver.density(null, 2.0));
    assertNull(deriver.density(10000L, null));
    assertNull(deriver.density(10000L, 0.0));
  }

  @Test
  void testAreaConvertsSquareMetersToSquareMiles() {
    assertEquals(1.0, deriver.areaSquareMiles(MetricsDeriver.SQUARE_METERS_PER_SQUARE_MILE),
        1e-12);

    // a square 1609.344 m on a side is exactly one square mile
    PlanarLayer layer = new PlanarLayer(PlanarCrs.CONUS_ALBERS, Collections.singletonList(
        new KeyedGeometry("n1", new GeometryFactory().toGeometry(
            new Envelope(0, 1609.344, 0, 1609.344)))));
    assertEquals(1.0, deriver.areaSquareMiles(layer).get("n1"), 1e-9);
  }

  @Test
  void testRelationHelpers() {
    Relation relation = Relation.builder("id", "rent", "value", "population")
        .addRow("1", "3000", "600000", "12,345")
        .addRow("2", "3000", "0", null)
        .build();
    Map<String, Double> areas = new HashMap<String, Double>();
    areas.put("1", 2.0);
    areas.put("2", 1.5);

    Relation out = deriver.withAreaAndDensity(
        deriver.withRatio(relation, "rent", "value", "ratio"),
        "id", areas, "population", "area_sq_mi", "pop_density");

    assertEquals(0.5, (Double) out.get(0, "ratio"), 1e-12);
    assertNull(out.get(1, "ratio"));
    assertEquals(12345L, out.get(0, "population"));
    assertEquals(2.0, (Double) out.get(0, "area_sq_mi"), 1e-12);
    assertEquals(6172.5, (Double) out.get(0, "pop_density"), 1e-9);
    assertNull(out.get(1, "population"));
    assertNull(out.get(1, "pop_density"));
  }

  @Test
  void testDensityColumnAddedWithoutPopulation() {
    Relation relation = Relation.builder("id").addRow("1").build();

    Relation out = deriver.withAreaAndDensity(relation, "id",
        Collections.singletonMap("1", 3.0), "population", "area_sq_mi", "pop_density");

    assertFalse(out.hasColumn("population"));
    assertNull(out.get(0, "pop_density"));
  }

  @Test
  void testSuffixedPopulationColumnsAreNotUsed() {
    Relation relation = Relation.builder("id", "population_left", "population_right")
        .addRow("1", "100", "200")
        .build();

    Relation out = deriver.withAreaAndDensity(relation, "id",
        Collections.singletonMap("1", 2.0), "population", "area_sq_mi", "pop_density");

    assertFalse(out.hasColumn("population"));
    assertEquals("100", out.get(0, "population_left"));
    assertNull(out.get(0, "pop_density"));
  }

  @Test
  void testNumericValuesLeniency() {
    assertEquals(3.5, NumericValues.toDouble(" 3.5 "), 1e-12);
    assertEquals(7.0, NumericValues.toDouble(7), 1e-12);
    assertNull(NumericValues.toDouble(""));
    assertNull(NumericValues.toDouble("nan"));
    assertNull(NumericValues.toDouble("abc"));
    assertNull(NumericValues.toDouble(Float.NaN));
  }
}
