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

import org.neighborhoods.fusion.NoReferenceGeometryException;
import org.neighborhoods.fusion.UnmatchedBoundaryException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link NearestAssignment}.
 */
@Tag("unit")
class NearestAssignmentTest {

  private final GeometryFactory factory = new GeometryFactory();

  private Geometry point(double x, double y) {
    return factory.createPoint(new Coordinate(x, y));
  }

  private Polygon square(double centerX, double centerY, double size) {
    double h = size / 2;
    return factory.createPolygon(new Coordinate[] {
        new Coordinate(centerX - h, centerY - h),
        new Coordinate(centerX + h, centerY - h),
        new Coordinate(centerX + h, centerY + h),
        new Coordinate(centerX - h, centerY + h),
        new Coordinate(centerX - h, centerY - h)});
  }

  private static PlanarLayer layer(KeyedGeometry... features) {
    return new PlanarLayer(PlanarCrs.CONUS_ALBERS, Arrays.asList(features));
  }

  private PlanarLayer threeNeighborhoods() {
    return layer(
        new KeyedGeometry("origin", point(0, 0)),
        new KeyedGeometry("east", point(10, 0)),
        new KeyedGeometry("north", point(0, 10)));
  }

  @Test
  void testUnitCenteredNearOriginGoesToOrigin() {
    PlanarLayer units = layer(new KeyedGeometry("u1", square(1, 0, 1)));

    Map<String, String> result = new NearestAssignment().assign(units, threeNeighborhoods());

    assertEquals(Collections.singletonMap("u1", "origin"), result);
  }

  @Test
  void testEveryUnitAssignedInLayerOrder() {
    PlanarLayer units = layer(
        new KeyedGeometry("u-north", square(1, 9, 1)),
        new KeyedGeometry("u-east", square(9, 1, 1)),
        new KeyedGeometry("u-origin", square(1, 1, 1)));

    Map<String, String> result = new NearestAssignment().assign(units, threeNeighborhoods());

    assertEquals(Arrays.asList("u-north", "u-east", "u-origin"),
        new ArrayList<String>(result.keySet()));
    assertEquals("north", result.get("u-north"));
    assertEquals("east", result.get("u-east"));
    assertEquals("origin", result.get("u-origin"));
  }

  @Test
  void testEquidistantReferencesResolveToFirstInOrder() {
    PlanarLayer units = layer(new KeyedGeometry("middle", square(5, 0, 2)));

    Map<String, String> westFirst = new NearestAssignment().assign(units, layer(
        new KeyedGeometry("west", point(0, 0)),
        new KeyedGeometry("east", point(10, 0))));
    Map<String, String> eastFirst = new NearestAssignment().assign(units, layer(
        new KeyedGeometry("east", point(10, 0)),
        new KeyedGeometry("west", point(0, 0))));

    assertEquals("west", westFirst.get("middle"));
    assertEquals("east", eastFirst.get("middle"));
  }

  @Test
  void testPointInsideReferencePolygonHasZeroDistance() {
    PlanarLayer queries = layer(new KeyedGeometry("q", point(5, 5)));
    PlanarLayer references = layer(
        new KeyedGeometry("near-point", point(5, 6)),
        new KeyedGeometry("covering", square(5, 5, 2)));

    assertEquals("covering", new NearestAssignment().assign(queries, references).get("q"));
  }

  @Test
  void testEmptyReferencesFail() {
    PlanarLayer units = layer(new KeyedGeometry("u1", square(1, 0, 1)));

    assertThrows(NoReferenceGeometryException.class,
        () -> new NearestAssignment().assign(units, layer()));
  }

  @Test
  void testEmptyQueriesGiveEmptyAssignment() {
    assertTrue(new NearestAssignment().assign(layer(), threeNeighborhoods()).isEmpty());
  }

  @Test
  void testMixedReferenceSystemsRejected() {
    PlanarLayer units = new PlanarLayer(PlanarCrs.WEB_MERCATOR,
        Collections.singletonList(new KeyedGeometry("u1", square(1, 0, 1))));

    assertThrows(IllegalArgumentException.class,
        () -> new NearestAssignment().assign(units, threeNeighborhoods()));
  }

  @Test
  void testEmptyUnitGeometryCannotBeAssigned() {
    PlanarLayer units = layer(
        new KeyedGeometry("u1", square(1, 0, 1)),
        new KeyedGeometry("hollow", factory.createPolygon()));

    UnmatchedBoundaryException e = assertThrows(UnmatchedBoundaryException.class,
        () -> new NearestAssignment().assign(units, threeNeighborhoods()));
    assertEquals(Collections.singletonList("hollow"), e.getUnassignedUnits());
  }

  @Test
  void testEmptyReferenceGeometryRejected() {
    PlanarLayer units = layer(new KeyedGeometry("u1", square(1, 0, 1)));
    PlanarLayer references = layer(
        new KeyedGeometry("a", point(0, 0)),
        new KeyedGeometry("nowhere", factory.createPoint()));

    assertThrows(IllegalArgumentException.class,
        () -> new NearestAssignment().assign(units, references));
  }

  @Test
  void testParallelMatchesSequential() {
    List<KeyedGeometry> grid = new ArrayList<KeyedGeometry>();
    for (int x = 0; x < 20; x++) {
      for (int y = 0; y < 20; y++) {
        grid.add(new KeyedGeometry(x + ":" + y, square(x * 0.5, y * 0.5, 0.5)));
      }
    }
    PlanarLayer units = new PlanarLayer(PlanarCrs.CONUS_ALBERS, grid);

    Map<String, String> sequential = new NearestAssignment(false).assign(units,
        threeNeighborhoods());
    Map<String, String> parallel = new NearestAssignment(true).assign(units,
        threeNeighborhoods());

    assertEquals(sequential, parallel);
    assertEquals(new ArrayList<String>(sequential.keySet()),
        new ArrayList<String>(parallel.keySet()));
  }
}
