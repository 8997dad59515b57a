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
package org.neighborhoods.fusion.output;

import org.neighborhoods.etl.CsvRelationReader;
import org.neighborhoods.etl.Relation;
import org.neighborhoods.fusion.pipeline.FusedNeighborhood;
import org.neighborhoods.fusion.pipeline.FusionResult;
import org.neighborhoods.fusion.spatial.GeographicCrs;
import org.neighborhoods.fusion.spatial.GeographicLayer;
import org.neighborhoods.fusion.spatial.KeyedGeometry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link NeighborhoodCsvWriter} and {@link NeighborhoodGeoJsonWriter}.
 */
@Tag("unit")
class NeighborhoodWritersTest {

  @TempDir
  Path tempDir;

  private static FusionResult result() {
    GeometryFactory factory = new GeometryFactory();
    Geometry alpha = factory.toGeometry(new Envelope(-118.002, -117.998, 33.999, 34.001));
    Geometry beta = factory.toGeometry(new Envelope(-117.992, -117.990, 33.999, 34.001));
    Relation table = Relation.builder("id", "neighborhood", "population", "area_sq_mi",
            "pop_density")
        .addRow("1", "Alpha", 12345L, 0.2, 61725.0)
        .addRow("2", "Beta", null, 0.1, null)
        .build();
    List<FusedNeighborhood> neighborhoods = new ArrayList<FusedNeighborhood>();
    neighborhoods.add(new FusedNeighborhood("1", table.record(0), alpha));
    neighborhoods.add(new FusedNeighborhood("2", table.record(1), beta));
    return FusionResult.builder()
        .neighborhoods(neighborhoods)
        .table(table)
        .boundaries(new GeographicLayer(GeographicCrs.WGS84, Arrays.asList(
            new KeyedGeometry("1", alpha), new KeyedGeometry("2", beta))))
        .build();
  }

  @Test
  void testCsvHasOneRowPerNeighborhoodWithWktGeometry() throws IOException, ParseException {
    Path file = tempDir.resolve("csvs/block_neighborhoods.csv");

    new NeighborhoodCsvWriter().write(result(), file);

    Relation written = new CsvRelationReader().read(file);
    assertEquals(Arrays.asList("id", "neighborhood", "population", "area_sq_mi", "pop_density",
        "geometry"), written.getColumns());
    assertEquals(2, written.size());
    assertEquals("12345", written.get(0, "population"));
    assertNull(written.get(1, "pop_density"));
    Geometry alpha = new WKTReader().read((String) written.get(0, "geometry"));
    assertEquals("Polygon", alpha.getGeometryType());
    assertEquals(-118.002, alpha.getEnvelopeInternal().getMinX(), 1e-9);
  }

  @Test
  void testGeoJsonFeatureCollection() throws IOException {
    Path file = tempDir.resolve("geojsons/block_neighborhoods.geojson");

    new NeighborhoodGeoJsonWriter().write(result(), file);

    JsonNode root = new ObjectMapper().readTree(file.toFile());
    assertEquals("FeatureCollection", root.path("type").asText());
    assertEquals(2, root.path("features").size());
    JsonNode alpha = root.path("features").get(0);
    assertEquals("Feature", alpha.path("type").asText());
    assertEquals("1", alpha.path("id").asText());
    assertEquals("Alpha", alpha.path("properties").path("neighborhood").asText());
    assertEquals(12345L, alpha.path("properties").path("population").asLong());
    assertEquals(0.2, alpha.path("properties").path("area_sq_mi").asDouble(), 1e-12);
    assertEquals("Polygon", alpha.path("geometry").path("type").asText());
    assertEquals(-118.002,
        alpha.path("geometry").path("coordinates").get(0).get(0).get(0).asDouble(), 1e-9);
    assertTrue(alpha.path("geometry").path("crs").isMissingNode());
    JsonNode beta = root.path("features").get(1);
    assertTrue(beta.path("properties").has("pop_density"));
    assertTrue(beta.path("properties").path("pop_density").isNull());
  }
}
