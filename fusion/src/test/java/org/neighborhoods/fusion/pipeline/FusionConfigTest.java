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

import org.neighborhoods.etl.JoinSpec;
import org.neighborhoods.fusion.geo.CensusGeography;
import org.neighborhoods.fusion.geo.GeographyServiceConfig;
import org.neighborhoods.fusion.spatial.GeographicCrs;
import org.neighborhoods.fusion.spatial.PlanarCrs;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FusionConfig}.
 */
@Tag("unit")
class FusionConfigTest {

  @TempDir
  Path tempDir;

  @Test
  void testDefaults() {
    FusionConfig config = FusionConfig.defaults();

    assertSame(CensusGeography.BLOCK, config.getGeography());
    assertSame(PlanarCrs.CONUS_ALBERS, config.getPlanarCrs());
    assertSame(GeographicCrs.WGS84, config.getGeographicCrs());
    assertEquals(JoinSpec.DEFAULT_DEDUP_KEY, config.getDedupKey());
    assertNull(config.getNeighborhoodValueColumn());
    assertFalse(config.isParallelAssignment());
    assertEquals(GeographyServiceConfig.DEFAULT_BASE_URL,
        config.getGeographyService().getBaseUrl());
    assertEquals(3, config.getGeographyService().getRetry().getMaxRetries());
  }

  @Test
  void testYamlFile() throws IOException {
    Path file = tempDir.resolve("fusion.yaml");
    Files.write(file, ("geography: block_group\n"
        + "planarCrs: EPSG:3857\n"
        + "dedupKey: id\n"
        + "neighborhoodValueColumn: \"2024-02-29\"\n"
        + "parallelAssignment: true\n"
        + "overlapTolerance: 0.001\n"
        + "geographyService:\n"
        + "  apiKey: \"{env:NEIGHBORHOOD_FUSION_TEST_UNSET_KEY}\"\n"
        + "  pageSize: 250\n"
        + "  retry:\n"
        + "    maxRetries: 5\n"
        + "    initialBackoffMs: 10\n").getBytes(StandardCharsets.UTF_8));

    FusionConfig config = FusionConfig.fromYaml(file);

    assertSame(CensusGeography.BLOCK_GROUP, config.getGeography());
    assertSame(PlanarCrs.WEB_MERCATOR, config.getPlanarCrs());
    assertEquals("id", config.getDedupKey());
    assertEquals("2024-02-29", config.getNeighborhoodValueColumn());
    assertTrue(config.isParallelAssignment());
    assertEquals(0.001, config.getOverlapTolerance(), 1e-12);
    assertEquals(250, config.getGeographyService().getPageSize());
    assertEquals(5, config.getGeographyService().getRetry().getMaxRetries());
    assertEquals(10, config.getGeographyService().getRetry().getInitialBackoffMs());
    // unset variables substitute to empty, which means no key
    assertNull(config.getGeographyService().getApiKey());
  }

  @Test
  void testExplicitNullDedupKeyDisablesDeduplication() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("dedupKey", null);

    assertNull(FusionConfig.fromMap(map).getDedupKey());
  }

  @Test
  void testGeographyOverrideKeepsOtherSettings() {
    FusionConfig config = FusionConfig.builder()
        .planarCrs(PlanarCrs.WEB_MERCATOR)
        .parallelAssignment(true)
        .build()
        .withGeography(CensusGeography.TRACT);

    assertSame(CensusGeography.TRACT, config.getGeography());
    assertSame(PlanarCrs.WEB_MERCATOR, config.getPlanarCrs());
    assertTrue(config.isParallelAssignment());
  }

  @Test
  void testInvalidValuesRejected() {
    Map<String, Object> geography = new HashMap<String, Object>();
    geography.put("geography", "county");
    Map<String, Object> crs = new HashMap<String, Object>();
    crs.put("planarCrs", "EPSG:4326");

    assertThrows(IllegalArgumentException.class, () -> FusionConfig.fromMap(geography));
    assertThrows(IllegalArgumentException.class, () -> FusionConfig.fromMap(crs));
  }
}
