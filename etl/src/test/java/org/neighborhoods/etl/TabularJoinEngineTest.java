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
package org.neighborhoods.etl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TabularJoinEngine}.
 */
@Tag("unit")
class TabularJoinEngineTest {

  private TabularJoinEngine engine;
  private Relation points;

  @BeforeEach
  void setUp() {
    engine = new TabularJoinEngine();
    points = Relation.builder("id", "neighborhood", "city_name", "state_id")
        .addRow("1", "Echo Park", "Los Angeles", "CA")
        .addRow("2", "Silver Lake", "Los Angeles", "CA")
        .addRow("3", "Mission", "San Francisco", "CA")
        .build();
  }

  @Test
  void testLeftJoinPreservesEveryLeftRow() {
    Relation zori = Relation.builder("RegionName", "2024-02-29")
        .addRow("Los Angeles", "2900")
        .build();

    Relation joined = engine.leftJoin(points, zori, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("RegionName")
        .renameValue("2024-02-29", "city_ZORI")
        .build());

    assertEquals(Arrays.asList("id", "neighborhood", "city_name", "state_id", "city_ZORI"),
        joined.getColumns());
    assertEquals(3, joined.size());
    assertEquals("2900", joined.get(0, "city_ZORI"));
    assertEquals("2900", joined.get(1, "city_ZORI"));
    assertNull(joined.get(2, "city_ZORI"));
  }

  @Test
  void testMultiKeyJoinDropsRightKeys() {
    Relation zhvi = Relation.builder("RegionName", "State", "City", "2024-02-29")
        .addRow("Echo Park", "CA", "Los Angeles", "1100000")
        .addRow("Echo Park", "TX", "Austin", "500000")
        .build();

    Relation joined = engine.leftJoin(points, zhvi, JoinSpec.builder()
        .leftKeys("neighborhood", "state_id", "city_name")
        .rightKeys("RegionName", "State", "City")
        .renameValue("2024-02-29", "neighborhood_ZHVI")
        .build());

    assertFalse(joined.hasColumn("RegionName"));
    assertFalse(joined.hasColumn("State"));
    assertFalse(joined.hasColumn("City"));
    assertEquals("1100000", joined.get(0, "neighborhood_ZHVI"));
    assertNull(joined.get(1, "neighborhood_ZHVI"));
  }

  @Test
  void testCollidingColumnsGetSuffixes() {
    Relation walk = Relation.builder("neighborhood", "city_name", "walk_score")
        .addRow("Echo Park", "LA", "88")
        .build();

    Relation joined = engine.leftJoin(points, walk, JoinSpec.builder()
        .leftKeys("neighborhood")
        .rightKeys("neighborhood")
        .build());

    assertEquals(Arrays.asList("id", "neighborhood", "city_name_left", "state_id",
        "city_name_right", "walk_score"), joined.getColumns());
    assertEquals("Los Angeles", joined.get(0, "city_name_left"));
    assertEquals("LA", joined.get(0, "city_name_right"));
  }

  @Test
  void testRenameTargetsSuffixedColumn() {
    Relation right = Relation.builder("city", "state_id")
        .addRow("Los Angeles", "California")
        .build();

    Relation joined = engine.leftJoin(points, right, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("city")
        .renameValue("state_id", "state_name")
        .build());

    assertTrue(joined.hasColumn("state_id_left"));
    assertEquals("California", joined.get(0, "state_name"));
  }

  @Test
  void testOneToManyMatchIsDeduplicatedKeepingFirst() {
    Relation zori = Relation.builder("RegionName", "value")
        .addRow("Los Angeles", "2900")
        .addRow("Los Angeles", "3100")
        .build();

    Relation joined = engine.leftJoin(points, zori, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("RegionName")
        .build());

    assertEquals(3, joined.size());
    assertEquals("2900", joined.get(0, "value"));
    assertEquals("Silver Lake", joined.get(1, "neighborhood"));
    assertEquals("2900", joined.get(1, "value"));
  }

  @Test
  void testRowsWithoutNeighborhoodCollapseToFirst() {
    Relation left = Relation.builder("id", "neighborhood", "city_name")
        .addRow("1", null, "Los Angeles")
        .addRow("2", null, "Los Angeles")
        .addRow("3", "Mission", "San Francisco")
        .build();
    Relation zori = Relation.builder("RegionName", "value")
        .addRow("Los Angeles", "2900")
        .build();

    Relation joined = engine.leftJoin(left, zori, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("RegionName")
        .build());

    assertEquals(2, joined.size());
    assertEquals("1", joined.get(0, "id"));
    assertEquals("3", joined.get(1, "id"));
  }

  @Test
  void testWithoutDedupOneToManyRepeatsLeftRows() {
    Relation zori = Relation.builder("RegionName", "value")
        .addRow("Los Angeles", "2900")
        .addRow("Los Angeles", "3100")
        .build();

    Relation joined = engine.leftJoin(points, zori, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("RegionName")
        .noDedup()
        .build());

    assertEquals(5, joined.size());
    assertEquals("3100", joined.get(1, "value"));
  }

  @Test
  void testMissingLeftKeyIsSchemaMismatch() {
    Relation right = Relation.builder("RegionName", "value").build();
    SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () ->
        engine.leftJoin(points, right, JoinSpec.builder()
            .leftKeys("county")
            .rightKeys("RegionName")
            .build()));
    assertTrue(e.getMessage().contains("county"));
  }

  @Test
  void testMissingRightKeyIsSchemaMismatch() {
    Relation right = Relation.builder("Region", "value").build();
    assertThrows(SchemaMismatchException.class, () ->
        engine.leftJoin(points, right, JoinSpec.builder()
            .leftKeys("city_name")
            .rightKeys("RegionName")
            .build()));
  }

  @Test
  void testMissingRenameSourceIsSchemaMismatch() {
    Relation right = Relation.builder("RegionName", "2024-01-31").build();
    assertThrows(SchemaMismatchException.class, () ->
        engine.leftJoin(points, right, JoinSpec.builder()
            .leftKeys("city_name")
            .rightKeys("RegionName")
            .renameValue("2024-02-29", "city_ZORI")
            .build()));
  }

  @SuppressWarnings("deprecation")
  @Test
  void testRenameLastColumnUsesRightValueColumns() {
    Relation right = Relation.builder("RegionName", "2024-01-31", "2024-02-29")
        .addRow("Los Angeles", "2800", "2900")
        .build();

    Relation joined = engine.leftJoin(points, right, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("RegionName")
        .renameLastColumn("city_ZORI")
        .build());

    assertEquals("2900", joined.get(0, "city_ZORI"));
    assertEquals("2800", joined.get(0, "2024-01-31"));
  }

  @Test
  void testMissingKeyCellNeverMatches() {
    Relation left = Relation.builder("neighborhood", "city_name")
        .addRow("Nowhere", null)
        .build();
    Relation right = Relation.builder("RegionName", "value")
        .addRow(null, "1")
        .build();

    Relation joined = engine.leftJoin(left, right, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("RegionName")
        .build());

    assertEquals(1, joined.size());
    assertNull(joined.get(0, "value"));
  }

  @Test
  void testSelfJoinOnUniqueKeyReproducesRelation() {
    Relation joined = engine.leftJoin(points, points.select(Collections.singletonList("id")),
        JoinSpec.builder()
            .leftKeys("id")
            .rightKeys("id")
            .build());

    assertEquals(points, joined);
  }

  @Test
  void testSelfJoinDiscardingDuplicateColumnsReproducesRelation() {
    Relation joined = engine.leftJoin(points, points, JoinSpec.builder()
        .leftKeys("id")
        .rightKeys("id")
        .dedupKey("id")
        .build());

    Relation restored = joined
        .dropIfPresent(Arrays.asList("neighborhood_right", "city_name_right", "state_id_right"))
        .rename(Map.of(
            "neighborhood_left", "neighborhood",
            "city_name_left", "city_name",
            "state_id_left", "state_id"));

    assertEquals(points, restored);
  }

  @Test
  void testExactStringMatchOnly() {
    Relation zori = Relation.builder("RegionName", "value")
        .addRow("los angeles", "2900")
        .addRow("Los Angeles ", "3000")
        .build();

    Relation joined = engine.leftJoin(points, zori, JoinSpec.builder()
        .leftKeys("city_name")
        .rightKeys("RegionName")
        .build());

    assertNull(joined.get(0, "value"));
  }
}
