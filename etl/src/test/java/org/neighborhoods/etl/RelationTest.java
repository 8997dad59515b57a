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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Relation}.
 */
@Tag("unit")
class RelationTest {

  private final Relation relation = Relation.builder("id", "name", "value")
      .addRow("1", "a", "10")
      .addRow("2", "b", null)
      .addRow("3", "a", "30")
      .build();

  @Test
  void testDuplicateColumnNamesRejected() {
    assertThrows(IllegalArgumentException.class, () -> Relation.builder("a", "a").build());
  }

  @Test
  void testRowWidthMustMatchColumns() {
    assertThrows(IllegalArgumentException.class, () ->
        Relation.builder("a", "b").addRow("only one").build());
  }

  @Test
  void testSelectReordersColumns() {
    Relation selected = relation.select(Arrays.asList("value", "id"));
    assertEquals(Arrays.asList("value", "id"), selected.getColumns());
    assertEquals("10", selected.get(0, "value"));
  }

  @Test
  void testSelectMissingColumnIsSchemaMismatch() {
    assertThrows(SchemaMismatchException.class, () ->
        relation.select(Collections.singletonList("missing")));
  }

  @Test
  void testDistinctOnKeepsFirstOccurrence() {
    Relation distinct = relation.distinctOn("name");
    assertEquals(2, distinct.size());
    assertEquals("1", distinct.get(0, "id"));
    assertEquals("2", distinct.get(1, "id"));
  }

  @Test
  void testDistinctOnTreatsMissingKeysAsEqual() {
    Relation withMissing = Relation.builder("id", "name")
        .addRow("1", null)
        .addRow("2", "a")
        .addRow("3", null)
        .build();

    Relation distinct = withMissing.distinctOn("name");

    assertEquals(2, distinct.size());
    assertEquals("1", distinct.get(0, "id"));
    assertEquals("2", distinct.get(1, "id"));
  }

  @Test
  void testWithColumnAppendsAndReplaces() {
    Relation added = relation.withColumn("double", r -> r.get("id") + r.get("id").toString());
    assertEquals("11", added.get(0, "double"));
    Relation replaced = added.withColumn("value", r -> "x");
    assertEquals(4, replaced.getColumns().size());
    assertEquals("x", replaced.get(1, "value"));
  }

  @Test
  void testTransformationsLeaveReceiverUnchanged() {
    relation.rename(Collections.singletonMap("name", "label"));
    relation.dropIfPresent(Collections.singletonList("value"));
    assertEquals(Arrays.asList("id", "name", "value"), relation.getColumns());
  }

  @Test
  void testDistinctValuesInFirstSeenOrder() {
    List<Object> names = relation.distinctValues("name");
    assertEquals(Arrays.<Object>asList("a", "b"), names);
  }

  @Test
  void testEquality() {
    Relation copy = Relation.of(relation.getColumns(),
        Arrays.asList(relation.row(0), relation.row(1), relation.row(2)));
    assertEquals(relation, copy);
    assertEquals(relation.hashCode(), copy.hashCode());
    assertNotEquals(relation, relation.distinctOn("name"));
  }
}
