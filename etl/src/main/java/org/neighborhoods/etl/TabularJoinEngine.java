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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic left join of two relations on one or more key columns.
 *
 * <p>The join:
 * <ul>
 *   <li>preserves every left row, in order; a left row matching several
 *       right rows is repeated once per match, in right-row order</li>
 *   <li>fills the right columns of unmatched rows with missing values</li>
 *   <li>appends the configured suffix to both sides of a colliding
 *       non-key column name</li>
 *   <li>removes the right-side key columns</li>
 *   <li>optionally renames the incoming value column</li>
 *   <li>de-duplicates on the business key, keeping the first row, so a
 *       one-to-many match cannot multiply neighborhoods</li>
 * </ul>
 *
 * <p>Keys match by exact value equality. A row with a missing key cell
 * matches nothing. Case and whitespace differences are not reconciled.
 */
public class TabularJoinEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(TabularJoinEngine.class);

  /**
   * Joins {@code right} onto {@code left}.
   *
   * @param left Relation whose rows are all preserved
   * @param right Relation supplying the joined columns
   * @param spec Keys, suffixes, rename and de-duplication settings
   * @return Joined relation
   * @throws SchemaMismatchException if a key, the value column or the dedup key is absent,
   *     or if suffixing still leaves duplicate column names
   */
  public Relation leftJoin(Relation left, Relation right, JoinSpec spec) {
    left.requireColumns("Left", spec.getLeftKeys());
    right.requireColumns("Right", spec.getRightKeys());

    List<String> rightValueColumns = new ArrayList<String>();
    for (String column : right.getColumns()) {
      if (!spec.getRightKeys().contains(column)) {
        rightValueColumns.add(column);
      }
    }

    Set<String> collisions = new HashSet<String>(left.getColumns());
    collisions.retainAll(rightValueColumns);

    List<String> outColumns = new ArrayList<String>();
    for (String column : left.getColumns()) {
      outColumns.add(collisions.contains(column) ? column + spec.getLeftSuffix() : column);
    }
    int firstRightColumn = outColumns.size();
    for (String column : rightValueColumns) {
      outColumns.add(collisions.contains(column) ? column + spec.getRightSuffix() : column);
    }

    String renameSource = resolveValueColumn(right, rightValueColumns, spec);
    if (renameSource != null) {
      int position = firstRightColumn + rightValueColumns.indexOf(renameSource);
      outColumns.set(position, spec.getRenamedValueColumn());
    }

    Set<String> unique = new HashSet<String>();
    for (String column : outColumns) {
      if (!unique.add(column)) {
        throw new SchemaMismatchException("Join " + spec + " produces duplicate column '"
            + column + "'; choose different suffixes or rename target");
      }
    }

    int[] leftKeyIdx = indexes(left, spec.getLeftKeys());
    int[] rightKeyIdx = indexes(right, spec.getRightKeys());
    int[] rightValueIdx = indexes(right, rightValueColumns);

    ListMultimap<List<Object>, Integer> index = ArrayListMultimap.create();
    for (int r = 0; r < right.size(); r++) {
      List<Object> key = key(right, r, rightKeyIdx);
      if (key != null) {
        index.put(key, r);
      }
    }

    List<Object[]> out = new ArrayList<Object[]>(left.size());
    int unmatched = 0;
    for (int l = 0; l < left.size(); l++) {
      Object[] leftRow = left.row(l);
      List<Object> key = key(left, l, leftKeyIdx);
      List<Integer> matches = key == null
          ? Collections.<Integer>emptyList()
          : index.get(key);
      if (matches.isEmpty()) {
        unmatched++;
        out.add(Arrays.copyOf(leftRow, outColumns.size()));
        continue;
      }
      for (Integer r : matches) {
        Object[] row = Arrays.copyOf(leftRow, outColumns.size());
        for (int i = 0; i < rightValueIdx.length; i++) {
          row[firstRightColumn + i] = right.get(r, rightValueIdx[i]);
        }
        out.add(row);
      }
    }

    Relation joined = Relation.of(outColumns, out);
    LOGGER.debug("Joined {} left rows with {} right rows on {}: {} rows, {} unmatched",
        left.size(), right.size(), spec.getLeftKeys(), joined.size(), unmatched);

    String dedupKey = spec.getDedupKey();
    if (dedupKey == null) {
      return joined;
    }
    joined.requireColumns("Joined", Collections.singletonList(dedupKey));
    Relation deduplicated = joined.distinctOn(dedupKey);
    int dropped = joined.size() - deduplicated.size();
    if (dropped > 0) {
      LOGGER.warn("Dropped {} row(s) with a repeated '{}' after joining on {}",
          dropped, dedupKey, spec.getLeftKeys());
    }
    return deduplicated;
  }

  private static String resolveValueColumn(Relation right, List<String> rightValueColumns,
      JoinSpec spec) {
    if (spec.getRenamedValueColumn() == null) {
      return null;
    }
    if (spec.isRenameLastColumn()) {
      if (rightValueColumns.isEmpty()) {
        throw new SchemaMismatchException("Right relation has no value column to rename to '"
            + spec.getRenamedValueColumn() + "'");
      }
      return rightValueColumns.get(rightValueColumns.size() - 1);
    }
    String source = spec.getValueColumn();
    if (!rightValueColumns.contains(source)) {
      throw SchemaMismatchException.missingColumns("Right",
          Collections.singletonList(source), right.getColumns());
    }
    return source;
  }

  private static int[] indexes(Relation relation, List<String> columns) {
    int[] result = new int[columns.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = relation.indexOf(columns.get(i));
    }
    return result;
  }

  /** Returns the key tuple of a row, or null if any key cell is missing. */
  private static List<Object> key(Relation relation, int row, int[] keyIdx) {
    List<Object> key = new ArrayList<Object>(keyIdx.length);
    for (int idx : keyIdx) {
      Object value = relation.get(row, idx);
      if (value == null) {
        return null;
      }
      key.add(value);
    }
    return key;
  }
}
