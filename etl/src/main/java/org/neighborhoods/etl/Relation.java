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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable, column-ordered table of rows.
 *
 * <p>Cells hold {@link String}, {@link Number} or {@code null} (missing).
 * Column names are unique. Every transformation returns a new relation; the
 * receiver is never changed, so a relation can be handed from one pipeline
 * step to the next without defensive copies.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Relation points = Relation.builder("id", "neighborhood", "city_name")
 *     .addRow("1", "Echo Park", "Los Angeles")
 *     .addRow("2", "Silver Lake", "Los Angeles")
 *     .build();
 *
 * Relation narrowed = points.select(Arrays.asList("id", "neighborhood"));
 * }</pre>
 */
public final class Relation {

  private final ImmutableList<String> columns;
  private final ImmutableMap<String, Integer> positions;
  private final List<Object[]> rows;

  private Relation(List<String> columns, List<Object[]> rows) {
    this.columns = ImmutableList.copyOf(columns);
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    Set<String> seen = new HashSet<String>();
    for (int i = 0; i < this.columns.size(); i++) {
      String column = this.columns.get(i);
      if (!seen.add(column)) {
        throw new IllegalArgumentException("Duplicate column name: " + column);
      }
      builder.put(column, i);
    }
    this.positions = builder.build();
    List<Object[]> copy = new ArrayList<Object[]>(rows.size());
    for (Object[] row : rows) {
      if (row.length != this.columns.size()) {
        throw new IllegalArgumentException("Row has " + row.length
            + " cells but relation has " + this.columns.size() + " columns");
      }
      copy.add(row.clone());
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  /**
   * Creates a relation from column names and row arrays. Rows are copied.
   */
  public static Relation of(List<String> columns, List<Object[]> rows) {
    return new Relation(columns, rows);
  }

  /**
   * Creates a relation from records keyed by column name; absent keys become missing cells.
   */
  public static Relation fromRecords(List<String> columns,
      List<? extends Map<String, ?>> records) {
    List<Object[]> rows = new ArrayList<Object[]>(records.size());
    for (Map<String, ?> record : records) {
      Object[] row = new Object[columns.size()];
      for (int i = 0; i < columns.size(); i++) {
        row[i] = record.get(columns.get(i));
      }
      rows.add(row);
    }
    return new Relation(columns, rows);
  }

  public static Relation empty(List<String> columns) {
    return new Relation(columns, Collections.<Object[]>emptyList());
  }

  public static Builder builder(String... columns) {
    return new Builder(Arrays.asList(columns));
  }

  public static Builder builder(List<String> columns) {
    return new Builder(columns);
  }

  public List<String> getColumns() {
    return columns;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return positions.containsKey(column);
  }

  /**
   * Returns the position of a column.
   *
   * @throws SchemaMismatchException if the column does not exist
   */
  public int indexOf(String column) {
    Integer position = positions.get(column);
    if (position == null) {
      throw SchemaMismatchException.missingColumns("Input",
          Collections.singletonList(column), columns);
    }
    return position;
  }

  /**
   * Verifies that every named column is present.
   *
   * @param relationName Name used in the error message
   * @param required Columns that must exist
   * @throws SchemaMismatchException listing all absent columns
   */
  public void requireColumns(String relationName, Collection<String> required) {
    Set<String> missing = new LinkedHashSet<String>();
    for (String column : required) {
      if (!positions.containsKey(column)) {
        missing.add(column);
      }
    }
    if (!missing.isEmpty()) {
      throw SchemaMismatchException.missingColumns(relationName, missing, columns);
    }
  }

  /**
   * Returns the name of the last column.
   */
  public String lastColumn() {
    if (columns.isEmpty()) {
      throw new IllegalStateException("Relation has no columns");
    }
    return columns.get(columns.size() - 1);
  }

  public @Nullable Object get(int row, String column) {
    return rows.get(row)[indexOf(column)];
  }

  public @Nullable Object get(int row, int column) {
    return rows.get(row)[column];
  }

  /**
   * Returns a copy of one row's cells in column order.
   */
  public Object[] row(int row) {
    return rows.get(row).clone();
  }

  /**
   * Returns one row as an insertion-ordered map of column name to value.
   */
  public Map<String, Object> record(int row) {
    Object[] cells = rows.get(row);
    Map<String, Object> record = new LinkedHashMap<String, Object>();
    for (int i = 0; i < columns.size(); i++) {
      record.put(columns.get(i), cells[i]);
    }
    return record;
  }

  public List<Map<String, Object>> toRecords() {
    List<Map<String, Object>> records = new ArrayList<Map<String, Object>>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      records.add(record(i));
    }
    return records;
  }

  /**
   * Returns a relation with only the named columns, in the given order.
   */
  public Relation select(List<String> selected) {
    requireColumns("Input", selected);
    int[] source = new int[selected.size()];
    for (int i = 0; i < source.length; i++) {
      source[i] = positions.get(selected.get(i));
    }
    List<Object[]> projected = new ArrayList<Object[]>(rows.size());
    for (Object[] row : rows) {
      Object[] out = new Object[source.length];
      for (int i = 0; i < source.length; i++) {
        out[i] = row[source[i]];
      }
      projected.add(out);
    }
    return new Relation(selected, projected);
  }

  /**
   * Returns a relation without the named columns; names that are not present are ignored.
   */
  public Relation dropIfPresent(Collection<String> dropped) {
    List<String> kept = new ArrayList<String>();
    for (String column : columns) {
      if (!dropped.contains(column)) {
        kept.add(column);
      }
    }
    return kept.size() == columns.size() ? this : select(kept);
  }

  /**
   * Renames columns.
   *
   * @param renames Old name to new name
   * @throws SchemaMismatchException if an old name is absent
   */
  public Relation rename(Map<String, String> renames) {
    requireColumns("Input", renames.keySet());
    List<String> renamed = new ArrayList<String>(columns.size());
    for (String column : columns) {
      String target = renames.get(column);
      renamed.add(target != null ? target : column);
    }
    return new Relation(renamed, rows);
  }

  /**
   * Adds a column computed from each row, or replaces it if it already exists.
   *
   * @param column Name of the computed column
   * @param function Computes the cell from the row's record
   */
  public Relation withColumn(String column,
      Function<Map<String, Object>, @Nullable Object> function) {
    Integer existing = positions.get(column);
    List<String> outColumns = new ArrayList<String>(columns);
    if (existing == null) {
      outColumns.add(column);
    }
    int target = existing != null ? existing : columns.size();
    List<Object[]> out = new ArrayList<Object[]>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      Object value = function.apply(record(i));
      Object[] row = Arrays.copyOf(rows.get(i), outColumns.size());
      row[target] = value;
      out.add(row);
    }
    return new Relation(outColumns, out);
  }

  /**
   * Removes rows whose key repeats an earlier row's key, keeping the first occurrence.
   * A missing key counts as one value: only the first row without a key is kept.
   */
  public Relation distinctOn(String keyColumn) {
    int key = indexOf(keyColumn);
    Set<Object> seen = new HashSet<Object>();
    boolean seenMissing = false;
    List<Object[]> kept = new ArrayList<Object[]>(rows.size());
    for (Object[] row : rows) {
      if (row[key] == null) {
        if (!seenMissing) {
          seenMissing = true;
          kept.add(row);
        }
      } else if (seen.add(row[key])) {
        kept.add(row);
      }
    }
    return kept.size() == rows.size() ? this : new Relation(columns, kept);
  }

  /**
   * Returns the distinct non-missing values of a column in order of first appearance.
   */
  public List<Object> distinctValues(String column) {
    int index = indexOf(column);
    Set<Object> values = new LinkedHashSet<Object>();
    for (Object[] row : rows) {
      if (row[index] != null) {
        values.add(row[index]);
      }
    }
    return new ArrayList<Object>(values);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Relation)) {
      return false;
    }
    Relation that = (Relation) o;
    if (!columns.equals(that.columns) || rows.size() != that.rows.size()) {
      return false;
    }
    for (int i = 0; i < rows.size(); i++) {
      if (!Arrays.equals(rows.get(i), that.rows.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override public int hashCode() {
    int hash = columns.hashCode();
    for (Object[] row : rows) {
      hash = 31 * hash + Arrays.hashCode(row);
    }
    return hash;
  }

  @Override public String toString() {
    return "Relation{columns=" + columns + ", rows=" + rows.size() + "}";
  }

  /**
   * Builder for Relation.
   */
  public static class Builder {
    private final List<String> columns;
    private final List<Object[]> rows = new ArrayList<Object[]>();

    private Builder(List<String> columns) {
      this.columns = new ArrayList<String>(Objects.requireNonNull(columns, "columns"));
    }

    public Builder addRow(Object... cells) {
      rows.add(cells.clone());
      return this;
    }

    public Builder addRecord(Map<String, ?> record) {
      Object[] row = new Object[columns.size()];
      for (int i = 0; i < row.length; i++) {
        row[i] = record.get(columns.get(i));
      }
      rows.add(row);
      return this;
    }

    public Relation build() {
      return new Relation(columns, rows);
    }
  }
}
