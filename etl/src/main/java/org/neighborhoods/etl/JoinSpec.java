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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Describes one left join performed by {@link TabularJoinEngine}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * JoinSpec spec = JoinSpec.builder()
 *     .leftKeys("neighborhood", "state_id", "city_name")
 *     .rightKeys("RegionName", "State", "City")
 *     .renameValue("2024-02-29", "neighborhood_ZHVI")
 *     .build();
 * }</pre>
 *
 * <p>The value column to rename is named explicitly. {@link Builder#renameLastColumn}
 * keeps the older position-based convention available, but resolves the
 * position against the right relation's non-key columns only, never against
 * whatever happens to be last in the joined result.
 */
public final class JoinSpec {

  /** Business key used for de-duplication unless configured otherwise. */
  public static final String DEFAULT_DEDUP_KEY = "neighborhood";

  private final ImmutableList<String> leftKeys;
  private final ImmutableList<String> rightKeys;
  private final String leftSuffix;
  private final String rightSuffix;
  private final @Nullable String valueColumn;
  private final @Nullable String renamedValueColumn;
  private final boolean renameLastColumn;
  private final @Nullable String dedupKey;

  private JoinSpec(Builder builder) {
    this.leftKeys = ImmutableList.copyOf(builder.leftKeys);
    this.rightKeys = ImmutableList.copyOf(builder.rightKeys);
    this.leftSuffix = builder.leftSuffix;
    this.rightSuffix = builder.rightSuffix;
    this.valueColumn = builder.valueColumn;
    this.renamedValueColumn = builder.renamedValueColumn;
    this.renameLastColumn = builder.renameLastColumn;
    this.dedupKey = builder.dedupKey;
  }

  public List<String> getLeftKeys() {
    return leftKeys;
  }

  public List<String> getRightKeys() {
    return rightKeys;
  }

  public String getLeftSuffix() {
    return leftSuffix;
  }

  public String getRightSuffix() {
    return rightSuffix;
  }

  /**
   * Returns the right-side column whose joined copy is renamed, or null.
   */
  public @Nullable String getValueColumn() {
    return valueColumn;
  }

  public @Nullable String getRenamedValueColumn() {
    return renamedValueColumn;
  }

  public boolean isRenameLastColumn() {
    return renameLastColumn;
  }

  /**
   * Returns the column rows are de-duplicated on, or null if de-duplication is off.
   */
  public @Nullable String getDedupKey() {
    return dedupKey;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "JoinSpec{" + leftKeys + " = " + rightKeys
        + (renamedValueColumn != null ? ", rename -> " + renamedValueColumn : "")
        + (dedupKey != null ? ", dedup on " + dedupKey : "") + "}";
  }

  /**
   * Builder for JoinSpec.
   */
  public static class Builder {
    private List<String> leftKeys;
    private List<String> rightKeys;
    private String leftSuffix = "_left";
    private String rightSuffix = "_right";
    private @Nullable String valueColumn;
    private @Nullable String renamedValueColumn;
    private boolean renameLastColumn;
    private @Nullable String dedupKey = DEFAULT_DEDUP_KEY;

    public Builder leftKeys(String... keys) {
      return leftKeys(Arrays.asList(keys));
    }

    public Builder leftKeys(List<String> keys) {
      this.leftKeys = keys;
      return this;
    }

    public Builder rightKeys(String... keys) {
      return rightKeys(Arrays.asList(keys));
    }

    public Builder rightKeys(List<String> keys) {
      this.rightKeys = keys;
      return this;
    }

    public Builder suffixes(String leftSuffix, String rightSuffix) {
      this.leftSuffix = leftSuffix;
      this.rightSuffix = rightSuffix;
      return this;
    }

    /**
     * Renames the joined copy of a right-side column.
     *
     * @param sourceColumn Column of the right relation
     * @param targetColumn Name in the joined result
     */
    public Builder renameValue(String sourceColumn, String targetColumn) {
      this.valueColumn = sourceColumn;
      this.renamedValueColumn = targetColumn;
      this.renameLastColumn = false;
      return this;
    }

    /**
     * Renames the last non-key column of the right relation.
     *
     * @deprecated Position-based renaming breaks silently when the right
     *     relation's column order changes; use {@link #renameValue}.
     */
    @Deprecated
    public Builder renameLastColumn(String targetColumn) {
      this.valueColumn = null;
      this.renamedValueColumn = targetColumn;
      this.renameLastColumn = true;
      return this;
    }

    public Builder dedupKey(@Nullable String dedupKey) {
      this.dedupKey = dedupKey;
      return this;
    }

    public Builder noDedup() {
      this.dedupKey = null;
      return this;
    }

    public JoinSpec build() {
      if (leftKeys == null || leftKeys.isEmpty()) {
        throw new IllegalArgumentException("At least one left key is required");
      }
      if (rightKeys == null || rightKeys.size() != leftKeys.size()) {
        throw new IllegalArgumentException("Right keys " + rightKeys
            + " must pair up with left keys " + leftKeys);
      }
      if (leftSuffix.equals(rightSuffix)) {
        throw new IllegalArgumentException("Suffixes must differ: " + leftSuffix);
      }
      return new JoinSpec(this);
    }
  }
}
