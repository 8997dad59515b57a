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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link PolygonDissolver}: one boundary per group plus the
 * bookkeeping needed to check the partition.
 */
public final class DissolveResult {
  private final PlanarLayer boundaries;
  private final ImmutableMap<String, Integer> unitCounts;
  private final ImmutableList<OverlapWarning> overlapWarnings;
  private final double inputArea;

  DissolveResult(PlanarLayer boundaries, Map<String, Integer> unitCounts,
      List<OverlapWarning> overlapWarnings, double inputArea) {
    this.boundaries = boundaries;
    this.unitCounts = ImmutableMap.copyOf(unitCounts);
    this.overlapWarnings = ImmutableList.copyOf(overlapWarnings);
    this.inputArea = inputArea;
  }

  /** Dissolved boundaries keyed by group id, in first-seen group order. */
  public PlanarLayer getBoundaries() {
    return boundaries;
  }

  /** Number of input units per group. */
  public Map<String, Integer> getUnitCounts() {
    return unitCounts;
  }

  public List<OverlapWarning> getOverlapWarnings() {
    return overlapWarnings;
  }

  /** Summed area of all input units in square meters. */
  public double getInputArea() {
    return inputArea;
  }

  /**
   * A group whose units overlap by more than the configured tolerance.
   */
  public static final class OverlapWarning {
    private final String groupId;
    private final double overlapArea;
    private final double unitArea;

    public OverlapWarning(String groupId, double overlapArea, double unitArea) {
      this.groupId = groupId;
      this.overlapArea = overlapArea;
      this.unitArea = unitArea;
    }

    public String getGroupId() {
      return groupId;
    }

    /** Square meters counted more than once. */
    public double getOverlapArea() {
      return overlapArea;
    }

    /** Summed area of the group's units before union. */
    public double getUnitArea() {
      return unitArea;
    }

    @Override public String toString() {
      return String.format("OverlapWarning{group='%s', overlap=%.2f m2 of %.2f m2}",
          groupId, overlapArea, unitArea);
    }
  }
}
