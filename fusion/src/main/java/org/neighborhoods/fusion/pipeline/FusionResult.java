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

import org.neighborhoods.etl.Relation;
import org.neighborhoods.fusion.geo.County;
import org.neighborhoods.fusion.spatial.DissolveResult;
import org.neighborhoods.fusion.spatial.GeographicLayer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a fusion run: one {@link FusedNeighborhood} per output row plus
 * run statistics.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * FusionResult result = pipeline.run(inputs);
 * System.out.println(result.getNeighborhoodCount() + " neighborhoods from "
 *     + result.getUnitCount() + " units");
 * if (!result.isComplete()) {
 *   System.err.println("Missing counties: " + result.getIncompleteCounties());
 * }
 * }</pre>
 *
 * @see FusionPipeline
 */
public class FusionResult {

  private final List<FusedNeighborhood> neighborhoods;
  private final Relation table;
  private final GeographicLayer boundaries;
  private final List<County> counties;
  private final List<County> incompleteCounties;
  private final int unitCount;
  private final int duplicateRowsDropped;
  private final List<DissolveResult.OverlapWarning> overlapWarnings;
  private final long elapsedMs;

  private FusionResult(Builder builder) {
    this.neighborhoods = copy(builder.neighborhoods);
    this.table = builder.table;
    this.boundaries = builder.boundaries;
    this.counties = copy(builder.counties);
    this.incompleteCounties = copy(builder.incompleteCounties);
    this.unitCount = builder.unitCount;
    this.duplicateRowsDropped = builder.duplicateRowsDropped;
    this.overlapWarnings = copy(builder.overlapWarnings);
    this.elapsedMs = builder.elapsedMs;
  }

  private static <T> List<T> copy(List<T> list) {
    return list != null
        ? Collections.unmodifiableList(new ArrayList<T>(list))
        : Collections.<T>emptyList();
  }

  /**
   * Returns the fused neighborhoods in output order.
   */
  public List<FusedNeighborhood> getNeighborhoods() {
    return neighborhoods;
  }

  /**
   * Returns the attribute table, one row per neighborhood, without geometry.
   */
  public Relation getTable() {
    return table;
  }

  /**
   * Returns the dissolved boundaries in geographic coordinates, keyed by
   * neighborhood id.
   */
  public GeographicLayer getBoundaries() {
    return boundaries;
  }

  public int getNeighborhoodCount() {
    return neighborhoods.size();
  }

  /**
   * Returns the counties that were queried.
   */
  public List<County> getCounties() {
    return counties;
  }

  /**
   * Returns the counties whose units could not be fetched or came back empty.
   */
  public List<County> getIncompleteCounties() {
    return incompleteCounties;
  }

  /**
   * Returns whether every queried county contributed units.
   */
  public boolean isComplete() {
    return incompleteCounties.isEmpty();
  }

  /**
   * Returns the number of geographic units that were assigned and dissolved.
   */
  public int getUnitCount() {
    return unitCount;
  }

  /**
   * Returns the number of neighborhood rows removed because their
   * de-duplication key repeated an earlier row's.
   */
  public int getDuplicateRowsDropped() {
    return duplicateRowsDropped;
  }

  public List<DissolveResult.OverlapWarning> getOverlapWarnings() {
    return overlapWarnings;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return String.format("FusionResult{neighborhoods=%d, units=%d, counties=%d,"
            + " incompleteCounties=%s, duplicatesDropped=%d, overlapWarnings=%d, elapsed=%dms}",
        neighborhoods.size(), unitCount, counties.size(), incompleteCounties,
        duplicateRowsDropped, overlapWarnings.size(), elapsedMs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for FusionResult.
   */
  public static class Builder {
    private List<FusedNeighborhood> neighborhoods;
    private Relation table;
    private GeographicLayer boundaries;
    private List<County> counties;
    private List<County> incompleteCounties;
    private int unitCount;
    private int duplicateRowsDropped;
    private List<DissolveResult.OverlapWarning> overlapWarnings;
    private long elapsedMs;

    public Builder neighborhoods(List<FusedNeighborhood> neighborhoods) {
      this.neighborhoods = neighborhoods;
      return this;
    }

    public Builder table(Relation table) {
      this.table = table;
      return this;
    }

    public Builder boundaries(GeographicLayer boundaries) {
      this.boundaries = boundaries;
      return this;
    }

    public Builder counties(List<County> counties) {
      this.counties = counties;
      return this;
    }

    public Builder incompleteCounties(List<County> incompleteCounties) {
      this.incompleteCounties = incompleteCounties;
      return this;
    }

    public Builder unitCount(int unitCount) {
      this.unitCount = unitCount;
      return this;
    }

    public Builder duplicateRowsDropped(int duplicateRowsDropped) {
      this.duplicateRowsDropped = duplicateRowsDropped;
      return this;
    }

    public Builder overlapWarnings(List<DissolveResult.OverlapWarning> overlapWarnings) {
      this.overlapWarnings = overlapWarnings;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public FusionResult build() {
      return new FusionResult(this);
    }
  }
}
