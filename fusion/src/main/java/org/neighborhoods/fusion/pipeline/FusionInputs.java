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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Source tables of a fusion run.
 *
 * <ul>
 *   <li>{@code neighborhoodPoints} - one row per neighborhood with
 *       {@code id, neighborhood, city_name, state_id, county_fips, lat, lng}</li>
 *   <li>{@code neighborhoodValues} - Zillow neighborhood home values keyed by
 *       {@code RegionName, State, City}</li>
 *   <li>{@code cityRentValues} / {@code cityHomeValues} - Zillow city rent and
 *       home value indexes keyed by {@code RegionName}</li>
 *   <li>{@code walkScores} - optional walkability rows</li>
 * </ul>
 */
public final class FusionInputs {
  private final Relation neighborhoodPoints;
  private final Relation neighborhoodValues;
  private final Relation cityRentValues;
  private final Relation cityHomeValues;
  private final @Nullable Relation walkScores;

  private FusionInputs(Builder builder) {
    this.neighborhoodPoints = Objects.requireNonNull(builder.neighborhoodPoints,
        "neighborhoodPoints");
    this.neighborhoodValues = Objects.requireNonNull(builder.neighborhoodValues,
        "neighborhoodValues");
    this.cityRentValues = Objects.requireNonNull(builder.cityRentValues, "cityRentValues");
    this.cityHomeValues = Objects.requireNonNull(builder.cityHomeValues, "cityHomeValues");
    this.walkScores = builder.walkScores;
  }

  public Relation getNeighborhoodPoints() {
    return neighborhoodPoints;
  }

  public Relation getNeighborhoodValues() {
    return neighborhoodValues;
  }

  public Relation getCityRentValues() {
    return cityRentValues;
  }

  public Relation getCityHomeValues() {
    return cityHomeValues;
  }

  public @Nullable Relation getWalkScores() {
    return walkScores;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for FusionInputs.
   */
  public static class Builder {
    private Relation neighborhoodPoints;
    private Relation neighborhoodValues;
    private Relation cityRentValues;
    private Relation cityHomeValues;
    private @Nullable Relation walkScores;

    public Builder neighborhoodPoints(Relation neighborhoodPoints) {
      this.neighborhoodPoints = neighborhoodPoints;
      return this;
    }

    public Builder neighborhoodValues(Relation neighborhoodValues) {
      this.neighborhoodValues = neighborhoodValues;
      return this;
    }

    public Builder cityRentValues(Relation cityRentValues) {
      this.cityRentValues = cityRentValues;
      return this;
    }

    public Builder cityHomeValues(Relation cityHomeValues) {
      this.cityHomeValues = cityHomeValues;
      return this;
    }

    public Builder walkScores(@Nullable Relation walkScores) {
      this.walkScores = walkScores;
      return this;
    }

    public FusionInputs build() {
      return new FusionInputs(this);
    }
  }
}
