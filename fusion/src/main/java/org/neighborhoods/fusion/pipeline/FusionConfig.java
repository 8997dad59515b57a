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

import org.neighborhoods.etl.EnvironmentSubstitutor;
import org.neighborhoods.etl.JoinSpec;
import org.neighborhoods.fusion.geo.CensusGeography;
import org.neighborhoods.fusion.geo.GeographyServiceConfig;
import org.neighborhoods.fusion.spatial.GeographicCrs;
import org.neighborhoods.fusion.spatial.PlanarCrs;
import org.neighborhoods.fusion.spatial.PolygonDissolver;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Settings for a fusion run.
 *
 * <p>YAML example:
 * <pre>{@code
 * geography: block_group
 * planarCrs: EPSG:5070
 * dedupKey: neighborhood
 * neighborhoodValueColumn: "2024-05-31"
 * parallelAssignment: true
 * geographyService:
 *   apiKey: "{env:CENSUS_API_KEY}"
 *   retry:
 *     maxRetries: 5
 * }</pre>
 *
 * <p>The three value columns name the Zillow column to carry for each
 * table. When absent, the table's last column (the most recent month) is
 * used, resolved by name when the table is loaded.
 */
public final class FusionConfig {
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final CensusGeography geography;
  private final PlanarCrs planarCrs;
  private final GeographicCrs geographicCrs;
  private final @Nullable String dedupKey;
  private final @Nullable String neighborhoodValueColumn;
  private final @Nullable String cityZhviValueColumn;
  private final @Nullable String cityZoriValueColumn;
  private final boolean parallelAssignment;
  private final double overlapTolerance;
  private final GeographyServiceConfig geographyService;

  private FusionConfig(Builder builder) {
    this.geography = builder.geography;
    this.planarCrs = builder.planarCrs;
    this.geographicCrs = builder.geographicCrs;
    this.dedupKey = builder.dedupKey;
    this.neighborhoodValueColumn = builder.neighborhoodValueColumn;
    this.cityZhviValueColumn = builder.cityZhviValueColumn;
    this.cityZoriValueColumn = builder.cityZoriValueColumn;
    this.parallelAssignment = builder.parallelAssignment;
    this.overlapTolerance = builder.overlapTolerance;
    this.geographyService = builder.geographyService;
  }

  public static FusionConfig defaults() {
    return builder().build();
  }

  /**
   * Reads a config from a YAML file.
   */
  public static FusionConfig fromYaml(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      Map<String, Object> map = YAML_MAPPER.readValue(in,
          new TypeReference<Map<String, Object>>() { });
      return fromMap(map);
    }
  }

  /**
   * Creates a config from a YAML/JSON map; absent keys keep their defaults.
   * String values may use {@code {env:VAR}} placeholders.
   */
  @SuppressWarnings("unchecked")
  public static FusionConfig fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }
    String geography = string(map, "geography");
    if (geography != null) {
      builder.geography(CensusGeography.fromName(geography));
    }
    String planar = string(map, "planarCrs");
    if (planar != null) {
      builder.planarCrs(PlanarCrs.fromCode(planar));
    }
    String geographic = string(map, "geographicCrs");
    if (geographic != null) {
      builder.geographicCrs(GeographicCrs.fromCode(geographic));
    }
    if (map.containsKey("dedupKey")) {
      builder.dedupKey(string(map, "dedupKey"));
    }
    builder.neighborhoodValueColumn(string(map, "neighborhoodValueColumn"));
    builder.cityZhviValueColumn(string(map, "cityZhviValueColumn"));
    builder.cityZoriValueColumn(string(map, "cityZoriValueColumn"));
    Object parallel = map.get("parallelAssignment");
    if (parallel != null) {
      builder.parallelAssignment(Boolean.parseBoolean(String.valueOf(parallel)));
    }
    Object tolerance = map.get("overlapTolerance");
    if (tolerance instanceof Number) {
      builder.overlapTolerance(((Number) tolerance).doubleValue());
    }
    Object service = map.get("geographyService");
    if (service instanceof Map) {
      builder.geographyService(GeographyServiceConfig.fromMap((Map<String, Object>) service));
    }
    return builder.build();
  }

  private static @Nullable String string(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    String text = EnvironmentSubstitutor.substitute(String.valueOf(value)).trim();
    return text.isEmpty() ? null : text;
  }

  public CensusGeography getGeography() {
    return geography;
  }

  public PlanarCrs getPlanarCrs() {
    return planarCrs;
  }

  public GeographicCrs getGeographicCrs() {
    return geographicCrs;
  }

  /** Business key rows are de-duplicated on after each join; null disables it. */
  public @Nullable String getDedupKey() {
    return dedupKey;
  }

  public @Nullable String getNeighborhoodValueColumn() {
    return neighborhoodValueColumn;
  }

  public @Nullable String getCityZhviValueColumn() {
    return cityZhviValueColumn;
  }

  public @Nullable String getCityZoriValueColumn() {
    return cityZoriValueColumn;
  }

  public boolean isParallelAssignment() {
    return parallelAssignment;
  }

  /** Relative overlap between units of one group above which a warning is raised. */
  public double getOverlapTolerance() {
    return overlapTolerance;
  }

  public GeographyServiceConfig getGeographyService() {
    return geographyService;
  }

  /** Returns a copy with another geography; used for the command line override. */
  public FusionConfig withGeography(CensusGeography geography) {
    return toBuilder().geography(geography).build();
  }

  public Builder toBuilder() {
    return builder()
        .geography(geography)
        .planarCrs(planarCrs)
        .geographicCrs(geographicCrs)
        .dedupKey(dedupKey)
        .neighborhoodValueColumn(neighborhoodValueColumn)
        .cityZhviValueColumn(cityZhviValueColumn)
        .cityZoriValueColumn(cityZoriValueColumn)
        .parallelAssignment(parallelAssignment)
        .overlapTolerance(overlapTolerance)
        .geographyService(geographyService);
  }

  @Override public String toString() {
    return "FusionConfig{geography=" + geography.getName()
        + ", planarCrs=" + planarCrs.getCode()
        + ", geographicCrs=" + geographicCrs.getCode()
        + ", dedupKey=" + dedupKey
        + ", parallelAssignment=" + parallelAssignment
        + ", geographyService=" + geographyService + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for FusionConfig.
   */
  public static class Builder {
    private CensusGeography geography = CensusGeography.BLOCK;
    private PlanarCrs planarCrs = PlanarCrs.CONUS_ALBERS;
    private GeographicCrs geographicCrs = GeographicCrs.WGS84;
    private @Nullable String dedupKey = JoinSpec.DEFAULT_DEDUP_KEY;
    private @Nullable String neighborhoodValueColumn;
    private @Nullable String cityZhviValueColumn;
    private @Nullable String cityZoriValueColumn;
    private boolean parallelAssignment;
    private double overlapTolerance = PolygonDissolver.DEFAULT_OVERLAP_TOLERANCE;
    private GeographyServiceConfig geographyService = GeographyServiceConfig.defaults();

    public Builder geography(CensusGeography geography) {
      this.geography = geography;
      return this;
    }

    public Builder planarCrs(PlanarCrs planarCrs) {
      this.planarCrs = planarCrs;
      return this;
    }

    public Builder geographicCrs(GeographicCrs geographicCrs) {
      this.geographicCrs = geographicCrs;
      return this;
    }

    public Builder dedupKey(@Nullable String dedupKey) {
      this.dedupKey = dedupKey;
      return this;
    }

    public Builder neighborhoodValueColumn(@Nullable String column) {
      this.neighborhoodValueColumn = column;
      return this;
    }

    public Builder cityZhviValueColumn(@Nullable String column) {
      this.cityZhviValueColumn = column;
      return this;
    }

    public Builder cityZoriValueColumn(@Nullable String column) {
      this.cityZoriValueColumn = column;
      return this;
    }

    public Builder parallelAssignment(boolean parallelAssignment) {
      this.parallelAssignment = parallelAssignment;
      return this;
    }

    public Builder overlapTolerance(double overlapTolerance) {
      this.overlapTolerance = overlapTolerance;
      return this;
    }

    public Builder geographyService(GeographyServiceConfig geographyService) {
      this.geographyService = geographyService;
      return this;
    }

    public FusionConfig build() {
      if (geography == null || planarCrs == null || geographicCrs == null) {
        throw new IllegalArgumentException("geography, planarCrs and geographicCrs are required");
      }
      if (overlapTolerance < 0) {
        throw new IllegalArgumentException("overlapTolerance must be >= 0: " + overlapTolerance);
      }
      if (geographyService == null) {
        geographyService = GeographyServiceConfig.defaults();
      }
      return new FusionConfig(this);
    }
  }
}
