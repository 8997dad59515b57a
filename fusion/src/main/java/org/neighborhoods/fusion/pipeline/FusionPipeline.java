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
import org.neighborhoods.etl.Relation;
import org.neighborhoods.etl.SchemaMismatchException;
import org.neighborhoods.etl.TabularJoinEngine;
import org.neighborhoods.fusion.UnmatchedBoundaryException;
import org.neighborhoods.fusion.geo.County;
import org.neighborhoods.fusion.geo.GeographyService;
import org.neighborhoods.fusion.metrics.MetricsDeriver;
import org.neighborhoods.fusion.metrics.NumericValues;
import org.neighborhoods.fusion.spatial.CoordinateReferenceManager;
import org.neighborhoods.fusion.spatial.DissolveResult;
import org.neighborhoods.fusion.spatial.GeographicLayer;
import org.neighborhoods.fusion.spatial.KeyedGeometry;
import org.neighborhoods.fusion.spatial.NearestAssignment;
import org.neighborhoods.fusion.spatial.PlanarLayer;
import org.neighborhoods.fusion.spatial.PolygonDissolver;
import org.neighborhoods.fusion.walkscore.WalkScoreScraper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.AREA_SQ_MI;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.CITY;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.CITY_NAME;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.CITY_RTV;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.CITY_ZHVI;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.CITY_ZORI;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.COUNTY_FIPS;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.ID;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.LAT;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.LNG;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.NEIGHBORHOOD;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.NEIGHBORHOOD_ZHVI;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.POPULATION;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.POP_DENSITY;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.REGION_NAME;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.STATE;
import static org.neighborhoods.fusion.pipeline.NeighborhoodColumns.STATE_ID;

/**
 * Fuses neighborhood points, housing metrics, census geographic units and
 * walkability scores into one boundary polygon per neighborhood.
 *
 * <p>Steps run strictly in order, each consuming the previous step's output:
 * <ol>
 *   <li>join neighborhood and city housing metrics onto the points</li>
 *   <li>build point geometries in the geographic system</li>
 *   <li>derive the city rent-to-value ratio</li>
 *   <li>collect the distinct counties</li>
 *   <li>fetch geographic units per county</li>
 *   <li>reproject points and units to the planar system</li>
 *   <li>assign every unit to its nearest neighborhood point</li>
 *   <li>dissolve units per neighborhood</li>
 *   <li>reproject boundaries back to the geographic system</li>
 *   <li>pair boundaries with neighborhoods one-to-one</li>
 *   <li>left-join walkability scores</li>
 *   <li>derive area and population density</li>
 *   <li>assemble the result</li>
 * </ol>
 *
 * <p>A county whose units cannot be fetched is skipped and reported in
 * {@link FusionResult#getIncompleteCounties()}. Schema problems and
 * neighborhoods left without a boundary abort the run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * FusionConfig config = FusionConfig.fromYaml(Paths.get("fusion.yaml"));
 * FusionPipeline pipeline = new FusionPipeline(config,
 *     new TigerWebClient(config.getGeographyService()));
 * FusionResult result = pipeline.run(inputs);
 * }</pre>
 */
public class FusionPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(FusionPipeline.class);

  /** Join keys of the walkability table, identical on both sides. */
  static final List<String> WALKABILITY_KEYS = Arrays.asList(NEIGHBORHOOD, CITY_NAME, STATE_ID);

  private final FusionConfig config;
  private final GeographyService geographyService;
  private final TabularJoinEngine joinEngine = new TabularJoinEngine();
  private final CoordinateReferenceManager crsManager = new CoordinateReferenceManager();
  private final MetricsDeriver metrics = new MetricsDeriver();
  private final GeometryFactory geometryFactory = new GeometryFactory();
  private final NearestAssignment assignment;
  private final PolygonDissolver dissolver;

  public FusionPipeline(FusionConfig config, GeographyService geographyService) {
    this.config = config;
    this.geographyService = geographyService;
    this.assignment = new NearestAssignment(config.isParallelAssignment());
    this.dissolver = new PolygonDissolver(config.getOverlapTolerance());
  }

  /**
   * Runs the fusion.
   *
   * @param inputs Source tables
   * @return Fused neighborhoods with run statistics
   * @throws SchemaMismatchException if a required column is absent
   * @throws UnmatchedBoundaryException if neighborhoods and boundaries do not pair up,
   *     including when two neighborhoods share an id
   */
  public FusionResult run(FusionInputs inputs) {
    LOGGER.info("Starting neighborhood fusion: {}", config);
    long startTime = System.currentTimeMillis();
    Relation points = inputs.getNeighborhoodPoints();
    points.requireColumns("Neighborhood points",
        Arrays.asList(ID, NEIGHBORHOOD, CITY_NAME, STATE_ID, COUNTY_FIPS, LAT, LNG));

    LOGGER.info("Step 1: Joining housing metrics onto {} neighborhoods", points.size());
    Relation joined = joinHousingMetrics(points, inputs);
    int duplicatesDropped = Math.max(0, points.size() - joined.size());
    joined = joined.dropIfPresent(NeighborhoodColumns.DROPPED_POINT_COLUMNS);

    LOGGER.info("Step 2: Building point geometries in {}", config.getGeographicCrs().getCode());
    GeographicLayer pointLayer = pointLayer(joined);

    LOGGER.info("Step 3: Deriving {}", CITY_RTV);
    joined = metrics.withRatio(joined, CITY_ZORI, CITY_ZHVI, CITY_RTV);

    List<County> counties = distinctCounties(joined);
    LOGGER.info("Step 4: Found {} distinct counties", counties.size());

    LOGGER.info("Step 5: Fetching {} units for {} counties",
        config.getGeography().getName(), counties.size());
    List<County> incomplete = new ArrayList<County>();
    GeographicLayer units = fetchUnits(counties, incomplete);

    LOGGER.info("Step 6: Reprojecting {} points and {} units to {}",
        pointLayer.size(), units.size(), config.getPlanarCrs().getCode());
    PlanarLayer planarPoints = crsManager.toPlanar(pointLayer, config.getPlanarCrs());
    PlanarLayer planarUnits = crsManager.toPlanar(units, config.getPlanarCrs());

    LOGGER.info("Step 7: Assigning {} units to nearest of {} neighborhoods",
        planarUnits.size(), planarPoints.size());
    Map<String, String> nearest = assignment.assign(planarUnits, planarPoints);

    LOGGER.info("Step 8: Dissolving units per neighborhood");
    DissolveResult dissolved = dissolver.dissolve(planarUnits, nearest);

    LOGGER.info("Step 9: Reprojecting {} boundaries to {}",
        dissolved.getBoundaries().size(), config.getGeographicCrs().getCode());
    GeographicLayer boundaries =
        crsManager.toGeographic(dissolved.getBoundaries(), config.getGeographicCrs());

    LOGGER.info("Step 10: Pairing boundaries with neighborhoods");
    requireOneToOne(pointLayer.ids(), boundaries);
    Relation table = joined.dropIfPresent(Arrays.asList(LAT, LNG));

    Relation walkScores = inputs.getWalkScores();
    if (walkScores != null) {
      LOGGER.info("Step 11: Joining {} walkability rows", walkScores.size());
      int before = table.size();
      table = joinWalkScores(table, walkScores);
      duplicatesDropped += Math.max(0, before - table.size());
    } else {
      LOGGER.info("Step 11: No walkability data; skipping");
    }

    LOGGER.info("Step 12: Deriving area and population density");
    Map<String, Double> areas = metrics.areaSquareMiles(dissolved.getBoundaries());
    table = metrics.withAreaAndDensity(table, ID, areas, POPULATION, AREA_SQ_MI, POP_DENSITY);

    LOGGER.info("Step 13: Assembling {} fused neighborhoods", table.size());
    List<FusedNeighborhood> fused = new ArrayList<FusedNeighborhood>(table.size());
    for (int i = 0; i < table.size(); i++) {
      String id = String.valueOf(table.get(i, ID));
      fused.add(new FusedNeighborhood(id, table.record(i), boundaries.getGeometry(id)));
    }

    FusionResult result = FusionResult.builder()
        .neighborhoods(fused)
        .table(table)
        .boundaries(boundaries)
        .counties(counties)
        .incompleteCounties(incomplete)
        .unitCount(planarUnits.size())
        .duplicateRowsDropped(duplicatesDropped)
        .overlapWarnings(dissolved.getOverlapWarnings())
        .elapsedMs(System.currentTimeMillis() - startTime)
        .build();
    if (!incomplete.isEmpty()) {
      LOGGER.warn("Fusion finished with incomplete coverage; no units for counties {}",
          incomplete);
    }
    LOGGER.info("Fusion completed: {}", result);
    return result;
  }

  private Relation joinHousingMetrics(Relation points, FusionInputs inputs) {
    Relation neighborhoodValues = inputs.getNeighborhoodValues();
    String neighborhoodValue = valueColumn(neighborhoodValues,
        config.getNeighborhoodValueColumn(), "neighborhood home values");
    List<String> valueKeys = Arrays.asList(REGION_NAME, STATE, CITY);
    Relation joined = joinEngine.leftJoin(points,
        narrow(neighborhoodValues, valueKeys, neighborhoodValue),
        JoinSpec.builder()
            .leftKeys(NEIGHBORHOOD, STATE_ID, CITY_NAME)
            .rightKeys(valueKeys)
            .renameValue(neighborhoodValue, NEIGHBORHOOD_ZHVI)
            .dedupKey(config.getDedupKey())
            .build());

    joined = joinCityMetric(joined, inputs.getCityRentValues(),
        config.getCityZoriValueColumn(), CITY_ZORI, "city rent index");
    return joinCityMetric(joined, inputs.getCityHomeValues(),
        config.getCityZhviValueColumn(), CITY_ZHVI, "city home values");
  }

  /**
   * Joins one city-level value. Cities are matched on name and state when
   * the table has a state column, otherwise on name alone.
   */
  private Relation joinCityMetric(Relation left, Relation cityTable,
      @Nullable String explicitColumn, String target, String description) {
    String valueColumn = valueColumn(cityTable, explicitColumn, description);
    List<String> leftKeys;
    List<String> rightKeys;
    if (cityTable.hasColumn(STATE) && !STATE.equals(valueColumn)) {
      leftKeys = Arrays.asList(CITY_NAME, STATE_ID);
      rightKeys = Arrays.asList(REGION_NAME, STATE);
    } else {
      leftKeys = Collections.singletonList(CITY_NAME);
      rightKeys = Collections.singletonList(REGION_NAME);
    }
    return joinEngine.leftJoin(left, narrow(cityTable, rightKeys, valueColumn),
        JoinSpec.builder()
            .leftKeys(leftKeys)
            .rightKeys(rightKeys)
            .renameValue(valueColumn, target)
            .dedupKey(config.getDedupKey())
            .build());
  }

  /**
   * Resolves the value column of a Zillow table: the configured name, or
   * else the last (most recent) column.
   */
  private static String valueColumn(Relation table, @Nullable String explicitColumn,
      String description) {
    String column = explicitColumn != null ? explicitColumn : table.lastColumn();
    if (!table.hasColumn(column)) {
      throw SchemaMismatchException.missingColumns(description,
          Collections.singletonList(column), table.getColumns());
    }
    LOGGER.info("Using column '{}' of {}", column, description);
    return column;
  }

  private static Relation narrow(Relation table, List<String> keys, String valueColumn) {
    if (keys.contains(valueColumn)) {
      throw new SchemaMismatchException("Value column '" + valueColumn
          + "' is also a join key " + keys);
    }
    List<String> selected = new ArrayList<String>(keys);
    selected.add(valueColumn);
    return table.select(selected);
  }

  private GeographicLayer pointLayer(Relation table) {
    List<KeyedGeometry> features = new ArrayList<KeyedGeometry>(table.size());
    List<String> withoutLocation = new ArrayList<String>();
    Set<String> seenIds = new HashSet<String>();
    Set<String> repeatedIds = new LinkedHashSet<String>();
    for (int i = 0; i < table.size(); i++) {
      Object id = table.get(i, ID);
      if (id == null) {
        throw new IllegalArgumentException("Neighborhood '" + table.get(i, NEIGHBORHOOD)
            + "' has no id");
      }
      if (!seenIds.add(id.toString())) {
        repeatedIds.add(id.toString());
        continue;
      }
      Double lat = NumericValues.toDouble(table.get(i, LAT));
      Double lng = NumericValues.toDouble(table.get(i, LNG));
      if (lat == null || lng == null) {
        withoutLocation.add(id.toString());
        continue;
      }
      features.add(new KeyedGeometry(id.toString(),
          geometryFactory.createPoint(new Coordinate(lng, lat))));
    }
    if (!repeatedIds.isEmpty()) {
      throw UnmatchedBoundaryException.repeated(repeatedIds);
    }
    if (!withoutLocation.isEmpty()) {
      throw UnmatchedBoundaryException.unpaired(withoutLocation,
          Collections.<String>emptyList());
    }
    return new GeographicLayer(config.getGeographicCrs(), features);
  }

  private static List<County> distinctCounties(Relation table) {
    Set<County> counties = new LinkedHashSet<County>();
    int skipped = 0;
    for (Object fips : table.distinctValues(COUNTY_FIPS)) {
      try {
        counties.add(County.fromFips(fips));
      } catch (IllegalArgumentException e) {
        skipped++;
        LOGGER.warn("Ignoring county code: {}", e.getMessage());
      }
    }
    if (skipped > 0) {
      LOGGER.warn("{} county code(s) invalid; those neighborhoods are matched"
          + " against units of the other counties only", skipped);
    }
    return new ArrayList<County>(counties);
  }

  private GeographicLayer fetchUnits(List<County> counties, List<County> incomplete) {
    Map<String, KeyedGeometry> units = new LinkedHashMap<String, KeyedGeometry>();
    int countyNum = 0;
    for (County county : counties) {
      countyNum++;
      try {
        GeographicLayer layer = geographyService.fetchUnits(county, config.getGeography());
        if (layer.getCrs() != config.getGeographicCrs()) {
          throw new IllegalStateException("Geography service returned units in "
              + layer.getCrs().getCode() + ", expected " + config.getGeographicCrs().getCode());
        }
        if (layer.isEmpty()) {
          LOGGER.warn("County {}/{} ({}) returned no units; its area will be missing",
              countyNum, counties.size(), county);
          incomplete.add(county);
          continue;
        }
        for (KeyedGeometry unit : layer.getFeatures()) {
          if (units.putIfAbsent(unit.getId(), unit) != null) {
            LOGGER.warn("Unit {} returned for more than one county; keeping the first",
                unit.getId());
          }
        }
        LOGGER.info("County {}/{} ({}): {} units", countyNum, counties.size(), county,
            layer.size());
      } catch (IOException e) {
        LOGGER.warn("County {}/{} ({}) failed, continuing without its units: {}",
            countyNum, counties.size(), county, e.getMessage());
        incomplete.add(county);
      }
    }
    return new GeographicLayer(config.getGeographicCrs(),
        new ArrayList<KeyedGeometry>(units.values()));
  }

  private static void requireOneToOne(List<String> neighborhoodIds, GeographicLayer boundaries) {
    List<String> withoutBoundary = new ArrayList<String>();
    for (String id : neighborhoodIds) {
      if (!boundaries.contains(id)) {
        withoutBoundary.add(id);
      }
    }
    Set<String> known = new LinkedHashSet<String>(neighborhoodIds);
    List<String> withoutNeighborhood = new ArrayList<String>();
    for (String id : boundaries.ids()) {
      if (!known.contains(id)) {
        withoutNeighborhood.add(id);
      }
    }
    if (!withoutBoundary.isEmpty() || !withoutNeighborhood.isEmpty()) {
      throw UnmatchedBoundaryException.unpaired(withoutBoundary, withoutNeighborhood);
    }
  }

  private Relation joinWalkScores(Relation table, Relation walkScores) {
    List<String> columns = new ArrayList<String>();
    for (String column : WalkScoreScraper.COLUMNS) {
      if (walkScores.hasColumn(column)) {
        columns.add(column);
      }
    }
    walkScores.requireColumns("Walkability", WALKABILITY_KEYS);
    List<String> replaced = new ArrayList<String>();
    for (String column : columns) {
      if (!WALKABILITY_KEYS.contains(column) && table.hasColumn(column)) {
        replaced.add(column);
      }
    }
    if (!replaced.isEmpty()) {
      LOGGER.warn("Neighborhood table already has walkability column(s) {};"
          + " using the walkability values", replaced);
      table = table.dropIfPresent(replaced);
    }
    return joinEngine.leftJoin(table, walkScores.select(columns),
        JoinSpec.builder()
            .leftKeys(WALKABILITY_KEYS)
            .rightKeys(WALKABILITY_KEYS)
            .dedupKey(config.getDedupKey())
            .build());
  }
}
