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

import org.neighborhoods.fusion.UnmatchedBoundaryException;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unions polygons that share a group id into one boundary per group.
 *
 * <p>A group of one unit keeps that unit's polygon. Groups whose units do
 * not touch come out as multi-polygons. Administrative units are expected to
 * tile the plane; when the union of a group is smaller than the sum of its
 * parts by more than {@code overlapTolerance} (relative), the overlap is
 * logged and reported in {@link DissolveResult#getOverlapWarnings()}.
 */
public class PolygonDissolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(PolygonDissolver.class);

  public static final double DEFAULT_OVERLAP_TOLERANCE = 1e-6;

  private final double overlapTolerance;

  public PolygonDissolver() {
    this(DEFAULT_OVERLAP_TOLERANCE);
  }

  public PolygonDissolver(double overlapTolerance) {
    if (overlapTolerance < 0 || Double.isNaN(overlapTolerance)) {
      throw new IllegalArgumentException("overlapTolerance must be >= 0: " + overlapTolerance);
    }
    this.overlapTolerance = overlapTolerance;
  }

  /**
   * Dissolves a layer of units using a unit-id to group-id assignment, as
   * produced by {@link NearestAssignment#assign}.
   *
   * @throws UnmatchedBoundaryException if a unit has no group
   */
  public DissolveResult dissolve(PlanarLayer units, Map<String, String> groupByUnitId) {
    List<KeyedGeometry> grouped = new ArrayList<KeyedGeometry>(units.size());
    List<String> unassigned = new ArrayList<String>();
    for (KeyedGeometry unit : units.getFeatures()) {
      String group = groupByUnitId.get(unit.getId());
      if (group == null) {
        unassigned.add(unit.getId());
      } else {
        grouped.add(new KeyedGeometry(group, unit.getGeometry()));
      }
    }
    if (!unassigned.isEmpty()) {
      throw UnmatchedBoundaryException.unassigned(unassigned);
    }
    return dissolve(grouped, units.getCrs());
  }

  /**
   * Dissolves polygons keyed by group id. The same id may appear many times.
   *
   * @param groupedUnits Polygons keyed by the group they belong to
   * @param crs System the polygons are in
   * @throws IllegalArgumentException if a geometry is not polygonal
   */
  public DissolveResult dissolve(List<KeyedGeometry> groupedUnits, PlanarCrs crs) {
    Map<String, List<Geometry>> groups = new LinkedHashMap<String, List<Geometry>>();
    double inputArea = 0;
    for (KeyedGeometry unit : groupedUnits) {
      Geometry geometry = polygonal(unit);
      inputArea += geometry.getArea();
      groups.computeIfAbsent(unit.getId(), k -> new ArrayList<Geometry>()).add(geometry);
    }

    List<KeyedGeometry> boundaries = new ArrayList<KeyedGeometry>(groups.size());
    Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
    List<DissolveResult.OverlapWarning> warnings = new ArrayList<DissolveResult.OverlapWarning>();
    for (Map.Entry<String, List<Geometry>> group : groups.entrySet()) {
      List<Geometry> parts = group.getValue();
      counts.put(group.getKey(), parts.size());
      if (parts.size() == 1) {
        boundaries.add(new KeyedGeometry(group.getKey(), parts.get(0)));
        continue;
      }
      Geometry union = UnaryUnionOp.union(parts);
      double partArea = 0;
      for (Geometry part : parts) {
        partArea += part.getArea();
      }
      double overlap = partArea - union.getArea();
      if (overlap > overlapTolerance * partArea) {
        LOGGER.warn("Units of '{}' overlap by {} m2 ({} units, {} m2 total);"
                + " source geometry may be corrupt",
            group.getKey(), overlap, parts.size(), partArea);
        warnings.add(new DissolveResult.OverlapWarning(group.getKey(), overlap, partArea));
      }
      boundaries.add(new KeyedGeometry(group.getKey(), union));
    }

    LOGGER.debug("Dissolved {} units into {} boundaries", groupedUnits.size(), groups.size());
    return new DissolveResult(new PlanarLayer(crs, boundaries), counts, warnings, inputArea);
  }

  private static Geometry polygonal(KeyedGeometry unit) {
    Geometry geometry = unit.getGeometry();
    if (!(geometry instanceof Polygonal)) {
      throw new IllegalArgumentException("Cannot dissolve " + geometry.getGeometryType()
          + " for '" + unit.getId() + "'; only polygons are supported");
    }
    if (!geometry.isValid()) {
      LOGGER.warn("Repairing invalid polygon for '{}'", unit.getId());
      geometry = GeometryFixer.fix(geometry);
    }
    return geometry;
  }
}
