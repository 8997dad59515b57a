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

import org.neighborhoods.fusion.NoReferenceGeometryException;
import org.neighborhoods.fusion.UnmatchedBoundaryException;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Assigns every query geometry to its closest reference geometry.
 *
 * <p>Polygon queries are represented by their centroid; references are
 * compared as-is, so a point inside a reference polygon is at distance zero.
 * When several references are equally close (within {@link #TIE_TOLERANCE}
 * meters) the one that comes first in the reference layer wins.
 *
 * <p>Each query is compared against every reference, which is fine for the
 * few thousand units of a county batch. With {@code parallel} set, queries
 * are evaluated on a parallel stream; results are collected by position so
 * the outcome is identical to the sequential run.
 */
public class NearestAssignment {
  private static final Logger LOGGER = LoggerFactory.getLogger(NearestAssignment.class);

  /** Distances closer than this to the current best count as a tie. */
  public static final double TIE_TOLERANCE = 1e-9;

  private final boolean parallel;

  public NearestAssignment() {
    this(false);
  }

  public NearestAssignment(boolean parallel) {
    this.parallel = parallel;
  }

  /**
   * Maps each query id to the id of its nearest reference.
   *
   * @param queries Geometries to assign, e.g. census units
   * @param references Candidate targets, e.g. neighborhood points
   * @return Query id to reference id, in query layer order
   * @throws NoReferenceGeometryException if {@code references} is empty
   * @throws IllegalArgumentException if the layers are in different systems
   *     or a reference geometry is empty
   * @throws UnmatchedBoundaryException if a query geometry is empty
   */
  public Map<String, String> assign(PlanarLayer queries, PlanarLayer references) {
    if (references.isEmpty()) {
      throw new NoReferenceGeometryException(
          "Cannot assign " + queries.size() + " geometries: reference layer is empty");
    }
    if (queries.getCrs() != references.getCrs()) {
      throw new IllegalArgumentException("Query layer is in " + queries.getCrs().getCode()
          + " but reference layer is in " + references.getCrs().getCode());
    }
    final List<KeyedGeometry> refs = references.getFeatures();
    for (KeyedGeometry ref : refs) {
      if (ref.getGeometry().isEmpty()) {
        throw new IllegalArgumentException("Reference '" + ref.getId() + "' has empty geometry");
      }
    }

    final List<KeyedGeometry> features = queries.getFeatures();
    List<String> unassigned = new ArrayList<String>();
    Geometry[] points = new Geometry[features.size()];
    for (int i = 0; i < features.size(); i++) {
      Geometry geometry = features.get(i).getGeometry();
      if (geometry.isEmpty()) {
        unassigned.add(features.get(i).getId());
      } else {
        points[i] = geometry instanceof Polygonal ? geometry.getCentroid() : geometry;
      }
    }
    if (!unassigned.isEmpty()) {
      throw UnmatchedBoundaryException.unassigned(unassigned);
    }

    final String[] nearest = new String[features.size()];
    IntStream indexes = IntStream.range(0, features.size());
    if (parallel) {
      indexes = indexes.parallel();
    }
    indexes.forEach(i -> nearest[i] = nearest(points[i], refs));

    Map<String, String> result = new LinkedHashMap<String, String>();
    for (int i = 0; i < features.size(); i++) {
      result.put(features.get(i).getId(), nearest[i]);
    }
    LOGGER.debug("Assigned {} geometries to {} references (parallel={})",
        features.size(), refs.size(), parallel);
    return result;
  }

  /**
   * Returns the id of the reference closest to {@code point}; earlier
   * references win ties.
   */
  static String nearest(Geometry point, List<KeyedGeometry> references) {
    String bestId = null;
    double best = Double.POSITIVE_INFINITY;
    for (KeyedGeometry ref : references) {
      double d = point.distance(ref.getGeometry());
      if (bestId == null || d < best - TIE_TOLERANCE) {
        best = d;
        bestId = ref.getId();
      }
    }
    return bestId;
  }
}
