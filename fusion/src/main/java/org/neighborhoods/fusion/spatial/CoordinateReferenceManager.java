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

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Moves layers between geographic and planar reference systems.
 *
 * <p>Reprojection is pure: the input layer is untouched and the result is a
 * new layer tagged with the target system. Distance and area work happens on
 * {@link PlanarLayer}s only; geographic layers exist for input and output.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CoordinateReferenceManager crs = new CoordinateReferenceManager();
 * PlanarLayer planar = crs.toPlanar(points, PlanarCrs.CONUS_ALBERS);
 * GeographicLayer back = crs.toGeographic(planar, GeographicCrs.WGS84);
 * }</pre>
 */
public class CoordinateReferenceManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(CoordinateReferenceManager.class);

  private final CRSFactory crsFactory = new CRSFactory();
  private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
  private final Map<SpatialReference, CoordinateReferenceSystem> systems =
      new ConcurrentHashMap<SpatialReference, CoordinateReferenceSystem>();

  /**
   * Projects a geographic layer into a planar system.
   */
  public PlanarLayer toPlanar(GeographicLayer layer, PlanarCrs target) {
    return new PlanarLayer(target, transformAll(layer, target));
  }

  /**
   * Unprojects a planar layer back to a geographic system.
   */
  public GeographicLayer toGeographic(PlanarLayer layer, GeographicCrs target) {
    return new GeographicLayer(target, transformAll(layer, target));
  }

  /**
   * Transforms a single geometry. The input geometry is not modified.
   *
   * @param geometry Geometry in {@code source} coordinates
   * @param source System the coordinates are in
   * @param target System to transform into
   * @return Transformed copy
   * @throws IllegalArgumentException if a coordinate cannot be transformed
   */
  public Geometry transform(Geometry geometry, SpatialReference source, SpatialReference target) {
    Geometry copy = geometry.copy();
    if (source.equals(target)) {
      return copy;
    }
    CoordinateTransform transform = transformFactory.createTransform(
        system(source), system(target));
    copy.apply(new ProjectionFilter(transform, source, target));
    copy.geometryChanged();
    return copy;
  }

  private List<KeyedGeometry> transformAll(FeatureLayer<?> layer, SpatialReference target) {
    LOGGER.debug("Reprojecting {} features from {} to {}",
        layer.size(), layer.getCrs().getCode(), target.getCode());
    List<KeyedGeometry> out = new ArrayList<KeyedGeometry>(layer.size());
    for (KeyedGeometry feature : layer.getFeatures()) {
      try {
        out.add(new KeyedGeometry(feature.getId(),
            transform(feature.getGeometry(), layer.getCrs(), target)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Cannot reproject feature '" + feature.getId()
            + "': " + e.getMessage(), e);
      }
    }
    return out;
  }

  private CoordinateReferenceSystem system(SpatialReference reference) {
    return systems.computeIfAbsent(reference,
        r -> crsFactory.createFromParameters(r.getCode(), r.getProj4()));
  }

  /**
   * Rewrites every coordinate of a geometry through a proj4j transform.
   * Transforms are not thread-safe, so each geometry gets its own.
   */
  private static final class ProjectionFilter implements CoordinateSequenceFilter {
    private final CoordinateTransform transform;
    private final SpatialReference source;
    private final SpatialReference target;
    private final ProjCoordinate in = new ProjCoordinate();
    private final ProjCoordinate out = new ProjCoordinate();

    ProjectionFilter(CoordinateTransform transform, SpatialReference source,
        SpatialReference target) {
      this.transform = transform;
      this.source = source;
      this.target = target;
    }

    @Override public void filter(CoordinateSequence seq, int i) {
      in.x = seq.getX(i);
      in.y = seq.getY(i);
      try {
        transform.transform(in, out);
      } catch (Proj4jException e) {
        throw new IllegalArgumentException("(" + in.x + ", " + in.y + ") from "
            + source.getCode() + " to " + target.getCode() + ": " + e.getMessage(), e);
      }
      if (Double.isNaN(out.x) || Double.isNaN(out.y)
          || Double.isInfinite(out.x) || Double.isInfinite(out.y)) {
        throw new IllegalArgumentException("(" + in.x + ", " + in.y + ") has no image in "
            + target.getCode());
      }
      seq.setOrdinate(i, CoordinateSequence.X, out.x);
      seq.setOrdinate(i, CoordinateSequence.Y, out.y);
    }

    @Override public boolean isDone() {
      return false;
    }

    @Override public boolean isGeometryChanged() {
      return true;
    }
  }
}
