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

import org.locationtech.jts.geom.Geometry;

import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of {@link KeyedGeometry} tagged with the reference system
 * its coordinates are in. Identifiers are unique within a layer.
 *
 * <p>The two concrete layer types split on the kind of reference system, so
 * operations that need meters can demand a {@link PlanarLayer} in their
 * signature instead of checking at run time.
 *
 * @param <C> Kind of reference system
 */
public abstract class FeatureLayer<C extends SpatialReference> {

  private final C crs;
  private final ImmutableList<KeyedGeometry> features;
  private final ImmutableMap<String, KeyedGeometry> byId;

  protected FeatureLayer(C crs, List<KeyedGeometry> features) {
    this.crs = Objects.requireNonNull(crs, "crs");
    this.features = ImmutableList.copyOf(features);
    ImmutableMap.Builder<String, KeyedGeometry> builder = ImmutableMap.builder();
    for (KeyedGeometry feature : this.features) {
      builder.put(feature.getId(), feature);
    }
    // buildOrThrow rejects repeated identifiers
    this.byId = builder.buildOrThrow();
  }

  public C getCrs() {
    return crs;
  }

  public List<KeyedGeometry> getFeatures() {
    return features;
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  public boolean contains(String id) {
    return byId.containsKey(id);
  }

  /**
   * Returns the geometry with the given identifier.
   *
   * @throws IllegalArgumentException if no feature has that identifier
   */
  public Geometry getGeometry(String id) {
    KeyedGeometry feature = byId.get(id);
    if (feature == null) {
      throw new IllegalArgumentException("No feature with id '" + id + "' in layer");
    }
    return feature.getGeometry();
  }

  public List<String> ids() {
    return byId.keySet().asList();
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{crs=" + crs.getCode() + ", features=" + features.size()
        + "}";
  }
}
