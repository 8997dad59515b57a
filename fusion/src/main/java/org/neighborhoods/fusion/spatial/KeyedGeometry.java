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

import org.locationtech.jts.geom.Geometry;

import java.util.Objects;

/**
 * A geometry with a string identifier: a geographic unit keyed by its GEOID,
 * a neighborhood point keyed by neighborhood id, or a dissolved boundary
 * keyed by the neighborhood it belongs to.
 */
public final class KeyedGeometry {
  private final String id;
  private final Geometry geometry;

  public KeyedGeometry(String id, Geometry geometry) {
    this.id = Objects.requireNonNull(id, "id");
    this.geometry = Objects.requireNonNull(geometry, "geometry");
  }

  public String getId() {
    return id;
  }

  public Geometry getGeometry() {
    return geometry;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof KeyedGeometry)) {
      return false;
    }
    KeyedGeometry that = (KeyedGeometry) o;
    return id.equals(that.id) && geometry.equalsExact(that.geometry);
  }

  @Override public int hashCode() {
    return id.hashCode();
  }

  @Override public String toString() {
    return "KeyedGeometry{id='" + id + "', type=" + geometry.getGeometryType() + "}";
  }
}
