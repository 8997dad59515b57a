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

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One output neighborhood: its attributes in column order and its boundary
 * in geographic coordinates.
 */
public final class FusedNeighborhood {
  private final String id;
  private final Map<String, Object> attributes;
  private final Geometry boundary;

  public FusedNeighborhood(String id, Map<String, Object> attributes, Geometry boundary) {
    this.id = id;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(attributes));
    this.boundary = boundary;
  }

  public String getId() {
    return id;
  }

  /** Attribute values by column, including {@code id}; values may be null. */
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public Geometry getBoundary() {
    return boundary;
  }

  @Override public String toString() {
    return "FusedNeighborhood{id='" + id + "', name="
        + attributes.get(NeighborhoodColumns.NEIGHBORHOOD)
        + ", boundary=" + boundary.getGeometryType() + "}";
  }
}
