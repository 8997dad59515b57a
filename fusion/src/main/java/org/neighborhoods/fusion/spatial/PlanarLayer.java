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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer in a meter-based projected system. Distances and areas are only
 * computed on this type.
 */
public final class PlanarLayer extends FeatureLayer<PlanarCrs> {

  public PlanarLayer(PlanarCrs crs, List<KeyedGeometry> features) {
    super(crs, features);
  }

  /**
   * Returns the area of one feature in square meters.
   */
  public double area(String id) {
    return getGeometry(id).getArea();
  }

  /**
   * Returns every feature's area in square meters, in layer order.
   */
  public Map<String, Double> areas() {
    Map<String, Double> areas = new LinkedHashMap<String, Double>();
    for (KeyedGeometry feature : getFeatures()) {
      areas.put(feature.getId(), feature.getGeometry().getArea());
    }
    return areas;
  }

  /**
   * Returns the summed area of all features in square meters.
   */
  public double totalArea() {
    double total = 0;
    for (KeyedGeometry feature : getFeatures()) {
      total += feature.getGeometry().getArea();
    }
    return total;
  }
}
