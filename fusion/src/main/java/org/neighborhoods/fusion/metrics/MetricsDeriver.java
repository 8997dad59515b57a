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
package org.neighborhoods.fusion.metrics;

import org.neighborhoods.etl.Relation;
import org.neighborhoods.fusion.spatial.PlanarLayer;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived neighborhood metrics: rent-to-value ratio, area and population
 * density. Missing or unparseable inputs give a missing result.
 */
public class MetricsDeriver {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricsDeriver.class);

  public static final double SQUARE_METERS_PER_SQUARE_MILE = 2_589_988.110336;

  /**
   * Returns {@code rent / value * 100}, or {@code null} when either input is
   * missing, {@code value} is zero, or the result is not finite.
   */
  public @Nullable Double ratio(@Nullable Object rent, @Nullable Object value) {
    Double r = NumericValues.toDouble(rent);
    Double v = NumericValues.toDouble(value);
    if (r == null || v == null || v == 0d) {
      return null;
    }
    double ratio = r / v * 100d;
    return Double.isInfinite(ratio) || Double.isNaN(ratio) ? null : ratio;
  }

  /** Converts square meters to square miles. */
  public double areaSquareMiles(double squareMeters) {
    return squareMeters / SQUARE_METERS_PER_SQUARE_MILE;
  }

  /**
   * Returns the area of every feature of a planar layer in square miles.
   */
  public Map<String, Double> areaSquareMiles(PlanarLayer layer) {
    Map<String, Double> areas = new LinkedHashMap<String, Double>();
    for (Map.Entry<String, Double> e : layer.areas().entrySet()) {
      areas.put(e.getKey(), areaSquareMiles(e.getValue()));
    }
    return areas;
  }

  /**
   * Parses a population cell, stripping thousands separators.
   */
  public @Nullable Long parsePopulation(@Nullable Object raw) {
    return NumericValues.toLong(raw);
  }

  /**
   * Returns population per square mile, or {@code null} when either operand
   * is missing or the area is zero.
   */
  public @Nullable Double density(@Nullable Long population, @Nullable Double areaSqMi) {
    if (population == null || areaSqMi == null || areaSqMi == 0d || areaSqMi.isNaN()) {
      return null;
    }
    return population / areaSqMi;
  }

  /**
   * Adds or replaces {@code target} with {@code rentColumn / valueColumn * 100}.
   */
  public Relation withRatio(Relation relation, String rentColumn, String valueColumn,
      String target) {
    relation.requireColumns("ratio input", Arrays.asList(rentColumn, valueColumn));
    return relation.withColumn(target, r -> ratio(r.get(rentColumn), r.get(valueColumn)));
  }

  /**
   * Adds area, normalised population and density columns.
   *
   * @param relation One row per neighborhood
   * @param idColumn Column holding the key of {@code areasSqMi}
   * @param areasSqMi Area per neighborhood id in square miles
   * @param populationColumn Raw population column; may be absent
   */
  public Relation withAreaAndDensity(Relation relation, String idColumn,
      Map<String, Double> areasSqMi, String populationColumn, String areaColumn,
      String densityColumn) {
    relation.requireColumns("area input", Collections.singletonList(idColumn));
    Relation out = relation.withColumn(areaColumn, r -> areasSqMi.get(key(r.get(idColumn))));
    if (!out.hasColumn(populationColumn)) {
      List<String> suffixed = new ArrayList<String>();
      for (String column : out.getColumns()) {
        if (column.startsWith(populationColumn + "_")) {
          suffixed.add(column);
        }
      }
      if (!suffixed.isEmpty()) {
        LOGGER.warn("No '{}' column but found {}; {} left missing",
            populationColumn, suffixed, densityColumn);
      }
      return out.withColumn(densityColumn, r -> null);
    }
    out = out.withColumn(populationColumn, r -> parsePopulation(r.get(populationColumn)));
    return out.withColumn(densityColumn, r -> density(
        (Long) r.get(populationColumn), (Double) r.get(areaColumn)));
  }

  private static @Nullable String key(@Nullable Object id) {
    return id == null ? null : id.toString();
  }
}
