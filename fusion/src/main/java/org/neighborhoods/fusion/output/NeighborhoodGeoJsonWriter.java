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
package org.neighborhoods.fusion.output;

import org.neighborhoods.fusion.pipeline.FusedNeighborhood;
import org.neighborhoods.fusion.pipeline.FusionResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.locationtech.jts.io.geojson.GeoJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes fused neighborhoods as a GeoJSON FeatureCollection, one Feature per
 * neighborhood with its attributes as properties.
 */
public class NeighborhoodGeoJsonWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(NeighborhoodGeoJsonWriter.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public void write(FusionResult result, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(result, out);
    }
    LOGGER.info("Wrote {} neighborhoods to {}", result.getNeighborhoodCount(), file);
  }

  public void write(FusionResult result, Writer target) throws IOException {
    MAPPER.writerWithDefaultPrettyPrinter().writeValue(target, toFeatureCollection(result));
  }

  ObjectNode toFeatureCollection(FusionResult result) throws IOException {
    GeoJsonWriter geometryWriter = new GeoJsonWriter();
    geometryWriter.setEncodeCRS(false);
    ObjectNode collection = MAPPER.createObjectNode();
    collection.put("type", "FeatureCollection");
    ArrayNode features = collection.putArray("features");
    for (FusedNeighborhood neighborhood : result.getNeighborhoods()) {
      ObjectNode feature = features.addObject();
      feature.put("type", "Feature");
      feature.put("id", neighborhood.getId());
      ObjectNode properties = feature.putObject("properties");
      for (Map.Entry<String, Object> e : neighborhood.getAttributes().entrySet()) {
        properties.set(e.getKey(), property(e.getValue()));
      }
      feature.set("geometry", MAPPER.readTree(geometryWriter.write(neighborhood.getBoundary())));
    }
    return collection;
  }

  private static JsonNode property(Object value) {
    if (value == null || value instanceof Double && !Double.isFinite((Double) value)) {
      return MAPPER.nullNode();
    }
    return MAPPER.valueToTree(value);
  }
}
