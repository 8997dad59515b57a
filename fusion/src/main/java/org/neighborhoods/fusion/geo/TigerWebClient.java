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
package org.neighborhoods.fusion.geo;

import org.neighborhoods.etl.HttpFetcher;
import org.neighborhoods.etl.UrlConnectionFetcher;
import org.neighborhoods.fusion.spatial.GeographicCrs;
import org.neighborhoods.fusion.spatial.GeographicLayer;
import org.neighborhoods.fusion.spatial.KeyedGeometry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for the Census Bureau TIGERweb ArcGIS REST service.
 *
 * <p>Queries the {@code Tracts_Blocks} map service layer for the requested
 * granularity, restricted to one county, and reads the GeoJSON response.
 * Large counties are fetched in pages ({@code resultOffset} /
 * {@code resultRecordCount}) for as long as the service reports
 * {@code exceededTransferLimit}, up to
 * {@link GeographyServiceConfig#getMaxPages()} pages. A page that adds no
 * new unit fails the county.
 *
 * <p>Transient failures are retried by the underlying {@link HttpFetcher}.
 */
public class TigerWebClient implements GeographyService {
  private static final Logger LOGGER = LoggerFactory.getLogger(TigerWebClient.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final GeographyServiceConfig config;
  private final HttpFetcher fetcher;
  private final GeometryFactory geometryFactory = new GeometryFactory();

  public TigerWebClient(GeographyServiceConfig config) {
    this(config, new UrlConnectionFetcher(config.getRetry(), config.getConnectTimeoutMs(),
        config.getReadTimeoutMs()));
  }

  public TigerWebClient(GeographyServiceConfig config, HttpFetcher fetcher) {
    this.config = config;
    this.fetcher = fetcher;
  }

  @Override public GeographicLayer fetchUnits(County county, CensusGeography geography)
      throws IOException {
    Map<String, KeyedGeometry> units = new LinkedHashMap<String, KeyedGeometry>();
    int offset = 0;
    int pages = 0;
    while (true) {
      String url = buildQueryUrl(county, geography, offset);
      LOGGER.debug("Requesting {} units for county {}: {}", geography.getName(), county, url);
      JsonNode root = parse(fetcher.get(url), county);
      int before = units.size();
      int count = readFeatures(root, county, units);
      pages++;
      if (!exceededTransferLimit(root) || count == 0) {
        break;
      }
      if (units.size() == before) {
        throw new IOException("TIGERweb page at offset " + offset + " for county " + county
            + " repeated earlier units; the service is not honouring resultOffset");
      }
      if (pages >= config.getMaxPages()) {
        throw new IOException("County " + county + " still had more units after "
            + pages + " pages (maxPages=" + config.getMaxPages() + ")");
      }
      offset += count;
    }
    LOGGER.info("Fetched {} {} units for county {} in {} page(s)",
        units.size(), geography.getName(), county, pages);
    return new GeographicLayer(GeographicCrs.WGS84, new ArrayList<KeyedGeometry>(units.values()));
  }

  /**
   * Builds the layer query URL for one page of a county's units.
   */
  public String buildQueryUrl(County county, CensusGeography geography, int offset) {
    String where = "COUNTY='" + county.getCountyFips() + "' and STATE='"
        + county.getStateFips() + "'";
    StringBuilder url = new StringBuilder(config.getBaseUrl())
        .append('/').append(geography.getLayer()).append("/query")
        .append("?where=").append(encode(where))
        .append("&outFields=").append(encode("*"))
        .append("&outSR=4326")
        .append("&returnGeometry=true")
        .append("&f=geojson")
        .append("&resultOffset=").append(offset)
        .append("&resultRecordCount=").append(config.getPageSize());
    if (config.getApiKey() != null) {
      url.append("&key=").append(encode(config.getApiKey()));
    }
    return url.toString();
  }

  private static JsonNode parse(String body, County county) throws IOException {
    JsonNode root = MAPPER.readTree(body);
    if (root == null || !root.isObject()) {
      throw new IOException("Unexpected TIGERweb response for county " + county);
    }
    JsonNode error = root.get("error");
    if (error != null) {
      throw new IOException("TIGERweb error for county " + county + ": "
          + error.path("code").asText("?") + " " + error.path("message").asText(""));
    }
    return root;
  }

  private int readFeatures(JsonNode root, County county, Map<String, KeyedGeometry> units)
      throws IOException {
    JsonNode features = root.path("features");
    if (!features.isArray()) {
      throw new IOException("TIGERweb response for county " + county + " has no features array");
    }
    GeoJsonReader reader = new GeoJsonReader(geometryFactory);
    int skipped = 0;
    for (JsonNode feature : features) {
      JsonNode geometryNode = feature.get("geometry");
      String id = unitId(feature.path("properties"));
      if (id == null || geometryNode == null || geometryNode.isNull()) {
        skipped++;
        continue;
      }
      Geometry geometry;
      try {
        geometry = reader.read(geometryNode.toString());
      } catch (ParseException e) {
        throw new IOException("Cannot read geometry of unit " + id + " in county " + county, e);
      }
      if (units.containsKey(id)) {
        LOGGER.warn("Duplicate unit id {} in county {}; keeping the first", id, county);
        continue;
      }
      units.put(id, new KeyedGeometry(id, geometry));
    }
    if (skipped > 0) {
      LOGGER.warn("Skipped {} feature(s) without id or geometry in county {}", skipped, county);
    }
    return features.size();
  }

  private @Nullable String unitId(JsonNode properties) {
    for (String field : new String[] {config.getIdField(), config.getFallbackIdField()}) {
      JsonNode value = properties.get(field);
      if (value != null && !value.isNull() && !value.asText().isEmpty()) {
        return value.asText();
      }
    }
    return null;
  }

  private static boolean exceededTransferLimit(JsonNode root) {
    return root.path("exceededTransferLimit").asBoolean(false)
        || root.path("properties").path("exceededTransferLimit").asBoolean(false);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
