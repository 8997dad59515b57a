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

import org.neighborhoods.etl.EnvironmentSubstitutor;
import org.neighborhoods.etl.RetryConfig;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Connection settings for the TIGERweb geography service.
 *
 * <p>YAML example:
 * <pre>{@code
 * geographyService:
 *   baseUrl: "https://tigerweb.geo.census.gov/arcgis/rest/services/TIGERweb/Tracts_Blocks/MapServer"
 *   apiKey: "{env:CENSUS_API_KEY}"
 *   pageSize: 2000
 *   maxPages: 500
 *   retry:
 *     maxRetries: 3
 *     initialBackoffMs: 1000
 * }</pre>
 */
public final class GeographyServiceConfig {
  public static final String DEFAULT_BASE_URL =
      "https://tigerweb.geo.census.gov/arcgis/rest/services/TIGERweb/Tracts_Blocks/MapServer";

  private final String baseUrl;
  private final @Nullable String apiKey;
  private final String idField;
  private final String fallbackIdField;
  private final int pageSize;
  private final int maxPages;
  private final int connectTimeoutMs;
  private final int readTimeoutMs;
  private final RetryConfig retry;

  private GeographyServiceConfig(Builder builder) {
    this.baseUrl = builder.baseUrl;
    this.apiKey = builder.apiKey;
    this.idField = builder.idField;
    this.fallbackIdField = builder.fallbackIdField;
    this.pageSize = builder.pageSize;
    this.maxPages = builder.maxPages;
    this.connectTimeoutMs = builder.connectTimeoutMs;
    this.readTimeoutMs = builder.readTimeoutMs;
    this.retry = builder.retry;
  }

  public static GeographyServiceConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a config from a YAML/JSON map. String values may use
   * {@code {env:VAR}} placeholders.
   */
  @SuppressWarnings("unchecked")
  public static GeographyServiceConfig fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }
    if (map.get("baseUrl") != null) {
      builder.baseUrl(EnvironmentSubstitutor.substitute(String.valueOf(map.get("baseUrl"))));
    }
    if (map.get("apiKey") != null) {
      builder.apiKey(EnvironmentSubstitutor.substitute(String.valueOf(map.get("apiKey"))));
    }
    if (map.get("idField") != null) {
      builder.idField(String.valueOf(map.get("idField")));
    }
    if (map.get("fallbackIdField") != null) {
      builder.fallbackIdField(String.valueOf(map.get("fallbackIdField")));
    }
    if (map.get("pageSize") instanceof Number) {
      builder.pageSize(((Number) map.get("pageSize")).intValue());
    }
    if (map.get("maxPages") instanceof Number) {
      builder.maxPages(((Number) map.get("maxPages")).intValue());
    }
    if (map.get("connectTimeoutMs") instanceof Number) {
      builder.connectTimeoutMs(((Number) map.get("connectTimeoutMs")).intValue());
    }
    if (map.get("readTimeoutMs") instanceof Number) {
      builder.readTimeoutMs(((Number) map.get("readTimeoutMs")).intValue());
    }
    Object retryObj = map.get("retry");
    if (retryObj instanceof Map) {
      builder.retry(RetryConfig.fromMap((Map<String, Object>) retryObj));
    }
    return builder.build();
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /** Census API key, sent as {@code key} when present. */
  public @Nullable String getApiKey() {
    return apiKey;
  }

  /** Property holding the unit identifier, {@code GEOID} by default. */
  public String getIdField() {
    return idField;
  }

  /** Property used when {@link #getIdField()} is missing, {@code OBJECTID} by default. */
  public String getFallbackIdField() {
    return fallbackIdField;
  }

  public int getPageSize() {
    return pageSize;
  }

  /** Upper bound on page requests for one county. */
  public int getMaxPages() {
    return maxPages;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public int getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public RetryConfig getRetry() {
    return retry;
  }

  @Override public String toString() {
    return "GeographyServiceConfig{baseUrl='" + baseUrl + "', apiKey="
        + (apiKey == null ? "none" : "***") + ", pageSize=" + pageSize + ", retry=" + retry + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for GeographyServiceConfig.
   */
  public static class Builder {
    private String baseUrl = DEFAULT_BASE_URL;
    private @Nullable String apiKey;
    private String idField = "GEOID";
    private String fallbackIdField = "OBJECTID";
    private int pageSize = 2000;
    private int maxPages = 500;
    private int connectTimeoutMs = 30000;
    private int readTimeoutMs = 120000;
    private RetryConfig retry = RetryConfig.defaults();

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder apiKey(@Nullable String apiKey) {
      this.apiKey = apiKey == null || apiKey.isEmpty() ? null : apiKey;
      return this;
    }

    public Builder idField(String idField) {
      this.idField = idField;
      return this;
    }

    public Builder fallbackIdField(String fallbackIdField) {
      this.fallbackIdField = fallbackIdField;
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public Builder maxPages(int maxPages) {
      this.maxPages = maxPages;
      return this;
    }

    public Builder connectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    public Builder readTimeoutMs(int readTimeoutMs) {
      this.readTimeoutMs = readTimeoutMs;
      return this;
    }

    public Builder retry(RetryConfig retry) {
      this.retry = retry;
      return this;
    }

    public GeographyServiceConfig build() {
      if (baseUrl == null || baseUrl.isEmpty()) {
        throw new IllegalArgumentException("baseUrl is required");
      }
      if (baseUrl.endsWith("/")) {
        baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
      }
      if (pageSize <= 0) {
        throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
      }
      if (maxPages <= 0) {
        throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
      }
      if (retry == null) {
        retry = RetryConfig.defaults();
      }
      return new GeographyServiceConfig(this);
    }
  }
}
