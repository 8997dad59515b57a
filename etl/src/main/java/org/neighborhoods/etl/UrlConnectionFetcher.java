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
package org.neighborhoods.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link HttpFetcher} backed by {@link HttpURLConnection}, with timeouts and
 * retry/backoff for transient failures.
 */
public class UrlConnectionFetcher implements HttpFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(UrlConnectionFetcher.class);
  private static final String DEFAULT_USER_AGENT = "neighborhood-fusion/1.0";

  private final RetryingExecutor executor;
  private final int connectTimeoutMs;
  private final int readTimeoutMs;
  private final Map<String, String> headers;

  public UrlConnectionFetcher(RetryConfig retry, int connectTimeoutMs, int readTimeoutMs) {
    this(new RetryingExecutor(retry), connectTimeoutMs, readTimeoutMs,
        Collections.<String, String>emptyMap());
  }

  public UrlConnectionFetcher(RetryingExecutor executor, int connectTimeoutMs,
      int readTimeoutMs, Map<String, String> headers) {
    this.executor = executor;
    this.connectTimeoutMs = connectTimeoutMs;
    this.readTimeoutMs = readTimeoutMs;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<String, String>(headers));
  }

  @Override public String get(String url) throws IOException {
    return executor.execute("GET " + url, () -> doGet(url));
  }

  private String doGet(String url) throws IOException {
    HttpURLConnection conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
    try {
      conn.setRequestMethod("GET");
      conn.setConnectTimeout(connectTimeoutMs);
      conn.setReadTimeout(readTimeoutMs);
      conn.setRequestProperty("User-Agent", DEFAULT_USER_AGENT);
      for (Map.Entry<String, String> e : headers.entrySet()) {
        conn.setRequestProperty(e.getKey(), e.getValue());
      }

      int responseCode = conn.getResponseCode();
      LOGGER.debug("HTTP GET {} -> {}", url, responseCode);
      if (responseCode >= 200 && responseCode < 300) {
        return readBody(conn.getInputStream());
      }
      String errorBody = readBody(conn.getErrorStream());
      throw new HttpStatusException(responseCode, abbreviate(errorBody));
    } finally {
      conn.disconnect();
    }
  }

  private static String readBody(InputStream in) throws IOException {
    if (in == null) {
      return "";
    }
    try (InputStream stream = in) {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buffer = new byte[8192];
      int n;
      while ((n = stream.read(buffer)) != -1) {
        out.write(buffer, 0, n);
      }
      return out.toString(StandardCharsets.UTF_8);
    }
  }

  private static String abbreviate(String body) {
    return body.length() <= 200 ? body : body.substring(0, 200) + "...";
  }
}
