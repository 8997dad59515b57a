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

import java.util.Map;

/**
 * Retry policy for transient failures: a bounded number of retries with
 * exponential backoff, capped at a maximum delay.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * retry:
 *   maxRetries: 3
 *   initialBackoffMs: 1000
 *   multiplier: 2.0
 *   maxBackoffMs: 30000
 * }</pre>
 */
public final class RetryConfig {

  private final int maxRetries;
  private final long initialBackoffMs;
  private final double multiplier;
  private final long maxBackoffMs;

  private RetryConfig(Builder builder) {
    this.maxRetries = builder.maxRetries;
    this.initialBackoffMs = builder.initialBackoffMs;
    this.multiplier = builder.multiplier;
    this.maxBackoffMs = builder.maxBackoffMs;
  }

  public static RetryConfig defaults() {
    return builder().build();
  }

  /**
   * Returns a policy that makes a single attempt.
   */
  public static RetryConfig none() {
    return builder().maxRetries(0).build();
  }

  /**
   * Creates a RetryConfig from a YAML/JSON map; absent keys keep their defaults.
   */
  public static RetryConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }
    if (map.get("maxRetries") != null) {
      builder.maxRetries(((Number) map.get("maxRetries")).intValue());
    }
    if (map.get("initialBackoffMs") != null) {
      builder.initialBackoffMs(((Number) map.get("initialBackoffMs")).longValue());
    }
    if (map.get("multiplier") != null) {
      builder.multiplier(((Number) map.get("multiplier")).doubleValue());
    }
    if (map.get("maxBackoffMs") != null) {
      builder.maxBackoffMs(((Number) map.get("maxBackoffMs")).longValue());
    }
    return builder.build();
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public long getInitialBackoffMs() {
    return initialBackoffMs;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public long getMaxBackoffMs() {
    return maxBackoffMs;
  }

  /**
   * Returns the delay before the given retry.
   *
   * @param retry Retry number, starting at 1
   */
  public long backoffBeforeRetry(int retry) {
    double delay = initialBackoffMs * Math.pow(multiplier, retry - 1);
    return (long) Math.min(delay, (double) maxBackoffMs);
  }

  @Override public String toString() {
    return "RetryConfig{maxRetries=" + maxRetries + ", initialBackoffMs=" + initialBackoffMs
        + ", multiplier=" + multiplier + ", maxBackoffMs=" + maxBackoffMs + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for RetryConfig.
   */
  public static class Builder {
    private int maxRetries = 3;
    private long initialBackoffMs = 1000;
    private double multiplier = 2.0;
    private long maxBackoffMs = 30000;

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder initialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
      return this;
    }

    public Builder multiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    public Builder maxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
      return this;
    }

    public RetryConfig build() {
      if (maxRetries < 0) {
        throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
      }
      if (initialBackoffMs < 0 || maxBackoffMs < 0) {
        throw new IllegalArgumentException("Backoff delays must be >= 0");
      }
      if (multiplier < 1.0) {
        throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
      }
      return new RetryConfig(this);
    }
  }
}
