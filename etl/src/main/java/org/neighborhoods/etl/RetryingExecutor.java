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

import java.io.IOException;

/**
 * Runs an I/O call, retrying transient failures according to a {@link RetryConfig}.
 *
 * <p>Every {@link IOException} is considered transient except an
 * {@link HttpStatusException} whose status is not retryable. When retries are
 * exhausted the last failure is rethrown.
 */
public class RetryingExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingExecutor.class);

  /**
   * An I/O operation to attempt.
   *
   * @param <T> Result type
   */
  @FunctionalInterface
  public interface IoCall<T> {
    T call() throws IOException;
  }

  /**
   * Waits between attempts; replaced in tests.
   */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final RetryConfig config;
  private final Sleeper sleeper;

  public RetryingExecutor(RetryConfig config) {
    this(config, Thread::sleep);
  }

  public RetryingExecutor(RetryConfig config, Sleeper sleeper) {
    this.config = config;
    this.sleeper = sleeper;
  }

  public RetryConfig getConfig() {
    return config;
  }

  /**
   * Executes the call.
   *
   * @param description Short description used in log messages
   * @param call Operation to run
   * @return The call's result
   * @throws IOException The last failure once retries are exhausted, or a permanent failure
   */
  public <T> T execute(String description, IoCall<T> call) throws IOException {
    int retry = 0;
    while (true) {
      try {
        return call.call();
      } catch (IOException e) {
        if (!isRetryable(e) || retry >= config.getMaxRetries()) {
          if (retry > 0) {
            LOGGER.warn("{} failed after {} retries: {}", description, retry, e.getMessage());
          }
          throw e;
        }
        retry++;
        long backoff = config.backoffBeforeRetry(retry);
        LOGGER.warn("{} failed, retrying in {}ms (attempt {}/{}): {}",
            description, backoff, retry, config.getMaxRetries(), e.getMessage());
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IOException("Interrupted during retry backoff for " + description, ie);
        }
      }
    }
  }

  static boolean isRetryable(IOException e) {
    if (e instanceof HttpStatusException) {
      return ((HttpStatusException) e).isRetryable();
    }
    return true;
  }
}
