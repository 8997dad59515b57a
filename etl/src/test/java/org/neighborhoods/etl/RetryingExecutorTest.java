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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RetryingExecutor} and {@link RetryConfig}.
 */
@Tag("unit")
class RetryingExecutorTest {

  private final List<Long> sleeps = new ArrayList<Long>();

  @Test
  void testBackoffIsExponentialAndCapped() {
    RetryConfig config = RetryConfig.builder()
        .initialBackoffMs(100)
        .multiplier(2.0)
        .maxBackoffMs(300)
        .build();

    assertEquals(100, config.backoffBeforeRetry(1));
    assertEquals(200, config.backoffBeforeRetry(2));
    assertEquals(300, config.backoffBeforeRetry(3));
    assertEquals(300, config.backoffBeforeRetry(10));
  }

  @Test
  void testTransientFailureRetriedUntilSuccess() throws IOException {
    RetryingExecutor executor = new RetryingExecutor(
        RetryConfig.builder().maxRetries(3).initialBackoffMs(10).build(), sleeps::add);
    AtomicInteger attempts = new AtomicInteger();

    String result = executor.execute("test", () -> {
      if (attempts.incrementAndGet() < 3) {
        throw new IOException("connection reset");
      }
      return "ok";
    });

    assertEquals("ok", result);
    assertEquals(3, attempts.get());
    assertEquals(Arrays.asList(10L, 20L), sleeps);
  }

  @Test
  void testExhaustedRetriesRethrowLastFailure() {
    RetryingExecutor executor = new RetryingExecutor(
        RetryConfig.builder().maxRetries(2).initialBackoffMs(1).build(), sleeps::add);
    AtomicInteger attempts = new AtomicInteger();

    IOException e = assertThrows(IOException.class, () ->
        executor.execute("test", () -> {
          throw new IOException("attempt " + attempts.incrementAndGet());
        }));

    assertEquals("attempt 3", e.getMessage());
    assertEquals(2, sleeps.size());
  }

  @Test
  void testPermanentHttpStatusNotRetried() {
    RetryingExecutor executor = new RetryingExecutor(RetryConfig.defaults(), sleeps::add);
    AtomicInteger attempts = new AtomicInteger();

    HttpStatusException e = assertThrows(HttpStatusException.class, () ->
        executor.execute("test", () -> {
          attempts.incrementAndGet();
          throw new HttpStatusException(404, "not found");
        }));

    assertEquals(404, e.getStatusCode());
    assertEquals(1, attempts.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void testRateLimitAndServerErrorsAreRetryable() {
    assertTrue(new HttpStatusException(429, "").isRetryable());
    assertTrue(new HttpStatusException(503, "").isRetryable());
    assertEquals(false, new HttpStatusException(400, "").isRetryable());
  }

  @Test
  void testNoRetryPolicyMakesSingleAttempt() {
    RetryingExecutor executor = new RetryingExecutor(RetryConfig.none(), sleeps::add);
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(IOException.class, () -> executor.execute("test", () -> {
      attempts.incrementAndGet();
      throw new IOException("down");
    }));
    assertEquals(1, attempts.get());
  }

  @Test
  void testFromMapOverridesDefaults() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("maxRetries", 5);
    map.put("initialBackoffMs", 250);

    RetryConfig config = RetryConfig.fromMap(map);

    assertEquals(5, config.getMaxRetries());
    assertEquals(250, config.getInitialBackoffMs());
    assertEquals(2.0, config.getMultiplier());
    assertEquals(30000, config.getMaxBackoffMs());
  }

  @Test
  void testInvalidConfigRejected() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryConfig.builder().maxRetries(-1).build());
    assertThrows(IllegalArgumentException.class, () ->
        RetryConfig.builder().multiplier(0.5).build());
  }
}
