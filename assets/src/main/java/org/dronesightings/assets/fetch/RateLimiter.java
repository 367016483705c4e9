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
package org.dronesightings.assets.fetch;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-provider request spacing with failure-driven backoff.
 *
 * <p>The required spacing between two requests is
 * {@code baseDelay * 3^consecutiveFailures}: base, 3x base, 9x base and so on,
 * without a cap. A success resets the failure count. State belongs to the
 * instance, so two providers never share failure counts.
 */
public class RateLimiter {
  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

  static final int BACKOFF_FACTOR = 3;

  private final Duration baseDelay;
  private final Clock clock;
  private final Sleeper sleeper;

  private @Nullable Instant lastRequestAt;
  private int consecutiveFailures;
  private long totalRequests;

  public RateLimiter(Duration baseDelay) {
    this(baseDelay, Clock.systemUTC(), Sleeper.SYSTEM);
  }

  public RateLimiter(Duration baseDelay, Clock clock, Sleeper sleeper) {
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative: " + baseDelay);
    }
    this.baseDelay = baseDelay;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Required spacing after {@code failures} consecutive failures.
   * Saturates at the largest representable duration instead of overflowing.
   */
  public static Duration requiredDelay(Duration baseDelay, int failures) {
    long millis = baseDelay.toMillis();
    for (int i = 0; i < failures; i++) {
      if (millis > Long.MAX_VALUE / BACKOFF_FACTOR) {
        return Duration.ofMillis(Long.MAX_VALUE);
      }
      millis *= BACKOFF_FACTOR;
    }
    return Duration.ofMillis(millis);
  }

  /** Required spacing for the current failure count. */
  public synchronized Duration requiredDelay() {
    return requiredDelay(baseDelay, consecutiveFailures);
  }

  /**
   * Blocks until the required spacing since the previous request has elapsed,
   * then records the new request.
   */
  public synchronized void waitIfNeeded() throws InterruptedException {
    if (lastRequestAt != null) {
      Duration required = requiredDelay();
      Duration elapsed = Duration.between(lastRequestAt, clock.instant());
      if (elapsed.compareTo(required) < 0) {
        Duration wait = required.minus(elapsed);
        LOGGER.info("Rate limiting: waiting {} ms ({} consecutive failures)",
            wait.toMillis(), consecutiveFailures);
        sleeper.sleep(wait);
      }
    }
    lastRequestAt = clock.instant();
    totalRequests++;
  }

  public synchronized void recordSuccess() {
    consecutiveFailures = 0;
  }

  public synchronized void recordFailure() {
    consecutiveFailures++;
    LOGGER.debug("Recorded failure, consecutive failures now {}", consecutiveFailures);
  }

  public synchronized int getConsecutiveFailures() {
    return consecutiveFailures;
  }

  public synchronized long getTotalRequests() {
    return totalRequests;
  }

  public synchronized @Nullable Instant getLastRequestAt() {
    return lastRequestAt;
  }
}
