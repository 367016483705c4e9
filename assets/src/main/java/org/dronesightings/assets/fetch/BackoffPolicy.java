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

import java.time.Duration;
import java.util.Random;

/**
 * Delay before a retry attempt: {@code initialDelay * 3^attempt} plus a uniform
 * jitter in {@code [0, maxJitter)}. With the defaults attempt 1 waits about 15 s
 * and attempt 2 about 45 s. Independent from, and added to, rate limiter spacing.
 */
public class BackoffPolicy {
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(5);
  public static final Duration DEFAULT_MAX_JITTER = Duration.ofSeconds(5);

  private final Duration initialDelay;
  private final Duration maxJitter;
  private final Random random;

  public BackoffPolicy() {
    this(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_JITTER, new Random());
  }

  public BackoffPolicy(Duration initialDelay, Duration maxJitter, Random random) {
    this.initialDelay = initialDelay;
    this.maxJitter = maxJitter;
    this.random = random;
  }

  /** Deterministic part of the retry delay for a 0-indexed attempt. */
  public Duration baseDelay(int attempt) {
    return RateLimiter.requiredDelay(initialDelay, attempt);
  }

  /** Full retry delay for a 0-indexed attempt, including jitter. */
  public Duration retryDelay(int attempt) {
    long jitterMillis = maxJitter.toMillis() > 0
        ? (long) (random.nextDouble() * maxJitter.toMillis())
        : 0L;
    return baseDelay(attempt).plusMillis(jitterMillis);
  }
}
