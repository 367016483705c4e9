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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link BackoffPolicy}.
 */
@Tag("unit")
public class BackoffPolicyTest {

  @Test void testBaseDelayGrowsByFactorThree() {
    BackoffPolicy policy = new BackoffPolicy();
    assertEquals(Duration.ofSeconds(15), policy.baseDelay(1));
    assertEquals(Duration.ofSeconds(45), policy.baseDelay(2));
    assertEquals(Duration.ofSeconds(135), policy.baseDelay(3));
  }

  @Test void testJitterStaysBelowMaximum() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(5),
        new Random(7));
    for (int i = 0; i < 200; i++) {
      Duration delay = policy.retryDelay(1);
      assertTrue(delay.compareTo(Duration.ofSeconds(15)) >= 0, delay.toString());
      assertTrue(delay.compareTo(Duration.ofSeconds(20)) < 0, delay.toString());
    }
  }

  @Test void testZeroJitterIsDeterministic() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(2), Duration.ZERO, new Random());
    assertEquals(Duration.ofSeconds(6), policy.retryDelay(1));
    assertEquals(Duration.ofSeconds(18), policy.retryDelay(2));
  }
}
