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

import org.dronesightings.assets.AssetCategory;
import org.dronesightings.assets.model.BoundingBox;
import org.dronesightings.assets.model.Feature;
import org.dronesightings.assets.source.OverpassElementMapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RegionChunker}.
 */
@Tag("unit")
public class RegionChunkerTest {
  private static final Duration MIN_DELAY = Duration.ofSeconds(10);
  private static final Duration MAX_DELAY = Duration.ofSeconds(20);

  private RecordingSleeper sleeper;
  private ScriptedTransport transport;
  private CancellationToken cancellation;
  private RegionChunker<JsonNode> chunker;

  @BeforeEach
  void setUp() {
    MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    sleeper = new RecordingSleeper(clock);
    transport = new ScriptedTransport();
    cancellation = CancellationToken.create();
    QueryExecutor<JsonNode> executor = new QueryExecutor<>("overpass",
        new EndpointSelector(ImmutableList.of("https://overpass.test/api")),
        new RateLimiter(Duration.ZERO, clock, sleeper), transport, PayloadParser.json(),
        new BackoffPolicy(Duration.ofSeconds(1), Duration.ZERO, new Random(3)), sleeper,
        Duration.ofSeconds(60), cancellation);
    chunker = new RegionChunker<>(executor, 1, MIN_DELAY, MAX_DELAY, new Random(3), sleeper,
        cancellation);
  }

  private static Map<String, BoundingBox> regions(int count) {
    Map<String, BoundingBox> regions = new LinkedHashMap<>();
    for (int i = 0; i < count; i++) {
      regions.put("r" + i, new BoundingBox(40 + i, 0, 41 + i, 1));
    }
    return regions;
  }

  /** Overpass payload with {@code count} nodes named {@code prefix-n}. */
  private static String payload(String prefix, int count) {
    List<String> elements = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      elements.add("{\"type\":\"node\",\"id\":" + i + ",\"lat\":50.0,\"lon\":" + i
          + ".5,\"tags\":{\"name\":\"" + prefix + "-" + i + "\"}}");
    }
    return "{\"elements\":[" + String.join(",", elements) + "]}";
  }

  private ChunkedResult fetch(Map<String, BoundingBox> regions) {
    return chunker.fetchByRegion(regions, BoundingBox::toOverpass,
        payload -> OverpassElementMapper.map(AssetCategory.MILITARY, payload));
  }

  @Test void testMergesRegionsInOrderIncludingEmptyOnes() {
    transport.respond(payload("a", 2)).respond(payload("b", 0)).respond(payload("c", 3))
        .respond(payload("d", 0)).respond(payload("e", 1));

    ChunkedResult result = fetch(regions(5));

    assertEquals(6, result.getFeatures().size());
    List<String> names = new ArrayList<>();
    for (Feature feature : result.getFeatures()) {
      names.add(feature.getName());
    }
    assertEquals(ImmutableList.of("a-0", "a-1", "c-0", "c-1", "c-2", "e-0"), names);
    assertEquals(0, result.getRegionsFailed());
    assertEquals(5, result.getRegionsAttempted());
    assertEquals(Integer.valueOf(0), result.getRegionCounts().get("r1"));
    assertFalse(result.allRegionsFailed());
  }

  @Test void testDelaysSeparateRegionsButDoNotFollowTheLast() {
    for (int i = 0; i < 5; i++) {
      transport.respond(payload("x", 1));
    }

    fetch(regions(5));

    List<Duration> sleeps = sleeper.getSleeps();
    assertEquals(4, sleeps.size());
    for (Duration sleep : sleeps) {
      assertTrue(sleep.compareTo(MIN_DELAY) >= 0 && sleep.compareTo(MAX_DELAY) <= 0,
          sleep.toString());
    }
  }

  @Test void testFailedRegionIsSkippedAndProcessingContinues() {
    transport.respond(payload("a", 2)).fail("HTTP 504").respond(payload("c", 1));

    ChunkedResult result = fetch(regions(3));

    assertEquals(3, result.getFeatures().size());
    assertEquals(1, result.getRegionsFailed());
    assertEquals(Integer.valueOf(-1), result.getRegionCounts().get("r1"));
    assertEquals(3, transport.getCallCount());
  }

  @Test void testAllRegionsFailed() {
    transport.fail("down").fail("down");

    ChunkedResult result = fetch(regions(2));

    assertTrue(result.allRegionsFailed());
    assertTrue(result.getFeatures().isEmpty());
  }

  @Test void testCancellationStopsBeforeNextRegion() {
    cancellation.cancel();

    ChunkedResult result = fetch(regions(3));

    assertTrue(result.isCancelled());
    assertEquals(0, transport.getCallCount());
  }

  @Test void testQueryBuiltPerRegion() {
    transport.respond(payload("a", 0)).respond(payload("b", 0));

    fetch(regions(2));

    assertEquals(ImmutableList.of("40,0,41,1", "41,0,42,1"), transport.getQueries());
  }
}
