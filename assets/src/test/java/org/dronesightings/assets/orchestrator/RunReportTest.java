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
package org.dronesightings.assets.orchestrator;

import org.dronesightings.assets.AssetCategory;
import org.dronesightings.assets.AssetFetchException;
import org.dronesightings.assets.strategy.Strategy;
import org.dronesightings.assets.strategy.StrategyAttempt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RunReport}.
 */
@Tag("unit")
public class RunReportTest {
  private static final Instant STARTED = Instant.parse("2024-05-01T06:00:00Z");
  private static final Instant COMPLETED = Instant.parse("2024-05-01T06:01:30Z");

  @TempDir
  Path tempDir;

  private static RunReport sample() {
    return RunReport.builder(STARTED,
            ImmutableList.of(AssetCategory.AIRPORT, AssetCategory.HARBOUR))
        .addAttempts(ImmutableList.of(
            StrategyAttempt.success(AssetCategory.AIRPORT, Strategy.LIVE_FETCH, 1200,
                STARTED.plusSeconds(2), 812)))
        .succeeded(812)
        .addAttempts(ImmutableList.of(
            StrategyAttempt.failure(AssetCategory.HARBOUR, Strategy.STATIC_FALLBACK, 3,
                STARTED.plusSeconds(80), "resource missing")))
        .failed(AssetCategory.HARBOUR)
        .build(COMPLETED);
  }

  @Test void testTotals() {
    RunReport report = sample();

    assertEquals(90.0, report.getTotalTimeSeconds(), 1e-9);
    assertEquals(2, report.getTotalDownloads());
    assertEquals(1, report.getSuccessfulDownloads());
    assertEquals(0.5, report.getSuccessRate(), 1e-9);
    assertEquals(812, report.getTotalFeatures());
    assertFalse(report.isCancelled());
  }

  @Test void testJsonLayout() throws IOException {
    JsonNode json = new ObjectMapper().readTree(sample().toJson());

    assertEquals("2024-05-01T06:00:00Z", json.get("started").asText());
    assertEquals("2024-05-01T06:01:30Z", json.get("completed").asText());
    assertEquals(90.0, json.get("total_time").asDouble(), 1e-9);
    assertEquals(1, json.get("successful_downloads").asInt());
    assertEquals(2, json.get("total_downloads").asInt());
    assertEquals(0.5, json.get("success_rate").asDouble(), 1e-9);
    assertEquals(812, json.get("total_features").asLong());
    assertEquals("harbour", json.get("failed_categories").get(0).asText());
    assertFalse(json.get("cancelled").asBoolean());

    JsonNode operations = json.get("operations");
    assertEquals(2, operations.size());
    JsonNode first = operations.get(0);
    assertEquals("airport", first.get("asset_type").asText());
    assertEquals("optimized_download", first.get("strategy").asText());
    assertEquals(1200, first.get("duration_ms").asLong());
    assertTrue(first.get("success").asBoolean());
    assertEquals(812, first.get("record_count").asInt());
    assertFalse(first.has("error"));
    JsonNode second = operations.get(1);
    assertEquals("fallback_data", second.get("strategy").asText());
    assertEquals("resource missing", second.get("error").asText());
  }

  @Test void testEmptyRunHasZeroRate() {
    RunReport report = RunReport.builder(STARTED, ImmutableList.of()).cancelled()
        .build(STARTED);

    assertEquals(0.0, report.getSuccessRate(), 1e-9);
    assertTrue(report.isCancelled());
  }

  @Test void testReportNamesNeverCollide() throws IOException {
    Path first = sample().writeTo(tempDir.resolve("logs"));
    Path second = sample().writeTo(tempDir.resolve("logs"));

    assertNotEquals(first, second);
    assertEquals("download_report_" + COMPLETED.toEpochMilli() + ".json",
        first.getFileName().toString());
    assertEquals("download_report_" + COMPLETED.toEpochMilli() + "_1.json",
        second.getFileName().toString());
    assertTrue(Files.size(second) > 0);
  }

  @Test void testUnwritableDirectory() throws IOException {
    Path blocker = tempDir.resolve("logs");
    Files.write(blocker, new byte[0]);

    assertThrows(AssetFetchException.class, () -> sample().writeTo(blocker));
  }
}
