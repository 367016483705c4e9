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
import org.dronesightings.assets.AssetConfigException;
import org.dronesightings.assets.OrchestratorConfig;
import org.dronesightings.assets.cache.AssetCache;
import org.dronesightings.assets.cache.QueryFingerprint;
import org.dronesightings.assets.fetch.CancellationToken;
import org.dronesightings.assets.fetch.MutableClock;
import org.dronesightings.assets.fetch.RecordingSleeper;
import org.dronesightings.assets.fetch.ScriptedTransport;
import org.dronesightings.assets.model.BoundingBox;
import org.dronesightings.assets.model.Feature;
import org.dronesightings.assets.model.FeatureCollectionCodec;
import org.dronesightings.assets.model.FeatureSet;
import org.dronesightings.assets.source.OverpassFixtures;
import org.dronesightings.assets.strategy.FakeSource;
import org.dronesightings.assets.strategy.Strategy;
import org.dronesightings.assets.strategy.StrategyPlan;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DownloadOrchestrator}.
 */
@Tag("unit")
public class DownloadOrchestratorTest {
  private static final List<AssetCategory> THREE = ImmutableList.of(
      AssetCategory.AIRPORT, AssetCategory.HARBOUR, AssetCategory.MILITARY);

  @TempDir
  Path tempDir;

  private MutableClock clock;
  private RecordingSleeper sleeper;
  private FakeSource airports;
  private FakeSource overpass;
  private FakeSource fallback;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T06:00:00Z"));
    sleeper = new RecordingSleeper(clock);
    airports = new FakeSource("ourairports", AssetCategory.AIRPORT).defaultSize(5);
    overpass = new FakeSource("overpass", AssetCategory.HARBOUR, AssetCategory.MILITARY)
        .defaultSize(4);
    fallback = new FakeSource("fallback", AssetCategory.values()).uncacheable()
        .acceptingEmpty().defaultSize(1);
  }

  private OrchestratorConfig config(Duration interCategoryDelay) {
    return OrchestratorConfig.builder()
        .assetRoot(tempDir.resolve("assets"))
        .cacheRoot(tempDir.resolve("cache"))
        .reportRoot(tempDir.resolve("logs"))
        .baseDelay(Duration.ofSeconds(1))
        .minRegionDelay(Duration.ZERO)
        .maxRegionDelay(Duration.ZERO)
        .interCategoryDelay(interCategoryDelay)
        .regions(ImmutableMap.of("central", new BoundingBox(45, 8, 55, 20)))
        .enableAlternateSources(false)
        .categories(THREE)
        .build();
  }

  private DownloadOrchestrator orchestrator(OrchestratorConfig config,
      CancellationToken cancellation) {
    StrategyPlan plan = StrategyPlan.builder().live(airports).live(overpass)
        .fallback(fallback).build();
    return new DownloadOrchestrator(config, plan,
        new AssetCache(config.getCacheRoot(), config.getTtlDays(), clock),
        new AssetWriter(config.getAssetRoot(), clock), sleeper, clock, cancellation);
  }

  private List<Path> reports() throws IOException {
    try (Stream<Path> files = Files.list(tempDir.resolve("logs"))) {
      return files.collect(Collectors.toList());
    }
  }

  @Test void testRunWritesLayersAndReport() throws IOException {
    overpass.thenReturn(4).thenFail("HTTP 504");

    RunReport report = orchestrator(config(Duration.ZERO), CancellationToken.create()).run();

    assertEquals(3, report.getTotalDownloads());
    assertEquals(3, report.getSuccessfulDownloads());
    assertEquals(1.0, report.getSuccessRate(), 1e-9);
    assertEquals(5 + 4 + 1, report.getTotalFeatures());
    assertTrue(report.getFailedCategories().isEmpty());
    assertFalse(report.isCancelled());

    FeatureSet military = FeatureCollectionCodec.read(
        tempDir.resolve("assets").resolve("military.geojson"), AssetCategory.MILITARY);
    assertEquals(1, military.size());
    assertTrue(Files.exists(tempDir.resolve("assets").resolve("airport.geojson")));
    assertTrue(Files.exists(tempDir.resolve("assets").resolve("harbour.geojson")));

    List<Path> reports = reports();
    assertEquals(1, reports.size());
    assertTrue(reports.get(0).getFileName().toString().startsWith("download_report_"));
  }

  @Test void testCacheMaintenanceFailureDoesNotAbortRun() throws IOException {
    OrchestratorConfig config = config(Duration.ZERO);
    new AssetCache(config.getCacheRoot(), config.getTtlDays(), clock)
        .put(AssetCategory.HARBOUR, QueryFingerprint.of("stale"),
            FakeSource.features(AssetCategory.HARBOUR, 2));
    clock.advance(Duration.ofDays(400));
    // index saves fail while the temp file name is taken by a directory
    Files.createDirectories(config.getCacheRoot().resolve("cache_index.json.tmp"));

    RunReport report = orchestrator(config, CancellationToken.create()).run();

    assertEquals(3, report.getSuccessfulDownloads());
    assertTrue(report.getFailedCategories().isEmpty());
    assertEquals(1, reports().size());
  }

  @Test void testInterCategoryDelayBetweenCategoriesOnly() {
    orchestrator(config(Duration.ofSeconds(60)), CancellationToken.create()).run();

    List<Duration> pauses = sleeper.getSleeps().stream()
        .filter(d -> d.equals(Duration.ofSeconds(60)))
        .collect(Collectors.toList());
    assertEquals(2, pauses.size());
  }

  @Test void testCategoryFailsWhenEveryStrategyFails() {
    airports.thenFail("down");
    fallback.thenFail("resource missing");

    RunReport report = orchestrator(config(Duration.ZERO), CancellationToken.create()).run();

    assertEquals(ImmutableList.of(AssetCategory.AIRPORT), report.getFailedCategories());
    assertEquals(2, report.getSuccessfulDownloads());
    assertEquals(2.0 / 3, report.getSuccessRate(), 1e-9);
    assertFalse(Files.exists(tempDir.resolve("assets").resolve("airport.geojson")));
  }

  @Test void testAttemptsAreReportedInOrder() {
    airports.thenFail("HTTP 503");

    RunReport report = orchestrator(config(Duration.ZERO), CancellationToken.create())
        .run(ImmutableList.of(AssetCategory.AIRPORT));

    assertEquals(3, report.getAttempts().size());
    assertEquals(Strategy.CACHE, report.getAttempts().get(0).getStrategy());
    assertEquals(Strategy.LIVE_FETCH, report.getAttempts().get(1).getStrategy());
    assertEquals("HTTP 503", report.getAttempts().get(1).getError());
    assertEquals(Strategy.STATIC_FALLBACK, report.getAttempts().get(2).getStrategy());
    assertTrue(report.getAttempts().get(2).isSuccess());
  }

  @Test void testCancellationStopsBeforeNextCategory() {
    CancellationToken cancellation = CancellationToken.create();
    DownloadOrchestrator orchestrator = new DownloadOrchestrator(config(Duration.ofSeconds(60)),
        StrategyPlan.builder().live(airports).live(overpass).fallback(fallback).build(), null,
        new AssetWriter(tempDir.resolve("assets"), clock),
        duration -> cancellation.cancel(), clock, cancellation);

    RunReport report = orchestrator.run();

    assertTrue(report.isCancelled());
    assertEquals(1, report.getSuccessfulDownloads());
    assertEquals(3, report.getTotalDownloads());
    assertEquals(0, overpass.getCallCount());
  }

  @Test void testInterruptedPauseCancelsRun() {
    DownloadOrchestrator orchestrator = new DownloadOrchestrator(config(Duration.ofSeconds(60)),
        StrategyPlan.builder().live(airports).live(overpass).fallback(fallback).build(), null,
        new AssetWriter(tempDir.resolve("assets"), clock),
        duration -> {
          throw new InterruptedException("stop");
        }, clock, CancellationToken.create());

    RunReport report = orchestrator.run();
    boolean interrupted = Thread.interrupted();

    assertTrue(interrupted);
    assertTrue(report.isCancelled());
    assertEquals(1, report.getSuccessfulDownloads());
  }

  @Test void testUnwritableOutputMarksCategoryFailed() throws IOException {
    Files.createDirectories(tempDir);
    Files.write(tempDir.resolve("assets"), new byte[0]);

    RunReport report = orchestrator(config(Duration.ZERO), CancellationToken.create())
        .run(ImmutableList.of(AssetCategory.AIRPORT));

    assertEquals(ImmutableList.of(AssetCategory.AIRPORT), report.getFailedCategories());
    assertEquals(0, report.getSuccessfulDownloads());
  }

  @Test void testMissingFallbackFailsBeforeAnyRequest() {
    StrategyPlan plan = StrategyPlan.builder().live(airports)
        .fallback(new FakeSource("harbours", AssetCategory.HARBOUR)).build();
    DownloadOrchestrator orchestrator = new DownloadOrchestrator(config(Duration.ZERO), plan,
        null, new AssetWriter(tempDir.resolve("assets"), clock), sleeper, clock,
        CancellationToken.create());

    assertThrows(AssetConfigException.class,
        () -> orchestrator.run(ImmutableList.of(AssetCategory.AIRPORT)));
    assertEquals(0, airports.getCallCount());
  }

  @Test void testMilitaryEndToEndThenServedFromCache() throws IOException {
    OrchestratorConfig config = config(Duration.ZERO).toBuilder()
        .categories(ImmutableList.of(AssetCategory.MILITARY))
        .build();
    ScriptedTransport overpassTransport =
        new ScriptedTransport().respond(OverpassFixtures.militaryPayload(12, 3));
    ProviderTransports transports = new ProviderTransports(overpassTransport,
        new ScriptedTransport(), new ScriptedTransport());

    RunReport first = DownloadOrchestrator.create(config, transports, sleeper, new Random(7),
        clock, CancellationToken.create()).run();

    assertEquals(1, first.getSuccessfulDownloads());
    assertEquals(9, first.getTotalFeatures());
    assertEquals(1, overpassTransport.getCallCount());
    Path layer = tempDir.resolve("assets").resolve("military.geojson");
    FeatureSet written = FeatureCollectionCodec.read(layer, AssetCategory.MILITARY);
    assertEquals(9, written.size());
    for (Feature feature : written.getFeatures()) {
      assertEquals("military", feature.getAssetType());
    }

    clock.advance(Duration.ofDays(2));
    ScriptedTransport idle = new ScriptedTransport();
    RunReport second = DownloadOrchestrator.create(config,
        new ProviderTransports(idle, idle, idle), sleeper, new Random(7), clock,
        CancellationToken.create()).run();

    assertEquals(9, second.getTotalFeatures());
    assertEquals(0, idle.getCallCount());
    assertEquals(Strategy.CACHE, second.getAttempts().get(0).getStrategy());
    assertTrue(second.getAttempts().get(0).isSuccess());
    assertEquals(written, FeatureCollectionCodec.read(layer, AssetCategory.MILITARY));
  }
}
