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
import org.dronesightings.assets.OrchestratorConfig;
import org.dronesightings.assets.cache.AssetCache;
import org.dronesightings.assets.cache.CacheStats;
import org.dronesightings.assets.fetch.BackoffPolicy;
import org.dronesightings.assets.fetch.CancellationToken;
import org.dronesightings.assets.fetch.EndpointSelector;
import org.dronesightings.assets.fetch.PayloadParser;
import org.dronesightings.assets.fetch.QueryExecutor;
import org.dronesightings.assets.fetch.QueryTransport;
import org.dronesightings.assets.fetch.RateLimiter;
import org.dronesightings.assets.fetch.RegionChunker;
import org.dronesightings.assets.fetch.Sleeper;
import org.dronesightings.assets.source.AirportCsvSource;
import org.dronesightings.assets.source.OverpassSource;
import org.dronesightings.assets.source.StaticFallbackSource;
import org.dronesightings.assets.source.WikidataSource;
import org.dronesightings.assets.strategy.FetchOutcome;
import org.dronesightings.assets.strategy.FetchStrategyChain;
import org.dronesightings.assets.strategy.StrategyPlan;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Downloads a list of asset categories one after another.
 *
 * <p>Each category runs through a {@link FetchStrategyChain}; a satisfied
 * category is written through {@link AssetWriter}. A fixed delay separates
 * consecutive categories. A failed category is recorded and the run goes on;
 * only configuration errors abort, and they do so before any network request.
 */
public class DownloadOrchestrator {
  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadOrchestrator.class);

  private final OrchestratorConfig config;
  private final StrategyPlan plan;
  private final @Nullable AssetCache cache;
  private final AssetWriter writer;
  private final Sleeper sleeper;
  private final Clock clock;
  private final CancellationToken cancellation;

  public DownloadOrchestrator(OrchestratorConfig config, StrategyPlan plan,
      @Nullable AssetCache cache, AssetWriter writer, Sleeper sleeper, Clock clock,
      CancellationToken cancellation) {
    this.config = config;
    this.plan = plan;
    this.cache = cache;
    this.writer = writer;
    this.sleeper = sleeper;
    this.clock = clock;
    this.cancellation = cancellation;
  }

  /**
   * Wires providers, cache and writer from a configuration.
   *
   * @param config Run configuration
   * @param transports Transport per provider
   * @param sleeper Sleeper for every wait of the run
   * @param random Randomness for endpoint choice, jitter and region delays
   * @param clock Time source
   * @param cancellation Token checked between attempts, regions and categories
   */
  public static DownloadOrchestrator create(OrchestratorConfig config,
      ProviderTransports transports, Sleeper sleeper, Random random, Clock clock,
      CancellationToken cancellation) {
    Wiring wiring = new Wiring(config, sleeper, random, clock, cancellation);
    int retries = config.getMaxRetries();

    QueryExecutor<JsonNode> overpass = wiring.executor("overpass",
        config.getOverpassEndpoints(), transports.overpass(), PayloadParser.json());
    RegionChunker<JsonNode> chunker = new RegionChunker<>(overpass, retries,
        config.getMinRegionDelay(), config.getMaxRegionDelay(), random, sleeper, cancellation);

    StrategyPlan.Builder plan = StrategyPlan.builder()
        .cacheEnabled(config.isEnableCache())
        .live(new OverpassSource("overpass", overpass, chunker, config.getRegions(),
            config.getSingleQueryBox(), retries))
        .live(new AirportCsvSource("ourairports", wiring.executor("ourairports",
            ImmutableList.of(config.getAirportCsvUrl()), transports.airportCsv(),
            AirportCsvSource.csvParser()), retries));
    if (config.isEnableAlternateSources()) {
      plan.alternate(new AirportCsvSource("ourairports-mirror", wiring.executor(
              "ourairports-mirror", ImmutableList.of(config.getAirportMirrorUrl()),
              transports.airportCsv(), AirportCsvSource.csvParser()), retries))
          .alternate(new WikidataSource("wikidata", wiring.executor("wikidata",
              ImmutableList.of(config.getWikidataEndpoint()), transports.wikidata(),
              PayloadParser.json()), retries));
    }
    plan.fallback(new StaticFallbackSource());

    AssetCache cache = config.isEnableCache()
        ? new AssetCache(config.getCacheRoot(), config.getTtlDays(), clock)
        : null;
    return new DownloadOrchestrator(config, plan.build(), cache,
        new AssetWriter(config.getAssetRoot(), clock), sleeper, clock, cancellation);
  }

  /** Runs the categories listed in the configuration. */
  public RunReport run() {
    return run(config.getCategories());
  }

  /**
   * Downloads the given categories in order.
   *
   * @param categories Categories in download order
   * @return Report of the run, also written to the report directory
   * @throws org.dronesightings.assets.AssetConfigException if a category has
   *     no static fallback; raised before any request is made
   */
  public RunReport run(List<AssetCategory> categories) {
    FetchStrategyChain chain = new FetchStrategyChain(plan, cache, categories, clock);
    RunReport.Builder report = RunReport.builder(clock.instant(), categories);

    if (cache != null) {
      try {
        int evicted = cache.evictExpired();
        CacheStats stats = cache.stats();
        LOGGER.info("Cache: {} entries, {} MB ({} expired entries evicted)",
            stats.getTotalEntries(), String.format("%.2f", stats.getTotalMegabytes()), evicted);
      } catch (AssetFetchException e) {
        LOGGER.warn("Cache maintenance failed, continuing without eviction: {}",
            e.getMessage());
      }
    }

    for (int i = 0; i < categories.size(); i++) {
      AssetCategory category = categories.get(i);
      if (cancellation.isCancelled()) {
        LOGGER.warn("Run cancelled before {}", category);
        report.cancelled();
        break;
      }
      LOGGER.info("Progress: {}/{} - {}", i + 1, categories.size(), category);

      FetchOutcome outcome = chain.fetch(category);
      report.addAttempts(outcome.getAttempts());
      if (outcome.isSatisfied() && save(outcome)) {
        report.succeeded(outcome.getFeatureSet().size());
      } else {
        report.failed(category);
      }

      if (i < categories.size() - 1 && !interCategoryPause()) {
        report.cancelled();
        break;
      }
    }

    RunReport result = report.build(clock.instant());
    logSummary(result);
    try {
      Path path = result.writeTo(config.getReportRoot());
      LOGGER.info("Download report saved: {}", path);
    } catch (AssetFetchException e) {
      LOGGER.error("Could not save download report", e);
    }
    return result;
  }

  private boolean save(FetchOutcome outcome) {
    try {
      writer.write(outcome.getFeatureSet(), String.valueOf(outcome.getSourceName()));
      return true;
    } catch (AssetFetchException e) {
      LOGGER.error("Could not save {} output", outcome.getCategory(), e);
      return false;
    }
  }

  /** Sleeps the inter-category delay; false if interrupted. */
  private boolean interCategoryPause() {
    Duration delay = config.getInterCategoryDelay();
    if (delay.isZero()) {
      return true;
    }
    LOGGER.info("Rate limiting: waiting {}s before next asset...", delay.getSeconds());
    try {
      sleeper.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted during inter-category delay");
      return false;
    }
  }

  private static void logSummary(RunReport report) {
    int total = report.getTotalDownloads();
    LOGGER.info("DOWNLOAD SUMMARY");
    LOGGER.info("Successful: {}/{} ({}%)", report.getSuccessfulDownloads(), total,
        String.format("%.1f", report.getSuccessRate() * 100));
    LOGGER.info("Total time: {} seconds", String.format("%.1f", report.getTotalTimeSeconds()));
    if (total > 0) {
      LOGGER.info("Average per asset: {} seconds",
          String.format("%.1f", report.getTotalTimeSeconds() / total));
    }
    if (!report.getFailedCategories().isEmpty()) {
      LOGGER.warn("Failed categories: {}", report.getFailedCategories());
    }
  }

  /** Shared collaborators for building one executor per provider. */
  private static final class Wiring {
    private final OrchestratorConfig config;
    private final Sleeper sleeper;
    private final Random random;
    private final Clock clock;
    private final CancellationToken cancellation;
    private final BackoffPolicy backoff;

    Wiring(OrchestratorConfig config, Sleeper sleeper, Random random, Clock clock,
        CancellationToken cancellation) {
      this.config = config;
      this.sleeper = sleeper;
      this.random = random;
      this.clock = clock;
      this.cancellation = cancellation;
      this.backoff = new BackoffPolicy(BackoffPolicy.DEFAULT_INITIAL_DELAY,
          BackoffPolicy.DEFAULT_MAX_JITTER, random);
    }

    <T> QueryExecutor<T> executor(String provider, List<String> endpoints,
        QueryTransport transport, PayloadParser<T> parser) {
      return new QueryExecutor<>(provider, new EndpointSelector(endpoints, random),
          new RateLimiter(config.getBaseDelay(), clock, sleeper), transport, parser,
          backoff, sleeper, config.getRequestTimeout(), cancellation);
    }
  }
}
