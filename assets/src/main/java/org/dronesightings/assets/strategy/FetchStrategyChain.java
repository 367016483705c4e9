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
package org.dronesightings.assets.strategy;

import org.dronesightings.assets.AssetCategory;
import org.dronesightings.assets.AssetFetchException;
import org.dronesightings.assets.cache.AssetCache;
import org.dronesightings.assets.cache.QueryFingerprint;
import org.dronesightings.assets.model.FeatureSet;
import org.dronesightings.assets.source.AssetSource;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-category state machine over cache, live fetch, alternate source and
 * static fallback.
 *
 * <p>Each planned strategy is tried in order until one produces a feature set.
 * Every attempt, failed or not, is recorded; strategies not planned for the
 * category are skipped without a record. Results of network strategies are
 * written to the cache under the producing source's query fingerprint.
 */
public class FetchStrategyChain {
  private static final Logger LOGGER = LoggerFactory.getLogger(FetchStrategyChain.class);

  static final String CACHE_SOURCE_NAME = "cache";

  private final StrategyPlan plan;
  private final @Nullable AssetCache cache;
  private final Clock clock;

  /**
   * Creates a chain and checks the plan against the categories it will serve.
   *
   * @param plan Resolved strategies and sources
   * @param cache Asset cache, or null to disable cache reads and writes
   * @param categories Categories that will be requested
   * @param clock Time source for attempt durations and timestamps
   * @throws org.dronesightings.assets.AssetConfigException if a category has
   *     no static fallback
   */
  public FetchStrategyChain(StrategyPlan plan, @Nullable AssetCache cache,
      Collection<AssetCategory> categories, Clock clock) {
    plan.validate(categories);
    this.plan = plan;
    this.cache = cache;
    this.clock = clock;
  }

  /** Runs the chain for one category until it is satisfied or exhausted. */
  public FetchOutcome fetch(AssetCategory category) {
    List<StrategyAttempt> attempts = new ArrayList<>();
    LOGGER.info("Starting download: {} (strategies: {})", category,
        plan.strategiesFor(category));

    ChainState state = ChainState.TRY_CACHE;
    Throwable lastFailure = null;
    while (!state.isTerminal()) {
      Strategy strategy = state.strategy();
      if (!isAvailable(category, strategy)) {
        state = state.onFailure();
        continue;
      }

      long start = clock.millis();
      try {
        Attempted result = attempt(category, strategy);
        long duration = clock.millis() - start;
        attempts.add(StrategyAttempt.success(category, strategy, duration,
            clock.instant(), result.featureSet.size()));
        LOGGER.info("{} downloaded successfully using {} in {}ms ({} records)",
            category, strategy.reportName(), duration, result.featureSet.size());
        return new FetchOutcome(category, ChainState.SATISFIED, attempts, strategy,
            result.sourceName, result.featureSet);
      } catch (StrategyException | RuntimeException e) {
        long duration = clock.millis() - start;
        attempts.add(StrategyAttempt.failure(category, strategy, duration,
            clock.instant(), String.valueOf(e.getMessage())));
        LOGGER.warn("Strategy {} failed for {}: {}", strategy.reportName(), category,
            e.getMessage());
        lastFailure = e;
        state = state.onFailure();
      }
    }

    LOGGER.error("All download strategies failed for {}", category, lastFailure);
    return new FetchOutcome(category, ChainState.EXHAUSTED_FAILED, attempts, null, null, null);
  }

  private boolean isAvailable(AssetCategory category, Strategy strategy) {
    if (strategy == Strategy.CACHE && cache == null) {
      return false;
    }
    return plan.isPlanned(category, strategy);
  }

  private Attempted attempt(AssetCategory category, Strategy strategy)
      throws StrategyException {
    if (strategy == Strategy.CACHE) {
      return fromCache(category);
    }
    AssetSource source = plan.source(category, strategy);
    if (source == null) {
      throw new StrategyException("No source for " + strategy.reportName());
    }
    FeatureSet featureSet = source.fetch(category);
    if (featureSet.isEmpty() && !source.acceptsEmptyResult()) {
      throw new StrategyException(source.getName() + " returned no features");
    }
    if (strategy != Strategy.STATIC_FALLBACK) {
      store(category, source, featureSet);
    }
    return new Attempted(featureSet, source.getName());
  }

  private Attempted fromCache(AssetCategory category) throws StrategyException {
    for (AssetSource source : plan.networkSources(category)) {
      String query = source.queryText(category);
      if (query == null) {
        continue;
      }
      Optional<FeatureSet> cached = cache.get(category, QueryFingerprint.of(query));
      if (cached.isPresent()) {
        return new Attempted(cached.get(), CACHE_SOURCE_NAME);
      }
    }
    throw new StrategyException("No valid cache entry for " + category);
  }

  private void store(AssetCategory category, AssetSource source, FeatureSet featureSet) {
    if (cache == null || !plan.isCacheEnabled()) {
      return;
    }
    if (featureSet.isPartial()) {
      LOGGER.info("Not caching partial {} results from {}", category, source.getName());
      return;
    }
    String query = source.queryText(category);
    if (query == null) {
      return;
    }
    try {
      cache.put(category, QueryFingerprint.of(query), featureSet);
    } catch (AssetFetchException e) {
      LOGGER.warn("Could not cache {} results from {}: {}", category, source.getName(),
          e.getMessage());
    }
  }

  /** Features and the name of whatever produced them. */
  private static final class Attempted {
    final FeatureSet featureSet;
    final String sourceName;

    Attempted(FeatureSet featureSet, String sourceName) {
      this.featureSet = featureSet;
      this.sourceName = sourceName;
    }
  }
}
