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
import org.dronesightings.assets.AssetConfigException;
import org.dronesightings.assets.source.AssetSource;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered strategies available per category, resolved once from the
 * registered sources.
 *
 * <p>The cache strategy is planned for a category only when caching is enabled
 * and at least one of its network sources produces a fingerprintable query.
 */
public final class StrategyPlan {
  private final Map<Strategy, List<AssetSource>> sources;
  private final boolean cacheEnabled;

  private StrategyPlan(Builder builder) {
    this.sources = new EnumMap<>(Strategy.class);
    builder.sources.forEach((strategy, list) ->
        sources.put(strategy, ImmutableList.copyOf(list)));
    this.cacheEnabled = builder.cacheEnabled;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Source implementing a strategy for a category; the first registered wins. */
  public @Nullable AssetSource source(AssetCategory category, Strategy strategy) {
    for (AssetSource source : sources.getOrDefault(strategy, ImmutableList.of())) {
      if (source.supports(category)) {
        return source;
      }
    }
    return null;
  }

  /** Network sources of a category in lookup order: live, then alternate. */
  public ImmutableList<AssetSource> networkSources(AssetCategory category) {
    ImmutableList.Builder<AssetSource> result = ImmutableList.builder();
    for (Strategy strategy : new Strategy[] {Strategy.LIVE_FETCH, Strategy.ALTERNATE_SOURCE}) {
      AssetSource source = source(category, strategy);
      if (source != null) {
        result.add(source);
      }
    }
    return result.build();
  }

  /** Strategies the chain tries for a category, in order. */
  public ImmutableList<Strategy> strategiesFor(AssetCategory category) {
    List<Strategy> result = new ArrayList<>();
    for (Strategy strategy : Strategy.values()) {
      if (isPlanned(category, strategy)) {
        result.add(strategy);
      }
    }
    return ImmutableList.copyOf(result);
  }

  public boolean isPlanned(AssetCategory category, Strategy strategy) {
    if (strategy == Strategy.CACHE) {
      if (!cacheEnabled) {
        return false;
      }
      for (AssetSource source : networkSources(category)) {
        if (source.queryText(category) != null) {
          return true;
        }
      }
      return false;
    }
    return source(category, strategy) != null;
  }

  public boolean isCacheEnabled() {
    return cacheEnabled;
  }

  /**
   * Checks that every requested category ends in a static fallback.
   *
   * @throws AssetConfigException naming the first category without one
   */
  public void validate(Collection<AssetCategory> categories) {
    for (AssetCategory category : categories) {
      if (!isPlanned(category, Strategy.STATIC_FALLBACK)) {
        throw new AssetConfigException("No static fallback registered for category '"
            + category + "'");
      }
    }
  }

  /** Builder for {@link StrategyPlan}. */
  public static final class Builder {
    private final Map<Strategy, List<AssetSource>> sources = new EnumMap<>(Strategy.class);
    private boolean cacheEnabled = true;

    private Builder() {
    }

    public Builder live(AssetSource source) {
      return add(Strategy.LIVE_FETCH, source);
    }

    public Builder alternate(AssetSource source) {
      return add(Strategy.ALTERNATE_SOURCE, source);
    }

    public Builder fallback(AssetSource source) {
      return add(Strategy.STATIC_FALLBACK, source);
    }

    public Builder cacheEnabled(boolean cacheEnabled) {
      this.cacheEnabled = cacheEnabled;
      return this;
    }

    private Builder add(Strategy strategy, AssetSource source) {
      sources.computeIfAbsent(strategy, s -> new ArrayList<>()).add(source);
      return this;
    }

    public StrategyPlan build() {
      return new StrategyPlan(this);
    }
  }
}
