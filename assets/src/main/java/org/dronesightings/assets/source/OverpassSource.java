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
package org.dronesightings.assets.source;

import org.dronesightings.assets.AssetCategory;
import org.dronesightings.assets.fetch.ChunkedResult;
import org.dronesightings.assets.fetch.QueryExecutor;
import org.dronesightings.assets.fetch.QueryResult;
import org.dronesightings.assets.fetch.RegionChunker;
import org.dronesightings.assets.model.BoundingBox;
import org.dronesightings.assets.model.FeatureSet;
import org.dronesightings.assets.strategy.StrategyException;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Fetches OpenStreetMap features through the Overpass API.
 *
 * <p>Broad categories are split across the configured regions so that no
 * single request runs into the server's timeout or quota; the critical
 * infrastructure query is sent once for the whole bounding box.
 */
public class OverpassSource implements AssetSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(OverpassSource.class);

  private final String name;
  private final QueryExecutor<JsonNode> executor;
  private final RegionChunker<JsonNode> chunker;
  private final ImmutableMap<String, BoundingBox> regions;
  private final BoundingBox singleBox;
  private final int maxRetries;

  public OverpassSource(String name, QueryExecutor<JsonNode> executor,
      RegionChunker<JsonNode> chunker, Map<String, BoundingBox> regions,
      BoundingBox singleBox, int maxRetries) {
    this.name = name;
    this.executor = executor;
    this.chunker = chunker;
    this.regions = ImmutableMap.copyOf(regions);
    this.singleBox = singleBox;
    this.maxRetries = maxRetries;
  }

  @Override public String getName() {
    return name;
  }

  @Override public Set<AssetCategory> getCategories() {
    return Sets.union(OverpassQueries.CHUNKED_CATEGORIES, OverpassQueries.SINGLE_CATEGORIES);
  }

  /** All region queries of a chunked category, one per line, in region order. */
  @Override public String queryText(AssetCategory category) {
    if (!OverpassQueries.isChunked(category)) {
      return OverpassQueries.query(category, singleBox);
    }
    StringJoiner joiner = new StringJoiner("\n");
    for (BoundingBox bbox : regions.values()) {
      joiner.add(OverpassQueries.query(category, bbox));
    }
    return joiner.toString();
  }

  @Override public FeatureSet fetch(AssetCategory category) throws StrategyException {
    if (!supports(category)) {
      throw new StrategyException(name + " does not serve category " + category);
    }
    if (OverpassQueries.isChunked(category)) {
      return fetchChunked(category);
    }

    LOGGER.info("Downloading {} with a single {} query", category, name);
    QueryResult<JsonNode> result =
        executor.execute(OverpassQueries.query(category, singleBox), maxRetries);
    if (!result.isSuccess()) {
      throw new StrategyException(name + " query for " + category + " failed after "
          + result.getAttempts() + " attempts: " + result.getMessage());
    }
    return new FeatureSet(category, OverpassElementMapper.map(category, result.getPayload()));
  }

  private FeatureSet fetchChunked(AssetCategory category) throws StrategyException {
    LOGGER.info("Downloading {} in {} regions", category, regions.size());
    ChunkedResult result = chunker.fetchByRegion(regions,
        bbox -> OverpassQueries.query(category, bbox),
        payload -> OverpassElementMapper.map(category, payload));
    if (result.isCancelled()) {
      throw new StrategyException("Chunked " + category + " download cancelled");
    }
    if (result.allRegionsFailed()) {
      throw new StrategyException("All " + result.getRegionsAttempted()
          + " regions failed for " + category);
    }
    if (result.getRegionsFailed() > 0) {
      LOGGER.warn("{} of {} regions failed for {}; keeping partial results uncached",
          result.getRegionsFailed(), result.getRegionsAttempted(), category);
      return FeatureSet.partial(category, result.getFeatures());
    }
    return new FeatureSet(category, result.getFeatures());
  }
}
