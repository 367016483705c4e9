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

import org.dronesightings.assets.model.BoundingBox;
import org.dronesightings.assets.model.Feature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

/**
 * Splits a geographically broad query into fixed sub-regions so each request
 * stays within provider timeout limits, then merges the per-region results.
 *
 * <p>A region whose query fails contributes no features and the next region is
 * processed. A jittered delay, uniform in {@code [minRegionDelay,
 * maxRegionDelay]}, separates consecutive regions whether or not the previous
 * one succeeded. Results are concatenated in region order with no cross-region
 * deduplication, so a facility near a region boundary may appear twice.
 *
 * @param <T> Parsed payload type of the underlying executor
 */
public class RegionChunker<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(RegionChunker.class);

  private final QueryExecutor<T> executor;
  private final int maxRetries;
  private final Duration minRegionDelay;
  private final Duration maxRegionDelay;
  private final Random random;
  private final Sleeper sleeper;
  private final CancellationToken cancellation;

  public RegionChunker(QueryExecutor<T> executor, int maxRetries,
      Duration minRegionDelay, Duration maxRegionDelay, Random random,
      Sleeper sleeper, CancellationToken cancellation) {
    if (maxRegionDelay.compareTo(minRegionDelay) < 0) {
      throw new IllegalArgumentException("maxRegionDelay " + maxRegionDelay
          + " is below minRegionDelay " + minRegionDelay);
    }
    this.executor = executor;
    this.maxRetries = maxRetries;
    this.minRegionDelay = minRegionDelay;
    this.maxRegionDelay = maxRegionDelay;
    this.random = random;
    this.sleeper = sleeper;
    this.cancellation = cancellation;
  }

  /**
   * Fetches every region in iteration order and merges the features.
   *
   * @param regions Region name to bounding box, iterated in map order
   * @param queryBuilder Builds the provider query for one bounding box
   * @param processFn Converts one region's payload into features
   * @return Merged features and per-region counts
   */
  public ChunkedResult fetchByRegion(Map<String, BoundingBox> regions,
      Function<BoundingBox, String> queryBuilder,
      Function<T, List<Feature>> processFn) {
    List<Feature> features = new ArrayList<>();
    Map<String, Integer> counts = new LinkedHashMap<>();

    Iterator<Map.Entry<String, BoundingBox>> it = regions.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, BoundingBox> region = it.next();
      if (cancellation.isCancelled()) {
        LOGGER.info("Chunked fetch cancelled before region {}", region.getKey());
        return new ChunkedResult(features, counts, true);
      }

      LOGGER.info("Processing {} region {}", executor.getProviderName(), region.getKey());
      QueryResult<T> result = executor.execute(queryBuilder.apply(region.getValue()), maxRetries);
      if (result.isSuccess()) {
        List<Feature> regionFeatures = processFn.apply(result.getPayload());
        features.addAll(regionFeatures);
        counts.put(region.getKey(), regionFeatures.size());
        LOGGER.info("Found {} features in {}", regionFeatures.size(), region.getKey());
      } else {
        counts.put(region.getKey(), -1);
        LOGGER.warn("Region {} contributed no features: {}", region.getKey(), result);
      }

      if (it.hasNext()) {
        try {
          sleeper.sleep(regionDelay());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return new ChunkedResult(features, counts, true);
        }
      }
    }
    return new ChunkedResult(features, counts, false);
  }

  /** Uniform delay in {@code [minRegionDelay, maxRegionDelay]}. */
  Duration regionDelay() {
    long min = minRegionDelay.toMillis();
    long span = maxRegionDelay.toMillis() - min;
    return Duration.ofMillis(min + (span > 0 ? (long) (random.nextDouble() * (span + 1)) : 0L));
  }
}
