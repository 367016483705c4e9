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

import org.dronesightings.assets.model.Feature;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Merged output of a {@link RegionChunker} run: features in region order plus
 * per-region feature counts. A failed region maps to -1.
 */
public final class ChunkedResult {
  private final ImmutableList<Feature> features;
  private final ImmutableMap<String, Integer> regionCounts;
  private final boolean cancelled;

  ChunkedResult(List<Feature> features, Map<String, Integer> regionCounts, boolean cancelled) {
    this.features = ImmutableList.copyOf(features);
    this.regionCounts = ImmutableMap.copyOf(regionCounts);
    this.cancelled = cancelled;
  }

  public ImmutableList<Feature> getFeatures() {
    return features;
  }

  public ImmutableMap<String, Integer> getRegionCounts() {
    return regionCounts;
  }

  public int getRegionsAttempted() {
    return regionCounts.size();
  }

  public int getRegionsFailed() {
    return (int) regionCounts.values().stream().filter(count -> count < 0).count();
  }

  /** True when no region produced a payload, including when none was attempted. */
  public boolean allRegionsFailed() {
    return getRegionsFailed() == getRegionsAttempted();
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
