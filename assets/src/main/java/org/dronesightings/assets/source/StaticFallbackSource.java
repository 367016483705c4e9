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
import org.dronesightings.assets.model.Feature;
import org.dronesightings.assets.model.FeatureCollectionCodec;
import org.dronesightings.assets.model.FeatureSet;
import org.dronesightings.assets.strategy.StrategyException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Minimal bundled dataset used when every network strategy has failed.
 *
 * <p>The dataset is read once from the classpath and filtered by
 * {@code asset_type}; a category with no bundled features yields an empty,
 * still successful, feature set.
 */
public class StaticFallbackSource implements AssetSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(StaticFallbackSource.class);

  public static final String DEFAULT_RESOURCE = "/fallback-assets.geojson";

  private final String resource;
  private @Nullable ImmutableList<Feature> features;

  public StaticFallbackSource() {
    this(DEFAULT_RESOURCE);
  }

  public StaticFallbackSource(String resource) {
    this.resource = resource;
  }

  @Override public String getName() {
    return "fallback";
  }

  @Override public Set<AssetCategory> getCategories() {
    return Sets.immutableEnumSet(EnumSet.allOf(AssetCategory.class));
  }

  @Override public @Nullable String queryText(AssetCategory category) {
    return null;
  }

  @Override public boolean acceptsEmptyResult() {
    return true;
  }

  @Override public FeatureSet fetch(AssetCategory category) throws StrategyException {
    List<Feature> matching = new ArrayList<>();
    for (Feature feature : bundled()) {
      if (category.key().equals(feature.getAssetType())) {
        matching.add(feature);
      }
    }
    LOGGER.warn("Using fallback data for {} ({} records)", category, matching.size());
    return new FeatureSet(category, matching);
  }

  private synchronized ImmutableList<Feature> bundled() throws StrategyException {
    if (features == null) {
      try (InputStream in = StaticFallbackSource.class.getResourceAsStream(resource)) {
        if (in == null) {
          throw new StrategyException("Fallback resource not found: " + resource);
        }
        // Category is irrelevant here; features are filtered by asset_type.
        features = FeatureCollectionCodec.read(in, AssetCategory.AIRPORT).getFeatures();
      } catch (IOException e) {
        throw new StrategyException("Cannot read fallback resource " + resource, e);
      }
    }
    return features;
  }
}
