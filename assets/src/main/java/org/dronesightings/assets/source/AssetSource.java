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
import org.dronesightings.assets.model.FeatureSet;
import org.dronesightings.assets.strategy.StrategyException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Set;

/**
 * A provider of feature sets for one or more asset categories.
 */
public interface AssetSource {

  /** Provider name used in logs and output metadata. */
  String getName();

  /** Categories this source can fetch. */
  Set<AssetCategory> getCategories();

  default boolean supports(AssetCategory category) {
    return getCategories().contains(category);
  }

  /**
   * Exact query text sent for a category. Its fingerprint keys the cache
   * entries this source produces; null means results are not cached.
   */
  @Nullable String queryText(AssetCategory category);

  /** Whether an empty feature set from this source satisfies a request. */
  default boolean acceptsEmptyResult() {
    return false;
  }

  /**
   * Fetches the complete feature set of a category.
   *
   * @throws StrategyException if the source could not produce the set
   */
  FeatureSet fetch(AssetCategory category) throws StrategyException;
}
