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
import org.dronesightings.assets.model.FeatureSet;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Terminal result of running a {@link FetchStrategyChain} for one category. */
public final class FetchOutcome {
  private final AssetCategory category;
  private final ChainState state;
  private final ImmutableList<StrategyAttempt> attempts;
  private final @Nullable Strategy satisfiedBy;
  private final @Nullable String sourceName;
  private final @Nullable FeatureSet featureSet;

  FetchOutcome(AssetCategory category, ChainState state, List<StrategyAttempt> attempts,
      @Nullable Strategy satisfiedBy, @Nullable String sourceName,
      @Nullable FeatureSet featureSet) {
    this.category = category;
    this.state = state;
    this.attempts = ImmutableList.copyOf(attempts);
    this.satisfiedBy = satisfiedBy;
    this.sourceName = sourceName;
    this.featureSet = featureSet;
  }

  public AssetCategory getCategory() {
    return category;
  }

  public ChainState getState() {
    return state;
  }

  public boolean isSatisfied() {
    return state == ChainState.SATISFIED;
  }

  public ImmutableList<StrategyAttempt> getAttempts() {
    return attempts;
  }

  public @Nullable Strategy getSatisfiedBy() {
    return satisfiedBy;
  }

  /** Name of the source that produced the features, or "cache". */
  public @Nullable String getSourceName() {
    return sourceName;
  }

  /**
   * Features of a satisfied chain.
   *
   * @throws IllegalStateException if the chain was exhausted
   */
  public FeatureSet getFeatureSet() {
    if (featureSet == null) {
      throw new IllegalStateException("No features for exhausted category " + category);
    }
    return featureSet;
  }

  @Override public String toString() {
    return "FetchOutcome{" + category + ", " + state
        + (satisfiedBy != null ? ", via " + satisfiedBy.reportName() : "")
        + ", attempts=" + attempts.size() + "}";
  }
}
