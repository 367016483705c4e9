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
package org.dronesightings.assets.model;

import org.dronesightings.assets.AssetCategory;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable collection of features for one category.
 *
 * <p>This is the unit exchanged between every fetch strategy and the
 * orchestrator. A set is partial when part of its query failed, for example
 * some regions of a chunked download; a partial set is usable output but is
 * never cached. Partiality is not part of equality.
 */
public final class FeatureSet {
  private final AssetCategory category;
  private final ImmutableList<Feature> features;
  private final boolean partial;

  public FeatureSet(AssetCategory category, List<Feature> features) {
    this(category, features, false);
  }

  private FeatureSet(AssetCategory category, List<Feature> features, boolean partial) {
    this.category = Objects.requireNonNull(category, "category");
    this.features = ImmutableList.copyOf(features);
    this.partial = partial;
  }

  public static FeatureSet empty(AssetCategory category) {
    return new FeatureSet(category, ImmutableList.of());
  }

  /** Set built from an incomplete download. */
  public static FeatureSet partial(AssetCategory category, List<Feature> features) {
    return new FeatureSet(category, features, true);
  }

  public AssetCategory getCategory() {
    return category;
  }

  public ImmutableList<Feature> getFeatures() {
    return features;
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  public boolean isPartial() {
    return partial;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FeatureSet that = (FeatureSet) o;
    return category == that.category && features.equals(that.features);
  }

  @Override public int hashCode() {
    return Objects.hash(category, features);
  }

  @Override public String toString() {
    return "FeatureSet{" + category + ", " + features.size() + " features"
        + (partial ? ", partial}" : "}");
  }
}
