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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * A single geographic point record.
 *
 * <p>Attributes are the category-specific values derived by the provider
 * translation (always including {@code asset_type}); tags are the remaining raw
 * provider tags. Both keep their insertion order. Attribute keys must not
 * collide with the reserved GeoJSON property names {@code name},
 * {@code provider_id} and {@code tags}.
 */
public final class Feature {
  public static final String ASSET_TYPE = "asset_type";

  private final double longitude;
  private final double latitude;
  private final String name;
  private final ImmutableMap<String, String> attributes;
  private final ImmutableMap<String, String> tags;
  private final @Nullable String providerId;

  public Feature(double longitude, double latitude, String name,
      Map<String, String> attributes, Map<String, String> tags,
      @Nullable String providerId) {
    this.longitude = longitude;
    this.latitude = latitude;
    this.name = Objects.requireNonNull(name, "name");
    this.attributes = ImmutableMap.copyOf(attributes);
    this.tags = ImmutableMap.copyOf(tags);
    this.providerId = providerId;
  }

  public double getLongitude() {
    return longitude;
  }

  public double getLatitude() {
    return latitude;
  }

  public String getName() {
    return name;
  }

  public ImmutableMap<String, String> getAttributes() {
    return attributes;
  }

  public ImmutableMap<String, String> getTags() {
    return tags;
  }

  public @Nullable String getProviderId() {
    return providerId;
  }

  /** Returns the {@code asset_type} attribute, or null if the provider did not set one. */
  public @Nullable String getAssetType() {
    return attributes.get(ASSET_TYPE);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Feature feature = (Feature) o;
    return Double.compare(longitude, feature.longitude) == 0
        && Double.compare(latitude, feature.latitude) == 0
        && name.equals(feature.name)
        && attributes.equals(feature.attributes)
        && tags.equals(feature.tags)
        && Objects.equals(providerId, feature.providerId);
  }

  @Override public int hashCode() {
    return Objects.hash(longitude, latitude, name, attributes, tags, providerId);
  }

  @Override public String toString() {
    return "Feature{" + name + " @ " + latitude + "," + longitude
        + (providerId != null ? ", id=" + providerId : "") + "}";
  }
}
