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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates raw Overpass elements into features.
 *
 * <p>Coordinates come from the element itself or, for ways and relations, from
 * its {@code center}. Elements without coordinates are skipped. Every feature
 * carries {@code asset_type} equal to the category key.
 */
public final class OverpassElementMapper {

  private OverpassElementMapper() {
  }

  /** Maps every element of an Overpass JSON payload. */
  public static List<Feature> map(AssetCategory category, JsonNode payload) {
    List<Feature> features = new ArrayList<>();
    for (JsonNode element : payload.path("elements")) {
      Feature feature = mapElement(category, element);
      if (feature != null) {
        features.add(feature);
      }
    }
    return features;
  }

  /** Maps one element, or returns null when it has no usable coordinates. */
  static @Nullable Feature mapElement(AssetCategory category, JsonNode element) {
    JsonNode lat = coordinate(element, "lat");
    JsonNode lon = coordinate(element, "lon");
    if (lat == null || lon == null) {
      return null;
    }

    Map<String, String> tags = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = element.path("tags").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      tags.put(field.getKey(), field.getValue().asText());
    }

    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put(Feature.ASSET_TYPE, category.key());
    String name;
    ImmutableSet<String> consumed;
    switch (category) {
    case MILITARY:
      name = firstOf(tags, "Military facility", "name", "military", "ref");
      attributes.put("facility_type", tags.getOrDefault("military", "base"));
      consumed = ImmutableSet.of("name", "military");
      break;
    case ENERGY:
      name = firstOf(tags, "Energy facility", "name", "operator");
      attributes.put("source_type",
          firstOf(tags, "unknown", "plant:source", "generator:source"));
      consumed = ImmutableSet.of("name", "plant:source", "generator:source");
      break;
    case HARBOUR:
      name = firstOf(tags, "Unnamed harbour", "name", "harbour", "ref");
      consumed = ImmutableSet.of("name", "harbour");
      break;
    case RAIL:
      name = firstOf(tags, "Rail station", "name");
      consumed = ImmutableSet.of("name");
      break;
    case BORDER:
      name = firstOf(tags, "Border crossing", "name");
      consumed = ImmutableSet.of("name");
      break;
    case CRITICAL:
      name = firstOf(tags, "Critical facility", "name");
      classifyCritical(tags, attributes);
      consumed = ImmutableSet.of("name");
      break;
    default:
      name = firstOf(tags, "Unnamed " + category.key(), "name");
      consumed = ImmutableSet.of("name");
      break;
    }
    tags.keySet().removeAll(consumed);

    String providerId = element.hasNonNull("id")
        ? element.path("type").asText("element") + "/" + element.get("id").asText()
        : null;
    return new Feature(lon.asDouble(), lat.asDouble(), name, attributes, tags, providerId);
  }

  private static void classifyCritical(Map<String, String> tags,
      Map<String, String> attributes) {
    if (tags.containsKey("aeroway")) {
      attributes.put("facility_type", "airport");
      attributes.put("sector", "aviation");
    } else if (tags.getOrDefault("amenity", "").contains("ferry_terminal")) {
      attributes.put("facility_type", "ferry_terminal");
      attributes.put("sector", "maritime");
    } else if (tags.containsKey("harbour")) {
      attributes.put("facility_type", "harbour");
      attributes.put("sector", "maritime");
    } else {
      attributes.put("facility_type", "unknown");
      attributes.put("sector", "critical");
    }
  }

  private static @Nullable JsonNode coordinate(JsonNode element, String field) {
    JsonNode value = element.get(field);
    if (value == null || value.isNull()) {
      value = element.path("center").get(field);
    }
    return value != null && value.isNumber() ? value : null;
  }

  private static String firstOf(Map<String, String> tags, String fallback, String... keys) {
    for (String key : keys) {
      String value = tags.get(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return fallback;
  }
}
