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
import org.dronesightings.assets.fetch.QueryExecutor;
import org.dronesightings.assets.fetch.QueryResult;
import org.dronesightings.assets.model.Feature;
import org.dronesightings.assets.model.FeatureSet;
import org.dronesightings.assets.strategy.StrategyException;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Queries the Wikidata SPARQL endpoint for European airports, served as the
 * {@code infrastructure} category.
 */
public class WikidataSource implements AssetSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(WikidataSource.class);

  public static final String ENDPOINT = "https://query.wikidata.org/sparql";

  static final String AIRPORTS_QUERY = "SELECT ?airport ?airportLabel ?iata ?icao ?coord ?country"
      + " WHERE {\n"
      + "  ?airport wdt:P31/wdt:P279* wd:Q1248784 .\n"
      + "  ?airport wdt:P17 ?country .\n"
      + "  ?country wdt:P30 wd:Q46 .\n"
      + "  OPTIONAL { ?airport wdt:P238 ?iata . }\n"
      + "  OPTIONAL { ?airport wdt:P239 ?icao . }\n"
      + "  OPTIONAL { ?airport wdt:P625 ?coord . }\n"
      + "  SERVICE wikibase:label { bd:serviceParam wikibase:language \"en\" . }\n"
      + "}";

  private final String name;
  private final QueryExecutor<JsonNode> executor;
  private final int maxRetries;

  public WikidataSource(String name, QueryExecutor<JsonNode> executor, int maxRetries) {
    this.name = name;
    this.executor = executor;
    this.maxRetries = maxRetries;
  }

  @Override public String getName() {
    return name;
  }

  @Override public Set<AssetCategory> getCategories() {
    return ImmutableSet.of(AssetCategory.INFRASTRUCTURE);
  }

  @Override public String queryText(AssetCategory category) {
    return AIRPORTS_QUERY;
  }

  @Override public FeatureSet fetch(AssetCategory category) throws StrategyException {
    if (!supports(category)) {
      throw new StrategyException(name + " does not serve category " + category);
    }
    QueryResult<JsonNode> result = executor.execute(AIRPORTS_QUERY, maxRetries);
    if (!result.isSuccess()) {
      throw new StrategyException(name + " SPARQL query failed after " + result.getAttempts()
          + " attempts: " + result.getMessage());
    }
    List<Feature> features = toFeatures(category, result.getPayload());
    LOGGER.info("Retrieved {} airports from {}", features.size(), name);
    return new FeatureSet(category, features);
  }

  /** Maps SPARQL JSON bindings; bindings without parseable coordinates are skipped. */
  static List<Feature> toFeatures(AssetCategory category, JsonNode payload) {
    List<Feature> features = new ArrayList<>();
    for (JsonNode binding : payload.path("results").path("bindings")) {
      double[] lonLat = parsePoint(value(binding, "coord"));
      if (lonLat == null) {
        continue;
      }
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put(Feature.ASSET_TYPE, category.key());
      attributes.put("facility_type", "airport");
      putIfPresent(attributes, "iata", value(binding, "iata"));
      putIfPresent(attributes, "icao", value(binding, "icao"));
      putIfPresent(attributes, "country", value(binding, "country"));
      attributes.put("source", "wikidata");

      String label = value(binding, "airportLabel");
      features.add(new Feature(lonLat[0], lonLat[1], label != null ? label : "Unknown",
          attributes, ImmutableMap.of(), value(binding, "airport")));
    }
    return features;
  }

  /** Parses a WKT literal {@code Point(lon lat)}. */
  static double @Nullable [] parsePoint(@Nullable String wkt) {
    if (wkt == null) {
      return null;
    }
    String body = wkt.replace("Point(", "").replace(")", "").trim();
    String[] parts = body.split("\\s+");
    if (parts.length != 2) {
      return null;
    }
    try {
      return new double[] {Double.parseDouble(parts[0]), Double.parseDouble(parts[1])};
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static @Nullable String value(JsonNode binding, String field) {
    JsonNode value = binding.path(field).get("value");
    return value == null || value.isNull() ? null : value.asText();
  }

  private static void putIfPresent(Map<String, String> map, String key,
      @Nullable String value) {
    if (value != null && !value.isEmpty()) {
      map.put(key, value);
    }
  }
}
