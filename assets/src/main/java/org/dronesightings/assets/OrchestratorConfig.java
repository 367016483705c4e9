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
package org.dronesightings.assets;

import org.dronesightings.assets.cache.AssetCache;
import org.dronesightings.assets.model.BoundingBox;
import org.dronesightings.assets.source.AirportCsvSource;
import org.dronesightings.assets.source.OverpassQueries;
import org.dronesightings.assets.source.WikidataSource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for one download run, passed explicitly to every component.
 *
 * <p>Built with {@link #builder()} or loaded from a YAML or JSON file whose
 * keys mirror the builder methods; durations are given in seconds, regions as
 * {@code [south, west, north, east]} lists:
 *
 * <pre>
 * assetRoot: data/assets
 * baseDelaySeconds: 45
 * ttlDays:
 *   energy: 1
 * regions:
 *   nordic: [55, 4, 72, 32]
 * categories: [airport, critical, military, energy]
 * </pre>
 */
public final class OrchestratorConfig {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Categories downloaded when none are requested explicitly. */
  public static final ImmutableList<AssetCategory> DEFAULT_CATEGORIES = ImmutableList.of(
      AssetCategory.AIRPORT, AssetCategory.CRITICAL, AssetCategory.MILITARY,
      AssetCategory.ENERGY);

  private final Path assetRoot;
  private final Path cacheRoot;
  private final Path reportRoot;
  private final ImmutableMap<AssetCategory, Integer> ttlDays;
  private final ImmutableList<String> overpassEndpoints;
  private final String airportCsvUrl;
  private final String airportMirrorUrl;
  private final String wikidataEndpoint;
  private final Duration baseDelay;
  private final int maxRetries;
  private final Duration requestTimeout;
  private final Duration minRegionDelay;
  private final Duration maxRegionDelay;
  private final Duration interCategoryDelay;
  private final ImmutableMap<String, BoundingBox> regions;
  private final BoundingBox singleQueryBox;
  private final boolean enableCache;
  private final boolean enableAlternateSources;
  private final ImmutableList<AssetCategory> categories;

  private OrchestratorConfig(Builder builder) {
    this.assetRoot = builder.assetRoot;
    this.cacheRoot = builder.cacheRoot;
    this.reportRoot = builder.reportRoot;
    this.ttlDays = ImmutableMap.copyOf(builder.ttlDays);
    this.overpassEndpoints = ImmutableList.copyOf(builder.overpassEndpoints);
    this.airportCsvUrl = builder.airportCsvUrl;
    this.airportMirrorUrl = builder.airportMirrorUrl;
    this.wikidataEndpoint = builder.wikidataEndpoint;
    this.baseDelay = builder.baseDelay;
    this.maxRetries = builder.maxRetries;
    this.requestTimeout = builder.requestTimeout;
    this.minRegionDelay = builder.minRegionDelay;
    this.maxRegionDelay = builder.maxRegionDelay;
    this.interCategoryDelay = builder.interCategoryDelay;
    this.regions = ImmutableMap.copyOf(builder.regions);
    this.singleQueryBox = builder.singleQueryBox;
    this.enableCache = builder.enableCache;
    this.enableAlternateSources = builder.enableAlternateSources;
    this.categories = ImmutableList.copyOf(builder.categories);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder initialised with this configuration's values. */
  public Builder toBuilder() {
    Builder builder = builder()
        .assetRoot(assetRoot)
        .cacheRoot(cacheRoot)
        .reportRoot(reportRoot)
        .overpassEndpoints(overpassEndpoints)
        .airportCsvUrl(airportCsvUrl)
        .airportMirrorUrl(airportMirrorUrl)
        .wikidataEndpoint(wikidataEndpoint)
        .baseDelay(baseDelay)
        .maxRetries(maxRetries)
        .requestTimeout(requestTimeout)
        .minRegionDelay(minRegionDelay)
        .maxRegionDelay(maxRegionDelay)
        .interCategoryDelay(interCategoryDelay)
        .regions(regions)
        .singleQueryBox(singleQueryBox)
        .enableCache(enableCache)
        .enableAlternateSources(enableAlternateSources)
        .categories(categories);
    ttlDays.forEach(builder::ttlDays);
    return builder;
  }

  public static OrchestratorConfig defaults() {
    return builder().build();
  }

  /**
   * Loads a YAML or JSON configuration file.
   *
   * @throws AssetConfigException if the file cannot be read or holds invalid values
   */
  public static OrchestratorConfig load(Path file) {
    JsonNode root;
    try {
      root = YamlUtils.parseYamlOrJson(file);
    } catch (IOException e) {
      throw new AssetConfigException("Cannot read configuration file " + file, e);
    }
    if (root.isMissingNode()) {
      return defaults();
    }
    if (!root.isObject()) {
      throw new AssetConfigException("Configuration file " + file + " must hold a mapping");
    }
    return fromMap(MAPPER.convertValue(root, new TypeReference<Map<String, Object>>() { }));
  }

  /**
   * Builds a configuration from a parsed map; absent keys keep their defaults.
   *
   * @throws AssetConfigException on values of the wrong type or out of range
   */
  @SuppressWarnings("unchecked")
  public static OrchestratorConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Object assetRoot = map.get("assetRoot");
    if (assetRoot instanceof String) {
      builder.assetRoot(Paths.get((String) assetRoot));
    }
    Object cacheRoot = map.get("cacheRoot");
    if (cacheRoot instanceof String) {
      builder.cacheRoot(Paths.get((String) cacheRoot));
    }
    Object reportRoot = map.get("reportRoot");
    if (reportRoot instanceof String) {
      builder.reportRoot(Paths.get((String) reportRoot));
    }

    Object ttl = map.get("ttlDays");
    if (ttl instanceof Map) {
      for (Map.Entry<?, ?> e : ((Map<?, ?>) ttl).entrySet()) {
        builder.ttlDays(AssetCategory.fromKey(String.valueOf(e.getKey())),
            intValue("ttlDays." + e.getKey(), e.getValue()));
      }
    }

    Object endpoints = map.get("overpassEndpoints");
    if (endpoints instanceof List) {
      List<String> list = new ArrayList<>();
      for (Object endpoint : (List<Object>) endpoints) {
        list.add(String.valueOf(endpoint));
      }
      builder.overpassEndpoints(list);
    }
    Object airportCsvUrl = map.get("airportCsvUrl");
    if (airportCsvUrl instanceof String) {
      builder.airportCsvUrl((String) airportCsvUrl);
    }
    Object airportMirrorUrl = map.get("airportMirrorUrl");
    if (airportMirrorUrl instanceof String) {
      builder.airportMirrorUrl((String) airportMirrorUrl);
    }
    Object wikidataEndpoint = map.get("wikidataEndpoint");
    if (wikidataEndpoint instanceof String) {
      builder.wikidataEndpoint((String) wikidataEndpoint);
    }

    if (map.containsKey("baseDelaySeconds")) {
      builder.baseDelay(seconds("baseDelaySeconds", map.get("baseDelaySeconds")));
    }
    if (map.containsKey("maxRetries")) {
      builder.maxRetries(intValue("maxRetries", map.get("maxRetries")));
    }
    if (map.containsKey("requestTimeoutSeconds")) {
      builder.requestTimeout(seconds("requestTimeoutSeconds", map.get("requestTimeoutSeconds")));
    }
    if (map.containsKey("minRegionDelaySeconds")) {
      builder.minRegionDelay(seconds("minRegionDelaySeconds", map.get("minRegionDelaySeconds")));
    }
    if (map.containsKey("maxRegionDelaySeconds")) {
      builder.maxRegionDelay(seconds("maxRegionDelaySeconds", map.get("maxRegionDelaySeconds")));
    }
    if (map.containsKey("interCategoryDelaySeconds")) {
      builder.interCategoryDelay(
          seconds("interCategoryDelaySeconds", map.get("interCategoryDelaySeconds")));
    }

    Object regions = map.get("regions");
    if (regions instanceof Map) {
      Map<String, BoundingBox> table = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) regions).entrySet()) {
        table.put(String.valueOf(e.getKey()), bbox("regions." + e.getKey(), e.getValue()));
      }
      builder.regions(table);
    }
    if (map.containsKey("singleQueryBox")) {
      builder.singleQueryBox(bbox("singleQueryBox", map.get("singleQueryBox")));
    }

    Object enableCache = map.get("enableCache");
    if (enableCache instanceof Boolean) {
      builder.enableCache((Boolean) enableCache);
    }
    Object enableAlternate = map.get("enableAlternateSources");
    if (enableAlternate instanceof Boolean) {
      builder.enableAlternateSources((Boolean) enableAlternate);
    }

    Object categories = map.get("categories");
    if (categories instanceof List) {
      List<AssetCategory> list = new ArrayList<>();
      for (Object category : (List<Object>) categories) {
        list.add(AssetCategory.fromKey(String.valueOf(category)));
      }
      builder.categories(list);
    }
    return builder.build();
  }

  private static int intValue(String key, Object value) {
    if (!(value instanceof Number)) {
      throw new AssetConfigException("'" + key + "' must be a number, got " + value);
    }
    return ((Number) value).intValue();
  }

  private static Duration seconds(String key, Object value) {
    if (!(value instanceof Number)) {
      throw new AssetConfigException("'" + key + "' must be a number of seconds, got " + value);
    }
    return Duration.ofMillis(Math.round(((Number) value).doubleValue() * 1000));
  }

  private static BoundingBox bbox(String key, Object value) {
    if (!(value instanceof List) || ((List<?>) value).size() != 4) {
      throw new AssetConfigException("'" + key + "' must be [south, west, north, east]");
    }
    List<?> list = (List<?>) value;
    double[] c = new double[4];
    for (int i = 0; i < 4; i++) {
      if (!(list.get(i) instanceof Number)) {
        throw new AssetConfigException("'" + key + "' holds a non-numeric coordinate");
      }
      c[i] = ((Number) list.get(i)).doubleValue();
    }
    try {
      return new BoundingBox(c[0], c[1], c[2], c[3]);
    } catch (IllegalArgumentException e) {
      throw new AssetConfigException("'" + key + "': " + e.getMessage(), e);
    }
  }

  public Path getAssetRoot() {
    return assetRoot;
  }

  public Path getCacheRoot() {
    return cacheRoot;
  }

  public Path getReportRoot() {
    return reportRoot;
  }

  public ImmutableMap<AssetCategory, Integer> getTtlDays() {
    return ttlDays;
  }

  public ImmutableList<String> getOverpassEndpoints() {
    return overpassEndpoints;
  }

  public String getAirportCsvUrl() {
    return airportCsvUrl;
  }

  public String getAirportMirrorUrl() {
    return airportMirrorUrl;
  }

  public String getWikidataEndpoint() {
    return wikidataEndpoint;
  }

  public Duration getBaseDelay() {
    return baseDelay;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public Duration getMinRegionDelay() {
    return minRegionDelay;
  }

  public Duration getMaxRegionDelay() {
    return maxRegionDelay;
  }

  public Duration getInterCategoryDelay() {
    return interCategoryDelay;
  }

  public ImmutableMap<String, BoundingBox> getRegions() {
    return regions;
  }

  public BoundingBox getSingleQueryBox() {
    return singleQueryBox;
  }

  public boolean isEnableCache() {
    return enableCache;
  }

  public boolean isEnableAlternateSources() {
    return enableAlternateSources;
  }

  public ImmutableList<AssetCategory> getCategories() {
    return categories;
  }

  /** Builder for {@link OrchestratorConfig}; {@link #build()} validates. */
  public static final class Builder {
    private Path assetRoot = Paths.get("assets");
    private Path cacheRoot = Paths.get("cache");
    private Path reportRoot = Paths.get("logs");
    private final Map<AssetCategory, Integer> ttlDays =
        new EnumMap<>(AssetCache.DEFAULT_TTL_TABLE);
    private List<String> overpassEndpoints = OverpassQueries.DEFAULT_ENDPOINTS;
    private String airportCsvUrl = AirportCsvSource.OURAIRPORTS_URL;
    private String airportMirrorUrl = AirportCsvSource.GITHUB_MIRROR_URL;
    private String wikidataEndpoint = WikidataSource.ENDPOINT;
    private Duration baseDelay = Duration.ofSeconds(45);
    private int maxRetries = 3;
    private Duration requestTimeout = Duration.ofSeconds(120);
    private Duration minRegionDelay = Duration.ofSeconds(10);
    private Duration maxRegionDelay = Duration.ofSeconds(20);
    private Duration interCategoryDelay = Duration.ofSeconds(60);
    private Map<String, BoundingBox> regions = OverpassQueries.EUROPE_REGIONS;
    private BoundingBox singleQueryBox = OverpassQueries.EUROPE;
    private boolean enableCache = true;
    private boolean enableAlternateSources = true;
    private List<AssetCategory> categories = DEFAULT_CATEGORIES;

    private Builder() {
    }

    public Builder assetRoot(Path assetRoot) {
      this.assetRoot = assetRoot;
      return this;
    }

    public Builder cacheRoot(Path cacheRoot) {
      this.cacheRoot = cacheRoot;
      return this;
    }

    public Builder reportRoot(Path reportRoot) {
      this.reportRoot = reportRoot;
      return this;
    }

    public Builder ttlDays(AssetCategory category, int days) {
      this.ttlDays.put(category, days);
      return this;
    }

    public Builder overpassEndpoints(List<String> overpassEndpoints) {
      this.overpassEndpoints = overpassEndpoints;
      return this;
    }

    public Builder airportCsvUrl(String airportCsvUrl) {
      this.airportCsvUrl = airportCsvUrl;
      return this;
    }

    public Builder airportMirrorUrl(String airportMirrorUrl) {
      this.airportMirrorUrl = airportMirrorUrl;
      return this;
    }

    public Builder wikidataEndpoint(String wikidataEndpoint) {
      this.wikidataEndpoint = wikidataEndpoint;
      return this;
    }

    public Builder baseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder minRegionDelay(Duration minRegionDelay) {
      this.minRegionDelay = minRegionDelay;
      return this;
    }

    public Builder maxRegionDelay(Duration maxRegionDelay) {
      this.maxRegionDelay = maxRegionDelay;
      return this;
    }

    public Builder interCategoryDelay(Duration interCategoryDelay) {
      this.interCategoryDelay = interCategoryDelay;
      return this;
    }

    public Builder regions(Map<String, BoundingBox> regions) {
      this.regions = regions;
      return this;
    }

    public Builder singleQueryBox(BoundingBox singleQueryBox) {
      this.singleQueryBox = singleQueryBox;
      return this;
    }

    public Builder enableCache(boolean enableCache) {
      this.enableCache = enableCache;
      return this;
    }

    public Builder enableAlternateSources(boolean enableAlternateSources) {
      this.enableAlternateSources = enableAlternateSources;
      return this;
    }

    public Builder categories(List<AssetCategory> categories) {
      this.categories = categories;
      return this;
    }

    /**
     * Validates and builds the configuration.
     *
     * @throws AssetConfigException on empty pools or tables, negative delays,
     *     a region delay range with min above max, or fewer than one attempt
     */
    public OrchestratorConfig build() {
      if (overpassEndpoints == null || overpassEndpoints.isEmpty()) {
        throw new AssetConfigException("At least one Overpass endpoint is required");
      }
      if (regions == null || regions.isEmpty()) {
        throw new AssetConfigException("At least one region is required");
      }
      if (maxRetries < 1) {
        throw new AssetConfigException("maxRetries must be at least 1, got " + maxRetries);
      }
      requireNonNegative("baseDelay", baseDelay);
      requireNonNegative("minRegionDelay", minRegionDelay);
      requireNonNegative("maxRegionDelay", maxRegionDelay);
      requireNonNegative("interCategoryDelay", interCategoryDelay);
      if (requestTimeout.isZero() || requestTimeout.isNegative()) {
        throw new AssetConfigException("requestTimeout must be positive");
      }
      if (maxRegionDelay.compareTo(minRegionDelay) < 0) {
        throw new AssetConfigException("maxRegionDelay " + maxRegionDelay
            + " is below minRegionDelay " + minRegionDelay);
      }
      for (Map.Entry<AssetCategory, Integer> ttl : ttlDays.entrySet()) {
        if (ttl.getValue() < 0) {
          throw new AssetConfigException("TTL for " + ttl.getKey() + " must not be negative");
        }
      }
      if (categories == null || categories.isEmpty()) {
        throw new AssetConfigException("At least one asset category is required");
      }
      return new OrchestratorConfig(this);
    }

    private static void requireNonNegative(String name, Duration value) {
      if (value == null || value.isNegative()) {
        throw new AssetConfigException(name + " must not be negative");
      }
    }
  }
}
