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
package org.dronesightings.assets.cache;

import org.dronesightings.assets.AssetCategory;
import org.dronesightings.assets.AssetFetchException;
import org.dronesightings.assets.model.FeatureCollectionCodec;
import org.dronesightings.assets.model.FeatureSet;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * File-backed cache of fetched feature sets keyed by category and query
 * fingerprint, with a time-to-live per category.
 *
 * <p>Write order is data file first, then index flush. The index flush is the
 * commit point: a crash between the two leaves an unreferenced data file,
 * never an index entry pointing at a missing or partial file. An entry whose
 * age has reached the category TTL is a miss on every read path.
 *
 * <p>All index access is serialized on this instance.
 */
public class AssetCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(AssetCache.class);

  /** Default TTL in days per category; categories not listed use {@link #DEFAULT_TTL_DAYS}. */
  public static final ImmutableMap<AssetCategory, Integer> DEFAULT_TTL_TABLE =
      ImmutableMap.<AssetCategory, Integer>builder()
          .put(AssetCategory.AIRPORT, 7)
          .put(AssetCategory.HARBOUR, 14)
          .put(AssetCategory.MILITARY, 30)
          .put(AssetCategory.ENERGY, 3)
          .put(AssetCategory.RAIL, 14)
          .put(AssetCategory.BORDER, 30)
          .build();

  public static final int DEFAULT_TTL_DAYS = 7;

  private final Path cacheRoot;
  private final ImmutableMap<AssetCategory, Integer> ttlDays;
  private final Clock clock;
  private final CacheIndex index;

  public AssetCache(Path cacheRoot) {
    this(cacheRoot, DEFAULT_TTL_TABLE, Clock.systemUTC());
  }

  /**
   * Creates a cache and loads its index once.
   *
   * @param cacheRoot Directory holding the index and data files
   * @param ttlDays TTL in days per category
   * @param clock Time source for entry creation and expiry
   */
  public AssetCache(Path cacheRoot, Map<AssetCategory, Integer> ttlDays, Clock clock) {
    this.cacheRoot = cacheRoot;
    this.ttlDays = ImmutableMap.copyOf(ttlDays);
    this.clock = clock;
    this.index = CacheIndex.load(cacheRoot);
  }

  /** Time-to-live of a category. */
  public Duration ttl(AssetCategory category) {
    return Duration.ofDays(ttlDays.getOrDefault(category, DEFAULT_TTL_DAYS));
  }

  /**
   * Returns true iff an entry exists for the key and its age is strictly below
   * the category TTL.
   */
  public synchronized boolean isValid(AssetCategory category, QueryFingerprint fingerprint) {
    CacheEntry entry = index.get(category, fingerprint);
    return entry != null && !isExpired(entry, category, clock.millis());
  }

  /**
   * Returns the cached feature set if the entry is valid and its data file is
   * readable. An expired entry is evicted; an entry whose data file is missing
   * or corrupt is dropped from the index.
   */
  public synchronized Optional<FeatureSet> get(AssetCategory category,
      QueryFingerprint fingerprint) {
    CacheEntry entry = index.get(category, fingerprint);
    if (entry == null) {
      LOGGER.debug("Cache miss for {} ({})", category, fingerprint);
      return Optional.empty();
    }
    long now = clock.millis();
    if (isExpired(entry, category, now)) {
      LOGGER.debug("Cache entry expired for {} (age: {} hours)",
          category, TimeUnit.MILLISECONDS.toHours(now - entry.createdAt));
      drop(entry);
      return Optional.empty();
    }
    try {
      FeatureSet cached = FeatureCollectionCodec.read(cacheRoot.resolve(entry.filename), category);
      long remaining = entry.createdAt + ttl(category).toMillis() - now;
      LOGGER.info("Using cached {} data ({} records, {} hours until refresh)", category,
          cached.size(), TimeUnit.MILLISECONDS.toHours(remaining));
      return Optional.of(cached);
    } catch (IOException e) {
      LOGGER.warn("Cached data file {} is unreadable, dropping entry: {}",
          entry.filename, e.getMessage());
      drop(entry);
      return Optional.empty();
    }
  }

  /**
   * Stores a feature set and commits it to the index, replacing any previous
   * entry for the same category and fingerprint.
   *
   * @return The committed index entry
   * @throws AssetFetchException if the data file or the index cannot be written
   */
  public synchronized CacheEntry put(AssetCategory category, QueryFingerprint fingerprint,
      FeatureSet featureSet) {
    long now = clock.millis();
    Path dataFile = uniqueDataFile(category, fingerprint, now);
    long byteSize;
    try {
      byteSize = FeatureCollectionCodec.write(dataFile, featureSet, "cache",
          Instant.ofEpochMilli(now));
    } catch (IOException e) {
      throw new AssetFetchException("Failed to write cache data file " + dataFile, e);
    }

    CacheEntry entry = new CacheEntry(category, fingerprint,
        dataFile.getFileName().toString(), now, featureSet.size(), byteSize);
    CacheEntry previous = index.put(entry);
    index.save();
    LOGGER.info("Cached {} records for {} ({})", featureSet.size(), category, fingerprint);

    if (previous != null && !previous.filename.equals(entry.filename)) {
      deleteDataFile(previous.filename);
    }
    return entry;
  }

  /**
   * Removes every entry whose age has reached its category TTL, deleting the
   * backing files, and flushes the index once.
   *
   * @return Number of evicted entries
   */
  public synchronized int evictExpired() {
    long now = clock.millis();
    List<String> expired = new ArrayList<>();
    Iterator<Map.Entry<String, CacheEntry>> it = index.entries().entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, CacheEntry> e = it.next();
      CacheEntry entry = e.getValue();
      AssetCategory category = categoryOf(entry);
      if (category == null || isExpired(entry, category, now)) {
        expired.add(e.getKey());
      }
    }
    for (String key : expired) {
      CacheEntry removed = index.remove(key);
      if (removed != null) {
        deleteDataFile(removed.filename);
      }
    }
    if (!expired.isEmpty()) {
      index.save();
      LOGGER.info("Cleaned {} expired cache entries", expired.size());
    }
    return expired.size();
  }

  /** Entry and byte totals, overall and per category. */
  public synchronized CacheStats stats() {
    Map<String, Integer> counts = new TreeMap<>();
    Map<String, Long> bytes = new TreeMap<>();
    long totalBytes = 0;
    for (CacheEntry entry : index.entries().values()) {
      counts.merge(entry.category, 1, Integer::sum);
      bytes.merge(entry.category, entry.byteSize, Long::sum);
      totalBytes += entry.byteSize;
    }
    return new CacheStats(index.size(), totalBytes, counts, bytes);
  }

  public synchronized @Nullable CacheEntry getEntry(AssetCategory category,
      QueryFingerprint fingerprint) {
    return index.get(category, fingerprint);
  }

  public Path getCacheRoot() {
    return cacheRoot;
  }

  private boolean isExpired(CacheEntry entry, AssetCategory category, long nowMillis) {
    return nowMillis - entry.createdAt >= ttl(category).toMillis();
  }

  private void drop(CacheEntry entry) {
    index.remove(entry.category + "_" + entry.fingerprint);
    index.save();
    deleteDataFile(entry.filename);
  }

  private Path uniqueDataFile(AssetCategory category, QueryFingerprint fingerprint, long now) {
    String base = category.key() + "_" + fingerprint.value() + "_" + now;
    Path candidate = cacheRoot.resolve(base + ".json");
    int suffix = 1;
    while (Files.exists(candidate)) {
      candidate = cacheRoot.resolve(base + "_" + suffix++ + ".json");
    }
    return candidate;
  }

  private void deleteDataFile(String filename) {
    try {
      Files.deleteIfExists(cacheRoot.resolve(filename));
    } catch (IOException e) {
      LOGGER.warn("Could not delete cache data file {}: {}", filename, e.getMessage());
    }
  }

  private static @Nullable AssetCategory categoryOf(CacheEntry entry) {
    try {
      return entry.assetCategory();
    } catch (RuntimeException e) {
      LOGGER.warn("Cache entry with unknown category {} will be evicted", entry.category);
      return null;
    }
  }
}
