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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persistent map from {@code category_fingerprint} to {@link CacheEntry}.
 *
 * <p>The single source of truth for what is cached. Saved with a write to a
 * temporary file followed by an atomic move, so a crash never leaves a
 * partially written index behind. Not thread-safe on its own;
 * {@link AssetCache} serializes access.
 */
public class CacheIndex {
  private static final Logger LOGGER = LoggerFactory.getLogger(CacheIndex.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static final String INDEX_FILENAME = "cache_index.json";

  @JsonProperty("version")
  private String version = "1.0";

  @JsonProperty("lastUpdated")
  private long lastUpdated;

  @JsonProperty("entries")
  private Map<String, CacheEntry> entries = new TreeMap<>();

  @JsonIgnore
  private Path cacheRoot;

  static String key(AssetCategory category, QueryFingerprint fingerprint) {
    return category.key() + "_" + fingerprint.value();
  }

  /**
   * Loads the index from {@code cacheRoot}. An absent file (first run) or a
   * corrupt file yields an empty index.
   */
  public static CacheIndex load(Path cacheRoot) {
    Path indexFile = cacheRoot.resolve(INDEX_FILENAME);
    CacheIndex index;
    if (!Files.exists(indexFile)) {
      LOGGER.debug("No cache index found in {}, starting empty", cacheRoot);
      index = new CacheIndex();
    } else {
      try {
        index = MAPPER.readValue(indexFile.toFile(), CacheIndex.class);
        if (index.entries == null) {
          index.entries = new TreeMap<>();
        }
        index.dropMalformedEntries(indexFile);
        LOGGER.debug("Loaded cache index version {} with {} entries",
            index.version, index.entries.size());
      } catch (IOException e) {
        LOGGER.warn("Cache index {} is unreadable, starting empty: {}", indexFile, e.getMessage());
        index = new CacheIndex();
      }
    }
    index.cacheRoot = cacheRoot;
    return index;
  }

  /** Removes entries that lack a category, fingerprint or data file name. */
  private void dropMalformedEntries(Path indexFile) {
    Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, CacheEntry> e = it.next();
      CacheEntry entry = e.getValue();
      if (entry == null || isBlank(entry.category) || isBlank(entry.fingerprint)
          || isBlank(entry.filename)) {
        LOGGER.warn("Dropping malformed cache index entry '{}' from {}", e.getKey(), indexFile);
        it.remove();
      }
    }
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.trim().isEmpty();
  }

  @Nullable CacheEntry get(AssetCategory category, QueryFingerprint fingerprint) {
    return entries.get(key(category, fingerprint));
  }

  /** Replaces the entry for its key and returns the previous one, if any. */
  @Nullable CacheEntry put(CacheEntry entry) {
    lastUpdated = System.currentTimeMillis();
    return entries.put(entry.category + "_" + entry.fingerprint, entry);
  }

  @Nullable CacheEntry remove(String key) {
    lastUpdated = System.currentTimeMillis();
    return entries.remove(key);
  }

  Map<String, CacheEntry> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  /**
   * Flushes the index to durable storage. This is the commit point for a
   * cache write.
   *
   * @throws AssetFetchException if the index cannot be written
   */
  void save() {
    Path indexFile = cacheRoot.resolve(INDEX_FILENAME);
    Path tempFile = cacheRoot.resolve(INDEX_FILENAME + ".tmp");
    try {
      Files.createDirectories(cacheRoot);
      MAPPER.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), this);
      try {
        Files.move(tempFile, indexFile,
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tempFile, indexFile, StandardCopyOption.REPLACE_EXISTING);
      }
      LOGGER.debug("Saved cache index with {} entries", entries.size());
    } catch (IOException e) {
      throw new AssetFetchException("Failed to save cache index " + indexFile, e);
    }
  }
}
