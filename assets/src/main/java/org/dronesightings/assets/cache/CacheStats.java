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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Snapshot of cache contents: entry and byte totals, overall and per category.
 */
public final class CacheStats {
  private final int totalEntries;
  private final long totalBytes;
  private final ImmutableMap<String, Integer> countByCategory;
  private final ImmutableMap<String, Long> bytesByCategory;

  CacheStats(int totalEntries, long totalBytes, Map<String, Integer> countByCategory,
      Map<String, Long> bytesByCategory) {
    this.totalEntries = totalEntries;
    this.totalBytes = totalBytes;
    this.countByCategory = ImmutableMap.copyOf(countByCategory);
    this.bytesByCategory = ImmutableMap.copyOf(bytesByCategory);
  }

  public int getTotalEntries() {
    return totalEntries;
  }

  public long getTotalBytes() {
    return totalBytes;
  }

  public double getTotalMegabytes() {
    return totalBytes / (1024.0 * 1024.0);
  }

  public ImmutableMap<String, Integer> getCountByCategory() {
    return countByCategory;
  }

  public ImmutableMap<String, Long> getBytesByCategory() {
    return bytesByCategory;
  }

  @Override public String toString() {
    return String.format("CacheStats{entries=%d, size=%.1f MB, byCategory=%s}",
        totalEntries, getTotalMegabytes(), countByCategory);
  }
}
