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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Index record for one cached feature set. Owned by {@link AssetCache}.
 */
public class CacheEntry {
  @JsonProperty("category")
  public String category;

  @JsonProperty("fingerprint")
  public String fingerprint;

  @JsonProperty("filename")
  public String filename;

  @JsonProperty("createdAt")
  public long createdAt;  // epoch millis

  @JsonProperty("recordCount")
  public int recordCount;

  @JsonProperty("byteSize")
  public long byteSize;

  public CacheEntry() {
  }

  CacheEntry(AssetCategory category, QueryFingerprint fingerprint, String filename,
      long createdAt, int recordCount, long byteSize) {
    this.category = category.key();
    this.fingerprint = fingerprint.value();
    this.filename = filename;
    this.createdAt = createdAt;
    this.recordCount = recordCount;
    this.byteSize = byteSize;
  }

  public AssetCategory assetCategory() {
    return AssetCategory.fromKey(category);
  }

  @Override public String toString() {
    return "CacheEntry{" + category + "_" + fingerprint + " -> " + filename
        + ", records=" + recordCount + ", bytes=" + byteSize + "}";
  }
}
