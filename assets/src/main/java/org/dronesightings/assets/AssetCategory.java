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

import java.util.Locale;

/**
 * Class of infrastructure asset that is fetched, cached and written independently.
 *
 * <p>The lowercase {@link #key()} is used as the cache namespace, the output file
 * name and the {@code asset_type} attribute of every feature in the category.
 */
public enum AssetCategory {
  AIRPORT("airport"),
  HARBOUR("harbour"),
  MILITARY("military"),
  ENERGY("energy"),
  RAIL("rail"),
  BORDER("border"),
  CRITICAL("critical"),
  INFRASTRUCTURE("infrastructure");

  private final String key;

  AssetCategory(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  /**
   * Resolves a category from its key, its enum name or a plural alias
   * such as "airports" or "harbours".
   *
   * @param name Category name as given on the command line or in configuration
   * @return The matching category
   * @throws AssetConfigException if no category matches
   */
  public static AssetCategory fromKey(String name) {
    if (name == null || name.trim().isEmpty()) {
      throw new AssetConfigException("Asset category must not be empty");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (AssetCategory category : values()) {
      if (category.key.equals(normalized) || (category.key + "s").equals(normalized)) {
        return category;
      }
    }
    throw new AssetConfigException("Unknown asset category: " + name);
  }

  @Override public String toString() {
    return key;
  }
}
