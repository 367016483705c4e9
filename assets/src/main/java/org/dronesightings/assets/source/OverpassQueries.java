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
import org.dronesightings.assets.model.BoundingBox;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Overpass QL tag vocabularies per asset category.
 *
 * <p>Chunked categories are queried once per region with a short server
 * timeout; the critical infrastructure query covers all of Europe in one
 * request.
 */
public final class OverpassQueries {

  /** Public Overpass API mirrors. */
  public static final ImmutableList<String> DEFAULT_ENDPOINTS = ImmutableList.of(
      "https://overpass-api.de/api/interpreter",
      "https://lz4.overpass-api.de/api/interpreter",
      "https://z.overpass-api.de/api/interpreter");

  /** Whole of Europe, used for single-request queries. */
  public static final BoundingBox EUROPE = new BoundingBox(35, -15, 72, 40);

  /** Default regional split of Europe for chunked queries, in query order. */
  public static final ImmutableMap<String, BoundingBox> EUROPE_REGIONS =
      ImmutableMap.<String, BoundingBox>builder()
          .put("nordic", new BoundingBox(55, 4, 72, 32))
          .put("western", new BoundingBox(42, -10, 55, 8))
          .put("central", new BoundingBox(45, 8, 55, 20))
          .put("southern", new BoundingBox(35, 8, 45, 20))
          .put("eastern", new BoundingBox(45, 20, 55, 40))
          .build();

  static final int CHUNKED_TIMEOUT_SECONDS = 60;
  static final int SINGLE_TIMEOUT_SECONDS = 90;

  private static final ImmutableMap<AssetCategory, ImmutableList<String>> NODE_WAY_FILTERS =
      ImmutableMap.<AssetCategory, ImmutableList<String>>builder()
          .put(AssetCategory.MILITARY, ImmutableList.of(
              "[\"landuse\"=\"military\"]",
              "[\"military\"]",
              "[\"aeroway\"=\"aerodrome\"][\"military\"=\"yes\"]"))
          .put(AssetCategory.HARBOUR, ImmutableList.of(
              "[\"harbour\"]",
              "[\"amenity\"=\"ferry_terminal\"]",
              "[\"port\"]"))
          .put(AssetCategory.RAIL, ImmutableList.of(
              "[\"railway\"=\"station\"]",
              "[\"public_transport\"=\"station\"][\"station\"=\"train\"]",
              "[\"railway\"=\"halt\"]"))
          .put(AssetCategory.BORDER, ImmutableList.of(
              "[\"barrier\"=\"border_control\"]",
              "[\"amenity\"=\"customs\"]",
              "[\"checkpoint\"]"))
          .build();

  private static final ImmutableList<String> ENERGY_STATEMENTS = ImmutableList.of(
      "node[\"power\"=\"plant\"]",
      "way[\"power\"=\"plant\"]",
      "node[\"power\"=\"generator\"][\"generator:source\"~\"nuclear|wind|solar\"]",
      "node[\"man_made\"=\"offshore_platform\"]");

  private static final ImmutableList<String> CRITICAL_STATEMENTS = ImmutableList.of(
      "node[\"aeroway\"=\"aerodrome\"][\"iata\"~\".\"]",
      "way[\"aeroway\"=\"aerodrome\"][\"iata\"~\".\"]",
      "node[\"amenity\"=\"ferry_terminal\"][\"operator\"~\".\"]",
      "node[\"harbour\"=\"yes\"][\"commercial\"=\"yes\"]");

  /** Categories queried region by region. */
  public static final ImmutableSet<AssetCategory> CHUNKED_CATEGORIES = ImmutableSet.of(
      AssetCategory.MILITARY, AssetCategory.ENERGY, AssetCategory.HARBOUR,
      AssetCategory.RAIL, AssetCategory.BORDER);

  /** Categories queried with a single bounding box. */
  public static final ImmutableSet<AssetCategory> SINGLE_CATEGORIES =
      ImmutableSet.of(AssetCategory.CRITICAL);

  private OverpassQueries() {
  }

  public static boolean isChunked(AssetCategory category) {
    return CHUNKED_CATEGORIES.contains(category);
  }

  public static boolean supports(AssetCategory category) {
    return CHUNKED_CATEGORIES.contains(category) || SINGLE_CATEGORIES.contains(category);
  }

  /**
   * Builds the Overpass QL query of a category for one bounding box.
   *
   * @throws IllegalArgumentException if Overpass has no vocabulary for the category
   */
  public static String query(AssetCategory category, BoundingBox bbox) {
    ImmutableList<String> statements;
    int timeout = CHUNKED_TIMEOUT_SECONDS;
    switch (category) {
    case ENERGY:
      statements = ENERGY_STATEMENTS;
      break;
    case CRITICAL:
      statements = CRITICAL_STATEMENTS;
      timeout = SINGLE_TIMEOUT_SECONDS;
      break;
    default:
      ImmutableList<String> filters = NODE_WAY_FILTERS.get(category);
      if (filters == null) {
        throw new IllegalArgumentException("No Overpass query for category " + category);
      }
      ImmutableList.Builder<String> builder = ImmutableList.builder();
      for (String filter : filters) {
        builder.add("node" + filter).add("way" + filter);
      }
      statements = builder.build();
      break;
    }

    String box = "(" + bbox.toOverpass() + ");";
    StringBuilder sb = new StringBuilder();
    sb.append("[out:json][timeout:").append(timeout).append("];\n(\n");
    for (String statement : statements) {
      sb.append("  ").append(statement).append(box).append('\n');
    }
    sb.append(");\nout center tags;");
    return sb.toString();
  }
}
