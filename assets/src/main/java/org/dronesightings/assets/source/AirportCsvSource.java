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
import org.dronesightings.assets.fetch.PayloadParser;
import org.dronesightings.assets.fetch.QueryExecutor;
import org.dronesightings.assets.fetch.QueryResult;
import org.dronesightings.assets.model.Feature;
import org.dronesightings.assets.model.FeatureSet;
import org.dronesightings.assets.strategy.StrategyException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the OurAirports airport table and keeps the European rows.
 *
 * <p>The same table is published at ourairports.com and mirrored on GitHub;
 * one instance is registered per location.
 */
public class AirportCsvSource implements AssetSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(AirportCsvSource.class);

  public static final String OURAIRPORTS_URL = "https://ourairports.com/data/airports.csv";
  public static final String GITHUB_MIRROR_URL =
      "https://raw.githubusercontent.com/davidmegginson/ourairports-data/main/airports.csv";

  /** ISO 3166 country codes treated as European. */
  public static final ImmutableSet<String> EUROPEAN_COUNTRIES = ImmutableSet.of(
      "AL", "AD", "AT", "BA", "BE", "BG", "BY", "CH", "CY", "CZ", "DE", "DK", "EE",
      "ES", "FI", "FO", "FR", "GB", "GI", "GR", "HR", "HU", "IE", "IS", "IT", "LI",
      "LT", "LU", "LV", "MD", "ME", "MK", "MT", "NL", "NO", "PL", "PT", "RO", "RS",
      "RU", "SE", "SI", "SK", "SM", "UA");

  static final List<String> REQUIRED_COLUMNS =
      ImmutableList.of("name", "latitude_deg", "longitude_deg", "iso_country");

  private final String name;
  private final QueryExecutor<List<String[]>> executor;
  private final int maxRetries;

  public AirportCsvSource(String name, QueryExecutor<List<String[]>> executor, int maxRetries) {
    this.name = name;
    this.executor = executor;
    this.maxRetries = maxRetries;
  }

  /**
   * Parser for CSV tables with a header row. A body without the required
   * airport columns is a malformed response.
   */
  public static PayloadParser<List<String[]>> csvParser() {
    return body -> {
      List<String[]> rows;
      try (CSVReader reader = new CSVReader(new StringReader(body))) {
        rows = reader.readAll();
      } catch (CsvException e) {
        throw new IOException("Unparseable CSV payload: " + e.getMessage(), e);
      }
      if (rows.isEmpty()) {
        throw new IOException("Empty CSV payload");
      }
      List<String> header = ImmutableList.copyOf(rows.get(0));
      for (String column : REQUIRED_COLUMNS) {
        if (!header.contains(column)) {
          throw new IOException("CSV payload lacks column '" + column + "'");
        }
      }
      return rows;
    };
  }

  @Override public String getName() {
    return name;
  }

  @Override public Set<AssetCategory> getCategories() {
    return ImmutableSet.of(AssetCategory.AIRPORT);
  }

  @Override public String queryText(AssetCategory category) {
    return "GET " + name + " airports.csv where iso_country in "
        + String.join(",", EUROPEAN_COUNTRIES);
  }

  @Override public FeatureSet fetch(AssetCategory category) throws StrategyException {
    if (!supports(category)) {
      throw new StrategyException(name + " does not serve category " + category);
    }
    QueryResult<List<String[]>> result = executor.execute("", maxRetries);
    if (!result.isSuccess()) {
      throw new StrategyException(name + " download failed after " + result.getAttempts()
          + " attempts: " + result.getMessage());
    }
    List<Feature> features = toFeatures(result.getPayload());
    LOGGER.info("Kept {} European airports from {}", features.size(), name);
    return new FeatureSet(category, features);
  }

  /** Converts parsed rows, header first, keeping European rows with valid coordinates. */
  static List<Feature> toFeatures(List<String[]> rows) {
    Map<String, Integer> columns = new HashMap<>();
    String[] header = rows.get(0);
    for (int i = 0; i < header.length; i++) {
      columns.put(header[i], i);
    }

    List<Feature> features = new ArrayList<>();
    int skipped = 0;
    for (String[] row : rows.subList(1, rows.size())) {
      if (!EUROPEAN_COUNTRIES.contains(cell(row, columns, "iso_country"))) {
        continue;
      }
      double lat;
      double lon;
      try {
        lat = Double.parseDouble(cell(row, columns, "latitude_deg"));
        lon = Double.parseDouble(cell(row, columns, "longitude_deg"));
      } catch (NumberFormatException e) {
        skipped++;
        continue;
      }

      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put(Feature.ASSET_TYPE, AssetCategory.AIRPORT.key());
      putIfPresent(attributes, "airport_type", cell(row, columns, "type"));
      putIfPresent(attributes, "iata", cell(row, columns, "iata_code"));
      putIfPresent(attributes, "icao", cell(row, columns, "gps_code"));
      attributes.put("iso_country", cell(row, columns, "iso_country"));

      Map<String, String> tags = new LinkedHashMap<>();
      putIfPresent(tags, "ident", cell(row, columns, "ident"));
      putIfPresent(tags, "municipality", cell(row, columns, "municipality"));
      putIfPresent(tags, "iso_region", cell(row, columns, "iso_region"));

      String id = cell(row, columns, "id");
      features.add(new Feature(lon, lat, cell(row, columns, "name"), attributes, tags,
          id.isEmpty() ? null : "ourairports/" + id));
    }
    if (skipped > 0) {
      LOGGER.debug("Skipped {} airport rows without coordinates", skipped);
    }
    return features;
  }

  private static String cell(String[] row, Map<String, Integer> columns, String column) {
    Integer index = columns.get(column);
    if (index == null || index >= row.length) {
      return "";
    }
    return row[index].trim();
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (!value.isEmpty()) {
      map.put(key, value);
    }
  }
}
