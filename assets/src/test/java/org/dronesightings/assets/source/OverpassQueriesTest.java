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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link OverpassQueries}.
 */
@Tag("unit")
public class OverpassQueriesTest {

  @Test void testMilitaryRegionQuery() {
    String query = OverpassQueries.query(AssetCategory.MILITARY,
        OverpassQueries.EUROPE_REGIONS.get("nordic"));

    assertTrue(query.startsWith("[out:json][timeout:60];\n(\n"), query);
    assertTrue(query.contains("  node[\"landuse\"=\"military\"](55,4,72,32);\n"), query);
    assertTrue(query.contains(
        "  way[\"aeroway\"=\"aerodrome\"][\"military\"=\"yes\"](55,4,72,32);\n"), query);
    assertTrue(query.endsWith(");\nout center tags;"), query);
  }

  @Test void testCriticalQueryUsesLongerTimeout() {
    String query = OverpassQueries.query(AssetCategory.CRITICAL, OverpassQueries.EUROPE);

    assertTrue(query.startsWith("[out:json][timeout:90];"), query);
    assertTrue(query.contains("node[\"aeroway\"=\"aerodrome\"][\"iata\"~\".\"](35,-15,72,40);"),
        query);
  }

  @Test void testEnergyFiltersGeneratorSources() {
    String query = OverpassQueries.query(AssetCategory.ENERGY, new BoundingBox(1, 2, 3, 4));

    assertTrue(query.contains(
        "node[\"power\"=\"generator\"][\"generator:source\"~\"nuclear|wind|solar\"](1,2,3,4);"));
  }

  @Test void testChunkingSplit() {
    assertTrue(OverpassQueries.isChunked(AssetCategory.MILITARY));
    assertTrue(OverpassQueries.isChunked(AssetCategory.BORDER));
    assertFalse(OverpassQueries.isChunked(AssetCategory.CRITICAL));
    assertTrue(OverpassQueries.supports(AssetCategory.CRITICAL));
    assertFalse(OverpassQueries.supports(AssetCategory.AIRPORT));
    assertEquals(5, OverpassQueries.EUROPE_REGIONS.size());
  }

  @Test void testCategoryWithoutVocabularyRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> OverpassQueries.query(AssetCategory.AIRPORT, OverpassQueries.EUROPE));
  }
}
