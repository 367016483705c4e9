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
import org.dronesightings.assets.model.Feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link OverpassElementMapper}.
 */
@Tag("unit")
public class OverpassElementMapperTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static JsonNode json(String text) throws IOException {
    return MAPPER.readTree(text);
  }

  @Test void testSkipsElementsWithoutCoordinates() throws IOException {
    JsonNode payload = json(OverpassFixtures.militaryPayload(12, 3));

    List<Feature> features = OverpassElementMapper.map(AssetCategory.MILITARY, payload);

    assertEquals(9, features.size());
    for (Feature feature : features) {
      assertEquals("military", feature.getAssetType());
    }
  }

  @Test void testWayCenterCoordinates() throws IOException {
    Feature feature = OverpassElementMapper.mapElement(AssetCategory.RAIL, json(
        "{\"type\":\"way\",\"id\":77,\"center\":{\"lat\":48.88,\"lon\":2.355},"
            + "\"tags\":{\"railway\":\"station\"}}"));

    assertEquals(2.355, feature.getLongitude());
    assertEquals(48.88, feature.getLatitude());
    assertEquals("Rail station", feature.getName());
    assertEquals("way/77", feature.getProviderId());
    assertEquals("station", feature.getTags().get("railway"));
  }

  @Test void testMilitaryNameFallbacksAndFacilityType() throws IOException {
    Feature named = OverpassElementMapper.mapElement(AssetCategory.MILITARY, json(
        "{\"type\":\"node\",\"id\":1,\"lat\":1,\"lon\":2,"
            + "\"tags\":{\"military\":\"airfield\",\"operator\":\"Air Force\"}}"));
    assertEquals("airfield", named.getName());
    assertEquals("airfield", named.getAttributes().get("facility_type"));
    assertFalse(named.getTags().containsKey("military"));
    assertEquals("Air Force", named.getTags().get("operator"));

    Feature bare = OverpassElementMapper.mapElement(AssetCategory.MILITARY, json(
        "{\"type\":\"node\",\"id\":2,\"lat\":1,\"lon\":2,\"tags\":{\"landuse\":\"military\"}}"));
    assertEquals("Military facility", bare.getName());
    assertEquals("base", bare.getAttributes().get("facility_type"));
  }

  @Test void testEnergySourceType() throws IOException {
    Feature plant = OverpassElementMapper.mapElement(AssetCategory.ENERGY, json(
        "{\"type\":\"node\",\"id\":3,\"lat\":51.0,\"lon\":2.1,"
            + "\"tags\":{\"power\":\"plant\",\"plant:source\":\"nuclear\",\"operator\":\"EDF\"}}"));

    assertEquals("EDF", plant.getName());
    assertEquals("nuclear", plant.getAttributes().get("source_type"));
    assertFalse(plant.getTags().containsKey("plant:source"));

    Feature unknown = OverpassElementMapper.mapElement(AssetCategory.ENERGY, json(
        "{\"type\":\"node\",\"id\":4,\"lat\":51.0,\"lon\":2.1,\"tags\":{}}"));
    assertEquals("Energy facility", unknown.getName());
    assertEquals("unknown", unknown.getAttributes().get("source_type"));
  }

  @Test void testCriticalClassification() throws IOException {
    Feature airport = OverpassElementMapper.mapElement(AssetCategory.CRITICAL, json(
        "{\"type\":\"node\",\"id\":5,\"lat\":1,\"lon\":2,"
            + "\"tags\":{\"aeroway\":\"aerodrome\",\"iata\":\"CDG\",\"name\":\"CDG\"}}"));
    assertEquals("airport", airport.getAttributes().get("facility_type"));
    assertEquals("aviation", airport.getAttributes().get("sector"));
    assertEquals("critical", airport.getAssetType());

    Feature ferry = OverpassElementMapper.mapElement(AssetCategory.CRITICAL, json(
        "{\"type\":\"node\",\"id\":6,\"lat\":1,\"lon\":2,"
            + "\"tags\":{\"amenity\":\"ferry_terminal\",\"operator\":\"DFDS\"}}"));
    assertEquals("ferry_terminal", ferry.getAttributes().get("facility_type"));
    assertEquals("maritime", ferry.getAttributes().get("sector"));
    assertEquals("Critical facility", ferry.getName());

    Feature harbour = OverpassElementMapper.mapElement(AssetCategory.CRITICAL, json(
        "{\"type\":\"node\",\"id\":7,\"lat\":1,\"lon\":2,"
            + "\"tags\":{\"harbour\":\"yes\",\"commercial\":\"yes\"}}"));
    assertEquals("harbour", harbour.getAttributes().get("facility_type"));
  }

  @Test void testHarbourNameFallback() throws IOException {
    Feature harbour = OverpassElementMapper.mapElement(AssetCategory.HARBOUR, json(
        "{\"type\":\"node\",\"id\":8,\"lat\":1,\"lon\":2,\"tags\":{\"ref\":\"H-12\"}}"));

    assertEquals("H-12", harbour.getName());
  }

  @Test void testNonNumericCoordinatesSkipped() throws IOException {
    assertNull(OverpassElementMapper.mapElement(AssetCategory.BORDER, json(
        "{\"type\":\"node\",\"id\":9,\"lat\":\"north\",\"lon\":2}")));
  }

  @Test void testPayloadWithoutElementsGivesNothing() throws IOException {
    assertTrue(OverpassElementMapper.map(AssetCategory.BORDER, json("{\"remark\":\"timeout\"}"))
        .isEmpty());
  }
}
