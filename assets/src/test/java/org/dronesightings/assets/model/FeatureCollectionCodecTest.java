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
package org.dronesightings.assets.model;

import org.dronesightings.assets.AssetCategory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FeatureCollectionCodec}.
 */
@Tag("unit")
public class FeatureCollectionCodecTest {
  private static final Instant GENERATED = Instant.parse("2024-05-01T08:30:00Z");

  @TempDir
  Path tempDir;

  private static FeatureSet harbours() {
    return new FeatureSet(AssetCategory.HARBOUR, ImmutableList.of(
        new Feature(12.238889, 45.505556, "Venice Port",
            ImmutableMap.of(Feature.ASSET_TYPE, "harbour"),
            ImmutableMap.of("seamark:type", "harbour"), "node/42")));
  }

  @Test void testEncodeLayout() {
    JsonNode root = FeatureCollectionCodec.encode(harbours(), "overpass", GENERATED);

    assertEquals("FeatureCollection", root.path("type").asText());
    JsonNode feature = root.path("features").get(0);
    assertEquals("Point", feature.path("geometry").path("type").asText());
    assertEquals(12.238889, feature.path("geometry").path("coordinates").get(0).asDouble());
    assertEquals(45.505556, feature.path("geometry").path("coordinates").get(1).asDouble());
    JsonNode properties = feature.path("properties");
    assertEquals("Venice Port", properties.path("name").asText());
    assertEquals("node/42", properties.path("provider_id").asText());
    assertEquals("harbour", properties.path("asset_type").asText());
    assertEquals("harbour", properties.path("tags").path("seamark:type").asText());

    JsonNode metadata = root.path("metadata");
    assertEquals("2024-05-01 08:30:00 UTC", metadata.path("generated").asText());
    assertEquals("harbour", metadata.path("asset_type").asText());
    assertEquals(1, metadata.path("count").asInt());
    assertEquals("overpass", metadata.path("source").asText());
  }

  @Test void testWriteThenRead() throws IOException {
    Path file = tempDir.resolve("nested/harbour.geojson");

    long size = FeatureCollectionCodec.write(file, harbours(), "overpass", GENERATED);

    assertEquals(Files.size(file), size);
    assertEquals(harbours(), FeatureCollectionCodec.read(file, AssetCategory.HARBOUR));
  }

  @Test void testDecodeWithoutOptionalProperties() throws IOException {
    JsonNode root = new ObjectMapper().readTree("{\"type\":\"FeatureCollection\",\"features\":["
        + "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Point\",\"coordinates\":[4.89,52.37]},"
        + "\"properties\":{\"name\":\"Amsterdam Port\",\"asset_type\":\"harbour\","
        + "\"type\":\"commercial\",\"depth\":null}}]}");

    FeatureSet set = FeatureCollectionCodec.decode(root, AssetCategory.HARBOUR);

    Feature feature = set.getFeatures().get(0);
    assertEquals("Amsterdam Port", feature.getName());
    assertEquals("harbour", feature.getAssetType());
    assertEquals("commercial", feature.getAttributes().get("type"));
    assertFalse(feature.getAttributes().containsKey("depth"));
    assertTrue(feature.getTags().isEmpty());
    assertEquals(null, feature.getProviderId());
  }

  @Test void testNonCollectionRejected() throws IOException {
    JsonNode root = new ObjectMapper().readTree("{\"type\":\"Feature\"}");

    assertThrows(IOException.class,
        () -> FeatureCollectionCodec.decode(root, AssetCategory.HARBOUR));
  }

  @Test void testFeatureWithoutCoordinatesRejected() throws IOException {
    JsonNode root = new ObjectMapper().readTree(
        "{\"features\":[{\"geometry\":{\"type\":\"Point\"},\"properties\":{}}]}");

    assertThrows(IOException.class,
        () -> FeatureCollectionCodec.decode(root, AssetCategory.HARBOUR));
  }
}
