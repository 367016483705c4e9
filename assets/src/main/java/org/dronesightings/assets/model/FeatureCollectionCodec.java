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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes {@link FeatureSet}s as GeoJSON feature collections.
 *
 * <p>Each feature is a {@code Point} whose properties hold {@code name},
 * {@code provider_id}, the attribute bag flattened into the properties object,
 * and the raw provider tags under {@code tags}. The collection carries a
 * {@code metadata} object with generation time, category, count and source.
 */
public final class FeatureCollectionCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final DateTimeFormatter GENERATED_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  private static final String NAME = "name";
  private static final String PROVIDER_ID = "provider_id";
  private static final String TAGS = "tags";

  private FeatureCollectionCodec() {
  }

  /**
   * Builds the GeoJSON tree for a feature set.
   *
   * @param featureSet Features to encode
   * @param source Name of the strategy or provider that produced the set
   * @param generated Generation timestamp recorded in the metadata
   * @return FeatureCollection object node
   */
  public static ObjectNode encode(FeatureSet featureSet, String source, Instant generated) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("type", "FeatureCollection");
    ArrayNode features = root.putArray("features");
    for (Feature feature : featureSet.getFeatures()) {
      features.add(encodeFeature(feature));
    }
    ObjectNode metadata = root.putObject("metadata");
    metadata.put("generated", GENERATED_FORMAT.format(generated));
    metadata.put("asset_type", featureSet.getCategory().key());
    metadata.put("count", featureSet.size());
    metadata.put("source", source);
    return root;
  }

  private static ObjectNode encodeFeature(Feature feature) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("type", "Feature");
    ObjectNode geometry = node.putObject("geometry");
    geometry.put("type", "Point");
    ArrayNode coordinates = geometry.putArray("coordinates");
    coordinates.add(feature.getLongitude());
    coordinates.add(feature.getLatitude());

    ObjectNode properties = node.putObject("properties");
    properties.put(NAME, feature.getName());
    if (feature.getProviderId() != null) {
      properties.put(PROVIDER_ID, feature.getProviderId());
    }
    for (Map.Entry<String, String> attribute : feature.getAttributes().entrySet()) {
      properties.put(attribute.getKey(), attribute.getValue());
    }
    ObjectNode tags = properties.putObject(TAGS);
    for (Map.Entry<String, String> tag : feature.getTags().entrySet()) {
      tags.put(tag.getKey(), tag.getValue());
    }
    return node;
  }

  /** Writes a feature set to {@code path} in compact form, creating parent directories. */
  public static long write(Path path, FeatureSet featureSet, String source, Instant generated)
      throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    MAPPER.writeValue(path.toFile(), encode(featureSet, source, generated));
    return Files.size(path);
  }

  /** Reads a feature collection file as a feature set of the given category. */
  public static FeatureSet read(Path path, AssetCategory category) throws IOException {
    return decode(MAPPER.readTree(path.toFile()), category);
  }

  /** Reads a feature collection from a stream, e.g. a bundled classpath resource. */
  public static FeatureSet read(InputStream stream, AssetCategory category) throws IOException {
    return decode(MAPPER.readTree(stream), category);
  }

  /**
   * Decodes a GeoJSON FeatureCollection tree.
   *
   * @throws IOException if the tree is not a feature collection of points
   */
  public static FeatureSet decode(JsonNode root, AssetCategory category) throws IOException {
    if (root == null || !root.path("features").isArray()) {
      throw new IOException("Not a GeoJSON FeatureCollection");
    }
    List<Feature> features = new ArrayList<>();
    for (JsonNode node : root.get("features")) {
      features.add(decodeFeature(node));
    }
    return new FeatureSet(category, features);
  }

  private static Feature decodeFeature(JsonNode node) throws IOException {
    JsonNode coordinates = node.path("geometry").path("coordinates");
    if (!coordinates.isArray() || coordinates.size() < 2) {
      throw new IOException("Feature without point coordinates: " + node);
    }
    JsonNode properties = node.path("properties");
    Map<String, String> attributes = new LinkedHashMap<>();
    Map<String, String> tags = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String key = field.getKey();
      JsonNode value = field.getValue();
      if (NAME.equals(key) || PROVIDER_ID.equals(key)) {
        continue;
      }
      if (TAGS.equals(key)) {
        Iterator<Map.Entry<String, JsonNode>> tagFields = value.fields();
        while (tagFields.hasNext()) {
          Map.Entry<String, JsonNode> tag = tagFields.next();
          tags.put(tag.getKey(), tag.getValue().asText());
        }
      } else if (value.isValueNode() && !value.isNull()) {
        attributes.put(key, value.asText());
      }
    }
    JsonNode providerId = properties.get(PROVIDER_ID);
    return new Feature(
        coordinates.get(0).asDouble(),
        coordinates.get(1).asDouble(),
        properties.path(NAME).asText(""),
        attributes,
        tags,
        providerId != null && !providerId.isNull() ? providerId.asText() : null);
  }
}
