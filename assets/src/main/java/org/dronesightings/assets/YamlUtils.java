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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads YAML or JSON configuration into a Jackson tree.
 *
 * <p>YAML is parsed with SnakeYAML so that anchors and aliases are resolved
 * before conversion; JSON goes straight through Jackson.
 */
public final class YamlUtils {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private YamlUtils() {
  }

  /**
   * Parses a YAML or JSON stream; the format is chosen by the resource name's
   * extension.
   *
   * @param stream Stream with YAML or JSON data
   * @param resourceName File or resource name, used only for its extension
   * @return Parsed tree; an empty YAML document yields a missing node
   * @throws IOException if the data cannot be read or parsed
   */
  public static JsonNode parseYamlOrJson(InputStream stream, String resourceName)
      throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(100);
      Object parsed;
      try {
        parsed = new Yaml(loaderOptions).load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      return parsed == null
          ? JSON_MAPPER.missingNode()
          : JSON_MAPPER.convertValue(parsed, JsonNode.class);
    }
    return JSON_MAPPER.readTree(stream);
  }

  /** Parses a YAML or JSON file. */
  public static JsonNode parseYamlOrJson(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return parseYamlOrJson(in, file.getFileName().toString());
    }
  }
}
