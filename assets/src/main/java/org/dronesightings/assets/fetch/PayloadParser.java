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
package org.dronesightings.assets.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Parses a raw response body. A parse failure is a malformed response and is
 * retried exactly like a network failure.
 *
 * @param <T> Parsed payload type
 */
@FunctionalInterface
public interface PayloadParser<T> {

  T parse(String body) throws IOException;

  /** Parser for JSON object payloads such as Overpass and SPARQL results. */
  static PayloadParser<JsonNode> json() {
    ObjectMapper mapper = new ObjectMapper();
    return body -> {
      JsonNode root = mapper.readTree(body);
      if (root == null || !root.isObject()) {
        throw new IOException("Expected a JSON object payload");
      }
      return root;
    };
  }
}
