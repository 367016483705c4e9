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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for request URI construction in {@link HttpQueryTransport}.
 */
@Tag("unit")
public class HttpQueryTransportTest {

  @Test void testQueryIsUrlEncodedIntoParameter() {
    HttpQueryTransport transport = new HttpQueryTransport("data", ImmutableMap.of(), null);

    assertEquals("https://overpass.test/api/interpreter?data=%5Bout%3Ajson%5D%3B",
        transport.buildUri("https://overpass.test/api/interpreter", "[out:json];").toString());
  }

  @Test void testExtraParametersFollowQuery() {
    HttpQueryTransport transport =
        new HttpQueryTransport("query", ImmutableMap.of("format", "json"), null);

    assertEquals("https://wikidata.test/sparql?query=SELECT+1&format=json",
        transport.buildUri("https://wikidata.test/sparql", "SELECT 1").toString());
  }

  @Test void testWithoutQueryParameterEndpointIsFetchedAsIs() {
    HttpQueryTransport transport = new HttpQueryTransport(null, ImmutableMap.of(), "text/csv");

    assertEquals("https://ourairports.test/data/airports.csv",
        transport.buildUri("https://ourairports.test/data/airports.csv", "ignored").toString());
  }

  @Test void testExistingQueryStringIsExtended() {
    HttpQueryTransport transport = new HttpQueryTransport("data", ImmutableMap.of(), null);

    assertEquals("https://mirror.test/api?key=1&data=x",
        transport.buildUri("https://mirror.test/api?key=1", "x").toString());
  }
}
