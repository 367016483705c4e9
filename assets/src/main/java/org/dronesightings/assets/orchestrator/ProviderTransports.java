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
package org.dronesightings.assets.orchestrator;

import org.dronesightings.assets.fetch.HttpQueryTransport;
import org.dronesightings.assets.fetch.QueryTransport;

import com.google.common.collect.ImmutableMap;

/** Transport used to reach each provider. */
public final class ProviderTransports {
  private final QueryTransport overpass;
  private final QueryTransport airportCsv;
  private final QueryTransport wikidata;

  public ProviderTransports(QueryTransport overpass, QueryTransport airportCsv,
      QueryTransport wikidata) {
    this.overpass = overpass;
    this.airportCsv = airportCsv;
    this.wikidata = wikidata;
  }

  /** HTTP transports for the public providers. */
  public static ProviderTransports http() {
    return new ProviderTransports(
        new HttpQueryTransport("data", ImmutableMap.of(), "application/json"),
        new HttpQueryTransport(null, ImmutableMap.of(), "text/csv"),
        new HttpQueryTransport("query", ImmutableMap.of("format", "json"),
            "application/sparql-results+json"));
  }

  /** Overpass API, query sent as the {@code data} parameter. */
  public QueryTransport overpass() {
    return overpass;
  }

  /** Plain GET of the airport CSV table, primary and mirror alike. */
  public QueryTransport airportCsv() {
    return airportCsv;
  }

  /** Wikidata SPARQL endpoint. */
  public QueryTransport wikidata() {
    return wikidata;
  }
}
