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

import org.dronesightings.assets.AssetConfigException;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Random;

/**
 * Spreads load across a pool of equivalent service mirrors by picking one
 * uniformly at random for every request. No stickiness and no health tracking.
 */
public class EndpointSelector {
  private final ImmutableList<String> endpoints;
  private final Random random;

  public EndpointSelector(List<String> endpoints) {
    this(endpoints, new Random());
  }

  public EndpointSelector(List<String> endpoints, Random random) {
    if (endpoints == null || endpoints.isEmpty()) {
      throw new AssetConfigException("Endpoint pool must contain at least one endpoint");
    }
    this.endpoints = ImmutableList.copyOf(endpoints);
    this.random = random;
  }

  public String pick() {
    return endpoints.get(random.nextInt(endpoints.size()));
  }

  public ImmutableList<String> getEndpoints() {
    return endpoints;
  }
}
