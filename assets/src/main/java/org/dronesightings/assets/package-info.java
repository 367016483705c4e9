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

/**
 * Acquisition of European infrastructure asset layers for the drone
 * sightings map.
 *
 * <p>Each asset category (airports, harbours, military sites, energy
 * facilities and so on) is downloaded from rate-limited public providers and
 * written as a GeoJSON layer. Downloads go through a fixed chain of
 * strategies: a local cache, the live provider, alternate providers and a
 * bundled fallback dataset.
 *
 * <p>{@link org.dronesightings.assets.OrchestratorConfig} holds the run
 * settings and can be loaded from YAML or JSON.
 */
package org.dronesightings.assets;
