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
 * Polite querying of remote providers.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link org.dronesightings.assets.fetch.RateLimiter} - Minimum spacing between
 *       requests, tripled after every consecutive failure</li>
 *   <li>{@link org.dronesightings.assets.fetch.EndpointSelector} - Random choice among
 *       equivalent mirrors</li>
 *   <li>{@link org.dronesightings.assets.fetch.QueryExecutor} - Bounded retries with
 *       jittered exponential backoff</li>
 *   <li>{@link org.dronesightings.assets.fetch.RegionChunker} - Splits a large area into
 *       regions queried one after another</li>
 * </ul>
 *
 * <p>All waits go through {@link org.dronesightings.assets.fetch.Sleeper} and all network
 * traffic through {@link org.dronesightings.assets.fetch.QueryTransport}.
 */
package org.dronesightings.assets.fetch;
