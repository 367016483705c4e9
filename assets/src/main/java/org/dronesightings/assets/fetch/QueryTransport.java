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

import java.io.IOException;
import java.time.Duration;

/**
 * Issues one network request for a query against a chosen endpoint.
 *
 * <p>Timeouts, connection errors and non-success statuses surface as
 * {@link IOException} and are retried like any other attempt failure.
 */
@FunctionalInterface
public interface QueryTransport {

  /**
   * Sends a query and returns the raw response body.
   *
   * @param endpoint Endpoint URL chosen by the {@link EndpointSelector}
   * @param query Provider query text
   * @param timeout Per-attempt timeout
   * @return Response body
   * @throws IOException on network failure, timeout or non-success status
   * @throws InterruptedException if the calling thread is interrupted
   */
  String send(String endpoint, String query, Duration timeout)
      throws IOException, InterruptedException;
}
