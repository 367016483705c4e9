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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Executes a provider query with endpoint selection, rate limiting, bounded
 * retries and exponential backoff.
 *
 * <p>Per attempt the executor picks an endpoint, waits on its own
 * {@link RateLimiter}, sends the query with a bounded timeout and parses the
 * payload. A failed attempt records a failure on the limiter; the next attempt
 * first sleeps {@link BackoffPolicy#retryDelay(int)}. When all attempts fail the
 * result is an explicit failure value, never an exception.
 *
 * @param <T> Parsed payload type
 */
public class QueryExecutor<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

  private final String providerName;
  private final EndpointSelector endpointSelector;
  private final RateLimiter rateLimiter;
  private final QueryTransport transport;
  private final PayloadParser<T> parser;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;
  private final Duration timeout;
  private final CancellationToken cancellation;

  public QueryExecutor(String providerName, EndpointSelector endpointSelector,
      RateLimiter rateLimiter, QueryTransport transport, PayloadParser<T> parser,
      BackoffPolicy backoffPolicy, Sleeper sleeper, Duration timeout,
      CancellationToken cancellation) {
    this.providerName = providerName;
    this.endpointSelector = endpointSelector;
    this.rateLimiter = rateLimiter;
    this.transport = transport;
    this.parser = parser;
    this.backoffPolicy = backoffPolicy;
    this.sleeper = sleeper;
    this.timeout = timeout;
    this.cancellation = cancellation;
  }

  /**
   * Executes a query with up to {@code maxRetries} attempts.
   *
   * @param query Provider query text
   * @param maxRetries Total number of attempts; values below 1 mean one attempt
   * @return Parsed payload, or a failure describing the last attempt
   */
  public QueryResult<T> execute(String query, int maxRetries) {
    int attempts = Math.max(1, maxRetries);
    QueryResult.FailureKind lastKind = QueryResult.FailureKind.TRANSIENT_NETWORK;
    String lastMessage = "no attempt made";

    for (int attempt = 0; attempt < attempts; attempt++) {
      if (cancellation.isCancelled()) {
        LOGGER.info("{} query cancelled before attempt {}", providerName, attempt + 1);
        return QueryResult.failure(QueryResult.FailureKind.CANCELLED, "cancelled", attempt);
      }
      String endpoint;
      String body;
      try {
        if (attempt > 0) {
          Duration delay = backoffPolicy.retryDelay(attempt);
          LOGGER.info("Retry {}: waiting {} ms before next {} attempt",
              attempt, delay.toMillis(), providerName);
          sleeper.sleep(delay);
        }
        endpoint = endpointSelector.pick();
        rateLimiter.waitIfNeeded();
        LOGGER.info("Querying {} (attempt {}/{})", endpoint, attempt + 1, attempts);
        body = transport.send(endpoint, query, timeout);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return QueryResult.failure(QueryResult.FailureKind.CANCELLED, "interrupted", attempt + 1);
      } catch (IOException e) {
        lastKind = QueryResult.FailureKind.TRANSIENT_NETWORK;
        lastMessage = e.getClass().getSimpleName() + ": " + e.getMessage();
        LOGGER.warn("Attempt {} against {} failed: {}", attempt + 1, providerName, lastMessage);
        rateLimiter.recordFailure();
        continue;
      }

      T payload;
      try {
        payload = parser.parse(body);
      } catch (IOException | RuntimeException e) {
        lastKind = QueryResult.FailureKind.MALFORMED_RESPONSE;
        lastMessage = "Malformed response from " + endpoint + ": " + e.getMessage();
        LOGGER.warn("Attempt {} against {} failed: {}", attempt + 1, providerName, lastMessage);
        rateLimiter.recordFailure();
        continue;
      }

      rateLimiter.recordSuccess();
      return QueryResult.success(payload, endpoint, attempt + 1);
    }

    LOGGER.warn("All {} attempts against {} failed", attempts, providerName);
    return QueryResult.failure(lastKind, lastMessage, attempts);
  }

  public String getProviderName() {
    return providerName;
  }

  public RateLimiter getRateLimiter() {
    return rateLimiter;
  }
}
