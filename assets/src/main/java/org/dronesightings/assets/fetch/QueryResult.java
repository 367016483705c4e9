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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of {@link QueryExecutor#execute(String, int)}.
 *
 * <p>A failure is an ordinary value, not an exception: callers treat it as a
 * recoverable per-strategy outcome.
 *
 * @param <T> Parsed payload type
 */
public final class QueryResult<T> {

  /** Why a query produced no payload. */
  public enum FailureKind {
    /** Timeout, connection error or non-success status on the last attempt. */
    TRANSIENT_NETWORK,
    /** Unparseable payload on the last attempt. */
    MALFORMED_RESPONSE,
    /** Cancellation signal or interrupt observed between attempts. */
    CANCELLED
  }

  private final @Nullable T payload;
  private final @Nullable FailureKind failureKind;
  private final @Nullable String message;
  private final @Nullable String endpoint;
  private final int attempts;

  private QueryResult(@Nullable T payload, @Nullable FailureKind failureKind,
      @Nullable String message, @Nullable String endpoint, int attempts) {
    this.payload = payload;
    this.failureKind = failureKind;
    this.message = message;
    this.endpoint = endpoint;
    this.attempts = attempts;
  }

  public static <T> QueryResult<T> success(T payload, String endpoint, int attempts) {
    return new QueryResult<>(payload, null, null, endpoint, attempts);
  }

  public static <T> QueryResult<T> failure(FailureKind kind, String message, int attempts) {
    return new QueryResult<>(null, kind, message, null, attempts);
  }

  public boolean isSuccess() {
    return failureKind == null;
  }

  /**
   * Returns the parsed payload.
   *
   * @throws IllegalStateException if this is a failure
   */
  public T getPayload() {
    if (payload == null) {
      throw new IllegalStateException("No payload: " + this);
    }
    return payload;
  }

  public @Nullable FailureKind getFailureKind() {
    return failureKind;
  }

  public @Nullable String getMessage() {
    return message;
  }

  public @Nullable String getEndpoint() {
    return endpoint;
  }

  public int getAttempts() {
    return attempts;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("QueryResult{");
    if (isSuccess()) {
      sb.append("success, endpoint=").append(endpoint);
    } else {
      sb.append(failureKind).append(", error=").append(message);
    }
    sb.append(", attempts=").append(attempts).append("}");
    return sb.toString();
  }
}
