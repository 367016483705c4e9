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
package org.dronesightings.assets.strategy;

import org.checkerframework.checker.nullness.qual.Nullable;

/** States of a {@link FetchStrategyChain} for one category. */
public enum ChainState {
  TRY_CACHE(Strategy.CACHE),
  TRY_LIVE_FETCH(Strategy.LIVE_FETCH),
  TRY_ALTERNATE(Strategy.ALTERNATE_SOURCE),
  TRY_FALLBACK(Strategy.STATIC_FALLBACK),
  SATISFIED(null),
  EXHAUSTED_FAILED(null);

  private final @Nullable Strategy strategy;

  ChainState(@Nullable Strategy strategy) {
    this.strategy = strategy;
  }

  /** Strategy tried in this state, or null for terminal states. */
  public @Nullable Strategy strategy() {
    return strategy;
  }

  public boolean isTerminal() {
    return strategy == null;
  }

  /** State entered when the strategy of this state fails or is unavailable. */
  ChainState onFailure() {
    switch (this) {
    case TRY_CACHE:
      return TRY_LIVE_FETCH;
    case TRY_LIVE_FETCH:
      return TRY_ALTERNATE;
    case TRY_ALTERNATE:
      return TRY_FALLBACK;
    case TRY_FALLBACK:
      return EXHAUSTED_FAILED;
    default:
      return this;
    }
  }
}
