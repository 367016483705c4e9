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

import org.dronesightings.assets.AssetCategory;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

/** Record of one strategy attempt for one category; serialized into run reports. */
@JsonPropertyOrder({"asset_type", "strategy", "duration_ms", "timestamp", "success",
    "record_count", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class StrategyAttempt {
  private final AssetCategory category;
  private final Strategy strategy;
  private final long durationMs;
  private final boolean success;
  private final Instant timestamp;
  private final int recordCount;
  private final @Nullable String error;

  private StrategyAttempt(AssetCategory category, Strategy strategy, long durationMs,
      boolean success, Instant timestamp, int recordCount, @Nullable String error) {
    this.category = category;
    this.strategy = strategy;
    this.durationMs = durationMs;
    this.success = success;
    this.timestamp = timestamp;
    this.recordCount = recordCount;
    this.error = error;
  }

  public static StrategyAttempt success(AssetCategory category, Strategy strategy,
      long durationMs, Instant timestamp, int recordCount) {
    return new StrategyAttempt(category, strategy, durationMs, true, timestamp,
        recordCount, null);
  }

  public static StrategyAttempt failure(AssetCategory category, Strategy strategy,
      long durationMs, Instant timestamp, String error) {
    return new StrategyAttempt(category, strategy, durationMs, false, timestamp, 0, error);
  }

  public AssetCategory getCategory() {
    return category;
  }

  @JsonProperty("asset_type")
  public String getCategoryKey() {
    return category.key();
  }

  public Strategy getStrategy() {
    return strategy;
  }

  @JsonProperty("strategy")
  public String getStrategyName() {
    return strategy.reportName();
  }

  @JsonProperty("duration_ms")
  public long getDurationMs() {
    return durationMs;
  }

  @JsonProperty("success")
  public boolean isSuccess() {
    return success;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  @JsonProperty("timestamp")
  public String getTimestampText() {
    return timestamp.toString();
  }

  @JsonProperty("record_count")
  public int getRecordCount() {
    return recordCount;
  }

  @JsonProperty("error")
  public @Nullable String getError() {
    return error;
  }

  @Override public String toString() {
    return category + "/" + strategy.reportName() + (success
        ? " succeeded with " + recordCount + " records"
        : " failed: " + error) + " in " + durationMs + "ms";
  }
}
