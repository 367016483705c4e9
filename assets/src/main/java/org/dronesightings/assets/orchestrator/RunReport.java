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

import org.dronesightings.assets.AssetCategory;
import org.dronesightings.assets.AssetFetchException;
import org.dronesightings.assets.strategy.StrategyAttempt;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one download run: every strategy attempt in order plus totals.
 *
 * <p>Immutable once built; written to disk once per run under a unique name.
 */
@JsonPropertyOrder({"started", "completed", "total_time", "operations", "total_features",
    "successful_downloads", "total_downloads", "success_rate", "failed_categories",
    "cancelled"})
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class RunReport {
  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Instant started;
  private final Instant completed;
  private final ImmutableList<StrategyAttempt> attempts;
  private final ImmutableList<AssetCategory> requested;
  private final ImmutableList<AssetCategory> failed;
  private final int successful;
  private final long totalFeatures;
  private final boolean cancelled;

  private RunReport(Builder builder, Instant completed) {
    this.started = builder.started;
    this.completed = completed;
    this.attempts = ImmutableList.copyOf(builder.attempts);
    this.requested = ImmutableList.copyOf(builder.requested);
    this.failed = ImmutableList.copyOf(builder.failed);
    this.successful = builder.successful;
    this.totalFeatures = builder.totalFeatures;
    this.cancelled = builder.cancelled;
  }

  static Builder builder(Instant started, List<AssetCategory> requested) {
    return new Builder(started, requested);
  }

  public Instant getStarted() {
    return started;
  }

  @JsonProperty("started")
  String getStartedText() {
    return started.toString();
  }

  public Instant getCompleted() {
    return completed;
  }

  @JsonProperty("completed")
  String getCompletedText() {
    return completed.toString();
  }

  @JsonProperty("total_time")
  public double getTotalTimeSeconds() {
    return Duration.between(started, completed).toMillis() / 1000.0;
  }

  @JsonProperty("operations")
  public ImmutableList<StrategyAttempt> getAttempts() {
    return attempts;
  }

  @JsonProperty("total_features")
  public long getTotalFeatures() {
    return totalFeatures;
  }

  @JsonProperty("successful_downloads")
  public int getSuccessfulDownloads() {
    return successful;
  }

  /** Number of requested categories, including any skipped by cancellation. */
  @JsonProperty("total_downloads")
  public int getTotalDownloads() {
    return requested.size();
  }

  @JsonProperty("success_rate")
  public double getSuccessRate() {
    return requested.isEmpty() ? 0.0 : (double) successful / requested.size();
  }

  public ImmutableList<AssetCategory> getFailedCategories() {
    return failed;
  }

  @JsonProperty("failed_categories")
  List<String> getFailedCategoryKeys() {
    List<String> keys = new ArrayList<>();
    for (AssetCategory category : failed) {
      keys.add(category.key());
    }
    return keys;
  }

  @JsonProperty("cancelled")
  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Writes the report as {@code download_report_{epochMillis}.json} in a
   * directory, adding a counter when that name is taken.
   *
   * @return Path of the written report
   * @throws AssetFetchException if the report cannot be written
   */
  public Path writeTo(Path directory) {
    try {
      Files.createDirectories(directory);
      String base = "download_report_" + completed.toEpochMilli();
      Path target = directory.resolve(base + ".json");
      int suffix = 1;
      while (Files.exists(target)) {
        target = directory.resolve(base + "_" + suffix++ + ".json");
      }
      MAPPER.writeValue(target.toFile(), this);
      return target;
    } catch (IOException e) {
      throw new AssetFetchException("Failed to write download report to " + directory, e);
    }
  }

  String toJson() throws IOException {
    return MAPPER.writeValueAsString(this);
  }

  /** Accumulates attempts during a run. */
  static final class Builder {
    private final Instant started;
    private final List<AssetCategory> requested;
    private final List<StrategyAttempt> attempts = new ArrayList<>();
    private final List<AssetCategory> failed = new ArrayList<>();
    private int successful;
    private long totalFeatures;
    private boolean cancelled;

    private Builder(Instant started, List<AssetCategory> requested) {
      this.started = started;
      this.requested = requested;
    }

    Builder addAttempts(List<StrategyAttempt> categoryAttempts) {
      attempts.addAll(categoryAttempts);
      return this;
    }

    Builder succeeded(int featureCount) {
      successful++;
      totalFeatures += featureCount;
      return this;
    }

    Builder failed(AssetCategory category) {
      failed.add(category);
      return this;
    }

    Builder cancelled() {
      cancelled = true;
      return this;
    }

    RunReport build(Instant completed) {
      return new RunReport(this, completed);
    }
  }
}
