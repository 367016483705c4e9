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
import org.dronesightings.assets.AssetConfigException;
import org.dronesightings.assets.OrchestratorConfig;
import org.dronesightings.assets.fetch.CancellationToken;
import org.dronesightings.assets.fetch.Sleeper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Command line entry point for downloading infrastructure assets. */
@CommandLine.Command(name = "asset-download",
    mixinStandardHelpOptions = true,
    header = "Download infrastructure asset layers with rate limiting and fallbacks",
    description = "Downloads each requested asset category in order, trying the cache, "
        + "the live provider, alternate providers and bundled fallback data.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: every category was downloaded",
        "1: at least one category failed",
        "2: invalid configuration"
    })
public class AssetDownloadCommand implements Callable<Integer> {
  private static final Logger LOGGER = LoggerFactory.getLogger(AssetDownloadCommand.class);

  static final int EXIT_OK = 0;
  static final int EXIT_PARTIAL = 1;
  static final int EXIT_CONFIG = 2;

  /** How long the shutdown hook waits for the run to write its report. */
  static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

  @CommandLine.Parameters(arity = "0..*", paramLabel = "CATEGORY",
      description = "Categories to download (airport, harbour, military, energy, rail, "
          + "border, critical, infrastructure); defaults to the configured list")
  private List<String> categories = new ArrayList<>();

  @CommandLine.Option(names = {"-c", "--config"},
      description = "YAML or JSON configuration file")
  private @Nullable Path configFile;

  @CommandLine.Option(names = {"--asset-root"}, description = "Output directory for layers")
  private @Nullable Path assetRoot;

  @CommandLine.Option(names = {"--cache-root"}, description = "Cache directory")
  private @Nullable Path cacheRoot;

  @CommandLine.Option(names = {"--report-dir"}, description = "Directory for run reports")
  private @Nullable Path reportRoot;

  @CommandLine.Option(names = {"--no-cache"}, description = "Skip cache reads and writes")
  private boolean noCache;

  @CommandLine.Option(names = {"--no-alternate"}, description = "Skip alternate providers")
  private boolean noAlternate;

  private final ProviderTransports transports;
  private volatile @Nullable CancelOnShutdown shutdownHandler;

  public AssetDownloadCommand() {
    this(ProviderTransports.http());
  }

  AssetDownloadCommand(ProviderTransports transports) {
    this.transports = transports;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new AssetDownloadCommand())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .execute(args);
    System.exit(exitCode);
  }

  @Override public Integer call() {
    OrchestratorConfig config;
    List<AssetCategory> requested = new ArrayList<>();
    try {
      config = resolveConfig();
      for (String name : categories) {
        requested.add(AssetCategory.fromKey(name));
      }
      if (requested.isEmpty()) {
        requested.addAll(config.getCategories());
      }
    } catch (AssetConfigException e) {
      LOGGER.error("Invalid configuration: {}", e.getMessage());
      return EXIT_CONFIG;
    }

    CancellationToken cancellation = CancellationToken.create();
    CancelOnShutdown onShutdown =
        new CancelOnShutdown(cancellation, Thread.currentThread(), SHUTDOWN_GRACE);
    Thread hook = new Thread(onShutdown, "asset-download-cancel");
    Runtime.getRuntime().addShutdownHook(hook);
    shutdownHandler = onShutdown;
    try {
      DownloadOrchestrator orchestrator = DownloadOrchestrator.create(config, transports,
          sleeper(), new Random(), Clock.systemUTC(), cancellation);
      RunReport report = orchestrator.run(requested);
      return report.getFailedCategories().isEmpty() && !report.isCancelled()
          ? EXIT_OK
          : EXIT_PARTIAL;
    } catch (AssetConfigException e) {
      LOGGER.error("Invalid configuration: {}", e.getMessage());
      return EXIT_CONFIG;
    } finally {
      onShutdown.finished();
      shutdownHandler = null;
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException e) {
        LOGGER.debug("JVM shutting down; cancellation hook stays registered");
      }
    }
  }

  /** Handler of the shutdown hook registered by a call in progress, if any. */
  @Nullable CancelOnShutdown shutdownHandler() {
    return shutdownHandler;
  }

  /** Sleeper used for all waits; overridable so tests do not sleep. */
  protected Sleeper sleeper() {
    return Sleeper.SYSTEM;
  }

  OrchestratorConfig resolveConfig() {
    OrchestratorConfig base = configFile != null
        ? OrchestratorConfig.load(configFile)
        : OrchestratorConfig.defaults();
    if (assetRoot == null && cacheRoot == null && reportRoot == null && !noCache
        && !noAlternate) {
      return base;
    }
    OrchestratorConfig.Builder builder = base.toBuilder();
    if (assetRoot != null) {
      builder.assetRoot(assetRoot);
    }
    if (cacheRoot != null) {
      builder.cacheRoot(cacheRoot);
    }
    if (reportRoot != null) {
      builder.reportRoot(reportRoot);
    }
    if (noCache) {
      builder.enableCache(false);
    }
    if (noAlternate) {
      builder.enableAlternateSources(false);
    }
    return builder.build();
  }

  /**
   * Shutdown hook body. Cancels the run, wakes the worker from any wait and
   * keeps the JVM alive until the run has finished or the grace period ends,
   * so an interrupted run still writes its report.
   */
  static final class CancelOnShutdown implements Runnable {
    private final CancellationToken cancellation;
    private final Thread worker;
    private final Duration grace;
    private final CountDownLatch done = new CountDownLatch(1);

    CancelOnShutdown(CancellationToken cancellation, Thread worker, Duration grace) {
      this.cancellation = cancellation;
      this.worker = worker;
      this.grace = grace;
    }

    @Override public void run() {
      LOGGER.warn("Shutdown requested, cancelling download run");
      cancellation.cancel();
      worker.interrupt();
      try {
        if (!done.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
          LOGGER.warn("Download run did not finish within {} s of shutdown",
              grace.getSeconds());
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.warn("Interrupted while waiting for the download run to finish");
      }
    }

    void finished() {
      done.countDown();
    }
  }
}
