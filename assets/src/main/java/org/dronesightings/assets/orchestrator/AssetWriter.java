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

import org.dronesightings.assets.AssetFetchException;
import org.dronesightings.assets.model.FeatureCollectionCodec;
import org.dronesightings.assets.model.FeatureSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/** Writes one {@code {category}.geojson} feature collection per satisfied category. */
public class AssetWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(AssetWriter.class);

  private final Path assetRoot;
  private final Clock clock;

  public AssetWriter(Path assetRoot, Clock clock) {
    this.assetRoot = assetRoot;
    this.clock = clock;
  }

  /**
   * Writes a feature set, replacing any earlier output of the same category.
   *
   * @param featureSet Features to write
   * @param source Name of the strategy source, recorded in the metadata
   * @return Path of the written file
   * @throws AssetFetchException if the file cannot be written
   */
  public Path write(FeatureSet featureSet, String source) {
    Path target = pathFor(featureSet);
    try {
      long size = FeatureCollectionCodec.write(target, featureSet, source, clock.instant());
      LOGGER.info("Saved {} {} features to {} ({} bytes)", featureSet.size(),
          featureSet.getCategory(), target, size);
      return target;
    } catch (IOException e) {
      throw new AssetFetchException("Failed to write " + target, e);
    }
  }

  Path pathFor(FeatureSet featureSet) {
    return assetRoot.resolve(featureSet.getCategory().key() + ".geojson");
  }
}
