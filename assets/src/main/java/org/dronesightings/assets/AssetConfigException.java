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
package org.dronesightings.assets;

/**
 * Configuration error detected before any network activity.
 *
 * <p>This is the only error that terminates a download run: an empty endpoint
 * pool, an unknown category, a category without a fallback strategy, or an
 * unreadable configuration file. Runtime fetch failures never raise it.
 */
public class AssetConfigException extends RuntimeException {

  /**
   * Creates a new AssetConfigException with the specified message.
   */
  public AssetConfigException(String message) {
    super(message);
  }

  /**
   * Creates a new AssetConfigException with the specified message and cause.
   */
  public AssetConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
