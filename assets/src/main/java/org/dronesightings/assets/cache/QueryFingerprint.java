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
package org.dronesightings.assets.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Short deterministic hash of the exact query text used to fetch a category.
 *
 * <p>Part of the cache key: when the query text changes (new tag filters, new
 * regions) the fingerprint changes too, so an entry fetched with an older query
 * is never reused.
 */
public final class QueryFingerprint {
  static final int LENGTH = 12;

  private final String value;

  private QueryFingerprint(String value) {
    this.value = value;
  }

  /** Fingerprint of a query: the first 12 hex characters of its MD5 digest. */
  public static QueryFingerprint of(String query) {
    try {
      MessageDigest md = MessageDigest.getInstance("MD5");
      byte[] digest = md.digest(query.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder();
      for (byte b : digest) {
        hex.append(String.format("%02x", b));
      }
      return new QueryFingerprint(hex.substring(0, LENGTH));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }

  /** Wraps a fingerprint read back from the cache index. */
  public static QueryFingerprint fromString(String value) {
    return new QueryFingerprint(Objects.requireNonNull(value, "value"));
  }

  public String value() {
    return value;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value.equals(((QueryFingerprint) o).value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  @Override public String toString() {
    return value;
  }
}
