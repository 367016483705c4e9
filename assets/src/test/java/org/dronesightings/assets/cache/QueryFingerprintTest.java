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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * Tests for {@link QueryFingerprint}.
 */
@Tag("unit")
public class QueryFingerprintTest {

  @Test void testFirstTwelveHexCharactersOfMd5() {
    // md5("abc") = 900150983cd24fb0d6963f7d28e17f72
    assertEquals("900150983cd2", QueryFingerprint.of("abc").value());
  }

  @Test void testDifferentQueriesDifferentFingerprints() {
    assertNotEquals(QueryFingerprint.of("node[\"military\"](35,-15,72,40);"),
        QueryFingerprint.of("node[\"military\"](35,-15,72,41);"));
  }

  @Test void testEqualityWithParsedValue() {
    QueryFingerprint fingerprint = QueryFingerprint.of("query");
    assertEquals(fingerprint, QueryFingerprint.fromString(fingerprint.value()));
    assertEquals(QueryFingerprint.LENGTH, fingerprint.value().length());
  }
}
