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
package org.dronesightings.assets.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link BoundingBox}.
 */
@Tag("unit")
public class BoundingBoxTest {

  @Test void testOverpassOrderWithoutTrailingZeros() {
    assertEquals("35,-15,72,40", new BoundingBox(35, -15, 72, 40).toOverpass());
  }

  @Test void testFractionalCoordinatesKept() {
    assertEquals("45.5,8.25,55,20", new BoundingBox(45.5, 8.25, 55, 20).toOverpass());
  }

  @Test void testSouthAboveNorthRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BoundingBox(60, 0, 50, 10));
  }

  @Test void testEquality() {
    assertEquals(new BoundingBox(42, -10, 55, 8), new BoundingBox(42, -10, 55, 8));
  }
}
