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

import java.util.Objects;

/**
 * Geographic bounding box in degrees.
 *
 * <p>{@link #toOverpass()} renders the box in Overpass QL order
 * {@code south,west,north,east}.
 */
public final class BoundingBox {
  private final double south;
  private final double west;
  private final double north;
  private final double east;

  public BoundingBox(double south, double west, double north, double east) {
    if (south > north) {
      throw new IllegalArgumentException("south " + south + " is above north " + north);
    }
    this.south = south;
    this.west = west;
    this.north = north;
    this.east = east;
  }

  public double getSouth() {
    return south;
  }

  public double getWest() {
    return west;
  }

  public double getNorth() {
    return north;
  }

  public double getEast() {
    return east;
  }

  /** Returns the box as {@code south,west,north,east} without trailing zeros. */
  public String toOverpass() {
    return format(south) + "," + format(west) + "," + format(north) + "," + format(east);
  }

  private static String format(double value) {
    if (value == Math.rint(value)) {
      return String.valueOf((long) value);
    }
    return Double.toString(value);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BoundingBox that = (BoundingBox) o;
    return Double.compare(south, that.south) == 0
        && Double.compare(west, that.west) == 0
        && Double.compare(north, that.north) == 0
        && Double.compare(east, that.east) == 0;
  }

  @Override public int hashCode() {
    return Objects.hash(south, west, north, east);
  }

  @Override public String toString() {
    return "BoundingBox{" + toOverpass() + "}";
  }
}
