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
package org.neighborhoods.fusion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when neighborhoods and boundaries cannot be paired one-to-one: a
 * neighborhood received no geographic units, a boundary has no neighborhood,
 * a geographic unit could not be assigned at all, or a neighborhood id is
 * used by more than one neighborhood.
 *
 * <p>The fused dataset would be incoherent, so the run is aborted instead of
 * emitting neighborhoods with a missing boundary.
 */
public class UnmatchedBoundaryException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final List<String> neighborhoodsWithoutBoundary;
  private final List<String> boundariesWithoutNeighborhood;
  private final List<String> unassignedUnits;
  private final List<String> repeatedNeighborhoodIds;

  public UnmatchedBoundaryException(String message,
      Collection<String> neighborhoodsWithoutBoundary,
      Collection<String> boundariesWithoutNeighborhood,
      Collection<String> unassignedUnits,
      Collection<String> repeatedNeighborhoodIds) {
    super(message);
    this.neighborhoodsWithoutBoundary = copy(neighborhoodsWithoutBoundary);
    this.boundariesWithoutNeighborhood = copy(boundariesWithoutNeighborhood);
    this.unassignedUnits = copy(unassignedUnits);
    this.repeatedNeighborhoodIds = copy(repeatedNeighborhoodIds);
  }

  /**
   * Creates an exception for neighborhood/boundary identifiers that do not pair up.
   */
  public static UnmatchedBoundaryException unpaired(Collection<String> neighborhoodsWithoutBoundary,
      Collection<String> boundariesWithoutNeighborhood) {
    return new UnmatchedBoundaryException(
        String.format("Boundary join is not one-to-one: %d neighborhood(s) without boundary %s,"
                + " %d boundary(ies) without neighborhood %s",
            neighborhoodsWithoutBoundary.size(), abbreviate(neighborhoodsWithoutBoundary),
            boundariesWithoutNeighborhood.size(), abbreviate(boundariesWithoutNeighborhood)),
        neighborhoodsWithoutBoundary, boundariesWithoutNeighborhood,
        Collections.<String>emptyList(), Collections.<String>emptyList());
  }

  /**
   * Creates an exception for geographic units that have no assigned neighborhood.
   */
  public static UnmatchedBoundaryException unassigned(Collection<String> unitIds) {
    return new UnmatchedBoundaryException(
        String.format("%d geographic unit(s) could not be assigned to a neighborhood: %s",
            unitIds.size(), abbreviate(unitIds)),
        Collections.<String>emptyList(), Collections.<String>emptyList(), unitIds,
        Collections.<String>emptyList());
  }

  /**
   * Creates an exception for neighborhood ids shared by several neighborhoods.
   */
  public static UnmatchedBoundaryException repeated(Collection<String> neighborhoodIds) {
    return new UnmatchedBoundaryException(
        String.format("%d neighborhood id(s) used by more than one neighborhood: %s",
            neighborhoodIds.size(), abbreviate(neighborhoodIds)),
        Collections.<String>emptyList(), Collections.<String>emptyList(),
        Collections.<String>emptyList(), neighborhoodIds);
  }

  public List<String> getNeighborhoodsWithoutBoundary() {
    return neighborhoodsWithoutBoundary;
  }

  public List<String> getBoundariesWithoutNeighborhood() {
    return boundariesWithoutNeighborhood;
  }

  public List<String> getUnassignedUnits() {
    return unassignedUnits;
  }

  public List<String> getRepeatedNeighborhoodIds() {
    return repeatedNeighborhoodIds;
  }

  private static List<String> copy(Collection<String> ids) {
    return Collections.unmodifiableList(new ArrayList<String>(ids));
  }

  private static String abbreviate(Collection<String> ids) {
    List<String> list = new ArrayList<String>(ids);
    if (list.size() <= 10) {
      return list.toString();
    }
    return list.subList(0, 10) + " (+" + (list.size() - 10) + " more)";
  }
}
