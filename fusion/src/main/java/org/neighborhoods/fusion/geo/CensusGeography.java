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
package org.neighborhoods.fusion.geo;

import java.util.Locale;

/**
 * Census geographic unit granularity, coarse to fine. Each value maps to a
 * layer of the TIGERweb {@code Tracts_Blocks} map service.
 */
public enum CensusGeography {
  TRACT("tract", 0),
  BLOCK_GROUP("block_group", 1),
  BLOCK("block", 2);

  private final String name;
  private final int layer;

  CensusGeography(String name, int layer) {
    this.name = name;
    this.layer = layer;
  }

  /** Name used in configuration and output file names. */
  public String getName() {
    return name;
  }

  public int getLayer() {
    return layer;
  }

  /**
   * Parses {@code tract}, {@code block_group} or {@code block}
   * (case-insensitive; {@code block-group} also accepted).
   */
  public static CensusGeography fromName(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (CensusGeography g : values()) {
      if (g.name.equals(normalized)) {
        return g;
      }
    }
    throw new IllegalArgumentException("Unknown census geography '" + value
        + "'; expected tract, block_group or block");
  }
}
