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

/**
 * Neighborhood boundary synthesis.
 *
 * <p>Joins housing and walkability metrics onto named neighborhood points,
 * assigns census geographic units (tracts, block groups or blocks) to their
 * nearest neighborhood, dissolves each neighborhood's units into a single
 * boundary and derives area and density metrics.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code spatial} - reference systems, reprojection, nearest assignment, dissolve</li>
 *   <li>{@code geo} - the TIGERweb geography service</li>
 *   <li>{@code walkscore} - neighborhood walkability pages</li>
 *   <li>{@code metrics} - derived numeric fields</li>
 *   <li>{@code pipeline} - configuration and the ordered fusion run</li>
 *   <li>{@code output} - CSV and GeoJSON writers</li>
 *   <li>{@code cli} - command line entry point</li>
 * </ul>
 */
package org.neighborhoods.fusion;
