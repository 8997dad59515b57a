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
package org.neighborhoods.fusion.output;

import org.neighborhoods.etl.CsvRelationWriter;
import org.neighborhoods.etl.Relation;
import org.neighborhoods.fusion.pipeline.FusedNeighborhood;
import org.neighborhoods.fusion.pipeline.FusionResult;
import org.neighborhoods.fusion.pipeline.NeighborhoodColumns;

import org.locationtech.jts.io.WKTWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes fused neighborhoods as a flat CSV table: every attribute column
 * followed by the boundary as WKT in a {@code geometry} column.
 */
public class NeighborhoodCsvWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(NeighborhoodCsvWriter.class);

  private final CsvRelationWriter csvWriter = new CsvRelationWriter();

  public void write(FusionResult result, Path file) throws IOException {
    csvWriter.write(toRelation(result), file);
    LOGGER.info("Wrote {} neighborhoods to {}", result.getNeighborhoodCount(), file);
  }

  public void write(FusionResult result, Writer target) throws IOException {
    csvWriter.write(toRelation(result), target);
  }

  /**
   * Returns the output table: the result's attribute columns plus WKT geometry.
   */
  Relation toRelation(FusionResult result) {
    Relation table = result.getTable();
    if (table.hasColumn(NeighborhoodColumns.GEOMETRY)) {
      throw new IllegalStateException("Attribute table already has a '"
          + NeighborhoodColumns.GEOMETRY + "' column");
    }
    List<String> columns = new ArrayList<String>(table.getColumns());
    columns.add(NeighborhoodColumns.GEOMETRY);
    WKTWriter wkt = new WKTWriter();
    Relation.Builder builder = Relation.builder(columns);
    for (FusedNeighborhood neighborhood : result.getNeighborhoods()) {
      List<Object> row = new ArrayList<Object>(columns.size());
      for (String column : table.getColumns()) {
        row.add(neighborhood.getAttributes().get(column));
      }
      row.add(wkt.write(neighborhood.getBoundary()));
      builder.addRow(row.toArray());
    }
    return builder.build();
  }
}
