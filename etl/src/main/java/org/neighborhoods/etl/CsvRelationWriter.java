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
package org.neighborhoods.etl;

import com.opencsv.CSVWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link Relation} as CSV with a header row. Missing values are written as empty cells.
 */
public class CsvRelationWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvRelationWriter.class);

  public void write(Relation relation, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(relation, writer);
    }
    LOGGER.info("Wrote {} rows to {}", relation.size(), file);
  }

  /**
   * Writes CSV content to a writer. The writer is flushed but not closed.
   */
  public void write(Relation relation, Writer target) throws IOException {
    CSVWriter csvWriter = new CSVWriter(target);
    csvWriter.writeNext(relation.getColumns().toArray(new String[0]), false);
    int width = relation.getColumns().size();
    for (int r = 0; r < relation.size(); r++) {
      String[] line = new String[width];
      for (int c = 0; c < width; c++) {
        line[c] = format(relation.get(r, c));
      }
      csvWriter.writeNext(line, false);
    }
    csvWriter.flush();
    if (csvWriter.checkError()) {
      throw new IOException("Failed writing CSV output");
    }
  }

  static String format(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return "";
      }
    }
    return String.valueOf(value);
  }
}
