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

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a CSV file with a header row into a {@link Relation}.
 *
 * <p>All cells are read as strings so identifiers keep their leading zeros
 * (county FIPS codes, for example). Empty cells become missing values.
 * Numeric interpretation is left to the consumer.
 */
public class CsvRelationReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvRelationReader.class);
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  /**
   * Reads a UTF-8 CSV file.
   *
   * @param file Path of the CSV file
   * @return Relation with the header's columns
   * @throws IOException If the file cannot be read or is malformed
   */
  public Relation read(Path file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Relation relation = read(reader);
      LOGGER.info("Read {} rows x {} columns from {}",
          relation.size(), relation.getColumns().size(), file);
      return relation;
    }
  }

  /**
   * Reads CSV content from a reader. The reader is not closed.
   */
  public Relation read(Reader source) throws IOException {
    CSVReader csvReader = new CSVReaderBuilder(source).build();
    try {
      String[] header = csvReader.readNext();
      if (header == null) {
        throw new IOException("CSV input is empty; a header row is required");
      }
      if (header.length > 0 && !header[0].isEmpty() && header[0].charAt(0) == BYTE_ORDER_MARK) {
        header[0] = header[0].substring(1);
      }
      List<Object[]> rows = new ArrayList<Object[]>();
      String[] line;
      while ((line = csvReader.readNext()) != null) {
        if (line.length == 1 && line[0].isEmpty()) {
          continue;
        }
        if (line.length > header.length) {
          throw new IOException("CSV line " + csvReader.getLinesRead() + " has "
              + line.length + " cells but the header has " + header.length);
        }
        Object[] row = new Object[header.length];
        for (int i = 0; i < line.length; i++) {
          row[i] = line[i].isEmpty() ? null : line[i];
        }
        rows.add(row);
      }
      return Relation.of(Arrays.asList(header), rows);
    } catch (CsvValidationException e) {
      throw new IOException("Malformed CSV: " + e.getMessage(), e);
    }
  }
}
