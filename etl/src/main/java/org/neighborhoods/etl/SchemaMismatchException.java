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

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a relation lacks a column that an operation names explicitly:
 * a join key, a value column to rename, or a column the pipeline requires.
 *
 * <p>Schema mismatches are structural; callers are expected to let them
 * abort the run instead of producing all-missing columns.
 */
public class SchemaMismatchException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public SchemaMismatchException(String message) {
    super(message);
  }

  /**
   * Creates an exception describing columns absent from a relation.
   *
   * @param relationName Name used for the relation in the message
   * @param missing Columns that were requested but not found
   * @param available Columns the relation actually has
   */
  public static SchemaMismatchException missingColumns(String relationName,
      Collection<String> missing, List<String> available) {
    return new SchemaMismatchException(
        String.format("%s relation is missing column(s) %s; available columns: %s",
            relationName, missing, available));
  }
}
