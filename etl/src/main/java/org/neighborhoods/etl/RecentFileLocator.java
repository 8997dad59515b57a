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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.stream.Stream;

/**
 * Locates the most recently modified CSV file in a directory whose name contains an identifier.
 *
 * <p>Source tables are dropped into directories as dated downloads (for example
 * {@code Neighborhood_zhvi_uc_sfrcondo_tier_0.33_0.67_sm_sa_month.csv}); the newest
 * matching file wins. Equal modification times are broken by file name, last wins.
 */
public class RecentFileLocator {
  private static final Logger LOGGER = LoggerFactory.getLogger(RecentFileLocator.class);

  /**
   * Finds the newest matching CSV file.
   *
   * @param directory Directory to search (not recursive)
   * @param identifier Substring the file name must contain
   * @return Path of the newest matching file
   * @throws IOException If the directory cannot be listed or nothing matches
   */
  public Path findMostRecent(Path directory, String identifier) throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new NoSuchFileException(directory.toString(), null, "not a directory");
    }
    Path best = null;
    FileTime bestTime = null;
    try (Stream<Path> files = Files.list(directory)) {
      for (Path file : (Iterable<Path>) files::iterator) {
        String name = file.getFileName().toString();
        if (!Files.isRegularFile(file) || !name.endsWith(".csv") || !name.contains(identifier)) {
          continue;
        }
        FileTime time = Files.getLastModifiedTime(file);
        int cmp = bestTime == null ? 1 : time.compareTo(bestTime);
        if (cmp > 0 || (cmp == 0 && name.compareTo(best.getFileName().toString()) > 0)) {
          best = file;
          bestTime = time;
        }
      }
    }
    if (best == null) {
      throw new IOException("No CSV file containing '" + identifier + "' in " + directory);
    }
    LOGGER.info("Using {} for '{}'", best.getFileName(), identifier);
    return best;
  }
}
