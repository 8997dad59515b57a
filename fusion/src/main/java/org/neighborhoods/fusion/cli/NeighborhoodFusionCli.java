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
package org.neighborhoods.fusion.cli;

import org.neighborhoods.etl.CsvRelationReader;
import org.neighborhoods.etl.CsvRelationWriter;
import org.neighborhoods.etl.RecentFileLocator;
import org.neighborhoods.etl.Relation;
import org.neighborhoods.fusion.geo.CensusGeography;
import org.neighborhoods.fusion.geo.TigerWebClient;
import org.neighborhoods.fusion.output.NeighborhoodCsvWriter;
import org.neighborhoods.fusion.output.NeighborhoodGeoJsonWriter;
import org.neighborhoods.fusion.pipeline.FusionConfig;
import org.neighborhoods.fusion.pipeline.FusionInputs;
import org.neighborhoods.fusion.pipeline.FusionPipeline;
import org.neighborhoods.fusion.pipeline.FusionResult;
import org.neighborhoods.fusion.pipeline.NeighborhoodColumns;
import org.neighborhoods.fusion.walkscore.CityState;
import org.neighborhoods.fusion.walkscore.WalkScoreCollector;
import org.neighborhoods.fusion.walkscore.WalkScoreScraper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point.
 *
 * <p>Usage:
 * <pre>
 * java -jar neighborhood-fusion.jar \
 *   --zhvi-directory zhvi_assets --zori-directory zori_assets \
 *   --spatial-directory spatial_assets --walkscore-directory csvs \
 *   --geojson-directory geojsons --csv-directory csvs \
 *   --census-geography block_group [--config fusion.yaml] [--scrape-walkscores]
 * </pre>
 *
 * <p>Each input directory is searched for the most recently modified CSV
 * whose name contains {@code Neighborhood} / {@code City} (Zillow tables),
 * {@code neighborhoods} (points) or {@code walkscores}. Options may also be
 * spelled with underscores ({@code --zhvi_directory}).
 */
public class NeighborhoodFusionCli {
  private static final Logger LOGGER = LoggerFactory.getLogger(NeighborhoodFusionCli.class);

  static final String WALKSCORES_FILE = "walkscores.csv";

  private final RecentFileLocator locator = new RecentFileLocator();
  private final CsvRelationReader reader = new CsvRelationReader();

  public static void main(String[] args) {
    Options options;
    try {
      options = Options.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(Options.USAGE);
      System.exit(2);
      return;
    }
    try {
      new NeighborhoodFusionCli().run(options);
    } catch (Exception e) {
      LOGGER.error("Neighborhood fusion failed", e);
      System.exit(1);
    }
  }

  /**
   * Loads the sources, runs the fusion and writes both outputs.
   */
  public FusionResult run(Options options) throws IOException {
    FusionConfig config = options.configFile != null
        ? FusionConfig.fromYaml(options.configFile)
        : FusionConfig.defaults();
    if (options.geography != null) {
      config = config.withGeography(options.geography);
    }
    LOGGER.info("Configuration: {}", config);

    Relation points = read(options.spatialDirectory, "neighborhoods");
    FusionInputs inputs = FusionInputs.builder()
        .neighborhoodPoints(points)
        .neighborhoodValues(read(options.zhviDirectory, "Neighborhood"))
        .cityHomeValues(read(options.zhviDirectory, "City"))
        .cityRentValues(read(options.zoriDirectory, "City"))
        .walkScores(walkScores(options, config, points))
        .build();

    FusionPipeline pipeline = new FusionPipeline(config,
        new TigerWebClient(config.getGeographyService()));
    FusionResult result = pipeline.run(inputs);

    String baseName = config.getGeography().getName() + "_neighborhoods";
    new NeighborhoodCsvWriter().write(result,
        options.csvDirectory.resolve(baseName + ".csv"));
    new NeighborhoodGeoJsonWriter().write(result,
        options.geojsonDirectory.resolve(baseName + ".geojson"));
    return result;
  }

  private Relation read(Path directory, String identifier) throws IOException {
    return reader.read(locator.findMostRecent(directory, identifier));
  }

  private @Nullable Relation walkScores(Options options, FusionConfig config, Relation points)
      throws IOException {
    if (options.scrapeWalkScores) {
      WalkScoreCollector collector = new WalkScoreCollector(
          new WalkScoreScraper(config.getGeographyService().getRetry()));
      Relation scraped = collector.collect(CityState.distinct(points,
          NeighborhoodColumns.CITY_NAME, NeighborhoodColumns.STATE_ID));
      new CsvRelationWriter().write(scraped, options.walkscoreDirectory.resolve(WALKSCORES_FILE));
      return scraped;
    }
    try {
      return read(options.walkscoreDirectory, "walkscores");
    } catch (IOException e) {
      LOGGER.warn("No walkability table available, continuing without it: {}", e.getMessage());
      return null;
    }
  }

  /**
   * Parsed command line options.
   */
  public static class Options {
    static final String USAGE = "Usage: neighborhood-fusion [--zhvi-directory DIR]"
        + " [--zori-directory DIR] [--spatial-directory DIR] [--walkscore-directory DIR]"
        + " [--geojson-directory DIR] [--csv-directory DIR]"
        + " [--census-geography tract|block_group|block] [--config FILE] [--scrape-walkscores]";

    Path zhviDirectory = Paths.get("zhvi_assets");
    Path zoriDirectory = Paths.get("zori_assets");
    Path spatialDirectory = Paths.get("spatial_assets");
    Path walkscoreDirectory = Paths.get("csvs");
    Path geojsonDirectory = Paths.get("geojsons");
    Path csvDirectory = Paths.get("csvs");
    @Nullable CensusGeography geography;
    @Nullable Path configFile;
    boolean scrapeWalkScores;

    /**
     * Parses command line arguments.
     *
     * @throws IllegalArgumentException on an unknown option or a missing value
     */
    public static Options parse(String[] args) {
      Options options = new Options();
      for (int i = 0; i < args.length; i++) {
        String option = args[i].replace('_', '-');
        if ("--scrape-walkscores".equals(option)) {
          options.scrapeWalkScores = true;
          continue;
        }
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + args[i]);
        }
        String value = args[++i];
        switch (option) {
          case "--zhvi-directory":
            options.zhviDirectory = Paths.get(value);
            break;
          case "--zori-directory":
            options.zoriDirectory = Paths.get(value);
            break;
          case "--spatial-directory":
            options.spatialDirectory = Paths.get(value);
            break;
          case "--walkscore-directory":
            options.walkscoreDirectory = Paths.get(value);
            break;
          case "--geojson-directory":
            options.geojsonDirectory = Paths.get(value);
            break;
          case "--csv-directory":
            options.csvDirectory = Paths.get(value);
            break;
          case "--census-geography":
            options.geography = CensusGeography.fromName(value);
            break;
          case "--config":
            options.configFile = Paths.get(value);
            break;
          default:
            throw new IllegalArgumentException("Unknown option: " + args[i - 1]);
        }
      }
      return options;
    }

    public Path getZhviDirectory() {
      return zhviDirectory;
    }

    public Path getZoriDirectory() {
      return zoriDirectory;
    }

    public Path getSpatialDirectory() {
      return spatialDirectory;
    }

    public Path getWalkscoreDirectory() {
      return walkscoreDirectory;
    }

    public Path getGeojsonDirectory() {
      return geojsonDirectory;
    }

    public Path getCsvDirectory() {
      return csvDirectory;
    }

    public @Nullable CensusGeography getGeography() {
      return geography;
    }

    public @Nullable Path getConfigFile() {
      return configFile;
    }

    public boolean isScrapeWalkScores() {
      return scrapeWalkScores;
    }
  }
}
