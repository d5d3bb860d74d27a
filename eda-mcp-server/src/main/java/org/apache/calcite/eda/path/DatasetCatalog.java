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
package org.apache.calcite.eda.path;

import org.apache.calcite.eda.DataRootConfig;
import org.apache.calcite.eda.error.DatasetNotFoundException;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Lists the CSV files available under the data root.
 *
 * <p>The catalog never loads tables. Unreadable subdirectories are skipped
 * with a warning, and files whose canonical location lies outside the data
 * root (symbolic links leading out) are not listed.
 */
public class DatasetCatalog {
  private static final Logger logger = LoggerFactory.getLogger(DatasetCatalog.class);

  private static final String CSV_EXTENSION = ".csv";

  private final Path root;

  public DatasetCatalog(DataRootConfig config) {
    this.root = requireNonNull(config, "config").getRoot();
  }

  /**
   * Lists CSV files under the data root.
   *
   * @return paths relative to the data root, sorted lexicographically
   * @throws DatasetNotFoundException if the data root does not exist
   */
  public List<String> listDatasets() throws DatasetNotFoundException {
    if (!Files.isDirectory(root)) {
      throw new DatasetNotFoundException("Data root does not exist: " + root);
    }

    List<String> datasets = new ArrayList<>();
    try {
      Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
        @Override public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
          if (isCsv(file) && Files.isRegularFile(file) && staysInside(file)) {
            datasets.add(PathResolver.relativize(root, file));
          }
          return FileVisitResult.CONTINUE;
        }

        @Override public FileVisitResult visitFileFailed(Path file, IOException e) {
          logger.warn("Skipping unreadable entry {}: {}", file, e.getMessage());
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException e) {
      logger.warn("Error walking data root {}", root, e);
    }

    Collections.sort(datasets);
    return ImmutableList.copyOf(datasets);
  }

  public Path getRoot() {
    return root;
  }

  private static boolean isCsv(Path file) {
    Path name = file.getFileName();
    return name != null
        && name.toString().toLowerCase(Locale.ROOT).endsWith(CSV_EXTENSION);
  }

  private boolean staysInside(Path file) {
    try {
      Path real = file.toRealPath();
      return real.startsWith(root) && !real.equals(root);
    } catch (IOException e) {
      logger.debug("Cannot canonicalize {}: {}", file, e.getMessage());
      return false;
    }
  }
}
