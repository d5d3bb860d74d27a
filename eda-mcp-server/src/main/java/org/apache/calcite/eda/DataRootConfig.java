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
package org.apache.calcite.eda;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable location of the data root, the single directory every dataset
 * path must resolve inside.
 *
 * <p>Built once at startup and handed to each component that needs it.
 */
public final class DataRootConfig {
  private static final Logger logger = LoggerFactory.getLogger(DataRootConfig.class);

  /** Command-line flag naming the data root. */
  public static final String DATA_ROOT_FLAG = "--data-root";

  /** Environment variable consulted when the flag is absent. */
  public static final String DATA_ROOT_ENV = "EDA_DATA_ROOT";

  /** Directory used when neither the flag nor the environment names one. */
  public static final String DEFAULT_DATA_ROOT = "data";

  private final Path root;

  private DataRootConfig(Path root) {
    this.root = root;
  }

  /**
   * Creates a configuration for the given directory.
   *
   * <p>An existing directory is canonicalized, resolving symbolic links, so
   * that containment checks compare canonical forms on both sides. A
   * directory that does not exist is kept in absolute, normalized form.
   *
   * @param directory Data root directory
   * @return configuration
   */
  public static DataRootConfig of(Path directory) {
    requireNonNull(directory, "directory");
    Path absolute = directory.toAbsolutePath().normalize();
    if (Files.exists(absolute)) {
      try {
        return new DataRootConfig(absolute.toRealPath());
      } catch (IOException e) {
        logger.warn("Could not canonicalize data root {}: {}", absolute, e.getMessage());
      }
    }
    return new DataRootConfig(absolute);
  }

  /**
   * Creates a configuration from command-line arguments and environment.
   *
   * <p>The {@code --data-root} flag wins over the {@code EDA_DATA_ROOT}
   * variable, which wins over {@code ./data}.
   *
   * @param args Command-line arguments
   * @param env Environment variables
   * @return configuration
   * @throws IllegalArgumentException if the configured value is not a valid path
   */
  public static DataRootConfig fromArgs(String[] args, Map<String, String> env) {
    String value = parseFlag(args);
    if (value == null || value.isEmpty()) {
      value = env.get(DATA_ROOT_ENV);
    }
    if (value == null || value.isEmpty()) {
      value = DEFAULT_DATA_ROOT;
    }
    try {
      return of(Paths.get(value));
    } catch (InvalidPathException e) {
      throw new IllegalArgumentException("Invalid data root: " + value, e);
    }
  }

  private static @Nullable String parseFlag(String[] args) {
    for (int i = 0; i < args.length - 1; i++) {
      if (DATA_ROOT_FLAG.equals(args[i])) {
        return args[i + 1];
      }
    }
    return null;
  }

  /**
   * Returns the data root, canonical when it existed at construction time.
   */
  public Path getRoot() {
    return root;
  }

  @Override public String toString() {
    return "DataRootConfig{root=" + root + "}";
  }
}
