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
import org.apache.calcite.eda.error.InvalidArgumentException;
import org.apache.calcite.eda.error.SecurityViolationException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;

import static java.util.Objects.requireNonNull;

/**
 * Turns caller-supplied path strings into canonical locations inside the
 * data root.
 *
 * <p>Relative paths are interpreted against the data root; absolute paths
 * are accepted as long as they canonicalize inside it. Canonicalization
 * resolves {@code .}, {@code ..} and symbolic links before the containment
 * check, so neither traversal sequences nor links can leave the sandbox.
 *
 * <p>Escaping paths are rejected whether or not their target exists, so the
 * resolver does not reveal which files exist outside the data root.
 */
public class PathResolver {
  private final Path root;

  public PathResolver(DataRootConfig config) {
    this.root = requireNonNull(config, "config").getRoot();
  }

  /**
   * Resolves a path to a dataset reference.
   *
   * @param rawPath Path relative to the data root, or absolute
   * @return reference to an existing regular file inside the data root
   * @throws SecurityViolationException if the path escapes the data root or
   *     names the data root itself
   * @throws DatasetNotFoundException if the file does not exist or is not a
   *     regular file
   * @throws InvalidArgumentException if the path is absent or not a valid path
   */
  public DatasetReference resolve(@Nullable String rawPath)
      throws SecurityViolationException, DatasetNotFoundException,
      InvalidArgumentException {
    if (rawPath == null) {
      throw new InvalidArgumentException("Parameter 'path' is required");
    }

    Path requested;
    try {
      requested = Paths.get(rawPath);
    } catch (InvalidPathException e) {
      throw new InvalidArgumentException("Invalid path: " + rawPath, e);
    }

    if (!Files.isDirectory(root)) {
      throw new DatasetNotFoundException("Data root does not exist: " + root);
    }

    Path candidate = requested.isAbsolute() ? requested : root.resolve(requested);
    Path canonical = canonicalize(candidate, rawPath);

    if (!canonical.startsWith(root) || canonical.equals(root)) {
      throw new SecurityViolationException(
          "Path must be located within the data directory: " + rawPath);
    }
    if (!Files.exists(canonical)) {
      throw new DatasetNotFoundException("CSV file not found: " + rawPath);
    }
    if (!Files.isRegularFile(canonical)) {
      throw new DatasetNotFoundException("Not a regular file: " + rawPath);
    }

    return new DatasetReference(canonical, relativize(root, canonical));
  }

  /**
   * Returns the data root this resolver checks against.
   */
  public Path getRoot() {
    return root;
  }

  /**
   * Canonicalizes a path that may not exist.
   *
   * <p>The longest existing prefix is resolved through the file system; the
   * missing remainder is appended and normalized lexically.
   */
  private static Path canonicalize(Path candidate, String rawPath)
      throws DatasetNotFoundException {
    try {
      return candidate.toRealPath();
    } catch (NoSuchFileException e) {
      // fall through to the partial resolution below
    } catch (IOException e) {
      throw new DatasetNotFoundException("Cannot access " + rawPath + ": " + e.getMessage(), e);
    }

    Deque<Path> missing = new ArrayDeque<>();
    Path existing = candidate;
    while (existing != null && !Files.exists(existing)) {
      Path name = existing.getFileName();
      if (name != null) {
        missing.push(name);
      }
      existing = existing.getParent();
    }
    if (existing == null) {
      return candidate.toAbsolutePath().normalize();
    }

    Path resolved;
    try {
      resolved = existing.toRealPath();
    } catch (IOException e) {
      throw new DatasetNotFoundException("Cannot access " + rawPath + ": " + e.getMessage(), e);
    }
    for (Path segment : missing) {
      resolved = resolved.resolve(segment);
    }
    return resolved.normalize();
  }

  static String relativize(Path root, Path path) {
    StringBuilder sb = new StringBuilder();
    for (Path segment : root.relativize(path)) {
      if (sb.length() > 0) {
        sb.append('/');
      }
      sb.append(segment);
    }
    return sb.toString();
  }
}
