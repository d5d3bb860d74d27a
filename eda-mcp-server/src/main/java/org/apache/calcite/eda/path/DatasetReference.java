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

import java.nio.file.Path;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A dataset path that has passed the data root containment check.
 *
 * <p>Holds the canonical absolute location, used for reading, and the
 * caller-visible path relative to the data root, used in results.
 */
public final class DatasetReference {
  private final Path absolutePath;
  private final String relativePath;

  public DatasetReference(Path absolutePath, String relativePath) {
    this.absolutePath = requireNonNull(absolutePath, "absolutePath");
    this.relativePath = requireNonNull(relativePath, "relativePath");
  }

  public Path getAbsolutePath() {
    return absolutePath;
  }

  /**
   * Returns the path relative to the data root, using {@code /} separators.
   */
  public String getRelativePath() {
    return relativePath;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatasetReference)) {
      return false;
    }
    DatasetReference that = (DatasetReference) o;
    return absolutePath.equals(that.absolutePath)
        && relativePath.equals(that.relativePath);
  }

  @Override public int hashCode() {
    return Objects.hash(absolutePath, relativePath);
  }

  @Override public String toString() {
    return relativePath;
  }
}
