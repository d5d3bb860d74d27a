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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

/**
 * Tests for DataRootConfig.
 */
@Tag("unit")
public class DataRootConfigTest {
  @TempDir
  Path tempDir;

  @Test void testFlagWinsOverEnvironment() throws Exception {
    Path flagDir = Files.createDirectories(tempDir.resolve("flag"));
    Path envDir = Files.createDirectories(tempDir.resolve("env"));

    DataRootConfig config = DataRootConfig.fromArgs(
        new String[] {"--data-root", flagDir.toString()},
        ImmutableMap.of(DataRootConfig.DATA_ROOT_ENV, envDir.toString()));

    assertThat(config.getRoot(), equalTo(flagDir.toRealPath()));
  }

  @Test void testEnvironmentUsedWithoutFlag() throws Exception {
    Path envDir = Files.createDirectories(tempDir.resolve("env"));

    DataRootConfig config = DataRootConfig.fromArgs(new String[0],
        ImmutableMap.of(DataRootConfig.DATA_ROOT_ENV, envDir.toString()));

    assertThat(config.getRoot(), equalTo(envDir.toRealPath()));
  }

  @Test void testDefaultDirectory() {
    DataRootConfig config = DataRootConfig.fromArgs(new String[0], Collections.emptyMap());

    assertThat(config.getRoot().isAbsolute(), is(true));
    assertThat(config.getRoot().getFileName(), equalTo(Paths.get("data")));
  }

  @Test void testSymlinkedRootIsCanonicalized() throws Exception {
    Path real = Files.createDirectories(tempDir.resolve("real"));
    Path link = Files.createSymbolicLink(tempDir.resolve("link"), real);

    assertThat(DataRootConfig.of(link).getRoot(), equalTo(real.toRealPath()));
  }

  @Test void testMissingRootIsNormalized() {
    Path missing = tempDir.resolve("a/../missing");

    assertThat(DataRootConfig.of(missing).getRoot(),
        equalTo(tempDir.resolve("missing").toAbsolutePath().normalize()));
  }
}
