/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package org.openobservatory.measurements.archive;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SidecarArchiveIndexTest {
  @TempDir
  Path tempDir;

  private SidecarArchiveIndex index;

  @BeforeEach
  void setUp() throws IOException {
    Files.writeString(tempDir.resolve("c.lz4.idx"), "r1 a\t0\nr1 m\t120\nr2 \t300\n");
    index = new SidecarArchiveIndex(new FileSystemObjectStorage(tempDir));
  }

  @Test
  void testPicksLastFrameStartingBeforeTheKey() {
    assertThat(index.offsetHint("c.lz4", "r1 a")).hasValue(0);
    assertThat(index.offsetHint("c.lz4", "r1 k")).hasValue(0);
    assertThat(index.offsetHint("c.lz4", "r1 m")).hasValue(120);
    assertThat(index.offsetHint("c.lz4", "r1 z")).hasValue(120);
    assertThat(index.offsetHint("c.lz4", "r3 x")).hasValue(300);
  }

  @Test
  void testKeyBeforeFirstFrame() {
    assertThat(index.offsetHint("c.lz4", "r0 ")).isEmpty();
  }

  @Test
  void testMissingOrBrokenIndexGivesNoHint() throws IOException {
    assertThat(index.offsetHint("other.lz4", "r1 a")).isEmpty();

    Files.writeString(tempDir.resolve("broken.lz4.idx"), "r1 a\tnot-a-number\n");
    assertThat(index.offsetHint("broken.lz4", "r1 b")).isEmpty();
  }
}
