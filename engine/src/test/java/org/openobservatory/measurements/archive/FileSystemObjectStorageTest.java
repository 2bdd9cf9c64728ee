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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.NotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemObjectStorageTest {
  @TempDir
  Path tempDir;

  @Test
  void testReadFromOffset() throws IOException {
    Files.createDirectories(tempDir.resolve("2019-01-01"));
    Files.writeString(tempDir.resolve("2019-01-01/IT-AS1.lz4"), "0123456789");
    final FileSystemObjectStorage storage = new FileSystemObjectStorage(tempDir);

    try (final InputStream in = storage.get("2019-01-01/IT-AS1.lz4", 4)) {
      assertThat(new String(in.readAllBytes(), StandardCharsets.US_ASCII)).isEqualTo("456789");
    }
    assertThat(storage.size("2019-01-01/IT-AS1.lz4")).hasValue(10);
  }

  @Test
  void testOffsetPastTheEnd() throws IOException {
    Files.writeString(tempDir.resolve("small.lz4"), "abc");
    final FileSystemObjectStorage storage = new FileSystemObjectStorage(tempDir);

    assertThatThrownBy(() -> storage.get("small.lz4", 10)).isInstanceOf(IOException.class);
  }

  @Test
  void testMissingObject() {
    final FileSystemObjectStorage storage = new FileSystemObjectStorage(tempDir);

    assertThatThrownBy(() -> storage.get("nope.lz4"))//
        .isInstanceOf(NotFoundException.class)//
        .satisfies(e -> assertThat(((NotFoundException) e).getErrorCode()).isEqualTo(ErrorCode.CONTAINER_NOT_FOUND));
    assertThatThrownBy(() -> storage.size("nope.lz4")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void testPathsCannotEscapeTheRoot() {
    final FileSystemObjectStorage storage = new FileSystemObjectStorage(tempDir.resolve("archive"));

    assertThatThrownBy(() -> storage.get("../secret.txt")).isInstanceOf(IllegalArgumentException.class);
  }
}
