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

import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.NotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalLong;

/**
 * Archive objects stored as files under a root directory.
 */
public class FileSystemObjectStorage implements ObjectStorage {
  private final Path root;

  public FileSystemObjectStorage(final Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public InputStream get(final String path) throws IOException {
    return get(path, 0);
  }

  @Override
  public InputStream get(final String path, final long offset) throws IOException {
    if (offset < 0)
      throw new IllegalArgumentException("Negative offset " + offset);

    final Path file = resolve(path);
    final SeekableByteChannel channel;
    try {
      channel = Files.newByteChannel(file, StandardOpenOption.READ);
    } catch (final NoSuchFileException e) {
      throw notFound(path, e);
    }
    try {
      if (offset > channel.size())
        throw new IOException("Offset " + offset + " is past the end of '" + path + "' (" + channel.size() + " bytes)");
      channel.position(offset);
    } catch (final IOException e) {
      channel.close();
      throw e;
    }
    return Channels.newInputStream(channel);
  }

  @Override
  public OptionalLong size(final String path) throws IOException {
    try {
      return OptionalLong.of(Files.size(resolve(path)));
    } catch (final NoSuchFileException e) {
      throw notFound(path, e);
    }
  }

  public Path getRoot() {
    return root;
  }

  private Path resolve(final String path) {
    final Path resolved = root.resolve(path).normalize();
    if (!resolved.startsWith(root))
      throw new IllegalArgumentException("Path '" + path + "' escapes the storage root");
    return resolved;
  }

  private static NotFoundException notFound(final String path, final Throwable cause) {
    return (NotFoundException) new NotFoundException(ErrorCode.CONTAINER_NOT_FOUND, "Archive object '" + path + "' not found",
        cause).addContext("path", path);
  }
}
