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

import org.openobservatory.measurements.exception.NotFoundException;
import org.openobservatory.measurements.locator.ArchiveLayout;
import org.openobservatory.measurements.log.LogManager;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;
import java.util.logging.Level;

/**
 * Reads offset hints from the {@code <container>.idx} object stored next to each container. Every line of the sidecar is
 * {@code <first index key of the frame><TAB><frame offset>}, ordered by key. A missing or unreadable sidecar only means
 * there is no hint.
 */
public class SidecarArchiveIndex implements ArchiveIndex {
  private final ObjectStorage storage;

  public SidecarArchiveIndex(final ObjectStorage storage) {
    this.storage = storage;
  }

  @Override
  public OptionalLong offsetHint(final String containerPath, final String indexKey) {
    final String path = ArchiveLayout.indexPath(containerPath);
    try (final InputStream in = storage.get(path);
        final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {

      long found = -1;
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isEmpty())
          continue;
        final int tab = line.lastIndexOf('\t');
        if (tab < 0) {
          LogManager.instance().log(this, Level.WARNING, "Malformed line in archive index '%s', ignoring the index", path);
          return OptionalLong.empty();
        }
        if (line.substring(0, tab).compareTo(indexKey) > 0)
          break;
        found = Long.parseLong(line.substring(tab + 1).trim());
      }
      return found > -1 ? OptionalLong.of(found) : OptionalLong.empty();

    } catch (final NotFoundException e) {
      LogManager.instance().log(this, Level.FINE, "No archive index for '%s'", containerPath);
      return OptionalLong.empty();
    } catch (final IOException | NumberFormatException e) {
      LogManager.instance().log(this, Level.WARNING, "Cannot read archive index '%s', scanning the whole container", e, path);
      return OptionalLong.empty();
    }
  }
}
