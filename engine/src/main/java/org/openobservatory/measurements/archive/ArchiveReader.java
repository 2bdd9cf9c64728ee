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

import org.openobservatory.measurements.ContextConfiguration;
import org.openobservatory.measurements.GlobalConfiguration;
import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.exception.CorruptArchiveException;
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.NotFoundException;
import org.openobservatory.measurements.exception.StorageAccessException;
import org.openobservatory.measurements.locator.ArchiveLayout;
import org.openobservatory.measurements.locator.FetchPlan;
import org.openobservatory.measurements.locator.MeasurementReader;
import org.openobservatory.measurements.log.LogManager;
import org.openobservatory.measurements.model.ArchiveLocator;
import org.openobservatory.measurements.model.MeasurementBody;
import org.openobservatory.measurements.model.MeasurementRef;
import org.openobservatory.measurements.model.StorageTier;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.OptionalLong;
import java.util.logging.Level;

/**
 * Reads measurements from archive containers. The scan starts at the offset hint when there is one, otherwise at the
 * beginning of the container, and stops at the first record whose key is not lower than the wanted one. Containers up to
 * the buffer threshold are loaded in memory before decoding, bigger ones are decoded while streaming.
 */
public class ArchiveReader implements MeasurementReader {
  private static final int CHECK_EVERY = 256;

  private final ObjectStorage storage;
  private final ArchiveIndex  index;
  private final ArchiveLayout layout;
  private final long          bufferThreshold;
  private final long          maxRecordSize;

  public ArchiveReader(final ContextConfiguration configuration, final ObjectStorage storage, final ArchiveIndex index,
      final ArchiveLayout layout) {
    this.storage = storage;
    this.index = index != null ? index : ArchiveIndex.NONE;
    this.layout = layout;
    this.bufferThreshold = configuration.getValueAsLong(GlobalConfiguration.ARCHIVE_BUFFER_THRESHOLD);
    this.maxRecordSize = configuration.getValueAsLong(GlobalConfiguration.ARCHIVE_MAX_RECORD_SIZE);
  }

  @Override
  public StorageTier getTier() {
    return StorageTier.ARCHIVE;
  }

  @Override
  public MeasurementBody fetch(final FetchPlan plan, final QueryContext context) {
    final ArchiveLocator locator = plan.archiveLocator() != null ? plan.archiveLocator() : layout.locate(plan.ref());
    return fetch(locator, plan.ref(), context);
  }

  public MeasurementBody fetch(final ArchiveLocator locator, final MeasurementRef ref, final QueryContext context) {
    final String path = locator.containerPath();
    final String key = locator.indexKey();

    final OptionalLong hint = locator.offsetHint().isPresent() ? locator.offsetHint() : index.offsetHint(path, key);

    Seek seek = null;
    if (hint.isPresent() && hint.getAsLong() > 0) {
      try {
        seek = seek(path, hint.getAsLong(), key, context);
        if (seek.startedPastKey) {
          LogManager.instance().log(this, Level.WARNING, "Offset hint %d of '%s' is past key '%s', scanning from the beginning",
              hint.getAsLong(), path, key);
          seek = null;
        }
      } catch (final CorruptArchiveException e) {
        LogManager.instance().log(this, Level.WARNING, "Cannot decode '%s' from offset hint %d, scanning from the beginning", e,
            path, hint.getAsLong());
      }
    }

    if (seek == null)
      seek = seek(path, 0, key, context);

    if (seek.record == null || !seek.record.indexKey().equals(key))
      throw (NotFoundException) new NotFoundException("Measurement " + ref + " not found in archive container '" + path + "'")
          .addContext("tier", StorageTier.ARCHIVE).addContext("container", path).addContext("indexKey", key);

    LogManager.instance().log(this, Level.FINE, "Found %s in '%s' after %d records", ref, path, seek.decoded);
    return new MeasurementBody(ref, seek.record.rawBytes(), seek.record.formatVersion());
  }

  /**
   * Tells if the container of {@code reportId} holds at least one of its measurements.
   */
  public boolean containsReport(final String reportId, final QueryContext context) {
    final String path;
    try {
      path = layout.containerPath(reportId);
    } catch (final NotFoundException e) {
      return false;
    }

    final String prefix = ArchiveLayout.reportPrefix(reportId);
    final OptionalLong hint = index.offsetHint(path, prefix);
    try {
      final Seek seek = seek(path, hint.orElse(0), prefix, context);
      return seek.record != null && seek.record.indexKey().startsWith(prefix);
    } catch (final NotFoundException e) {
      return false;
    }
  }

  private Seek seek(final String path, final long offset, final String key, final QueryContext context) {
    context.checkActive();

    try (final ArchiveRecordScanner scanner = new ArchiveRecordScanner(path, open(path, offset), maxRecordSize)) {
      final Seek result = new Seek();
      while (scanner.hasNext()) {
        final ArchiveRecord record = scanner.next();
        result.decoded = scanner.getDecodedRecords();
        final int cmp = record.indexKey().compareTo(key);
        if (cmp >= 0) {
          result.record = record;
          result.startedPastKey = cmp > 0 && result.decoded == 1;
          return result;
        }
        if (result.decoded % CHECK_EVERY == 0)
          context.checkActive();
      }
      return result;

    } catch (final CorruptArchiveException e) {
      LogManager.instance().log(this, offset == 0 ? Level.SEVERE : Level.FINE, "Corrupt archive container '%s' (offset %d): %s", path,
          offset, e.getMessage());
      throw e;
    }
  }

  private InputStream open(final String path, final long offset) {
    try {
      final OptionalLong size = storage.size(path);
      if (size.isPresent() && size.getAsLong() - offset <= bufferThreshold) {
        try (final InputStream in = storage.get(path, offset)) {
          return new ByteArrayInputStream(in.readAllBytes());
        }
      }
      return storage.get(path, offset);
    } catch (final IOException e) {
      throw (StorageAccessException) new StorageAccessException(ErrorCode.IO_ERROR, "Cannot open archive container '" + path + "'",
          e).addContext("container", path).addContext("offset", offset);
    }
  }

  private static final class Seek {
    private ArchiveRecord record;
    private long          decoded;
    private boolean       startedPastKey;
  }
}
