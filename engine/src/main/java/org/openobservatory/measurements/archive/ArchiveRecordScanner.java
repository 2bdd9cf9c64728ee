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

import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4FrameInputStream;
import org.openobservatory.measurements.exception.CorruptArchiveException;
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.StorageAccessException;
import org.openobservatory.measurements.locator.ArchiveLayout;
import org.openobservatory.measurements.log.LogManager;
import org.openobservatory.measurements.model.FormatVersion;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Level;

/**
 * Lazily decodes the records of a container: a sequence of concatenated LZ4 frames whose content is newline delimited JSON,
 * one measurement per line, sorted by index key. Only {@code report_id}, {@code input} and {@code data_format_version} are
 * read from each document, the rest is skipped.
 * <p>
 * Decompression and parse failures raise {@link CorruptArchiveException}; failures of the underlying storage stream raise
 * {@link StorageAccessException}.
 */
public class ArchiveRecordScanner implements Iterator<ArchiveRecord>, AutoCloseable {
  private static final int BUFFER_SIZE = 64 * 1024;

  private final String              containerPath;
  private final TrackingInputStream source;
  private final long                maxRecordSize;
  private       InputStream         decoded;
  private       ArchiveRecord       next;
  private       String              lastKey;
  private       long                ordinal  = 0;
  private       boolean             finished = false;

  public ArchiveRecordScanner(final String containerPath, final InputStream compressed, final long maxRecordSize) {
    this.containerPath = containerPath;
    this.source = new TrackingInputStream(compressed);
    this.maxRecordSize = maxRecordSize;
  }

  @Override
  public boolean hasNext() {
    if (next == null && !finished)
      next = readNext();
    return next != null;
  }

  @Override
  public ArchiveRecord next() {
    if (!hasNext())
      throw new NoSuchElementException();
    final ArchiveRecord r = next;
    next = null;
    return r;
  }

  /**
   * Number of records decoded so far.
   */
  public long getDecodedRecords() {
    return ordinal;
  }

  @Override
  public void close() {
    finished = true;
    try {
      if (decoded != null)
        decoded.close();
      else
        source.close();
    } catch (final IOException e) {
      LogManager.instance().log(this, Level.FINE, "Error closing archive container '%s'", e, containerPath);
    }
  }

  private ArchiveRecord readNext() {
    try {
      if (decoded == null)
        decoded = new BufferedInputStream(new LZ4FrameInputStream(source), BUFFER_SIZE);

      byte[] line;
      do {
        line = readLine();
        if (line == null) {
          finished = true;
          return null;
        }
      } while (line.length == 0);

      return parse(line);

    } catch (final LZ4Exception e) {
      finished = true;
      throw corrupt("Invalid LZ4 data after " + ordinal + " records", e);
    } catch (final IOException e) {
      finished = true;
      if (source.failure != null)
        throw new StorageAccessException(ErrorCode.IO_ERROR, "Error reading archive container '" + containerPath + "'", e);
      throw corrupt("Cannot decompress after " + ordinal + " records: " + e.getMessage(), e);
    }
  }

  private byte[] readLine() throws IOException {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream(1024);
    int b;
    while ((b = decoded.read()) != -1) {
      if (b == '\n')
        return buffer.toByteArray();
      if (buffer.size() >= maxRecordSize) {
        finished = true;
        throw corrupt("Record " + (ordinal + 1) + " is longer than " + maxRecordSize + " bytes", null);
      }
      buffer.write(b);
    }
    // LAST LINE WITHOUT NEWLINE
    return buffer.size() > 0 ? buffer.toByteArray() : null;
  }

  private ArchiveRecord parse(final byte[] line) {
    String reportId = null;
    String input = null;
    String version = null;

    try (final JsonReader reader = new JsonReader(
        new InputStreamReader(new ByteArrayInputStream(line), StandardCharsets.UTF_8))) {
      reader.beginObject();
      while (reader.hasNext()) {
        final String name = reader.nextName();
        switch (name) {
        case "report_id":
          reportId = readString(reader);
          break;
        case "input":
          input = readString(reader);
          break;
        case "data_format_version":
          version = readString(reader);
          break;
        default:
          reader.skipValue();
        }
      }
      reader.endObject();
    } catch (final IOException | JsonParseException | IllegalStateException e) {
      finished = true;
      throw corrupt("Record " + (ordinal + 1) + " is not a valid JSON object", e);
    }

    if (reportId == null || reportId.isEmpty()) {
      finished = true;
      throw corrupt("Record " + (ordinal + 1) + " has no report_id", null);
    }

    final String key = ArchiveLayout.indexKey(reportId, input != null && !input.isEmpty() ? input : null);
    if (lastKey != null && key.compareTo(lastKey) < 0) {
      finished = true;
      throw corrupt("Record " + (ordinal + 1) + " with key '" + key + "' is out of order", null);
    }
    lastKey = key;
    ++ordinal;
    return new ArchiveRecord(reportId, input != null && !input.isEmpty() ? input : null, key, line, FormatVersion.fromLabel(version),
        ordinal);
  }

  private static String readString(final JsonReader reader) throws IOException {
    final JsonToken token = reader.peek();
    if (token == JsonToken.NULL) {
      reader.nextNull();
      return null;
    }
    if (token == JsonToken.STRING || token == JsonToken.NUMBER)
      return reader.nextString();
    reader.skipValue();
    return null;
  }

  private CorruptArchiveException corrupt(final String message, final Throwable cause) {
    return new CorruptArchiveException(containerPath, message, cause);
  }

  /**
   * Remembers failures of the storage stream, to tell them apart from decoding errors raised by the LZ4 layer above.
   */
  private static final class TrackingInputStream extends FilterInputStream {
    private IOException failure;

    private TrackingInputStream(final InputStream in) {
      super(in);
    }

    @Override
    public int read() throws IOException {
      try {
        return super.read();
      } catch (final IOException e) {
        failure = e;
        throw e;
      }
    }

    @Override
    public int read(final byte[] b, final int off, final int len) throws IOException {
      try {
        return super.read(b, off, len);
      } catch (final IOException e) {
        failure = e;
        throw e;
      }
    }

    @Override
    public long skip(final long n) throws IOException {
      try {
        return super.skip(n);
      } catch (final IOException e) {
        failure = e;
        throw e;
      }
    }
  }
}
