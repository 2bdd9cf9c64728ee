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
package org.openobservatory.measurements.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Raw measurement document as stored by the tier that produced it. Bytes are kept undecoded.
 */
public final class MeasurementBody {
  private final MeasurementRef ref;
  private final byte[]         rawBytes;
  private final FormatVersion  formatVersion;

  public MeasurementBody(final MeasurementRef ref, final byte[] rawBytes, final FormatVersion formatVersion) {
    if (ref == null || rawBytes == null)
      throw new IllegalArgumentException("ref and body are mandatory");
    this.ref = ref;
    this.rawBytes = rawBytes;
    this.formatVersion = formatVersion != null ? formatVersion : FormatVersion.UNKNOWN;
  }

  public MeasurementRef getRef() {
    return ref;
  }

  public byte[] getRawBytes() {
    return Arrays.copyOf(rawBytes, rawBytes.length);
  }

  public int size() {
    return rawBytes.length;
  }

  public String asString() {
    return new String(rawBytes, StandardCharsets.UTF_8);
  }

  public FormatVersion getFormatVersion() {
    return formatVersion;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof MeasurementBody))
      return false;
    final MeasurementBody that = (MeasurementBody) o;
    return ref.equals(that.ref) && formatVersion == that.formatVersion && Arrays.equals(rawBytes, that.rawBytes);
  }

  @Override
  public int hashCode() {
    return 31 * ref.hashCode() + Arrays.hashCode(rawBytes);
  }

  @Override
  public String toString() {
    return "MeasurementBody{" + ref + ", " + rawBytes.length + " bytes, " + formatVersion + "}";
  }
}
