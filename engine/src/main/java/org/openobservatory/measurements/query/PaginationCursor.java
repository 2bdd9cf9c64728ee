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
package org.openobservatory.measurements.query;

import org.openobservatory.measurements.exception.InvalidRequestException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Opaque position in the rows of an aggregation, bound to the request that produced it. The token is the URL-safe
 * base64 encoding of {@code v1:<offset>:<request hash>}.
 */
public final class PaginationCursor {
  private static final String VERSION = "v1";

  private final long   offset;
  private final String requestHash;

  private PaginationCursor(final long offset, final String requestHash) {
    this.offset = offset;
    this.requestHash = requestHash;
  }

  public static PaginationCursor of(final long offset, final String fingerprint) {
    if (offset < 0)
      throw new IllegalArgumentException("Negative offset " + offset);
    return new PaginationCursor(offset, hash(fingerprint));
  }

  /**
   * Decodes a token and checks it was issued for a request with the same fingerprint.
   *
   * @throws InvalidRequestException if the token is malformed or belongs to another request
   */
  public static PaginationCursor decode(final String token, final String fingerprint) {
    final String decoded;
    try {
      decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
    } catch (final IllegalArgumentException e) {
      throw new InvalidRequestException("Malformed cursor", "Pass the cursor exactly as returned by the previous page");
    }

    final String[] parts = decoded.split(":");
    if (parts.length != 3 || !VERSION.equals(parts[0]))
      throw new InvalidRequestException("Malformed cursor", "Pass the cursor exactly as returned by the previous page");

    final long offset;
    try {
      offset = Long.parseLong(parts[1]);
    } catch (final NumberFormatException e) {
      throw new InvalidRequestException("Malformed cursor", "Pass the cursor exactly as returned by the previous page");
    }
    if (offset < 0)
      throw new InvalidRequestException("Malformed cursor", "Pass the cursor exactly as returned by the previous page");

    if (!parts[2].equals(hash(fingerprint)))
      throw new InvalidRequestException("Cursor was issued for a different request",
          "Keep dimensions, filters and time range unchanged while paging");

    return new PaginationCursor(offset, parts[2]);
  }

  public String encode() {
    final String raw = VERSION + ":" + offset + ":" + requestHash;
    return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
  }

  public long getOffset() {
    return offset;
  }

  static String hash(final String fingerprint) {
    try {
      final byte[] digest = MessageDigest.getInstance("SHA-256").digest(fingerprint.getBytes(StandardCharsets.UTF_8));
      final StringBuilder hex = new StringBuilder(16);
      for (int i = 0; i < 8; i++)
        hex.append(String.format("%02x", digest[i]));
      return hex.toString();
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  public String toString() {
    return encode();
  }
}
