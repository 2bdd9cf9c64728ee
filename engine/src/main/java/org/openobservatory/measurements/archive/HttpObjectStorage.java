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
import org.openobservatory.measurements.log.LogManager;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.logging.Level;

/**
 * Archive objects served over HTTP. Reads from an offset use {@code Range: bytes=<offset>-} requests; servers ignoring
 * the header are handled by skipping the leading bytes.
 */
public class HttpObjectStorage implements ObjectStorage {
  private final URI        baseUri;
  private final HttpClient client;
  private final Duration   requestTimeout;

  public HttpObjectStorage(final URI baseUri, final Duration requestTimeout) {
    this(baseUri, HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(requestTimeout).build(),
        requestTimeout);
  }

  public HttpObjectStorage(final URI baseUri, final HttpClient client, final Duration requestTimeout) {
    final String base = baseUri.toString();
    this.baseUri = base.endsWith("/") ? baseUri : URI.create(base + "/");
    this.client = client;
    this.requestTimeout = requestTimeout;
  }

  @Override
  public InputStream get(final String path) throws IOException {
    return get(path, 0);
  }

  @Override
  public InputStream get(final String path, final long offset) throws IOException {
    if (offset < 0)
      throw new IllegalArgumentException("Negative offset " + offset);

    final HttpRequest.Builder request = HttpRequest.newBuilder().uri(resolve(path)).timeout(requestTimeout).GET();
    if (offset > 0)
      request.header("Range", "bytes=" + offset + "-");

    final HttpResponse<InputStream> response = send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
    final int status = response.statusCode();
    if (status == 206)
      return response.body();

    if (status == 200) {
      final InputStream body = response.body();
      if (offset > 0) {
        LogManager.instance().log(this, Level.FINE, "Server ignored range request for '%s', skipping %d bytes", path, offset);
        try {
          body.skipNBytes(offset);
        } catch (final IOException e) {
          body.close();
          throw e;
        }
      }
      return body;
    }

    response.body().close();
    if (status == 404)
      throw notFound(path);
    throw new IOException("Unexpected HTTP status " + status + " reading archive object '" + path + "'");
  }

  @Override
  public OptionalLong size(final String path) throws IOException {
    final HttpRequest request = HttpRequest.newBuilder().uri(resolve(path)).timeout(requestTimeout)
        .method("HEAD", HttpRequest.BodyPublishers.noBody()).build();
    final HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
    if (response.statusCode() == 404)
      throw notFound(path);
    if (response.statusCode() != 200)
      throw new IOException("Unexpected HTTP status " + response.statusCode() + " reading size of archive object '" + path + "'");
    return response.headers().firstValueAsLong("Content-Length");
  }

  public URI getBaseUri() {
    return baseUri;
  }

  URI resolve(final String path) {
    final String relative = path.startsWith("/") ? path.substring(1) : path;
    return baseUri.resolve(relative);
  }

  private <T> HttpResponse<T> send(final HttpRequest request, final HttpResponse.BodyHandler<T> handler) throws IOException {
    try {
      return client.send(request, handler);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while requesting " + request.uri());
    }
  }

  private static NotFoundException notFound(final String path) {
    return (NotFoundException) new NotFoundException(ErrorCode.CONTAINER_NOT_FOUND, "Archive object '" + path + "' not found")
        .addContext("path", path);
  }
}
