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

import java.io.IOException;
import java.io.InputStream;
import java.util.OptionalLong;

/**
 * Read-only access to archive objects. Paths are relative and use {@code /} as separator.
 * <p>
 * Every method throws {@link org.openobservatory.measurements.exception.NotFoundException} with error code
 * {@code CONTAINER_NOT_FOUND} when the object does not exist, and {@link IOException} on any other failure.
 */
public interface ObjectStorage {
  InputStream get(String path) throws IOException;

  /**
   * Opens the object starting at byte {@code offset}.
   */
  InputStream get(String path, long offset) throws IOException;

  /**
   * Size in bytes, empty if the storage cannot tell without reading the object.
   */
  OptionalLong size(String path) throws IOException;
}
