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

import java.util.OptionalLong;

/**
 * Address of one record inside an archive container.
 *
 * @param containerPath path of the container in object storage
 * @param offsetHint    byte offset of the LZ4 frame holding the record, when known
 * @param indexKey      sort key of the record inside the container
 */
public record ArchiveLocator(String containerPath, OptionalLong offsetHint, String indexKey) {

  public ArchiveLocator {
    if (containerPath == null || containerPath.isBlank())
      throw new IllegalArgumentException("containerPath is mandatory");
    if (indexKey == null)
      throw new IllegalArgumentException("indexKey is mandatory");
    if (offsetHint == null)
      offsetHint = OptionalLong.empty();
    else if (offsetHint.isPresent() && offsetHint.getAsLong() < 0)
      throw new IllegalArgumentException("offsetHint must be >= 0, got " + offsetHint.getAsLong());
  }

  public ArchiveLocator(final String containerPath, final String indexKey) {
    this(containerPath, OptionalLong.empty(), indexKey);
  }

  public ArchiveLocator withOffsetHint(final long offset) {
    return new ArchiveLocator(containerPath, OptionalLong.of(offset), indexKey);
  }
}
