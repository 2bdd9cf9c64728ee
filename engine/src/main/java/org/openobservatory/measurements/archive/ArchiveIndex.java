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

import java.util.OptionalLong;

/**
 * Source of offset hints: the byte offset of the LZ4 frame where the scan for a record should start.
 */
public interface ArchiveIndex {
  ArchiveIndex NONE = (containerPath, indexKey) -> OptionalLong.empty();

  /**
   * Returns the offset of a frame whose records start at or before {@code indexKey}, or empty to scan from the beginning.
   */
  OptionalLong offsetHint(String containerPath, String indexKey);
}
