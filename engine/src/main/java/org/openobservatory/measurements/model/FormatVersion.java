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

/**
 * Data format version declared by a measurement body ({@code data_format_version}).
 */
public enum FormatVersion {
  V0_2_0("0.2.0"),
  V0_3_0("0.3.0"),
  UNKNOWN(null);

  private final String label;

  FormatVersion(final String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static FormatVersion fromLabel(final String label) {
    if (label != null)
      for (final FormatVersion v : values())
        if (label.trim().equals(v.label))
          return v;
    return UNKNOWN;
  }
}
