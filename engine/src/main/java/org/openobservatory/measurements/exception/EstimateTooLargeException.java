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
package org.openobservatory.measurements.exception;

public class EstimateTooLargeException extends RequestRejectedException {

  public EstimateTooLargeException(final long estimatedRows, final long ceiling, final String coarsestGranularity) {
    super(ErrorCode.ESTIMATE_TOO_LARGE,
        "Estimated " + estimatedRows + " result rows at " + coarsestGranularity + " granularity, the ceiling is " + ceiling,
        "Remove a high-cardinality dimension, add a filter or shorten the time range");
    addContext("estimatedRows", estimatedRows);
    addContext("rowCeiling", ceiling);
    addContext("granularity", coarsestGranularity);
  }
}
