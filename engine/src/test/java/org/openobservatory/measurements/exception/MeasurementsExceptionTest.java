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

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MeasurementsExceptionTest {

  @Test
  void testCategoriesAndStatus() {
    assertThat(new InvalidRequestException("bad").getHttpStatus()).isEqualTo(400);
    assertThat(new TooManyDimensionsException(6, 4).getCategory()).isEqualTo(ErrorCategory.REQUEST);
    assertThat(new NotFoundException("missing").getHttpStatus()).isEqualTo(404);
    assertThat(new QueryTimeoutException("slow").isRetryable()).isTrue();
    assertThat(new PoolExhaustedException(8, 5000).getHttpStatus()).isEqualTo(503);
    assertThat(new CorruptArchiveException("2020-01-01/IT-AS30722.lz4", "broken").getCategory()).isEqualTo(ErrorCategory.INTEGRITY);
    assertThat(new CorruptArchiveException("2020-01-01/IT-AS30722.lz4", "broken").isRetryable()).isFalse();
    assertThat(ErrorCode.fromCode(2002)).isEqualTo(ErrorCode.CONTAINER_NOT_FOUND);
    assertThat(ErrorCode.fromCode(12345)).isEqualTo(ErrorCode.INTERNAL_ERROR);
  }

  @Test
  void testToJSON() {
    final MeasurementsException e = new StorageAccessException(ErrorCode.IO_ERROR, "Cannot read container",
        new IOException("connection reset")).addContext("container", "2020-01-01/IT-AS30722.lz4").addContext("offset", 42L);

    final JSONObject json = new JSONObject(e.toJSON());

    assertThat(json.getInt("errorCode")).isEqualTo(5001);
    assertThat(json.getString("category")).isEqualTo("Storage");
    assertThat(json.getString("cause")).isEqualTo("connection reset");
    assertThat(json.getJSONObject("context").getLong("offset")).isEqualTo(42L);
    assertThat(json.getJSONObject("context").getString("container")).isEqualTo("2020-01-01/IT-AS30722.lz4");
  }

  @Test
  void testRejectionHint() {
    final RangeTooWideException e = new RangeTooWideException(Duration.ofDays(500), Duration.ofDays(400));
    assertThat(e.getHint()).isNotBlank();
    assertThat(new JSONObject(e.toJSON()).getJSONObject("context").getString("hint")).isEqualTo(e.getHint());
  }
}
