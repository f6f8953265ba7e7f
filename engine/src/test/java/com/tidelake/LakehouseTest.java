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
package com.tidelake;

import com.tidelake.exception.ErrorCode;
import com.tidelake.exception.LakehouseIsClosedException;
import com.tidelake.view.PayloadBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LakehouseTest extends TestHelper {

  @Test
  void closedLakehouseRejectsIngestionAndStart() {
    insertProcess("P1", nanos(START));
    lakehouse.close();
    lakehouse.close();

    final PayloadBuilder payload = new PayloadBuilder().log(nanos(START), "app::main", "INFO", "starting");
    assertThatThrownBy(() -> lakehouse.insertBlock(newBlock("B0", "S1", "P1", nanos(START), payload, nanos(START), nanos(START) + 1),
        payload.build())).isInstanceOf(LakehouseIsClosedException.class)
        .satisfies(e -> assertThat(((LakehouseIsClosedException) e).getErrorCode()).isEqualTo(ErrorCode.LAKEHOUSE_IS_CLOSED));
    assertThatThrownBy(() -> lakehouse.start()).isInstanceOf(LakehouseIsClosedException.class);
    assertThat(blobStore.list("")).isEmpty();
  }
}
