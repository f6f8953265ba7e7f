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
package com.tidelake.query;

import com.tidelake.TestHelper;
import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.exception.PartitionNotFoundException;
import com.tidelake.exception.ViewNotFoundException;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.time.TimeGranularity;
import com.tidelake.time.TimeRange;
import com.tidelake.view.BuiltinViews;
import com.tidelake.view.ViewDefinition;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LakehouseCatalogTest extends TestHelper {

  @Test
  void globalViewsAreTables() {
    assertThat(lakehouse.getCatalog().getTableNames()).contains(BuiltinViews.PROCESSES, BuiltinViews.STREAMS, BuiltinViews.BLOCKS,
        BuiltinViews.LOG_ENTRIES, BuiltinViews.MEASURES);

    assertThatThrownBy(() -> lakehouse.getCatalog().getTable("unknown")).isInstanceOf(ViewNotFoundException.class);
  }

  @Test
  void instanceOnlyViewHasNoGlobalTable() {
    lakehouse.registerView(ViewDefinition.builder("process_logs")
        .schema(BuiltinViews.logEntries().getSchema())
        .source(BuiltinViews.logEntries().getSource())
        .transform(BuiltinViews.logEntries().getTransform())
        .eventTimeColumn("time")
        .instanceKey(BuiltinViews.logEntries().getInstanceKey())
        .global(false)
        .build());

    assertThat(lakehouse.getCatalog().getTableNames()).doesNotContain("process_logs");
    assertThatThrownBy(() -> lakehouse.getCatalog().getTable("process_logs")).isInstanceOf(InvalidScanRequestException.class);
    assertThat(lakehouse.getCatalog().viewInstance("process_logs", "P1").scan(ScanRequest.all()).isEmpty()).isTrue();
  }

  @Test
  void globalKeyOfViewInstanceIsTheGlobalTable() {
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_LOG);
    insertLogBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), nanos("2024-03-01T10:00:05Z"), "starting");
    lakehouse.getScheduler().materializeRange(BuiltinViews.LOG_ENTRIES,
        new TimeRange(nanos("2024-03-01T10:00:00Z"), nanos("2024-03-01T10:01:00Z")), TimeGranularity.MINUTE);

    final TableProvider table = lakehouse.getCatalog().viewInstance(BuiltinViews.LOG_ENTRIES, ViewDefinition.GLOBAL_INSTANCE);

    assertThat(table).isInstanceOf(MaterializedViewTable.class);
    assertThat(table.scan(ScanRequest.builder().columns("exe", "msg").build()).toRows().get(0)).containsExactly("/usr/bin/p1", "starting");
  }

  @Test
  void missingPartitionFileScansEmpty() {
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_LOG);
    insertLogBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), nanos("2024-03-01T10:00:05Z"), "starting");
    lakehouse.getScheduler().materializeRange(BuiltinViews.LOG_ENTRIES,
        new TimeRange(nanos("2024-03-01T10:00:00Z"), nanos("2024-03-01T10:01:00Z")), TimeGranularity.MINUTE);

    final TableProvider table = lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES);
    final String path = table.listPartitions(TimeRange.unbounded()).get(0).getFilePath();
    assertThat(blobStore.delete(path)).isTrue();
    lakehouse.getContentCache().invalidate(path);

    final ScanResult result = table.scan(ScanRequest.all());
    assertThat(result.isEmpty()).isTrue();
    assertThat(result.getPartitionsPruned()).isEqualTo(1);
  }

  @Test
  void emptyGlobalTable() {
    final TableProvider table = lakehouse.getCatalog().getTable(BuiltinViews.MEASURES);

    assertThatThrownBy(() -> table.listPartitions(TimeRange.unbounded())).isInstanceOf(PartitionNotFoundException.class);
    final ScanResult result = table.scan(ScanRequest.builder().columns("name", "value").build());
    assertThat(result.isEmpty()).isTrue();
    assertThat(result.getSchema().size()).isEqualTo(2);
    assertThatThrownBy(() -> table.scan(ScanRequest.builder().columns("nope").build())).isInstanceOf(InvalidScanRequestException.class);
  }
}
