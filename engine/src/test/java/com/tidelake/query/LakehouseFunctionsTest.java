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
import com.tidelake.columnar.RecordBatch;
import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.exception.ViewNotFoundException;
import com.tidelake.maintenance.MaintenanceReport;
import com.tidelake.materialize.MaterializationResult;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.partition.Partition;
import com.tidelake.view.BuiltinViews;
import com.tidelake.view.ViewDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LakehouseFunctionsTest extends TestHelper {
  private LakehouseFunctions functions;

  @BeforeEach
  void ingest() {
    functions = lakehouse.getFunctions();
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_LOG);
    insertLogBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), nanos("2024-03-01T10:00:05Z"), "starting", "config loaded");
    insertLogBlock("B1", "S1", "P1", nanos("2024-03-01T10:01:10Z"), nanos("2024-03-01T10:01:05Z"), "ready");
  }

  @SuppressWarnings("unchecked")
  private List<MaterializationResult> materializeLogs() {
    return (List<MaterializationResult>) functions.invoke("materialize_partitions",
        List.of(BuiltinViews.LOG_ENTRIES, "2024-03-01T10:00:00Z", Instant.parse("2024-03-01T10:02:00Z"), "minute"));
  }

  @Test
  void materializeAndListPartitions() {
    assertThat(materializeLogs()).extracting(MaterializationResult::getOutcome)
        .containsExactly(MaterializationResult.Outcome.CREATED, MaterializationResult.Outcome.CREATED);

    final RecordBatch partitions = (RecordBatch) functions.invoke("LIST_PARTITIONS", List.of());
    assertThat(partitions.getSchema()).isEqualTo(LakehouseFunctions.PARTITIONS_SCHEMA);
    assertThat(partitions.getRowCount()).isEqualTo(2);
    assertThat(partitions.getValue("view_set_name", 0)).isEqualTo(BuiltinViews.LOG_ENTRIES);
    assertThat(partitions.getValue("begin_insert_time", 0)).isEqualTo(nanos("2024-03-01T10:00:00Z"));
    assertThat(partitions.getValue("row_count", 0)).isEqualTo(2L);
    assertThat(partitions.getValue("retired_time", 0)).isEqualTo(0L);
    assertThat(partitions.getValue("file_schema_hash", 1))
        .isEqualTo(lakehouse.getRegistry().get(BuiltinViews.LOG_ENTRIES).getFingerprint());
  }

  @Test
  void listViewSetsShowsTheCurrentSchemaHashes() {
    final RecordBatch views = (RecordBatch) functions.invoke("list_view_sets", List.of());

    assertThat(views.getSchema()).isEqualTo(LakehouseFunctions.VIEW_SETS_SCHEMA);
    assertThat(views.toRows()).extracting(r -> r[0]).containsExactly(BuiltinViews.ASYNC_EVENTS, BuiltinViews.BLOCKS, BuiltinViews.LOG_ENTRIES,
        BuiltinViews.MEASURES, BuiltinViews.PROCESSES, BuiltinViews.STREAMS, BuiltinViews.THREAD_SPANS);

    final ViewDefinition logs = lakehouse.getRegistry().get(BuiltinViews.LOG_ENTRIES);
    assertThat(views.toRows().get(2)).containsExactly(BuiltinViews.LOG_ENTRIES, logs.getFingerprint(), logs.getSchema().toString(), "process",
        1L);
    assertThat(views.getValue("instance_key", 6)).isEqualTo("stream");
    assertThat(views.getValue("global_instance_available", 6)).isEqualTo(0L);
    assertThat(views.getValue("instance_key", 1)).isEqualTo("none");

    materializeLogs();
    assertThat(((RecordBatch) functions.invoke("list_partitions", List.of())).getValue("file_schema_hash", 0))
        .isEqualTo(views.getValue("current_schema_hash", 2));
  }

  @Test
  void retireByRangeMetadataAndFile() {
    materializeLogs();
    final List<Partition> live = lakehouse.getPartitionStore().listAll();

    assertThat(functions.invoke("retire_partition_by_metadata",
        List.of(BuiltinViews.LOG_ENTRIES, ViewDefinition.GLOBAL_INSTANCE, nanos("2024-03-01T10:00:00Z"), nanos("2024-03-01T10:00:30Z"))))
        .isEqualTo(false);
    assertThat(functions.invoke("retire_partition_by_file", List.of(live.get(1).getFilePath()))).isEqualTo(1);
    assertThat(lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES).scan(ScanRequest.all()).getRowCount()).isEqualTo(2);

    assertThat(functions.invoke("retire_partitions",
        List.of(BuiltinViews.LOG_ENTRIES, ViewDefinition.GLOBAL_INSTANCE, 0L, Long.MAX_VALUE))).isEqualTo(1);
    assertThat(lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES).scan(ScanRequest.all()).isEmpty()).isTrue();

    final RecordBatch partitions = functions.listPartitions();
    assertThat(partitions.getRowCount()).isEqualTo(2);
    assertThat((Long) partitions.getValue("retired_time", 0)).isPositive();
  }

  @Test
  void retiredBucketIsRebuiltOnNextMaterialization() {
    materializeLogs();
    functions.retirePartitionByMetadata(BuiltinViews.LOG_ENTRIES, ViewDefinition.GLOBAL_INSTANCE, nanos("2024-03-01T10:00:00Z"),
        nanos("2024-03-01T10:01:00Z"));

    assertThat(materializeLogs()).extracting(MaterializationResult::getOutcome)
        .containsExactly(MaterializationResult.Outcome.CREATED, MaterializationResult.Outcome.UP_TO_DATE);
  }

  @Test
  void deleteDuplicates() {
    lakehouse.getMetadataStore().replicate(List.of(), List.of(new StreamInfo("S1", "P1", List.of(StreamInfo.TAG_LOG),
        nanos("2024-03-01T10:00:03Z"))), List.of());

    assertThat(functions.invoke("delete_duplicate_blocks", List.of(0L, Long.MAX_VALUE))).isEqualTo(0);
    assertThat(functions.invoke("delete_duplicate_processes", List.of(0L, Long.MAX_VALUE))).isEqualTo(0);
    assertThat(functions.invoke("delete_duplicate_streams", List.of("2024-03-01T10:00:00Z", "2024-03-01T11:00:00Z"))).isEqualTo(1);
  }

  @Test
  void runMaintenance() {
    final MaintenanceReport report = (MaintenanceReport) functions.invoke("run_maintenance", List.of());

    assertThat(report.getDuplicatesDeleted()).isZero();
    assertThat(lakehouse.getMaintenanceTask().getLastReport()).isSameAs(report);
  }

  @Test
  void invalidCallsAreRejected() {
    assertThatThrownBy(() -> functions.invoke("drop_everything", List.of())).isInstanceOf(InvalidScanRequestException.class);
    assertThatThrownBy(() -> functions.invoke("retire_partition_by_file", List.of())).isInstanceOf(InvalidScanRequestException.class);
    assertThatThrownBy(() -> functions.invoke("delete_duplicate_blocks", List.of("yesterday", 0L)))
        .isInstanceOf(InvalidScanRequestException.class);
    assertThatThrownBy(() -> functions.invoke("materialize_partitions", List.of(BuiltinViews.LOG_ENTRIES, 0L, 1L, "fortnight")))
        .isInstanceOf(InvalidScanRequestException.class);
    assertThatThrownBy(() -> functions.invoke("materialize_partitions", List.of("no_such_view", 0L, 1L, "minute")))
        .isInstanceOf(ViewNotFoundException.class);
  }
}
