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
package com.tidelake.maintenance;

import com.tidelake.GlobalConfiguration;
import com.tidelake.TestHelper;
import com.tidelake.exception.StorageException;
import com.tidelake.materialize.MaterializationResult;
import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.partition.Partition;
import com.tidelake.query.ScanRequest;
import com.tidelake.serializer.json.JSONObject;
import com.tidelake.storage.InMemoryBlobStore;
import com.tidelake.time.TimeGranularity;
import com.tidelake.time.TimeRange;
import com.tidelake.view.BuiltinViews;
import com.tidelake.view.PayloadBuilder;
import com.tidelake.view.ViewDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MaintenanceTaskTest extends TestHelper {
  private static final TimeRange MINUTE_10_00 = new TimeRange(nanos("2024-03-01T10:00:00Z"), nanos("2024-03-01T10:01:00Z"));

  private volatile boolean  deletesFail;
  private volatile Runnable afterNextPut;

  @Override
  protected InMemoryBlobStore createBlobStore() {
    return new InMemoryBlobStore() {
      @Override
      public void put(final String path, final byte[] content) {
        super.put(path, content);
        final Runnable hook = afterNextPut;
        afterNextPut = null;
        if (hook != null)
          hook.run();
      }

      @Override
      public boolean delete(final String path) {
        if (deletesFail)
          throw new StorageException(path, "Simulated outage", null);
        return super.delete(path);
      }
    };
  }

  private void ingest() {
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_LOG);
    insertLogBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), nanos("2024-03-01T10:00:05Z"), "starting", "config loaded");
  }

  private MaterializationResult materializeLogs() {
    final ViewDefinition view = lakehouse.getRegistry().get(BuiltinViews.LOG_ENTRIES);
    return lakehouse.getMaterializer().materialize(view, ViewDefinition.GLOBAL_INSTANCE, MINUTE_10_00);
  }

  private static ViewDefinition logEntriesVersion(final String version) {
    final ViewDefinition base = BuiltinViews.logEntries();
    return ViewDefinition.builder(base.getName())
        .schema(base.getSchema())
        .source(base.getSource())
        .transform(base.getTransform())
        .eventTimeColumn(base.getEventTimeColumn())
        .granularity(base.getGranularity())
        .mergeGranularity(base.getMergeGranularity())
        .instanceKey(base.getInstanceKey())
        .updateGroup(base.getUpdateGroup())
        .version(version)
        .build();
  }

  @Test
  void replacedViewRetiresItsOldPartitions() {
    ingest();
    final Partition old = materializeLogs().getPartition();

    final ViewDefinition v2 = logEntriesVersion("2");
    assertThat(v2.getFingerprint()).isNotEqualTo(old.getFingerprint());
    lakehouse.replaceView(v2);

    // STALE PARTITIONS ARE NEVER SCANNED, EVEN BEFORE MAINTENANCE RUNS
    assertThat(lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES).scan(ScanRequest.all()).isEmpty()).isTrue();

    final MaintenanceReport report = lakehouse.getMaintenanceTask().runOnce();
    assertThat(report.getPartitionsRetired()).isEqualTo(1);
    assertThat(report.getPartitionsCollected()).isZero();

    final MaterializationResult rebuilt = materializeLogs();
    assertThat(rebuilt.getOutcome()).isEqualTo(MaterializationResult.Outcome.CREATED);
    assertThat(rebuilt.getPartition().getFingerprint()).isEqualTo(v2.getFingerprint());
    assertThat(rebuilt.getPartition().getFilePath()).isNotEqualTo(old.getFilePath());
    assertThat(lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES).scan(ScanRequest.all()).getRowCount()).isEqualTo(2);

    // THE OLD FILE SURVIVES THE GRACE PERIOD FOR IN-FLIGHT READERS
    clock.advance(Duration.ofMinutes(30));
    assertThat(lakehouse.getMaintenanceTask().runOnce().getPartitionsCollected()).isZero();
    assertThat(blobStore.exists(old.getFilePath())).isTrue();

    clock.advance(Duration.ofHours(1));
    assertThat(lakehouse.getMaintenanceTask().runOnce().getPartitionsCollected()).isEqualTo(1);
    assertThat(blobStore.exists(old.getFilePath())).isFalse();
    assertThat(blobStore.exists(rebuilt.getPartition().getFilePath())).isTrue();
    assertThat(lakehouse.getPartitionStore().listAll()).containsExactly(rebuilt.getPartition());
  }

  @Test
  void fileStillReferencedByTheLivePartitionIsKept() {
    ingest();
    final Partition first = materializeLogs().getPartition();
    insertLogBlock("B1", "S1", "P1", nanos("2024-03-01T10:00:30Z"), nanos("2024-03-01T10:00:29Z"), "late");
    final Partition second = materializeLogs().getPartition();
    assertThat(second.getFilePath()).isEqualTo(first.getFilePath());

    clock.advance(Duration.ofHours(2));
    final MaintenanceReport report = lakehouse.getMaintenanceTask().runOnce();

    assertThat(report.getPartitionsCollected()).isEqualTo(1);
    assertThat(blobStore.exists(second.getFilePath())).isTrue();
    assertThat(lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES).scan(ScanRequest.all()).getRowCount()).isEqualTo(3);
  }

  @Test
  void fileCollectedBetweenWriteAndRegistrationIsWrittenAgain() {
    ingest();
    final Partition first = materializeLogs().getPartition();
    lakehouse.getPartitionStore().retirePartitions(BuiltinViews.LOG_ENTRIES, ViewDefinition.GLOBAL_INSTANCE, MINUTE_10_00,
        nanos("2024-03-01T10:02:00Z"));
    clock.advance(Duration.ofHours(2));

    // THE RETIRED PARTITION SHARES THE PATH OF THE ONE BEING WRITTEN: COLLECT IT RIGHT AFTER THE NEW FILE LANDS
    afterNextPut = () -> assertThat(lakehouse.getMaintenanceTask().runOnce().getPartitionsCollected()).isEqualTo(1);
    final MaterializationResult rebuilt = materializeLogs();

    assertThat(afterNextPut).isNull();
    assertThat(rebuilt.getOutcome()).isEqualTo(MaterializationResult.Outcome.CREATED);
    assertThat(rebuilt.getPartition().getFilePath()).isEqualTo(first.getFilePath());
    assertThat(rebuilt.getPartition().isRetired()).isFalse();
    assertThat(blobStore.exists(rebuilt.getPartition().getFilePath())).isTrue();
    assertThat(lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES).scan(ScanRequest.all()).getRowCount()).isEqualTo(2);
  }

  @Test
  void failedFileDeletionKeepsThePartitionRow() {
    ingest();
    final Partition old = materializeLogs().getPartition();
    lakehouse.replaceView(logEntriesVersion("2"));
    lakehouse.getMaintenanceTask().runOnce();

    deletesFail = true;
    clock.advance(Duration.ofHours(2));
    assertThat(lakehouse.getMaintenanceTask().runOnce().getPartitionsCollected()).isZero();
    assertThat(lakehouse.getPartitionStore().listAll()).extracting(Partition::getPartitionId).containsExactly(old.getPartitionId());

    deletesFail = false;
    assertThat(lakehouse.getMaintenanceTask().runOnce().getPartitionsCollected()).isEqualTo(1);
    assertThat(blobStore.exists(old.getFilePath())).isFalse();
  }

  @Test
  void duplicatesAreDeleted() {
    ingest();
    final PayloadBuilder payload = new PayloadBuilder().log(nanos("2024-03-01T10:00:05Z"), "app::main", "INFO", "starting");
    final BlockMetadata replay = newBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:12Z"), payload, nanos("2024-03-01T10:00:05Z"),
        nanos("2024-03-01T10:00:06Z"));
    lakehouse.getMetadataStore().replicate(List.of(), List.of(new StreamInfo("S1", "P1", List.of(StreamInfo.TAG_LOG),
        nanos("2024-03-01T10:00:02Z"))), List.of(replay));

    clock.set("2024-03-01T11:00:00Z");
    final MaintenanceReport report = lakehouse.getMaintenanceTask().runOnce();

    assertThat(report.getDuplicatesDeleted()).isEqualTo(2);
    assertThat(lakehouse.getMaintenanceTask().runOnce().getDuplicatesDeleted()).isZero();
    assertThat(lakehouse.getMetadataStore().listBlocks("S1", TimeRange.unbounded())).hasSize(1);
  }

  @Test
  void retentionExpiresRawDataAndPartitions() {
    ingest();
    materializeLogs();
    lakehouse.getScheduler().materializeRange(BuiltinViews.BLOCKS, MINUTE_10_00, TimeGranularity.MINUTE);

    final MaintenanceTask task = new MaintenanceTask(lakehouse.getDeduplicator(), lakehouse.getSchemaRetirement(),
        new PartitionGarbageCollector(lakehouse.getPartitionStore(), blobStore, lakehouse.getContentCache(), lakehouse.getPartitionLocks(),
            clock, 0),
        lakehouse.getMetadataStore(), lakehouse.getPartitionStore(), lakehouse.getMetadataCache(), clock,
        newTestConfiguration().setValue(GlobalConfiguration.MAINTENANCE_RETENTION, 3_600_000L));

    clock.set("2024-03-01T11:30:00Z");
    final MaintenanceReport report = task.runOnce();

    assertThat(report.getExpiredBlocksDeleted()).isEqualTo(1);
    assertThat(report.getExpiredPartitionsRetired()).isEqualTo(2);
    assertThat(report.getPartitionsCollected()).isZero();
    assertThat(lakehouse.getMetadataStore().getProcess("P1")).isNull();
    assertThat(lakehouse.getCatalog().getTable(BuiltinViews.LOG_ENTRIES).scan(ScanRequest.all()).isEmpty()).isTrue();

    clock.advance(Duration.ofSeconds(1));
    final MaintenanceReport next = task.runOnce();
    assertThat(next.getPartitionsCollected()).isEqualTo(2);
    assertThat(lakehouse.getPartitionStore().listAll()).isEmpty();
    assertThat(task.getPassCount()).isEqualTo(2);

    final JSONObject json = report.toJSON();
    assertThat(json.getInt("expiredBlocksDeleted")).isEqualTo(1);
    assertThat(json.getInt("expiredPartitionsRetired")).isEqualTo(2);
  }
}
