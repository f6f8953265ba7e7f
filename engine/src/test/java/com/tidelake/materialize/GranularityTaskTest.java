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
package com.tidelake.materialize;

import com.tidelake.TestHelper;
import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.exception.StorageWriteException;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.partition.Partition;
import com.tidelake.storage.InMemoryBlobStore;
import com.tidelake.time.TimeGranularity;
import com.tidelake.time.TimeRange;
import com.tidelake.view.BuiltinViews;
import com.tidelake.view.ViewDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GranularityTaskTest extends TestHelper {
  private volatile boolean storageDown;

  @Override
  protected InMemoryBlobStore createBlobStore() {
    return new InMemoryBlobStore() {
      @Override
      public void put(final String path, final byte[] content) {
        if (storageDown && path.startsWith("views/"))
          throw new StorageWriteException(path, "Simulated outage", null);
        super.put(path, content);
      }
    };
  }

  private GranularityTask minuteTask() {
    return lakehouse.getScheduler().getTask(TimeGranularity.MINUTE);
  }

  private List<Partition> logPartitions() {
    return lakehouse.getPartitionStore().listPartitions(BuiltinViews.LOG_ENTRIES, ViewDefinition.GLOBAL_INSTANCE, TimeRange.unbounded());
  }

  private void ingest() {
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_LOG);
    insertLogBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), nanos("2024-03-01T10:00:05Z"), "starting", "config loaded");
  }

  @Test
  void pendingRangeCoversTheLastCompletedBuckets() {
    assertThat(minuteTask().pendingRange(nanos("2024-03-01T10:01:05Z"))).isEqualTo(
        new TimeRange(nanos("2024-03-01T09:59:00Z"), nanos("2024-03-01T10:01:00Z")));
    assertThat(lakehouse.getScheduler().getTask(TimeGranularity.HOUR).pendingRange(nanos("2024-03-01T10:01:05Z"))).isEqualTo(
        new TimeRange(nanos("2024-03-01T08:00:00Z"), nanos("2024-03-01T10:00:00Z")));
  }

  @Test
  void tickMaterializesAndAdvancesTheWatermark() {
    ingest();
    clock.set("2024-03-01T10:01:05Z");

    minuteTask().tick();

    assertThat(minuteTask().getWatermark()).isEqualTo(nanos("2024-03-01T10:01:00Z"));
    assertThat(minuteTask().getTickCount()).isEqualTo(1);
    assertThat(minuteTask().getErrorCount()).isZero();
    assertThat(minuteTask().getState()).isEqualTo(TaskState.IDLE);
    assertThat(logPartitions()).hasSize(1);
    // PROCESSES, STREAMS, BLOCKS AND LOG ENTRIES
    assertThat(minuteTask().getPartitionsWritten()).isEqualTo(4);
    assertThat(lakehouse.getPartitionStore().listAll()).extracting(Partition::getViewName)
        .containsExactlyInAnyOrder(BuiltinViews.BLOCKS, BuiltinViews.LOG_ENTRIES, BuiltinViews.PROCESSES, BuiltinViews.STREAMS);
  }

  @Test
  void failedBucketHoldsTheWatermarkUntilItSucceeds() {
    ingest();
    clock.set("2024-03-01T10:01:05Z");
    minuteTask().tick();

    storageDown = true;
    insertLogBlock("B1", "S1", "P1", nanos("2024-03-01T10:01:30Z"), nanos("2024-03-01T10:01:29Z"), "during outage");
    clock.set("2024-03-01T10:05:05Z");
    minuteTask().tick();

    assertThat(minuteTask().getErrorCount()).isPositive();
    assertThat(minuteTask().getWatermark()).isEqualTo(nanos("2024-03-01T10:01:00Z"));
    assertThat(logPartitions()).hasSize(1);

    // THE NEXT TICK GOES BACK TO THE WATERMARK, BEYOND ITS NORMAL LOOKBACK
    storageDown = false;
    clock.set("2024-03-01T10:06:05Z");
    assertThat(minuteTask().pendingRange(nanos("2024-03-01T10:06:05Z")).getBegin()).isEqualTo(nanos("2024-03-01T10:01:00Z"));
    minuteTask().tick();

    assertThat(minuteTask().getWatermark()).isEqualTo(nanos("2024-03-01T10:06:00Z"));
    assertThat(logPartitions()).extracting(Partition::getInsertRange).containsExactly(//
        new TimeRange(nanos("2024-03-01T10:00:00Z"), nanos("2024-03-01T10:01:00Z")),//
        new TimeRange(nanos("2024-03-01T10:01:00Z"), nanos("2024-03-01T10:02:00Z")));
  }

  @Test
  void lateTickIsSkipped() {
    final GranularityTask task = new GranularityTask(TimeGranularity.SECOND, lakehouse.getRegistry(), lakehouse.getMaterializer(),
        Runnable::run, clock, 2, 60, 1_000, 500);

    task.tick();
    clock.advance(Duration.ofSeconds(3));
    task.tick();

    assertThat(task.getTickCount()).isEqualTo(1);
    assertThat(task.getSkippedTickCount()).isEqualTo(1);

    clock.advance(Duration.ofSeconds(1));
    task.tick();
    assertThat(task.getTickCount()).isEqualTo(2);
  }

  @Test
  void onDemandRangeUsesTheRequestedGranularity() {
    ingest();
    insertLogBlock("B1", "S1", "P1", nanos("2024-03-01T10:00:20Z"), nanos("2024-03-01T10:00:19Z"), "second");

    final List<MaterializationResult> results = lakehouse.getScheduler().materializeRange(BuiltinViews.LOG_ENTRIES,
        new TimeRange(nanos("2024-03-01T10:00:10Z"), nanos("2024-03-01T10:00:21Z")), TimeGranularity.SECOND);

    assertThat(results).hasSize(11);
    assertThat(results).filteredOn(MaterializationResult::hasWritten).hasSize(2);
    assertThat(logPartitions()).hasSize(2);
  }

  @Test
  void onDemandRangeRejectsFinerGranularity() {
    assertThatThrownBy(() -> lakehouse.getScheduler().materializeRange(BuiltinViews.PROCESSES, TimeRange.unbounded(),
        TimeGranularity.SECOND)).isInstanceOf(InvalidScanRequestException.class);
  }
}
