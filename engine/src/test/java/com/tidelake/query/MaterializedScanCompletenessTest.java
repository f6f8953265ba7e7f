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
import com.tidelake.columnar.RecordBatchBuilder;
import com.tidelake.materialize.MaterializationResult;
import com.tidelake.materialize.SourceResolver;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.partition.PartitionReader;
import com.tidelake.time.TimeGranularity;
import com.tidelake.time.TimeRange;
import com.tidelake.view.BuiltinViews;
import com.tidelake.view.ViewDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Rows scanned from the materialized partitions of a global view equal the rows derived directly from the raw blocks,
 * including after blocks arrive late in buckets already materialized.
 */
class MaterializedScanCompletenessTest extends TestHelper {
  private static final TimeRange THREE_MINUTES = new TimeRange(nanos("2024-03-01T10:00:00Z"), nanos("2024-03-01T10:03:00Z"));

  @BeforeEach
  void ingest() {
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_LOG);
    insertStream("S2", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_METRICS);

    insertLogBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), nanos("2024-03-01T10:00:05Z"), "starting", "config loaded");
    insertLogBlock("B1", "S1", "P1", nanos("2024-03-01T10:01:20Z"), nanos("2024-03-01T10:01:15Z"), "listening");
    insertLogBlock("B2", "S1", "P1", nanos("2024-03-01T10:02:40Z"), nanos("2024-03-01T10:02:30Z"), "request served", "idle");
    insertMeasureBlock("M0", "S2", "P1", nanos("2024-03-01T10:00:30Z"), nanos("2024-03-01T10:00:25Z"), "latency", 1.5, 2.5);
    insertMeasureBlock("M1", "S2", "P1", nanos("2024-03-01T10:02:10Z"), nanos("2024-03-01T10:02:05Z"), "latency", 3.5);
  }

  private List<List<Object>> scanned(final String viewName, final ScanRequest request) {
    return rows(lakehouse.getCatalog().getTable(viewName).scan(request).toRows());
  }

  private List<List<Object>> derived(final String viewName, final TimeRange eventRange) {
    final ViewDefinition view = lakehouse.getRegistry().get(viewName);
    final SourceResolver resolver = new SourceResolver(lakehouse.getMetadataStore(), lakehouse.getPartitionStore(),
        new PartitionReader(lakehouse.getContentCache()), blobStore, lakehouse.getRegistry());
    final RecordBatchBuilder builder = new RecordBatchBuilder(view.getSchema());
    view.getTransform().apply(resolver.resolve(view, ViewDefinition.GLOBAL_INSTANCE, THREE_MINUTES), builder);

    final int timeColumn = view.getSchema().indexOf(view.getEventTimeColumn());
    final List<Object[]> inRange = new ArrayList<>();
    for (final Object[] row : builder.build().toRows())
      if (eventRange.contains((Long) row[timeColumn]))
        inRange.add(row);
    return rows(inRange);
  }

  private static List<List<Object>> rows(final List<Object[]> rows) {
    final List<List<Object>> result = new ArrayList<>(rows.size());
    for (final Object[] row : rows)
      result.add(Arrays.asList(row));
    return result;
  }

  private void materializeAll() {
    clock.set("2024-03-01T10:03:05Z");
    for (final String view : List.of(BuiltinViews.LOG_ENTRIES, BuiltinViews.MEASURES))
      lakehouse.getScheduler().materializeRange(view, THREE_MINUTES, TimeGranularity.MINUTE);
  }

  @Test
  void scanMatchesDerivationAcrossBuckets() {
    materializeAll();

    assertThat(scanned(BuiltinViews.LOG_ENTRIES, ScanRequest.all())).hasSize(5)
        .containsExactlyInAnyOrderElementsOf(derived(BuiltinViews.LOG_ENTRIES, TimeRange.unbounded()));
    assertThat(scanned(BuiltinViews.MEASURES, ScanRequest.all())).hasSize(3)
        .containsExactlyInAnyOrderElementsOf(derived(BuiltinViews.MEASURES, TimeRange.unbounded()));
  }

  @Test
  void lateBlocksAreIncludedAfterRematerialization() {
    materializeAll();

    // INSERTED IN BUCKETS ALREADY MATERIALIZED, WITH EVENTS OLDER THAN THEIR NEIGHBOURS
    insertLogBlock("B3", "S1", "P1", nanos("2024-03-01T10:01:50Z"), nanos("2024-03-01T10:00:40Z"), "late warning");
    insertMeasureBlock("M2", "S2", "P1", nanos("2024-03-01T10:00:55Z"), nanos("2024-03-01T10:00:50Z"), "latency", 9.5);

    final List<MaterializationResult> results = lakehouse.getScheduler().materializeRange(BuiltinViews.LOG_ENTRIES, THREE_MINUTES,
        TimeGranularity.MINUTE);
    assertThat(results).extracting(MaterializationResult::getOutcome).containsExactly(MaterializationResult.Outcome.UP_TO_DATE,
        MaterializationResult.Outcome.CREATED, MaterializationResult.Outcome.UP_TO_DATE);
    lakehouse.getScheduler().materializeRange(BuiltinViews.MEASURES, THREE_MINUTES, TimeGranularity.MINUTE);

    assertThat(scanned(BuiltinViews.LOG_ENTRIES, ScanRequest.all())).hasSize(6)
        .containsExactlyInAnyOrderElementsOf(derived(BuiltinViews.LOG_ENTRIES, TimeRange.unbounded()));
    assertThat(scanned(BuiltinViews.MEASURES, ScanRequest.all())).hasSize(4)
        .containsExactlyInAnyOrderElementsOf(derived(BuiltinViews.MEASURES, TimeRange.unbounded()));

    // SAME ROWS WHEN THE QUERY RESTRICTS EVENT TIMES
    final TimeRange firstMinute = new TimeRange(nanos("2024-03-01T10:00:00Z"), nanos("2024-03-01T10:01:00Z"));
    assertThat(scanned(BuiltinViews.LOG_ENTRIES, ScanRequest.builder().eventRange(firstMinute.getBegin(), firstMinute.getEnd()).build()))
        .hasSize(3)
        .containsExactlyInAnyOrderElementsOf(derived(BuiltinViews.LOG_ENTRIES, firstMinute));
  }
}
