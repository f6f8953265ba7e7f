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
package com.tidelake.view;

import com.tidelake.TestHelper;
import com.tidelake.columnar.RecordBatch;
import com.tidelake.columnar.RecordBatchBuilder;
import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.query.ScanRequest;
import com.tidelake.query.ScanResult;
import com.tidelake.time.TimeRange;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadSpansTransformTest extends TestHelper {

  private static PayloadBuilder nestedScopes(final long base) {
    return new PayloadBuilder()//
        .endScope(base, "started_earlier", "app::main", "main.rs", 1)//
        .beginScope(base + 1_000, "outer", "app::main", "main.rs", 10)//
        .beginScope(base + 2_000, "inner", "app::db", "db.rs", 20)//
        .endScope(base + 3_000, "inner", "app::db", "db.rs", 20)//
        .endScope(base + 5_000, "outer", "app::main", "main.rs", 10)//
        .beginScope(base + 6_000, "tail", "app::main", "main.rs", 30);
  }

  @Test
  void scopesArePairedIntoSpans() {
    final PayloadBuilder payload = nestedScopes(0);
    final BlockMetadata block = BlockMetadata.builder("B0", "S1", "P1").timeRange(0, 9_000).nbObjects(payload.getEventCount())
        .payloadSize(payload.build().length).insertTime(10_000).build();
    final SourceData source = SourceData.ofBlocks(TimeRange.of(0, 20_000), "S1", 1L,
        List.of(new SourceData.BlockData(block, null, null, b -> PayloadDecoder.decode(payload.build()))));

    final RecordBatchBuilder output = new RecordBatchBuilder(BuiltinViews.threadSpans().getSchema());
    new ThreadSpansTransform().apply(source, output);
    final RecordBatch spans = output.build();

    assertThat(spans.getRowCount()).isEqualTo(3);
    // id, parent, depth, begin, end
    assertThat(row(spans, 0)).containsExactly(1L, 0L, 0L, 1_000L, 5_000L);
    assertThat(row(spans, 1)).containsExactly(2L, 1L, 1L, 2_000L, 3_000L);
    // STILL OPEN: CLOSED AT THE BLOCK END
    assertThat(row(spans, 2)).containsExactly(3L, 0L, 0L, 6_000L, 9_000L);

    assertThat(spans.getValue("name", 1)).isEqualTo("inner");
    assertThat(spans.getValue("duration", 0)).isEqualTo(4_000L);
    assertThat(spans.getValue("stream_id", 0)).isEqualTo("S1");
  }

  @Test
  void scopeHashIdentifiesTheCallSite() {
    final long hash = ThreadSpansTransform.scopeHash("outer", "app::main", "main.rs", 10);

    assertThat(ThreadSpansTransform.scopeHash("outer", "app::main", "main.rs", 10)).isEqualTo(hash);
    assertThat(ThreadSpansTransform.scopeHash("outer", "app::main", "main.rs", 11)).isNotEqualTo(hash);
    assertThat(ThreadSpansTransform.scopeHash("oute", "rapp::main", "main.rs", 10)).isNotEqualTo(hash);
  }

  @Test
  void streamInstanceIsMaterializedOnDemand() {
    final long base = nanos("2024-03-01T10:00:05Z");
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_CPU);
    insertStream("S2", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_CPU);
    insertBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), nestedScopes(base), base, base + 9_000);
    insertBlock("C0", "S2", "P1", nanos("2024-03-01T10:00:10Z"), new PayloadBuilder().beginScope(base, "other", "app::io", "io.rs", 5),
        base, base + 2_000);

    final ScanResult result = lakehouse.getCatalog().viewInstance(BuiltinViews.THREAD_SPANS, "S1")
        .scan(ScanRequest.builder().columns("name", "depth").build());

    final List<Object[]> rows = result.toRows();
    rows.sort(Comparator.comparing(r -> (String) r[0]));
    assertThat(rows).hasSize(3);
    assertThat(rows.get(0)).containsExactly("inner", 1L);
    assertThat(rows.get(1)).containsExactly("outer", 0L);
    assertThat(rows.get(2)).containsExactly("tail", 0L);
  }

  @Test
  void asyncEventsKeepBothEnds() {
    final long base = nanos("2024-03-01T10:00:05Z");
    insertProcess("P1", nanos("2024-03-01T10:00:00Z"));
    insertStream("S1", "P1", nanos("2024-03-01T10:00:01Z"), StreamInfo.TAG_CPU);
    insertBlock("B0", "S1", "P1", nanos("2024-03-01T10:00:10Z"), new PayloadBuilder()//
        .beginAsync(base, 7, 0, "fetch", "app::io", "io.rs", 12)//
        .beginScope(base + 1, "sync", "app::main", "main.rs", 3)//
        .endAsync(base + 2, 7, 0, "fetch", "app::io", "io.rs", 12), base, base + 3);

    final ScanResult result = lakehouse.getCatalog().viewInstance(BuiltinViews.ASYNC_EVENTS, "P1")
        .scan(ScanRequest.builder().columns("event_type", "span_id", "name").build());

    final List<Object[]> rows = result.toRows();
    rows.sort(Comparator.comparing(r -> (String) r[0]));
    assertThat(rows).hasSize(2);
    assertThat(rows.get(0)).containsExactly("begin", 7L, "fetch");
    assertThat(rows.get(1)).containsExactly("end", 7L, "fetch");
  }

  private static Object[] row(final RecordBatch batch, final int row) {
    return new Object[] { batch.getValue("id", row), batch.getValue("parent", row), batch.getValue("depth", row), batch.getValue("begin", row),
        batch.getValue("end", row) };
  }
}
