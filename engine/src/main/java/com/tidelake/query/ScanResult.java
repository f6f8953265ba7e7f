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

import com.tidelake.columnar.RecordBatch;
import com.tidelake.columnar.TableSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by a scan, as decoded batches in ascending time order of their partitions, plus pruning counters.
 */
public class ScanResult {
  private final TableSchema       schema;
  private final List<RecordBatch> batches;
  private final int               partitionsScanned;
  private final int               partitionsPruned;
  private final int               chunksRead;
  private final int               chunksPruned;

  public ScanResult(final TableSchema schema, final List<RecordBatch> batches, final int partitionsScanned, final int partitionsPruned,
      final int chunksRead, final int chunksPruned) {
    this.schema = schema;
    this.batches = Collections.unmodifiableList(batches);
    this.partitionsScanned = partitionsScanned;
    this.partitionsPruned = partitionsPruned;
    this.chunksRead = chunksRead;
    this.chunksPruned = chunksPruned;
  }

  public static ScanResult empty(final TableSchema schema) {
    return new ScanResult(schema, List.of(), 0, 0, 0, 0);
  }

  public TableSchema getSchema() {
    return schema;
  }

  public List<RecordBatch> getBatches() {
    return batches;
  }

  public long getRowCount() {
    long total = 0;
    for (final RecordBatch b : batches)
      total += b.getRowCount();
    return total;
  }

  public boolean isEmpty() {
    return getRowCount() == 0;
  }

  public List<Object[]> toRows() {
    final List<Object[]> rows = new ArrayList<>();
    for (final RecordBatch b : batches)
      rows.addAll(b.toRows());
    return rows;
  }

  public RecordBatch toBatch() {
    return RecordBatch.concat(schema, batches);
  }

  public int getPartitionsScanned() {
    return partitionsScanned;
  }

  public int getPartitionsPruned() {
    return partitionsPruned;
  }

  public int getChunksRead() {
    return chunksRead;
  }

  public int getChunksPruned() {
    return chunksPruned;
  }

  @Override
  public String toString() {
    return "ScanResult{rows=" + getRowCount() + ", partitions=" + partitionsScanned + "/" + (partitionsScanned + partitionsPruned) + ", chunks="
        + chunksRead + "/" + (chunksRead + chunksPruned) + "}";
  }
}
