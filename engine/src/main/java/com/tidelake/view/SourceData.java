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

import com.tidelake.columnar.RecordBatch;
import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.ProcessInfo;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.time.TimeRange;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Source of one materialization: the records whose insert time falls in the bucket, and a hash identifying them.
 * Payloads and upstream rows are only read when the transform asks for them.
 */
public class SourceData {
  private final TimeRange                 insertRange;
  private final String                    instanceId;
  private final long                      sourceHash;
  private final List<BlockData>           blocks;
  private final List<ProcessInfo>         processes;
  private final List<StreamInfo>          streams;
  private final Supplier<List<RecordBatch>> upstream;
  private final int                       upstreamPartitions;

  /**
   * Block with the stream and process it belongs to. Events are decoded on first access.
   */
  public static class BlockData {
    private final BlockMetadata                               block;
    private final StreamInfo                                  stream;
    private final ProcessInfo                                 process;
    private final Function<BlockMetadata, List<TelemetryEvent>> loader;
    private       List<TelemetryEvent>                        events;

    public BlockData(final BlockMetadata block, final StreamInfo stream, final ProcessInfo process,
        final Function<BlockMetadata, List<TelemetryEvent>> loader) {
      this.block = block;
      this.stream = stream;
      this.process = process;
      this.loader = loader;
    }

    public BlockMetadata getBlock() {
      return block;
    }

    public StreamInfo getStream() {
      return stream;
    }

    /**
     * Owning process, null if the process record is missing.
     */
    public ProcessInfo getProcess() {
      return process;
    }

    public List<TelemetryEvent> getEvents() {
      if (events == null)
        events = loader.apply(block);
      return events;
    }
  }

  private SourceData(final TimeRange insertRange, final String instanceId, final long sourceHash, final List<BlockData> blocks,
      final List<ProcessInfo> processes, final List<StreamInfo> streams, final Supplier<List<RecordBatch>> upstream,
      final int upstreamPartitions) {
    this.insertRange = insertRange;
    this.instanceId = instanceId;
    this.sourceHash = sourceHash;
    this.blocks = blocks;
    this.processes = processes;
    this.streams = streams;
    this.upstream = upstream;
    this.upstreamPartitions = upstreamPartitions;
  }

  public static SourceData ofBlocks(final TimeRange insertRange, final String instanceId, final long sourceHash, final List<BlockData> blocks) {
    return new SourceData(insertRange, instanceId, sourceHash, blocks, List.of(), List.of(), () -> List.of(), 0);
  }

  public static SourceData ofProcesses(final TimeRange insertRange, final long sourceHash, final List<ProcessInfo> processes) {
    return new SourceData(insertRange, null, sourceHash, List.of(), processes, List.of(), () -> List.of(), 0);
  }

  public static SourceData ofStreams(final TimeRange insertRange, final long sourceHash, final List<StreamInfo> streams) {
    return new SourceData(insertRange, null, sourceHash, List.of(), List.of(), streams, () -> List.of(), 0);
  }

  /**
   * Block records without payload access, for the metadata view of blocks.
   */
  public static SourceData ofBlockRecords(final TimeRange insertRange, final long sourceHash, final List<BlockData> blocks) {
    return new SourceData(insertRange, null, sourceHash, blocks, List.of(), List.of(), () -> List.of(), 0);
  }

  public static SourceData ofUpstream(final TimeRange insertRange, final String instanceId, final long sourceHash, final int partitions,
      final Supplier<List<RecordBatch>> upstream) {
    return new SourceData(insertRange, instanceId, sourceHash, List.of(), List.of(), List.of(), upstream, partitions);
  }

  public TimeRange getInsertRange() {
    return insertRange;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public long getSourceHash() {
    return sourceHash;
  }

  public List<BlockData> getBlocks() {
    return blocks;
  }

  public List<ProcessInfo> getProcesses() {
    return processes;
  }

  public List<StreamInfo> getStreams() {
    return streams;
  }

  public List<RecordBatch> getUpstreamBatches() {
    return upstream.get();
  }

  public boolean isEmpty() {
    return blocks.isEmpty() && processes.isEmpty() && streams.isEmpty() && upstreamPartitions == 0;
  }
}
