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

import com.tidelake.columnar.RecordBatch;
import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.MetadataStore;
import com.tidelake.metadata.ProcessInfo;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionReader;
import com.tidelake.partition.PartitionStore;
import com.tidelake.storage.BlobStore;
import com.tidelake.time.TimeRange;
import com.tidelake.view.InstanceKey;
import com.tidelake.view.PayloadDecoder;
import com.tidelake.view.SourceData;
import com.tidelake.view.TelemetryEvent;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;
import com.tidelake.view.ViewSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Finds the source records of a (view, instance, insert-time bucket) and computes their hash. Only metadata is read
 * here: payloads and upstream partitions are loaded when the transform consumes them.
 */
public class SourceResolver {
  private static final Comparator<BlockMetadata> INSERT_ORDER = Comparator.comparingLong(BlockMetadata::getInsertTime)
      .thenComparing(BlockMetadata::getBlockId);

  private final MetadataStore   metadataStore;
  private final PartitionStore  partitionStore;
  private final PartitionReader partitionReader;
  private final BlobStore       blobStore;
  private final ViewRegistry    registry;

  public SourceResolver(final MetadataStore metadataStore, final PartitionStore partitionStore, final PartitionReader partitionReader,
      final BlobStore blobStore, final ViewRegistry registry) {
    this.metadataStore = metadataStore;
    this.partitionStore = partitionStore;
    this.partitionReader = partitionReader;
    this.blobStore = blobStore;
    this.registry = registry;
  }

  /**
   * @return the source of the bucket, or null when the upstream partitions are not aligned on the bucket yet
   */
  public SourceData resolve(final ViewDefinition view, final String instanceId, final TimeRange bucket) {
    final ViewSource source = view.getSource();
    switch (source.getKind()) {
    case BLOCKS:
      return resolveBlocks(view, instanceId, bucket);
    case METADATA:
      return resolveMetadata(source.getMetadataKind(), bucket);
    default:
      return resolveUpstream(registry.get(source.getUpstreamView()), instanceId, bucket);
    }
  }

  /**
   * Streams of the instance carrying the tag of the view.
   */
  public List<String> resolveStreamIds(final ViewDefinition view, final String instanceId) {
    final String tag = view.getSource().getStreamTag();
    final List<String> result = new ArrayList<>();
    if (view.getInstanceKey() == InstanceKey.STREAM) {
      final StreamInfo stream = metadataStore.getStream(instanceId);
      if (stream != null && (tag == null || stream.hasTag(tag)))
        result.add(stream.getStreamId());
    } else
      for (final StreamInfo s : metadataStore.listStreamsForProcess(instanceId))
        if (tag == null || s.hasTag(tag))
          result.add(s.getStreamId());
    return result;
  }

  private SourceData resolveBlocks(final ViewDefinition view, final String instanceId, final TimeRange bucket) {
    final List<BlockMetadata> blocks;
    if (ViewDefinition.GLOBAL_INSTANCE.equals(instanceId))
      blocks = metadataStore.listBlocks(view.getSource().getStreamTag(), bucket, 0);
    else {
      blocks = new ArrayList<>();
      for (final String streamId : resolveStreamIds(view, instanceId))
        blocks.addAll(metadataStore.listBlocks(streamId, bucket));
      blocks.sort(INSERT_ORDER);
    }

    final Map<String, StreamInfo> streams = new HashMap<>();
    final Map<String, ProcessInfo> processes = new HashMap<>();
    final Function<BlockMetadata, List<TelemetryEvent>> loader = b -> PayloadDecoder.decode(blobStore.get(b.getPayloadPath()));

    long hash = 0;
    final List<SourceData.BlockData> data = new ArrayList<>(blocks.size());
    for (final BlockMetadata b : blocks) {
      hash += SourceHash.of(b);
      final StreamInfo stream = streams.computeIfAbsent(b.getStreamId(), metadataStore::getStream);
      final ProcessInfo process = processes.computeIfAbsent(b.getProcessId(), metadataStore::getProcess);
      data.add(new SourceData.BlockData(b, stream, process, loader));
    }
    return SourceData.ofBlocks(bucket, instanceId, hash, data);
  }

  private SourceData resolveMetadata(final ViewSource.MetadataKind kind, final TimeRange bucket) {
    long hash = 0;
    switch (kind) {
    case PROCESSES: {
      final List<ProcessInfo> processes = metadataStore.listProcessesInserted(bucket);
      for (final ProcessInfo p : processes)
        hash += SourceHash.of(p);
      return SourceData.ofProcesses(bucket, hash, processes);
    }
    case STREAMS: {
      final List<StreamInfo> streams = metadataStore.listStreams(bucket);
      for (final StreamInfo s : streams)
        hash += SourceHash.of(s);
      return SourceData.ofStreams(bucket, hash, streams);
    }
    default: {
      final List<BlockMetadata> blocks = metadataStore.listBlocks(null, bucket, 0);
      final List<SourceData.BlockData> data = new ArrayList<>(blocks.size());
      for (final BlockMetadata b : blocks) {
        hash += SourceHash.of(b);
        data.add(new SourceData.BlockData(b, null, null, block -> List.of()));
      }
      return SourceData.ofBlockRecords(bucket, hash, data);
    }
    }
  }

  private SourceData resolveUpstream(final ViewDefinition upstream, final String instanceId, final TimeRange bucket) {
    final List<Partition> partitions = new ArrayList<>();
    long hash = 0;
    for (final Partition p : partitionStore.listPartitions(upstream.getName(), instanceId, bucket)) {
      if (!bucket.contains(p.getInsertRange()) || !p.getFingerprint().equals(upstream.getFingerprint()))
        return null;
      partitions.add(p);
      hash += SourceHash.of(p);
    }

    return SourceData.ofUpstream(bucket, instanceId, hash, partitions.size(), () -> {
      final List<RecordBatch> batches = new ArrayList<>();
      for (final Partition p : partitions)
        batches.addAll(partitionReader.readAll(p, upstream.getSchema()));
      return batches;
    });
  }
}
