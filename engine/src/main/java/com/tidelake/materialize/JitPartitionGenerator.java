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

import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.log.LogManager;
import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.MetadataStore;
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.time.TimeRange;
import com.tidelake.time.TimeUtils;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

/**
 * Materializes the partitions of one view instance (a process or a stream) on demand, when a query asks for it.
 * <p>
 * The insert times of the blocks of the instance overlapping the requested event range are cut in buckets aligned on the
 * configured width. A bucket holding more telemetry objects than allowed is halved until it fits, down to one second.
 * Each bucket is materialized under its own lease, so concurrent queries for the same instance share one computation.
 */
public class JitPartitionGenerator {
  private static final long MIN_SPLIT_WIDTH = 1_000_000_000L;

  private final ViewRegistry           registry;
  private final MetadataStore          metadataStore;
  private final SourceResolver         resolver;
  private final PartitionMaterializer  materializer;
  private final PartitionMetadataCache metadataCache;
  private final LeaseManager           leaseManager;
  private final long                   bucketWidth;
  private final long                   maxObjects;
  private final AtomicLong             materializations = new AtomicLong();

  public JitPartitionGenerator(final ViewRegistry registry, final MetadataStore metadataStore, final SourceResolver resolver,
      final PartitionMaterializer materializer, final PartitionMetadataCache metadataCache, final LeaseManager leaseManager,
      final long bucketWidthMs, final long maxObjects) {
    if (bucketWidthMs <= 0)
      throw new IllegalArgumentException("Invalid just-in-time bucket width " + bucketWidthMs);
    this.registry = registry;
    this.metadataStore = metadataStore;
    this.resolver = resolver;
    this.materializer = materializer;
    this.metadataCache = metadataCache;
    this.leaseManager = leaseManager;
    this.bucketWidth = TimeUtils.millisToNanos(bucketWidthMs);
    this.maxObjects = maxObjects;
  }

  /**
   * Brings the partitions of the instance up to date for the event range and returns the ones that may contain events
   * of the range, sorted by insert time.
   */
  public List<Partition> generate(final String viewName, final String instanceId, final TimeRange eventRange) {
    final ViewDefinition view = registry.get(viewName);
    if (!view.supportsInstances())
      throw new InvalidScanRequestException("View '" + viewName + "' has no instances");
    if (instanceId == null || instanceId.isEmpty() || ViewDefinition.GLOBAL_INSTANCE.equals(instanceId))
      throw new InvalidScanRequestException("Invalid instance '" + instanceId + "' for view '" + viewName + "'");

    final List<String> streamIds = resolver.resolveStreamIds(view, instanceId);
    final TimeRange insertBounds = metadataStore.findBlockInsertTimeBounds(streamIds, eventRange);
    if (insertBounds == null) {
      LogManager.instance().log(this, Level.FINE, "No blocks for %s/%s in %s", null, viewName, instanceId, eventRange);
      return List.of();
    }

    for (final TimeRange bucket : buckets(insertBounds))
      for (final TimeRange range : split(streamIds, bucket))
        materialize(view, instanceId, range);

    return metadataCache.getPartitions(viewName, instanceId, eventRange);
  }

  List<TimeRange> buckets(final TimeRange insertBounds) {
    final List<TimeRange> result = new ArrayList<>();
    for (long begin = Math.floorDiv(insertBounds.getBegin(), bucketWidth) * bucketWidth; begin < insertBounds.getEnd(); begin += bucketWidth)
      result.add(new TimeRange(begin, begin + bucketWidth));
    return result;
  }

  private List<TimeRange> split(final List<String> streamIds, final TimeRange bucket) {
    final List<TimeRange> result = new ArrayList<>();
    splitInto(streamIds, bucket, result);
    return result;
  }

  private void splitInto(final List<String> streamIds, final TimeRange range, final List<TimeRange> result) {
    if (maxObjects <= 0 || range.getDuration() <= MIN_SPLIT_WIDTH || countObjects(streamIds, range) <= maxObjects) {
      result.add(range);
      return;
    }
    final long middle = range.getBegin() + range.getDuration() / 2;
    splitInto(streamIds, new TimeRange(range.getBegin(), middle), result);
    splitInto(streamIds, new TimeRange(middle, range.getEnd()), result);
  }

  private long countObjects(final List<String> streamIds, final TimeRange range) {
    long total = 0;
    for (final String streamId : streamIds)
      for (final BlockMetadata b : metadataStore.listBlocks(streamId, range))
        total += b.getNbObjects();
    return total;
  }

  private void materialize(final ViewDefinition view, final String instanceId, final TimeRange range) {
    final MaterializationResult result = materializeUnderLease(view, instanceId, range);
    if (result.getOutcome() == MaterializationResult.Outcome.ABORTED && result.getCoveringRange() != null)
      // A WIDER PARTITION OWNS THE RANGE: BRING THAT ONE UP TO DATE INSTEAD
      materializeUnderLease(view, instanceId, result.getCoveringRange());
  }

  private MaterializationResult materializeUnderLease(final ViewDefinition view, final String instanceId, final TimeRange range) {
    final String leaseKey = view.getName() + "/" + instanceId + "/" + range.getBegin() + "-" + range.getEnd();
    return leaseManager.acquire(leaseKey, () -> {
      final MaterializationResult result = materializer.materialize(view, instanceId, range);
      if (result.hasWritten())
        materializations.incrementAndGet();
      return result;
    });
  }

  /**
   * Number of partitions written on demand.
   */
  public long getMaterializationCount() {
    return materializations.get();
  }

  public LeaseManager getLeaseManager() {
    return leaseManager;
  }
}
