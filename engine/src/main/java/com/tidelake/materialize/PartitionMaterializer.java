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

import com.tidelake.columnar.PartitionFileWriter;
import com.tidelake.columnar.RecordBatch;
import com.tidelake.columnar.RecordBatchBuilder;
import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.StaleMaterializationException;
import com.tidelake.exception.StorageWriteException;
import com.tidelake.log.LogManager;
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionLocks;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.partition.PartitionPaths;
import com.tidelake.partition.PartitionReader;
import com.tidelake.partition.PartitionStore;
import com.tidelake.storage.BlobStore;
import com.tidelake.storage.ContentCache;
import com.tidelake.time.TimeRange;
import com.tidelake.time.TimeUtils;
import com.tidelake.view.SourceData;
import com.tidelake.view.ViewDefinition;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;

/**
 * Materializes one (view, instance, insert-time bucket). Shared by the scheduled tasks and the just-in-time generator.
 * <p>
 * Strategy, in order:
 * <ol>
 *   <li>a live partition overlapping the bucket extends beyond it: abort, a coarser partition already covers it</li>
 *   <li>one partition equal to the bucket with the current fingerprint and source hash: up to date</li>
 *   <li>no partition and no source: skip</li>
 *   <li>two or more contained partitions with the current fingerprint whose source hashes add up to the current one,
 *   bucket within the merge granularity: merge their rows</li>
 *   <li>otherwise: derive the bucket from its source</li>
 * </ol>
 * The file is written first, at a path depending only on the bucket and the fingerprint, then the partition is
 * registered and the superseded ones retired in one transaction. A failed write leaves the registered partitions
 * untouched. The garbage collector may delete a retired file at the same path between the write and the registration:
 * registration holds the lock of the view instance and writes the file again if it is missing.
 */
public class PartitionMaterializer {
  private static final int MAX_STALE_ATTEMPTS = 3;

  private final SourceResolver                      resolver;
  private final PartitionStore                      partitionStore;
  private final PartitionMetadataCache              metadataCache;
  private final PartitionReader                     partitionReader;
  private final ContentCache                        contentCache;
  private final BlobStore                           blobStore;
  private final RetryPolicy                         retryPolicy;
  private final Clock                               clock;
  private final PartitionLocks                      locks;

  private final AtomicLong created      = new AtomicLong();
  private final AtomicLong merged       = new AtomicLong();
  private final AtomicLong upToDate     = new AtomicLong();
  private final AtomicLong skipped      = new AtomicLong();
  private final AtomicLong aborted      = new AtomicLong();
  private final AtomicLong failed       = new AtomicLong();
  private final AtomicLong bytesWritten = new AtomicLong();

  public PartitionMaterializer(final SourceResolver resolver, final PartitionStore partitionStore, final PartitionMetadataCache metadataCache,
      final PartitionReader partitionReader, final ContentCache contentCache, final BlobStore blobStore, final RetryPolicy retryPolicy,
      final Clock clock, final PartitionLocks locks) {
    this.resolver = resolver;
    this.partitionStore = partitionStore;
    this.metadataCache = metadataCache;
    this.partitionReader = partitionReader;
    this.contentCache = contentCache;
    this.blobStore = blobStore;
    this.retryPolicy = retryPolicy;
    this.clock = clock;
    this.locks = locks;
  }

  /**
   * @throws StorageWriteException         if the file cannot be written after all the retries
   * @throws StaleMaterializationException if concurrent registrations kept changing the partitions of the bucket
   */
  public MaterializationResult materialize(final ViewDefinition view, final String instanceId, final TimeRange bucket) {
    for (int attempt = 1; ; attempt++) {
      try {
        return materializeOnce(view, instanceId, bucket);
      } catch (final StaleMaterializationException e) {
        if (attempt >= MAX_STALE_ATTEMPTS) {
          failed.incrementAndGet();
          throw e;
        }
        LogManager.instance().log(this, Level.FINE, "Partitions of %s/%s %s changed while materializing, planning again", null, view.getName(),
            instanceId, bucket);
      } catch (final RuntimeException e) {
        failed.incrementAndGet();
        throw e;
      }
    }
  }

  private MaterializationResult materializeOnce(final ViewDefinition view, final String instanceId, final TimeRange bucket) {
    final List<Partition> existing = partitionStore.listPartitions(view.getName(), instanceId, bucket);
    for (final Partition p : existing)
      if (!bucket.contains(p.getInsertRange())) {
        aborted.incrementAndGet();
        LogManager.instance().log(this, Level.FINE, "Skipping %s/%s %s: covered by %s", null, view.getName(), instanceId, bucket, p);
        return MaterializationResult.aborted(bucket, p.getInsertRange());
      }

    final SourceData source = resolver.resolve(view, instanceId, bucket);
    if (source == null) {
      aborted.incrementAndGet();
      LogManager.instance().log(this, Level.FINE, "Skipping %s/%s %s: upstream partitions not aligned", null, view.getName(), instanceId,
          bucket);
      return MaterializationResult.aborted(bucket, null);
    }

    final long sourceHash = source.getSourceHash();
    final String fingerprint = view.getFingerprint();

    if (existing.size() == 1) {
      final Partition p = existing.get(0);
      if (p.getInsertRange().equals(bucket) && p.getFingerprint().equals(fingerprint) && p.getSourceHash() == sourceHash) {
        upToDate.incrementAndGet();
        return MaterializationResult.upToDate(bucket, p);
      }
    }

    if (existing.isEmpty() && source.isEmpty()) {
      skipped.incrementAndGet();
      return MaterializationResult.skipped(bucket);
    }

    final MaterializationResult.Outcome outcome;
    final RecordBatch rows;
    if (canMerge(view, existing, bucket, sourceHash)) {
      outcome = MaterializationResult.Outcome.MERGED;
      final List<RecordBatch> batches = new ArrayList<>();
      for (final Partition p : existing)
        batches.addAll(partitionReader.readAll(p, view.getSchema()));
      rows = RecordBatch.concat(view.getSchema(), batches);
    } else {
      outcome = MaterializationResult.Outcome.CREATED;
      final RecordBatchBuilder builder = new RecordBatchBuilder(view.getSchema());
      view.getTransform().apply(source, builder);
      rows = builder.build();
    }

    final byte[] content = rows.isEmpty() ? null : new PartitionFileWriter(view.getSchema(), view.getFingerprint()).write(rows).finish();
    final Partition partition = register(write(view, instanceId, bucket, sourceHash, rows, content), content, existing);

    if (outcome == MaterializationResult.Outcome.MERGED)
      merged.incrementAndGet();
    else
      created.incrementAndGet();

    LogManager.instance().log(this, Level.FINE, "%s %s/%s %s: %d rows from %d partitions", null, outcome, view.getName(), instanceId, bucket,
        rows.getRowCount(), existing.size());
    return MaterializationResult.written(outcome, bucket, partition);
  }

  private static boolean canMerge(final ViewDefinition view, final List<Partition> existing, final TimeRange bucket, final long sourceHash) {
    if (existing.size() < 2 || !view.isConcatMergeable() || bucket.getDuration() > view.getMergeGranularity().getNanos())
      return false;
    long sum = 0;
    for (final Partition p : existing) {
      if (!p.getFingerprint().equals(view.getFingerprint()))
        return false;
      sum += p.getSourceHash();
    }
    return sum == sourceHash;
  }

  private Partition write(final ViewDefinition view, final String instanceId, final TimeRange bucket, final long sourceHash,
      final RecordBatch rows, final byte[] content) {
    final Partition.Builder builder = Partition.builder(view.getName(), instanceId, bucket)
        .updated(TimeUtils.nowNanos(clock))
        .fingerprint(view.getFingerprint())
        .sourceHash(sourceHash)
        .rowCount(rows.getRowCount());

    if (content == null)
      return builder.file(null, 0).eventTimes(bucket.getBegin(), bucket.getBegin()).build();

    final TableSchema schema = view.getSchema();
    final long[] times = rows.getLongColumn(schema.indexOf(view.getEventTimeColumn()));
    long minTime = Long.MAX_VALUE;
    long maxTime = Long.MIN_VALUE;
    for (final long t : times) {
      minTime = Math.min(minTime, t);
      maxTime = Math.max(maxTime, t);
    }

    final String path = PartitionPaths.partitionPath(view.getName(), instanceId, bucket, view.getFingerprint());
    retryPolicy.run("writing " + path, () -> blobStore.put(path, content));
    contentCache.invalidate(path);
    bytesWritten.addAndGet(content.length);

    return builder.file(path, content.length).eventTimes(minTime, maxTime).build();
  }

  private Partition register(final Partition partition, final byte[] content, final List<Partition> superseded) {
    final List<Long> ids = new ArrayList<>(superseded.size());
    for (final Partition p : superseded)
      ids.add(p.getPartitionId());

    final ReentrantLock lock = locks.get(partition.getViewName(), partition.getInstanceId());
    lock.lock();
    try {
      if (partition.hasFile() && !blobStore.exists(partition.getFilePath())) {
        final String path = partition.getFilePath();
        LogManager.instance().log(this, Level.WARNING, "File '%s' was collected before its registration, writing it again", null, path);
        retryPolicy.run("writing " + path, () -> blobStore.put(path, content));
      }
      final Partition registered = partitionStore.commit(partition, ids, TimeUtils.nowNanos(clock));
      metadataCache.invalidate(partition.getViewName(), partition.getInstanceId());
      return registered;
    } finally {
      lock.unlock();
      if (partition.hasFile())
        // A READER MAY HAVE CACHED THE PREVIOUS CONTENT OF THE SAME PATH IN THE MEANTIME
        contentCache.invalidate(partition.getFilePath());
    }
  }

  public long getCreatedCount() {
    return created.get();
  }

  public long getMergedCount() {
    return merged.get();
  }

  public long getUpToDateCount() {
    return upToDate.get();
  }

  public long getSkippedCount() {
    return skipped.get();
  }

  public long getAbortedCount() {
    return aborted.get();
  }

  public long getFailedCount() {
    return failed.get();
  }

  public long getBytesWritten() {
    return bytesWritten.get();
  }
}
