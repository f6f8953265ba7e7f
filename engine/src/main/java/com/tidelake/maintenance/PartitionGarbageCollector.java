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

import com.tidelake.exception.StorageException;
import com.tidelake.log.LogManager;
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionLocks;
import com.tidelake.partition.PartitionStore;
import com.tidelake.storage.BlobStore;
import com.tidelake.storage.ContentCache;
import com.tidelake.time.TimeUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;

/**
 * Reclaims the partitions retired for longer than the grace period. A file is deleted only when no live partition
 * references its path, since a bucket re-materialized under the same fingerprint reuses the path of the partition it
 * superseded. The check and the deletion hold the lock of the view instance, so a registration of the same path cannot
 * interleave. A partition whose file cannot be deleted keeps its row and is collected again at the next pass.
 */
public class PartitionGarbageCollector {
  private final PartitionStore partitionStore;
  private final BlobStore      blobStore;
  private final ContentCache   contentCache;
  private final Clock          clock;
  private final PartitionLocks locks;
  private final long           gracePeriodNanos;

  public PartitionGarbageCollector(final PartitionStore partitionStore, final BlobStore blobStore, final ContentCache contentCache,
      final PartitionLocks locks, final Clock clock, final long gracePeriodMs) {
    if (gracePeriodMs < 0)
      throw new IllegalArgumentException("Negative grace period " + gracePeriodMs);
    this.partitionStore = partitionStore;
    this.blobStore = blobStore;
    this.contentCache = contentCache;
    this.locks = locks;
    this.clock = clock;
    this.gracePeriodNanos = TimeUtils.millisToNanos(gracePeriodMs);
  }

  /**
   * @return number of deleted partition rows
   */
  public int collect() {
    final long cutoff = TimeUtils.nowNanos(clock) - gracePeriodNanos;
    final List<Partition> expired = partitionStore.listRetiredBefore(cutoff);
    if (expired.isEmpty())
      return 0;

    final List<Long> toDelete = new ArrayList<>(expired.size());
    int deletedFiles = 0;
    for (final Partition p : expired) {
      if (p.hasFile()) {
        final ReentrantLock lock = locks.get(p.getViewName(), p.getInstanceId());
        lock.lock();
        try {
          if (!partitionStore.isFileReferenced(p.getFilePath())) {
            if (blobStore.delete(p.getFilePath()))
              ++deletedFiles;
            contentCache.invalidate(p.getFilePath());
          }
        } catch (final StorageException e) {
          LogManager.instance().log(this, Level.WARNING, "Cannot delete file of retired partition %s, will retry later", e, p);
          continue;
        } finally {
          lock.unlock();
        }
      }
      toDelete.add(p.getPartitionId());
    }

    final int deleted = partitionStore.deletePartitions(toDelete);
    LogManager.instance().log(this, Level.INFO, "Garbage collected %d retired partitions (%d files) retired before %s", null, deleted,
        deletedFiles, TimeUtils.format(cutoff));
    return deleted;
  }

  public long getGracePeriodMs() {
    return gracePeriodNanos / 1_000_000;
  }
}
