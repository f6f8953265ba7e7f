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

import com.tidelake.ContextConfiguration;
import com.tidelake.GlobalConfiguration;
import com.tidelake.log.LogManager;
import com.tidelake.metadata.MetadataStore;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.partition.PartitionStore;
import com.tidelake.time.TimeRange;
import com.tidelake.time.TimeUtils;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

/**
 * Periodic maintenance, scheduled independently from the materializer: deduplication of the recent records, retirement
 * of the partitions with an obsolete fingerprint, optional retention, then garbage collection of the retired partitions.
 */
public class MaintenanceTask {
  private final Deduplicator              deduplicator;
  private final SchemaRetirement          retirement;
  private final PartitionGarbageCollector collector;
  private final MetadataStore             metadataStore;
  private final PartitionStore            partitionStore;
  private final PartitionMetadataCache    metadataCache;
  private final Clock                     clock;
  private final long                      sweepIntervalMs;
  private final long                      dedupLookbackNanos;
  private final long                      retentionNanos;

  private final    AtomicBoolean            running = new AtomicBoolean();
  private final    AtomicLong               passes  = new AtomicLong();
  private final    AtomicLong               errors  = new AtomicLong();
  private volatile MaintenanceReport        lastReport;
  private          ScheduledExecutorService executor;
  private          ScheduledFuture<?>       future;

  public MaintenanceTask(final Deduplicator deduplicator, final SchemaRetirement retirement, final PartitionGarbageCollector collector,
      final MetadataStore metadataStore, final PartitionStore partitionStore, final PartitionMetadataCache metadataCache, final Clock clock,
      final ContextConfiguration configuration) {
    this.deduplicator = deduplicator;
    this.retirement = retirement;
    this.collector = collector;
    this.metadataStore = metadataStore;
    this.partitionStore = partitionStore;
    this.metadataCache = metadataCache;
    this.clock = clock;
    this.sweepIntervalMs = configuration.getValueAsLong(GlobalConfiguration.MAINTENANCE_SWEEP_INTERVAL);
    this.dedupLookbackNanos = TimeUtils.millisToNanos(configuration.getValueAsLong(GlobalConfiguration.MAINTENANCE_DEDUP_LOOKBACK));
    this.retentionNanos = TimeUtils.millisToNanos(configuration.getValueAsLong(GlobalConfiguration.MAINTENANCE_RETENTION));
  }

  public synchronized void start() {
    if (executor != null || sweepIntervalMs <= 0)
      return;

    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread t = new Thread(r, "TideLake-Maintenance");
      t.setDaemon(true);
      return t;
    });
    future = executor.scheduleAtFixedRate(() -> {
      try {
        runOnce();
      } catch (final Exception e) {
        LogManager.instance().log(this, Level.SEVERE, "Error in periodic maintenance: %s", e, e.getMessage());
      }
    }, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one pass. Returns null when another pass is already running.
   */
  public MaintenanceReport runOnce() {
    if (!running.compareAndSet(false, true)) {
      LogManager.instance().log(this, Level.FINE, "Skipping concurrent maintenance pass: already in progress", null);
      return null;
    }

    final long startNs = System.nanoTime();
    try {
      final long now = TimeUtils.nowNanos(clock);

      final int duplicates = deduplicator.deleteAllDuplicates(new TimeRange(now - dedupLookbackNanos, Long.MAX_VALUE));
      final int retired = retirement.retireIncompatible();

      int expiredBlocks = 0;
      int expiredPartitions = 0;
      if (retentionNanos > 0) {
        final long cutoff = now - retentionNanos;
        expiredBlocks = metadataStore.deleteDataOlderThan(cutoff);
        expiredPartitions = partitionStore.retireOlderThan(cutoff, now);
        if (expiredPartitions > 0)
          metadataCache.invalidateAll();
      }

      final int collected = collector.collect();

      final MaintenanceReport report = new MaintenanceReport(duplicates, retired, collected, expiredBlocks, expiredPartitions,
          (System.nanoTime() - startNs) / 1_000_000);
      lastReport = report;
      passes.incrementAndGet();
      LogManager.instance().log(this, Level.FINE, "Maintenance pass completed: %s", null, report);
      return report;

    } catch (final RuntimeException e) {
      errors.incrementAndGet();
      LogManager.instance().log(this, Level.SEVERE, "Error during maintenance pass: %s", e, e.getMessage());
      throw e;
    } finally {
      running.set(false);
    }
  }

  public MaintenanceReport getLastReport() {
    return lastReport;
  }

  public long getPassCount() {
    return passes.get();
  }

  public long getErrorCount() {
    return errors.get();
  }

  public synchronized void shutdown() {
    if (future != null) {
      future.cancel(false);
      future = null;
    }
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }
}
