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

import com.tidelake.log.LogManager;
import com.tidelake.time.TimeGranularity;
import com.tidelake.time.TimeRange;
import com.tidelake.time.TimeUtils;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;
import com.tidelake.view.ViewSource;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;

/**
 * Periodic materialization of the global views at one granularity. Every tick re-derives the last completed buckets
 * (late blocks land in buckets already processed) and, after a pause, the buckets between the watermark and now.
 * <p>
 * Views run in registry order, so upstream views are materialized before their dependents. Consecutive views of the same
 * update group that do not depend on each other run in parallel on the worker executor.
 */
public class GranularityTask {
  private final TimeGranularity       granularity;
  private final ViewRegistry          registry;
  private final PartitionMaterializer materializer;
  private final Executor              workers;
  private final Clock                 clock;
  private final int                   lookbackBuckets;
  private final int                   maxCatchUpBuckets;
  private final long                  intervalNanos;
  private final long                  maxDelayNanos;

  private final    AtomicBoolean              running       = new AtomicBoolean();
  private final    AtomicReference<TaskState> state         = new AtomicReference<>(TaskState.IDLE);
  private final    AtomicLong                 ticks         = new AtomicLong();
  private final    AtomicLong                 skippedTicks  = new AtomicLong();
  private final    AtomicLong                 written       = new AtomicLong();
  private final    AtomicLong                 merges        = new AtomicLong();
  private final    AtomicLong                 errors        = new AtomicLong();
  private volatile long                       watermark     = Long.MIN_VALUE;
  private volatile long                       nextScheduled = Long.MIN_VALUE;
  private volatile long                       lastTickDurationMs;

  /**
   * @param intervalMs interval between ticks, used to detect late ticks
   * @param maxDelayMs a tick starting later than this after its scheduled time is skipped. 0 never skips
   */
  public GranularityTask(final TimeGranularity granularity, final ViewRegistry registry, final PartitionMaterializer materializer,
      final Executor workers, final Clock clock, final int lookbackBuckets, final int maxCatchUpBuckets, final long intervalMs,
      final long maxDelayMs) {
    if (lookbackBuckets < 1)
      throw new IllegalArgumentException("At least one bucket must be processed per tick");
    this.granularity = granularity;
    this.registry = registry;
    this.materializer = materializer;
    this.workers = workers;
    this.clock = clock;
    this.lookbackBuckets = lookbackBuckets;
    this.maxCatchUpBuckets = Math.max(lookbackBuckets, maxCatchUpBuckets);
    this.intervalNanos = TimeUtils.millisToNanos(intervalMs);
    this.maxDelayNanos = TimeUtils.millisToNanos(maxDelayMs);
  }

  /**
   * Runs one pass. Concurrent calls are skipped.
   */
  public void tick() {
    if (!running.compareAndSet(false, true)) {
      LogManager.instance().log(this, Level.FINE, "Skipping %s tick: previous tick still running", null, granularity);
      return;
    }

    final long startNs = System.nanoTime();
    try {
      final long now = TimeUtils.nowNanos(clock);
      if (isLate(now)) {
        skippedTicks.incrementAndGet();
        LogManager.instance().log(this, Level.WARNING, "Skipping %s tick: %d ms late", null, granularity,
            (now - nextScheduled) / 1_000_000);
        nextScheduled = now + intervalNanos;
        return;
      }
      nextScheduled = (nextScheduled == Long.MIN_VALUE ? now : nextScheduled) + intervalNanos;

      ticks.incrementAndGet();
      state.set(TaskState.SCANNING);
      final TimeRange range = pendingRange(now);
      final List<TimeRange> buckets = granularity.buckets(range);
      final List<List<ViewDefinition>> batches = batches();

      state.set(TaskState.WRITING);
      boolean failed = false;
      for (final List<ViewDefinition> batch : batches) {
        final List<CompletableFuture<Boolean>> futures = new ArrayList<>(batch.size());
        for (final ViewDefinition view : batch)
          futures.add(CompletableFuture.supplyAsync(() -> processView(view, buckets), workers));
        for (final CompletableFuture<Boolean> f : futures)
          if (!f.join())
            failed = true;
      }

      if (!failed)
        watermark = range.getEnd();

    } finally {
      lastTickDurationMs = (System.nanoTime() - startNs) / 1_000_000;
      state.set(TaskState.IDLE);
      running.set(false);
    }
  }

  private boolean isLate(final long now) {
    return maxDelayNanos > 0 && nextScheduled != Long.MIN_VALUE && now - nextScheduled > maxDelayNanos;
  }

  /**
   * Insert-time range processed by a tick at {@code now}: the last completed buckets, extended back to the watermark.
   */
  TimeRange pendingRange(final long now) {
    final long end = granularity.truncate(now);
    long begin = end - lookbackBuckets * granularity.getNanos();
    if (watermark != Long.MIN_VALUE && watermark < begin)
      begin = Math.max(granularity.truncate(watermark), end - maxCatchUpBuckets * granularity.getNanos());
    return new TimeRange(begin, end);
  }

  private List<List<ViewDefinition>> batches() {
    final List<List<ViewDefinition>> result = new ArrayList<>();
    List<ViewDefinition> current = null;
    final Set<String> currentNames = new HashSet<>();
    for (final ViewDefinition view : registry.getViews()) {
      if (!view.isScheduledAt(granularity))
        continue;

      final ViewSource source = view.getSource();
      final boolean dependsOnCurrent = source.getKind() == ViewSource.Kind.VIEW && currentNames.contains(source.getUpstreamView());
      if (current == null || dependsOnCurrent || current.get(0).getUpdateGroup() != view.getUpdateGroup()) {
        current = new ArrayList<>();
        currentNames.clear();
        result.add(current);
      }
      current.add(view);
      currentNames.add(view.getName());
    }
    return result;
  }

  /**
   * @return false if a bucket failed. The following buckets of the view are left for the next tick
   */
  private boolean processView(final ViewDefinition view, final List<TimeRange> buckets) {
    for (final TimeRange bucket : buckets) {
      try {
        final MaterializationResult result = materializer.materialize(view, ViewDefinition.GLOBAL_INSTANCE, bucket);
        if (result.hasWritten()) {
          written.incrementAndGet();
          if (result.getOutcome() == MaterializationResult.Outcome.MERGED)
            merges.incrementAndGet();
        }
      } catch (final RuntimeException e) {
        errors.incrementAndGet();
        LogManager.instance().log(this, Level.SEVERE, "Error materializing view '%s' bucket %s at %s: %s", e, view.getName(), bucket,
            granularity, e.getMessage());
        return false;
      }
    }
    return true;
  }

  public TimeGranularity getGranularity() {
    return granularity;
  }

  public TaskState getState() {
    return state.get();
  }

  /**
   * End of the last range processed without errors, {@link Long#MIN_VALUE} before the first one.
   */
  public long getWatermark() {
    return watermark;
  }

  public long getTickCount() {
    return ticks.get();
  }

  public long getSkippedTickCount() {
    return skippedTicks.get();
  }

  public long getPartitionsWritten() {
    return written.get();
  }

  public long getMergeCount() {
    return merges.get();
  }

  public long getErrorCount() {
    return errors.get();
  }

  public long getLastTickDurationMs() {
    return lastTickDurationMs;
  }

  @Override
  public String toString() {
    return "GranularityTask{" + granularity + ", state=" + state.get() + ", watermark=" + TimeUtils.format(watermark) + "}";
  }
}
