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

import com.tidelake.ContextConfiguration;
import com.tidelake.GlobalConfiguration;
import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.log.LogManager;
import com.tidelake.time.TimeGranularity;
import com.tidelake.time.TimeRange;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * Owns one {@link GranularityTask} per granularity and runs them on independent schedules. Tasks of different
 * granularities run concurrently; the partition registration check keeps them consistent when they touch the same
 * insert-time range.
 */
public class MaterializerScheduler {
  private final Map<TimeGranularity, GranularityTask>    tasks     = new EnumMap<>(TimeGranularity.class);
  private final Map<TimeGranularity, Long>               intervals = new EnumMap<>(TimeGranularity.class);
  private final Map<TimeGranularity, ScheduledFuture<?>> futures   = new ConcurrentHashMap<>();
  private final ViewRegistry                             registry;
  private final PartitionMaterializer                    materializer;
  private final ExecutorService                          workers;
  private       ScheduledExecutorService                 executor;

  public MaterializerScheduler(final ViewRegistry registry, final PartitionMaterializer materializer, final Clock clock,
      final ContextConfiguration configuration) {
    this.registry = registry;
    this.materializer = materializer;

    final AtomicInteger workerId = new AtomicInteger();
    this.workers = Executors.newFixedThreadPool(configuration.getValueAsInteger(GlobalConfiguration.MATERIALIZER_PARALLELISM), r -> {
      final Thread t = new Thread(r, "TideLake-Materializer-Worker-" + workerId.incrementAndGet());
      t.setDaemon(true);
      return t;
    });

    final int lookback = configuration.getValueAsInteger(GlobalConfiguration.MATERIALIZER_LOOKBACK_BUCKETS);
    final int maxCatchUp = configuration.getValueAsInteger(GlobalConfiguration.MATERIALIZER_MAX_CATCHUP_BUCKETS);
    final long secondMaxDelay = configuration.getValueAsLong(GlobalConfiguration.MATERIALIZER_SECOND_MAX_DELAY);

    intervals.put(TimeGranularity.SECOND, configuration.getValueAsLong(GlobalConfiguration.MATERIALIZER_SECOND_TICK));
    intervals.put(TimeGranularity.MINUTE, configuration.getValueAsLong(GlobalConfiguration.MATERIALIZER_MINUTE_TICK));
    intervals.put(TimeGranularity.HOUR, configuration.getValueAsLong(GlobalConfiguration.MATERIALIZER_HOUR_TICK));
    intervals.put(TimeGranularity.DAY, configuration.getValueAsLong(GlobalConfiguration.MATERIALIZER_DAY_TICK));

    for (final Map.Entry<TimeGranularity, Long> entry : intervals.entrySet()) {
      final TimeGranularity g = entry.getKey();
      tasks.put(g, new GranularityTask(g, registry, materializer, workers, clock, lookback, maxCatchUp, entry.getValue(),
          g == TimeGranularity.SECOND ? secondMaxDelay : 0));
    }
  }

  /**
   * Schedules every task with a positive tick interval.
   */
  public synchronized void start() {
    if (executor != null)
      return;

    executor = Executors.newScheduledThreadPool(tasks.size(), new ThreadFactory() {
      private final AtomicInteger id = new AtomicInteger();

      @Override
      public Thread newThread(final Runnable r) {
        final Thread t = new Thread(r, "TideLake-Materializer-" + id.incrementAndGet());
        t.setDaemon(true);
        return t;
      }
    });

    for (final GranularityTask task : tasks.values()) {
      final long interval = intervals.get(task.getGranularity());
      if (interval <= 0)
        continue;

      final ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
        try {
          task.tick();
        } catch (final Exception e) {
          LogManager.instance().log(this, Level.SEVERE, "Error in %s materialization tick: %s", e, task.getGranularity(), e.getMessage());
        }
      }, interval, interval, TimeUnit.MILLISECONDS);
      futures.put(task.getGranularity(), future);
    }

    LogManager.instance().log(this, Level.INFO, "Materializer started with intervals %s", null, intervals);
  }

  public GranularityTask getTask(final TimeGranularity granularity) {
    return tasks.get(granularity);
  }

  public Collection<GranularityTask> getTasks() {
    return Collections.unmodifiableCollection(tasks.values());
  }

  /**
   * Materializes the buckets of the granularity covering the range for a global view, independently of the schedule.
   */
  public List<MaterializationResult> materializeRange(final String viewName, final TimeRange insertRange, final TimeGranularity granularity) {
    final ViewDefinition view = registry.get(viewName);
    if (!view.isGlobal())
      throw new InvalidScanRequestException("View '" + viewName + "' has no global instance");
    if (granularity.compareTo(view.getGranularity()) < 0)
      throw new InvalidScanRequestException(
          "Granularity " + granularity + " is finer than the granularity " + view.getGranularity() + " of view '" + viewName + "'");

    final List<MaterializationResult> results = new ArrayList<>();
    for (final TimeRange bucket : granularity.buckets(insertRange))
      results.add(materializer.materialize(view, ViewDefinition.GLOBAL_INSTANCE, bucket));
    return results;
  }

  public void cancel(final TimeGranularity granularity) {
    final ScheduledFuture<?> future = futures.remove(granularity);
    if (future != null)
      future.cancel(false);
  }

  public synchronized void shutdown() {
    for (final TimeGranularity g : new ArrayList<>(futures.keySet()))
      cancel(g);
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
    workers.shutdownNow();
  }
}
