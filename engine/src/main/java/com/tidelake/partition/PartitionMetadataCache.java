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
package com.tidelake.partition;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.tidelake.time.TimeRange;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, process-wide cache of the partitions of (view, instance, event range) lookups. Entries are derived from the
 * partition store: they are dropped whenever a partition of the same view instance is registered or retired.
 * <p>
 * A load still reading the store when an invalidation happens would publish a list older than the invalidation. Every
 * load and every invalidation takes a number from the same sequence: an entry loaded before the last invalidation of its
 * view instance is dropped and loaded again when read.
 */
public class PartitionMetadataCache {
  private final PartitionStore              store;
  private final Cache<CacheKey, Entry>      cache;
  private final AtomicLong                  sequence          = new AtomicLong();
  private final ConcurrentMap<String, Long> lastInvalidations = new ConcurrentHashMap<>();
  private final AtomicLong                  lastInvalidateAll = new AtomicLong();

  private static final class Entry {
    private final long            loadSequence;
    private final List<Partition> partitions;

    private Entry(final long loadSequence, final List<Partition> partitions) {
      this.loadSequence = loadSequence;
      this.partitions = partitions;
    }
  }

  private static final class CacheKey {
    private final String    viewName;
    private final String    instanceId;
    private final TimeRange range;

    private CacheKey(final String viewName, final String instanceId, final TimeRange range) {
      this.viewName = viewName;
      this.instanceId = instanceId;
      this.range = range;
    }

    @Override
    public boolean equals(final Object o) {
      if (!(o instanceof CacheKey))
        return false;
      final CacheKey that = (CacheKey) o;
      return viewName.equals(that.viewName) && instanceId.equals(that.instanceId) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
      return Objects.hash(viewName, instanceId, range);
    }
  }

  public PartitionMetadataCache(final PartitionStore store, final long maxEntries) {
    this.store = store;
    this.cache = Caffeine.newBuilder().maximumSize(maxEntries).recordStats().build();
  }

  public PartitionStore getStore() {
    return store;
  }

  /**
   * Live partitions of the view instance with events in the range, loaded from the store on a miss.
   */
  public List<Partition> getPartitions(final String viewName, final String instanceId, final TimeRange eventRange) {
    final CacheKey key = new CacheKey(viewName, instanceId, eventRange);
    while (true) {
      final Entry entry = cache.get(key, k -> {
        // NUMBERED BEFORE READING: AN INVALIDATION NUMBERED AFTER MAY NOT BE IN WHAT IS READ
        final long loadSequence = sequence.incrementAndGet();
        return new Entry(loadSequence, List.copyOf(store.listPartitionsForEvents(k.viewName, k.instanceId, k.range)));
      });
      if (!isOutdated(key, entry))
        return entry.partitions;
      cache.asMap().remove(key, entry);
    }
  }

  public void invalidate(final String viewName, final String instanceId) {
    lastInvalidations.merge(instanceKey(viewName, instanceId), sequence.incrementAndGet(), Math::max);
    cache.asMap().keySet().removeIf(k -> k.viewName.equals(viewName) && k.instanceId.equals(instanceId));
  }

  public void invalidateView(final String viewName) {
    lastInvalidations.merge(viewName, sequence.incrementAndGet(), Math::max);
    cache.asMap().keySet().removeIf(k -> k.viewName.equals(viewName));
  }

  public void invalidateAll() {
    lastInvalidateAll.accumulateAndGet(sequence.incrementAndGet(), Math::max);
    cache.invalidateAll();
  }

  private boolean isOutdated(final CacheKey key, final Entry entry) {
    return lastInvalidateAll.get() > entry.loadSequence ||
        lastInvalidations.getOrDefault(key.viewName, 0L) > entry.loadSequence ||
        lastInvalidations.getOrDefault(instanceKey(key.viewName, key.instanceId), 0L) > entry.loadSequence;
  }

  private static String instanceKey(final String viewName, final String instanceId) {
    // VIEW NAMES NEVER CONTAIN '/', SO INSTANCE KEYS CANNOT COLLIDE WITH VIEW KEYS
    return viewName + "/" + instanceId;
  }

  public long getEstimatedSize() {
    return cache.estimatedSize();
  }

  public CacheStats getStats() {
    return cache.stats();
  }
}
