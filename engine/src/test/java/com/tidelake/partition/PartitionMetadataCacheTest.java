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

import com.tidelake.TestHelper;
import com.tidelake.metadata.MetadataDataSource;
import com.tidelake.time.TimeRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PartitionMetadataCacheTest {
  private static final String VIEW = "log_entries";

  private final AtomicInteger  reads        = new AtomicInteger();
  private final AtomicBoolean  holdNextRead = new AtomicBoolean();
  private final CountDownLatch readDone     = new CountDownLatch(1);
  private final CountDownLatch release      = new CountDownLatch(1);

  private MetadataDataSource     dataSource;
  private JdbcPartitionStore     store;
  private PartitionMetadataCache cache;

  @BeforeEach
  void open() {
    dataSource = new MetadataDataSource(TestHelper.newTestConfiguration());
    store = new JdbcPartitionStore(dataSource) {
      @Override
      public List<Partition> listPartitionsForEvents(final String viewName, final String instanceId, final TimeRange eventRange) {
        final List<Partition> result = super.listPartitionsForEvents(viewName, instanceId, eventRange);
        reads.incrementAndGet();
        if (holdNextRead.compareAndSet(true, false)) {
          readDone.countDown();
          try {
            assertThat(release.await(10, TimeUnit.SECONDS)).isTrue();
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
          }
        }
        return result;
      }
    };
    cache = new PartitionMetadataCache(store, 100);
  }

  @AfterEach
  void close() {
    dataSource.close();
  }

  private Partition commit(final String instance, final long begin, final long end, final String path) {
    final Partition partition = Partition.builder(VIEW, instance, new TimeRange(begin, end))
        .eventTimes(begin, end - 1)
        .updated(end)
        .file(path, 1_000)
        .rowCount(10)
        .fingerprint("fp")
        .sourceHash(begin)
        .build();
    return store.commit(partition, List.of(), end);
  }

  @Test
  void lookupsAreServedFromTheCacheUntilInvalidated() {
    commit("global", 0, 60, "a");

    assertThat(cache.getPartitions(VIEW, "global", TimeRange.unbounded())).extracting(Partition::getFilePath).containsExactly("a");
    assertThat(cache.getPartitions(VIEW, "global", TimeRange.unbounded())).hasSize(1);
    assertThat(reads.get()).isEqualTo(1);

    commit("global", 60, 120, "b");
    assertThat(cache.getPartitions(VIEW, "global", TimeRange.unbounded())).hasSize(1);

    cache.invalidate(VIEW, "global");
    assertThat(cache.getPartitions(VIEW, "global", TimeRange.unbounded())).extracting(Partition::getFilePath).containsExactly("a", "b");
    assertThat(reads.get()).isEqualTo(2);
    assertThat(cache.getStats().hitCount()).isEqualTo(2);
  }

  @Test
  void invalidationIsScopedToTheViewInstance() {
    commit("global", 0, 60, "a");
    commit("P1", 0, 60, "b");
    cache.getPartitions(VIEW, "global", TimeRange.unbounded());
    cache.getPartitions(VIEW, "P1", TimeRange.unbounded());

    cache.invalidate(VIEW, "P1");
    cache.getPartitions(VIEW, "global", TimeRange.unbounded());
    assertThat(reads.get()).isEqualTo(2);
    cache.getPartitions(VIEW, "P1", TimeRange.unbounded());
    assertThat(reads.get()).isEqualTo(3);

    cache.invalidateView(VIEW);
    cache.getPartitions(VIEW, "global", TimeRange.unbounded());
    cache.getPartitions(VIEW, "P1", TimeRange.unbounded());
    assertThat(reads.get()).isEqualTo(5);
  }

  @Test
  void loadOverlappingARegistrationIsNotKept() throws Exception {
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      holdNextRead.set(true);
      final Future<List<Partition>> reader = executor.submit(() -> cache.getPartitions(VIEW, "global", TimeRange.unbounded()));

      // THE READER HAS SEEN NO PARTITION AND IS ABOUT TO PUBLISH WHAT IT READ
      assertThat(readDone.await(10, TimeUnit.SECONDS)).isTrue();
      commit("global", 0, 60, "a");
      cache.invalidate(VIEW, "global");
      release.countDown();

      assertThat(reader.get(10, TimeUnit.SECONDS)).extracting(Partition::getFilePath).containsExactly("a");
      assertThat(cache.getPartitions(VIEW, "global", TimeRange.unbounded())).extracting(Partition::getFilePath).containsExactly("a");
      assertThat(reads.get()).isEqualTo(2);
    } finally {
      executor.shutdownNow();
    }
  }
}
