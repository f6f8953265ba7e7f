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
import com.tidelake.exception.StaleMaterializationException;
import com.tidelake.metadata.MetadataDataSource;
import com.tidelake.time.TimeRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcPartitionStoreTest {
  private MetadataDataSource dataSource;
  private JdbcPartitionStore store;

  @BeforeEach
  void open() {
    dataSource = new MetadataDataSource(TestHelper.newTestConfiguration());
    store = new JdbcPartitionStore(dataSource);
  }

  @AfterEach
  void close() {
    dataSource.close();
  }

  private static Partition partition(final String instance, final long begin, final long end, final String path, final String fingerprint) {
    return Partition.builder("log_entries", instance, new TimeRange(begin, end))
        .eventTimes(begin - 5, end - 5)
        .updated(end)
        .file(path, path != null ? 1_000 : 0)
        .rowCount(path != null ? 10 : 0)
        .fingerprint(fingerprint)
        .sourceHash(begin)
        .build();
  }

  private Partition commit(final Partition partition) {
    final List<Long> overlapping = store.listPartitions(partition.getViewName(), partition.getInstanceId(), partition.getInsertRange())
        .stream().map(Partition::getPartitionId).toList();
    return store.commit(partition, overlapping, partition.getUpdated());
  }

  @Test
  void commitSupersedesOverlappingPartitions() {
    final Partition first = commit(partition("global", 0, 60, "a", "fp"));
    final Partition second = commit(partition("global", 60, 120, "b", "fp"));
    assertThat(first.getPartitionId()).isPositive().isNotEqualTo(second.getPartitionId());

    final Partition merged = commit(partition("global", 0, 3600, "c", "fp"));

    assertThat(store.listPartitions("log_entries", "global", TimeRange.unbounded())).containsExactly(merged);
    assertThat(store.listAll()).hasSize(3);
    assertThat(store.listRetiredBefore(3_601)).extracting(Partition::getPartitionId)
        .containsExactlyInAnyOrder(first.getPartitionId(), second.getPartitionId());
    assertThat(store.listRetiredBefore(3_600)).isEmpty();
  }

  @Test
  void concurrentChangeIsDetectedAtCommit() {
    commit(partition("global", 0, 60, "a", "fp"));

    // PLANNED BEFORE THE PARTITION ABOVE EXISTED
    assertThatThrownBy(() -> store.commit(partition("global", 0, 60, "b", "fp"), List.of(), 100))
        .isInstanceOf(StaleMaterializationException.class);

    assertThat(store.listAll()).extracting(Partition::getFilePath).containsExactly("a");
  }

  @Test
  void instancesAndAdjacentRangesDoNotOverlap() {
    commit(partition("global", 0, 60, "a", "fp"));
    commit(partition("P1", 0, 60, "b", "fp"));
    commit(partition("global", 60, 120, "c", "fp"));

    assertThat(store.listPartitions("log_entries", "global", new TimeRange(0, 60))).extracting(Partition::getFilePath).containsExactly("a");
    assertThat(store.listPartitions("log_entries", "global", new TimeRange(59, 61))).extracting(Partition::getFilePath)
        .containsExactly("a", "c");
    assertThat(store.listPartitions("log_entries", "P1", TimeRange.unbounded())).extracting(Partition::getFilePath).containsExactly("b");
  }

  @Test
  void eventListingSkipsPartitionsWithoutRows() {
    commit(partition("global", 0, 60, "a", "fp"));
    commit(partition("global", 60, 120, null, "fp"));
    commit(partition("global", 120, 180, "c", "fp"));

    // EVENT TIMES ARE [begin - 5, end - 5]
    assertThat(store.listPartitionsForEvents("log_entries", "global", new TimeRange(50, 120))).extracting(Partition::getFilePath)
        .containsExactly("a", "c");
    assertThat(store.listPartitionsForEvents("log_entries", "global", new TimeRange(56, 115))).isEmpty();
  }

  @Test
  void retireByRangeMetadataAndFile() {
    commit(partition("global", 0, 60, "a", "fp"));
    commit(partition("global", 60, 120, "b", "fp"));
    commit(partition("global", 120, 180, "c", "fp"));
    commit(partition("global", 180, 240, "d", "fp"));

    assertThat(store.retirePartitions("log_entries", "global", new TimeRange(30, 90), 500)).isEqualTo(2);
    assertThat(store.retirePartitionByMetadata("log_entries", "global", new TimeRange(120, 170), 500)).isFalse();
    assertThat(store.retirePartitionByMetadata("log_entries", "global", new TimeRange(120, 180), 500)).isTrue();
    assertThat(store.isFileReferenced("d")).isTrue();
    assertThat(store.retirePartitionByFile("d", 500)).isEqualTo(1);
    assertThat(store.isFileReferenced("d")).isFalse();

    assertThat(store.listPartitions("log_entries", "global", TimeRange.unbounded())).isEmpty();
    assertThat(store.listAll()).allMatch(Partition::isRetired).allMatch(p -> p.getRetiredTime() == 500);
  }

  @Test
  void incompatibleAndExpiredPartitionsAreRetired() {
    commit(partition("global", 0, 60, "a", "old"));
    commit(partition("P1", 0, 60, "b", "old"));
    commit(partition("global", 60, 120, "c", "new"));
    commit(partition("global", 120, 180, "d", "new"));

    assertThat(store.retireIncompatible("log_entries", "new", 500)).extracting(Partition::getFilePath).containsExactlyInAnyOrder("a", "b");
    assertThat(store.retireIncompatible("log_entries", "new", 600)).isEmpty();

    assertThat(store.retireOlderThan(120, 700)).isEqualTo(1);
    assertThat(store.listPartitions("log_entries", "global", TimeRange.unbounded())).extracting(Partition::getFilePath)
        .containsExactly("d");
  }

  @Test
  void deletedPartitionsAreGone() {
    final Partition a = commit(partition("global", 0, 60, "a", "fp"));
    final Partition b = commit(partition("global", 60, 120, "b", "fp"));

    assertThat(store.deletePartitions(List.of())).isZero();
    assertThat(store.deletePartitions(List.of(a.getPartitionId(), b.getPartitionId(), 9_999L))).isEqualTo(2);
    assertThat(store.listAll()).isEmpty();
  }
}
