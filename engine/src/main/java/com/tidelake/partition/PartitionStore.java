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

import com.tidelake.exception.StaleMaterializationException;
import com.tidelake.time.TimeRange;

import java.util.Collection;
import java.util.List;

/**
 * Registry of materialized partitions. For a view instance at most one non-retired partition covers any insert time:
 * registering a partition retires the ones it supersedes in the same transaction.
 */
public interface PartitionStore {

  /**
   * Non-retired partitions of the view instance whose insert range overlaps {@code insertRange}, ordered by insert
   * range.
   */
  List<Partition> listPartitions(String viewName, String instanceId, TimeRange insertRange);

  /**
   * Non-retired partitions with rows whose event times intersect {@code eventRange}, ordered by insert range.
   */
  List<Partition> listPartitionsForEvents(String viewName, String instanceId, TimeRange eventRange);

  /**
   * Every partition, retired ones included, ordered by view, instance and insert range.
   */
  List<Partition> listAll();

  /**
   * Registers the partition and retires {@code superseded} atomically.
   *
   * @param superseded ids of the non-retired partitions overlapping the new one, as observed when planning
   *
   * @return the registered partition with its id
   *
   * @throws StaleMaterializationException if the overlapping partitions changed since planning
   */
  Partition commit(Partition partition, Collection<Long> superseded, long now);

  /**
   * Retires the non-retired partitions of the view instance overlapping the range.
   *
   * @return number of retired partitions
   */
  int retirePartitions(String viewName, String instanceId, TimeRange insertRange, long now);

  /**
   * Retires the non-retired partition with exactly this insert range.
   *
   * @return false if there is none
   */
  boolean retirePartitionByMetadata(String viewName, String instanceId, TimeRange insertRange, long now);

  /**
   * @return number of retired partitions referencing the file
   */
  int retirePartitionByFile(String filePath, long now);

  /**
   * Retires the non-retired partitions of the view (all instances) whose fingerprint differs from {@code fingerprint}.
   */
  List<Partition> retireIncompatible(String viewName, String fingerprint, long now);

  /**
   * Retires the non-retired partitions whose insert range ends before the cutoff.
   */
  int retireOlderThan(long cutoff, long now);

  List<Partition> listRetiredBefore(long cutoff);

  /**
   * Tells if a non-retired partition references the file.
   */
  boolean isFileReferenced(String filePath);

  int deletePartitions(Collection<Long> partitionIds);
}
