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
package com.tidelake.metadata;

import com.tidelake.exception.DuplicatedKeyException;
import com.tidelake.time.TimeRange;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Durable record of processes, streams and blocks. Every write is transactional: a block becomes visible to
 * materialization only once its transaction commits.
 * <p>
 * Listing methods return canonical records only: when the same id was stored more than once (bulk replication, racing
 * client retries) the earliest inserted record wins, so a duplicate never contributes twice to a view.
 */
public interface MetadataStore {

  /**
   * @throws DuplicatedKeyException if a process with the same id already exists
   */
  void insertProcess(ProcessInfo process);

  /**
   * @throws DuplicatedKeyException if a stream with the same id already exists
   */
  void insertStream(StreamInfo stream);

  /**
   * @throws DuplicatedKeyException if a block with the same id already exists
   */
  void insertBlock(BlockMetadata block);

  /**
   * Advances the last update time of a process and merges the given properties into the stored ones.
   *
   * @return false if the process does not exist
   */
  boolean touchProcess(String processId, long lastUpdateTime, Map<String, String> properties);

  ProcessInfo getProcess(String processId);

  StreamInfo getStream(String streamId);

  /**
   * The canonical record of the block, or null if the block is not registered.
   */
  BlockMetadata getBlock(String blockId);

  /**
   * Blocks of one stream inserted in the range, ordered by insert time.
   */
  List<BlockMetadata> listBlocks(String streamId, TimeRange insertRange);

  /**
   * Blocks of all the streams carrying {@code streamTag} (all streams if null) inserted in the range, ordered by insert
   * time.
   */
  List<BlockMetadata> listBlocks(String streamTag, TimeRange insertRange, int limit);

  /**
   * Blocks of the given streams whose event time intersects {@code eventRange}, ordered by insert time.
   */
  List<BlockMetadata> listBlocksForStreams(Collection<String> streamIds, TimeRange eventRange);

  List<StreamInfo> listStreamsForProcess(String processId);

  List<StreamInfo> listStreams(TimeRange insertRange);

  /**
   * Processes whose last update time falls in the range, ordered by insert time.
   */
  List<ProcessInfo> listProcesses(TimeRange updateRange);

  /**
   * Processes inserted in the range, ordered by insert time.
   */
  List<ProcessInfo> listProcessesInserted(TimeRange insertRange);

  /**
   * Minimum and maximum insert time (the maximum made exclusive) of the blocks of the given streams whose event time
   * intersects {@code eventRange}, or null when there is none.
   */
  TimeRange findBlockInsertTimeBounds(Collection<String> streamIds, TimeRange eventRange);

  /**
   * Imports records copied from another lakehouse in a single transaction, without identity checks.
   */
  void replicate(Collection<ProcessInfo> processes, Collection<StreamInfo> streams, Collection<BlockMetadata> blocks);

  /**
   * Deletes the non canonical copies of blocks inserted in the range.
   *
   * @return number of deleted rows
   */
  int deleteDuplicateBlocks(TimeRange insertRange);

  int deleteDuplicateStreams(TimeRange insertRange);

  int deleteDuplicateProcesses(TimeRange insertRange);

  /**
   * Deletes blocks inserted before the cutoff, then the streams and processes older than the cutoff left without blocks.
   *
   * @return number of deleted blocks
   */
  int deleteDataOlderThan(long cutoff);

  void close();
}
