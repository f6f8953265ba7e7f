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

import com.tidelake.log.LogManager;
import com.tidelake.metadata.MetadataStore;
import com.tidelake.time.TimeRange;

import java.util.logging.Level;

/**
 * Collapses records submitted more than once (a client retrying an insert) to their canonical copy, the earliest one
 * inserted. Identity is the record id only.
 */
public class Deduplicator {
  private final MetadataStore metadataStore;

  public Deduplicator(final MetadataStore metadataStore) {
    this.metadataStore = metadataStore;
  }

  public int deleteDuplicateBlocks(final TimeRange insertRange) {
    return log("blocks", insertRange, metadataStore.deleteDuplicateBlocks(insertRange));
  }

  public int deleteDuplicateStreams(final TimeRange insertRange) {
    return log("streams", insertRange, metadataStore.deleteDuplicateStreams(insertRange));
  }

  public int deleteDuplicateProcesses(final TimeRange insertRange) {
    return log("processes", insertRange, metadataStore.deleteDuplicateProcesses(insertRange));
  }

  /**
   * @return total number of deleted rows
   */
  public int deleteAllDuplicates(final TimeRange insertRange) {
    return deleteDuplicateBlocks(insertRange) + deleteDuplicateStreams(insertRange) + deleteDuplicateProcesses(insertRange);
  }

  private int log(final String table, final TimeRange insertRange, final int deleted) {
    if (deleted > 0)
      LogManager.instance().log(this, Level.INFO, "Deleted %d duplicate %s inserted in %s", null, deleted, table, insertRange);
    return deleted;
  }
}
