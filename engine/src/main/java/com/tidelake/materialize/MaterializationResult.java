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

import com.tidelake.partition.Partition;
import com.tidelake.time.TimeRange;

/**
 * What a materialization of one bucket did.
 */
public class MaterializationResult {
  public enum Outcome {
    /**
     * The registered partition already matches the source.
     */
    UP_TO_DATE,
    /**
     * No source and no partition: nothing to do.
     */
    SKIPPED,
    /**
     * A coarser partition covers the bucket, or the upstream view is not aligned on it.
     */
    ABORTED,
    MERGED,
    CREATED
  }

  private final Outcome   outcome;
  private final TimeRange bucket;
  private final Partition partition;
  private final TimeRange coveringRange;

  private MaterializationResult(final Outcome outcome, final TimeRange bucket, final Partition partition, final TimeRange coveringRange) {
    this.outcome = outcome;
    this.bucket = bucket;
    this.partition = partition;
    this.coveringRange = coveringRange;
  }

  static MaterializationResult upToDate(final TimeRange bucket, final Partition partition) {
    return new MaterializationResult(Outcome.UP_TO_DATE, bucket, partition, null);
  }

  static MaterializationResult skipped(final TimeRange bucket) {
    return new MaterializationResult(Outcome.SKIPPED, bucket, null, null);
  }

  static MaterializationResult aborted(final TimeRange bucket, final TimeRange coveringRange) {
    return new MaterializationResult(Outcome.ABORTED, bucket, null, coveringRange);
  }

  static MaterializationResult written(final Outcome outcome, final TimeRange bucket, final Partition partition) {
    return new MaterializationResult(outcome, bucket, partition, null);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public TimeRange getBucket() {
    return bucket;
  }

  /**
   * Partition now covering the bucket, null if skipped or aborted.
   */
  public Partition getPartition() {
    return partition;
  }

  /**
   * Insert range of the coarser partition that caused an abort, null otherwise.
   */
  public TimeRange getCoveringRange() {
    return coveringRange;
  }

  public boolean hasWritten() {
    return outcome == Outcome.MERGED || outcome == Outcome.CREATED;
  }

  @Override
  public String toString() {
    return outcome + " " + bucket + (partition != null ? " -> " + partition : "");
  }
}
