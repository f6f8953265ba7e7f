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

import com.tidelake.time.TimeRange;

import java.util.Objects;

/**
 * Descriptor of one materialized partition: the output of a view for one insert-time bucket and one view instance.
 * A partition without file ({@link #getFilePath()} null) records that the bucket was re-derived as empty.
 */
public class Partition {
  private final long      partitionId;
  private final String    viewName;
  private final String    instanceId;
  private final TimeRange insertRange;
  private final long      minEventTime;
  private final long      maxEventTime;
  private final long      updated;
  private final String    filePath;
  private final long      fileSize;
  private final long      rowCount;
  private final String    fingerprint;
  private final long      sourceHash;
  private final boolean   retired;
  private final long      retiredTime;

  private Partition(final Builder b) {
    this.partitionId = b.partitionId;
    this.viewName = Objects.requireNonNull(b.viewName, "viewName");
    this.instanceId = Objects.requireNonNull(b.instanceId, "instanceId");
    this.insertRange = Objects.requireNonNull(b.insertRange, "insertRange");
    this.minEventTime = b.minEventTime;
    this.maxEventTime = b.maxEventTime;
    this.updated = b.updated;
    this.filePath = b.filePath;
    this.fileSize = b.fileSize;
    this.rowCount = b.rowCount;
    this.fingerprint = Objects.requireNonNull(b.fingerprint, "fingerprint");
    this.sourceHash = b.sourceHash;
    this.retired = b.retired;
    this.retiredTime = b.retiredTime;
  }

  public static Builder builder(final String viewName, final String instanceId, final TimeRange insertRange) {
    return new Builder(viewName, instanceId, insertRange);
  }

  public long getPartitionId() {
    return partitionId;
  }

  public String getViewName() {
    return viewName;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public TimeRange getInsertRange() {
    return insertRange;
  }

  public long getMinEventTime() {
    return minEventTime;
  }

  public long getMaxEventTime() {
    return maxEventTime;
  }

  public long getUpdated() {
    return updated;
  }

  public String getFilePath() {
    return filePath;
  }

  public boolean hasFile() {
    return filePath != null;
  }

  public long getFileSize() {
    return fileSize;
  }

  public long getRowCount() {
    return rowCount;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public long getSourceHash() {
    return sourceHash;
  }

  public boolean isRetired() {
    return retired;
  }

  public long getRetiredTime() {
    return retiredTime;
  }

  /**
   * Tells if the event times of the rows can intersect the range. Partitions without rows never do.
   */
  public boolean mayContainEvents(final TimeRange eventRange) {
    return rowCount > 0 && eventRange.intersectsClosed(minEventTime, maxEventTime);
  }

  Builder toBuilder() {
    return new Builder(viewName, instanceId, insertRange).partitionId(partitionId).eventTimes(minEventTime, maxEventTime).updated(updated)
        .file(filePath, fileSize).rowCount(rowCount).fingerprint(fingerprint).sourceHash(sourceHash).retired(retired, retiredTime);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Partition))
      return false;
    final Partition that = (Partition) o;
    return partitionId == that.partitionId && viewName.equals(that.viewName) && instanceId.equals(that.instanceId) && insertRange.equals(
        that.insertRange) && retired == that.retired && fingerprint.equals(that.fingerprint) && sourceHash == that.sourceHash;
  }

  @Override
  public int hashCode() {
    return Objects.hash(partitionId, viewName, instanceId, insertRange);
  }

  @Override
  public String toString() {
    return "Partition{" + viewName + "/" + instanceId + " " + insertRange + ", rows=" + rowCount + ", file=" + filePath + ", fingerprint="
        + fingerprint + (retired ? ", retired" : "") + "}";
  }

  public static class Builder {
    private final String    viewName;
    private final String    instanceId;
    private final TimeRange insertRange;
    private       long      partitionId;
    private       long      minEventTime;
    private       long      maxEventTime;
    private       long      updated;
    private       String    filePath;
    private       long      fileSize;
    private       long      rowCount;
    private       String    fingerprint;
    private       long      sourceHash;
    private       boolean   retired;
    private       long      retiredTime;

    private Builder(final String viewName, final String instanceId, final TimeRange insertRange) {
      this.viewName = viewName;
      this.instanceId = instanceId;
      this.insertRange = insertRange;
    }

    public Builder partitionId(final long partitionId) {
      this.partitionId = partitionId;
      return this;
    }

    public Builder eventTimes(final long minEventTime, final long maxEventTime) {
      this.minEventTime = minEventTime;
      this.maxEventTime = maxEventTime;
      return this;
    }

    public Builder updated(final long updated) {
      this.updated = updated;
      return this;
    }

    public Builder file(final String filePath, final long fileSize) {
      this.filePath = filePath;
      this.fileSize = fileSize;
      return this;
    }

    public Builder rowCount(final long rowCount) {
      this.rowCount = rowCount;
      return this;
    }

    public Builder fingerprint(final String fingerprint) {
      this.fingerprint = fingerprint;
      return this;
    }

    public Builder sourceHash(final long sourceHash) {
      this.sourceHash = sourceHash;
      return this;
    }

    public Builder retired(final boolean retired, final long retiredTime) {
      this.retired = retired;
      this.retiredTime = retiredTime;
      return this;
    }

    public Partition build() {
      return new Partition(this);
    }
  }
}
