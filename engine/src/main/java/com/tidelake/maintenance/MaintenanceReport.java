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

import com.tidelake.serializer.json.JSONObject;

/**
 * Outcome of one maintenance pass.
 */
public class MaintenanceReport {
  private final int  duplicatesDeleted;
  private final int  partitionsRetired;
  private final int  partitionsCollected;
  private final int  expiredBlocksDeleted;
  private final int  expiredPartitionsRetired;
  private final long durationMs;

  public MaintenanceReport(final int duplicatesDeleted, final int partitionsRetired, final int partitionsCollected,
      final int expiredBlocksDeleted, final int expiredPartitionsRetired, final long durationMs) {
    this.duplicatesDeleted = duplicatesDeleted;
    this.partitionsRetired = partitionsRetired;
    this.partitionsCollected = partitionsCollected;
    this.expiredBlocksDeleted = expiredBlocksDeleted;
    this.expiredPartitionsRetired = expiredPartitionsRetired;
    this.durationMs = durationMs;
  }

  public int getDuplicatesDeleted() {
    return duplicatesDeleted;
  }

  /**
   * Partitions retired because their fingerprint no longer matches their view.
   */
  public int getPartitionsRetired() {
    return partitionsRetired;
  }

  public int getPartitionsCollected() {
    return partitionsCollected;
  }

  public int getExpiredBlocksDeleted() {
    return expiredBlocksDeleted;
  }

  public int getExpiredPartitionsRetired() {
    return expiredPartitionsRetired;
  }

  public long getDurationMs() {
    return durationMs;
  }

  public JSONObject toJSON() {
    return new JSONObject()
        .put("duplicatesDeleted", duplicatesDeleted)
        .put("partitionsRetired", partitionsRetired)
        .put("partitionsCollected", partitionsCollected)
        .put("expiredBlocksDeleted", expiredBlocksDeleted)
        .put("expiredPartitionsRetired", expiredPartitionsRetired)
        .put("durationMs", durationMs);
  }

  @Override
  public String toString() {
    return toJSON().toString();
  }
}
