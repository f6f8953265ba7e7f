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
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.partition.PartitionStore;
import com.tidelake.time.TimeUtils;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;

import java.time.Clock;
import java.util.List;
import java.util.logging.Level;

/**
 * Retires the partitions written under a fingerprint that no longer matches their view. Their files stay until the
 * garbage collector reclaims them.
 */
public class SchemaRetirement {
  private final ViewRegistry           registry;
  private final PartitionStore         partitionStore;
  private final PartitionMetadataCache metadataCache;
  private final Clock                  clock;

  public SchemaRetirement(final ViewRegistry registry, final PartitionStore partitionStore, final PartitionMetadataCache metadataCache,
      final Clock clock) {
    this.registry = registry;
    this.partitionStore = partitionStore;
    this.metadataCache = metadataCache;
    this.clock = clock;
  }

  /**
   * @return number of retired partitions
   */
  public int retireIncompatible() {
    int total = 0;
    for (final ViewDefinition view : registry.getViews())
      total += retireIncompatible(view);
    return total;
  }

  public int retireIncompatible(final ViewDefinition view) {
    final List<Partition> retired = partitionStore.retireIncompatible(view.getName(), view.getFingerprint(), TimeUtils.nowNanos(clock));
    if (!retired.isEmpty()) {
      metadataCache.invalidateView(view.getName());
      LogManager.instance().log(this, Level.INFO, "Retired %d partitions of view '%s' not matching fingerprint %s", null, retired.size(),
          view.getName(), view.getFingerprint());
    }
    return retired.size();
  }
}
