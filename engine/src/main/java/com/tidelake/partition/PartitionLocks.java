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

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per view instance, held while the files of that instance change owner: registration of a new partition and
 * deletion of the file of a collected one. Since paths are reused across re-materializations of the same bucket, the
 * check "is this file referenced" and the action that follows must not interleave with a registration.
 * <p>
 * Locks are weakly held: an unused lock is reclaimed, a lock in use is always the same instance for the same key.
 */
public class PartitionLocks {
  private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build(k -> new ReentrantLock());

  public ReentrantLock get(final String viewName, final String instanceId) {
    return locks.get(viewName + "/" + instanceId);
  }
}
