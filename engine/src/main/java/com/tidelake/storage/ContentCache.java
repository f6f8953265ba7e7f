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
package com.tidelake.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Bounded cache of partition file bytes, weighted by size. Concurrent readers of the same missing file share one
 * storage read: the entry is published only once the whole content has been loaded. Files bigger than the max file size
 * bypass the cache.
 */
public class ContentCache {
  private final BlobStore           blobStore;
  private final Cache<String, byte[]> cache;
  private final long                maxFileSize;

  public ContentCache(final BlobStore blobStore, final long byteBudget, final long maxFileSize) {
    this.blobStore = blobStore;
    this.maxFileSize = maxFileSize;
    this.cache = Caffeine.newBuilder()
        .maximumWeight(byteBudget)
        .weigher((String path, byte[] content) -> content.length + path.length())
        .recordStats()
        .build();
  }

  /**
   * Returns the content of the file. The expected size, when known (&gt;= 0), avoids caching files above the limit.
   */
  public byte[] get(final String path, final long expectedSize) {
    if (expectedSize > maxFileSize)
      return blobStore.get(path);
    return cache.get(path, blobStore::get);
  }

  /**
   * Drops the cached content of a path whose object was replaced or deleted.
   */
  public void invalidate(final String path) {
    cache.invalidate(path);
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  public CacheStats getStats() {
    return cache.stats();
  }

  public long getEstimatedSize() {
    return cache.estimatedSize();
  }
}
