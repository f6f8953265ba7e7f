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

import com.tidelake.exception.ObjectNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Object storage kept in memory, for tests and ephemeral lakehouses.
 */
public class InMemoryBlobStore implements BlobStore {
  private final Map<String, byte[]> objects    = new ConcurrentHashMap<>();
  private final AtomicLong          writeCount = new AtomicLong();

  @Override
  public void put(final String path, final byte[] content) {
    objects.put(path, content.clone());
    writeCount.incrementAndGet();
  }

  @Override
  public byte[] get(final String path) {
    final byte[] content = objects.get(path);
    if (content == null)
      throw new ObjectNotFoundException(path, null);
    return content.clone();
  }

  @Override
  public boolean exists(final String path) {
    return objects.containsKey(path);
  }

  @Override
  public long size(final String path) {
    final byte[] content = objects.get(path);
    return content != null ? content.length : -1;
  }

  @Override
  public boolean delete(final String path) {
    return objects.remove(path) != null;
  }

  @Override
  public List<String> list(final String prefix) {
    return objects.keySet().stream().filter(p -> p.startsWith(prefix)).sorted().collect(Collectors.toList());
  }

  /**
   * Total number of puts since creation.
   */
  public long getWriteCount() {
    return writeCount.get();
  }
}
