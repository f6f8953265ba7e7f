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

import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.ProcessInfo;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.partition.Partition;

/**
 * Identity hash of the source records of a bucket. The hash of a set is the wrapping sum of the hashes of its
 * elements, so the hashes of adjacent buckets add up to the hash of their union: this is what allows partitions to be
 * merged without reading their source again.
 */
public final class SourceHash {
  private SourceHash() {
  }

  public static long of(final BlockMetadata block) {
    return mix(fnv(block.getBlockId()) ^ block.getNbObjects());
  }

  public static long of(final ProcessInfo process) {
    return mix(fnv(process.getProcessId()) ^ process.getInsertTime() ^ Long.rotateLeft(process.getLastUpdateTime(), 29));
  }

  public static long of(final StreamInfo stream) {
    return mix(fnv(stream.getStreamId()) ^ stream.getInsertTime());
  }

  /**
   * Hash of an upstream partition: changes whenever the partition is re-materialized with different content.
   */
  public static long of(final Partition partition) {
    return mix(fnv(partition.getFilePath() != null ? partition.getFilePath() : partition.getInsertRange().toString()) ^ partition.getSourceHash()
        ^ Long.rotateLeft(partition.getRowCount(), 17));
  }

  static long fnv(final String value) {
    long hash = 0xcbf29ce484222325L;
    for (int i = 0; i < value.length(); i++) {
      hash ^= value.charAt(i);
      hash *= 0x100000001b3L;
    }
    return hash;
  }

  /**
   * Finalizer of SplitMix64: spreads the bits so that sums of hashes do not collide on structured ids.
   */
  static long mix(long z) {
    z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
    z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
    return z ^ (z >>> 31);
  }
}
