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
package com.tidelake.time;

import java.util.ArrayList;
import java.util.List;

/**
 * Bucket widths used to partition views in time. Buckets are aligned on the Unix epoch, so a bucket of a coarser
 * granularity always contains whole buckets of the finer ones.
 */
public enum TimeGranularity {
  SECOND(1_000_000_000L),
  MINUTE(60_000_000_000L),
  HOUR(3_600_000_000_000L),
  DAY(86_400_000_000_000L);

  private final long nanos;

  TimeGranularity(final long nanos) {
    this.nanos = nanos;
  }

  public long getNanos() {
    return nanos;
  }

  public long truncate(final long time) {
    return Math.floorDiv(time, nanos) * nanos;
  }

  public TimeRange bucketOf(final long time) {
    final long begin = truncate(time);
    return new TimeRange(begin, begin + nanos);
  }

  /**
   * Tells if {@code range} is exactly one bucket of this granularity.
   */
  public boolean isBucket(final TimeRange range) {
    return range.getDuration() == nanos && truncate(range.getBegin()) == range.getBegin();
  }

  /**
   * Splits the range into the buckets of this granularity that intersect it, in ascending order.
   */
  public List<TimeRange> buckets(final TimeRange range) {
    final List<TimeRange> result = new ArrayList<>();
    if (range.isEmpty())
      return result;
    for (long begin = truncate(range.getBegin()); begin < range.getEnd(); begin += nanos)
      result.add(new TimeRange(begin, begin + nanos));
    return result;
  }

  public static TimeGranularity fromString(final String value) {
    return switch (value.trim().toLowerCase()) {
      case "second", "seconds", "s" -> SECOND;
      case "minute", "minutes", "m" -> MINUTE;
      case "hour", "hours", "h" -> HOUR;
      case "day", "days", "d" -> DAY;
      default -> throw new IllegalArgumentException("Unknown granularity '" + value + "'");
    };
  }
}
