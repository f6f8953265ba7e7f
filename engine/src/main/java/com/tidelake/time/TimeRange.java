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

import java.util.Objects;

/**
 * Half-open time interval {@code [begin, end)} expressed in nanoseconds since the Unix epoch.
 */
public final class TimeRange implements Comparable<TimeRange> {
  private final long begin;
  private final long end;

  public TimeRange(final long begin, final long end) {
    if (end < begin)
      throw new IllegalArgumentException("Invalid time range: end " + end + " precedes begin " + begin);
    this.begin = begin;
    this.end = end;
  }

  public static TimeRange of(final long begin, final long end) {
    return new TimeRange(begin, end);
  }

  public static TimeRange unbounded() {
    return new TimeRange(Long.MIN_VALUE, Long.MAX_VALUE);
  }

  public long getBegin() {
    return begin;
  }

  public long getEnd() {
    return end;
  }

  public long getDuration() {
    return end - begin;
  }

  public boolean isEmpty() {
    return begin == end;
  }

  public boolean contains(final long time) {
    return time >= begin && time < end;
  }

  /**
   * Tells if {@code other} lies entirely inside this range.
   */
  public boolean contains(final TimeRange other) {
    return other.begin >= begin && other.end <= end;
  }

  public boolean overlaps(final TimeRange other) {
    return begin < other.end && other.begin < end;
  }

  /**
   * Tells if the closed interval {@code [min, max]} intersects this range. Used with event-time statistics where the
   * maximum is inclusive.
   */
  public boolean intersectsClosed(final long min, final long max) {
    return min < end && max >= begin;
  }

  public TimeRange intersection(final TimeRange other) {
    final long b = Math.max(begin, other.begin);
    final long e = Math.min(end, other.end);
    return e <= b ? null : new TimeRange(b, e);
  }

  @Override
  public int compareTo(final TimeRange o) {
    final int cmp = Long.compare(begin, o.begin);
    return cmp != 0 ? cmp : Long.compare(end, o.end);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof TimeRange))
      return false;
    final TimeRange that = (TimeRange) o;
    return begin == that.begin && end == that.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(begin, end);
  }

  @Override
  public String toString() {
    return "[" + TimeUtils.format(begin) + ", " + TimeUtils.format(end) + ")";
  }
}
