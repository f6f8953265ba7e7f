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

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Conversions between {@link Instant}, clocks and the nanosecond timestamps used throughout the lakehouse.
 */
public final class TimeUtils {
  private TimeUtils() {
  }

  public static long toNanos(final Instant instant) {
    return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
  }

  public static Instant toInstant(final long nanos) {
    return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
  }

  public static long nowNanos(final Clock clock) {
    return toNanos(clock.instant());
  }

  public static long millisToNanos(final long millis) {
    return millis * 1_000_000L;
  }

  public static String format(final long nanos) {
    if (nanos == Long.MIN_VALUE)
      return "-inf";
    if (nanos == Long.MAX_VALUE)
      return "+inf";
    return DateTimeFormatter.ISO_INSTANT.format(toInstant(nanos));
  }
}
