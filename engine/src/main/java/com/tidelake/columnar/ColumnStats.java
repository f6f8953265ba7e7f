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
package com.tidelake.columnar;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * Min/max of a column within a chunk or a whole partition file, used to skip data that cannot match a predicate.
 * Values are {@link Long} for TIMESTAMP and LONG columns, {@link Double} for DOUBLE and {@link String} for STRING.
 * Both bounds are {@code null} for an empty chunk.
 */
public final class ColumnStats {
  private final ColumnType          type;
  private final Comparable<Object>  min;
  private final Comparable<Object>  max;

  @SuppressWarnings("unchecked")
  public ColumnStats(final ColumnType type, final Object min, final Object max) {
    this.type = type;
    this.min = (Comparable<Object>) min;
    this.max = (Comparable<Object>) max;
  }

  public static ColumnStats compute(final ColumnType type, final Object data, final int count) {
    if (count == 0)
      return new ColumnStats(type, null, null);
    switch (type) {
    case TIMESTAMP:
    case LONG: {
      final long[] values = (long[]) data;
      long min = values[0], max = values[0];
      for (int i = 1; i < count; i++) {
        min = Math.min(min, values[i]);
        max = Math.max(max, values[i]);
      }
      return new ColumnStats(type, min, max);
    }
    case DOUBLE: {
      final double[] values = (double[]) data;
      // TOTAL ORDER OF Double.compare: NaN IS THE GREATEST VALUE, AS IN THE EQUALITY FILTER
      double min = values[0], max = values[0];
      for (int i = 1; i < count; i++) {
        if (Double.compare(values[i], min) < 0)
          min = values[i];
        if (Double.compare(values[i], max) > 0)
          max = values[i];
      }
      return new ColumnStats(type, min, max);
    }
    default: {
      final String[] values = (String[]) data;
      String min = values[0], max = values[0];
      for (int i = 1; i < count; i++) {
        if (values[i].compareTo(min) < 0)
          min = values[i];
        if (values[i].compareTo(max) > 0)
          max = values[i];
      }
      return new ColumnStats(type, min, max);
    }
    }
  }

  public ColumnStats merge(final ColumnStats other) {
    if (min == null)
      return other;
    if (other.min == null)
      return this;
    return new ColumnStats(type, min.compareTo(other.min) <= 0 ? min : other.min,
        max.compareTo(other.max) >= 0 ? max : other.max);
  }

  public ColumnType getType() {
    return type;
  }

  public Object getMin() {
    return min;
  }

  public Object getMax() {
    return max;
  }

  public boolean isEmpty() {
    return min == null;
  }

  /**
   * Returns false only when the value is certainly out of [min, max].
   */
  public boolean mayContain(final Object value) {
    if (min == null)
      return false;
    final Object converted = convert(value);
    if (converted == null)
      return true;
    return min.compareTo(converted) <= 0 && max.compareTo(converted) >= 0;
  }

  /**
   * Returns false only when no value of [min, max] falls in the half-open range [begin, end).
   */
  public boolean mayIntersect(final long begin, final long end) {
    if (min == null)
      return false;
    if (type != ColumnType.TIMESTAMP && type != ColumnType.LONG)
      return true;
    return (Long) (Object) min < end && (Long) (Object) max >= begin;
  }

  private Object convert(final Object value) {
    if (value == null)
      return null;
    switch (type) {
    case TIMESTAMP:
    case LONG:
      return value instanceof Number ? (Object) ((Number) value).longValue() : null;
    case DOUBLE:
      return value instanceof Number ? (Object) ((Number) value).doubleValue() : null;
    default:
      return value.toString();
    }
  }

  void write(final DataOutputStream out) throws IOException {
    out.writeBoolean(min != null);
    if (min == null)
      return;
    writeValue(out, min);
    writeValue(out, max);
  }

  static ColumnStats read(final DataInputStream in, final ColumnType type) throws IOException {
    if (!in.readBoolean())
      return new ColumnStats(type, null, null);
    final Object min = readValue(in, type);
    final Object max = readValue(in, type);
    return new ColumnStats(type, min, max);
  }

  private void writeValue(final DataOutputStream out, final Object value) throws IOException {
    switch (type) {
    case TIMESTAMP:
    case LONG:
      out.writeLong((Long) value);
      break;
    case DOUBLE:
      out.writeDouble((Double) value);
      break;
    default:
      PartitionFooter.writeString(out, (String) value);
    }
  }

  private static Object readValue(final DataInputStream in, final ColumnType type) throws IOException {
    switch (type) {
    case TIMESTAMP:
    case LONG:
      return in.readLong();
    case DOUBLE:
      return in.readDouble();
    default:
      return PartitionFooter.readString(in);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof ColumnStats))
      return false;
    final ColumnStats that = (ColumnStats) o;
    return type == that.type && Objects.equals(min, that.min) && Objects.equals(max, that.max);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, min, max);
  }

  @Override
  public String toString() {
    return "[" + min + ", " + max + "]";
  }
}
