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

import java.util.Arrays;

/**
 * Accumulates rows into growable column arrays. Values are converted to the column type: numbers are accepted for
 * numeric columns, anything else is rendered with {@code toString()} for string columns, nulls become empty or zero.
 */
public final class RecordBatchBuilder {
  private static final int INITIAL_CAPACITY = 64;

  private final TableSchema schema;
  private       Object[]    columns;
  private       int         size;
  private       int         capacity;

  public RecordBatchBuilder(final TableSchema schema) {
    this.schema = schema;
    allocate(INITIAL_CAPACITY);
  }

  public TableSchema getSchema() {
    return schema;
  }

  public int size() {
    return size;
  }

  public RecordBatchBuilder append(final Object... values) {
    if (values.length != schema.size())
      throw new IllegalArgumentException("Expected " + schema.size() + " values, found " + values.length);
    ensureCapacity(size + 1);
    for (int c = 0; c < values.length; c++)
      set(c, size, values[c]);
    size++;
    return this;
  }

  /**
   * Appends one row of another batch, matching the columns by name.
   */
  public RecordBatchBuilder appendRow(final RecordBatch batch, final int row) {
    ensureCapacity(size + 1);
    final TableSchema source = batch.getSchema();
    for (int c = 0; c < schema.size(); c++) {
      final int sourceIndex = source == schema ? c : source.indexOf(schema.getColumn(c).getName());
      set(c, size, sourceIndex < 0 ? null : batch.getValue(sourceIndex, row));
    }
    size++;
    return this;
  }

  public RecordBatchBuilder appendBatch(final RecordBatch batch) {
    if (batch.getSchema().equals(schema)) {
      // FAST PATH: SAME LAYOUT, COPY WHOLE ARRAYS
      final int count = batch.getRowCount();
      ensureCapacity(size + count);
      for (int c = 0; c < schema.size(); c++)
        System.arraycopy(batch.getColumnData(c), 0, columns[c], size, count);
      size += count;
    } else
      for (int r = 0; r < batch.getRowCount(); r++)
        appendRow(batch, r);
    return this;
  }

  public RecordBatch build() {
    final Object[] result = new Object[columns.length];
    for (int c = 0; c < columns.length; c++) {
      final Object data = columns[c];
      if (data instanceof long[])
        result[c] = Arrays.copyOf((long[]) data, size);
      else if (data instanceof double[])
        result[c] = Arrays.copyOf((double[]) data, size);
      else
        result[c] = Arrays.copyOf((String[]) data, size);
    }
    return new RecordBatch(schema, result, size);
  }

  public void clear() {
    size = 0;
    allocate(INITIAL_CAPACITY);
  }

  private void set(final int column, final int row, final Object value) {
    switch (schema.getColumn(column).getType()) {
    case TIMESTAMP:
    case LONG:
      ((long[]) columns[column])[row] = toLong(schema.getColumn(column), value);
      break;
    case DOUBLE:
      ((double[]) columns[column])[row] = toDouble(schema.getColumn(column), value);
      break;
    default:
      ((String[]) columns[column])[row] = value == null ? "" : value.toString();
    }
  }

  private static long toLong(final ColumnDefinition column, final Object value) {
    if (value == null)
      return 0L;
    if (value instanceof Number)
      return ((Number) value).longValue();
    if (value instanceof String && !((String) value).isEmpty())
      try {
        return Long.parseLong((String) value);
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Column '" + column.getName() + "' expects an integer, found '" + value + "'", e);
      }
    if (value instanceof String)
      return 0L;
    throw new IllegalArgumentException("Column '" + column.getName() + "' expects an integer, found " + value.getClass().getSimpleName());
  }

  private static double toDouble(final ColumnDefinition column, final Object value) {
    if (value == null)
      return 0D;
    if (value instanceof Number)
      return ((Number) value).doubleValue();
    if (value instanceof String && !((String) value).isEmpty())
      try {
        return Double.parseDouble((String) value);
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Column '" + column.getName() + "' expects a number, found '" + value + "'", e);
      }
    if (value instanceof String)
      return 0D;
    throw new IllegalArgumentException("Column '" + column.getName() + "' expects a number, found " + value.getClass().getSimpleName());
  }

  private void allocate(final int newCapacity) {
    columns = new Object[schema.size()];
    for (int c = 0; c < schema.size(); c++)
      columns[c] = newArray(schema.getColumn(c).getType(), newCapacity);
    capacity = newCapacity;
  }

  private void ensureCapacity(final int required) {
    if (required <= capacity)
      return;
    final int newCapacity = Math.max(required, capacity * 2);
    for (int c = 0; c < columns.length; c++) {
      final Object data = columns[c];
      if (data instanceof long[])
        columns[c] = Arrays.copyOf((long[]) data, newCapacity);
      else if (data instanceof double[])
        columns[c] = Arrays.copyOf((double[]) data, newCapacity);
      else
        columns[c] = Arrays.copyOf((String[]) data, newCapacity);
    }
    capacity = newCapacity;
  }

  private static Object newArray(final ColumnType type, final int capacity) {
    switch (type) {
    case TIMESTAMP:
    case LONG:
      return new long[capacity];
    case DOUBLE:
      return new double[capacity];
    default:
      return new String[capacity];
    }
  }
}
