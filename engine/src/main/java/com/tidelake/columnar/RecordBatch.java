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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Immutable set of rows stored column by column. TIMESTAMP and LONG columns are {@code long[]}, DOUBLE columns
 * {@code double[]} and STRING columns {@code String[]}.
 */
public final class RecordBatch {
  private final TableSchema schema;
  private final Object[]    columns;
  private final int         rowCount;

  RecordBatch(final TableSchema schema, final Object[] columns, final int rowCount) {
    if (columns.length != schema.size())
      throw new IllegalArgumentException("Expected " + schema.size() + " columns, found " + columns.length);
    this.schema = schema;
    this.columns = columns;
    this.rowCount = rowCount;
  }

  public static RecordBatch empty(final TableSchema schema) {
    return new RecordBatchBuilder(schema).build();
  }

  public TableSchema getSchema() {
    return schema;
  }

  public int getRowCount() {
    return rowCount;
  }

  public boolean isEmpty() {
    return rowCount == 0;
  }

  public long[] getLongColumn(final int column) {
    return (long[]) columns[column];
  }

  public double[] getDoubleColumn(final int column) {
    return (double[]) columns[column];
  }

  public String[] getStringColumn(final int column) {
    return (String[]) columns[column];
  }

  Object getColumnData(final int column) {
    return columns[column];
  }

  public long getLong(final int column, final int row) {
    return getLongColumn(column)[row];
  }

  public double getDouble(final int column, final int row) {
    return getDoubleColumn(column)[row];
  }

  public String getString(final int column, final int row) {
    return getStringColumn(column)[row];
  }

  public Object getValue(final int column, final int row) {
    checkRow(row);
    switch (schema.getColumn(column).getType()) {
    case TIMESTAMP:
    case LONG:
      return getLongColumn(column)[row];
    case DOUBLE:
      return getDoubleColumn(column)[row];
    default:
      return getStringColumn(column)[row];
    }
  }

  public Object getValue(final String column, final int row) {
    final int index = schema.indexOf(column);
    if (index < 0)
      throw new IllegalArgumentException("Column '" + column + "' not found in " + schema);
    return getValue(index, row);
  }

  public Object[] getRow(final int row) {
    final Object[] values = new Object[columns.length];
    for (int c = 0; c < columns.length; c++)
      values[c] = getValue(c, row);
    return values;
  }

  public List<Object[]> toRows() {
    final List<Object[]> rows = new ArrayList<>(rowCount);
    for (int r = 0; r < rowCount; r++)
      rows.add(getRow(r));
    return rows;
  }

  public RecordBatch project(final List<String> names) {
    final TableSchema projected = schema.project(names);
    final Object[] projectedColumns = new Object[names.size()];
    for (int i = 0; i < names.size(); i++)
      projectedColumns[i] = columns[schema.indexOf(names.get(i))];
    return new RecordBatch(projected, projectedColumns, rowCount);
  }

  /**
   * Returns the rows in [from, to).
   */
  public RecordBatch slice(final int from, final int to) {
    if (from < 0 || to > rowCount || from > to)
      throw new IndexOutOfBoundsException("Invalid slice [" + from + ", " + to + ") of " + rowCount + " rows");
    if (from == 0 && to == rowCount)
      return this;
    final Object[] sliced = new Object[columns.length];
    for (int c = 0; c < columns.length; c++) {
      final Object data = columns[c];
      if (data instanceof long[])
        sliced[c] = Arrays.copyOfRange((long[]) data, from, to);
      else if (data instanceof double[])
        sliced[c] = Arrays.copyOfRange((double[]) data, from, to);
      else
        sliced[c] = Arrays.copyOfRange((String[]) data, from, to);
    }
    return new RecordBatch(schema, sliced, to - from);
  }

  public RecordBatch filter(final IntPredicate rowFilter) {
    final RecordBatchBuilder builder = new RecordBatchBuilder(schema);
    for (int r = 0; r < rowCount; r++)
      if (rowFilter.test(r))
        builder.appendRow(this, r);
    return builder.size() == rowCount ? this : builder.build();
  }

  public static RecordBatch concat(final TableSchema schema, final List<RecordBatch> batches) {
    if (batches.size() == 1 && batches.get(0).getSchema().equals(schema))
      return batches.get(0);
    final RecordBatchBuilder builder = new RecordBatchBuilder(schema);
    for (final RecordBatch batch : batches)
      builder.appendBatch(batch);
    return builder.build();
  }

  private void checkRow(final int row) {
    if (row < 0 || row >= rowCount)
      throw new IndexOutOfBoundsException("Row " + row + " out of " + rowCount);
  }

  @Override
  public String toString() {
    return "RecordBatch{rows=" + rowCount + ", schema=" + schema + "}";
  }
}
