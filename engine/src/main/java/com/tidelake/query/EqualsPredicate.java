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
package com.tidelake.query;

import com.tidelake.columnar.ColumnStats;
import com.tidelake.columnar.RecordBatch;

/**
 * Keeps the rows whose column equals a value. Numbers are compared by value, whatever their boxed type.
 */
public class EqualsPredicate implements ScanPredicate {
  private final String column;
  private final Object value;

  public EqualsPredicate(final String column, final Object value) {
    if (value == null)
      throw new IllegalArgumentException("Null value for equality on column '" + column + "'");
    this.column = column;
    this.value = value;
  }

  @Override
  public String getColumn() {
    return column;
  }

  public Object getValue() {
    return value;
  }

  @Override
  public boolean mayMatch(final ColumnStats stats) {
    return stats.mayContain(value);
  }

  @Override
  public boolean test(final RecordBatch batch, final int column, final int row) {
    switch (batch.getSchema().getColumn(column).getType()) {
    case TIMESTAMP:
    case LONG:
      return value instanceof Number && ((Number) value).longValue() == batch.getLong(column, row);
    case DOUBLE:
      return value instanceof Number && Double.compare(((Number) value).doubleValue(), batch.getDouble(column, row)) == 0;
    default:
      return value.toString().equals(batch.getString(column, row));
    }
  }

  @Override
  public String toString() {
    return column + " = " + value;
  }
}
