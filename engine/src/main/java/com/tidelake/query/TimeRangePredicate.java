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
import com.tidelake.time.TimeRange;

/**
 * Keeps the rows whose timestamp falls in a half-open range.
 */
public class TimeRangePredicate implements ScanPredicate {
  private final String    column;
  private final TimeRange range;

  public TimeRangePredicate(final String column, final TimeRange range) {
    this.column = column;
    this.range = range;
  }

  @Override
  public String getColumn() {
    return column;
  }

  public TimeRange getRange() {
    return range;
  }

  @Override
  public boolean mayMatch(final ColumnStats stats) {
    return stats.mayIntersect(range.getBegin(), range.getEnd());
  }

  @Override
  public boolean test(final RecordBatch batch, final int column, final int row) {
    return range.contains(batch.getLong(column, row));
  }

  @Override
  public String toString() {
    return column + " in " + range;
  }
}
