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

import com.tidelake.time.TimeRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scan pushed down by the query engine: projection, predicates, event-time range and row limit.
 */
public class ScanRequest {
  public static final long NO_LIMIT = -1;

  private final List<String>        columns;
  private final List<ScanPredicate> predicates;
  private final TimeRange           eventRange;
  private final long                limit;

  private ScanRequest(final Builder builder) {
    this.columns = builder.columns == null ? null : Collections.unmodifiableList(builder.columns);
    this.predicates = Collections.unmodifiableList(builder.predicates);
    this.eventRange = builder.eventRange;
    this.limit = builder.limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ScanRequest all() {
    return builder().build();
  }

  /**
   * Projected columns, or null for all the columns of the table.
   */
  public List<String> getColumns() {
    return columns;
  }

  public List<ScanPredicate> getPredicates() {
    return predicates;
  }

  public TimeRange getEventRange() {
    return eventRange;
  }

  public long getLimit() {
    return limit;
  }

  public boolean hasLimit() {
    return limit >= 0;
  }

  @Override
  public String toString() {
    return "ScanRequest{columns=" + (columns == null ? "*" : columns) + ", predicates=" + predicates + ", eventRange=" + eventRange
        + ", limit=" + limit + "}";
  }

  public static class Builder {
    private List<String>              columns;
    private final List<ScanPredicate> predicates = new ArrayList<>();
    private TimeRange                 eventRange = TimeRange.unbounded();
    private long                      limit      = NO_LIMIT;

    public Builder columns(final String... columns) {
      this.columns = List.of(columns);
      return this;
    }

    public Builder columns(final List<String> columns) {
      this.columns = columns == null ? null : new ArrayList<>(columns);
      return this;
    }

    public Builder eventRange(final TimeRange eventRange) {
      this.eventRange = eventRange;
      return this;
    }

    public Builder eventRange(final long begin, final long end) {
      return eventRange(new TimeRange(begin, end));
    }

    public Builder where(final ScanPredicate predicate) {
      predicates.add(predicate);
      return this;
    }

    public Builder whereEquals(final String column, final Object value) {
      return where(new EqualsPredicate(column, value));
    }

    public Builder limit(final long limit) {
      this.limit = limit;
      return this;
    }

    public ScanRequest build() {
      return new ScanRequest(this);
    }
  }
}
