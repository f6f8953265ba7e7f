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
package com.tidelake.view;

import com.tidelake.columnar.ColumnDefinition;
import com.tidelake.columnar.ColumnType;
import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.InvalidViewDefinitionException;
import com.tidelake.time.TimeGranularity;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative aggregation over the partitions of another view: rows are grouped by a time bin and a list of columns,
 * then reduced with {@link AggregateFunction}s. The result is a regular {@link ViewDefinition}, scheduled and
 * materialized like any other view.
 * <p>
 * Example: error counts per minute and target.
 * <pre>
 * AggregateView.builder("log_errors_per_minute", BuiltinViews.logEntries())
 *     .timeColumn("time").bin(TimeGranularity.MINUTE)
 *     .groupBy("target")
 *     .aggregate(AggregateFunction.COUNT, "msg", "nb_entries")
 *     .build();
 * </pre>
 */
public final class AggregateView {
  public static final String TIME_BIN_COLUMN = "time_bin";

  private AggregateView() {
  }

  public static Builder builder(final String name, final ViewDefinition upstream) {
    return new Builder(name, upstream);
  }

  public static final class Aggregation {
    private final AggregateFunction function;
    private final String            column;
    private final String            alias;

    public Aggregation(final AggregateFunction function, final String column, final String alias) {
      this.function = function;
      this.column = column;
      this.alias = alias;
    }

    public AggregateFunction getFunction() {
      return function;
    }

    public String getColumn() {
      return column;
    }

    public String getAlias() {
      return alias;
    }

    @Override
    public String toString() {
      return function + "(" + column + ") AS " + alias;
    }
  }

  public static final class Builder {
    private final String            name;
    private final ViewDefinition    upstream;
    private final List<String>      groupBy      = new ArrayList<>();
    private final List<Aggregation> aggregations = new ArrayList<>();
    private       String            timeColumn;
    private       TimeGranularity   bin          = TimeGranularity.MINUTE;
    private       TimeGranularity   granularity;
    private       TimeGranularity   mergeGranularity;
    private       int               updateGroup  = 3000;

    private Builder(final String name, final ViewDefinition upstream) {
      this.name = name;
      this.upstream = upstream;
      this.timeColumn = upstream.getEventTimeColumn();
    }

    public Builder timeColumn(final String timeColumn) {
      this.timeColumn = timeColumn;
      return this;
    }

    public Builder bin(final TimeGranularity bin) {
      this.bin = bin;
      return this;
    }

    public Builder groupBy(final String... columns) {
      groupBy.addAll(List.of(columns));
      return this;
    }

    public Builder aggregate(final AggregateFunction function, final String column, final String alias) {
      aggregations.add(new Aggregation(function, column, alias));
      return this;
    }

    public Builder granularity(final TimeGranularity granularity) {
      this.granularity = granularity;
      return this;
    }

    public Builder mergeGranularity(final TimeGranularity mergeGranularity) {
      this.mergeGranularity = mergeGranularity;
      return this;
    }

    public Builder updateGroup(final int updateGroup) {
      this.updateGroup = updateGroup;
      return this;
    }

    public ViewDefinition build() {
      final TableSchema upstreamSchema = upstream.getSchema();
      if (aggregations.isEmpty())
        throw new InvalidViewDefinitionException(name, "at least one aggregation is required");
      checkColumn(upstreamSchema, timeColumn, true);

      final List<ColumnDefinition> columns = new ArrayList<>();
      columns.add(new ColumnDefinition(TIME_BIN_COLUMN, ColumnType.TIMESTAMP));
      for (final String g : groupBy) {
        checkColumn(upstreamSchema, g, false);
        columns.add(upstreamSchema.getColumn(upstreamSchema.indexOf(g)));
      }
      for (final Aggregation a : aggregations) {
        checkColumn(upstreamSchema, a.getColumn(), false);
        if (a.getFunction() != AggregateFunction.COUNT && !upstreamSchema.getColumn(upstreamSchema.indexOf(a.getColumn())).getType().isNumeric())
          throw new InvalidViewDefinitionException(name, a + " requires a numeric column");
        columns.add(new ColumnDefinition(a.getAlias(), a.getFunction().getResultType()));
      }

      final TableSchema schema;
      try {
        schema = new TableSchema(columns);
      } catch (final IllegalArgumentException e) {
        throw new InvalidViewDefinitionException(name, e.getMessage());
      }

      final TimeGranularity g = granularity != null ? granularity : (bin.compareTo(upstream.getGranularity()) > 0 ? bin : upstream.getGranularity());
      return ViewDefinition.builder(name)
          .schema(schema)
          .source(ViewSource.view(upstream.getName()))
          .transform(new AggregateTransform(timeColumn, bin, groupBy, aggregations))
          .eventTimeColumn(TIME_BIN_COLUMN)
          .granularity(g)
          .mergeGranularity(mergeGranularity != null ? mergeGranularity : g)
          .instanceKey(InstanceKey.NONE)
          .global(true)
          .updateGroup(updateGroup)
          .version(describe())
          .concatMergeable(false)
          .build();
    }

    private String describe() {
      return upstream.getName() + "|" + timeColumn + "|" + bin + "|" + groupBy + "|" + aggregations;
    }

    private void checkColumn(final TableSchema schema, final String column, final boolean timestamp) {
      final int index = column != null ? schema.indexOf(column) : -1;
      if (index < 0)
        throw new InvalidViewDefinitionException(name, "column '" + column + "' not found in view '" + upstream.getName() + "'");
      if (timestamp && schema.getColumn(index).getType() != ColumnType.TIMESTAMP)
        throw new InvalidViewDefinitionException(name, "column '" + column + "' is not a timestamp");
    }
  }
}
