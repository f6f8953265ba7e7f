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

import com.tidelake.columnar.RecordBatch;
import com.tidelake.columnar.RecordBatchBuilder;
import com.tidelake.columnar.TableSchema;
import com.tidelake.time.TimeGranularity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the upstream rows of a bucket by time bin and group-by columns and computes the aggregations of each group.
 * Output rows are sorted by time bin, then by group values.
 */
public class AggregateTransform implements ViewTransform {
  private final String                          timeColumn;
  private final TimeGranularity                 bin;
  private final List<String>                    groupBy;
  private final List<AggregateView.Aggregation> aggregations;

  private static final class Group {
    final long     bin;
    final Object[] keys;
    final long[]   counts;
    final double[] values;

    Group(final long bin, final Object[] keys, final int nbAggregations) {
      this.bin = bin;
      this.keys = keys;
      this.counts = new long[nbAggregations];
      this.values = new double[nbAggregations];
    }
  }

  private static final class GroupKey {
    final long     bin;
    final Object[] keys;

    GroupKey(final long bin, final Object[] keys) {
      this.bin = bin;
      this.keys = keys;
    }

    @Override
    public boolean equals(final Object o) {
      return o instanceof GroupKey && bin == ((GroupKey) o).bin && Arrays.equals(keys, ((GroupKey) o).keys);
    }

    @Override
    public int hashCode() {
      return 31 * Long.hashCode(bin) + Arrays.hashCode(keys);
    }
  }

  public AggregateTransform(final String timeColumn, final TimeGranularity bin, final List<String> groupBy,
      final List<AggregateView.Aggregation> aggregations) {
    this.timeColumn = timeColumn;
    this.bin = bin;
    this.groupBy = List.copyOf(groupBy);
    this.aggregations = List.copyOf(aggregations);
  }

  @Override
  public void apply(final SourceData source, final RecordBatchBuilder output) {
    final Map<GroupKey, Group> groups = new HashMap<>();

    for (final RecordBatch batch : source.getUpstreamBatches()) {
      final TableSchema schema = batch.getSchema();
      final int timeIndex = schema.indexOf(timeColumn);
      final int[] groupIndexes = indexes(schema, groupBy);
      final int[] aggregateIndexes = new int[aggregations.size()];
      for (int a = 0; a < aggregations.size(); a++)
        aggregateIndexes[a] = schema.indexOf(aggregations.get(a).getColumn());

      for (int row = 0; row < batch.getRowCount(); row++) {
        final long binTime = bin.truncate(batch.getLong(timeIndex, row));
        final Object[] keys = new Object[groupIndexes.length];
        for (int k = 0; k < keys.length; k++)
          keys[k] = batch.getValue(groupIndexes[k], row);

        final Group group = groups.computeIfAbsent(new GroupKey(binTime, keys), k -> new Group(binTime, keys, aggregations.size()));
        for (int a = 0; a < aggregations.size(); a++)
          accumulate(group, a, aggregations.get(a).getFunction(), batch.getValue(aggregateIndexes[a], row));
      }
    }

    final List<Group> sorted = new ArrayList<>(groups.values());
    sorted.sort(Comparator.comparingLong((Group g) -> g.bin).thenComparing(g -> Arrays.toString(g.keys)));

    for (final Group group : sorted) {
      final Object[] row = new Object[1 + group.keys.length + aggregations.size()];
      row[0] = group.bin;
      System.arraycopy(group.keys, 0, row, 1, group.keys.length);
      for (int a = 0; a < aggregations.size(); a++)
        row[1 + group.keys.length + a] = result(group, a, aggregations.get(a).getFunction());
      output.append(row);
    }
  }

  private static void accumulate(final Group group, final int a, final AggregateFunction function, final Object value) {
    final double v = value instanceof Number ? ((Number) value).doubleValue() : 0D;
    switch (function) {
    case MIN:
      group.values[a] = group.counts[a] == 0 ? v : Math.min(group.values[a], v);
      break;
    case MAX:
      group.values[a] = group.counts[a] == 0 ? v : Math.max(group.values[a], v);
      break;
    case SUM:
    case AVG:
      group.values[a] += v;
      break;
    default:
      break;
    }
    group.counts[a]++;
  }

  private static Object result(final Group group, final int a, final AggregateFunction function) {
    switch (function) {
    case COUNT:
      return group.counts[a];
    case AVG:
      return group.counts[a] == 0 ? 0D : group.values[a] / group.counts[a];
    default:
      return group.values[a];
    }
  }

  private static int[] indexes(final TableSchema schema, final List<String> columns) {
    final int[] result = new int[columns.size()];
    for (int i = 0; i < result.length; i++)
      result[i] = schema.indexOf(columns.get(i));
    return result;
  }
}
