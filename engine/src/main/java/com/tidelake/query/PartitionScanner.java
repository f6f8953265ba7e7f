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

import com.tidelake.columnar.ColumnType;
import com.tidelake.columnar.PartitionFileReader;
import com.tidelake.columnar.PartitionFooter;
import com.tidelake.columnar.RecordBatch;
import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.IncompatibleSchemaException;
import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.exception.PartitionNotFoundException;
import com.tidelake.log.LogManager;
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionReader;
import com.tidelake.time.TimeRange;
import com.tidelake.view.ViewDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;

/**
 * Reads the rows of a set of partitions matching a {@link ScanRequest}.
 * <p>
 * Partitions are visited in ascending event time. Partitions, then chunks, are skipped when their column statistics
 * exclude a predicate. The limit stops the scan at the first chunk that fills it, so the following chunks and partitions
 * are never decoded. A partition whose file disappeared after it was listed contributes no rows.
 */
public class PartitionScanner {
  private static final Comparator<Partition> TIME_ORDER = Comparator.comparingLong(Partition::getMinEventTime)
      .thenComparingLong(p -> p.getInsertRange().getBegin());

  private final PartitionReader partitionReader;

  public PartitionScanner(final PartitionReader partitionReader) {
    this.partitionReader = partitionReader;
  }

  public ScanResult scan(final ViewDefinition view, final List<Partition> partitions, final ScanRequest request) {
    final TableSchema schema = view.getSchema();
    final List<String> projection = projection(view, request);
    final TableSchema outputSchema = schema.project(projection);

    final List<ScanPredicate> predicates = new ArrayList<>(request.getPredicates());
    final TimeRange eventRange = request.getEventRange();
    if (eventRange.getBegin() != Long.MIN_VALUE || eventRange.getEnd() != Long.MAX_VALUE)
      predicates.add(new TimeRangePredicate(view.getEventTimeColumn(), eventRange));
    validate(view, predicates);

    final Set<String> readColumns = new LinkedHashSet<>(projection);
    for (final ScanPredicate p : predicates)
      readColumns.add(p.getColumn());
    final List<String> columnsToRead = new ArrayList<>(readColumns);

    final List<Partition> sorted = new ArrayList<>(partitions);
    sorted.sort(TIME_ORDER);

    final List<RecordBatch> batches = new ArrayList<>();
    long remaining = request.hasLimit() ? request.getLimit() : Long.MAX_VALUE;
    int scanned = 0;
    int pruned = 0;
    int chunksRead = 0;
    int chunksPruned = 0;

    for (final Partition partition : sorted) {
      if (remaining <= 0)
        break;

      if (!partition.hasFile() || !partition.mayContainEvents(eventRange) || !partition.getFingerprint().equals(view.getFingerprint())) {
        ++pruned;
        continue;
      }

      final PartitionFileReader reader;
      try {
        reader = partitionReader.open(partition);
      } catch (final IncompatibleSchemaException e) {
        // LEFT TO THE MAINTENANCE TASK TO RETIRE
        LogManager.instance().log(this, Level.WARNING, "Skipping partition %s: %s", null, partition, e.getMessage());
        ++pruned;
        continue;
      } catch (final PartitionNotFoundException e) {
        // COLLECTED AFTER THE PARTITION LIST WAS READ
        LogManager.instance().log(this, Level.WARNING, "Skipping partition %s: %s", null, partition, e.getMessage());
        ++pruned;
        continue;
      }

      final PartitionFooter footer = reader.getFooter();
      final TableSchema fileSchema = footer.getSchema();
      if (!mayMatch(predicates, fileSchema, footer, -1)) {
        ++pruned;
        continue;
      }
      ++scanned;

      for (int chunk = 0; chunk < reader.getChunkCount() && remaining > 0; chunk++) {
        if (!mayMatch(predicates, fileSchema, footer, chunk)) {
          ++chunksPruned;
          continue;
        }
        ++chunksRead;

        RecordBatch batch = partitionReader.readChunk(reader, chunk, columnsToRead);
        if (!predicates.isEmpty()) {
          final RecordBatch toFilter = batch;
          final int[] indexes = new int[predicates.size()];
          for (int i = 0; i < indexes.length; i++)
            indexes[i] = toFilter.getSchema().indexOf(predicates.get(i).getColumn());
          batch = toFilter.filter(row -> {
            for (int i = 0; i < indexes.length; i++)
              if (!predicates.get(i).test(toFilter, indexes[i], row))
                return false;
            return true;
          });
        }
        if (batch.isEmpty())
          continue;

        batch = batch.project(projection);
        if (batch.getRowCount() > remaining)
          batch = batch.slice(0, (int) remaining);
        remaining -= batch.getRowCount();
        batches.add(batch);
      }
    }

    LogManager.instance().log(this, Level.FINE, "Scanned view '%s': %d partitions read, %d pruned, %d chunks read, %d pruned", null,
        view.getName(), scanned, pruned, chunksRead, chunksPruned);
    return new ScanResult(outputSchema, batches, scanned, pruned, chunksRead, chunksPruned);
  }

  /**
   * Schema of the rows returned for the request.
   *
   * @throws InvalidScanRequestException if a projected column does not exist
   */
  public static TableSchema outputSchema(final ViewDefinition view, final ScanRequest request) {
    return view.getSchema().project(projection(view, request));
  }

  private static List<String> projection(final ViewDefinition view, final ScanRequest request) {
    final TableSchema schema = view.getSchema();
    if (request.getColumns() == null) {
      final List<String> all = new ArrayList<>(schema.size());
      schema.getColumns().forEach(c -> all.add(c.getName()));
      return all;
    }
    if (request.getColumns().isEmpty())
      throw new InvalidScanRequestException("Empty projection on view '" + view.getName() + "'");
    for (final String c : request.getColumns())
      if (!schema.hasColumn(c))
        throw new InvalidScanRequestException("Column '" + c + "' not found in view '" + view.getName() + "'");
    return request.getColumns();
  }

  private static void validate(final ViewDefinition view, final List<ScanPredicate> predicates) {
    final TableSchema schema = view.getSchema();
    for (final ScanPredicate p : predicates) {
      final int index = schema.indexOf(p.getColumn());
      if (index < 0)
        throw new InvalidScanRequestException("Predicate on unknown column '" + p.getColumn() + "' of view '" + view.getName() + "'");
      if (p instanceof TimeRangePredicate) {
        final ColumnType type = schema.getColumn(index).getType();
        if (type != ColumnType.TIMESTAMP && type != ColumnType.LONG)
          throw new InvalidScanRequestException("Time range on non time column '" + p.getColumn() + "' of view '" + view.getName() + "'");
      }
    }
  }

  /**
   * @param chunk chunk index, -1 for the statistics of the whole file
   */
  private static boolean mayMatch(final List<ScanPredicate> predicates, final TableSchema fileSchema, final PartitionFooter footer,
      final int chunk) {
    for (final ScanPredicate p : predicates) {
      final int column = fileSchema.indexOf(p.getColumn());
      if (column < 0)
        return false;
      final boolean match = chunk < 0 ?
          p.mayMatch(footer.getFileStats(column)) :
          p.mayMatch(footer.getChunks().get(chunk).getColumn(column).getStats());
      if (!match)
        return false;
    }
    return true;
  }
}
