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
import com.tidelake.columnar.RecordBatch;
import com.tidelake.columnar.RecordBatchBuilder;
import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.log.LogManager;
import com.tidelake.maintenance.Deduplicator;
import com.tidelake.maintenance.MaintenanceReport;
import com.tidelake.maintenance.MaintenanceTask;
import com.tidelake.materialize.MaterializationResult;
import com.tidelake.materialize.MaterializerScheduler;
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.partition.PartitionStore;
import com.tidelake.time.TimeGranularity;
import com.tidelake.time.TimeRange;
import com.tidelake.time.TimeUtils;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;

import static com.tidelake.columnar.ColumnDefinition.of;

/**
 * Maintenance functions callable from the query engine, by name through {@link #invoke(String, List)} or directly.
 * Time arguments are nanoseconds since the epoch.
 */
public class LakehouseFunctions {
  public static final TableSchema PARTITIONS_SCHEMA = TableSchema.of(//
      of("view_set_name", ColumnType.STRING),//
      of("view_instance_id", ColumnType.STRING),//
      of("begin_insert_time", ColumnType.TIMESTAMP),//
      of("end_insert_time", ColumnType.TIMESTAMP),//
      of("min_event_time", ColumnType.TIMESTAMP),//
      of("max_event_time", ColumnType.TIMESTAMP),//
      of("updated", ColumnType.TIMESTAMP),//
      of("file_path", ColumnType.STRING),//
      of("file_size", ColumnType.LONG),//
      of("row_count", ColumnType.LONG),//
      of("file_schema_hash", ColumnType.STRING),//
      of("source_data_hash", ColumnType.LONG),//
      of("retired_time", ColumnType.TIMESTAMP));

  public static final TableSchema VIEW_SETS_SCHEMA = TableSchema.of(//
      of("view_set_name", ColumnType.STRING),//
      of("current_schema_hash", ColumnType.STRING),//
      of("schema", ColumnType.STRING),//
      of("instance_key", ColumnType.STRING),//
      of("global_instance_available", ColumnType.LONG));

  private final ViewRegistry           registry;
  private final PartitionStore         partitionStore;
  private final PartitionMetadataCache metadataCache;
  private final Deduplicator           deduplicator;
  private final MaterializerScheduler  scheduler;
  private final MaintenanceTask        maintenanceTask;
  private final Clock                  clock;

  public LakehouseFunctions(final ViewRegistry registry, final PartitionStore partitionStore, final PartitionMetadataCache metadataCache,
      final Deduplicator deduplicator, final MaterializerScheduler scheduler, final MaintenanceTask maintenanceTask, final Clock clock) {
    this.registry = registry;
    this.partitionStore = partitionStore;
    this.metadataCache = metadataCache;
    this.deduplicator = deduplicator;
    this.scheduler = scheduler;
    this.maintenanceTask = maintenanceTask;
    this.clock = clock;
  }

  /**
   * Calls a function by its SQL name.
   *
   * @throws InvalidScanRequestException if the function does not exist or the arguments do not match
   */
  public Object invoke(final String function, final List<Object> args) {
    LogManager.instance().log(this, Level.FINE, "Calling %s%s", null, function, args);
    switch (function.toLowerCase(Locale.ENGLISH)) {
    case "list_partitions":
      checkArgs(function, args, 0);
      return listPartitions();
    case "list_view_sets":
      checkArgs(function, args, 0);
      return listViewSets();
    case "retire_partitions":
      checkArgs(function, args, 4);
      return retirePartitions(string(args, 0), string(args, 1), time(args, 2), time(args, 3));
    case "retire_partition_by_metadata":
      checkArgs(function, args, 4);
      return retirePartitionByMetadata(string(args, 0), string(args, 1), time(args, 2), time(args, 3));
    case "retire_partition_by_file":
      checkArgs(function, args, 1);
      return retirePartitionByFile(string(args, 0));
    case "delete_duplicate_blocks":
      checkArgs(function, args, 2);
      return deduplicator.deleteDuplicateBlocks(new TimeRange(time(args, 0), time(args, 1)));
    case "delete_duplicate_streams":
      checkArgs(function, args, 2);
      return deduplicator.deleteDuplicateStreams(new TimeRange(time(args, 0), time(args, 1)));
    case "delete_duplicate_processes":
      checkArgs(function, args, 2);
      return deduplicator.deleteDuplicateProcesses(new TimeRange(time(args, 0), time(args, 1)));
    case "materialize_partitions":
      checkArgs(function, args, 4);
      return materializePartitions(string(args, 0), time(args, 1), time(args, 2), granularity(args, 3));
    case "run_maintenance":
      checkArgs(function, args, 0);
      return runMaintenance();
    default:
      throw new InvalidScanRequestException("Unknown function '" + function + "'");
    }
  }

  /**
   * Every partition, retired ones included ({@code retired_time} is 0 for live partitions).
   */
  public RecordBatch listPartitions() {
    final RecordBatchBuilder builder = new RecordBatchBuilder(PARTITIONS_SCHEMA);
    for (final Partition p : partitionStore.listAll())
      builder.append(p.getViewName(), p.getInstanceId(), p.getInsertRange().getBegin(), p.getInsertRange().getEnd(), p.getMinEventTime(),
          p.getMaxEventTime(), p.getUpdated(), p.getFilePath(), p.getFileSize(), p.getRowCount(), p.getFingerprint(), p.getSourceHash(),
          p.isRetired() ? p.getRetiredTime() : 0L);
    return builder.build();
  }

  /**
   * Registered views by name, with the fingerprint partitions must carry to be scanned. Partitions listed by
   * {@link #listPartitions()} with another {@code file_schema_hash} are retired by the next maintenance pass.
   */
  public RecordBatch listViewSets() {
    final List<ViewDefinition> views = new ArrayList<>(registry.getViews());
    views.sort(Comparator.comparing(ViewDefinition::getName));

    final RecordBatchBuilder builder = new RecordBatchBuilder(VIEW_SETS_SCHEMA);
    for (final ViewDefinition v : views)
      builder.append(v.getName(), v.getFingerprint(), v.getSchema().toString(), v.getInstanceKey().name().toLowerCase(Locale.ENGLISH),
          v.isGlobal() ? 1L : 0L);
    return builder.build();
  }

  public int retirePartitions(final String viewName, final String instanceId, final long begin, final long end) {
    final int retired = partitionStore.retirePartitions(viewName, instanceId, new TimeRange(begin, end), TimeUtils.nowNanos(clock));
    metadataCache.invalidate(viewName, instanceId);
    return retired;
  }

  public boolean retirePartitionByMetadata(final String viewName, final String instanceId, final long begin, final long end) {
    final boolean retired = partitionStore.retirePartitionByMetadata(viewName, instanceId, new TimeRange(begin, end),
        TimeUtils.nowNanos(clock));
    metadataCache.invalidate(viewName, instanceId);
    return retired;
  }

  public int retirePartitionByFile(final String filePath) {
    final int retired = partitionStore.retirePartitionByFile(filePath, TimeUtils.nowNanos(clock));
    if (retired > 0)
      metadataCache.invalidateAll();
    return retired;
  }

  public List<MaterializationResult> materializePartitions(final String viewName, final long begin, final long end,
      final TimeGranularity granularity) {
    return scheduler.materializeRange(viewName, new TimeRange(begin, end), granularity);
  }

  public MaintenanceReport runMaintenance() {
    return maintenanceTask.runOnce();
  }

  private static void checkArgs(final String function, final List<Object> args, final int expected) {
    if (args.size() != expected)
      throw new InvalidScanRequestException("Function '" + function + "' expects " + expected + " arguments, found " + args.size());
  }

  private static String string(final List<Object> args, final int index) {
    final Object value = args.get(index);
    if (value == null)
      throw new InvalidScanRequestException("Argument " + (index + 1) + " cannot be null");
    return value.toString();
  }

  private static TimeGranularity granularity(final List<Object> args, final int index) {
    try {
      return TimeGranularity.fromString(string(args, index));
    } catch (final IllegalArgumentException e) {
      throw new InvalidScanRequestException(e.getMessage(), e);
    }
  }

  private static long time(final List<Object> args, final int index) {
    final Object value = args.get(index);
    if (value instanceof Number)
      return ((Number) value).longValue();
    if (value instanceof Instant)
      return TimeUtils.toNanos((Instant) value);
    if (value instanceof String)
      try {
        return TimeUtils.toNanos(Instant.parse((String) value));
      } catch (final DateTimeParseException e) {
        throw new InvalidScanRequestException("Invalid time argument '" + value + "'", e);
      }
    throw new InvalidScanRequestException("Invalid time argument " + (index + 1) + ": " + value);
  }
}
