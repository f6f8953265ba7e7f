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
import com.tidelake.columnar.RecordBatchBuilder;
import com.tidelake.columnar.TableSchema;
import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.ProcessInfo;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.serializer.json.JSONObject;
import com.tidelake.time.TimeGranularity;

import java.util.List;

import static com.tidelake.columnar.ColumnType.DOUBLE;
import static com.tidelake.columnar.ColumnType.LONG;
import static com.tidelake.columnar.ColumnType.STRING;
import static com.tidelake.columnar.ColumnType.TIMESTAMP;

/**
 * Views every lakehouse exposes: the metadata tables and the views decoding log, metric and span payloads.
 */
public final class BuiltinViews {
  public static final String PROCESSES    = "processes";
  public static final String STREAMS      = "streams";
  public static final String BLOCKS       = "blocks";
  public static final String LOG_ENTRIES  = "log_entries";
  public static final String MEASURES     = "measures";
  public static final String THREAD_SPANS = "thread_spans";
  public static final String ASYNC_EVENTS = "async_events";

  private BuiltinViews() {
  }

  public static List<ViewDefinition> all() {
    return List.of(processes(), streams(), blocks(), logEntries(), measures(), threadSpans(), asyncEvents());
  }

  public static void registerAll(final ViewRegistry registry) {
    registry.registerAll(all());
  }

  public static ViewDefinition processes() {
    return ViewDefinition.builder(PROCESSES)
        .schema(schema("process_id", STRING, "exe", STRING, "username", STRING, "realname", STRING, "computer", STRING, "distro", STRING,
            "cpu_brand", STRING, "tsc_frequency", LONG, "start_time", TIMESTAMP, "start_ticks", LONG, "parent_process_id", STRING,
            "properties", STRING, "insert_time", TIMESTAMP, "last_update_time", TIMESTAMP))
        .source(ViewSource.metadata(ViewSource.MetadataKind.PROCESSES))
        .transform(BuiltinViews::processRows)
        .eventTimeColumn("insert_time")
        .granularity(TimeGranularity.MINUTE)
        .mergeGranularity(TimeGranularity.DAY)
        .updateGroup(1000)
        .build();
  }

  public static ViewDefinition streams() {
    return ViewDefinition.builder(STREAMS)
        .schema(schema("stream_id", STRING, "process_id", STRING, "tags", STRING, "properties", STRING, "dependencies_metadata", STRING,
            "objects_metadata", STRING, "insert_time", TIMESTAMP))
        .source(ViewSource.metadata(ViewSource.MetadataKind.STREAMS))
        .transform(BuiltinViews::streamRows)
        .eventTimeColumn("insert_time")
        .granularity(TimeGranularity.MINUTE)
        .mergeGranularity(TimeGranularity.DAY)
        .updateGroup(1000)
        .build();
  }

  public static ViewDefinition blocks() {
    return ViewDefinition.builder(BLOCKS)
        .schema(schema("block_id", STRING, "stream_id", STRING, "process_id", STRING, "begin_time", TIMESTAMP, "end_time", TIMESTAMP,
            "begin_ticks", LONG, "end_ticks", LONG, "nb_objects", LONG, "object_offset", LONG, "payload_size", LONG, "insert_time", TIMESTAMP))
        .source(ViewSource.metadata(ViewSource.MetadataKind.BLOCKS))
        .transform(BuiltinViews::blockRows)
        .eventTimeColumn("insert_time")
        .granularity(TimeGranularity.MINUTE)
        .mergeGranularity(TimeGranularity.DAY)
        .updateGroup(1000)
        .build();
  }

  public static ViewDefinition logEntries() {
    return ViewDefinition.builder(LOG_ENTRIES)
        .schema(schema("process_id", STRING, "exe", STRING, "username", STRING, "computer", STRING, "time", TIMESTAMP, "target", STRING,
            "level", STRING, "msg", STRING))
        .source(ViewSource.blocks(StreamInfo.TAG_LOG))
        .transform(BuiltinViews::logRows)
        .eventTimeColumn("time")
        .granularity(TimeGranularity.SECOND)
        .mergeGranularity(TimeGranularity.HOUR)
        .instanceKey(InstanceKey.PROCESS)
        .updateGroup(2000)
        .build();
  }

  public static ViewDefinition measures() {
    return ViewDefinition.builder(MEASURES)
        .schema(schema("process_id", STRING, "exe", STRING, "username", STRING, "computer", STRING, "time", TIMESTAMP, "target", STRING,
            "name", STRING, "unit", STRING, "value", DOUBLE))
        .source(ViewSource.blocks(StreamInfo.TAG_METRICS))
        .transform(BuiltinViews::measureRows)
        .eventTimeColumn("time")
        .granularity(TimeGranularity.SECOND)
        .mergeGranularity(TimeGranularity.HOUR)
        .instanceKey(InstanceKey.PROCESS)
        .updateGroup(2000)
        .build();
  }

  public static ViewDefinition threadSpans() {
    return ViewDefinition.builder(THREAD_SPANS)
        .schema(schema("stream_id", STRING, "block_id", STRING, "id", LONG, "parent", LONG, "depth", LONG, "hash", LONG, "begin", TIMESTAMP,
            "end", TIMESTAMP, "duration", LONG, "name", STRING, "target", STRING, "filename", STRING, "line", LONG))
        .source(ViewSource.blocks(StreamInfo.TAG_CPU))
        .transform(new ThreadSpansTransform())
        .eventTimeColumn("begin")
        .granularity(TimeGranularity.SECOND)
        .mergeGranularity(TimeGranularity.HOUR)
        .instanceKey(InstanceKey.STREAM)
        .global(false)
        .updateGroup(2000)
        .build();
  }

  public static ViewDefinition asyncEvents() {
    return ViewDefinition.builder(ASYNC_EVENTS)
        .schema(schema("stream_id", STRING, "block_id", STRING, "time", TIMESTAMP, "event_type", STRING, "span_id", LONG, "parent_span_id", LONG,
            "name", STRING, "filename", STRING, "target", STRING, "line", LONG))
        .source(ViewSource.blocks(StreamInfo.TAG_CPU))
        .transform(BuiltinViews::asyncRows)
        .eventTimeColumn("time")
        .granularity(TimeGranularity.SECOND)
        .mergeGranularity(TimeGranularity.HOUR)
        .instanceKey(InstanceKey.PROCESS)
        .updateGroup(2000)
        .build();
  }

  static TableSchema schema(final Object... namesAndTypes) {
    final ColumnDefinition[] columns = new ColumnDefinition[namesAndTypes.length / 2];
    for (int i = 0; i < columns.length; i++)
      columns[i] = new ColumnDefinition((String) namesAndTypes[i * 2], (ColumnType) namesAndTypes[i * 2 + 1]);
    return TableSchema.of(columns);
  }

  private static void processRows(final SourceData source, final RecordBatchBuilder output) {
    for (final ProcessInfo p : source.getProcesses())
      output.append(p.getProcessId(), p.getExe(), p.getUsername(), p.getRealname(), p.getComputer(), p.getDistro(), p.getCpuBrand(),
          p.getTscFrequency(), p.getStartTime(), p.getStartTicks(), p.getParentProcessId(), new JSONObject(p.getProperties()).toString(),
          p.getInsertTime(), p.getLastUpdateTime());
  }

  private static void streamRows(final SourceData source, final RecordBatchBuilder output) {
    for (final StreamInfo s : source.getStreams())
      output.append(s.getStreamId(), s.getProcessId(), String.join(",", s.getTags()), new JSONObject(s.getProperties()).toString(),
          s.getDependenciesMetadata(), s.getObjectsMetadata(), s.getInsertTime());
  }

  private static void blockRows(final SourceData source, final RecordBatchBuilder output) {
    for (final SourceData.BlockData data : source.getBlocks()) {
      final BlockMetadata b = data.getBlock();
      output.append(b.getBlockId(), b.getStreamId(), b.getProcessId(), b.getBeginTime(), b.getEndTime(), b.getBeginTicks(), b.getEndTicks(),
          b.getNbObjects(), b.getObjectOffset(), b.getPayloadSize(), b.getInsertTime());
    }
  }

  private static void logRows(final SourceData source, final RecordBatchBuilder output) {
    for (final SourceData.BlockData data : source.getBlocks()) {
      final ProcessInfo p = data.getProcess();
      for (final TelemetryEvent e : data.getEvents())
        if (e.getKind() == TelemetryEvent.Kind.LOG)
          output.append(data.getBlock().getProcessId(), p != null ? p.getExe() : "", p != null ? p.getUsername() : "",
              p != null ? p.getComputer() : "", e.getTime(), e.getString("target"), e.getString("level"), e.getString("msg"));
    }
  }

  private static void measureRows(final SourceData source, final RecordBatchBuilder output) {
    for (final SourceData.BlockData data : source.getBlocks()) {
      final ProcessInfo p = data.getProcess();
      for (final TelemetryEvent e : data.getEvents())
        if (e.getKind() == TelemetryEvent.Kind.MEASURE)
          output.append(data.getBlock().getProcessId(), p != null ? p.getExe() : "", p != null ? p.getUsername() : "",
              p != null ? p.getComputer() : "", e.getTime(), e.getString("target"), e.getString("name"), e.getString("unit"),
              e.getDouble("value"));
    }
  }

  private static void asyncRows(final SourceData source, final RecordBatchBuilder output) {
    for (final SourceData.BlockData data : source.getBlocks()) {
      final BlockMetadata b = data.getBlock();
      for (final TelemetryEvent e : data.getEvents()) {
        final String eventType;
        if (e.getKind() == TelemetryEvent.Kind.BEGIN_ASYNC)
          eventType = "begin";
        else if (e.getKind() == TelemetryEvent.Kind.END_ASYNC)
          eventType = "end";
        else
          continue;
        output.append(b.getStreamId(), b.getBlockId(), e.getTime(), eventType, e.getLong("span_id"), e.getLong("parent_span_id"),
            e.getString("name"), e.getString("filename"), e.getString("target"), e.getLong("line"));
      }
    }
  }
}
