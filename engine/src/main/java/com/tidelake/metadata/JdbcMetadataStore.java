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
package com.tidelake.metadata;

import com.tidelake.exception.DuplicatedKeyException;
import com.tidelake.serializer.json.JSONObject;
import com.tidelake.time.TimeRange;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link MetadataStore} over a relational database. Ids are not unique at the table level, because bulk replication
 * copies rows verbatim; inserts check the id inside their transaction and reads filter out the later copies of an id.
 */
public class JdbcMetadataStore implements MetadataStore {
  private static final String BLOCK_COLUMNS   = "b.row_id, b.block_id, b.stream_id, b.process_id, b.begin_time, b.end_time, b.begin_ticks, "
      + "b.end_ticks, b.nb_objects, b.object_offset, b.payload_size, b.insert_time";
  private static final String CANONICAL_BLOCK = "NOT EXISTS (SELECT 1 FROM blocks d WHERE d.block_id = b.block_id AND "
      + "(d.insert_time < b.insert_time OR (d.insert_time = b.insert_time AND d.row_id < b.row_id)))";
  private static final String CANONICAL_STREAM  = "NOT EXISTS (SELECT 1 FROM streams d WHERE d.stream_id = s.stream_id AND "
      + "(d.insert_time < s.insert_time OR (d.insert_time = s.insert_time AND d.row_id < s.row_id)))";
  private static final String CANONICAL_PROCESS = "NOT EXISTS (SELECT 1 FROM processes d WHERE d.process_id = p.process_id AND "
      + "(d.insert_time < p.insert_time OR (d.insert_time = p.insert_time AND d.row_id < p.row_id)))";

  private final MetadataDataSource dataSource;

  public JdbcMetadataStore(final MetadataDataSource dataSource) {
    this.dataSource = dataSource;
  }

  public MetadataDataSource getDataSource() {
    return dataSource;
  }

  @Override
  public void insertProcess(final ProcessInfo process) {
    dataSource.inTransaction("inserting process " + process.getProcessId(), conn -> {
      if (exists(conn, "SELECT 1 FROM processes WHERE process_id = ?", process.getProcessId()))
        throw new DuplicatedKeyException("processes", process.getProcessId());
      writeProcess(conn, process);
      return null;
    });
  }

  @Override
  public void insertStream(final StreamInfo stream) {
    dataSource.inTransaction("inserting stream " + stream.getStreamId(), conn -> {
      if (exists(conn, "SELECT 1 FROM streams WHERE stream_id = ?", stream.getStreamId()))
        throw new DuplicatedKeyException("streams", stream.getStreamId());
      writeStream(conn, stream);
      return null;
    });
  }

  @Override
  public void insertBlock(final BlockMetadata block) {
    dataSource.inTransaction("inserting block " + block.getBlockId(), conn -> {
      if (exists(conn, "SELECT 1 FROM blocks WHERE block_id = ?", block.getBlockId()))
        throw new DuplicatedKeyException("blocks", block.getBlockId());
      writeBlock(conn, block);
      return null;
    });
  }

  @Override
  public boolean touchProcess(final String processId, final long lastUpdateTime, final Map<String, String> properties) {
    return dataSource.inTransaction("updating process " + processId, conn -> {
      final ProcessInfo current = readProcess(conn, processId);
      if (current == null)
        return false;

      final Map<String, String> merged = new LinkedHashMap<>(current.getProperties());
      if (properties != null)
        merged.putAll(properties);

      try (final PreparedStatement stmt = conn.prepareStatement(
          "UPDATE processes SET last_update_time = GREATEST(last_update_time, ?), properties = ? WHERE process_id = ?")) {
        stmt.setLong(1, lastUpdateTime);
        stmt.setString(2, new JSONObject(merged).toString());
        stmt.setString(3, processId);
        stmt.executeUpdate();
      }
      return true;
    });
  }

  @Override
  public ProcessInfo getProcess(final String processId) {
    return dataSource.withConnection("reading process " + processId, conn -> readProcess(conn, processId));
  }

  @Override
  public StreamInfo getStream(final String streamId) {
    return dataSource.withConnection("reading stream " + streamId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "SELECT * FROM streams s WHERE s.stream_id = ? ORDER BY s.insert_time, s.row_id LIMIT 1")) {
        stmt.setString(1, streamId);
        try (final ResultSet rs = stmt.executeQuery()) {
          return rs.next() ? toStream(rs) : null;
        }
      }
    });
  }

  @Override
  public BlockMetadata getBlock(final String blockId) {
    return dataSource.withConnection("reading block " + blockId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "SELECT " + BLOCK_COLUMNS + " FROM blocks b WHERE b.block_id = ? ORDER BY b.insert_time, b.row_id LIMIT 1")) {
        stmt.setString(1, blockId);
        final List<BlockMetadata> blocks = readBlocks(stmt);
        return blocks.isEmpty() ? null : blocks.get(0);
      }
    });
  }

  @Override
  public List<BlockMetadata> listBlocks(final String streamId, final TimeRange insertRange) {
    return dataSource.withConnection("listing blocks of stream " + streamId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT " + BLOCK_COLUMNS + " FROM blocks b WHERE b.stream_id = ? "
          + "AND b.insert_time >= ? AND b.insert_time < ? AND " + CANONICAL_BLOCK + " ORDER BY b.insert_time, b.block_id")) {
        stmt.setString(1, streamId);
        stmt.setLong(2, insertRange.getBegin());
        stmt.setLong(3, insertRange.getEnd());
        return readBlocks(stmt);
      }
    });
  }

  @Override
  public List<BlockMetadata> listBlocks(final String streamTag, final TimeRange insertRange, final int limit) {
    return dataSource.withConnection("listing blocks", conn -> {
      final StringBuilder sql = new StringBuilder("SELECT " + BLOCK_COLUMNS + " FROM blocks b WHERE b.insert_time >= ? AND b.insert_time < ?");
      if (streamTag != null)
        sql.append(" AND EXISTS (SELECT 1 FROM streams s WHERE s.stream_id = b.stream_id AND ARRAY_CONTAINS(s.tags, ?))");
      sql.append(" AND ").append(CANONICAL_BLOCK).append(" ORDER BY b.insert_time, b.block_id");
      if (limit > 0)
        sql.append(" LIMIT ").append(limit);

      try (final PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
        stmt.setLong(1, insertRange.getBegin());
        stmt.setLong(2, insertRange.getEnd());
        if (streamTag != null)
          stmt.setString(3, streamTag);
        return readBlocks(stmt);
      }
    });
  }

  @Override
  public List<BlockMetadata> listBlocksForStreams(final Collection<String> streamIds, final TimeRange eventRange) {
    if (streamIds.isEmpty())
      return List.of();

    return dataSource.withConnection("listing blocks of streams", conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT " + BLOCK_COLUMNS + " FROM blocks b WHERE b.stream_id IN ("
          + placeholders(streamIds.size()) + ") AND b.begin_time < ? AND b.end_time >= ? AND " + CANONICAL_BLOCK
          + " ORDER BY b.insert_time, b.block_id")) {
        int i = setIds(stmt, streamIds);
        stmt.setLong(i++, eventRange.getEnd());
        stmt.setLong(i, eventRange.getBegin());
        return readBlocks(stmt);
      }
    });
  }

  @Override
  public List<StreamInfo> listStreamsForProcess(final String processId) {
    return dataSource.withConnection("listing streams of process " + processId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "SELECT * FROM streams s WHERE s.process_id = ? AND " + CANONICAL_STREAM + " ORDER BY s.insert_time, s.stream_id")) {
        stmt.setString(1, processId);
        return readStreams(stmt);
      }
    });
  }

  @Override
  public List<StreamInfo> listStreams(final TimeRange insertRange) {
    return dataSource.withConnection("listing streams", conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT * FROM streams s WHERE s.insert_time >= ? AND s.insert_time < ? AND "
          + CANONICAL_STREAM + " ORDER BY s.insert_time, s.stream_id")) {
        stmt.setLong(1, insertRange.getBegin());
        stmt.setLong(2, insertRange.getEnd());
        return readStreams(stmt);
      }
    });
  }

  @Override
  public List<ProcessInfo> listProcesses(final TimeRange updateRange) {
    return listProcesses("last_update_time", updateRange);
  }

  @Override
  public List<ProcessInfo> listProcessesInserted(final TimeRange insertRange) {
    return listProcesses("insert_time", insertRange);
  }

  @Override
  public TimeRange findBlockInsertTimeBounds(final Collection<String> streamIds, final TimeRange eventRange) {
    if (streamIds.isEmpty())
      return null;

    return dataSource.withConnection("computing insert time bounds", conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT MIN(b.insert_time), MAX(b.insert_time) FROM blocks b "
          + "WHERE b.stream_id IN (" + placeholders(streamIds.size()) + ") AND b.begin_time < ? AND b.end_time >= ?")) {
        int i = setIds(stmt, streamIds);
        stmt.setLong(i++, eventRange.getEnd());
        stmt.setLong(i, eventRange.getBegin());
        try (final ResultSet rs = stmt.executeQuery()) {
          if (!rs.next())
            return null;
          final long min = rs.getLong(1);
          if (rs.wasNull())
            return null;
          return new TimeRange(min, rs.getLong(2) + 1);
        }
      }
    });
  }

  @Override
  public void replicate(final Collection<ProcessInfo> processes, final Collection<StreamInfo> streams, final Collection<BlockMetadata> blocks) {
    dataSource.inTransaction("replicating records", conn -> {
      for (final ProcessInfo p : processes)
        writeProcess(conn, p);
      for (final StreamInfo s : streams)
        writeStream(conn, s);
      for (final BlockMetadata b : blocks)
        writeBlock(conn, b);
      return null;
    });
  }

  @Override
  public int deleteDuplicateBlocks(final TimeRange insertRange) {
    return deleteDuplicates("blocks", "block_id", insertRange);
  }

  @Override
  public int deleteDuplicateStreams(final TimeRange insertRange) {
    return deleteDuplicates("streams", "stream_id", insertRange);
  }

  @Override
  public int deleteDuplicateProcesses(final TimeRange insertRange) {
    return deleteDuplicates("processes", "process_id", insertRange);
  }

  @Override
  public int deleteDataOlderThan(final long cutoff) {
    return dataSource.inTransaction("deleting data older than " + cutoff, conn -> {
      final int blocks;
      try (final PreparedStatement stmt = conn.prepareStatement("DELETE FROM blocks WHERE insert_time < ?")) {
        stmt.setLong(1, cutoff);
        blocks = stmt.executeUpdate();
      }
      try (final PreparedStatement stmt = conn.prepareStatement(
          "DELETE FROM streams s WHERE s.insert_time < ? AND NOT EXISTS (SELECT 1 FROM blocks b WHERE b.stream_id = s.stream_id)")) {
        stmt.setLong(1, cutoff);
        stmt.executeUpdate();
      }
      try (final PreparedStatement stmt = conn.prepareStatement("DELETE FROM processes p WHERE p.last_update_time < ? "
          + "AND NOT EXISTS (SELECT 1 FROM streams s WHERE s.process_id = p.process_id)")) {
        stmt.setLong(1, cutoff);
        stmt.executeUpdate();
      }
      return blocks;
    });
  }

  @Override
  public void close() {
    dataSource.close();
  }

  private int deleteDuplicates(final String table, final String idColumn, final TimeRange insertRange) {
    return dataSource.inTransaction("deleting duplicate " + table, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("DELETE FROM " + table + " t WHERE t.insert_time >= ? AND t.insert_time < ? "
          + "AND EXISTS (SELECT 1 FROM " + table + " d WHERE d." + idColumn + " = t." + idColumn + " AND (d.insert_time < t.insert_time "
          + "OR (d.insert_time = t.insert_time AND d.row_id < t.row_id)))")) {
        stmt.setLong(1, insertRange.getBegin());
        stmt.setLong(2, insertRange.getEnd());
        return stmt.executeUpdate();
      }
    });
  }

  private List<ProcessInfo> listProcesses(final String timeColumn, final TimeRange range) {
    return dataSource.withConnection("listing processes", conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT * FROM processes p WHERE p." + timeColumn + " >= ? AND p." + timeColumn
          + " < ? AND " + CANONICAL_PROCESS + " ORDER BY p.insert_time, p.process_id")) {
        stmt.setLong(1, range.getBegin());
        stmt.setLong(2, range.getEnd());
        final List<ProcessInfo> result = new ArrayList<>();
        try (final ResultSet rs = stmt.executeQuery()) {
          while (rs.next())
            result.add(toProcess(rs));
        }
        return result;
      }
    });
  }

  private static boolean exists(final Connection conn, final String sql, final String id) throws SQLException {
    try (final PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, id);
      try (final ResultSet rs = stmt.executeQuery()) {
        return rs.next();
      }
    }
  }

  private static ProcessInfo readProcess(final Connection conn, final String processId) throws SQLException {
    try (final PreparedStatement stmt = conn.prepareStatement(
        "SELECT * FROM processes p WHERE p.process_id = ? ORDER BY p.insert_time, p.row_id LIMIT 1")) {
      stmt.setString(1, processId);
      try (final ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? toProcess(rs) : null;
      }
    }
  }

  private static void writeProcess(final Connection conn, final ProcessInfo p) throws SQLException {
    try (final PreparedStatement stmt = conn.prepareStatement("INSERT INTO processes (process_id, exe, username, realname, computer, distro, "
        + "cpu_brand, tsc_frequency, start_time, start_ticks, parent_process_id, properties, insert_time, last_update_time) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
      stmt.setString(1, p.getProcessId());
      stmt.setString(2, p.getExe());
      stmt.setString(3, p.getUsername());
      stmt.setString(4, p.getRealname());
      stmt.setString(5, p.getComputer());
      stmt.setString(6, p.getDistro());
      stmt.setString(7, p.getCpuBrand());
      stmt.setLong(8, p.getTscFrequency());
      stmt.setLong(9, p.getStartTime());
      stmt.setLong(10, p.getStartTicks());
      stmt.setString(11, p.getParentProcessId());
      stmt.setString(12, new JSONObject(p.getProperties()).toString());
      stmt.setLong(13, p.getInsertTime());
      stmt.setLong(14, p.getLastUpdateTime());
      stmt.executeUpdate();
    }
  }

  private static void writeStream(final Connection conn, final StreamInfo s) throws SQLException {
    try (final PreparedStatement stmt = conn.prepareStatement("INSERT INTO streams (stream_id, process_id, tags, properties, "
        + "dependencies_metadata, objects_metadata, insert_time) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
      stmt.setString(1, s.getStreamId());
      stmt.setString(2, s.getProcessId());
      stmt.setArray(3, toArray(conn, s.getTags()));
      stmt.setString(4, new JSONObject(s.getProperties()).toString());
      stmt.setString(5, s.getDependenciesMetadata());
      stmt.setString(6, s.getObjectsMetadata());
      stmt.setLong(7, s.getInsertTime());
      stmt.executeUpdate();
    }
  }

  private static void writeBlock(final Connection conn, final BlockMetadata b) throws SQLException {
    try (final PreparedStatement stmt = conn.prepareStatement("INSERT INTO blocks (block_id, stream_id, process_id, begin_time, end_time, "
        + "begin_ticks, end_ticks, nb_objects, object_offset, payload_size, insert_time) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
      stmt.setString(1, b.getBlockId());
      stmt.setString(2, b.getStreamId());
      stmt.setString(3, b.getProcessId());
      stmt.setLong(4, b.getBeginTime());
      stmt.setLong(5, b.getEndTime());
      stmt.setLong(6, b.getBeginTicks());
      stmt.setLong(7, b.getEndTicks());
      stmt.setLong(8, b.getNbObjects());
      stmt.setLong(9, b.getObjectOffset());
      stmt.setLong(10, b.getPayloadSize());
      stmt.setLong(11, b.getInsertTime());
      stmt.executeUpdate();
    }
  }

  private static String placeholders(final int count) {
    return String.join(", ", Collections.nCopies(count, "?"));
  }

  /**
   * Binds the ids from the first parameter on and returns the index of the next parameter.
   */
  private static int setIds(final PreparedStatement stmt, final Collection<String> ids) throws SQLException {
    int i = 1;
    for (final String id : ids)
      stmt.setString(i++, id);
    return i;
  }

  private static Array toArray(final Connection conn, final Collection<String> values) throws SQLException {
    return conn.createArrayOf("VARCHAR", values.toArray(new String[0]));
  }

  private static List<BlockMetadata> readBlocks(final PreparedStatement stmt) throws SQLException {
    final List<BlockMetadata> result = new ArrayList<>();
    try (final ResultSet rs = stmt.executeQuery()) {
      while (rs.next())
        result.add(BlockMetadata.builder(rs.getString("block_id"), rs.getString("stream_id"), rs.getString("process_id"))
            .timeRange(rs.getLong("begin_time"), rs.getLong("end_time"))
            .ticks(rs.getLong("begin_ticks"), rs.getLong("end_ticks"))
            .nbObjects(rs.getLong("nb_objects"))
            .objectOffset(rs.getLong("object_offset"))
            .payloadSize(rs.getLong("payload_size"))
            .insertTime(rs.getLong("insert_time"))
            .build());
    }
    return result;
  }

  private static List<StreamInfo> readStreams(final PreparedStatement stmt) throws SQLException {
    final List<StreamInfo> result = new ArrayList<>();
    try (final ResultSet rs = stmt.executeQuery()) {
      while (rs.next())
        result.add(toStream(rs));
    }
    return result;
  }

  private static StreamInfo toStream(final ResultSet rs) throws SQLException {
    final List<String> tags = new ArrayList<>();
    final Array array = rs.getArray("tags");
    if (array != null)
      for (final Object tag : (Object[]) array.getArray())
        tags.add(String.valueOf(tag));

    return new StreamInfo(rs.getString("stream_id"), rs.getString("process_id"), tags, readProperties(rs.getString("properties")),
        rs.getString("dependencies_metadata"), rs.getString("objects_metadata"), rs.getLong("insert_time"));
  }

  private static ProcessInfo toProcess(final ResultSet rs) throws SQLException {
    return ProcessInfo.builder(rs.getString("process_id"))
        .exe(rs.getString("exe"))
        .username(rs.getString("username"))
        .realname(rs.getString("realname"))
        .computer(rs.getString("computer"))
        .distro(rs.getString("distro"))
        .cpuBrand(rs.getString("cpu_brand"))
        .tscFrequency(rs.getLong("tsc_frequency"))
        .startTime(rs.getLong("start_time"))
        .startTicks(rs.getLong("start_ticks"))
        .parentProcessId(rs.getString("parent_process_id"))
        .properties(readProperties(rs.getString("properties")))
        .insertTime(rs.getLong("insert_time"))
        .lastUpdateTime(rs.getLong("last_update_time"))
        .build();
  }

  private static Map<String, String> readProperties(final String json) {
    if (json == null || json.isEmpty())
      return Map.of();
    return new JSONObject(json).toStringMap();
  }
}
