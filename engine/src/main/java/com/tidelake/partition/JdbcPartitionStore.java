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
package com.tidelake.partition;

import com.tidelake.exception.MetadataStoreException;
import com.tidelake.exception.StaleMaterializationException;
import com.tidelake.metadata.MetadataDataSource;
import com.tidelake.time.TimeRange;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link PartitionStore} persisted in the {@code partitions} table of the metadata store.
 */
public class JdbcPartitionStore implements PartitionStore {
  private static final String OVERLAPPING = "view_set_name = ? AND view_instance_id = ? AND retired = FALSE "
      + "AND begin_insert_time < ? AND end_insert_time > ?";

  private final MetadataDataSource dataSource;

  public JdbcPartitionStore(final MetadataDataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public List<Partition> listPartitions(final String viewName, final String instanceId, final TimeRange insertRange) {
    return dataSource.withConnection("listing partitions of " + viewName + "/" + instanceId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "SELECT * FROM partitions WHERE " + OVERLAPPING + " ORDER BY begin_insert_time, end_insert_time")) {
        bindOverlapping(stmt, viewName, instanceId, insertRange);
        return read(stmt);
      }
    });
  }

  @Override
  public List<Partition> listPartitionsForEvents(final String viewName, final String instanceId, final TimeRange eventRange) {
    return dataSource.withConnection("listing partitions of " + viewName + "/" + instanceId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT * FROM partitions WHERE view_set_name = ? AND view_instance_id = ? "
          + "AND retired = FALSE AND file_path IS NOT NULL AND row_count > 0 AND min_event_time < ? AND max_event_time >= ? "
          + "ORDER BY begin_insert_time, end_insert_time")) {
        stmt.setString(1, viewName);
        stmt.setString(2, instanceId);
        stmt.setLong(3, eventRange.getEnd());
        stmt.setLong(4, eventRange.getBegin());
        return read(stmt);
      }
    });
  }

  @Override
  public List<Partition> listAll() {
    return dataSource.withConnection("listing partitions", conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "SELECT * FROM partitions ORDER BY view_set_name, view_instance_id, begin_insert_time, partition_id")) {
        return read(stmt);
      }
    });
  }

  @Override
  public Partition commit(final Partition partition, final Collection<Long> superseded, final long now) {
    return dataSource.inTransaction("registering " + partition, conn -> {
      final Set<Long> current = new HashSet<>();
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT partition_id FROM partitions WHERE " + OVERLAPPING + " FOR UPDATE")) {
        bindOverlapping(stmt, partition.getViewName(), partition.getInstanceId(), partition.getInsertRange());
        try (final ResultSet rs = stmt.executeQuery()) {
          while (rs.next())
            current.add(rs.getLong(1));
        }
      }
      if (!current.equals(new HashSet<>(superseded)))
        throw new StaleMaterializationException(
            "Partitions of " + partition.getViewName() + "/" + partition.getInstanceId() + " " + partition.getInsertRange()
                + " changed during materialization: expected " + superseded + ", found " + current);

      final long id;
      try (final PreparedStatement stmt = conn.prepareStatement("INSERT INTO partitions (view_set_name, view_instance_id, begin_insert_time, "
          + "end_insert_time, min_event_time, max_event_time, updated, file_path, file_size, row_count, file_schema_hash, source_data_hash, "
          + "retired) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE)", Statement.RETURN_GENERATED_KEYS)) {
        stmt.setString(1, partition.getViewName());
        stmt.setString(2, partition.getInstanceId());
        stmt.setLong(3, partition.getInsertRange().getBegin());
        stmt.setLong(4, partition.getInsertRange().getEnd());
        stmt.setLong(5, partition.getMinEventTime());
        stmt.setLong(6, partition.getMaxEventTime());
        stmt.setLong(7, partition.getUpdated());
        if (partition.getFilePath() != null)
          stmt.setString(8, partition.getFilePath());
        else
          stmt.setNull(8, Types.VARCHAR);
        stmt.setLong(9, partition.getFileSize());
        stmt.setLong(10, partition.getRowCount());
        stmt.setString(11, partition.getFingerprint());
        stmt.setLong(12, partition.getSourceHash());
        stmt.executeUpdate();
        try (final ResultSet keys = stmt.getGeneratedKeys()) {
          if (!keys.next())
            throw new MetadataStoreException("No id generated for " + partition);
          id = keys.getLong(1);
        }
      }

      retire(conn, superseded, now);
      return partition.toBuilder().partitionId(id).build();
    });
  }

  @Override
  public int retirePartitions(final String viewName, final String instanceId, final TimeRange insertRange, final long now) {
    return dataSource.inTransaction("retiring partitions of " + viewName + "/" + instanceId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "UPDATE partitions SET retired = TRUE, retired_time = ? WHERE " + OVERLAPPING)) {
        stmt.setLong(1, now);
        stmt.setString(2, viewName);
        stmt.setString(3, instanceId);
        stmt.setLong(4, insertRange.getEnd());
        stmt.setLong(5, insertRange.getBegin());
        return stmt.executeUpdate();
      }
    });
  }

  @Override
  public boolean retirePartitionByMetadata(final String viewName, final String instanceId, final TimeRange insertRange, final long now) {
    return dataSource.inTransaction("retiring partition of " + viewName + "/" + instanceId, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("UPDATE partitions SET retired = TRUE, retired_time = ? WHERE view_set_name = ? "
          + "AND view_instance_id = ? AND begin_insert_time = ? AND end_insert_time = ? AND retired = FALSE")) {
        stmt.setLong(1, now);
        stmt.setString(2, viewName);
        stmt.setString(3, instanceId);
        stmt.setLong(4, insertRange.getBegin());
        stmt.setLong(5, insertRange.getEnd());
        return stmt.executeUpdate() > 0;
      }
    });
  }

  @Override
  public int retirePartitionByFile(final String filePath, final long now) {
    return dataSource.inTransaction("retiring partition " + filePath, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "UPDATE partitions SET retired = TRUE, retired_time = ? WHERE file_path = ? AND retired = FALSE")) {
        stmt.setLong(1, now);
        stmt.setString(2, filePath);
        return stmt.executeUpdate();
      }
    });
  }

  @Override
  public List<Partition> retireIncompatible(final String viewName, final String fingerprint, final long now) {
    return dataSource.inTransaction("retiring incompatible partitions of " + viewName, conn -> {
      final List<Partition> incompatible;
      try (final PreparedStatement stmt = conn.prepareStatement(
          "SELECT * FROM partitions WHERE view_set_name = ? AND retired = FALSE AND file_schema_hash <> ? FOR UPDATE")) {
        stmt.setString(1, viewName);
        stmt.setString(2, fingerprint);
        incompatible = read(stmt);
      }
      final List<Long> ids = new ArrayList<>(incompatible.size());
      for (final Partition p : incompatible)
        ids.add(p.getPartitionId());
      retire(conn, ids, now);
      return incompatible;
    });
  }

  @Override
  public int retireOlderThan(final long cutoff, final long now) {
    return dataSource.inTransaction("retiring partitions older than " + cutoff, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "UPDATE partitions SET retired = TRUE, retired_time = ? WHERE retired = FALSE AND end_insert_time <= ?")) {
        stmt.setLong(1, now);
        stmt.setLong(2, cutoff);
        return stmt.executeUpdate();
      }
    });
  }

  @Override
  public List<Partition> listRetiredBefore(final long cutoff) {
    return dataSource.withConnection("listing retired partitions", conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "SELECT * FROM partitions WHERE retired = TRUE AND retired_time < ? ORDER BY retired_time, partition_id")) {
        stmt.setLong(1, cutoff);
        return read(stmt);
      }
    });
  }

  @Override
  public boolean isFileReferenced(final String filePath) {
    return dataSource.withConnection("checking references of " + filePath, conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM partitions WHERE file_path = ? AND retired = FALSE LIMIT 1")) {
        stmt.setString(1, filePath);
        try (final ResultSet rs = stmt.executeQuery()) {
          return rs.next();
        }
      }
    });
  }

  @Override
  public int deletePartitions(final Collection<Long> partitionIds) {
    if (partitionIds.isEmpty())
      return 0;
    return dataSource.inTransaction("deleting partitions", conn -> {
      try (final PreparedStatement stmt = conn.prepareStatement(
          "DELETE FROM partitions WHERE partition_id IN (" + String.join(", ", Collections.nCopies(partitionIds.size(), "?")) + ")")) {
        int i = 1;
        for (final Long id : partitionIds)
          stmt.setLong(i++, id);
        return stmt.executeUpdate();
      }
    });
  }

  private static void retire(final Connection conn, final Collection<Long> ids, final long now) throws SQLException {
    if (ids.isEmpty())
      return;
    try (final PreparedStatement stmt = conn.prepareStatement("UPDATE partitions SET retired = TRUE, retired_time = ? WHERE partition_id = ?")) {
      for (final Long id : ids) {
        stmt.setLong(1, now);
        stmt.setLong(2, id);
        stmt.addBatch();
      }
      stmt.executeBatch();
    }
  }

  private static void bindOverlapping(final PreparedStatement stmt, final String viewName, final String instanceId, final TimeRange range)
      throws SQLException {
    stmt.setString(1, viewName);
    stmt.setString(2, instanceId);
    stmt.setLong(3, range.getEnd());
    stmt.setLong(4, range.getBegin());
  }

  private static List<Partition> read(final PreparedStatement stmt) throws SQLException {
    final List<Partition> result = new ArrayList<>();
    try (final ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        final long retiredTime = rs.getLong("retired_time");
        result.add(Partition.builder(rs.getString("view_set_name"), rs.getString("view_instance_id"),
                new TimeRange(rs.getLong("begin_insert_time"), rs.getLong("end_insert_time")))
            .partitionId(rs.getLong("partition_id"))
            .eventTimes(rs.getLong("min_event_time"), rs.getLong("max_event_time"))
            .updated(rs.getLong("updated"))
            .file(rs.getString("file_path"), rs.getLong("file_size"))
            .rowCount(rs.getLong("row_count"))
            .fingerprint(rs.getString("file_schema_hash"))
            .sourceHash(rs.getLong("source_data_hash"))
            .retired(rs.getBoolean("retired"), retiredTime)
            .build());
      }
    }
    return result;
  }
}
