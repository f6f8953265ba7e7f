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

import com.tidelake.ContextConfiguration;
import com.tidelake.GlobalConfiguration;
import com.tidelake.exception.MetadataStoreException;
import com.tidelake.log.LogManager;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.logging.Level;

/**
 * Pooled connection to the relational metadata store. Creating it brings the schema to the latest version through the
 * ordered list of migration steps, recording the applied version in the {@code migration} table.
 */
public class MetadataDataSource implements AutoCloseable {
  static final int LATEST_SCHEMA_VERSION = 2;

  private static final List<List<String>> MIGRATIONS = List.of(
      // VERSION 1: RAW TELEMETRY ENVELOPES
      List.of(//
          "CREATE TABLE IF NOT EXISTS processes (row_id BIGINT AUTO_INCREMENT PRIMARY KEY, process_id VARCHAR(64) NOT NULL, exe VARCHAR, "
              + "username VARCHAR, realname VARCHAR, computer VARCHAR, distro VARCHAR, cpu_brand VARCHAR, tsc_frequency BIGINT, "
              + "start_time BIGINT, start_ticks BIGINT, parent_process_id VARCHAR(64), properties VARCHAR, insert_time BIGINT NOT NULL, "
              + "last_update_time BIGINT NOT NULL)",
          "CREATE INDEX IF NOT EXISTS processes_id ON processes(process_id)",
          "CREATE INDEX IF NOT EXISTS processes_insert_time ON processes(insert_time)",
          "CREATE TABLE IF NOT EXISTS streams (row_id BIGINT AUTO_INCREMENT PRIMARY KEY, stream_id VARCHAR(64) NOT NULL, "
              + "process_id VARCHAR(64) NOT NULL, tags VARCHAR ARRAY, properties VARCHAR, dependencies_metadata VARCHAR, "
              + "objects_metadata VARCHAR, insert_time BIGINT NOT NULL)",
          "CREATE INDEX IF NOT EXISTS streams_id ON streams(stream_id)",
          "CREATE INDEX IF NOT EXISTS streams_process_id ON streams(process_id)",
          "CREATE TABLE IF NOT EXISTS blocks (row_id BIGINT AUTO_INCREMENT PRIMARY KEY, block_id VARCHAR(64) NOT NULL, "
              + "stream_id VARCHAR(64) NOT NULL, process_id VARCHAR(64) NOT NULL, begin_time BIGINT NOT NULL, end_time BIGINT NOT NULL, "
              + "begin_ticks BIGINT, end_ticks BIGINT, nb_objects BIGINT NOT NULL, object_offset BIGINT, payload_size BIGINT, "
              + "insert_time BIGINT NOT NULL)",
          "CREATE INDEX IF NOT EXISTS blocks_id ON blocks(block_id)",
          "CREATE INDEX IF NOT EXISTS blocks_stream_insert ON blocks(stream_id, insert_time)",
          "CREATE INDEX IF NOT EXISTS blocks_insert_time ON blocks(insert_time)"),
      // VERSION 2: MATERIALIZED PARTITIONS
      List.of(//
          "CREATE TABLE IF NOT EXISTS partitions (partition_id BIGINT AUTO_INCREMENT PRIMARY KEY, view_set_name VARCHAR NOT NULL, "
              + "view_instance_id VARCHAR NOT NULL, begin_insert_time BIGINT NOT NULL, end_insert_time BIGINT NOT NULL, "
              + "min_event_time BIGINT, max_event_time BIGINT, updated BIGINT NOT NULL, file_path VARCHAR, file_size BIGINT NOT NULL, "
              + "row_count BIGINT NOT NULL, file_schema_hash VARCHAR NOT NULL, source_data_hash BIGINT NOT NULL, "
              + "retired BOOLEAN DEFAULT FALSE NOT NULL, retired_time BIGINT)",
          "CREATE INDEX IF NOT EXISTS partitions_view ON partitions(view_set_name, view_instance_id, begin_insert_time)",
          "CREATE INDEX IF NOT EXISTS partitions_file ON partitions(file_path)"));

  private final HikariDataSource dataSource;

  public MetadataDataSource(final ContextConfiguration configuration) {
    final HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(configuration.getValueAsString(GlobalConfiguration.METADATA_JDBC_URL));
    hikariConfig.setUsername(configuration.getValueAsString(GlobalConfiguration.METADATA_JDBC_USER));
    hikariConfig.setPassword(configuration.getValueAsString(GlobalConfiguration.METADATA_JDBC_PASSWORD));
    hikariConfig.setMaximumPoolSize(configuration.getValueAsInteger(GlobalConfiguration.METADATA_POOL_SIZE));
    hikariConfig.setMinimumIdle(1);
    hikariConfig.setPoolName("tidelake-metadata");
    hikariConfig.setAutoCommit(true);

    try {
      this.dataSource = new HikariDataSource(hikariConfig);
    } catch (final RuntimeException e) {
      throw new MetadataStoreException("Cannot connect to metadata store " + hikariConfig.getJdbcUrl(), e);
    }

    try {
      migrate();
    } catch (final RuntimeException e) {
      dataSource.close();
      throw e;
    }
  }

  /**
   * Work executed inside a JDBC transaction.
   */
  @FunctionalInterface
  public interface TransactionalWork<T> {
    T execute(Connection connection) throws SQLException;
  }

  /**
   * Runs the work in a transaction, committing on success and rolling back on any failure.
   */
  public <T> T inTransaction(final String description, final TransactionalWork<T> work) {
    try (final Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        final T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (final SQLException | RuntimeException e) {
        try {
          conn.rollback();
        } catch (final SQLException rollbackEx) {
          e.addSuppressed(rollbackEx);
        }
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (final SQLException e) {
      throw new MetadataStoreException("Error on " + description, e);
    }
  }

  /**
   * Runs read-only work on a pooled connection in auto-commit mode.
   */
  public <T> T withConnection(final String description, final TransactionalWork<T> work) {
    try (final Connection conn = dataSource.getConnection()) {
      return work.execute(conn);
    } catch (final SQLException e) {
      throw new MetadataStoreException("Error on " + description, e);
    }
  }

  public int getSchemaVersion() {
    return withConnection("reading schema version", MetadataDataSource::readVersion);
  }

  private void migrate() {
    inTransaction("schema migration", conn -> {
      try (final Statement stmt = conn.createStatement()) {
        stmt.execute("CREATE TABLE IF NOT EXISTS migration (version INT NOT NULL)");
      }
      int version = readVersion(conn);
      while (version < LATEST_SCHEMA_VERSION) {
        try (final Statement stmt = conn.createStatement()) {
          for (final String ddl : MIGRATIONS.get(version))
            stmt.execute(ddl);
          version++;
          stmt.executeUpdate("DELETE FROM migration");
          stmt.executeUpdate("INSERT INTO migration (version) VALUES (" + version + ")");
        }
        LogManager.instance().log(this, Level.INFO, "Metadata store upgraded to schema version %d", null, version);
      }
      return version;
    });
  }

  private static int readVersion(final Connection conn) throws SQLException {
    try (final Statement stmt = conn.createStatement(); final ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM migration")) {
      return rs.next() ? rs.getInt(1) : 0;
    }
  }

  @Override
  public void close() {
    if (!dataSource.isClosed())
      dataSource.close();
  }
}
