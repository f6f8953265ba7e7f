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
package com.tidelake.server;

import com.tidelake.ContextConfiguration;
import com.tidelake.GlobalConfiguration;
import com.tidelake.Lakehouse;
import com.tidelake.materialize.GranularityTask;
import com.tidelake.metadata.ProcessInfo;
import com.tidelake.time.TimeGranularity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class LakehouseServerTest {
  private LakehouseServer server;

  @AfterEach
  void stopServer() {
    if (server != null)
      server.stop();
  }

  private static ContextConfiguration configuration() {
    return new ContextConfiguration()//
        .setValue(GlobalConfiguration.METADATA_JDBC_URL, "jdbc:h2:mem:tidelake-server-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")//
        .setValue(GlobalConfiguration.STORAGE_PATH, "")//
        .setValue(GlobalConfiguration.MATERIALIZER_SECOND_TICK, 50L)//
        .setValue(GlobalConfiguration.MATERIALIZER_MINUTE_TICK, 0L)//
        .setValue(GlobalConfiguration.MATERIALIZER_HOUR_TICK, 0L)//
        .setValue(GlobalConfiguration.MATERIALIZER_DAY_TICK, 0L)//
        .setValue(GlobalConfiguration.MAINTENANCE_SWEEP_INTERVAL, 0L);
  }

  @Test
  void startRunsTheScheduledTasks() {
    server = new LakehouseServer(configuration(), Clock.systemUTC());
    assertThat(server.getStatus()).isEqualTo(LakehouseServer.Status.OFFLINE);

    server.start();

    assertThat(server.isStarted()).isTrue();
    assertThat(server.getLakehouse().getCatalog().getTableNames()).contains("log_entries", "measures", "processes");

    final GranularityTask seconds = server.getLakehouse().getScheduler().getTask(TimeGranularity.SECOND);
    await().atMost(Duration.ofSeconds(10)).until(() -> seconds.getTickCount() + seconds.getSkippedTickCount() > 0);
  }

  @Test
  void stopClosesTheLakehouseAndRestartKeepsTheMetadata() {
    server = new LakehouseServer(configuration(), Clock.systemUTC());
    server.start();
    final Lakehouse first = server.getLakehouse();
    first.insertProcess(ProcessInfo.builder("P1").insertTime(1).lastUpdateTime(1).build());

    server.stop();
    assertThat(server.getStatus()).isEqualTo(LakehouseServer.Status.OFFLINE);
    assertThat(server.getLakehouse()).isNull();
    assertThat(first.isOpen()).isFalse();
    server.stop();

    server.start();
    assertThat(server.getLakehouse()).isNotSameAs(first);
    assertThat(server.getLakehouse().getMetadataStore().getProcess("P1")).isNotNull();
  }

  @Test
  void failedStartLeavesTheServerOffline() {
    server = new LakehouseServer(configuration().setValue(GlobalConfiguration.METADATA_JDBC_URL, "jdbc:unknown:nowhere"), Clock.systemUTC());

    assertThatThrownBy(server::start).isInstanceOf(ServerException.class);
    assertThat(server.getStatus()).isEqualTo(LakehouseServer.Status.OFFLINE);
    assertThat(server.getLakehouse()).isNull();
  }

  @Test
  void configurationFileOverridesSettings(@TempDir final Path dir) throws IOException {
    final Path file = dir.resolve("server-configuration.json");
    Files.writeString(file, "{\"configuration\":{\"jit.bucket\":60000,\"storage.path\":\"\",\"not.a.setting\":true}}");

    final ContextConfiguration configuration = LakehouseServer.loadConfiguration(file);

    assertThat(configuration.getContextSize()).isEqualTo(2);
    assertThat(configuration.getValueAsLong(GlobalConfiguration.JIT_BUCKET)).isEqualTo(60_000L);
    assertThat(configuration.getValueAsString(GlobalConfiguration.STORAGE_PATH)).isEmpty();
    assertThat(LakehouseServer.loadConfiguration(dir.resolve("missing.json")).getContextSize()).isZero();
  }
}
