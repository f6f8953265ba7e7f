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
import com.tidelake.log.LogManager;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.logging.Level;

/**
 * Standalone process running the scheduled materializer and the maintenance task of a lakehouse. The query engine
 * embedding the lakehouse reaches it through {@link #getLakehouse()}.
 */
public class LakehouseServer {
  public enum Status {OFFLINE, STARTING, ONLINE, SHUTTING_DOWN}

  public static final String CONFIG_SERVER_CONFIGURATION_FILENAME = "config/server-configuration.json";

  private final    ContextConfiguration configuration;
  private final    Clock                clock;
  private volatile Status               status = Status.OFFLINE;
  private          Lakehouse            lakehouse;
  private          Thread               shutdownHook;

  public LakehouseServer() {
    this(loadConfiguration(Paths.get(CONFIG_SERVER_CONFIGURATION_FILENAME)), Clock.systemUTC());
  }

  public LakehouseServer(final ContextConfiguration configuration, final Clock clock) {
    this.configuration = configuration;
    this.clock = clock;
  }

  public static void main(final String[] args) {
    final LakehouseServer server = new LakehouseServer();
    server.registerShutdownHook();
    server.start();
  }

  /**
   * Reads the settings of the configuration file, if present, on top of the global configuration.
   */
  static ContextConfiguration loadConfiguration(final Path file) {
    final ContextConfiguration configuration = new ContextConfiguration();
    if (Files.exists(file)) {
      try {
        configuration.fromJSON(Files.readString(file));
      } catch (final IOException e) {
        throw new ServerException("Error on loading server configuration from '" + file + "'", e);
      }
      LogManager.instance().log(LakehouseServer.class, Level.INFO, "Loaded server configuration from '%s'", null, file);
    }
    return configuration;
  }

  public synchronized void start() {
    if (status != Status.OFFLINE)
      return;

    status = Status.STARTING;
    welcomeBanner();

    try {
      lakehouse = Lakehouse.builder().configuration(configuration).clock(clock).build();
      lakehouse.start();
    } catch (final RuntimeException e) {
      status = Status.OFFLINE;
      if (lakehouse != null) {
        lakehouse.close();
        lakehouse = null;
      }
      LogManager.instance().log(this, Level.SEVERE, "Error on starting the lakehouse server: %s", e, e.getMessage());
      throw new ServerException("Error on starting the lakehouse server", e);
    }

    status = Status.ONLINE;
    LogManager.instance().log(this, Level.INFO, "Lakehouse server started (CPUs=%d MAXRAM=%dMB) serving %s", null,
        Runtime.getRuntime().availableProcessors(), Runtime.getRuntime().maxMemory() / (1024 * 1024),
        lakehouse.getCatalog().getTableNames());
  }

  public synchronized void stop() {
    if (status == Status.OFFLINE || status == Status.SHUTTING_DOWN)
      return;

    LogManager.instance().log(this, Level.INFO, "Shutting down lakehouse server...");
    status = Status.SHUTTING_DOWN;
    try {
      if (lakehouse != null)
        lakehouse.close();
    } finally {
      lakehouse = null;
      status = Status.OFFLINE;
      LogManager.instance().log(this, Level.INFO, "Lakehouse server is down");
    }
  }

  /**
   * Stops the server when the JVM exits.
   */
  public synchronized void registerShutdownHook() {
    if (shutdownHook != null)
      return;
    shutdownHook = new Thread(() -> {
      LogManager.instance().log(this, Level.INFO, "Received shutdown signal. The server will be halted");
      stop();
    }, "TideLake-ShutdownHook");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
  }

  public Status getStatus() {
    return status;
  }

  public boolean isStarted() {
    return status == Status.ONLINE;
  }

  public Lakehouse getLakehouse() {
    return lakehouse;
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  private void welcomeBanner() {
    LogManager.instance().log(this, Level.INFO, "Lakehouse server is starting up...");
    LogManager.instance().log(this, Level.INFO, "Running on %s %s - %s %s", null, System.getProperty("os.name"),
        System.getProperty("os.version"), System.getProperty("java.vm.name"), System.getProperty("java.version"));

    final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    GlobalConfiguration.dumpConfiguration(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    LogManager.instance().log(this, Level.INFO, "%s", null, buffer.toString(StandardCharsets.UTF_8));
    if (configuration.getContextSize() > 0)
      LogManager.instance().log(this, Level.INFO, "%d settings overridden by the server configuration", null, configuration.getContextSize());
  }
}
