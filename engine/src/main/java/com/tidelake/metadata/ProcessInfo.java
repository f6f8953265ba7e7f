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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Instrumented program instance. Immutable except for {@code lastUpdateTime} and the accumulated properties, which the
 * store updates through {@link MetadataStore#touchProcess(String, long, Map)}.
 */
public class ProcessInfo {
  private final String              processId;
  private final String              exe;
  private final String              username;
  private final String              realname;
  private final String              computer;
  private final String              distro;
  private final String              cpuBrand;
  private final long                tscFrequency;
  private final long                startTime;
  private final long                startTicks;
  private final String              parentProcessId;
  private final Map<String, String> properties;
  private final long                insertTime;
  private final long                lastUpdateTime;

  private ProcessInfo(final Builder builder) {
    this.processId = Objects.requireNonNull(builder.processId, "processId");
    this.exe = builder.exe;
    this.username = builder.username;
    this.realname = builder.realname;
    this.computer = builder.computer;
    this.distro = builder.distro;
    this.cpuBrand = builder.cpuBrand;
    this.tscFrequency = builder.tscFrequency;
    this.startTime = builder.startTime;
    this.startTicks = builder.startTicks;
    this.parentProcessId = builder.parentProcessId;
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    this.insertTime = builder.insertTime;
    this.lastUpdateTime = builder.lastUpdateTime != 0 ? builder.lastUpdateTime : builder.insertTime;
  }

  public static Builder builder(final String processId) {
    return new Builder(processId);
  }

  public Builder toBuilder() {
    return new Builder(processId).exe(exe).username(username).realname(realname).computer(computer).distro(distro).cpuBrand(cpuBrand)
        .tscFrequency(tscFrequency).startTime(startTime).startTicks(startTicks).parentProcessId(parentProcessId).properties(properties)
        .insertTime(insertTime).lastUpdateTime(lastUpdateTime);
  }

  public String getProcessId() {
    return processId;
  }

  public String getExe() {
    return exe;
  }

  public String getUsername() {
    return username;
  }

  public String getRealname() {
    return realname;
  }

  public String getComputer() {
    return computer;
  }

  public String getDistro() {
    return distro;
  }

  public String getCpuBrand() {
    return cpuBrand;
  }

  public long getTscFrequency() {
    return tscFrequency;
  }

  public long getStartTime() {
    return startTime;
  }

  public long getStartTicks() {
    return startTicks;
  }

  public String getParentProcessId() {
    return parentProcessId;
  }

  public Map<String, String> getProperties() {
    return properties;
  }

  public long getInsertTime() {
    return insertTime;
  }

  public long getLastUpdateTime() {
    return lastUpdateTime;
  }

  @Override
  public String toString() {
    return "Process{" + processId + ", exe=" + exe + ", computer=" + computer + "}";
  }

  public static class Builder {
    private final String              processId;
    private       String              exe             = "";
    private       String              username        = "";
    private       String              realname        = "";
    private       String              computer        = "";
    private       String              distro          = "";
    private       String              cpuBrand        = "";
    private       long                tscFrequency;
    private       long                startTime;
    private       long                startTicks;
    private       String              parentProcessId;
    private       Map<String, String> properties      = Map.of();
    private       long                insertTime;
    private       long                lastUpdateTime;

    private Builder(final String processId) {
      this.processId = processId;
    }

    public Builder exe(final String exe) {
      this.exe = exe;
      return this;
    }

    public Builder username(final String username) {
      this.username = username;
      return this;
    }

    public Builder realname(final String realname) {
      this.realname = realname;
      return this;
    }

    public Builder computer(final String computer) {
      this.computer = computer;
      return this;
    }

    public Builder distro(final String distro) {
      this.distro = distro;
      return this;
    }

    public Builder cpuBrand(final String cpuBrand) {
      this.cpuBrand = cpuBrand;
      return this;
    }

    public Builder tscFrequency(final long tscFrequency) {
      this.tscFrequency = tscFrequency;
      return this;
    }

    public Builder startTime(final long startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder startTicks(final long startTicks) {
      this.startTicks = startTicks;
      return this;
    }

    public Builder parentProcessId(final String parentProcessId) {
      this.parentProcessId = parentProcessId;
      return this;
    }

    public Builder properties(final Map<String, String> properties) {
      this.properties = properties != null ? properties : Map.of();
      return this;
    }

    public Builder insertTime(final long insertTime) {
      this.insertTime = insertTime;
      return this;
    }

    public Builder lastUpdateTime(final long lastUpdateTime) {
      this.lastUpdateTime = lastUpdateTime;
      return this;
    }

    public ProcessInfo build() {
      return new ProcessInfo(this);
    }
  }
}
