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

import java.nio.charset.StandardCharsets;

/**
 * Writes block payloads in the format read by {@link PayloadDecoder}. Used by ingestion clients and tools that
 * synthesize telemetry.
 */
public class PayloadBuilder {
  private final StringBuilder buffer = new StringBuilder();
  private       int           count;

  public PayloadBuilder log(final long time, final String target, final String level, final String msg) {
    return line(TelemetryEvent.Kind.LOG, time, "target", target, "level", level, "msg", msg);
  }

  public PayloadBuilder measure(final long time, final String name, final String target, final String unit, final double value) {
    begin(TelemetryEvent.Kind.MEASURE);
    field("name", name).append(',');
    field("target", target).append(',');
    field("unit", unit).append(',');
    buffer.append("value=").append(value);
    return end(time);
  }

  public PayloadBuilder beginScope(final long time, final String name, final String target, final String filename, final long line) {
    return scope(TelemetryEvent.Kind.BEGIN_SCOPE, time, name, target, filename, line);
  }

  public PayloadBuilder endScope(final long time, final String name, final String target, final String filename, final long line) {
    return scope(TelemetryEvent.Kind.END_SCOPE, time, name, target, filename, line);
  }

  public PayloadBuilder beginAsync(final long time, final long spanId, final long parentSpanId, final String name, final String target,
      final String filename, final long line) {
    return async(TelemetryEvent.Kind.BEGIN_ASYNC, time, spanId, parentSpanId, name, target, filename, line);
  }

  public PayloadBuilder endAsync(final long time, final long spanId, final long parentSpanId, final String name, final String target,
      final String filename, final long line) {
    return async(TelemetryEvent.Kind.END_ASYNC, time, spanId, parentSpanId, name, target, filename, line);
  }

  public int getEventCount() {
    return count;
  }

  public byte[] build() {
    return buffer.toString().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return buffer.toString();
  }

  private PayloadBuilder scope(final TelemetryEvent.Kind kind, final long time, final String name, final String target, final String filename,
      final long line) {
    begin(kind);
    field("name", name).append(',');
    field("target", target).append(',');
    field("filename", filename).append(',');
    buffer.append("line=").append(line).append('i');
    return end(time);
  }

  private PayloadBuilder async(final TelemetryEvent.Kind kind, final long time, final long spanId, final long parentSpanId, final String name,
      final String target, final String filename, final long line) {
    begin(kind);
    buffer.append("span_id=").append(spanId).append("i,");
    buffer.append("parent_span_id=").append(parentSpanId).append("i,");
    field("name", name).append(',');
    field("target", target).append(',');
    field("filename", filename).append(',');
    buffer.append("line=").append(line).append('i');
    return end(time);
  }

  private PayloadBuilder line(final TelemetryEvent.Kind kind, final long time, final String... keyValues) {
    begin(kind);
    for (int i = 0; i < keyValues.length; i += 2) {
      if (i > 0)
        buffer.append(',');
      field(keyValues[i], keyValues[i + 1]);
    }
    return end(time);
  }

  private void begin(final TelemetryEvent.Kind kind) {
    buffer.append(kind.getLineName()).append(' ');
  }

  private PayloadBuilder end(final long time) {
    buffer.append(' ').append(time).append('\n');
    count++;
    return this;
  }

  private StringBuilder field(final String key, final String value) {
    buffer.append(key).append("=\"");
    final String v = value != null ? value : "";
    for (int i = 0; i < v.length(); i++) {
      final char c = v.charAt(i);
      if (c == '"' || c == '\\')
        buffer.append('\\');
      buffer.append(c == '\n' || c == '\r' ? ' ' : c);
    }
    return buffer.append('"');
  }
}
