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

import java.util.Map;

/**
 * One event decoded from a block payload.
 */
public class TelemetryEvent {
  public enum Kind {
    LOG("log"),
    MEASURE("measure"),
    BEGIN_SCOPE("begin_scope"),
    END_SCOPE("end_scope"),
    BEGIN_ASYNC("begin_async"),
    END_ASYNC("end_async");

    private final String lineName;

    Kind(final String lineName) {
      this.lineName = lineName;
    }

    public String getLineName() {
      return lineName;
    }

    public static Kind fromLineName(final String name) {
      for (final Kind k : values())
        if (k.lineName.equals(name))
          return k;
      return null;
    }
  }

  private final Kind                kind;
  private final Map<String, String> tags;
  private final Map<String, Object> fields;
  private final long                time;

  public TelemetryEvent(final Kind kind, final Map<String, String> tags, final Map<String, Object> fields, final long time) {
    this.kind = kind;
    this.tags = tags;
    this.fields = fields;
    this.time = time;
  }

  public Kind getKind() {
    return kind;
  }

  public Map<String, String> getTags() {
    return tags;
  }

  public Map<String, Object> getFields() {
    return fields;
  }

  /**
   * Event time in nanoseconds since the epoch.
   */
  public long getTime() {
    return time;
  }

  /**
   * Value of a field, falling back to a tag with the same name, or the empty string.
   */
  public String getString(final String name) {
    final Object value = fields.get(name);
    if (value != null)
      return value.toString();
    final String tag = tags.get(name);
    return tag != null ? tag : "";
  }

  public long getLong(final String name) {
    final Object value = fields.get(name);
    if (value instanceof Number)
      return ((Number) value).longValue();
    final String text = value != null ? value.toString() : tags.get(name);
    if (text == null || text.isEmpty())
      return 0L;
    try {
      return Long.parseLong(text);
    } catch (final NumberFormatException e) {
      return 0L;
    }
  }

  public double getDouble(final String name) {
    final Object value = fields.get(name);
    if (value instanceof Number)
      return ((Number) value).doubleValue();
    return 0D;
  }

  @Override
  public String toString() {
    return kind.lineName + tags + fields + "@" + time;
  }
}
