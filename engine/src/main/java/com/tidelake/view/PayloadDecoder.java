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

import com.tidelake.log.LogManager;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Decodes block payloads. A payload holds one event per line:
 * <pre>{@code <kind>[,<tag>=<value>...] <field>=<value>[,<field>=<value>...] <timestamp-ns>}</pre>
 * Field values: quoted string, integer with the {@code i} suffix, or double. Malformed lines and unknown kinds are
 * skipped with a warning.
 */
public final class PayloadDecoder {
  static final int MAX_STRING_LENGTH = 64 * 1024;

  private PayloadDecoder() {
  }

  private record Token(String value, int length) {
  }

  private record FieldValue(Object value, int length) {
  }

  public static List<TelemetryEvent> decode(final byte[] payload) {
    return decode(new String(payload, StandardCharsets.UTF_8));
  }

  public static List<TelemetryEvent> decode(final String text) {
    final List<TelemetryEvent> events = new ArrayList<>();
    if (text == null || text.isEmpty())
      return events;

    for (final String rawLine : text.split("\\R")) {
      final String line = rawLine.trim();
      if (line.isEmpty() || line.startsWith("#"))
        continue;

      final TelemetryEvent event = parseLine(line);
      if (event != null)
        events.add(event);
      else
        LogManager.instance().log(PayloadDecoder.class, Level.WARNING, "Skipping malformed payload line: '%s'", null,
            sanitizeForLog(line.length() > 120 ? line.substring(0, 120) + "..." : line));
    }
    return events;
  }

  /**
   * Returns null if the line is malformed: unknown kind, no field, missing or invalid timestamp.
   */
  static TelemetryEvent parseLine(final String line) {
    try {
      int pos = 0;
      final int len = line.length();

      final StringBuilder kindName = new StringBuilder();
      while (pos < len && line.charAt(pos) != ',' && line.charAt(pos) != ' ')
        kindName.append(line.charAt(pos++));

      final TelemetryEvent.Kind kind = TelemetryEvent.Kind.fromLineName(kindName.toString());
      if (kind == null)
        return null;

      final Map<String, String> tags = new LinkedHashMap<>();
      if (pos < len && line.charAt(pos) == ',') {
        pos++;
        while (pos < len && line.charAt(pos) != ' ') {
          final Token key = readUntil(line, pos, '=');
          pos += key.length() + 1;
          final Token value = readTagValue(line, pos);
          pos += value.length();
          if (!key.value().isEmpty())
            tags.put(key.value(), value.value());
          if (pos < len && line.charAt(pos) == ',')
            pos++;
        }
      }

      if (pos < len && line.charAt(pos) == ' ')
        pos++;

      final Map<String, Object> fields = new LinkedHashMap<>();
      while (pos < len && line.charAt(pos) != ' ') {
        final Token key = readUntil(line, pos, '=');
        pos += key.length() + 1;
        final FieldValue value = readFieldValue(line, pos);
        fields.put(key.value(), value.value());
        pos += value.length();
        if (pos < len && line.charAt(pos) == ',')
          pos++;
      }

      if (fields.isEmpty() || pos >= len)
        return null;

      final String timestamp = line.substring(pos + 1).trim();
      if (timestamp.isEmpty())
        return null;

      return new TelemetryEvent(kind, tags, fields, Long.parseLong(timestamp));
    } catch (final IllegalArgumentException | IndexOutOfBoundsException e) {
      return null;
    }
  }

  private static Token readUntil(final String line, final int start, final char stop) {
    final StringBuilder buffer = new StringBuilder();
    int pos = start;
    while (pos < line.length()) {
      final char c = line.charAt(pos);
      if (c == '\\' && pos + 1 < line.length()) {
        buffer.append(line.charAt(pos + 1));
        pos += 2;
        continue;
      }
      if (c == stop || c == ' ')
        break;
      buffer.append(c);
      pos++;
    }
    if (pos >= line.length() || line.charAt(pos) != stop)
      throw new IllegalArgumentException("Missing '" + stop + "' at position " + pos);
    return new Token(buffer.toString(), pos - start);
  }

  private static Token readTagValue(final String line, final int start) {
    final StringBuilder buffer = new StringBuilder();
    int pos = start;
    while (pos < line.length()) {
      final char c = line.charAt(pos);
      if (c == '\\' && pos + 1 < line.length()) {
        buffer.append(line.charAt(pos + 1));
        pos += 2;
        continue;
      }
      if (c == ',' || c == ' ')
        break;
      buffer.append(c);
      pos++;
    }
    return new Token(buffer.toString(), pos - start);
  }

  private static FieldValue readFieldValue(final String line, final int start) {
    if (start >= line.length())
      throw new IllegalArgumentException("Missing field value at position " + start);

    if (line.charAt(start) == '"') {
      final StringBuilder buffer = new StringBuilder();
      int pos = start + 1;
      while (pos < line.length()) {
        final char c = line.charAt(pos);
        if (buffer.length() >= MAX_STRING_LENGTH)
          throw new IllegalArgumentException("Quoted field value exceeds " + MAX_STRING_LENGTH + " characters");
        if (c == '\\' && pos + 1 < line.length()) {
          buffer.append(line.charAt(pos + 1));
          pos += 2;
          continue;
        }
        if (c == '"')
          return new FieldValue(buffer.toString(), pos + 1 - start);
        buffer.append(c);
        pos++;
      }
      throw new IllegalArgumentException("Unterminated quoted string at position " + start);
    }

    int pos = start;
    while (pos < line.length() && line.charAt(pos) != ',' && line.charAt(pos) != ' ')
      pos++;

    final String raw = line.substring(start, pos);
    if (raw.endsWith("i"))
      return new FieldValue(Long.parseLong(raw.substring(0, raw.length() - 1)), pos - start);
    return new FieldValue(Double.parseDouble(raw), pos - start);
  }

  private static String sanitizeForLog(final String s) {
    final StringBuilder buffer = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      buffer.append(c >= 0x20 && c != 0x7F ? c : '?');
    }
    return buffer.toString();
  }
}
