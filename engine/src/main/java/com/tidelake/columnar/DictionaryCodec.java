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
package com.tidelake.columnar;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dictionary encoding for low-cardinality string columns (targets, levels, process ids). Returns {@code null} from
 * {@link #encode(String[], int)} when the chunk holds more than {@link #MAX_DICTIONARY_SIZE} distinct values: the
 * writer then falls back to {@link PlainStringCodec}.
 * <p>
 * Format: count (4 bytes), dictionary size (2 bytes), entries (4 bytes length + UTF-8), one 2 bytes index per value.
 */
public final class DictionaryCodec {
  public static final int MAX_DICTIONARY_SIZE = 65535;

  private DictionaryCodec() {
  }

  public static byte[] encode(final String[] values, final int count) {
    final Map<String, Integer> dictionary = new HashMap<>();
    final List<byte[]> entries = new ArrayList<>();
    final int[] indexes = new int[count];

    int size = 4 + 2 + count * 2;
    for (int i = 0; i < count; i++) {
      final String value = values[i] != null ? values[i] : "";
      Integer index = dictionary.get(value);
      if (index == null) {
        if (entries.size() >= MAX_DICTIONARY_SIZE)
          return null;
        index = entries.size();
        dictionary.put(value, index);
        final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        entries.add(utf8);
        size += 4 + utf8.length;
      }
      indexes[i] = index;
    }

    final ByteBuffer buffer = ByteBuffer.allocate(size);
    buffer.putInt(count);
    buffer.putShort((short) entries.size());
    for (final byte[] entry : entries) {
      buffer.putInt(entry.length);
      buffer.put(entry);
    }
    for (final int index : indexes)
      buffer.putShort((short) index);
    return buffer.array();
  }

  public static String[] decode(final byte[] data, final int offset) {
    try {
      final ByteBuffer buffer = ByteBuffer.wrap(data);
      buffer.position(offset);
      final int count = buffer.getInt();
      final int dictionarySize = buffer.getShort() & 0xFFFF;

      final String[] entries = new String[dictionarySize];
      for (int i = 0; i < dictionarySize; i++) {
        final byte[] utf8 = new byte[buffer.getInt()];
        buffer.get(utf8);
        entries[i] = new String(utf8, StandardCharsets.UTF_8);
      }

      final String[] result = new String[count];
      for (int i = 0; i < count; i++) {
        final int index = buffer.getShort() & 0xFFFF;
        if (index >= dictionarySize)
          throw new CorruptedColumnException(
              "Dictionary decode: invalid index " + index + " (dictionary size=" + dictionarySize + ")");
        result[i] = entries[index];
      }
      return result;
    } catch (final BufferUnderflowException | IllegalArgumentException | NegativeArraySizeException e) {
      throw new CorruptedColumnException("Dictionary decode: malformed data (size=" + data.length + ")", e);
    }
  }
}
