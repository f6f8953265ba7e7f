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

/**
 * Length-prefixed UTF-8 strings, used for high-cardinality columns like log messages.
 */
public final class PlainStringCodec {

  private PlainStringCodec() {
  }

  public static byte[] encode(final String[] values, final int count) {
    final byte[][] encoded = new byte[count][];
    int size = 4;
    for (int i = 0; i < count; i++) {
      encoded[i] = (values[i] != null ? values[i] : "").getBytes(StandardCharsets.UTF_8);
      size += 4 + encoded[i].length;
    }
    final ByteBuffer buffer = ByteBuffer.allocate(size);
    buffer.putInt(count);
    for (final byte[] value : encoded) {
      buffer.putInt(value.length);
      buffer.put(value);
    }
    return buffer.array();
  }

  public static String[] decode(final byte[] data, final int offset) {
    try {
      final ByteBuffer buffer = ByteBuffer.wrap(data);
      buffer.position(offset);
      final String[] result = new String[buffer.getInt()];
      for (int i = 0; i < result.length; i++) {
        final byte[] utf8 = new byte[buffer.getInt()];
        buffer.get(utf8);
        result[i] = new String(utf8, StandardCharsets.UTF_8);
      }
      return result;
    } catch (final BufferUnderflowException | IllegalArgumentException | NegativeArraySizeException e) {
      throw new CorruptedColumnException("Plain string decode: malformed data (size=" + data.length + ")", e);
    }
  }
}
