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

import java.io.ByteArrayOutputStream;

/**
 * Zigzag varint encoding of the deltas between consecutive values, used for integer columns such as counters, line
 * numbers and thread depths.
 */
public final class VarIntCodec {

  private VarIntCodec() {
  }

  public static byte[] encode(final long[] values, final int count) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream(count * 2 + 5);
    writeVarInt(out, count);
    long prev = 0;
    for (int i = 0; i < count; i++) {
      writeVarInt(out, DeltaOfDeltaCodec.zigzag(values[i] - prev));
      prev = values[i];
    }
    return out.toByteArray();
  }

  public static long[] decode(final byte[] data, final int offset) {
    final int[] position = { offset };
    final int count = (int) readVarInt(data, position);
    if (count < 0)
      throw new CorruptedColumnException("VarInt decode: invalid count " + count);
    final long[] result = new long[count];
    long prev = 0;
    for (int i = 0; i < count; i++) {
      prev += DeltaOfDeltaCodec.unzigzag(readVarInt(data, position));
      result[i] = prev;
    }
    return result;
  }

  static void writeVarInt(final ByteArrayOutputStream out, long value) {
    while ((value & ~0x7FL) != 0) {
      out.write((int) ((value & 0x7F) | 0x80));
      value >>>= 7;
    }
    out.write((int) value);
  }

  static long readVarInt(final byte[] data, final int[] position) {
    long result = 0;
    int shift = 0;
    while (true) {
      if (position[0] >= data.length)
        throw new CorruptedColumnException("VarInt decode: truncated buffer at " + position[0]);
      if (shift > 63)
        throw new CorruptedColumnException("VarInt decode: value too long at " + position[0]);
      final byte b = data[position[0]++];
      result |= (long) (b & 0x7F) << shift;
      if ((b & 0x80) == 0)
        return result;
      shift += 7;
    }
  }
}
