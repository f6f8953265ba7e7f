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

/**
 * Delta-of-delta encoding for timestamp columns. Consecutive event times are close to each other, so the second-order
 * difference usually fits in a handful of bits.
 * <p>
 * Layout: count (32 bits), first value (64 bits), first delta (zigzag, 64 bits), then one bucketed delta-of-delta per
 * value:
 * <ul>
 *   <li>'0': delta unchanged</li>
 *   <li>'10' + 7 bits</li>
 *   <li>'110' + 9 bits</li>
 *   <li>'1110' + 16 bits</li>
 *   <li>'1111' + 64 bits</li>
 * </ul>
 */
public final class DeltaOfDeltaCodec {

  private DeltaOfDeltaCodec() {
  }

  public static byte[] encode(final long[] values, final int count) {
    final BitWriter writer = new BitWriter(count * 2 + 24);
    writer.writeBits(count, 32);
    if (count == 0)
      return writer.toByteArray();

    writer.writeBits(values[0], 64);
    if (count == 1)
      return writer.toByteArray();

    long prevDelta = values[1] - values[0];
    writer.writeBits(zigzag(prevDelta), 64);

    for (int i = 2; i < count; i++) {
      final long delta = values[i] - values[i - 1];
      final long dod = delta - prevDelta;
      final long encoded = zigzag(dod);

      if (dod == 0)
        writer.writeBit(0);
      else if (encoded < (1L << 7)) {
        writer.writeBits(0b10, 2);
        writer.writeBits(encoded, 7);
      } else if (encoded < (1L << 9)) {
        writer.writeBits(0b110, 3);
        writer.writeBits(encoded, 9);
      } else if (encoded < (1L << 16)) {
        writer.writeBits(0b1110, 4);
        writer.writeBits(encoded, 16);
      } else {
        writer.writeBits(0b1111, 4);
        writer.writeBits(encoded, 64);
      }
      prevDelta = delta;
    }
    return writer.toByteArray();
  }

  public static long[] decode(final byte[] data, final int offset) {
    final BitReader reader = new BitReader(data, offset);
    final int count = (int) reader.readBits(32);
    if (count < 0)
      throw new CorruptedColumnException("DeltaOfDelta decode: invalid count " + count);

    final long[] result = new long[count];
    if (count == 0)
      return result;

    result[0] = reader.readBits(64);
    if (count == 1)
      return result;

    long prevDelta = unzigzag(reader.readBits(64));
    result[1] = result[0] + prevDelta;

    for (int i = 2; i < count; i++) {
      final long dod;
      if (reader.readBit() == 0)
        dod = 0;
      else if (reader.readBit() == 0)
        dod = unzigzag(reader.readBits(7));
      else if (reader.readBit() == 0)
        dod = unzigzag(reader.readBits(9));
      else if (reader.readBit() == 0)
        dod = unzigzag(reader.readBits(16));
      else
        dod = unzigzag(reader.readBits(64));

      prevDelta += dod;
      result[i] = result[i - 1] + prevDelta;
    }
    return result;
  }

  static long zigzag(final long value) {
    return (value << 1) ^ (value >> 63);
  }

  static long unzigzag(final long value) {
    return (value >>> 1) ^ -(value & 1);
  }
}
