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
 * Gorilla XOR encoding for double columns: each value is XORed with the previous one and only the meaningful bits are
 * kept.
 * <p>
 * Per value after the first:
 * <ul>
 *   <li>'0': same as previous</li>
 *   <li>'10' + block: meaningful bits fit the previous leading/trailing window</li>
 *   <li>'11' + 6 bits leading zeros + 6 bits (block length - 1) + block</li>
 * </ul>
 */
public final class GorillaXorCodec {

  private GorillaXorCodec() {
  }

  public static byte[] encode(final double[] values, final int count) {
    final BitWriter writer = new BitWriter(count * 2 + 16);
    writer.writeBits(count, 32);
    if (count == 0)
      return writer.toByteArray();

    long prevBits = Double.doubleToRawLongBits(values[0]);
    writer.writeBits(prevBits, 64);

    int prevLeading = Integer.MAX_VALUE;
    int prevTrailing = 0;

    for (int i = 1; i < count; i++) {
      final long bits = Double.doubleToRawLongBits(values[i]);
      final long xor = bits ^ prevBits;

      if (xor == 0)
        writer.writeBit(0);
      else {
        writer.writeBit(1);
        final int leading = Math.min(Long.numberOfLeadingZeros(xor), 63);
        final int trailing = Long.numberOfTrailingZeros(xor);

        if (leading >= prevLeading && trailing >= prevTrailing) {
          writer.writeBit(0);
          writer.writeBits(xor >>> prevTrailing, 64 - prevLeading - prevTrailing);
        } else {
          writer.writeBit(1);
          final int blockSize = 64 - leading - trailing;
          writer.writeBits(leading, 6);
          writer.writeBits(blockSize - 1, 6);
          writer.writeBits(xor >>> trailing, blockSize);
          prevLeading = leading;
          prevTrailing = trailing;
        }
      }
      prevBits = bits;
    }
    return writer.toByteArray();
  }

  public static double[] decode(final byte[] data, final int offset) {
    final BitReader reader = new BitReader(data, offset);
    final int count = (int) reader.readBits(32);
    if (count < 0)
      throw new CorruptedColumnException("GorillaXOR decode: invalid count " + count);

    final double[] result = new double[count];
    if (count == 0)
      return result;

    long prevBits = reader.readBits(64);
    result[0] = Double.longBitsToDouble(prevBits);

    int prevLeading = 0;
    int prevTrailing = 0;
    for (int i = 1; i < count; i++) {
      if (reader.readBit() != 0) {
        final long xor;
        if (reader.readBit() == 0)
          xor = reader.readBits(64 - prevLeading - prevTrailing) << prevTrailing;
        else {
          prevLeading = (int) reader.readBits(6);
          final int blockSize = (int) reader.readBits(6) + 1;
          prevTrailing = 64 - prevLeading - blockSize;
          if (prevTrailing < 0)
            throw new CorruptedColumnException("GorillaXOR decode: invalid block at value " + i);
          xor = reader.readBits(blockSize) << prevTrailing;
        }
        prevBits ^= xor;
      }
      result[i] = Double.longBitsToDouble(prevBits);
    }
    return result;
  }
}
