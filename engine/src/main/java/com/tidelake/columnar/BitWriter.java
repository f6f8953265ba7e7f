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

import java.util.Arrays;

/**
 * Growable MSB-first bit sink used by the bit-packed codecs.
 */
final class BitWriter {
  private byte[] buffer;
  private long   bitPosition;

  BitWriter(final int expectedBytes) {
    this.buffer = new byte[Math.max(16, expectedBytes)];
  }

  void writeBit(final int bit) {
    ensureCapacity(1);
    if (bit != 0) {
      final int byteIndex = (int) (bitPosition >>> 3);
      buffer[byteIndex] |= (byte) (0x80 >>> (bitPosition & 7));
    }
    bitPosition++;
  }

  /**
   * Writes the lowest {@code nbBits} bits of {@code value}, most significant first.
   */
  void writeBits(final long value, final int nbBits) {
    if (nbBits < 0 || nbBits > 64)
      throw new IllegalArgumentException("Invalid bit count " + nbBits);
    ensureCapacity(nbBits);
    for (int i = nbBits - 1; i >= 0; i--) {
      if (((value >>> i) & 1L) != 0) {
        final int byteIndex = (int) (bitPosition >>> 3);
        buffer[byteIndex] |= (byte) (0x80 >>> (bitPosition & 7));
      }
      bitPosition++;
    }
  }

  byte[] toByteArray() {
    return Arrays.copyOf(buffer, (int) ((bitPosition + 7) >>> 3));
  }

  private void ensureCapacity(final int nbBits) {
    final long required = (bitPosition + nbBits + 7) >>> 3;
    if (required > buffer.length)
      buffer = Arrays.copyOf(buffer, (int) Math.max(required, buffer.length * 2L));
  }
}
