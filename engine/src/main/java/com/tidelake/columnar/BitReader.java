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

final class BitReader {
  private final byte[] data;
  private final long   totalBits;
  private       long   bitPosition;

  BitReader(final byte[] data, final int offset) {
    this.data = data;
    this.totalBits = (long) data.length * 8;
    this.bitPosition = (long) offset * 8;
  }

  int readBit() {
    if (bitPosition >= totalBits)
      throw new CorruptedColumnException("Bit stream exhausted at bit " + bitPosition);
    final int value = (data[(int) (bitPosition >>> 3)] >>> (7 - (bitPosition & 7))) & 1;
    bitPosition++;
    return value;
  }

  long readBits(final int nbBits) {
    if (bitPosition + nbBits > totalBits)
      throw new CorruptedColumnException("Bit stream exhausted: need " + nbBits + " bits at " + bitPosition);
    long value = 0;
    for (int i = 0; i < nbBits; i++)
      value = (value << 1) | readBit();
    return value;
  }
}
