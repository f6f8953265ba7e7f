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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnCodecsTest {

  @Test
  void deltaOfDeltaKeepsIrregularTimestamps() {
    final long[] values = { 1_709_287_200_000_000_000L, 1_709_287_200_000_000_000L, 1_709_287_200_000_001_000L,
        1_709_287_200_000_002_000L, 1_709_287_200_500_000_000L, 1_709_287_100_000_000_000L, Long.MAX_VALUE, Long.MIN_VALUE, 0L };

    final byte[] encoded = DeltaOfDeltaCodec.encode(values, values.length);

    assertThat(DeltaOfDeltaCodec.decode(encoded, 0)).containsExactly(values);
  }

  @Test
  void regularTimestampsTakeOneBitEach() {
    final long[] values = new long[1000];
    for (int i = 0; i < values.length; i++)
      values[i] = 1_000_000_000L + i * 1_000_000L;

    final byte[] encoded = DeltaOfDeltaCodec.encode(values, values.length);

    // HEADER (4 + 8 + 8 BYTES) + 998 BITS
    assertThat(encoded.length).isEqualTo(20 + (998 + 7) / 8);
    assertThat(DeltaOfDeltaCodec.decode(encoded, 0)).containsExactly(values);
  }

  @Test
  void encodersHonorTheCount() {
    final long[] longs = { 5, 6, 7, 99 };

    assertThat(DeltaOfDeltaCodec.decode(DeltaOfDeltaCodec.encode(longs, 0), 0)).isEmpty();
    assertThat(DeltaOfDeltaCodec.decode(DeltaOfDeltaCodec.encode(longs, 1), 0)).containsExactly(5L);
    assertThat(VarIntCodec.decode(VarIntCodec.encode(longs, 3), 0)).containsExactly(5L, 6L, 7L);
    assertThat(GorillaXorCodec.decode(GorillaXorCodec.encode(new double[] { 1.5, 2.5 }, 1), 0)).containsExactly(1.5);
  }

  @Test
  void varIntKeepsNegativeAndExtremeValues() {
    final long[] values = { 0, -1, 1, -300, 300, Long.MIN_VALUE, Long.MAX_VALUE, 42 };

    assertThat(VarIntCodec.decode(VarIntCodec.encode(values, values.length), 0)).containsExactly(values);
  }

  @Test
  void gorillaKeepsSpecialDoubles() {
    final double[] values = { 12.5, 12.5, 12.75, -0.0, 0.0, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY,
        Double.MIN_VALUE, Double.MAX_VALUE, 1e-300, 3.0 };

    final double[] decoded = GorillaXorCodec.decode(GorillaXorCodec.encode(values, values.length), 0);

    assertThat(decoded).hasSize(values.length);
    for (int i = 0; i < values.length; i++)
      assertThat(Double.doubleToRawLongBits(decoded[i])).as("value %d", i).isEqualTo(Double.doubleToRawLongBits(values[i]));
  }

  @Test
  void dictionaryStoresEachDistinctValueOnce() {
    final String[] values = new String[1000];
    for (int i = 0; i < values.length; i++)
      values[i] = i % 2 == 0 ? "INFO" : "connection reset by peer";
    values[7] = null;

    final byte[] encoded = DictionaryCodec.encode(values, values.length);
    final String[] decoded = DictionaryCodec.decode(encoded, 0);

    assertThat(encoded.length).isLessThan(PlainStringCodec.encode(values, values.length).length);
    assertThat(decoded[0]).isEqualTo("INFO");
    assertThat(decoded[1]).isEqualTo("connection reset by peer");
    assertThat(decoded[7]).isEmpty();
  }

  @Test
  void dictionaryOverflowIsReported() {
    final String[] values = new String[DictionaryCodec.MAX_DICTIONARY_SIZE + 1];
    for (int i = 0; i < values.length; i++)
      values[i] = "v" + i;

    assertThat(DictionaryCodec.encode(values, values.length)).isNull();
    assertThat(DictionaryCodec.encode(values, DictionaryCodec.MAX_DICTIONARY_SIZE)).isNotNull();
    assertThat(PlainStringCodec.decode(PlainStringCodec.encode(values, values.length), 0)).containsExactly(values);
  }

  @Test
  void plainStringsKeepUnicode() {
    final String[] values = { "", "héllo", "日本語", "emoji 😀" };

    assertThat(PlainStringCodec.decode(PlainStringCodec.encode(values, values.length), 0)).containsExactly(values);
  }

  @Test
  void truncatedDataIsDetected() {
    final long[] values = { 1, 2, 30_000, 4, 5_000_000_000L, 6 };
    final byte[] encoded = DeltaOfDeltaCodec.encode(values, values.length);

    assertThatThrownBy(() -> DeltaOfDeltaCodec.decode(Arrays.copyOf(encoded, 14), 0)).isInstanceOf(CorruptedColumnException.class);
    assertThatThrownBy(() -> PlainStringCodec.decode(Arrays.copyOf(PlainStringCodec.encode(new String[] { "abcdef" }, 1), 6), 0))
        .isInstanceOf(CorruptedColumnException.class);
  }

  @Test
  void dictionaryIndexOutOfRangeIsDetected() {
    final byte[] encoded = DictionaryCodec.encode(new String[] { "a", "b" }, 2);
    encoded[encoded.length - 1] = 5;

    assertThatThrownBy(() -> DictionaryCodec.decode(encoded, 0)).isInstanceOf(CorruptedColumnException.class)
        .hasMessageContaining("invalid index 5");
  }
}
