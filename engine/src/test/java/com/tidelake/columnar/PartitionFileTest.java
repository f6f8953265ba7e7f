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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartitionFileTest {
  private static final TableSchema SCHEMA = TableSchema.of(new ColumnDefinition("time", ColumnType.TIMESTAMP),
      new ColumnDefinition("level", ColumnType.STRING), new ColumnDefinition("count", ColumnType.LONG),
      new ColumnDefinition("value", ColumnType.DOUBLE));

  private static RecordBatch rows(final int from, final int to) {
    final RecordBatchBuilder builder = new RecordBatchBuilder(SCHEMA);
    for (int i = from; i < to; i++)
      builder.append(1_000L + i * 10L, i % 3 == 0 ? "WARN" : "INFO", (long) -i, i / 4.0);
    return builder.build();
  }

  @Test
  void rowsAreSplitInChunks() {
    final PartitionFileWriter writer = new PartitionFileWriter(SCHEMA, "fp-1", 4);
    writer.write(rows(0, 6)).write(rows(6, 10));
    assertThat(writer.getRowCount()).isEqualTo(10);

    final PartitionFileReader reader = PartitionFileReader.open("a.tlk", writer.finish());

    assertThat(reader.getChunkCount()).isEqualTo(3);
    assertThat(reader.getFooter().getRowCount()).isEqualTo(10);
    assertThat(reader.getFooter().getFingerprint()).isEqualTo("fp-1");
    assertThat(reader.getSchema()).isEqualTo(SCHEMA);

    final RecordBatch last = reader.readChunk(2);
    assertThat(last.getRowCount()).isEqualTo(2);
    assertThat(last.getRow(0)).containsExactly(1_080L, "INFO", -8L, 2.0);
    assertThat(last.getRow(1)).containsExactly(1_090L, "WARN", -9L, 2.25);
  }

  @Test
  void projectionDecodesOnlyTheRequestedColumns() {
    final PartitionFileReader reader = PartitionFileReader.open("a.tlk", new PartitionFileWriter(SCHEMA, "fp").write(rows(0, 5)).finish());

    final RecordBatch batch = reader.readChunk(0, List.of("value", "level"));

    assertThat(batch.getSchema().getColumns()).extracting(ColumnDefinition::getName).containsExactly("value", "level");
    assertThat(batch.getRow(3)).containsExactly(0.75, "WARN");
  }

  @Test
  void statsAreKeptPerChunkAndPerFile() {
    final PartitionFileReader reader = PartitionFileReader.open("a.tlk",
        new PartitionFileWriter(SCHEMA, "fp", 4).write(rows(0, 10)).finish());
    final PartitionFooter footer = reader.getFooter();

    assertThat(footer.getChunks().get(1).getColumn(0).getStats()).isEqualTo(new ColumnStats(ColumnType.TIMESTAMP, 1_040L, 1_070L));
    assertThat(footer.getChunks().get(1).getColumn(2).getStats()).isEqualTo(new ColumnStats(ColumnType.LONG, -7L, -4L));
    assertThat(footer.getFileStats(0)).isEqualTo(new ColumnStats(ColumnType.TIMESTAMP, 1_000L, 1_090L));
    assertThat(footer.getFileStats(1)).isEqualTo(new ColumnStats(ColumnType.STRING, "INFO", "WARN"));

    assertThat(footer.getFileStats(0).mayIntersect(1_090L, 2_000L)).isTrue();
    assertThat(footer.getFileStats(0).mayIntersect(1_091L, 2_000L)).isFalse();
    assertThat(footer.getFileStats(0).mayIntersect(0L, 1_000L)).isFalse();
    assertThat(footer.getFileStats(3).mayContain(2.25)).isTrue();
    assertThat(footer.getFileStats(3).mayContain(2.5)).isFalse();
  }

  @Test
  void nanDoesNotHideOtherValuesFromStats() {
    final TableSchema schema = TableSchema.of(new ColumnDefinition("value", ColumnType.DOUBLE));
    final RecordBatch batch = new RecordBatchBuilder(schema).append(Double.NaN).append(3.0).append(-1.0).build();

    final ColumnStats stats = PartitionFileReader.open("n.tlk", new PartitionFileWriter(schema, "fp").write(batch).finish())
        .getFooter().getFileStats(0);

    assertThat(stats.getMin()).isEqualTo(-1.0);
    assertThat(stats.mayContain(3.0)).isTrue();
    assertThat(stats.mayContain(Double.NaN)).isTrue();
  }

  @Test
  void tooManyDistinctStringsFallBackToPlainEncoding() {
    final TableSchema schema = TableSchema.of(new ColumnDefinition("id", ColumnType.STRING));
    final RecordBatchBuilder builder = new RecordBatchBuilder(schema);
    for (int i = 0; i <= DictionaryCodec.MAX_DICTIONARY_SIZE; i++)
      builder.append("id-" + i);

    final PartitionFileReader reader = PartitionFileReader.open("p.tlk",
        new PartitionFileWriter(schema, "fp", DictionaryCodec.MAX_DICTIONARY_SIZE + 1).write(builder.build()).finish());

    assertThat(reader.getFooter().getChunks().get(0).getColumn(0).getCodec()).isEqualTo(ColumnCodec.PLAIN);
    assertThat(reader.readChunk(0).getString(0, DictionaryCodec.MAX_DICTIONARY_SIZE)).isEqualTo("id-" + DictionaryCodec.MAX_DICTIONARY_SIZE);
  }

  @Test
  void emptyFileHasNoChunk() {
    final PartitionFileReader reader = PartitionFileReader.open("e.tlk", new PartitionFileWriter(SCHEMA, "fp").finish());

    assertThat(reader.getChunkCount()).isZero();
    assertThat(reader.getFooter().getFileStats(0).isEmpty()).isTrue();
  }

  @Test
  void finishedWriterIsClosed() {
    final PartitionFileWriter writer = new PartitionFileWriter(SCHEMA, "fp");
    writer.finish();

    assertThatThrownBy(() -> writer.write(rows(0, 1))).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> new PartitionFileWriter(SCHEMA, "fp", 0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void corruptedContentIsRejected() {
    final byte[] data = new PartitionFileWriter(SCHEMA, "fp").write(rows(0, 5)).finish();

    final byte[] badMagic = data.clone();
    badMagic[0] = 'X';
    assertThatThrownBy(() -> PartitionFileReader.open("m.tlk", badMagic)).isInstanceOf(CorruptedColumnException.class)
        .hasMessageContaining("not a partition file");

    final byte[] badVersion = data.clone();
    badVersion[PartitionFileWriter.MAGIC.length] = 9;
    assertThatThrownBy(() -> PartitionFileReader.open("v.tlk", badVersion)).isInstanceOf(CorruptedColumnException.class)
        .hasMessageContaining("unsupported version");

    assertThatThrownBy(() -> PartitionFileReader.open("s.tlk", Arrays.copyOf(data, 8))).isInstanceOf(CorruptedColumnException.class);

    final byte[] badFooterLength = data.clone();
    badFooterLength[data.length - PartitionFileWriter.MAGIC.length - 4] = 0x7F;
    assertThatThrownBy(() -> PartitionFileReader.open("f.tlk", badFooterLength)).isInstanceOf(CorruptedColumnException.class);
  }
}
