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

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

/**
 * Reads partition files produced by {@link PartitionFileWriter}. The whole content is kept in memory; chunks and
 * columns are decoded lazily on request.
 */
public class PartitionFileReader {
  private final String          path;
  private final byte[]          data;
  private final PartitionFooter footer;

  private PartitionFileReader(final String path, final byte[] data, final PartitionFooter footer) {
    this.path = path;
    this.data = data;
    this.footer = footer;
  }

  /**
   * @throws CorruptedColumnException if the content is not a valid partition file
   */
  public static PartitionFileReader open(final String path, final byte[] data) {
    final int magicLength = PartitionFileWriter.MAGIC.length;
    if (data.length < magicLength * 2 + 1 + 4)
      throw new CorruptedColumnException("File '" + path + "' is too short (" + data.length + " bytes)");
    if (!Arrays.equals(data, 0, magicLength, PartitionFileWriter.MAGIC, 0, magicLength) ||
        !Arrays.equals(data, data.length - magicLength, data.length, PartitionFileWriter.MAGIC, 0, magicLength))
      throw new CorruptedColumnException("File '" + path + "' is not a partition file");
    if (data[magicLength] != PartitionFileWriter.FORMAT_VERSION)
      throw new CorruptedColumnException("File '" + path + "' has unsupported version " + data[magicLength]);

    final int footerLength = ByteBuffer.wrap(data, data.length - magicLength - 4, 4).getInt();
    final int footerOffset = data.length - magicLength - 4 - footerLength;
    if (footerLength <= 0 || footerOffset < magicLength + 1)
      throw new CorruptedColumnException("File '" + path + "' has an invalid footer length " + footerLength);

    try {
      final PartitionFooter footer = PartitionFooter.read(
          new DataInputStream(new ByteArrayInputStream(data, footerOffset, footerLength)));
      for (final PartitionFooter.ChunkInfo chunk : footer.getChunks())
        for (int c = 0; c < footer.getSchema().size(); c++) {
          final PartitionFooter.ColumnChunk column = chunk.getColumn(c);
          if (column.getOffset() < 0 || column.getOffset() + column.getLength() > footerOffset)
            throw new CorruptedColumnException("File '" + path + "' references data outside of its body");
        }
      return new PartitionFileReader(path, data, footer);
    } catch (final IOException | IllegalArgumentException e) {
      throw new CorruptedColumnException("File '" + path + "' has a corrupted footer", e);
    }
  }

  public String getPath() {
    return path;
  }

  public PartitionFooter getFooter() {
    return footer;
  }

  public TableSchema getSchema() {
    return footer.getSchema();
  }

  public int getChunkCount() {
    return footer.getChunks().size();
  }

  public RecordBatch readChunk(final int chunkIndex) {
    return readChunk(chunkIndex, null);
  }

  /**
   * Decodes one chunk.
   *
   * @param columns names of the columns to decode, null for all of them
   */
  public RecordBatch readChunk(final int chunkIndex, final List<String> columns) {
    final TableSchema fileSchema = footer.getSchema();
    final TableSchema target = columns == null ? fileSchema : fileSchema.project(columns);
    final PartitionFooter.ChunkInfo chunk = footer.getChunks().get(chunkIndex);

    final Object[] decoded = new Object[target.size()];
    for (int i = 0; i < target.size(); i++) {
      final int col = fileSchema.indexOf(target.getColumn(i).getName());
      decoded[i] = decodeColumn(chunk.getColumn(col), chunk.getRowCount());
    }
    return new RecordBatch(target, decoded, chunk.getRowCount());
  }

  private Object decodeColumn(final PartitionFooter.ColumnChunk column, final int expectedRows) {
    final Object values;
    final int count;
    switch (column.getCodec()) {
    case DELTA_OF_DELTA: {
      final long[] v = DeltaOfDeltaCodec.decode(data, column.getOffset());
      values = v;
      count = v.length;
      break;
    }
    case ZIGZAG_VARINT: {
      final long[] v = VarIntCodec.decode(data, column.getOffset());
      values = v;
      count = v.length;
      break;
    }
    case GORILLA_XOR: {
      final double[] v = GorillaXorCodec.decode(data, column.getOffset());
      values = v;
      count = v.length;
      break;
    }
    case DICTIONARY: {
      final String[] v = DictionaryCodec.decode(data, column.getOffset());
      values = v;
      count = v.length;
      break;
    }
    default: {
      final String[] v = PlainStringCodec.decode(data, column.getOffset());
      values = v;
      count = v.length;
    }
    }
    if (count != expectedRows)
      throw new CorruptedColumnException(
          "File '" + path + "': column holds " + count + " values, chunk declares " + expectedRows);
    return values;
  }
}
