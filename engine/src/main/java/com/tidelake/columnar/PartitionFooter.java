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

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trailer of a partition file: schema, fingerprint and the directory of chunks with the location, codec and statistics
 * of every column.
 */
public final class PartitionFooter {
  private final TableSchema       schema;
  private final String            fingerprint;
  private final List<ChunkInfo>   chunks;
  private final long              rowCount;
  private final ColumnStats[]     fileStats;

  public static final class ColumnChunk {
    private final ColumnCodec codec;
    private final int         offset;
    private final int         length;
    private final ColumnStats stats;

    public ColumnChunk(final ColumnCodec codec, final int offset, final int length, final ColumnStats stats) {
      this.codec = codec;
      this.offset = offset;
      this.length = length;
      this.stats = stats;
    }

    public ColumnCodec getCodec() {
      return codec;
    }

    public int getOffset() {
      return offset;
    }

    public int getLength() {
      return length;
    }

    public ColumnStats getStats() {
      return stats;
    }
  }

  public static final class ChunkInfo {
    private final int           rowCount;
    private final ColumnChunk[] columns;

    public ChunkInfo(final int rowCount, final ColumnChunk[] columns) {
      this.rowCount = rowCount;
      this.columns = columns;
    }

    public int getRowCount() {
      return rowCount;
    }

    public ColumnChunk getColumn(final int index) {
      return columns[index];
    }
  }

  public PartitionFooter(final TableSchema schema, final String fingerprint, final List<ChunkInfo> chunks) {
    this.schema = schema;
    this.fingerprint = fingerprint;
    this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));

    long rows = 0;
    for (final ChunkInfo c : chunks)
      rows += c.rowCount;
    this.rowCount = rows;

    this.fileStats = new ColumnStats[schema.size()];
    for (int col = 0; col < schema.size(); col++) {
      ColumnStats merged = new ColumnStats(schema.getColumn(col).getType(), null, null);
      for (final ChunkInfo c : chunks)
        merged = merged.merge(c.columns[col].stats);
      fileStats[col] = merged;
    }
  }

  public TableSchema getSchema() {
    return schema;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public List<ChunkInfo> getChunks() {
    return chunks;
  }

  public long getRowCount() {
    return rowCount;
  }

  public ColumnStats getFileStats(final int column) {
    return fileStats[column];
  }

  void write(final DataOutputStream out) throws IOException {
    out.writeInt(schema.size());
    for (final ColumnDefinition c : schema.getColumns()) {
      writeString(out, c.getName());
      out.writeByte(c.getType().getCode());
    }
    writeString(out, fingerprint);
    out.writeInt(chunks.size());
    for (final ChunkInfo chunk : chunks) {
      out.writeInt(chunk.rowCount);
      for (int col = 0; col < schema.size(); col++) {
        final ColumnChunk c = chunk.columns[col];
        out.writeByte(c.codec.getCode());
        out.writeInt(c.offset);
        out.writeInt(c.length);
        c.stats.write(out);
      }
    }
  }

  static PartitionFooter read(final DataInputStream in) throws IOException {
    final int columnCount = in.readInt();
    if (columnCount <= 0 || columnCount > 4096)
      throw new IOException("Invalid column count " + columnCount);
    final List<ColumnDefinition> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      final String name = readString(in);
      columns.add(new ColumnDefinition(name, ColumnType.fromCode(in.readByte())));
    }
    final TableSchema schema = new TableSchema(columns);
    final String fingerprint = readString(in);

    final int chunkCount = in.readInt();
    if (chunkCount < 0)
      throw new IOException("Invalid chunk count " + chunkCount);
    final List<ChunkInfo> chunks = new ArrayList<>(chunkCount);
    for (int i = 0; i < chunkCount; i++) {
      final int rows = in.readInt();
      final ColumnChunk[] chunkColumns = new ColumnChunk[columnCount];
      for (int col = 0; col < columnCount; col++) {
        final ColumnCodec codec = ColumnCodec.fromCode(in.readByte());
        final int offset = in.readInt();
        final int length = in.readInt();
        chunkColumns[col] = new ColumnChunk(codec, offset, length, ColumnStats.read(in, columns.get(col).getType()));
      }
      chunks.add(new ChunkInfo(rows, chunkColumns));
    }
    return new PartitionFooter(schema, fingerprint, chunks);
  }

  static void writeString(final DataOutputStream out, final String value) throws IOException {
    final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    out.writeInt(utf8.length);
    out.write(utf8);
  }

  static String readString(final DataInputStream in) throws IOException {
    final int length = in.readInt();
    if (length < 0)
      throw new IOException("Invalid string length " + length);
    final byte[] utf8 = new byte[length];
    in.readFully(utf8);
    return new String(utf8, StandardCharsets.UTF_8);
  }
}
