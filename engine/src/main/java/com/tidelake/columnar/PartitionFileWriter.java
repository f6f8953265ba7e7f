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
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes rows into a self-describing columnar partition file:
 * <pre>
 * "TLKP" version:1
 * chunk 0: column 0 bytes, column 1 bytes, ...
 * chunk 1: ...
 * footer
 * footer length:4 "TLKP"
 * </pre>
 * Rows are buffered and flushed into a chunk every {@code chunkSize} rows, so readers can skip whole chunks.
 */
public class PartitionFileWriter {
  public static final  byte[] MAGIC              = "TLKP".getBytes(StandardCharsets.US_ASCII);
  public static final  int    FORMAT_VERSION     = 1;
  public static final  int    DEFAULT_CHUNK_SIZE = 8192;

  private final TableSchema                     schema;
  private final String                          fingerprint;
  private final int                             chunkSize;
  private final RecordBatchBuilder              pending;
  private final ByteArrayOutputStream           body   = new ByteArrayOutputStream();
  private final List<PartitionFooter.ChunkInfo> chunks = new ArrayList<>();
  private       boolean                         finished;

  public PartitionFileWriter(final TableSchema schema, final String fingerprint) {
    this(schema, fingerprint, DEFAULT_CHUNK_SIZE);
  }

  public PartitionFileWriter(final TableSchema schema, final String fingerprint, final int chunkSize) {
    if (chunkSize <= 0)
      throw new IllegalArgumentException("Chunk size must be positive");
    this.schema = schema;
    this.fingerprint = fingerprint;
    this.chunkSize = chunkSize;
    this.pending = new RecordBatchBuilder(schema);
    body.write(MAGIC, 0, MAGIC.length);
    body.write(FORMAT_VERSION);
  }

  public PartitionFileWriter write(final RecordBatch batch) {
    checkOpen();
    for (int r = 0; r < batch.getRowCount(); r++) {
      pending.appendRow(batch, r);
      if (pending.size() >= chunkSize)
        flushChunk();
    }
    return this;
  }

  public long getRowCount() {
    long rows = pending.size();
    for (final PartitionFooter.ChunkInfo c : chunks)
      rows += c.getRowCount();
    return rows;
  }

  /**
   * Flushes the last chunk and returns the complete file content.
   */
  public byte[] finish() {
    checkOpen();
    if (pending.size() > 0)
      flushChunk();
    finished = true;

    try {
      final ByteArrayOutputStream footerBytes = new ByteArrayOutputStream();
      final DataOutputStream footerOut = new DataOutputStream(footerBytes);
      new PartitionFooter(schema, fingerprint, chunks).write(footerOut);
      footerOut.flush();

      final DataOutputStream out = new DataOutputStream(body);
      footerBytes.writeTo(out);
      out.writeInt(footerBytes.size());
      out.write(MAGIC);
      out.flush();
      return body.toByteArray();
    } catch (final IOException e) {
      throw new UncheckedIOException("Error on serializing partition footer", e);
    }
  }

  private void flushChunk() {
    final RecordBatch batch = pending.build();
    pending.clear();

    final PartitionFooter.ColumnChunk[] columns = new PartitionFooter.ColumnChunk[schema.size()];
    for (int col = 0; col < schema.size(); col++) {
      final ColumnType type = schema.getColumn(col).getType();
      final Object data = batch.getColumnData(col);
      final int count = batch.getRowCount();

      ColumnCodec codec = type.getDefaultCodec();
      byte[] encoded;
      switch (type) {
      case TIMESTAMP:
        encoded = DeltaOfDeltaCodec.encode((long[]) data, count);
        break;
      case LONG:
        encoded = VarIntCodec.encode((long[]) data, count);
        break;
      case DOUBLE:
        encoded = GorillaXorCodec.encode((double[]) data, count);
        break;
      default:
        encoded = DictionaryCodec.encode((String[]) data, count);
        if (encoded == null) {
          codec = ColumnCodec.PLAIN;
          encoded = PlainStringCodec.encode((String[]) data, count);
        }
      }

      columns[col] = new PartitionFooter.ColumnChunk(codec, body.size(), encoded.length, ColumnStats.compute(type, data, count));
      body.write(encoded, 0, encoded.length);
    }
    chunks.add(new PartitionFooter.ChunkInfo(batch.getRowCount(), columns));
  }

  private void checkOpen() {
    if (finished)
      throw new IllegalStateException("Partition file already finished");
  }
}
