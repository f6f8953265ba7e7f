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
package com.tidelake.partition;

import com.tidelake.columnar.CorruptedColumnException;
import com.tidelake.columnar.PartitionFileReader;
import com.tidelake.columnar.RecordBatch;
import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.CorruptedPartitionException;
import com.tidelake.exception.IncompatibleSchemaException;
import com.tidelake.exception.ObjectNotFoundException;
import com.tidelake.exception.PartitionNotFoundException;
import com.tidelake.storage.ContentCache;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens partition files through the content cache.
 */
public class PartitionReader {
  private final ContentCache contentCache;

  public PartitionReader(final ContentCache contentCache) {
    this.contentCache = contentCache;
  }

  /**
   * @throws PartitionNotFoundException  if the file does not exist anymore
   * @throws CorruptedPartitionException if the file cannot be decoded
   * @throws IncompatibleSchemaException if the fingerprint of the file differs from the one registered
   */
  public PartitionFileReader open(final Partition partition) {
    if (!partition.hasFile())
      throw new IllegalArgumentException("Partition " + partition + " has no file");

    final byte[] content;
    try {
      content = contentCache.get(partition.getFilePath(), partition.getFileSize());
    } catch (final ObjectNotFoundException e) {
      throw new PartitionNotFoundException(partition.getViewName(), partition.getInstanceId(), partition.getFilePath(), e);
    }
    final PartitionFileReader reader;
    try {
      reader = PartitionFileReader.open(partition.getFilePath(), content);
    } catch (final CorruptedColumnException e) {
      throw new CorruptedPartitionException(partition.getFilePath(), e.getMessage(), e);
    }
    if (!reader.getFooter().getFingerprint().equals(partition.getFingerprint()))
      throw new IncompatibleSchemaException(partition.getViewName(), partition.getFingerprint(), reader.getFooter().getFingerprint());
    return reader;
  }

  /**
   * Decodes one chunk, translating decoding errors.
   */
  public RecordBatch readChunk(final PartitionFileReader reader, final int chunk, final List<String> columns) {
    try {
      return reader.readChunk(chunk, columns);
    } catch (final CorruptedColumnException e) {
      throw new CorruptedPartitionException(reader.getPath(), e.getMessage(), e);
    }
  }

  /**
   * Every row of the partition in the given schema. Partitions without file have no rows.
   */
  public List<RecordBatch> readAll(final Partition partition, final TableSchema schema) {
    final List<RecordBatch> batches = new ArrayList<>();
    if (!partition.hasFile() || partition.getRowCount() == 0)
      return batches;

    final PartitionFileReader reader = open(partition);
    final List<String> names = new ArrayList<>(schema.size());
    schema.getColumns().forEach(c -> names.add(c.getName()));
    for (int chunk = 0; chunk < reader.getChunkCount(); chunk++)
      batches.add(readChunk(reader, chunk, names));
    return batches;
  }
}
