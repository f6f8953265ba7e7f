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
package com.tidelake.query;

import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.PartitionNotFoundException;
import com.tidelake.log.LogManager;
import com.tidelake.partition.Partition;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.time.TimeRange;
import com.tidelake.view.ViewDefinition;

import java.util.List;
import java.util.logging.Level;

/**
 * Global table of a view, backed by the partitions written by the scheduled materializer.
 */
public class MaterializedViewTable implements TableProvider {
  private final ViewDefinition         view;
  private final PartitionMetadataCache metadataCache;
  private final PartitionScanner       scanner;

  public MaterializedViewTable(final ViewDefinition view, final PartitionMetadataCache metadataCache, final PartitionScanner scanner) {
    this.view = view;
    this.metadataCache = metadataCache;
    this.scanner = scanner;
  }

  @Override
  public String getName() {
    return view.getName();
  }

  @Override
  public TableSchema getSchema() {
    return view.getSchema();
  }

  public ViewDefinition getView() {
    return view;
  }

  @Override
  public List<Partition> listPartitions(final TimeRange eventRange) {
    final List<Partition> partitions = metadataCache.getPartitions(view.getName(), ViewDefinition.GLOBAL_INSTANCE, eventRange);
    if (partitions.isEmpty())
      throw new PartitionNotFoundException(view.getName(), ViewDefinition.GLOBAL_INSTANCE, eventRange.toString());
    return partitions;
  }

  @Override
  public ScanResult scan(final ScanRequest request) {
    final List<Partition> partitions;
    try {
      partitions = listPartitions(request.getEventRange());
    } catch (final PartitionNotFoundException e) {
      LogManager.instance().log(this, Level.FINE, "%s", null, e.getMessage());
      return ScanResult.empty(PartitionScanner.outputSchema(view, request));
    }
    return scanner.scan(view, partitions, request);
  }

  @Override
  public String toString() {
    return "MaterializedViewTable{" + view.getName() + "}";
  }
}
