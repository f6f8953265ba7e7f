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
import com.tidelake.materialize.JitPartitionGenerator;
import com.tidelake.partition.Partition;
import com.tidelake.time.TimeRange;
import com.tidelake.view.ViewDefinition;

import java.util.List;
import java.util.logging.Level;

/**
 * Result of {@code view_instance(view_name, entity_key)}: the view restricted to one process or stream, materialized just
 * in time for the scanned range.
 */
public class ViewInstanceTable implements TableProvider {
  private final ViewDefinition        view;
  private final String                instanceId;
  private final JitPartitionGenerator generator;
  private final PartitionScanner      scanner;

  public ViewInstanceTable(final ViewDefinition view, final String instanceId, final JitPartitionGenerator generator,
      final PartitionScanner scanner) {
    this.view = view;
    this.instanceId = instanceId;
    this.generator = generator;
    this.scanner = scanner;
  }

  @Override
  public String getName() {
    return view.getName() + "('" + instanceId + "')";
  }

  @Override
  public TableSchema getSchema() {
    return view.getSchema();
  }

  public String getInstanceId() {
    return instanceId;
  }

  @Override
  public List<Partition> listPartitions(final TimeRange eventRange) {
    final List<Partition> partitions = generator.generate(view.getName(), instanceId, eventRange);
    if (partitions.isEmpty())
      throw new PartitionNotFoundException(view.getName(), instanceId, eventRange.toString());
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
    return "ViewInstanceTable{" + view.getName() + ", " + instanceId + "}";
  }
}
