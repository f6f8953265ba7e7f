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

import com.tidelake.exception.InvalidScanRequestException;
import com.tidelake.materialize.JitPartitionGenerator;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Tables visible to the query engine: one global table per global view, and the {@code view_instance} table function.
 */
public class LakehouseCatalog {
  public static final String VIEW_INSTANCE_FUNCTION = "view_instance";

  private final ViewRegistry           registry;
  private final PartitionMetadataCache metadataCache;
  private final JitPartitionGenerator  generator;
  private final PartitionScanner       scanner;

  public LakehouseCatalog(final ViewRegistry registry, final PartitionMetadataCache metadataCache, final JitPartitionGenerator generator,
      final PartitionScanner scanner) {
    this.registry = registry;
    this.metadataCache = metadataCache;
    this.generator = generator;
    this.scanner = scanner;
  }

  public List<String> getTableNames() {
    final List<String> names = new ArrayList<>();
    for (final ViewDefinition v : registry.getViews())
      if (v.isGlobal())
        names.add(v.getName());
    return names;
  }

  /**
   * @throws com.tidelake.exception.ViewNotFoundException if no view has this name
   * @throws InvalidScanRequestException                    if the view only exists per instance
   */
  public TableProvider getTable(final String name) {
    final ViewDefinition view = registry.get(name);
    if (!view.isGlobal())
      throw new InvalidScanRequestException("View '" + name + "' has no global table, use " + VIEW_INSTANCE_FUNCTION + "()");
    return new MaterializedViewTable(view, metadataCache, scanner);
  }

  /**
   * {@code view_instance(view_name, entity_key)}. The key {@value ViewDefinition#GLOBAL_INSTANCE} returns the global table.
   */
  public TableProvider viewInstance(final String viewName, final String instanceId) {
    if (ViewDefinition.GLOBAL_INSTANCE.equals(instanceId))
      return getTable(viewName);

    final ViewDefinition view = registry.get(viewName);
    if (!view.supportsInstances())
      throw new InvalidScanRequestException("View '" + viewName + "' has no instances");
    return new ViewInstanceTable(view, instanceId, generator, scanner);
  }
}
