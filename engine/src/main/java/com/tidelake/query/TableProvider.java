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
import com.tidelake.partition.Partition;
import com.tidelake.time.TimeRange;

import java.util.List;

/**
 * Table exposed to the query engine.
 */
public interface TableProvider {
  String getName();

  TableSchema getSchema();

  /**
   * Live partitions that may hold events of the range, sorted by insert time.
   *
   * @throws com.tidelake.exception.PartitionNotFoundException if no partition holds data for the range
   */
  List<Partition> listPartitions(TimeRange eventRange);

  /**
   * Never fails because data is missing: a range without partitions scans as an empty result.
   */
  ScanResult scan(ScanRequest request);
}
