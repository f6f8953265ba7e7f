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
package com.tidelake.exception;

/**
 * Raised when a process, stream or block with the same id is already stored. Ingestion callers treat it as an
 * idempotent no-op.
 */
public class DuplicatedKeyException extends LakehouseException {
  private final String table;
  private final String key;

  public DuplicatedKeyException(final String table, final String key) {
    super(ErrorCode.DUPLICATE_KEY, "Duplicated key '" + key + "' found in '" + table + "'");
    this.table = table;
    this.key = key;
    addContext("table", table);
    addContext("key", key);
  }

  public String getTable() {
    return table;
  }

  public String getKey() {
    return key;
  }
}
