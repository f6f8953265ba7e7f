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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of columns. The fingerprint is a stable digest of names and types, stored with every partition to detect
 * schema changes.
 */
public final class TableSchema {
  private final List<ColumnDefinition> columns;
  private final Map<String, Integer>   indexByName = new HashMap<>();

  public TableSchema(final List<ColumnDefinition> columns) {
    if (columns.isEmpty())
      throw new IllegalArgumentException("Schema without columns");
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    for (int i = 0; i < columns.size(); i++)
      if (indexByName.put(columns.get(i).getName(), i) != null)
        throw new IllegalArgumentException("Duplicated column '" + columns.get(i).getName() + "'");
  }

  public static TableSchema of(final ColumnDefinition... columns) {
    return new TableSchema(List.of(columns));
  }

  public List<ColumnDefinition> getColumns() {
    return columns;
  }

  public int size() {
    return columns.size();
  }

  public ColumnDefinition getColumn(final int index) {
    return columns.get(index);
  }

  /**
   * Returns the position of the column, or -1 if the schema does not have it.
   */
  public int indexOf(final String name) {
    final Integer index = indexByName.get(name);
    return index != null ? index : -1;
  }

  public boolean hasColumn(final String name) {
    return indexByName.containsKey(name);
  }

  public TableSchema project(final List<String> names) {
    final List<ColumnDefinition> projected = new ArrayList<>(names.size());
    for (final String name : names) {
      final int index = indexOf(name);
      if (index < 0)
        throw new IllegalArgumentException("Column '" + name + "' not found");
      projected.add(columns.get(index));
    }
    return new TableSchema(projected);
  }

  public String fingerprint() {
    return fingerprint("");
  }

  /**
   * Digest of the columns plus a salt, typically the version of the transform producing the rows.
   */
  public String fingerprint(final String salt) {
    final StringBuilder buffer = new StringBuilder(salt).append('|');
    for (final ColumnDefinition c : columns)
      buffer.append(c.getName()).append(':').append(c.getType().name()).append(';');
    return digest(buffer.toString());
  }

  static String digest(final String text) {
    try {
      final byte[] hash = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
      final StringBuilder hex = new StringBuilder(16);
      for (int i = 0; i < 8; i++)
        hex.append(String.format("%02x", hash[i]));
      return hex.toString();
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof TableSchema && columns.equals(((TableSchema) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return columns.toString();
  }
}
