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

import java.util.Objects;

public final class ColumnDefinition {
  private final String     name;
  private final ColumnType type;

  public ColumnDefinition(final String name, final ColumnType type) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Column name is empty");
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
  }

  public static ColumnDefinition of(final String name, final ColumnType type) {
    return new ColumnDefinition(name, type);
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ColumnDefinition))
      return false;
    final ColumnDefinition that = (ColumnDefinition) o;
    return name.equals(that.name) && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return name + " " + type;
  }
}
