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

/**
 * Column types of materialized views. Timestamps are nanoseconds since the Unix epoch; values are never null (missing
 * strings are empty, missing numbers are zero).
 */
public enum ColumnType {
  TIMESTAMP(0, ColumnCodec.DELTA_OF_DELTA),
  LONG(1, ColumnCodec.ZIGZAG_VARINT),
  DOUBLE(2, ColumnCodec.GORILLA_XOR),
  STRING(3, ColumnCodec.DICTIONARY);

  private final int         code;
  private final ColumnCodec defaultCodec;

  ColumnType(final int code, final ColumnCodec defaultCodec) {
    this.code = code;
    this.defaultCodec = defaultCodec;
  }

  public int getCode() {
    return code;
  }

  public ColumnCodec getDefaultCodec() {
    return defaultCodec;
  }

  public boolean isNumeric() {
    return this != STRING;
  }

  public static ColumnType fromCode(final int code) {
    for (final ColumnType type : values())
      if (type.code == code)
        return type;
    throw new IllegalArgumentException("Unknown column type code: " + code);
  }
}
