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

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for lakehouse exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Configuration errors</li>
 *   <li>2xxx - Concurrency errors (leases, stale plans)</li>
 *   <li>3xxx - Query errors</li>
 *   <li>5xxx - Storage errors (object storage I/O, partition files)</li>
 *   <li>6xxx - Metadata store errors</li>
 *   <li>7xxx - View and schema errors</li>
 *   <li>8xxx - Key errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see LakehouseException
 */
public enum ErrorCode {

  // ========== Configuration Errors (1xxx) ==========
  /** Invalid or missing configuration value */
  CONFIGURATION_ERROR(1001, "Configuration error"),

  /** Component used after it was closed */
  LAKEHOUSE_IS_CLOSED(1002, "Lakehouse is closed"),

  // ========== Concurrency Errors (2xxx) ==========
  /** Waiter for an in-flight materialization gave up */
  LEASE_TIMEOUT(2001, "Materialization lease timeout"),

  /** Materialization plan no longer matches the registered partitions */
  STALE_MATERIALIZATION(2002, "Stale materialization plan"),

  // ========== Query Errors (3xxx) ==========
  /** Requested range has no materialized data */
  PARTITION_NOT_FOUND(3001, "Partition not found"),

  /** Scan request refers to unknown columns or is malformed */
  INVALID_SCAN_REQUEST(3002, "Invalid scan request"),

  // ========== Storage Errors (5xxx) ==========
  /** Object storage read failed */
  STORAGE_READ_ERROR(5001, "Storage read error"),

  /** Object storage write failed */
  STORAGE_WRITE_FAILED(5002, "Storage write failed"),

  /** Partition file cannot be decoded */
  CORRUPTED_PARTITION(5003, "Corrupted partition file"),

  /** Object does not exist in the object storage */
  OBJECT_NOT_FOUND(5004, "Object not found"),

  // ========== Metadata Store Errors (6xxx) ==========
  /** Relational metadata store failure */
  METADATA_STORE_ERROR(6001, "Metadata store error"),

  // ========== View and Schema Errors (7xxx) ==========
  /** Referenced view does not exist */
  VIEW_NOT_FOUND(7001, "View not found"),

  /** View definitions form a cycle */
  CYCLIC_VIEW_DEFINITION(7002, "Cyclic view definition"),

  /** Partition schema does not match the view definition */
  INCOMPATIBLE_SCHEMA(7003, "Incompatible schema"),

  /** View definition is invalid */
  INVALID_VIEW_DEFINITION(7004, "Invalid view definition"),

  // ========== Key Errors (8xxx) ==========
  /** Record with the same id already exists */
  DUPLICATE_KEY(8001, "Duplicate key"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public String getCategory() {
    return switch (code / 1000) {
      case 1 -> "Configuration";
      case 2 -> "Concurrency";
      case 3 -> "Query";
      case 5 -> "Storage";
      case 6 -> "Metadata";
      case 7 -> "View";
      case 8 -> "Key";
      case 99 -> "Internal";
      default -> "Unknown";
    };
  }

  /**
   * Finds an ErrorCode by its numeric code, or INTERNAL_ERROR if not found.
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
