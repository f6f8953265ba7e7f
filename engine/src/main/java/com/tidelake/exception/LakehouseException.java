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

import com.tidelake.serializer.json.JSONObject;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Base exception class for all lakehouse exceptions.
 * Provides standardized error codes and diagnostic context.
 */
public class LakehouseException extends RuntimeException {
  private final ErrorCode           errorCode;
  private final Map<String, Object> context;

  public LakehouseException(final String message) {
    this(ErrorCode.INTERNAL_ERROR, message);
  }

  public LakehouseException(final String message, final Throwable cause) {
    this(ErrorCode.INTERNAL_ERROR, message, cause);
  }

  public LakehouseException(final ErrorCode errorCode, final String message) {
    super(message);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
    this.context = new HashMap<>();
  }

  public LakehouseException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
    this.context = new HashMap<>();
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the diagnostic context for this exception.
   *
   * @return unmodifiable map of context information
   */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /**
   * Adds a context entry to this exception.
   *
   * @return this exception for method chaining
   */
  public LakehouseException addContext(final String key, final Object value) {
    if (key != null)
      this.context.put(key, value);
    return this;
  }

  /**
   * Tells if the operation that raised this exception can be retried as is.
   */
  public boolean isRetryable() {
    return false;
  }

  public JSONObject toJSON() {
    final JSONObject json = new JSONObject();
    json.put("errorCode", errorCode.getCode());
    json.put("errorName", errorCode.name());
    json.put("category", errorCode.getCategory());
    json.put("message", getMessage());
    if (!context.isEmpty()) {
      final JSONObject ctx = new JSONObject();
      for (final Map.Entry<String, Object> entry : context.entrySet())
        ctx.put(entry.getKey(), entry.getValue() instanceof Number || entry.getValue() instanceof Boolean ?
            entry.getValue() :
            String.valueOf(entry.getValue()));
      json.put("context", ctx);
    }
    if (getCause() != null)
      json.put("cause", String.valueOf(getCause().getMessage()));
    return json;
  }

  @Override
  public String toString() {
    return String.format("%s [%s-%d]: %s", getClass().getSimpleName(), errorCode.getCategory(), errorCode.getCode(), getMessage());
  }
}
