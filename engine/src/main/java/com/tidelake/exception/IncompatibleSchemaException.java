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
 * Signals that a partition was written under a schema fingerprint different from the current view definition. The
 * partition gets retired, the caller does not crash.
 */
public class IncompatibleSchemaException extends LakehouseException {
  private final String expectedFingerprint;
  private final String actualFingerprint;

  public IncompatibleSchemaException(final String viewName, final String expectedFingerprint, final String actualFingerprint) {
    super(ErrorCode.INCOMPATIBLE_SCHEMA,
        "Partition of view '" + viewName + "' has schema " + actualFingerprint + " but the view expects " + expectedFingerprint);
    this.expectedFingerprint = expectedFingerprint;
    this.actualFingerprint = actualFingerprint;
    addContext("view", viewName);
  }

  public String getExpectedFingerprint() {
    return expectedFingerprint;
  }

  public String getActualFingerprint() {
    return actualFingerprint;
  }
}
