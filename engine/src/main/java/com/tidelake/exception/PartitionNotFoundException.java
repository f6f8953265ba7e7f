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
 * No materialized partition covers the requested range. The query bridge translates it into an empty result.
 */
public class PartitionNotFoundException extends LakehouseException {
  public PartitionNotFoundException(final String viewName, final String instanceId, final String range) {
    super(ErrorCode.PARTITION_NOT_FOUND, "No partition found for view '" + viewName + "' instance '" + instanceId + "' in " + range);
    addContext("view", viewName);
    addContext("instance", instanceId);
  }

  /**
   * The partition is registered but its file is gone, usually collected after the scan listed it.
   */
  public PartitionNotFoundException(final String viewName, final String instanceId, final String filePath, final Throwable cause) {
    super(ErrorCode.PARTITION_NOT_FOUND, "File '" + filePath + "' of a partition of view '" + viewName + "' instance '" + instanceId + "' not found",
        cause);
    addContext("view", viewName);
    addContext("instance", instanceId);
    addContext("path", filePath);
  }
}
