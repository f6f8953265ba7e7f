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
 * The object does not exist in the object storage. Not retried: the object will not appear by reading again.
 */
public class ObjectNotFoundException extends StorageException {
  public ObjectNotFoundException(final String path, final Throwable cause) {
    super(ErrorCode.OBJECT_NOT_FOUND, path, "Object '" + path + "' not found", cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
