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
package com.tidelake.storage;

import com.tidelake.exception.ObjectNotFoundException;
import com.tidelake.exception.StorageException;
import com.tidelake.exception.StorageWriteException;

import java.util.List;

/**
 * Object storage holding block payloads and partition files. Paths are relative, '/' separated. A put either stores the
 * whole content or leaves the previous content at that path untouched.
 */
public interface BlobStore {

  /**
   * @throws StorageWriteException if the content cannot be stored
   */
  void put(String path, byte[] content);

  /**
   * @throws ObjectNotFoundException if the object does not exist
   * @throws StorageException        if the object cannot be read
   */
  byte[] get(String path);

  boolean exists(String path);

  /**
   * Size in bytes of the object, or -1 if it does not exist.
   */
  long size(String path);

  /**
   * @return true if the object existed
   *
   * @throws StorageException if the object exists but cannot be deleted
   */
  boolean delete(String path);

  /**
   * Paths of the objects under the prefix, sorted.
   */
  List<String> list(String prefix);
}
