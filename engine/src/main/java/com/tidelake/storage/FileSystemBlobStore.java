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

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Object storage on a local (or mounted) file system. Writes go to a temporary file in the target directory, then
 * replace the target with an atomic move, so readers see either the old or the new content.
 */
public class FileSystemBlobStore implements BlobStore {
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path root;

  public FileSystemBlobStore(final Path root) {
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (final IOException e) {
      throw new StorageWriteException(root.toString(), "Cannot create storage directory " + root, e);
    }
  }

  public Path getRoot() {
    return root;
  }

  @Override
  public void put(final String path, final byte[] content) {
    final Path target = resolve(path);
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TEMP_SUFFIX);
      Files.write(temp, content);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (final AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (final IOException e) {
      if (temp != null)
        try {
          Files.deleteIfExists(temp);
        } catch (final IOException cleanup) {
          e.addSuppressed(cleanup);
        }
      throw new StorageWriteException(path, "Error writing object '" + path + "'", e);
    }
  }

  @Override
  public byte[] get(final String path) {
    try {
      return Files.readAllBytes(resolve(path));
    } catch (final NoSuchFileException e) {
      throw new ObjectNotFoundException(path, e);
    } catch (final IOException e) {
      throw new StorageException(path, "Error reading object '" + path + "'", e);
    }
  }

  @Override
  public boolean exists(final String path) {
    return Files.isRegularFile(resolve(path));
  }

  @Override
  public long size(final String path) {
    try {
      return Files.size(resolve(path));
    } catch (final NoSuchFileException e) {
      return -1;
    } catch (final IOException e) {
      throw new StorageException(path, "Error reading size of object '" + path + "'", e);
    }
  }

  @Override
  public boolean delete(final String path) {
    try {
      return Files.deleteIfExists(resolve(path));
    } catch (final IOException e) {
      throw new StorageException(path, "Error deleting object '" + path + "'", e);
    }
  }

  @Override
  public List<String> list(final String prefix) {
    if (!Files.isDirectory(root))
      return List.of();
    try (final Stream<Path> files = Files.walk(root)) {
      return files.filter(Files::isRegularFile)
          .map(p -> root.relativize(p).toString().replace('\\', '/'))
          .filter(p -> p.startsWith(prefix) && !p.endsWith(TEMP_SUFFIX))
          .sorted()
          .collect(Collectors.toList());
    } catch (final IOException e) {
      throw new StorageException(prefix, "Error listing objects under '" + prefix + "'", e);
    }
  }

  private Path resolve(final String path) {
    final Path resolved = root.resolve(path).normalize();
    if (!resolved.startsWith(root))
      throw new StorageException(path, "Path '" + path + "' escapes the storage root", null);
    return resolved;
  }
}
