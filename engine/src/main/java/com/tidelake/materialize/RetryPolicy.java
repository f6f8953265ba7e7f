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
package com.tidelake.materialize;

import com.tidelake.ContextConfiguration;
import com.tidelake.GlobalConfiguration;
import com.tidelake.exception.ConfigurationException;
import com.tidelake.exception.LakehouseException;
import com.tidelake.exception.StorageException;
import com.tidelake.log.LogManager;

import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * Bounded exponential backoff for object storage operations. Only retryable {@link StorageException}s are retried,
 * anything else is propagated at once.
 */
public class RetryPolicy {
  private final int  attempts;
  private final long initialBackoffMs;
  private final long maxBackoffMs;

  public RetryPolicy(final int attempts, final long initialBackoffMs, final long maxBackoffMs) {
    if (attempts < 1)
      throw new IllegalArgumentException("At least one attempt is required");
    this.attempts = attempts;
    this.initialBackoffMs = initialBackoffMs;
    this.maxBackoffMs = maxBackoffMs;
  }

  /**
   * @throws ConfigurationException if the attempts or the backoffs are out of range
   */
  public static RetryPolicy fromConfiguration(final ContextConfiguration configuration) {
    final int attempts = configuration.getValueAsInteger(GlobalConfiguration.STORAGE_RETRY_ATTEMPTS);
    if (attempts < 1)
      throw new ConfigurationException(GlobalConfiguration.STORAGE_RETRY_ATTEMPTS.getKey() + " configuration is invalid (" + attempts + ")");

    final long backoff = configuration.getValueAsLong(GlobalConfiguration.STORAGE_RETRY_BACKOFF);
    final long maxBackoff = configuration.getValueAsLong(GlobalConfiguration.STORAGE_RETRY_MAX_BACKOFF);
    if (backoff < 0 || maxBackoff < backoff)
      throw new ConfigurationException(
          GlobalConfiguration.STORAGE_RETRY_BACKOFF.getKey() + " and " + GlobalConfiguration.STORAGE_RETRY_MAX_BACKOFF.getKey()
              + " configuration is invalid (" + backoff + ", " + maxBackoff + ")");

    return new RetryPolicy(attempts, backoff, maxBackoff);
  }

  public int getAttempts() {
    return attempts;
  }

  public void run(final String description, final Runnable operation) {
    execute(description, () -> {
      operation.run();
      return null;
    });
  }

  public <T> T execute(final String description, final Supplier<T> operation) {
    long backoff = initialBackoffMs;
    for (int attempt = 1; ; attempt++) {
      try {
        return operation.get();
      } catch (final StorageException e) {
        if (!e.isRetryable() || attempt >= attempts)
          throw e;

        LogManager.instance().log(this, Level.WARNING, "Attempt %d/%d of %s failed (%s), retrying in %dms", null, attempt, attempts,
            description, e.getMessage(), backoff);
        sleep(backoff);
        backoff = Math.min(backoff * 2, maxBackoffMs);
      }
    }
  }

  private static void sleep(final long ms) {
    if (ms <= 0)
      return;
    try {
      Thread.sleep(ms);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LakehouseException("Interrupted while waiting to retry", e);
    }
  }
}
