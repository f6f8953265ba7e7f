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

import com.tidelake.exception.LakehouseException;
import com.tidelake.exception.LeaseTimeoutException;
import com.tidelake.log.LogManager;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * Coalesces concurrent requests for the same lease onto one in-flight computation. The first caller submits the work to
 * the executor, every caller (the first included) waits on the same future. The entry is removed once the work
 * completes, so a later request computes again and sees the registered partitions.
 * <p>
 * A waiter that times out or is interrupted only stops waiting: the work keeps running to completion.
 */
public class LeaseManager {
  private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
  private final Executor                               executor;
  private final long                                   timeoutMs;
  private final AtomicLong                             executions = new AtomicLong();
  private final AtomicLong                             coalesced  = new AtomicLong();

  public LeaseManager(final Executor executor, final long timeoutMs) {
    this.executor = executor;
    this.timeoutMs = timeoutMs;
  }

  /**
   * @throws LeaseTimeoutException if the computation does not complete within the lease timeout
   */
  @SuppressWarnings("unchecked")
  public <T> T acquire(final String leaseKey, final Supplier<T> work) {
    final CompletableFuture<Object> created = new CompletableFuture<>();
    final CompletableFuture<Object> existing = inFlight.putIfAbsent(leaseKey, created);

    final CompletableFuture<Object> future;
    if (existing == null) {
      future = created;
      executions.incrementAndGet();
      try {
        executor.execute(() -> run(leaseKey, created, work));
      } catch (final RuntimeException e) {
        inFlight.remove(leaseKey, created);
        created.completeExceptionally(e);
      }
    } else {
      future = existing;
      coalesced.incrementAndGet();
      LogManager.instance().log(this, Level.FINE, "Waiting for in-flight materialization '%s'", null, leaseKey);
    }

    try {
      return (T) future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      throw new LeaseTimeoutException(leaseKey, timeoutMs);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LakehouseException("Interrupted while waiting for '" + leaseKey + "'", e);
    } catch (final ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException)
        throw (RuntimeException) cause;
      if (cause instanceof Error)
        throw (Error) cause;
      throw new LakehouseException("Error on materialization '" + leaseKey + "'", cause);
    }
  }

  private <T> void run(final String leaseKey, final CompletableFuture<Object> future, final Supplier<T> work) {
    final Object result;
    try {
      result = work.get();
    } catch (final Throwable e) {
      // RELEASE BEFORE COMPLETING: A CALLER WOKEN UP BY THE FAILURE MAY TRY AGAIN RIGHT AWAY
      inFlight.remove(leaseKey, future);
      future.completeExceptionally(e);
      return;
    }
    inFlight.remove(leaseKey, future);
    future.complete(result);
  }

  /**
   * Number of computations actually executed.
   */
  public long getExecutionCount() {
    return executions.get();
  }

  /**
   * Number of requests served by a computation started by another caller.
   */
  public long getCoalescedCount() {
    return coalesced.get();
  }

  public int getInFlightCount() {
    return inFlight.size();
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }
}
