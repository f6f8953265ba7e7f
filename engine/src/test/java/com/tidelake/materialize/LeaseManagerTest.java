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

import com.tidelake.exception.LeaseTimeoutException;
import com.tidelake.exception.StorageWriteException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class LeaseManagerTest {
  private ExecutorService workers;
  private ExecutorService callers;

  @BeforeEach
  void setUp() {
    workers = Executors.newFixedThreadPool(2);
    callers = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    callers.shutdownNow();
    workers.shutdownNow();
  }

  @Test
  void concurrentRequestsShareOneComputation() throws Exception {
    final LeaseManager leases = new LeaseManager(workers, 10_000);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger executions = new AtomicInteger();

    final List<Future<String>> results = new ArrayList<>();
    for (int i = 0; i < 8; i++)
      results.add(callers.submit(() -> leases.acquire("log_entries/P1/0-60", () -> {
        executions.incrementAndGet();
        waitFor(release);
        return "done";
      })));

    await().atMost(Duration.ofSeconds(5)).until(() -> leases.getExecutionCount() + leases.getCoalescedCount() == 8);
    release.countDown();

    for (final Future<String> f : results)
      assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("done");
    assertThat(executions.get()).isEqualTo(1);
    assertThat(leases.getExecutionCount()).isEqualTo(1);
    assertThat(leases.getCoalescedCount()).isEqualTo(7);
    assertThat(leases.getInFlightCount()).isZero();
  }

  @Test
  void completedLeaseIsComputedAgain() {
    final LeaseManager leases = new LeaseManager(workers, 10_000);
    final AtomicInteger executions = new AtomicInteger();

    assertThat(leases.<Integer>acquire("k", executions::incrementAndGet)).isEqualTo(1);
    assertThat(leases.<Integer>acquire("k", executions::incrementAndGet)).isEqualTo(2);
    assertThat(leases.getInFlightCount()).isZero();
  }

  @Test
  void distinctKeysRunIndependently() throws Exception {
    final LeaseManager leases = new LeaseManager(workers, 10_000);
    final CountDownLatch bothRunning = new CountDownLatch(2);

    final Future<String> a = callers.submit(() -> leases.acquire("a", () -> {
      bothRunning.countDown();
      waitFor(bothRunning);
      return "a";
    }));
    final Future<String> b = callers.submit(() -> leases.acquire("b", () -> {
      bothRunning.countDown();
      waitFor(bothRunning);
      return "b";
    }));

    assertThat(a.get(5, TimeUnit.SECONDS)).isEqualTo("a");
    assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo("b");
    assertThat(leases.getCoalescedCount()).isZero();
  }

  @Test
  void waiterTimesOutWhileWorkCompletes() {
    final LeaseManager leases = new LeaseManager(workers, 50);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger completed = new AtomicInteger();

    assertThatThrownBy(() -> leases.acquire("slow", () -> {
      waitFor(release);
      return completed.incrementAndGet();
    })).isInstanceOf(LeaseTimeoutException.class).hasMessageContaining("slow");

    assertThat(leases.getInFlightCount()).isEqualTo(1);
    release.countDown();

    await().atMost(Duration.ofSeconds(5)).until(() -> completed.get() == 1 && leases.getInFlightCount() == 0);
  }

  @Test
  void failureReachesEveryWaiterAndReleasesTheLease() throws Exception {
    final LeaseManager leases = new LeaseManager(workers, 10_000);
    final CountDownLatch release = new CountDownLatch(1);

    final List<Future<Object>> results = new ArrayList<>();
    for (int i = 0; i < 3; i++)
      results.add(callers.submit(() -> leases.acquire("failing", () -> {
        waitFor(release);
        throw new StorageWriteException("views/x", "bucket unavailable", null);
      })));

    await().atMost(Duration.ofSeconds(5)).until(() -> leases.getExecutionCount() + leases.getCoalescedCount() == 3);
    release.countDown();

    for (final Future<Object> f : results)
      assertThatThrownBy(() -> f.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(StorageWriteException.class);
    assertThat(leases.getExecutionCount()).isEqualTo(1);

    assertThat(leases.<String>acquire("failing", () -> "recovered")).isEqualTo("recovered");
  }

  private static void waitFor(final CountDownLatch latch) {
    try {
      if (!latch.await(10, TimeUnit.SECONDS))
        throw new IllegalStateException("Latch not released");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
