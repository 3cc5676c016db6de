/*
 * Copyright 2026 The Tiering Simulator Authors. All Rights Reserved.
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
 */
package com.github.tiering.simulator.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.github.tiering.simulator.Tier;

public final class MigrationExecutorTest {

  @Test
  void appliesQueuedMigrations() {
    HotnessTracker tracker = new HotnessTracker(5, 1, 10);
    tracker.record(1, Tier.SLOW, 10, 100, 0);
    MigrationQueue queue = new MigrationQueue(10);
    MigrationExecutor executor = new MigrationExecutor(queue, tracker, Duration.ofMillis(1));
    queue.enqueue(new MigrationCandidate(1, Tier.SLOW, Tier.MID, 5, 0));

    assertThat(executor.applyNext()).isTrue();
    assertThat(executor.applyNext()).isFalse();

    assertThat(executor.completed()).isEqualTo(1);
    assertThat(tracker.stats(1).get().tier()).isEqualTo(Tier.MID);
    assertThat(tracker.stats(1).get().migrationCount()).isEqualTo(1);
    assertThat(tracker.stats(1).get().accessCount()).isEqualTo(1);
  }

  @Test
  void drainsInTheBackground() throws InterruptedException {
    HotnessTracker tracker = new HotnessTracker(5, 1, 10);
    MigrationQueue queue = new MigrationQueue(10);
    MigrationExecutor executor = new MigrationExecutor(queue, tracker, Duration.ofMillis(1));
    for (long address = 0; address < 5; address++) {
      tracker.record(address, Tier.SLOW, 10, 100, 0);
      queue.enqueue(new MigrationCandidate(address, Tier.SLOW, Tier.MID, 5, 0));
    }

    executor.start();
    long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
    while ((executor.completed() < 5) && (System.nanoTime() < deadline)) {
      Thread.sleep(1);
    }
    assertThat(executor.stop(Duration.ofSeconds(5))).isTrue();

    assertThat(executor.completed()).isEqualTo(5);
    assertThat(queue.isEmpty()).isTrue();
    assertThat(executor.isRunning()).isFalse();
  }

  @Test
  void noMigrationIsAppliedAfterStop() throws InterruptedException {
    HotnessTracker tracker = new HotnessTracker(5, 1, 10);
    MigrationQueue queue = new MigrationQueue(10);
    MigrationExecutor executor = new MigrationExecutor(queue, tracker, Duration.ofMillis(1));
    executor.start();
    assertThat(executor.stop(Duration.ofSeconds(5))).isTrue();

    queue.enqueue(new MigrationCandidate(1, Tier.SLOW, Tier.MID, 5, 0));
    Thread.sleep(50);

    assertThat(queue.size()).isEqualTo(1);
    assertThat(executor.completed()).isZero();
  }

  @Test
  void startsOnceAndStopsOnce() {
    MigrationExecutor executor = new MigrationExecutor(new MigrationQueue(1),
        new HotnessTracker(5, 1, 10), Duration.ofMillis(1));
    assertThatThrownBy(() -> executor.stop(Duration.ofSeconds(1)))
        .isInstanceOf(IllegalStateException.class);

    executor.start();
    assertThatThrownBy(executor::start).isInstanceOf(IllegalStateException.class);
    executor.stop(Duration.ofSeconds(5));
    assertThatThrownBy(() -> executor.stop(Duration.ofSeconds(1)))
        .isInstanceOf(IllegalStateException.class);
  }
}
