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
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.github.tiering.simulator.SettingsFixture;
import com.github.tiering.simulator.Tier;

public final class MigrationOrchestratorTest {
  private static final Duration POLL = Duration.ofMillis(1);

  @Test
  void proposesHotAddressOnPeriodicUpdate() {
    MigrationOrchestrator orchestrator = orchestrator(10, 50);
    for (int i = 0; i < 5; i++) {
      orchestrator.trackRequest(1, Tier.SLOW, 1_000, 100, i);
    }
    orchestrator.trackRequest(2, Tier.SLOW, 1_000, 100, 5);

    MigrationCycle cycle = orchestrator.periodicUpdate(0, 0);

    assertThat(cycle.candidates()).extracting(MigrationCandidate::address).containsExactly(1L);
    assertThat(cycle.enqueued()).isEqualTo(1);
    assertThat(cycle.dropped()).isZero();
    assertThat(cycle.reward()).isEmpty();
    assertThat(cycle.candidates().get(0).identifiedAt()).isEqualTo(5);
    assertThat(orchestrator.queue().size()).isEqualTo(1);
  }

  @Test
  void dropsCandidatesWhenTheQueueIsFull() {
    MigrationOrchestrator orchestrator = orchestrator(1, 50);
    for (long address = 1; address <= 3; address++) {
      for (int i = 0; i < 5 + address; i++) {
        orchestrator.trackRequest(address, Tier.SLOW, 1_000, 100, i);
      }
    }

    MigrationCycle cycle = orchestrator.periodicUpdate(0, 0);

    assertThat(cycle.enqueued()).isEqualTo(1);
    assertThat(cycle.dropped()).isEqualTo(2);
    assertThat(orchestrator.queue().candidates())
        .extracting(MigrationCandidate::address).containsExactly(3L);
    MigrationStatistics statistics = orchestrator.statistics();
    assertThat(statistics.migrationsEnqueued()).isEqualTo(1);
    assertThat(statistics.migrationsDropped()).isEqualTo(2);
    assertThat(statistics.queueFull()).isTrue();
  }

  @Test
  void rewardRequiresAFullWindowAndACompletedMigration() {
    MigrationOrchestrator orchestrator = orchestrator(10, 4);
    for (int i = 0; i < 3; i++) {
      orchestrator.trackRequest(1, Tier.SLOW, 1_000_000, 100, i);
    }
    assertThat(orchestrator.periodicUpdate(0, 0).reward()).isEmpty();

    orchestrator.trackRequest(1, Tier.SLOW, 1_000_000, 100, 3);
    assertThat(orchestrator.periodicUpdate(0, 0).reward()).isEmpty();

    orchestrator.trackRequest(1, Tier.SLOW, 1_000_000, 100, 4);
    MigrationCycle cycle = orchestrator.periodicUpdate(0, 0);
    assertThat(cycle.enqueued()).isEqualTo(1);
    assertThat(orchestrator.executor().applyNext()).isTrue();

    MigrationCycle rewarded = orchestrator.periodicUpdate(0, 0);

    assertThat(rewarded.reward()).isPresent();
    assertThat(rewarded.reward().getAsDouble()).isCloseTo(1_000.0, within(1e-6));
    assertThat(orchestrator.statistics().averageReward()).isCloseTo(1_000.0, within(1e-6));
  }

  @Test
  void statisticsSummarizeTheTrackedAddresses() {
    MigrationOrchestrator orchestrator = orchestrator(10, 50);
    for (int i = 0; i < 6; i++) {
      orchestrator.trackRequest(1, Tier.SLOW, 10, 100, i);
    }
    orchestrator.trackRequest(2, Tier.MID, 10, 100, 6);
    orchestrator.trackRequest(3, Tier.MID, 10, 100, 7);
    orchestrator.trackRequest(3, Tier.MID, 10, 100, 8);
    orchestrator.periodicUpdate(0, 0);
    orchestrator.executor().applyNext();

    MigrationStatistics statistics = orchestrator.statistics();

    assertThat(statistics.addressesTracked()).isEqualTo(3);
    assertThat(statistics.hotAddresses()).isEqualTo(1);
    assertThat(statistics.coldAddresses()).isEqualTo(1);
    assertThat(statistics.totalAccesses()).isEqualTo(9);
    assertThat(statistics.totalRequests()).isEqualTo(9);
    assertThat(statistics.migrationsEnqueued()).isEqualTo(1);
    assertThat(statistics.migrationsCompleted()).isEqualTo(1);
    assertThat(statistics.addressesMigrated()).isEqualTo(1);
    assertThat(statistics.totalMigrations()).isEqualTo(1);
    assertThat(statistics.queueSize()).isZero();
    assertThat(statistics.averageReward()).isZero();
  }

  @Test
  void shutdownDrainsTheQueue() {
    MigrationOrchestrator orchestrator = MigrationOrchestrator.from(SettingsFixture.settings()
        .with("migration.poll-interval", "1ms")
        .build(), 1_000, 1_000_000);
    orchestrator.start();
    for (int i = 0; i < 10; i++) {
      orchestrator.trackRequest(1, Tier.SLOW, 10, 100, i);
    }
    orchestrator.periodicUpdate(0, 0);

    MigrationStatistics statistics = orchestrator.shutdown();

    assertThat(statistics.migrationsEnqueued()).isEqualTo(1);
    assertThat(statistics.migrationsCompleted()).isEqualTo(1);
    assertThat(orchestrator.tracker().stats(1).get().migrationCount()).isEqualTo(1);
    assertThat(orchestrator.tracker().stats(1).get().tier()).isEqualTo(Tier.MID);
    assertThat(orchestrator.executor().isRunning()).isFalse();
  }

  @Test
  void shutdownIsIdempotent() {
    MigrationOrchestrator orchestrator = orchestrator(10, 50);
    orchestrator.start();
    for (int i = 0; i < 5; i++) {
      orchestrator.trackRequest(1, Tier.SLOW, 10, 100, i);
    }
    orchestrator.periodicUpdate(0, 0);

    MigrationStatistics first = orchestrator.shutdown();
    MigrationStatistics second = orchestrator.shutdown();

    assertThat(second.migrationsEnqueued()).isEqualTo(first.migrationsEnqueued());
    assertThat(second.migrationsCompleted()).isEqualTo(first.migrationsCompleted());
    assertThat(second.totalRequests()).isEqualTo(5);
    assertThat(orchestrator.executor().isRunning()).isFalse();
  }

  @Test
  void shutdownWithoutStart() {
    MigrationOrchestrator orchestrator = orchestrator(10, 50);
    orchestrator.trackRequest(1, Tier.SLOW, 10, 100, 0);

    assertThat(orchestrator.shutdown().totalRequests()).isEqualTo(1);
    assertThat(orchestrator.shutdown().totalRequests()).isEqualTo(1);
  }

  private static MigrationOrchestrator orchestrator(int queueSize, int rewardWindow) {
    HotnessTracker tracker = new HotnessTracker(5, 1, 100);
    MigrationCandidateSelector selector =
        new MigrationCandidateSelector(tracker, 1_000, 1_000_000, 5, 0.9, 10);
    MigrationQueue queue = new MigrationQueue(queueSize);
    MigrationExecutor executor = new MigrationExecutor(queue, tracker, POLL);
    return new MigrationOrchestrator(tracker, selector, queue, executor, rewardWindow,
        POLL, Duration.ofSeconds(5), Duration.ofSeconds(5));
  }
}
