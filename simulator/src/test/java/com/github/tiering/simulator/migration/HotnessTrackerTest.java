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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.github.tiering.simulator.Tier;

public final class HotnessTrackerTest {

  @Test
  void classifiesByAccessCount() {
    HotnessTracker tracker = new HotnessTracker(5, 1, 100);

    assertThat(tracker.classify(99)).isEqualTo(Hotness.COLD);
    tracker.record(1, Tier.SLOW, 10, 100, 0);
    assertThat(tracker.classify(1)).isEqualTo(Hotness.COLD);
    tracker.record(1, Tier.SLOW, 10, 100, 1);
    assertThat(tracker.classify(1)).isEqualTo(Hotness.WARM);
    for (int i = 0; i < 3; i++) {
      tracker.record(1, Tier.SLOW, 10, 100, 2 + i);
    }
    assertThat(tracker.classify(1)).isEqualTo(Hotness.HOT);

    assertThat(tracker.classifyCount(3)).isEqualTo(Hotness.WARM);
    assertThat(tracker.classifyCount(0)).isEqualTo(Hotness.COLD);
  }

  @Test
  void recordsStatistics() {
    HotnessTracker tracker = new HotnessTracker(5, 1, 3);
    for (int i = 1; i <= 5; i++) {
      tracker.record(7, (i < 5) ? Tier.SLOW : Tier.MID, 100 * i, 4096, 10 * i);
    }

    AddressStats stats = tracker.stats(7).get();
    assertThat(stats.accessCount()).isEqualTo(5);
    assertThat(stats.totalLatency()).isEqualTo(1_500);
    assertThat(stats.tier()).isEqualTo(Tier.MID);
    assertThat(stats.firstAccess()).isEqualTo(10);
    assertThat(stats.lastAccess()).isEqualTo(50);
    assertThat(stats.recentAccesses()).containsExactly(30L, 40L, 50L);
    assertThat(stats.size()).isEqualTo(4096);
    assertThat(stats.migrationCount()).isZero();
    assertThat(tracker.stats(8)).isEmpty();
  }

  @Test
  void snapshotIsDetached() {
    HotnessTracker tracker = new HotnessTracker(5, 1, 10);
    tracker.record(1, Tier.SLOW, 10, 100, 0);
    tracker.record(2, Tier.MID, 10, 100, 0);

    List<AddressStats> snapshot = tracker.snapshot();
    tracker.record(1, Tier.MID, 10, 100, 1);
    tracker.applyMigration(2, Tier.FAST);
    tracker.record(3, Tier.SLOW, 10, 100, 1);

    assertThat(snapshot).extracting(AddressStats::address).containsExactly(1L, 2L);
    assertThat(snapshot.get(0).accessCount()).isEqualTo(1);
    assertThat(snapshot.get(0).tier()).isEqualTo(Tier.SLOW);
    assertThat(snapshot.get(1).migrationCount()).isZero();
    assertThat(snapshot.get(1).recentAccesses()).containsExactly(0L);
  }

  @Test
  void applyMigrationMovesWithoutCountingAnAccess() {
    HotnessTracker tracker = new HotnessTracker(5, 1, 10);
    tracker.record(1, Tier.SLOW, 10, 100, 0);

    assertThat(tracker.applyMigration(1, Tier.MID)).isTrue();
    assertThat(tracker.applyMigration(2, Tier.MID)).isFalse();

    AddressStats stats = tracker.stats(1).get();
    assertThat(stats.tier()).isEqualTo(Tier.MID);
    assertThat(stats.migrationCount()).isEqualTo(1);
    assertThat(stats.accessCount()).isEqualTo(1);
    assertThat(tracker.size()).isEqualTo(1);
  }

  @Test
  void concurrentRecordsSerialize() throws Exception {
    HotnessTracker tracker = new HotnessTracker(5, 1, 100);
    int threads = 8;
    int records = 10_000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < records; i++) {
            tracker.record(1, Tier.SLOW, 1, 100, i);
            assertThat(tracker.classify(1)).isNotNull();
          }
          return null;
        }));
      }
      futures.add(executor.submit(() -> {
        start.await();
        for (int i = 0; i < records; i++) {
          tracker.applyMigration(1, Tier.MID);
        }
        return null;
      }));
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    AddressStats stats = tracker.stats(1).get();
    assertThat(stats.accessCount()).isEqualTo((long) threads * records);
    assertThat(stats.totalLatency()).isEqualTo((long) threads * records);
    assertThat(stats.migrationCount()).isEqualTo(records);
  }

  @Test
  void thresholdsMustBeOrdered() {
    assertThatThrownBy(() -> new HotnessTracker(1, 1, 10))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
