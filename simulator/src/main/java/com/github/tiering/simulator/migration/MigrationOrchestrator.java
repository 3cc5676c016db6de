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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.tiering.simulator.BasicSettings;
import com.github.tiering.simulator.BasicSettings.MigrationSettings;
import com.github.tiering.simulator.Tier;
import com.google.common.base.Stopwatch;
import com.google.common.collect.EvictingQueue;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;

/**
 * Composes the hotness tracker, candidate selector, queue and executor, and exposes them to the
 * simulation. Each served request is tracked; every few requests the simulation triggers a check
 * that proposes migrations, enqueues them and computes a delayed reward of the completed migrations
 * over the mean latency of the recent requests.
 */
public final class MigrationOrchestrator {
  private static final Logger logger = LogManager.getLogger(MigrationOrchestrator.class);

  private final MigrationCandidateSelector selector;
  private final EvictingQueue<Long> latencyWindow;
  private final MigrationExecutor executor;
  private final HotnessTracker tracker;
  private final MigrationQueue queue;
  private final DoubleList rewards;
  private final Duration shutdownTimeout;
  private final Duration drainTimeout;
  private final Duration pollInterval;
  private final int rewardWindow;

  private long requestCount;
  private long lastAccess;
  private long enqueued;
  private long dropped;
  private boolean started;
  private boolean stopped;

  public MigrationOrchestrator(HotnessTracker tracker, MigrationCandidateSelector selector,
      MigrationQueue queue, MigrationExecutor executor, int rewardWindow,
      Duration pollInterval, Duration drainTimeout, Duration shutdownTimeout) {
    checkArgument(rewardWindow > 0, "reward window must be positive");
    this.latencyWindow = EvictingQueue.create(rewardWindow);
    this.shutdownTimeout = requireNonNull(shutdownTimeout);
    this.drainTimeout = requireNonNull(drainTimeout);
    this.pollInterval = requireNonNull(pollInterval);
    this.executor = requireNonNull(executor);
    this.selector = requireNonNull(selector);
    this.tracker = requireNonNull(tracker);
    this.queue = requireNonNull(queue);
    this.rewards = new DoubleArrayList();
    this.rewardWindow = rewardWindow;
  }

  /** Returns an orchestrator for the configured migration settings and tier capacities. */
  public static MigrationOrchestrator from(BasicSettings settings,
      long fastCapacity, long midCapacity) {
    MigrationSettings migration = settings.migration();
    HotnessTracker tracker = new HotnessTracker(migration.hotThreshold(),
        migration.coldThreshold(), migration.historySize());
    MigrationCandidateSelector selector = new MigrationCandidateSelector(tracker, fastCapacity,
        midCapacity, migration.minAccessCount(), migration.headroom(), migration.candidateLimit());
    MigrationQueue queue = new MigrationQueue(migration.queueSize());
    MigrationExecutor executor = new MigrationExecutor(queue, tracker, migration.pollInterval());
    return new MigrationOrchestrator(tracker, selector, queue, executor, migration.rewardWindow(),
        migration.pollInterval(), migration.drainTimeout(), migration.shutdownTimeout());
  }

  /** Starts the background executor. */
  public synchronized void start() {
    checkState(!started, "The migration orchestrator was already started");
    executor.start();
    started = true;
  }

  /**
   * Records a served request.
   *
   * @param latency the request's served time, in virtual nanoseconds
   * @param now the virtual time the request completed
   */
  public void trackRequest(long address, Tier tier, long latency, long size, long now) {
    tracker.record(address, tier, latency, size, now);
    synchronized (this) {
      latencyWindow.add(latency);
      lastAccess = now;
      requestCount++;
    }
  }

  /**
   * Proposes and enqueues migrations for the current tier usage, then computes the delayed reward.
   * Enqueuing stops at the first candidate the full queue rejects.
   *
   * @param midUsage the bytes in use by the solid-state tier
   * @param fastUsage the bytes in use by the volatile tier
   */
  public synchronized MigrationCycle periodicUpdate(long midUsage, long fastUsage) {
    List<MigrationCandidate> candidates = selector.select(midUsage, fastUsage, lastAccess);
    int accepted = 0;
    for (MigrationCandidate candidate : candidates) {
      if (!queue.enqueue(candidate)) {
        break;
      }
      accepted++;
    }
    enqueued += accepted;
    dropped += candidates.size() - accepted;
    if ((accepted > 0) && logger.isDebugEnabled()) {
      logger.debug("Enqueued {} of {} migrations", accepted, candidates.size());
      for (MigrationCandidate candidate : candidates.subList(0, Math.min(3, accepted))) {
        logger.debug("  Address {}: {} -> {} (score: {})", candidate.address(),
            candidate.currentTier().device(), candidate.targetTier().device(), candidate.score());
      }
    }

    OptionalDouble reward = delayedReward();
    if (reward.isPresent()) {
      rewards.add(reward.getAsDouble());
      logger.debug(String.format(US, "Migration reward: %.2f", reward.getAsDouble()));
    }
    return new MigrationCycle(candidates, accepted, reward);
  }

  /** Returns the reward, defined once the latency window is full and a migration completed. */
  private OptionalDouble delayedReward() {
    long completed = executor.completed();
    if ((latencyWindow.size() < rewardWindow) || (completed == 0)) {
      return OptionalDouble.empty();
    }
    double sum = 0;
    for (long latency : latencyWindow) {
      sum += latency;
    }
    double averageLatency = Math.max(sum / latencyWindow.size(), 1e-9);
    return OptionalDouble.of(completed / (averageLatency / 1e9));
  }

  /** Returns the current statistics of the migration subsystem. */
  public MigrationStatistics statistics() {
    MigrationStatistics.Builder builder = MigrationStatistics.builder();
    for (AddressStats stats : tracker.snapshot()) {
      Hotness hotness = tracker.classifyCount(stats.accessCount());
      if (hotness == Hotness.HOT) {
        builder.hotAddresses++;
      } else if (hotness == Hotness.COLD) {
        builder.coldAddresses++;
      }
      if (stats.migrationCount() > 0) {
        builder.addressesMigrated++;
      }
      builder.totalMigrations += stats.migrationCount();
      builder.totalAccesses += stats.accessCount();
      builder.addressesTracked++;
    }
    synchronized (this) {
      builder.totalRequests = requestCount;
      builder.migrationsEnqueued = enqueued;
      builder.migrationsDropped = dropped;
      builder.averageReward = rewards.isEmpty() ? 0.0 : sum(rewards) / rewards.size();
    }
    builder.migrationsCompleted = executor.completed();
    builder.queueSize = queue.size();
    builder.queueFull = queue.isFull();
    return builder.build();
  }

  /**
   * Waits, up to the drain timeout, for the queued migrations to be applied, then stops the
   * executor and returns the final statistics. Later calls only return the current statistics.
   */
  public MigrationStatistics shutdown() {
    boolean wasStarted;
    synchronized (this) {
      if (stopped) {
        return statistics();
      }
      stopped = true;
      wasStarted = started;
    }
    if (wasStarted) {
      drain();
      executor.stop(shutdownTimeout);
    }
    MigrationStatistics statistics = statistics();
    logger.info("Migration subsystem stopped: {}", statistics);
    return statistics;
  }

  private void drain() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    while (executor.completed() < enqueued()) {
      if (stopwatch.elapsed().compareTo(drainTimeout) >= 0) {
        logger.warn("{} migrations were still pending after {} ms",
            enqueued() - executor.completed(), drainTimeout.toMillis());
        return;
      }
      try {
        TimeUnit.NANOSECONDS.sleep(Math.max(pollInterval.toNanos(), 1_000_000L));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  private synchronized long enqueued() {
    return enqueued;
  }

  private static double sum(DoubleList values) {
    double sum = 0;
    for (int i = 0; i < values.size(); i++) {
      sum += values.getDouble(i);
    }
    return sum;
  }

  public HotnessTracker tracker() {
    return tracker;
  }

  public MigrationQueue queue() {
    return queue;
  }

  public MigrationExecutor executor() {
    return executor;
  }
}
