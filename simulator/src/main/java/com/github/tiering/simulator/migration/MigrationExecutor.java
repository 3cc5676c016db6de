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
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Applies queued migrations on a background thread that runs on wall-clock time, independent of
 * the simulation's virtual clock. Applying a migration moves the address to its target tier in the
 * {@link HotnessTracker} and counts it as completed.
 * <p>
 * The executor may be started once and stopped once. A stop waits, up to a bound, for the current
 * iteration to finish; when it returns normally no further migrations are applied.
 */
public final class MigrationExecutor {
  private static final Logger logger = LogManager.getLogger(MigrationExecutor.class);

  private final ThreadFactory threadFactory;
  private final HotnessTracker tracker;
  private final MigrationQueue queue;
  private final AtomicLong completed;
  private final Duration pollInterval;

  private volatile boolean running;
  private Thread thread;
  private boolean stopped;

  public MigrationExecutor(MigrationQueue queue, HotnessTracker tracker, Duration pollInterval) {
    checkArgument(!pollInterval.isNegative(), "poll interval must be non-negative");
    this.threadFactory = new ThreadFactoryBuilder()
        .setNameFormat("migration-executor-%d")
        .setDaemon(true)
        .build();
    this.pollInterval = pollInterval;
    this.tracker = requireNonNull(tracker);
    this.queue = requireNonNull(queue);
    this.completed = new AtomicLong();
  }

  /** Starts the background worker. */
  public synchronized void start() {
    checkState(thread == null, "The migration executor was already started");
    running = true;
    thread = threadFactory.newThread(this::runLoop);
    thread.start();
  }

  /**
   * Stops the background worker, waiting up to the timeout for it to exit.
   *
   * @return whether the worker exited within the timeout
   */
  public synchronized boolean stop(Duration timeout) {
    checkState(thread != null, "The migration executor was not started");
    checkState(!stopped, "The migration executor was already stopped");
    stopped = true;
    running = false;
    thread.interrupt();
    try {
      thread.join(Math.max(1, timeout.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (thread.isAlive()) {
      logger.warn("The migration executor did not stop within {} ms", timeout.toMillis());
      return false;
    }
    return true;
  }

  /**
   * Applies the oldest queued migration, if any.
   *
   * @return whether a migration was applied
   */
  boolean applyNext() {
    Optional<MigrationCandidate> candidate = queue.dequeue();
    if (!candidate.isPresent()) {
      return false;
    }
    MigrationCandidate migration = candidate.get();
    if (!tracker.applyMigration(migration.address(), migration.targetTier())) {
      logger.debug("Migrated untracked address {}", migration.address());
    }
    completed.incrementAndGet();
    return true;
  }

  private void runLoop() {
    while (running) {
      if (!applyNext()) {
        try {
          TimeUnit.NANOSECONDS.sleep(pollInterval.toNanos());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  /** Returns the number of migrations applied so far. */
  public long completed() {
    return completed.get();
  }

  public boolean isRunning() {
    return running;
  }
}
