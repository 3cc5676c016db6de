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

import com.google.common.base.MoreObjects;

/**
 * A point-in-time summary of the migration subsystem.
 */
public final class MigrationStatistics {
  private final long addressesTracked;
  private final long hotAddresses;
  private final long coldAddresses;
  private final long totalAccesses;
  private final long totalRequests;
  private final long migrationsEnqueued;
  private final long migrationsCompleted;
  private final long migrationsDropped;
  private final long addressesMigrated;
  private final long totalMigrations;
  private final int queueSize;
  private final boolean queueFull;
  private final double averageReward;

  private MigrationStatistics(Builder builder) {
    this.addressesTracked = builder.addressesTracked;
    this.hotAddresses = builder.hotAddresses;
    this.coldAddresses = builder.coldAddresses;
    this.totalAccesses = builder.totalAccesses;
    this.totalRequests = builder.totalRequests;
    this.migrationsEnqueued = builder.migrationsEnqueued;
    this.migrationsCompleted = builder.migrationsCompleted;
    this.migrationsDropped = builder.migrationsDropped;
    this.addressesMigrated = builder.addressesMigrated;
    this.totalMigrations = builder.totalMigrations;
    this.queueSize = builder.queueSize;
    this.queueFull = builder.queueFull;
    this.averageReward = builder.averageReward;
  }

  public long addressesTracked() {
    return addressesTracked;
  }

  public long hotAddresses() {
    return hotAddresses;
  }

  public long coldAddresses() {
    return coldAddresses;
  }

  /** Returns the sum of the access counts of every tracked address. */
  public long totalAccesses() {
    return totalAccesses;
  }

  public long totalRequests() {
    return totalRequests;
  }

  public long migrationsEnqueued() {
    return migrationsEnqueued;
  }

  public long migrationsCompleted() {
    return migrationsCompleted;
  }

  public long migrationsDropped() {
    return migrationsDropped;
  }

  /** Returns the number of addresses moved at least once. */
  public long addressesMigrated() {
    return addressesMigrated;
  }

  /** Returns the sum of the migration counts of every tracked address. */
  public long totalMigrations() {
    return totalMigrations;
  }

  public int queueSize() {
    return queueSize;
  }

  public boolean queueFull() {
    return queueFull;
  }

  /** Returns the mean of the rewards computed so far, or zero if none was. */
  public double averageReward() {
    return averageReward;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("addressesTracked", addressesTracked)
        .add("hotAddresses", hotAddresses)
        .add("coldAddresses", coldAddresses)
        .add("totalAccesses", totalAccesses)
        .add("totalRequests", totalRequests)
        .add("migrationsEnqueued", migrationsEnqueued)
        .add("migrationsCompleted", migrationsCompleted)
        .add("migrationsDropped", migrationsDropped)
        .add("addressesMigrated", addressesMigrated)
        .add("totalMigrations", totalMigrations)
        .add("queueSize", queueSize)
        .add("queueFull", queueFull)
        .add("averageReward", averageReward)
        .toString();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    long addressesTracked;
    long hotAddresses;
    long coldAddresses;
    long totalAccesses;
    long totalRequests;
    long migrationsEnqueued;
    long migrationsCompleted;
    long migrationsDropped;
    long addressesMigrated;
    long totalMigrations;
    int queueSize;
    boolean queueFull;
    double averageReward;

    MigrationStatistics build() {
      return new MigrationStatistics(this);
    }
  }
}
