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

import static java.util.Objects.requireNonNull;

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;
import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;

/**
 * The access statistics of a single address. Instances held by the {@link HotnessTracker} are
 * mutated only under its lock; callers only ever see detached copies.
 */
public final class AddressStats {
  private final EvictingQueue<Long> recentAccesses;
  private final long address;
  private final long firstAccess;

  private long totalLatency;
  private int migrationCount;
  private long accessCount;
  private long lastAccess;
  private long size;
  private Tier tier;

  AddressStats(long address, Tier tier, long size, long time, int historySize) {
    this.recentAccesses = EvictingQueue.create(historySize);
    this.tier = requireNonNull(tier);
    this.address = address;
    this.firstAccess = time;
    this.lastAccess = time;
    this.size = size;
  }

  private AddressStats(AddressStats other) {
    this.recentAccesses = EvictingQueue.create(other.recentAccesses.remainingCapacity()
        + other.recentAccesses.size());
    this.recentAccesses.addAll(other.recentAccesses);
    this.migrationCount = other.migrationCount;
    this.totalLatency = other.totalLatency;
    this.accessCount = other.accessCount;
    this.firstAccess = other.firstAccess;
    this.lastAccess = other.lastAccess;
    this.address = other.address;
    this.size = other.size;
    this.tier = other.tier;
  }

  void recordAccess(Tier tier, long latency, long size, long time) {
    this.tier = requireNonNull(tier);
    this.totalLatency += latency;
    this.lastAccess = time;
    this.size = size;
    recentAccesses.add(time);
    accessCount++;
  }

  void recordMigration(Tier target) {
    this.tier = requireNonNull(target);
    migrationCount++;
  }

  AddressStats copy() {
    return new AddressStats(this);
  }

  public long address() {
    return address;
  }

  public long accessCount() {
    return accessCount;
  }

  /** Returns the cumulative latency of the accesses, in virtual nanoseconds. */
  public long totalLatency() {
    return totalLatency;
  }

  /** Returns the tier that last served, or that a migration last moved, the address. */
  public Tier tier() {
    return tier;
  }

  public long size() {
    return size;
  }

  public long firstAccess() {
    return firstAccess;
  }

  public long lastAccess() {
    return lastAccess;
  }

  /** Returns the virtual times of the most recent accesses, oldest first. */
  public ImmutableList<Long> recentAccesses() {
    return ImmutableList.copyOf(recentAccesses);
  }

  public int migrationCount() {
    return migrationCount;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("address", address)
        .add("tier", tier)
        .add("accessCount", accessCount)
        .add("migrationCount", migrationCount)
        .toString();
  }
}
