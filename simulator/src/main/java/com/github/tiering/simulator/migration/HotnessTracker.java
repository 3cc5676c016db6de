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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;

/**
 * Records the access statistics of every address seen during a run. The simulation reports each
 * served request while the migration executor records applied moves, so every read-modify-write
 * of the statistics is performed under a single lock. Statistics are never removed.
 */
public final class HotnessTracker {
  private final Long2ObjectMap<AddressStats> stats;
  private final int coldThreshold;
  private final int hotThreshold;
  private final int historySize;
  private final Lock lock;

  public HotnessTracker(int hotThreshold, int coldThreshold, int historySize) {
    checkArgument(coldThreshold < hotThreshold,
        "cold threshold %s must be below hot threshold %s", coldThreshold, hotThreshold);
    checkArgument(historySize > 0, "history size must be positive");
    this.stats = new Long2ObjectLinkedOpenHashMap<>();
    this.coldThreshold = coldThreshold;
    this.hotThreshold = hotThreshold;
    this.historySize = historySize;
    this.lock = new ReentrantLock();
  }

  /**
   * Records an access to the address.
   *
   * @param tier the tier that served the access
   * @param latency the access latency, in virtual nanoseconds
   * @param size the size of the item, in bytes
   * @param time the virtual time of the access
   */
  public void record(long address, Tier tier, long latency, long size, long time) {
    lock.lock();
    try {
      AddressStats entry = stats.get(address);
      if (entry == null) {
        entry = new AddressStats(address, tier, size, time, historySize);
        stats.put(address, entry);
      }
      entry.recordAccess(tier, latency, size, time);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Moves a tracked address to the target tier without counting an access.
   *
   * @return whether the address was tracked
   */
  public boolean applyMigration(long address, Tier target) {
    lock.lock();
    try {
      AddressStats entry = stats.get(address);
      if (entry == null) {
        return false;
      }
      entry.recordMigration(target);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the class of the address; an address never seen is cold. */
  public Hotness classify(long address) {
    lock.lock();
    try {
      AddressStats entry = stats.get(address);
      return classifyCount((entry == null) ? 0 : entry.accessCount());
    } finally {
      lock.unlock();
    }
  }

  /** Returns the class of an access count. */
  public Hotness classifyCount(long accessCount) {
    if (accessCount >= hotThreshold) {
      return Hotness.HOT;
    } else if (accessCount <= coldThreshold) {
      return Hotness.COLD;
    }
    return Hotness.WARM;
  }

  /** Returns a copy of the address's statistics, if it was seen. */
  public Optional<AddressStats> stats(long address) {
    lock.lock();
    try {
      AddressStats entry = stats.get(address);
      return (entry == null) ? Optional.empty() : Optional.of(entry.copy());
    } finally {
      lock.unlock();
    }
  }

  /** Returns a copy of every address's statistics, in the order the addresses were first seen. */
  public List<AddressStats> snapshot() {
    lock.lock();
    try {
      List<AddressStats> copies = new ArrayList<>(stats.size());
      for (AddressStats entry : stats.values()) {
        copies.add(entry.copy());
      }
      return copies;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return stats.size();
    } finally {
      lock.unlock();
    }
  }

  public int hotThreshold() {
    return hotThreshold;
  }

  public int coldThreshold() {
    return coldThreshold;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("hotThreshold", hotThreshold)
        .add("coldThreshold", coldThreshold)
        .add("tracked", size())
        .toString();
  }
}
