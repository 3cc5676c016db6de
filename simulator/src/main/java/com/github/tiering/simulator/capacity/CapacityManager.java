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
package com.github.tiering.simulator.capacity;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.US;

import java.util.EnumMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.tiering.simulator.BasicSettings;
import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.TierState.Node;

/**
 * Tracks the bytes used and the resident items of the constrained tiers, evicting in admission
 * order when an admission would exceed a tier's capacity. The slow tier is unconstrained and is not
 * tracked.
 * <p>
 * This class is not thread-safe; it is owned by the simulation's request completion path.
 */
public final class CapacityManager {
  private static final Logger logger = LogManager.getLogger(CapacityManager.class);

  private final Map<Tier, TierState> states;
  private final EvictionPolicy policy;
  private final long[] evictionCounts;
  private final long[] evictedBytes;
  private final long[] admissions;

  public CapacityManager(long fastCapacity, long midCapacity, EvictionPolicy policy) {
    this.states = new EnumMap<>(Tier.class);
    this.states.put(Tier.FAST, new TierState(Tier.FAST, fastCapacity));
    this.states.put(Tier.MID, new TierState(Tier.MID, midCapacity));
    this.evictionCounts = new long[Tier.values().length];
    this.evictedBytes = new long[Tier.values().length];
    this.admissions = new long[Tier.values().length];
    this.policy = policy;
    if (!policy.isImplemented()) {
      logger.warn("{} eviction is not implemented; evicting in admission order (FIFO)",
          policy.label());
    }
  }

  public static CapacityManager from(BasicSettings settings) {
    return new CapacityManager(settings.tiers().capacity(Tier.FAST),
        settings.tiers().capacity(Tier.MID), settings.evictionPolicy());
  }

  /**
   * Makes the item resident in the tier. An item that is already resident is left untouched. When
   * the tier is short of room, the oldest admissions are evicted until the item fits.
   *
   * @return true once the item is resident, or always for the unconstrained tier
   * @throws CapacityFaultException if the item cannot fit even in the emptied tier
   */
  public boolean admit(Tier tier, long id, long size) {
    checkArgument(size >= 0, "size must be non-negative: %s", size);
    TierState state = states.get(tier);
    if ((state == null) || state.contains(id)) {
      return true;
    }
    if (size > state.capacity()) {
      throw new CapacityFaultException(tier, id, size, state.capacity());
    }
    long shortfall = size - state.available();
    if (shortfall > 0) {
      evict(tier, shortfall);
      if (size > state.available()) {
        throw new CapacityFaultException(tier, id, size, state.capacity());
      }
    }
    state.add(id, size);
    admissions[tier.ordinal()]++;
    return true;
  }

  /**
   * Removes the oldest admitted items until at least the requested bytes were freed or the tier
   * is empty.
   */
  public Eviction evict(Tier tier, long bytesNeeded) {
    TierState state = states.get(tier);
    if (state == null) {
      return new Eviction(tier, 0, 0);
    }
    int count = 0;
    long bytesFreed = 0;
    while (bytesNeeded > 0) {
      Node victim = state.victim(policy);
      if (victim == null) {
        break;
      }
      long size = state.remove(victim.id);
      bytesNeeded -= size;
      bytesFreed += size;
      count++;
    }

    evictionCounts[tier.ordinal()] += count;
    evictedBytes[tier.ordinal()] += bytesFreed;
    if ((count > 0) && logger.isDebugEnabled()) {
      logger.debug(String.format(US, "[%s eviction] Evicted %d items (%d bytes). "
          + "New usage: %.2f%% (%d/%d bytes)", tier.device(), count, bytesFreed,
          100 * state.usage(), state.used(), state.capacity()));
    }
    return new Eviction(tier, count, bytesFreed);
  }

  /** Returns whether the tier's usage is accounted; the slow tier is not. */
  public boolean isTracked(Tier tier) {
    return states.containsKey(tier);
  }

  public boolean isResident(Tier tier, long id) {
    TierState state = states.get(tier);
    return (state != null) && state.contains(id);
  }

  /** Returns the bytes in use by the tier, or zero for the unconstrained tier. */
  public long used(Tier tier) {
    TierState state = states.get(tier);
    return (state == null) ? 0 : state.used();
  }

  /** Returns the capacity of the tier, or {@link Long#MAX_VALUE} for the unconstrained tier. */
  public long capacity(Tier tier) {
    TierState state = states.get(tier);
    return (state == null) ? Long.MAX_VALUE : state.capacity();
  }

  /** Returns the accounting of a constrained tier. */
  public TierState state(Tier tier) {
    TierState state = states.get(tier);
    checkArgument(state != null, "%s tier is not tracked", tier);
    return state;
  }

  public long admissions(Tier tier) {
    return admissions[tier.ordinal()];
  }

  public long evictions(Tier tier) {
    return evictionCounts[tier.ordinal()];
  }

  public long evictedBytes(Tier tier) {
    return evictedBytes[tier.ordinal()];
  }

  public EvictionPolicy policy() {
    return policy;
  }

  /** Checks that every tier's accounting is consistent and within capacity. */
  public void verify() {
    states.values().forEach(TierState::verify);
  }
}
