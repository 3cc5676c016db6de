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
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.github.tiering.simulator.Tier;

/**
 * Scans the tracked addresses and proposes tier moves. A hot address is promoted to the nearest
 * faster tier that still has headroom, and a cold address is demoted one tier. Only moves that
 * change the tier of an address accessed at least {@code minAccessCount} times are proposed, the
 * hottest first.
 */
public final class MigrationCandidateSelector {
  private final HotnessTracker tracker;
  private final int minAccessCount;
  private final long fastCapacity;
  private final long midCapacity;
  private final double headroom;
  private final int limit;

  /**
   * @param headroom the fraction of a tier's capacity that its usage must stay below for it to
   *        accept a promotion
   * @param limit the maximum number of candidates proposed per scan
   */
  public MigrationCandidateSelector(HotnessTracker tracker, long fastCapacity, long midCapacity,
      int minAccessCount, double headroom, int limit) {
    checkArgument((headroom > 0.0) && (headroom <= 1.0), "headroom must be in (0, 1]");
    checkArgument(limit > 0, "limit must be positive");
    this.tracker = requireNonNull(tracker);
    this.minAccessCount = minAccessCount;
    this.fastCapacity = fastCapacity;
    this.midCapacity = midCapacity;
    this.headroom = headroom;
    this.limit = limit;
  }

  /**
   * Returns the proposed moves given the current usage of the constrained tiers.
   *
   * @param midUsage the bytes in use by the solid-state tier
   * @param fastUsage the bytes in use by the volatile tier
   * @param now the virtual time of the scan
   */
  public List<MigrationCandidate> select(long midUsage, long fastUsage, long now) {
    List<MigrationCandidate> candidates = new ArrayList<>();
    for (AddressStats stats : tracker.snapshot()) {
      if (stats.accessCount() < minAccessCount) {
        continue;
      }
      Hotness hotness = tracker.classifyCount(stats.accessCount());
      Tier current = stats.tier();
      Tier target = targetTier(current, hotness, midUsage, fastUsage);
      if (target != current) {
        candidates.add(new MigrationCandidate(stats.address(), current, target,
            stats.accessCount(), now));
      }
    }
    candidates.sort(Comparator.comparingDouble(MigrationCandidate::score).reversed());
    return (candidates.size() > limit)
        ? new ArrayList<>(candidates.subList(0, limit))
        : candidates;
  }

  /** Returns the tier the address should move to, or its current tier if it should stay. */
  Tier targetTier(Tier current, Hotness hotness, long midUsage, long fastUsage) {
    if (hotness == Hotness.HOT) {
      for (Optional<Tier> tier = current.faster(); tier.isPresent(); tier = tier.get().faster()) {
        if (hasHeadroom(tier.get(), midUsage, fastUsage)) {
          return tier.get();
        }
      }
    } else if (hotness == Hotness.COLD) {
      return current.slower().orElse(current);
    }
    return current;
  }

  private boolean hasHeadroom(Tier tier, long midUsage, long fastUsage) {
    switch (tier) {
      case FAST:
        return fastUsage < (fastCapacity * headroom);
      case MID:
        return midUsage < (midCapacity * headroom);
      default:
        return true;
    }
  }
}
