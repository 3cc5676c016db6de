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
package com.github.tiering.simulator.placement;

import static java.util.Objects.requireNonNull;

import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.CapacityManager;

/**
 * Uses the solid-state tier as a cache in front of the rotational tier. A hit is served by the
 * solid-state tier; a miss is served by the rotational tier and the item is then promoted, evicting
 * the oldest admissions when the cache is full.
 */
public final class MidTierCachingPolicy implements PlacementPolicy {
  private final CapacityManager capacity;

  public MidTierCachingPolicy(CapacityManager capacity) {
    this.capacity = requireNonNull(capacity);
  }

  @Override
  public Tier select(Request request) {
    return capacity.isResident(Tier.MID, request.address()) ? Tier.MID : Tier.SLOW;
  }

  @Override
  public void onServed(Request request, Placement placement, long servedTime, boolean last) {
    if (placement.tier() == Tier.SLOW) {
      capacity.admit(Tier.MID, request.address(), request.size());
    }
  }
}
