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

/** Serves every request from one tier, providing a baseline for the other policies. */
public final class PinnedTierPolicy implements PlacementPolicy {
  private final CapacityManager capacity;
  private final Tier tier;

  public PinnedTierPolicy(Tier tier, CapacityManager capacity) {
    this.capacity = requireNonNull(capacity);
    this.tier = requireNonNull(tier);
  }

  public Tier tier() {
    return tier;
  }

  @Override
  public Tier select(Request request) {
    return tier;
  }

  @Override
  public void onServed(Request request, Placement placement, long servedTime, boolean last) {
    capacity.admit(tier, request.address(), request.size());
  }
}
