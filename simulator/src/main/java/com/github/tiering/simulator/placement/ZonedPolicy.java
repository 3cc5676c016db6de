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
import com.github.tiering.simulator.Request.Zone;
import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.CapacityManager;

/**
 * Routes by the zone the trace labels each request with: the hot zone to the solid-state tier and
 * the cold zone to the rotational tier. An item resident in memory is served from there instead,
 * and every item served by a device is then admitted into memory. A request without a label is
 * treated as cold.
 */
public final class ZonedPolicy implements PlacementPolicy {
  private final CapacityManager capacity;

  public ZonedPolicy(CapacityManager capacity) {
    this.capacity = requireNonNull(capacity);
  }

  @Override
  public Tier select(Request request) {
    if (capacity.isResident(Tier.FAST, request.address())) {
      return Tier.FAST;
    }
    return (request.zone().orElse(Zone.COLD) == Zone.HOT) ? Tier.MID : Tier.SLOW;
  }

  @Override
  public void onServed(Request request, Placement placement, long servedTime, boolean last) {
    if (placement.tier() != Tier.FAST) {
      capacity.admit(Tier.FAST, request.address(), request.size());
    }
  }
}
