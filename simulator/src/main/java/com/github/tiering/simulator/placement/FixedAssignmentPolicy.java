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

import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Tier;

/**
 * Assigns every address to a fixed device tier by its parity: odd addresses are served by the
 * solid-state tier and even addresses by the rotational tier. Residency is never consulted, so the
 * same address always lands on the same tier.
 */
public final class FixedAssignmentPolicy implements PlacementPolicy {

  @Override
  public Tier select(Request request) {
    return ((request.address() & 1L) == 1L) ? Tier.MID : Tier.SLOW;
  }
}
