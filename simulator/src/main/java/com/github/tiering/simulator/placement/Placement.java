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

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;

/** The tier selected to serve a request and the virtual time its transfer occupies. */
public final class Placement {
  private final Tier tier;
  private final long duration;

  public Placement(Tier tier, long duration) {
    this.tier = tier;
    this.duration = duration;
  }

  public Tier tier() {
    return tier;
  }

  /** Returns the transfer duration, in virtual nanoseconds, excluding any wait for a channel. */
  public long duration() {
    return duration;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tier", tier)
        .add("duration", duration)
        .toString();
  }
}
