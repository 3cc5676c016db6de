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

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;

/** A proposed move of an address between tiers, applied at most once. */
public final class MigrationCandidate {
  private final long identifiedAt;
  private final Tier currentTier;
  private final Tier targetTier;
  private final long address;
  private final double score;

  public MigrationCandidate(long address, Tier currentTier, Tier targetTier,
      double score, long identifiedAt) {
    checkArgument(currentTier != targetTier, "%s is already on %s", address, targetTier);
    this.currentTier = requireNonNull(currentTier);
    this.targetTier = requireNonNull(targetTier);
    this.identifiedAt = identifiedAt;
    this.address = address;
    this.score = score;
  }

  public long address() {
    return address;
  }

  public Tier currentTier() {
    return currentTier;
  }

  public Tier targetTier() {
    return targetTier;
  }

  /** Returns the hotness score, the access count at the time of selection. */
  public double score() {
    return score;
  }

  /** Returns the virtual time of the check that proposed the move. */
  public long identifiedAt() {
    return identifiedAt;
  }

  public boolean isPromotion() {
    return targetTier.isFasterThan(currentTier);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("address", address)
        .add("from", currentTier.device())
        .add("to", targetTier.device())
        .add("score", score)
        .toString();
  }
}
