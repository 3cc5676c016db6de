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

import java.util.List;
import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/** The outcome of one periodic migration check. */
public final class MigrationCycle {
  private final ImmutableList<MigrationCandidate> candidates;
  private final OptionalDouble reward;
  private final int enqueued;

  MigrationCycle(List<MigrationCandidate> candidates, int enqueued, OptionalDouble reward) {
    this.candidates = ImmutableList.copyOf(candidates);
    this.enqueued = enqueued;
    this.reward = reward;
  }

  /** Returns the proposed moves, hottest first. */
  public ImmutableList<MigrationCandidate> candidates() {
    return candidates;
  }

  public int enqueued() {
    return enqueued;
  }

  /** Returns the number of proposals dropped because the queue was full. */
  public int dropped() {
    return candidates.size() - enqueued;
  }

  /** Returns the delayed reward, absent until the latency window is full and a move completed. */
  public OptionalDouble reward() {
    return reward;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("candidates", candidates.size())
        .add("enqueued", enqueued)
        .add("reward", reward)
        .toString();
  }
}
