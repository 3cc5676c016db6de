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
package com.github.tiering.simulator;

import java.util.Optional;

import com.github.tiering.simulator.capacity.CapacityManager;
import com.github.tiering.simulator.migration.MigrationStatistics;
import com.github.tiering.simulator.placement.ServiceCounters;
import com.github.tiering.simulator.report.SummaryReport;
import com.google.common.base.MoreObjects;

/** The outcome of a simulation run. */
public final class SimulationResult {
  private final Optional<MigrationStatistics> migration;
  private final CapacityManager capacity;
  private final ServiceCounters counters;
  private final long completed;
  private final long endTime;
  private final int maxInFlight;

  SimulationResult(ServiceCounters counters, CapacityManager capacity,
      Optional<MigrationStatistics> migration, long completed, long endTime, int maxInFlight) {
    this.maxInFlight = maxInFlight;
    this.migration = migration;
    this.completed = completed;
    this.capacity = capacity;
    this.counters = counters;
    this.endTime = endTime;
  }

  public ServiceCounters counters() {
    return counters;
  }

  public CapacityManager capacity() {
    return capacity;
  }

  /** Returns the final migration statistics, if migration was enabled. */
  public Optional<MigrationStatistics> migration() {
    return migration;
  }

  public long completed() {
    return completed;
  }

  /** Returns the virtual time of the last event, in nanoseconds. */
  public long endTime() {
    return endTime;
  }

  /** Returns the largest number of requests that were in flight at once. */
  public int maxInFlight() {
    return maxInFlight;
  }

  public SummaryReport summary() {
    return new SummaryReport(counters, capacity, migration);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("completed", completed)
        .add("endTime", endTime)
        .add("maxInFlight", maxInFlight)
        .toString();
  }
}
