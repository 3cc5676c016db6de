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
package com.github.tiering.simulator.report;

import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.CapacityManager;
import com.github.tiering.simulator.migration.MigrationStatistics;
import com.github.tiering.simulator.placement.ServiceCounters;

/**
 * The end-of-run summary: the operations served per tier, their total and average served time,
 * the storage status of the constrained tiers and, when enabled, the migration statistics.
 */
public final class SummaryReport {
  private static final double NANOS_PER_SECOND = 1e9;
  private static final double SECONDS_PER_HOUR = 3600.0;

  private final Optional<MigrationStatistics> migration;
  private final CapacityManager capacity;
  private final ServiceCounters counters;

  public SummaryReport(ServiceCounters counters, CapacityManager capacity,
      Optional<MigrationStatistics> migration) {
    this.migration = requireNonNull(migration);
    this.capacity = requireNonNull(capacity);
    this.counters = requireNonNull(counters);
  }

  /** Returns the summary as plain text. */
  public String render() {
    StringBuilder summary = new StringBuilder();
    line(summary, "Total of operations at file's traces:", counters.totalOperations());
    for (Tier tier : Tier.values()) {
      line(summary, "Numbers of Reads in " + tier.device() + " tier:", counters.reads(tier));
      line(summary, "Numbers of Writes in " + tier.device() + " tier:", counters.writes(tier));
    }
    for (Tier tier : Tier.values()) {
      line(summary, "Total Served Time in " + tier.device() + " tier:",
          duration(counters.servedTime(tier)));
    }
    for (Tier tier : Tier.values()) {
      line(summary, "Average Served Time in " + tier.device() + " tier:",
          duration(counters.averageServedTime(tier)));
    }
    line(summary, "Storage status:", storageStatus());
    for (Tier tier : Tier.values()) {
      if (capacity.isTracked(tier)) {
        line(summary, "Evictions in " + tier.device() + " tier:", String.format(US,
            "%d items (%d bytes)", capacity.evictions(tier), capacity.evictedBytes(tier)));
      }
    }
    if (migration.isPresent()) {
      appendMigration(summary, migration.get());
    } else {
      line(summary, "Migration:", "disabled");
    }
    return summary.toString();
  }

  /** Returns the usage and resident count of each constrained tier. */
  public String storageStatus() {
    StringBuilder status = new StringBuilder();
    for (Tier tier : new Tier[] { Tier.MID, Tier.FAST }) {
      if (status.length() > 0) {
        status.append(" | ");
      }
      double percent = 100 * capacity.state(tier).usage();
      status.append(String.format(US, "%s: %.2f%% (%d files)", tier.device(),
          (capacity.capacity(tier) == 0) ? 0.0 : percent, capacity.state(tier).residentCount()));
    }
    return status.toString();
  }

  /** Writes the summary to the file, replacing any previous content. */
  public void writeTo(Path path) throws IOException {
    Files.write(path, render().getBytes(StandardCharsets.UTF_8));
  }

  private static void appendMigration(StringBuilder summary, MigrationStatistics stats) {
    summary.append("Migration statistics:").append(System.lineSeparator());
    line(summary, "  Addresses tracked:", stats.addressesTracked());
    line(summary, "  Hot addresses:", stats.hotAddresses());
    line(summary, "  Cold addresses:", stats.coldAddresses());
    line(summary, "  Total accesses:", stats.totalAccesses());
    line(summary, "  Total requests:", stats.totalRequests());
    line(summary, "  Addresses migrated:", stats.addressesMigrated());
    line(summary, "  Total migrations:", stats.totalMigrations());
    line(summary, "  Migrations enqueued:", stats.migrationsEnqueued());
    line(summary, "  Migrations completed:", stats.migrationsCompleted());
    line(summary, "  Migrations dropped:", stats.migrationsDropped());
    line(summary, "  Queue occupancy:", stats.queueSize() + (stats.queueFull() ? " (full)" : ""));
    line(summary, "  Average reward:", String.format(US, "%.2f", stats.averageReward()));
  }

  private static String duration(double nanos) {
    double seconds = nanos / NANOS_PER_SECOND;
    return String.format(US, "%.5f [s] (%.5f [h])", seconds, seconds / SECONDS_PER_HOUR);
  }

  private static void line(StringBuilder summary, String label, Object value) {
    summary.append(String.format(US, "%-38s%s", label, value)).append(System.lineSeparator());
  }
}
