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

import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

import com.github.tiering.simulator.capacity.EvictionPolicy;
import com.github.tiering.simulator.parser.TraceFormat;
import com.github.tiering.simulator.placement.PlacementPolicyType;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValueType;

/**
 * The simulator's configuration. See <tt>reference.conf</tt> for details on the settings.
 */
public class BasicSettings {
  private static final long MEGABYTE = 1024L * 1024L;

  private final Config config;

  public BasicSettings(Config config) {
    this.config = requireNonNull(config);
  }

  /** Returns the settings rooted at <tt>tiering.simulator</tt> of the full configuration. */
  public static BasicSettings fromRoot(Config root) {
    return new BasicSettings(root.getConfig("tiering.simulator"));
  }

  public PlacementPolicyType policy() {
    String name = config().getString("policy");
    try {
      return PlacementPolicyType.fromName(name);
    } catch (IllegalArgumentException e) {
      throw new ConfigException.BadValue(config().origin(), "policy", e.getMessage(), e);
    }
  }

  public EvictionPolicy evictionPolicy() {
    String name = config().getString("eviction-policy");
    try {
      return EvictionPolicy.fromName(name);
    } catch (IllegalArgumentException e) {
      throw new ConfigException.BadValue(config().origin(), "eviction-policy", e.getMessage(), e);
    }
  }

  /** Returns the fixed service time of the volatile tier, in nanoseconds. */
  public long fastHitDuration() {
    return config().getDuration("fast-hit-duration", TimeUnit.NANOSECONDS);
  }

  public TierSettings tiers() {
    return new TierSettings();
  }

  public TraceSettings trace() {
    return new TraceSettings();
  }

  public MigrationSettings migration() {
    return new MigrationSettings();
  }

  public OracleSettings oracle() {
    return new OracleSettings();
  }

  public ReportSettings report() {
    return new ReportSettings();
  }

  /** Returns the config resolved at the simulator's path. */
  public Config config() {
    return config;
  }

  private long positiveBytes(String path) {
    long bytes = config().getBytes(path);
    if (bytes < 0) {
      throw new ConfigException.BadValue(config().origin(), path, "must be non-negative");
    }
    return bytes;
  }

  private double rate(String path) {
    double rate = config().getDouble(path);
    if (rate <= 0) {
      throw new ConfigException.BadValue(config().origin(), path, "must be positive");
    }
    return rate * MEGABYTE;
  }

  private long nanosPerUnit(String path) {
    String unit = config().getString(path);
    switch (unit.toLowerCase(US)) {
      case "s":
        return TimeUnit.SECONDS.toNanos(1);
      case "ms":
        return TimeUnit.MILLISECONDS.toNanos(1);
      case "us":
        return TimeUnit.MICROSECONDS.toNanos(1);
      case "ns":
        return 1;
      default:
        throw new ConfigException.BadValue(config().origin(), path, "Unknown time unit: " + unit);
    }
  }

  public final class TierSettings {
    /** Returns the capacity of a constrained tier in bytes; the slow tier is unconstrained. */
    public long capacity(Tier tier) {
      if (tier == Tier.SLOW) {
        return Long.MAX_VALUE;
      }
      return positiveBytes(path(tier, "capacity"));
    }

    /** Returns the read transfer rate in bytes per second. */
    public double readRate(Tier tier) {
      return rate(path(tier, "read-rate"));
    }

    /** Returns the write transfer rate in bytes per second. */
    public double writeRate(Tier tier) {
      return rate(path(tier, "write-rate"));
    }

    /** Returns the number of parallel service channels of a device tier. */
    public int channels(Tier tier) {
      int channels = config().getInt(path(tier, "channels"));
      if (channels <= 0) {
        throw new ConfigException.BadValue(config().origin(),
            path(tier, "channels"), "must be positive");
      }
      return channels;
    }

    private String path(Tier tier, String key) {
      return "tiers." + tier.name().toLowerCase(US) + "." + key;
    }
  }

  public final class TraceSettings {
    public String path() {
      return config().getString("trace.path");
    }
    public TraceFormat format() {
      String name = config().getString("trace.format");
      try {
        return TraceFormat.fromName(name);
      } catch (IllegalArgumentException e) {
        throw new ConfigException.BadValue(config().origin(), "trace.format", e.getMessage(), e);
      }
    }
    public long skip() {
      return config().getLong("trace.skip");
    }
    public long limit() {
      return config().getLong("trace.limit");
    }
    public LegacySettings legacy() {
      return new LegacySettings();
    }
    public ExtendedSettings extended() {
      return new ExtendedSettings();
    }
  }

  public final class LegacySettings {
    public String delimiter() {
      return config().getString("trace.legacy.delimiter");
    }
    public OptionalInt timestampColumn() {
      return column("trace.legacy.timestamp-column");
    }
    public OptionalInt idColumn() {
      return column("trace.legacy.id-column");
    }
    public OptionalInt sizeColumn() {
      return column("trace.legacy.size-column");
    }
    public OptionalInt operationColumn() {
      return column("trace.legacy.operation-column");
    }
    /** Returns the size used when a request's size is absent, in bytes. */
    public long defaultSize() {
      return positiveBytes("trace.legacy.default-size");
    }
    /** Returns the number of bytes in one unit of the size column. */
    public long bytesPerSizeUnit() {
      String unit = config().getString("trace.legacy.size-unit");
      switch (unit.toUpperCase(US)) {
        case "B":
          return 1;
        case "KB":
          return 1024L;
        case "MB":
          return MEGABYTE;
        case "GB":
          return 1024L * MEGABYTE;
        default:
          throw new ConfigException.BadValue(config().origin(),
              "trace.legacy.size-unit", "Unknown size unit: " + unit);
      }
    }
    /** Returns the number of virtual nanoseconds in one unit of the timestamp column. */
    public long nanosPerTimestampUnit() {
      return nanosPerUnit("trace.legacy.timestamp-unit");
    }

    private OptionalInt column(String path) {
      if (config().getValue(path).valueType() == ConfigValueType.NUMBER) {
        return OptionalInt.of(config().getInt(path));
      }
      String value = config().getString(path).trim();
      if (value.equals("-")) {
        return OptionalInt.empty();
      }
      try {
        return OptionalInt.of(Integer.parseInt(value));
      } catch (NumberFormatException e) {
        throw new ConfigException.BadValue(config().origin(), path, "Not a column: " + value, e);
      }
    }
  }

  public final class ExtendedSettings {
    public long nanosPerTimestampUnit() {
      return nanosPerUnit("trace.extended.timestamp-unit");
    }
    public ImmutableSet<String> readCodes() {
      List<String> codes = config().getStringList("trace.extended.read-codes");
      return codes.stream()
          .map(code -> code.toLowerCase(US))
          .collect(ImmutableSet.toImmutableSet());
    }
  }

  public final class MigrationSettings {
    public boolean enabled() {
      return config().getBoolean("migration.enabled");
    }
    public int checkInterval() {
      return positiveInt("migration.check-interval");
    }
    public int queueSize() {
      return positiveInt("migration.queue-size");
    }
    public int candidateLimit() {
      return positiveInt("migration.candidate-limit");
    }
    public int hotThreshold() {
      return config().getInt("migration.hot-threshold");
    }
    public int coldThreshold() {
      return config().getInt("migration.cold-threshold");
    }
    public int minAccessCount() {
      return config().getInt("migration.min-access-count");
    }
    public double headroom() {
      double headroom = config().getDouble("migration.headroom");
      if ((headroom <= 0.0) || (headroom > 1.0)) {
        throw new ConfigException.BadValue(config().origin(),
            "migration.headroom", "must be in (0, 1]");
      }
      return headroom;
    }
    public int rewardWindow() {
      return positiveInt("migration.reward-window");
    }
    public int historySize() {
      return positiveInt("migration.history-size");
    }
    public Duration pollInterval() {
      return config().getDuration("migration.poll-interval");
    }
    public Duration drainTimeout() {
      return config().getDuration("migration.drain-timeout");
    }
    public Duration shutdownTimeout() {
      return config().getDuration("migration.shutdown-timeout");
    }

    private int positiveInt(String path) {
      int value = config().getInt(path);
      if (value <= 0) {
        throw new ConfigException.BadValue(config().origin(), path, "must be positive");
      }
      return value;
    }
  }

  public final class OracleSettings {
    public String type() {
      return config().getString("oracle.type");
    }
    public String className() {
      return config().getString("oracle.class");
    }
    public double epsilon() {
      return config().getDouble("oracle.epsilon");
    }
    public int randomSeed() {
      return config().getInt("oracle.random-seed");
    }
  }

  public final class ReportSettings {
    public String requests() {
      return config().getString("report.requests");
    }
    public String summary() {
      return config().getString("report.summary");
    }
  }
}
