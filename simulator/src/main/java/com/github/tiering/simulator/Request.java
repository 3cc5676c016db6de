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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.US;

import java.util.Optional;
import java.util.OptionalLong;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;

/**
 * A single I/O request of the replayed trace. A request is immutable and is consumed exactly once
 * by the simulation engine.
 */
public final class Request {
  private final long address;
  private final long size;
  private final long timestamp;
  private final long serviceTime;
  private final Operation operation;
  private final Pattern pattern;
  private final @Nullable Zone zone;

  private Request(Builder builder) {
    this.address = builder.address;
    this.size = builder.size;
    this.timestamp = builder.timestamp;
    this.serviceTime = builder.serviceTime;
    this.operation = builder.operation;
    this.pattern = builder.pattern;
    this.zone = builder.zone;
  }

  /** Returns the logical block address identifying the data. */
  public long address() {
    return address;
  }

  /** Returns the size in bytes. */
  public long size() {
    return size;
  }

  /** Returns the trace time of the arrival, in virtual nanoseconds. */
  public long timestamp() {
    return timestamp;
  }

  /** Returns the service time recorded by the trace, in nanoseconds, if present. */
  public OptionalLong serviceTime() {
    return (serviceTime < 0) ? OptionalLong.empty() : OptionalLong.of(serviceTime);
  }

  public Operation operation() {
    return operation;
  }

  public boolean isRead() {
    return operation == Operation.READ;
  }

  public Pattern pattern() {
    return pattern;
  }

  /** Returns the externally labeled zone, if the trace supplies one. */
  public Optional<Zone> zone() {
    return Optional.ofNullable(zone);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("address", address)
        .add("size", size)
        .add("operation", operation)
        .add("timestamp", timestamp)
        .add("pattern", pattern)
        .add("zone", zone)
        .omitNullValues()
        .toString();
  }

  /** Returns a read of the given size to the address, arriving at time zero. */
  public static Request read(long address, long size) {
    return builder().address(address).size(size).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public enum Operation {
    READ, WRITE;

    /** Returns the operation for a trace code, treating anything that is not a read as a write. */
    public static Operation of(String code) {
      return code.trim().toLowerCase(US).startsWith("r") ? READ : WRITE;
    }
  }

  public enum Pattern {
    SEQUENTIAL, RANDOM, UNKNOWN;

    public static Pattern of(String flag) {
      switch (flag.trim().toLowerCase(US)) {
        case "seq":
          return SEQUENTIAL;
        case "rand":
          return RANDOM;
        default:
          return UNKNOWN;
      }
    }
  }

  public enum Zone {
    HOT, COLD;

    /** Returns the zone for the label, or empty if the field is not a zone label. */
    public static Optional<Zone> parse(String label) {
      String normalized = label.trim().toLowerCase(US);
      if (normalized.equals("hot")) {
        return Optional.of(HOT);
      } else if (normalized.equals("cold")) {
        return Optional.of(COLD);
      }
      return Optional.empty();
    }
  }

  public static final class Builder {
    private long address;
    private long size;
    private long timestamp;
    private long serviceTime = -1;
    private Operation operation = Operation.READ;
    private Pattern pattern = Pattern.UNKNOWN;
    private @Nullable Zone zone;

    private Builder() {}

    public Builder address(long address) {
      this.address = address;
      return this;
    }

    public Builder size(long size) {
      checkArgument(size >= 0, "size must be non-negative: %s", size);
      this.size = size;
      return this;
    }

    public Builder timestamp(long timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder serviceTime(long serviceTime) {
      checkArgument(serviceTime >= 0, "service time must be non-negative: %s", serviceTime);
      this.serviceTime = serviceTime;
      return this;
    }

    public Builder operation(Operation operation) {
      this.operation = operation;
      return this;
    }

    public Builder pattern(Pattern pattern) {
      this.pattern = pattern;
      return this;
    }

    public Builder zone(@Nullable Zone zone) {
      this.zone = zone;
      return this;
    }

    public Request build() {
      return new Request(this);
    }
  }
}
