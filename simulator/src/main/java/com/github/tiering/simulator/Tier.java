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

import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * The storage classes of the hierarchy, ordered from the fastest to the slowest.
 */
public enum Tier {
  /** Volatile memory; served at a fixed nominal cost without channel contention. */
  FAST("RAM"),
  /** Solid-state devices. */
  MID("SSD"),
  /** Rotational devices; unconstrained in capacity. */
  SLOW("HDD");

  private static final Tier[] VALUES = values();

  private final String device;

  Tier(String device) {
    this.device = device;
  }

  /** Returns the device label used in the per-request output, e.g. {@code SSD}. */
  public String device() {
    return device;
  }

  /** Returns the human readable name, e.g. {@code Mid}. */
  public String label() {
    return StringUtils.capitalize(name().toLowerCase(US));
  }

  /** Returns the next faster tier, if any. */
  public Optional<Tier> faster() {
    return (ordinal() == 0) ? Optional.empty() : Optional.of(VALUES[ordinal() - 1]);
  }

  /** Returns the next slower tier, if any. */
  public Optional<Tier> slower() {
    return (ordinal() == VALUES.length - 1) ? Optional.empty() : Optional.of(VALUES[ordinal() + 1]);
  }

  /** Returns whether this tier is faster than the other tier. */
  public boolean isFasterThan(Tier other) {
    return ordinal() < other.ordinal();
  }

  /** Returns the tier with the given device label (RAM, SSD, HDD) or enum name. */
  public static Tier fromDevice(String name) {
    for (Tier tier : VALUES) {
      if (tier.device.equalsIgnoreCase(name) || tier.name().equalsIgnoreCase(name)) {
        return tier;
      }
    }
    throw new IllegalArgumentException("Unknown tier: " + name);
  }
}
