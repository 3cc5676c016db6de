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

import static java.util.Locale.US;

import com.github.tiering.simulator.BasicSettings;
import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.CapacityManager;
import com.github.tiering.simulator.placement.oracle.PlacementOracles;
import com.google.common.collect.ImmutableSet;

/**
 * The closed set of placement policies. The configuration selects exactly one, which is built once
 * when the run starts.
 */
public enum PlacementPolicyType {
  /** Address parity selects the solid-state or the rotational tier. */
  HASHED("hashed") {
    @Override public PlacementPolicy create(BasicSettings settings, CapacityManager capacity) {
      return new FixedAssignmentPolicy();
    }
  },
  /** The solid-state tier caches the rotational tier. */
  MID_CACHING("mid-caching", "ssd_caching") {
    @Override public PlacementPolicy create(BasicSettings settings, CapacityManager capacity) {
      return new MidTierCachingPolicy(capacity);
    }
  },
  /** The trace's zone label routes the request unless it is resident in memory. */
  ZONED("zoned", "f4") {
    @Override public PlacementPolicy create(BasicSettings settings, CapacityManager capacity) {
      return new ZonedPolicy(capacity);
    }
  },
  /** An external placement oracle decides. */
  ORACLE("oracle", "rl_c51") {
    @Override public PlacementPolicy create(BasicSettings settings, CapacityManager capacity) {
      return new OraclePolicy(PlacementOracles.create(settings),
          new RequestFeatureExtractor(), capacity);
    }
  },
  ALL_FAST("all-fast", "all_ram") {
    @Override public PlacementPolicy create(BasicSettings settings, CapacityManager capacity) {
      return new PinnedTierPolicy(Tier.FAST, capacity);
    }
  },
  ALL_MID("all-mid", "all_ssd") {
    @Override public PlacementPolicy create(BasicSettings settings, CapacityManager capacity) {
      return new PinnedTierPolicy(Tier.MID, capacity);
    }
  },
  ALL_SLOW("all-slow", "all_hdd") {
    @Override public PlacementPolicy create(BasicSettings settings, CapacityManager capacity) {
      return new PinnedTierPolicy(Tier.SLOW, capacity);
    }
  };

  private final ImmutableSet<String> names;

  PlacementPolicyType(String name, String... aliases) {
    this.names = ImmutableSet.<String>builder().add(name).add(aliases).build();
  }

  /** Returns the configuration name of the policy. */
  public String label() {
    return names.iterator().next();
  }

  /** Returns a new instance of the policy for a single run. */
  public abstract PlacementPolicy create(BasicSettings settings, CapacityManager capacity);

  /** Returns the policy for the configuration name or one of its historic aliases. */
  public static PlacementPolicyType fromName(String name) {
    String normalized = name.trim().toLowerCase(US);
    for (PlacementPolicyType type : values()) {
      if (type.names.contains(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown placement policy: " + name);
  }
}
