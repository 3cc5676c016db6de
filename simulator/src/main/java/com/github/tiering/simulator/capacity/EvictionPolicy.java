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
package com.github.tiering.simulator.capacity;

import static java.util.Locale.US;

import org.apache.commons.lang3.StringUtils;

import com.github.tiering.simulator.capacity.TierState.Node;

/**
 * The order in which resident items are chosen for eviction. Only admission order is implemented;
 * the other names are accepted so that existing configurations keep loading, and evict in admission
 * order as well.
 */
public enum EvictionPolicy {

  /** Evicts entries based on admission order. */
  FIFO(true),

  /** Named by configuration; evicts in admission order. */
  LRU(false),

  /** Named by configuration; evicts in admission order. */
  LFU(false);

  private final boolean implemented;

  EvictionPolicy(boolean implemented) {
    this.implemented = implemented;
  }

  /** Returns whether the victim order matches the policy's name. */
  public boolean isImplemented() {
    return implemented;
  }

  public String label() {
    return StringUtils.capitalize(name().toLowerCase(US));
  }

  /** Returns the victim entry to evict, or the sentinel if the tier is empty. */
  // TODO: order victims by recency for LRU and by access count for LFU once the expected
  // behavior of these names is agreed; the tier would then need to observe hits.
  Node findVictim(Node sentinel) {
    return sentinel.next;
  }

  public static EvictionPolicy fromName(String name) {
    for (EvictionPolicy policy : values()) {
      if (policy.name().equalsIgnoreCase(name.trim())) {
        return policy;
      }
    }
    throw new IllegalArgumentException("Unknown eviction policy: " + name);
  }
}
