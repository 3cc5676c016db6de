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

import com.github.tiering.simulator.Tier;

/**
 * Indicates that a tier cannot hold an item even after evicting every resident item, meaning that
 * the tier is undersized for the workload. The run is aborted rather than admitting partially.
 */
public final class CapacityFaultException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final Tier tier;
  private final long id;
  private final long size;
  private final long capacity;

  public CapacityFaultException(Tier tier, long id, long size, long capacity) {
    super(String.format(US, "%s tier of %,d bytes cannot hold item %d of %,d bytes",
        tier.label(), capacity, id, size));
    this.capacity = capacity;
    this.tier = tier;
    this.size = size;
    this.id = id;
  }

  public Tier tier() {
    return tier;
  }

  public long id() {
    return id;
  }

  public long size() {
    return size;
  }

  public long capacity() {
    return capacity;
  }
}
