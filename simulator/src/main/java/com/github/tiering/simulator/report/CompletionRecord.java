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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;

/** The outcome of a completed request. Times are in virtual nanoseconds. */
public final class CompletionRecord {
  private static final double NANOS_PER_MILLI = 1_000_000.0;

  private final long departure;
  private final long address;
  private final long arrival;
  private final Tier tier;

  public CompletionRecord(long address, long arrival, long departure, Tier tier) {
    checkArgument(departure >= arrival, "departure %s precedes arrival %s", departure, arrival);
    this.tier = requireNonNull(tier);
    this.departure = departure;
    this.address = address;
    this.arrival = arrival;
  }

  public long address() {
    return address;
  }

  public long arrival() {
    return arrival;
  }

  public long departure() {
    return departure;
  }

  public long servedTime() {
    return departure - arrival;
  }

  public Tier tier() {
    return tier;
  }

  public double arrivalMillis() {
    return arrival / NANOS_PER_MILLI;
  }

  public double departureMillis() {
    return departure / NANOS_PER_MILLI;
  }

  public double servedMillis() {
    return servedTime() / NANOS_PER_MILLI;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("address", address)
        .add("arrival", arrival)
        .add("departure", departure)
        .add("tier", tier.device())
        .toString();
  }
}
