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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.EnumMap;
import java.util.Map;

import com.github.tiering.simulator.BasicSettings;
import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.CapacityManager;
import com.google.common.base.MoreObjects;

/**
 * Maps each request to the tier that serves it and the virtual time its transfer takes, and
 * accounts for every completed request exactly once.
 * <p>
 * A transfer on a device tier lasts {@code size / rate}, with the rate chosen by the operation. The
 * volatile tier serves every request in a fixed nominal time.
 */
public final class PlacementDispatcher {
  private final Map<Tier, double[]> rates;
  private final ServiceCounters counters;
  private final PlacementPolicy policy;
  private final long fastHitDuration;

  /**
   * @param policy the single active policy of the run
   * @param readRates the read rates of the device tiers, in bytes per virtual second
   * @param writeRates the write rates of the device tiers, in bytes per virtual second
   * @param fastHitDuration the service time of the volatile tier, in virtual nanoseconds
   * @param counters the run's service counters
   */
  public PlacementDispatcher(PlacementPolicy policy, Map<Tier, Double> readRates,
      Map<Tier, Double> writeRates, long fastHitDuration, ServiceCounters counters) {
    checkArgument(fastHitDuration >= 0, "fast hit duration must be non-negative");
    this.rates = new EnumMap<>(Tier.class);
    for (Tier tier : new Tier[] { Tier.MID, Tier.SLOW }) {
      double read = requireNonNull(readRates.get(tier), () -> "No read rate for " + tier);
      double write = requireNonNull(writeRates.get(tier), () -> "No write rate for " + tier);
      checkArgument((read > 0) && (write > 0), "%s rates must be positive", tier);
      rates.put(tier, new double[] { read, write });
    }
    this.counters = requireNonNull(counters);
    this.policy = requireNonNull(policy);
    this.fastHitDuration = fastHitDuration;
  }

  /** Returns a dispatcher for the configured policy. */
  public static PlacementDispatcher from(BasicSettings settings,
      CapacityManager capacity, ServiceCounters counters) {
    Map<Tier, Double> readRates = new EnumMap<>(Tier.class);
    Map<Tier, Double> writeRates = new EnumMap<>(Tier.class);
    for (Tier tier : new Tier[] { Tier.MID, Tier.SLOW }) {
      readRates.put(tier, settings.tiers().readRate(tier));
      writeRates.put(tier, settings.tiers().writeRate(tier));
    }
    PlacementPolicy policy = settings.policy().create(settings, capacity);
    return new PlacementDispatcher(policy, readRates, writeRates,
        settings.fastHitDuration(), counters);
  }

  /** Selects the serving tier and computes the transfer duration of the request. */
  public Placement dispatch(Request request) {
    Tier tier = policy.select(request);
    checkState(tier != null, "%s selected no tier for %s", policy, request);
    return new Placement(tier, duration(tier, request));
  }

  /** Returns the virtual time, in nanoseconds, that the tier takes to transfer the request. */
  public long duration(Tier tier, Request request) {
    if (tier == Tier.FAST) {
      return fastHitDuration;
    }
    double rate = rates.get(tier)[request.isRead() ? 0 : 1];
    double nanos = request.size() / rate * 1e9;
    return (nanos >= Long.MAX_VALUE) ? Long.MAX_VALUE : (long) nanos;
  }

  /**
   * Accounts for a served request and notifies the policy.
   *
   * @param arrival the virtual time the request arrived
   * @param departure the virtual time its transfer completed
   * @param last whether no further requests follow
   */
  public void complete(Request request, Placement placement,
      long arrival, long departure, boolean last) {
    checkArgument(departure >= arrival, "departure %s precedes arrival %s", departure, arrival);
    long servedTime = departure - arrival;
    counters.record(placement.tier(), request.operation(), servedTime);
    policy.onServed(request, placement, servedTime, last);
  }

  public PlacementPolicy policy() {
    return policy;
  }

  public ServiceCounters counters() {
    return counters;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("policy", policy.getClass().getSimpleName())
        .add("fastHitDuration", fastHitDuration)
        .toString();
  }
}
