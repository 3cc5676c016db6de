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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.CapacityManager;

/**
 * Delegates each placement to a {@link PlacementOracle}. After the request is served, the item is
 * admitted into the chosen tier and the oracle is told the latency: the service time the trace
 * recorded when it has one, otherwise the simulated transfer time.
 */
public final class OraclePolicy implements PlacementPolicy {
  private final FeatureExtractor extractor;
  private final CapacityManager capacity;
  private final PlacementOracle oracle;

  public OraclePolicy(PlacementOracle oracle, FeatureExtractor extractor,
      CapacityManager capacity) {
    this.extractor = requireNonNull(extractor);
    this.capacity = requireNonNull(capacity);
    this.oracle = requireNonNull(oracle);
  }

  @Override
  public Tier select(Request request) {
    Tier tier = oracle.decide(extractor.extract(request));
    checkState(tier != null, "%s made no decision for %s", oracle, request);
    return tier;
  }

  @Override
  public void onServed(Request request, Placement placement, long servedTime, boolean last) {
    capacity.admit(placement.tier(), request.address(), request.size());
    extractor.recordTier(request.address(), placement.tier());

    long latency = request.serviceTime().orElse(placement.duration());
    oracle.observe(latency / 1e9, extractor.extract(request), last);
  }
}
