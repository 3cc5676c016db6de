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

import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Tier;
import com.google.common.collect.ImmutableList;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * Describes a request by its operation, its normalized address, size and recorded service time,
 * and the tier that last served its address. Values are normalized against the largest seen so
 * far, so the vector stays within [0, 1].
 */
public final class RequestFeatureExtractor implements FeatureExtractor {
  public static final ImmutableList<String> FEATURE_NAMES = ImmutableList.of("is_read",
      "address", "size", "service_time", "last_tier_ram", "last_tier_ssd", "last_tier_hdd");

  private static final int LAST_TIER_OFFSET = 4;

  private final Long2ObjectMap<Tier> lastTier;

  private double maxAddress;
  private double maxService;
  private double maxSize;

  public RequestFeatureExtractor() {
    this.lastTier = new Long2ObjectOpenHashMap<>();
  }

  @Override
  public FeatureVector extract(Request request) {
    double address = Math.abs((double) request.address());
    double size = request.size();
    double service = request.serviceTime().isPresent()
        ? request.serviceTime().getAsLong() / 1e9
        : 0.0;
    maxAddress = Math.max(maxAddress, address);
    maxService = Math.max(maxService, service);
    maxSize = Math.max(maxSize, size);

    double[] features = new double[FEATURE_NAMES.size()];
    features[0] = request.isRead() ? 1.0 : 0.0;
    features[1] = linear(address, maxAddress);
    features[2] = linear(size, maxSize);
    features[3] = logarithmic(service, maxService);
    Tier last = lastTier.get(request.address());
    if (last != null) {
      features[LAST_TIER_OFFSET + last.ordinal()] = 1.0;
    }
    return FeatureVector.of(features);
  }

  @Override
  public void recordTier(long address, Tier tier) {
    lastTier.put(address, tier);
  }

  private static double linear(double value, double max) {
    return (max <= 0.0) ? 0.0 : Math.min(Math.max(value / max, 0.0), 1.0);
  }

  private static double logarithmic(double value, double max) {
    return ((value <= 0.0) || (max <= 0.0)) ? 0.0 : Math.log1p(value) / Math.log1p(max);
  }
}
