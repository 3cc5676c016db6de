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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.github.tiering.simulator.BasicSettings;
import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Request.Operation;
import com.github.tiering.simulator.SettingsFixture;
import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.capacity.CapacityManager;

public final class PlacementDispatcherTest {

  @Test
  void durationIsSizeOverRate() {
    PlacementDispatcher dispatcher = dispatcher(request -> Tier.MID, 1_000.0, 500.0);

    Placement read = dispatcher.dispatch(Request.read(1, 2_000));
    Placement write = dispatcher.dispatch(
        Request.builder().address(1).size(2_000).operation(Operation.WRITE).build());

    assertThat(read.tier()).isEqualTo(Tier.MID);
    assertThat(read.duration()).isEqualTo(2_000_000_000L);
    assertThat(write.duration()).isEqualTo(4_000_000_000L);
  }

  @Test
  void fastTierUsesTheNominalDuration() {
    PlacementDispatcher dispatcher = dispatcher(request -> Tier.FAST, 1.0, 1.0);

    Placement placement = dispatcher.dispatch(Request.read(1, 1_000_000_000));

    assertThat(placement.duration()).isEqualTo(10);
  }

  @Test
  void completionIsCountedOnce() {
    ServiceCounters counters = new ServiceCounters();
    PlacementDispatcher dispatcher = new PlacementDispatcher(request -> Tier.SLOW,
        rates(1.0), rates(1.0), 10, counters);
    Request request = Request.read(2, 10);
    Placement placement = dispatcher.dispatch(request);

    dispatcher.complete(request, placement, 100, 350, false);

    assertThat(counters.reads(Tier.SLOW)).isEqualTo(1);
    assertThat(counters.writes(Tier.SLOW)).isZero();
    assertThat(counters.servedTime(Tier.SLOW)).isEqualTo(250);
    assertThat(counters.totalOperations()).isEqualTo(1);
    assertThat(counters.averageServedTime(Tier.MID)).isZero();
  }

  @Test
  void departureBeforeArrival() {
    PlacementDispatcher dispatcher = dispatcher(request -> Tier.SLOW, 1.0, 1.0);
    Request request = Request.read(2, 10);

    assertThatThrownBy(() -> dispatcher.complete(request, new Placement(Tier.SLOW, 1), 10, 5, false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromSettings() {
    BasicSettings settings = SettingsFixture.settings()
        .with("policy", "all_ssd")
        .with("tiers.mid.read-rate", 1)
        .build();
    PlacementDispatcher dispatcher = PlacementDispatcher.from(settings,
        CapacityManager.from(settings), new ServiceCounters());

    Placement placement = dispatcher.dispatch(Request.read(1, 1024 * 1024));

    assertThat(dispatcher.policy()).isInstanceOf(PinnedTierPolicy.class);
    assertThat(placement.tier()).isEqualTo(Tier.MID);
    assertThat(placement.duration()).isEqualTo(1_000_000_000L);
  }

  private static PlacementDispatcher dispatcher(PlacementPolicy policy, double read, double write) {
    return new PlacementDispatcher(policy, rates(read), rates(write), 10, new ServiceCounters());
  }

  private static Map<Tier, Double> rates(double rate) {
    Map<Tier, Double> rates = new EnumMap<>(Tier.class);
    rates.put(Tier.MID, rate);
    rates.put(Tier.SLOW, rate);
    return rates;
  }
}
