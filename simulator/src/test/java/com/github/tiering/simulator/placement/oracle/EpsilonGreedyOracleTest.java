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
package com.github.tiering.simulator.placement.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.placement.FeatureVector;

public final class EpsilonGreedyOracleTest {
  private static final FeatureVector READ_FROM_SLOW = FeatureVector.of(1, 0.5, 0.5, 0, 0, 0, 1);

  @Test
  void rewardIsClampedInverseLatency() {
    assertThat(EpsilonGreedyOracle.reward(0.5)).isEqualTo(2.0);
    assertThat(EpsilonGreedyOracle.reward(0.0)).isEqualTo(EpsilonGreedyOracle.MAX_REWARD);
    assertThat(EpsilonGreedyOracle.reward(1e-6)).isEqualTo(EpsilonGreedyOracle.MAX_REWARD);
    assertThat(EpsilonGreedyOracle.reward(1_000.0)).isEqualTo(0.001);
  }

  @Test
  void exploitsTheBestTier() {
    EpsilonGreedyOracle oracle = new EpsilonGreedyOracle(0.0, 42);
    for (int i = 0; i < 50; i++) {
      Tier tier = oracle.decide(READ_FROM_SLOW);
      oracle.observe((tier == Tier.MID) ? 0.1 : 10.0, READ_FROM_SLOW, false);
    }

    for (int i = 0; i < 10; i++) {
      assertThat(oracle.decide(READ_FROM_SLOW)).isEqualTo(Tier.MID);
      oracle.observe(0.1, READ_FROM_SLOW, false);
    }
    assertThat(oracle.meanReward(true, Tier.SLOW, Tier.MID)).isEqualTo(10.0);
    assertThat(oracle.explorations()).isZero();
  }

  @Test
  void exploresEveryTier() {
    EpsilonGreedyOracle oracle = new EpsilonGreedyOracle(1.0, 7);
    Set<Tier> seen = EnumSet.noneOf(Tier.class);
    for (int i = 0; i < 200; i++) {
      seen.add(oracle.decide(READ_FROM_SLOW));
    }

    assertThat(seen).containsExactlyInAnyOrder(Tier.values());
    assertThat(oracle.explorations()).isEqualTo(200);
    assertThat(oracle.decisions()).isEqualTo(200);
  }

  @Test
  void seededRunsAreReproducible() {
    EpsilonGreedyOracle first = new EpsilonGreedyOracle(0.3, 11);
    EpsilonGreedyOracle second = new EpsilonGreedyOracle(0.3, 11);
    for (int i = 0; i < 100; i++) {
      Tier tier = first.decide(READ_FROM_SLOW);
      assertThat(second.decide(READ_FROM_SLOW)).isEqualTo(tier);
      first.observe(0.01 * i, READ_FROM_SLOW, false);
      second.observe(0.01 * i, READ_FROM_SLOW, false);
    }
  }

  @Test
  void observeWithoutDecisionIsIgnored() {
    EpsilonGreedyOracle oracle = new EpsilonGreedyOracle(0.0, 1);
    oracle.observe(10.0, READ_FROM_SLOW, true);

    for (Tier tier : Tier.values()) {
      assertThat(oracle.meanReward(true, Tier.SLOW, tier))
          .isEqualTo(EpsilonGreedyOracle.MAX_REWARD);
    }
  }

  @Test
  void epsilonOutOfRange() {
    assertThatThrownBy(() -> new EpsilonGreedyOracle(1.5, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
