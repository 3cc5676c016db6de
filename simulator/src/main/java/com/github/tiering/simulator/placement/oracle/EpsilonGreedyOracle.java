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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;
import java.util.Random;

import com.github.tiering.simulator.Tier;
import com.github.tiering.simulator.placement.FeatureVector;
import com.github.tiering.simulator.placement.PlacementOracle;
import com.google.common.base.MoreObjects;

/**
 * A contextual epsilon-greedy bandit. The context is the operation and the tier that last served
 * the address, taken from the {@code RequestFeatureExtractor} layout. With probability epsilon a
 * random tier is explored, otherwise the tier with the best mean reward in the context is chosen.
 * The reward of a decision is the inverse of its latency, clamped to [0, 10]. An untried tier
 * starts at the maximum reward, so every tier is tried at least once in each context.
 */
public final class EpsilonGreedyOracle implements PlacementOracle {
  static final double MAX_REWARD = 10.0;
  static final double MIN_LATENCY = 1e-9;

  private static final Tier[] TIERS = Tier.values();
  private static final int IS_READ = 0;
  private static final int LAST_TIER_OFFSET = 4;
  private static final int CONTEXTS = 2 * (TIERS.length + 1);

  private final double[][] meanRewards;
  private final long[][] samples;
  private final double epsilon;
  private final Random random;

  private int pendingContext;
  private int pendingAction;
  private long decisions;
  private long explorations;

  public EpsilonGreedyOracle(double epsilon, long seed) {
    checkArgument((epsilon >= 0.0) && (epsilon <= 1.0), "epsilon must be in [0, 1]: %s", epsilon);
    this.meanRewards = new double[CONTEXTS][TIERS.length];
    this.samples = new long[CONTEXTS][TIERS.length];
    for (double[] rewards : meanRewards) {
      Arrays.fill(rewards, MAX_REWARD);
    }
    this.random = new Random(seed);
    this.epsilon = epsilon;
    this.pendingAction = -1;
  }

  @Override
  public Tier decide(FeatureVector features) {
    int context = context(features);
    int action;
    if (random.nextDouble() < epsilon) {
      explorations++;
      action = random.nextInt(TIERS.length);
    } else {
      action = bestAction(context);
    }
    decisions++;
    pendingContext = context;
    pendingAction = action;
    return TIERS[action];
  }

  @Override
  public void observe(double latency, FeatureVector next, boolean done) {
    if (pendingAction < 0) {
      return;
    }
    double reward = reward(latency);
    long n = ++samples[pendingContext][pendingAction];
    double mean = meanRewards[pendingContext][pendingAction];
    meanRewards[pendingContext][pendingAction] = mean + (reward - mean) / n;
    if (done) {
      pendingAction = -1;
    }
  }

  /** Returns the reward of a latency, in seconds. */
  static double reward(double latency) {
    double reward = 1.0 / Math.max(latency, MIN_LATENCY);
    return Math.min(Math.max(reward, 0.0), MAX_REWARD);
  }

  /** Returns the mean reward learned for the tier when the address was last served by another. */
  public double meanReward(boolean read, Tier lastTier, Tier tier) {
    return meanRewards[context(read, lastTier.ordinal() + 1)][tier.ordinal()];
  }

  public long decisions() {
    return decisions;
  }

  public long explorations() {
    return explorations;
  }

  private int bestAction(int context) {
    double best = Double.NEGATIVE_INFINITY;
    int ties = 0;
    int action = 0;
    for (int i = 0; i < TIERS.length; i++) {
      double value = meanRewards[context][i];
      if (value > best) {
        best = value;
        action = i;
        ties = 1;
      } else if ((value == best) && (random.nextInt(++ties) == 0)) {
        action = i;
      }
    }
    return action;
  }

  private static int context(FeatureVector features) {
    int lastTier = 0;
    for (int i = 0; i < TIERS.length; i++) {
      int index = LAST_TIER_OFFSET + i;
      if ((index < features.size()) && (features.get(index) > 0.5)) {
        lastTier = i + 1;
        break;
      }
    }
    boolean read = (features.size() > IS_READ) && (features.get(IS_READ) > 0.5);
    return context(read, lastTier);
  }

  private static int context(boolean read, int lastTier) {
    return (read ? 0 : TIERS.length + 1) + lastTier;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("epsilon", epsilon)
        .add("decisions", decisions)
        .add("explorations", explorations)
        .toString();
  }
}
