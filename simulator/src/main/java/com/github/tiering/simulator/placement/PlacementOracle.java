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

import com.github.tiering.simulator.Tier;

/**
 * An external decision service that selects the serving tier of each request. The simulator only
 * supplies feature vectors, applies the decision, and reports the observed outcome; it never
 * inspects how the oracle decides.
 */
public interface PlacementOracle {

  /** Returns the tier that should serve the request described by the features. */
  Tier decide(FeatureVector features);

  /**
   * Reports the outcome of the most recent decision.
   *
   * @param latency the latency experienced, in seconds
   * @param next the features of the following state
   * @param done whether the run has ended
   */
  void observe(double latency, FeatureVector next, boolean done);
}
