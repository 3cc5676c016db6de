package com.github.tiering.simulator.placement;

import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Tier;

/** Builds the feature vectors handed to a {@link PlacementOracle}. */
public interface FeatureExtractor {

  /** Returns the features of the request in the current context. */
  FeatureVector extract(Request request);

  /** Records the tier that last served the address. */
  void recordTier(long address, Tier tier);
}
