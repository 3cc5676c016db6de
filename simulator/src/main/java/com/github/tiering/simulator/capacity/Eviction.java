package com.github.tiering.simulator.capacity;

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;

/** The outcome of an eviction pass: how many items were removed and the bytes that were freed. */
public final class Eviction {
  private final Tier tier;
  private final int count;
  private final long bytesFreed;

  Eviction(Tier tier, int count, long bytesFreed) {
    this.tier = tier;
    this.count = count;
    this.bytesFreed = bytesFreed;
  }

  public Tier tier() {
    return tier;
  }

  public int count() {
    return count;
  }

  public long bytesFreed() {
    return bytesFreed;
  }

  public boolean isEmpty() {
    return count == 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tier", tier)
        .add("count", count)
        .add("bytesFreed", bytesFreed)
        .toString();
  }
}
