package com.github.tiering.simulator.placement;

import static java.util.Objects.requireNonNull;

import com.github.tiering.simulator.Request.Operation;
import com.github.tiering.simulator.Tier;

/**
 * Per-tier tallies of the requests served and their cumulative served time. Each completed request
 * is recorded exactly once, so the counters never decrease. Owned by one simulation run.
 */
public final class ServiceCounters {
  private final long[] reads;
  private final long[] writes;
  private final long[] servedTimes;

  public ServiceCounters() {
    this.reads = new long[Tier.values().length];
    this.writes = new long[Tier.values().length];
    this.servedTimes = new long[Tier.values().length];
  }

  /** Records a completed request and the virtual time from its arrival to its departure. */
  public void record(Tier tier, Operation operation, long servedTime) {
    requireNonNull(operation);
    int level = tier.ordinal();
    if (operation == Operation.READ) {
      reads[level]++;
    } else {
      writes[level]++;
    }
    servedTimes[level] += servedTime;
  }

  public long reads(Tier tier) {
    return reads[tier.ordinal()];
  }

  public long writes(Tier tier) {
    return writes[tier.ordinal()];
  }

  public long requests(Tier tier) {
    return reads[tier.ordinal()] + writes[tier.ordinal()];
  }

  /** Returns the cumulative served time, in virtual nanoseconds. */
  public long servedTime(Tier tier) {
    return servedTimes[tier.ordinal()];
  }

  /** Returns the mean served time, in virtual nanoseconds, or zero if the tier served nothing. */
  public double averageServedTime(Tier tier) {
    long requests = requests(tier);
    return (requests == 0) ? 0.0 : (double) servedTimes[tier.ordinal()] / requests;
  }

  public long totalOperations() {
    long total = 0;
    for (Tier tier : Tier.values()) {
      total += requests(tier);
    }
    return total;
  }
}
