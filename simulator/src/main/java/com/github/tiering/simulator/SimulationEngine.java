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
package com.github.tiering.simulator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

import com.github.tiering.simulator.capacity.CapacityManager;
import com.github.tiering.simulator.event.EventScheduler;
import com.github.tiering.simulator.event.ResourcePool;
import com.github.tiering.simulator.event.ResourcePool.Ticket;
import com.github.tiering.simulator.migration.MigrationOrchestrator;
import com.github.tiering.simulator.migration.MigrationStatistics;
import com.github.tiering.simulator.placement.Placement;
import com.github.tiering.simulator.placement.PlacementDispatcher;
import com.github.tiering.simulator.placement.ServiceCounters;
import com.github.tiering.simulator.report.CompletionListener;
import com.github.tiering.simulator.report.CompletionRecord;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;

/**
 * Replays requests against the tier hierarchy on a virtual clock. Each request arrives, waits for
 * a channel of its device tier, is served for its transfer duration and completes. Arrivals are
 * spaced by the difference of consecutive trace timestamps, clamped at zero.
 * <p>
 * Every completion is accounted by the dispatcher, reported to the listener and, when migration is
 * enabled, tracked by the migration orchestrator, which is asked for a migration check after every
 * {@code check-interval} completions. The engine runs once.
 */
public final class SimulationEngine {
  private static final Logger logger = LogManager.getLogger(SimulationEngine.class);

  private final @Nullable MigrationOrchestrator orchestrator;
  private final Map<Tier, ResourcePool> pools;
  private final PlacementDispatcher dispatcher;
  private final CompletionListener listener;
  private final EventScheduler scheduler;
  private final CapacityManager capacity;
  private final ServiceCounters counters;
  private final int checkInterval;

  private PeekingIterator<Request> arrivals;
  private boolean exhausted;
  private long completed;
  private long arrived;
  private int inFlight;
  private int maxInFlight;

  public SimulationEngine(BasicSettings settings, CompletionListener listener) {
    this.scheduler = new EventScheduler();
    this.counters = new ServiceCounters();
    this.listener = requireNonNull(listener);
    this.capacity = CapacityManager.from(settings);
    this.dispatcher = PlacementDispatcher.from(settings, capacity, counters);
    this.pools = new EnumMap<>(Tier.class);
    for (Tier tier : new Tier[] { Tier.MID, Tier.SLOW }) {
      pools.put(tier, new ResourcePool(tier, settings.tiers().channels(tier), scheduler));
    }
    this.checkInterval = settings.migration().checkInterval();
    checkArgument(checkInterval > 0, "check interval must be positive");
    this.orchestrator = settings.migration().enabled()
        ? MigrationOrchestrator.from(settings, capacity.capacity(Tier.FAST),
            capacity.capacity(Tier.MID))
        : null;
    logger.info("Simulating the {} policy (RAM: {} bytes, SSD: {} bytes, migration {})",
        settings.policy().label(), capacity.capacity(Tier.FAST), capacity.capacity(Tier.MID),
        (orchestrator == null) ? "disabled" : "enabled");
  }

  /**
   * Replays the requests to completion.
   *
   * @throws com.github.tiering.simulator.capacity.CapacityFaultException if a tier is too small
   *         for an item it must hold
   */
  public SimulationResult run(Stream<Request> requests) {
    checkState(arrivals == null, "The simulation already ran");
    arrivals = Iterators.peekingIterator(requests.iterator());

    Optional<MigrationStatistics> migration = Optional.empty();
    if (orchestrator != null) {
      orchestrator.start();
    }
    try {
      scheduler.schedule(0, this::arrive);
      scheduler.run();
      checkState(inFlight == 0, "%s requests never completed", inFlight);
      capacity.verify();
    } finally {
      if (orchestrator != null) {
        migration = Optional.of(orchestrator.shutdown());
      }
    }
    return new SimulationResult(counters, capacity, migration,
        completed, scheduler.now(), maxInFlight);
  }

  /** Starts serving the next request and schedules the arrival after it. */
  private void arrive() {
    if (!arrivals.hasNext()) {
      exhausted = true;
      return;
    }
    Request request = arrivals.next();
    arrived++;
    serve(request);

    if (arrivals.hasNext()) {
      long gap = Math.max(0, arrivals.peek().timestamp() - request.timestamp());
      scheduler.schedule(gap, this::arrive);
    } else {
      exhausted = true;
    }
  }

  private void serve(Request request) {
    long arrival = scheduler.now();
    Placement placement = dispatcher.dispatch(request);
    inFlight++;
    maxInFlight = Math.max(maxInFlight, inFlight);

    ResourcePool pool = pools.get(placement.tier());
    if (pool == null) {
      scheduler.schedule(placement.duration(), () -> complete(request, placement, arrival, null));
    } else {
      pool.acquire(ticket -> scheduler.schedule(placement.duration(),
          () -> complete(request, placement, arrival, ticket)));
    }
  }

  private void complete(Request request, Placement placement, long arrival,
      @Nullable Ticket ticket) {
    if (ticket != null) {
      pools.get(placement.tier()).release(ticket);
    }
    inFlight--;
    long departure = scheduler.now();
    boolean last = exhausted && (inFlight == 0);
    dispatcher.complete(request, placement, arrival, departure, last);
    listener.onCompletion(new CompletionRecord(request.address(),
        arrival, departure, placement.tier()));
    completed++;

    if (orchestrator != null) {
      orchestrator.trackRequest(request.address(), placement.tier(),
          departure - arrival, request.size(), departure);
      if ((completed % checkInterval) == 0) {
        orchestrator.periodicUpdate(capacity.used(Tier.MID), capacity.used(Tier.FAST));
      }
    }
  }

  public Optional<MigrationOrchestrator> orchestrator() {
    return Optional.ofNullable(orchestrator);
  }

  public ResourcePool pool(Tier tier) {
    ResourcePool pool = pools.get(tier);
    checkArgument(pool != null, "%s tier has no channels", tier);
    return pool;
  }

  public EventScheduler scheduler() {
    return scheduler;
  }

  public CapacityManager capacity() {
    return capacity;
  }

  public PlacementDispatcher dispatcher() {
    return dispatcher;
  }

  /** Returns the number of requests that have arrived so far. */
  public long arrived() {
    return arrived;
  }
}
