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
package com.github.tiering.simulator.event;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.function.Consumer;

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;

/**
 * A fixed number of parallel service channels of a device tier. A request that finds every channel
 * busy waits in arrival order; releasing a channel hands it to the oldest waiter, which resumes at
 * the current virtual time. There is no priority, so no waiter is passed over.
 */
public final class ResourcePool {
  private final Queue<Consumer<Ticket>> waiters;
  private final EventScheduler scheduler;
  private final int capacity;
  private final Tier tier;

  private long ticketIds;
  private long granted;
  private long queued;
  private int maxWaiting;
  private int inUse;

  public ResourcePool(Tier tier, int capacity, EventScheduler scheduler) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.scheduler = requireNonNull(scheduler);
    this.tier = requireNonNull(tier);
    this.waiters = new ArrayDeque<>();
    this.capacity = capacity;
  }

  /**
   * Requests a channel. The callback runs immediately if a channel is free and no one is waiting,
   * otherwise once every earlier waiter has been served and a channel is released.
   */
  public void acquire(Consumer<Ticket> onGranted) {
    requireNonNull(onGranted);
    if ((inUse < capacity) && waiters.isEmpty()) {
      inUse++;
      onGranted.accept(issue());
    } else {
      queued++;
      waiters.add(onGranted);
      maxWaiting = Math.max(maxWaiting, waiters.size());
    }
  }

  /** Frees the ticket's channel and wakes the next waiter, if any. */
  public void release(Ticket ticket) {
    checkArgument(ticket.pool == this, "%s was not issued by %s", ticket, this);
    checkState(!ticket.released, "%s was already released", ticket);
    ticket.released = true;
    inUse--;

    Consumer<Ticket> next = waiters.poll();
    if (next != null) {
      // the channel is reserved now so that a later arrival cannot overtake the waiter
      inUse++;
      Ticket handoff = issue();
      scheduler.schedule(0, () -> next.accept(handoff));
    }
  }

  private Ticket issue() {
    granted++;
    return new Ticket(this, ticketIds++);
  }

  public Tier tier() {
    return tier;
  }

  public int capacity() {
    return capacity;
  }

  /** Returns the number of channels currently held or reserved. */
  public int inUse() {
    return inUse;
  }

  /** Returns the number of requests waiting for a channel. */
  public int waiting() {
    return waiters.size();
  }

  /** Returns the number of channels handed out over the run. */
  public long granted() {
    return granted;
  }

  /** Returns the number of requests that had to wait for a channel. */
  public long queued() {
    return queued;
  }

  /** Returns the longest the wait queue has been. */
  public int maxWaiting() {
    return maxWaiting;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tier", tier)
        .add("capacity", capacity)
        .add("inUse", inUse)
        .add("waiting", waiters.size())
        .toString();
  }

  /** A held channel; released exactly once. */
  public static final class Ticket {
    final ResourcePool pool;
    final long id;
    boolean released;

    Ticket(ResourcePool pool, long id) {
      this.pool = pool;
      this.id = id;
    }

    public Tier tier() {
      return pool.tier;
    }

    public long id() {
      return id;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("tier", pool.tier)
          .add("id", id)
          .add("released", released)
          .toString();
    }
  }
}
