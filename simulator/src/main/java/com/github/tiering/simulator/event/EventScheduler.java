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

import java.util.PriorityQueue;

import com.google.common.base.MoreObjects;

/**
 * A discrete event scheduler that owns the virtual clock. Events run one at a time on the calling
 * thread in timestamp order, and events due at the same instant run in the order they were
 * scheduled. A simulated process suspends by scheduling its continuation; the clock only advances
 * when the next due event is taken from the timeline.
 * <p>
 * This class is not thread-safe: all scheduling must happen from the simulation thread.
 */
public final class EventScheduler {
  private final PriorityQueue<Event> timeline;

  private long sequence;
  private long executed;
  private long now;

  public EventScheduler() {
    this.timeline = new PriorityQueue<>();
  }

  /** Returns the current virtual time, in nanoseconds. */
  public long now() {
    return now;
  }

  /** Schedules the action to run after the delay, in virtual nanoseconds, has elapsed. */
  public void schedule(long delay, Runnable action) {
    checkArgument(delay >= 0, "delay must be non-negative: %s", delay);
    long time = (Long.MAX_VALUE - now < delay) ? Long.MAX_VALUE : now + delay;
    timeline.add(new Event(time, sequence++, action));
  }

  /** Runs the next due event, returning false if the timeline is empty. */
  public boolean step() {
    Event event = timeline.poll();
    if (event == null) {
      return false;
    }
    now = event.time;
    executed++;
    event.action.run();
    return true;
  }

  /** Runs events until none remain. */
  public void run() {
    while (step()) {}
  }

  /** Returns the number of events waiting on the timeline. */
  public int pending() {
    return timeline.size();
  }

  /** Returns the number of events that have run. */
  public long executed() {
    return executed;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("now", now)
        .add("pending", timeline.size())
        .add("executed", executed)
        .toString();
  }

  private static final class Event implements Comparable<Event> {
    final long time;
    final long order;
    final Runnable action;

    Event(long time, long order, Runnable action) {
      this.time = time;
      this.order = order;
      this.action = action;
    }

    @Override
    public int compareTo(Event other) {
      int result = Long.compare(time, other.time);
      return (result == 0) ? Long.compare(order, other.order) : result;
    }
  }
}
