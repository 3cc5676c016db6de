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
package com.github.tiering.simulator.migration;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import com.google.common.base.MoreObjects;

/**
 * A bounded FIFO of proposed migrations shared by the selector and the executor. Neither side ever
 * blocks: an enqueue on a full queue fails and the candidate is dropped.
 */
public final class MigrationQueue {
  private final BlockingQueue<MigrationCandidate> queue;
  private final int capacity;

  public MigrationQueue(int capacity) {
    checkArgument(capacity > 0, "capacity must be positive");
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.capacity = capacity;
  }

  /** Appends the candidate, returning false without waiting if the queue is full. */
  public boolean enqueue(MigrationCandidate candidate) {
    return queue.offer(candidate);
  }

  /** Removes the oldest candidate, if any. */
  public Optional<MigrationCandidate> dequeue() {
    return Optional.ofNullable(queue.poll());
  }

  /** Returns the queued candidates, oldest first. */
  public List<MigrationCandidate> candidates() {
    return new ArrayList<>(queue);
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public boolean isFull() {
    return queue.remainingCapacity() == 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("size", size())
        .add("capacity", capacity)
        .toString();
  }
}
