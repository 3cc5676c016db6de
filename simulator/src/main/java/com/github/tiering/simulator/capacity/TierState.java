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
package com.github.tiering.simulator.capacity;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.github.tiering.simulator.Tier;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * The capacity accounting of one constrained tier: the resident items, their sizes, the bytes in
 * use, and the admission order that eviction walks. The bytes in use always equal the sum of the
 * resident sizes.
 */
public final class TierState {
  private final Long2ObjectMap<Node> data;
  private final long capacity;
  private final Node sentinel;
  private final Tier tier;

  private long used;

  TierState(Tier tier, long capacity) {
    checkArgument(capacity >= 0, "capacity must be non-negative: %s", capacity);
    this.data = new Long2ObjectOpenHashMap<>();
    this.sentinel = new Node();
    this.capacity = capacity;
    this.tier = tier;
  }

  public Tier tier() {
    return tier;
  }

  /** Returns the capacity in bytes. */
  public long capacity() {
    return capacity;
  }

  /** Returns the bytes held by resident items. */
  public long used() {
    return used;
  }

  public long available() {
    return capacity - used;
  }

  /** Returns the fraction of the capacity in use, or 1.0 for a tier without capacity. */
  public double usage() {
    return (capacity == 0) ? 1.0 : (double) used / capacity;
  }

  public int residentCount() {
    return data.size();
  }

  public boolean contains(long id) {
    return data.containsKey(id);
  }

  /** Returns the size of the resident item, or -1 if it is not resident. */
  public long sizeOf(long id) {
    Node node = data.get(id);
    return (node == null) ? -1 : node.size;
  }

  /** Returns the resident ids, oldest admission first. */
  public ImmutableList<Long> admissionOrder() {
    ImmutableList.Builder<Long> ids = ImmutableList.builderWithExpectedSize(data.size());
    for (Node node = sentinel.next; node != sentinel; node = node.next) {
      ids.add(node.id);
    }
    return ids.build();
  }

  /** Appends the item to the admission order. The caller has made room for it. */
  void add(long id, long size) {
    checkState(!data.containsKey(id), "%s is already resident in %s", id, tier);
    Node node = new Node(id, size, sentinel);
    node.appendToTail();
    data.put(id, node);
    used += size;
  }

  /** Removes the item, returning its size or -1 if it was not resident. */
  long remove(long id) {
    Node node = data.remove(id);
    if (node == null) {
      return -1;
    }
    used -= node.size;
    node.remove();
    return node.size;
  }

  /** Returns the entry the policy would evict next, or null if the tier is empty. */
  Node victim(EvictionPolicy policy) {
    Node victim = policy.findVictim(sentinel);
    return (victim == sentinel) ? null : victim;
  }

  /** Checks that the accounting is consistent. */
  void verify() {
    checkState(used <= capacity, "%s uses %s of %s bytes", tier, used, capacity);
    long actualUsed = data.values().stream().mapToLong(node -> node.size).sum();
    checkState(actualUsed == used, "%s accounts %s bytes but holds %s", tier, used, actualUsed);
    long linked = 0;
    for (Node node = sentinel.next; node != sentinel; node = node.next) {
      linked++;
    }
    checkState(linked == data.size(), "%s links %s of %s entries", tier, linked, data.size());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tier", tier)
        .add("used", used)
        .add("capacity", capacity)
        .add("resident", data.size())
        .toString();
  }

  /** A node on the double-linked admission list. */
  static final class Node {
    final Node sentinel;

    Node prev;
    Node next;
    long id;
    long size;

    /** Creates a new sentinel node. */
    Node() {
      this.id = Long.MIN_VALUE;
      this.sentinel = this;
      this.prev = this;
      this.next = this;
    }

    /** Creates a new, unlinked node. */
    Node(long id, long size, Node sentinel) {
      this.sentinel = sentinel;
      this.size = size;
      this.id = id;
    }

    /** Appends the node to the tail of the list. */
    void appendToTail() {
      Node tail = sentinel.prev;
      sentinel.prev = this;
      tail.next = this;
      next = sentinel;
      prev = tail;
    }

    /** Removes the node from the list. */
    void remove() {
      prev.next = next;
      next.prev = prev;
      prev = next = null;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("id", id)
          .add("size", size)
          .toString();
    }
  }
}
