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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.github.tiering.simulator.Tier;

public final class MigrationQueueTest {

  @Test
  void isFirstInFirstOut() {
    MigrationQueue queue = new MigrationQueue(3);
    queue.enqueue(candidate(1));
    queue.enqueue(candidate(2));

    assertThat(queue.dequeue()).map(MigrationCandidate::address).hasValue(1L);
    assertThat(queue.dequeue()).map(MigrationCandidate::address).hasValue(2L);
    assertThat(queue.dequeue()).isEmpty();
  }

  @Test
  void rejectsWhenFullWithoutDisplacing() {
    MigrationQueue queue = new MigrationQueue(2);

    assertThat(queue.enqueue(candidate(1))).isTrue();
    assertThat(queue.enqueue(candidate(2))).isTrue();
    assertThat(queue.isFull()).isTrue();
    assertThat(queue.enqueue(candidate(3))).isFalse();

    assertThat(queue.size()).isEqualTo(2);
    assertThat(queue.candidates()).extracting(MigrationCandidate::address).containsExactly(1L, 2L);
  }

  @Test
  void neverExceedsItsCapacity() throws InterruptedException {
    MigrationQueue queue = new MigrationQueue(10);
    Thread[] producers = new Thread[4];
    int[] maxSize = new int[1];
    for (int t = 0; t < producers.length; t++) {
      producers[t] = new Thread(() -> {
        for (int i = 0; i < 1_000; i++) {
          queue.enqueue(candidate(i));
          if ((i % 3) == 0) {
            queue.dequeue();
          }
        }
      });
      producers[t].start();
    }
    for (int i = 0; i < 4_000; i++) {
      maxSize[0] = Math.max(maxSize[0], queue.size());
    }
    for (Thread producer : producers) {
      producer.join();
    }

    assertThat(maxSize[0]).isLessThanOrEqualTo(10);
    assertThat(queue.size()).isLessThanOrEqualTo(10);
    assertThat(queue.capacity()).isEqualTo(10);
  }

  static MigrationCandidate candidate(long address) {
    return new MigrationCandidate(address, Tier.SLOW, Tier.MID, 5, 0);
  }
}
