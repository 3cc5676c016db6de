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
package com.github.tiering.simulator.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Request.Operation;
import com.github.tiering.simulator.Request.Pattern;
import com.github.tiering.simulator.SettingsFixture;

public final class ExtendedTraceReaderTest {
  @TempDir Path dir;

  @Test
  void readsAllFields() throws IOException {
    List<Request> requests = read(
        "# timestamp op lba size pattern inter service idle",
        "0.5 rs 1024 4096 seq 0.01 0.25 0.0",
        "0.75 W 2048 8192 rand 0.25 0.004 0.1");

    assertThat(requests).hasSize(2);
    Request first = requests.get(0);
    assertThat(first.timestamp()).isEqualTo(500_000_000L);
    assertThat(first.operation()).isEqualTo(Operation.READ);
    assertThat(first.address()).isEqualTo(1024);
    assertThat(first.size()).isEqualTo(4096);
    assertThat(first.pattern()).isEqualTo(Pattern.SEQUENTIAL);
    assertThat(first.serviceTime()).hasValue(250_000_000L);

    Request second = requests.get(1);
    assertThat(second.operation()).isEqualTo(Operation.WRITE);
    assertThat(second.pattern()).isEqualTo(Pattern.RANDOM);
    assertThat(second.timestamp()).isEqualTo(750_000_000L);
  }

  @Test
  void writeCodesAreNotReads() throws IOException {
    List<Request> requests = read(
        "0 ws 1 1 seq 0 0 0",
        "0 read 2 1 seq 0 0 0",
        "0 R 3 1 seq 0 0 0");

    assertThat(requests).extracting(Request::operation)
        .containsExactly(Operation.WRITE, Operation.READ, Operation.READ);
  }

  @Test
  void skipsShortAndMalformedLines() throws IOException {
    Path trace = write("0 r 1 1 seq 0 0", "0 r x 1 seq 0 0 0", "1 r 5 1 rand 0 0 0");
    TraceReader reader = reader(trace);

    try (Stream<Request> stream = reader.requests()) {
      assertThat(stream.map(Request::address)).containsExactly(5L);
    }
    assertThat(reader.malformed()).isEqualTo(2);
  }

  @Test
  void missingFile() {
    TraceReader reader = reader(dir.resolve("missing.txt"));

    assertThatThrownBy(reader::requests).isInstanceOf(UncheckedIOException.class);
  }

  private List<Request> read(String... lines) throws IOException {
    try (Stream<Request> stream = reader(write(lines)).requests()) {
      return stream.collect(Collectors.toList());
    }
  }

  private TraceReader reader(Path trace) {
    return new ExtendedTraceReader(trace,
        SettingsFixture.settings().build().trace().extended(), 0, Long.MAX_VALUE);
  }

  private Path write(String... lines) throws IOException {
    Path trace = Files.createTempFile(dir, "trace", ".txt");
    Files.write(trace, List.of(lines), StandardCharsets.UTF_8);
    return trace;
  }
}
