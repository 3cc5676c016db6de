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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

public final class SimulatorTest {
  @TempDir Path dir;

  @Test
  void replaysTraceAndWritesReports() throws IOException {
    Path trace = dir.resolve("trace.csv");
    Files.write(trace, List.of(
        "0,1,4,Read",
        "1000,2,4,Write",
        "garbage",
        "2000,3,4,Read"), StandardCharsets.UTF_8);

    SimulationResult result = new Simulator(config(trace)).run();

    assertThat(result.completed()).isEqualTo(3);
    assertThat(result.counters().reads(Tier.MID)).isEqualTo(2);
    assertThat(result.counters().writes(Tier.SLOW)).isEqualTo(1);

    List<String> rows = Files.readAllLines(dir.resolve("requests.csv"), StandardCharsets.UTF_8);
    assertThat(rows).hasSize(4);
    assertThat(rows.get(0)).isEqualTo("address,arrival_ms,departure_ms,served_ms,tier");
    assertThat(rows.subList(1, 4)).extracting(row -> row.substring(row.lastIndexOf(',') + 1))
        .containsExactlyInAnyOrder("SSD", "HDD", "SSD");

    String summary = new String(Files.readAllBytes(dir.resolve("summary.txt")),
        StandardCharsets.UTF_8);
    assertThat(summary).contains("Storage status:").contains("Migration statistics:");
  }

  @Test
  void blankReportPathsDisableReports() throws IOException {
    Path trace = dir.resolve("trace.csv");
    Files.write(trace, List.of("0,1,4,Read"), StandardCharsets.UTF_8);
    Config config = config(trace)
        .withValue("tiering.simulator.report.requests", ConfigValueFactory.fromAnyRef(""))
        .withValue("tiering.simulator.report.summary", ConfigValueFactory.fromAnyRef(""));

    SimulationResult result = new Simulator(config).run();

    assertThat(result.completed()).isEqualTo(1);
    assertThat(dir.resolve("requests.csv")).doesNotExist();
    assertThat(dir.resolve("summary.txt")).doesNotExist();
  }

  @Test
  void missingTrace() {
    Simulator simulator = new Simulator(config(dir.resolve("missing.csv")));

    assertThatThrownBy(simulator::run).isInstanceOf(NoSuchFileException.class);
  }

  private Config config(Path trace) {
    Map<String, Object> overrides = new HashMap<>();
    overrides.put("tiering.simulator.trace.path", trace.toString());
    overrides.put("tiering.simulator.report.requests", dir.resolve("requests.csv").toString());
    overrides.put("tiering.simulator.report.summary", dir.resolve("summary.txt").toString());
    overrides.put("tiering.simulator.migration.poll-interval", "1ms");
    return ConfigFactory.parseMap(overrides)
        .withFallback(ConfigFactory.defaultReference())
        .resolve();
  }
}
