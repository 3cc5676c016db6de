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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.tiering.simulator.parser.TraceFormat;
import com.github.tiering.simulator.parser.TraceReader;
import com.github.tiering.simulator.report.CompletionListener;
import com.github.tiering.simulator.report.CsvCompletionWriter;
import com.github.tiering.simulator.report.SummaryReport;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A simulator that replays a request trace against the storage tiers under the configured
 * placement policy and writes a per-request report and a summary. See <tt>reference.conf</tt> for
 * details on the configuration.
 */
public final class Simulator {
  private static final Logger logger = LogManager.getLogger(Simulator.class);

  private final BasicSettings settings;

  public Simulator(Config config) {
    settings = BasicSettings.fromRoot(config);
  }

  /** Replays the configured trace and writes the reports. */
  public SimulationResult run() throws IOException {
    TraceReader trace = TraceFormat.readerFor(settings);
    SimulationResult result;
    String requestsPath = settings.report().requests();
    String summaryPath = settings.report().summary();
    try (CsvCompletionWriter writer = requestsPath.isBlank()
            ? null
            : CsvCompletionWriter.open(Paths.get(requestsPath));
        Stream<Request> requests = trace.requests()) {
      CompletionListener listener = (writer == null) ? CompletionListener.disabled() : writer;
      SimulationEngine engine = new SimulationEngine(settings, listener);
      result = engine.run(requests);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
    if (trace.malformed() > 0) {
      logger.warn("Skipped {} malformed trace lines", trace.malformed());
    }

    SummaryReport summary = result.summary();
    logger.info("[Storage Status at {}] {}", result.endTime(), summary.storageStatus());
    if (!summaryPath.isBlank()) {
      summary.writeTo(Paths.get(summaryPath));
    }
    return result;
  }

  public static void main(String[] args) throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    SimulationResult result = new Simulator(ConfigFactory.load()).run();
    logger.info("Executed {} requests in {}", result.completed(), stopwatch);
  }
}
