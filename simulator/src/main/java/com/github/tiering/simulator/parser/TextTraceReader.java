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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.tiering.simulator.Request;

/**
 * A skeletal implementation that reads the trace file one line at a time. A line that cannot be
 * parsed is logged and skipped; the rest of the trace is still replayed.
 */
public abstract class TextTraceReader implements TraceReader {
  private static final Logger logger = LogManager.getLogger(TextTraceReader.class);

  private final AtomicLong malformed;
  private final Path filePath;
  private final long skip;
  private final long limit;

  protected TextTraceReader(Path filePath, long skip, long limit) {
    checkArgument(skip >= 0, "skip must be non-negative");
    checkArgument(limit >= 0, "limit must be non-negative");
    this.filePath = requireNonNull(filePath);
    this.malformed = new AtomicLong();
    this.skip = skip;
    this.limit = limit;
  }

  @Override
  public Stream<Request> requests() {
    AtomicLong lineNumber = new AtomicLong();
    return lines()
        .map(line -> parseLine(lineNumber.incrementAndGet(), line))
        .flatMap(Optional::stream)
        .skip(skip)
        .limit(limit);
  }

  @Override
  public long malformed() {
    return malformed.get();
  }

  /** Returns the raw lines of the trace file. */
  protected Stream<String> lines() {
    try {
      BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8);
      return reader.lines().onClose(() -> {
        try {
          reader.close();
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read the trace " + filePath, e);
    }
  }

  /**
   * Returns the request described by the line, or empty if the line carries no request.
   *
   * @throws RuntimeException if the line is malformed
   */
  protected abstract Optional<Request> parse(String line);

  private Optional<Request> parseLine(long lineNumber, String line) {
    if (line.isBlank()) {
      return Optional.empty();
    }
    try {
      return parse(line);
    } catch (RuntimeException e) {
      malformed.incrementAndGet();
      logger.warn("Skipping malformed line {} of {}: {} ({})",
          lineNumber, filePath.getFileName(), line, e.toString());
      return Optional.empty();
    }
  }

  public Path filePath() {
    return filePath;
  }
}
