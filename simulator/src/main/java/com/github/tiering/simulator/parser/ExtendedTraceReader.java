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

import static java.util.Locale.US;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import com.github.tiering.simulator.BasicSettings.ExtendedSettings;
import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Request.Operation;
import com.github.tiering.simulator.Request.Pattern;
import com.google.common.collect.ImmutableSet;

/**
 * A reader for whitespace separated traces of
 * {@code timestamp operation address block_size seq|rand inter_arrival service_time idle_time}.
 * The inter-arrival and idle times are validated but not used; arrivals are spaced by the
 * timestamps. Lines starting with {@code #} are comments.
 */
public final class ExtendedTraceReader extends TextTraceReader {
  static final int FIELDS = 8;

  private final long nanosPerTimestampUnit;
  private final Set<String> readCodes;

  public ExtendedTraceReader(Path filePath, ExtendedSettings settings, long skip, long limit) {
    super(filePath, skip, limit);
    this.nanosPerTimestampUnit = settings.nanosPerTimestampUnit();
    this.readCodes = ImmutableSet.copyOf(settings.readCodes());
  }

  @Override
  protected Optional<Request> parse(String line) {
    String trimmed = line.trim();
    if (trimmed.startsWith("#")) {
      return Optional.empty();
    }
    String[] fields = trimmed.split("\\s+");
    if (fields.length < FIELDS) {
      throw new IllegalArgumentException("Expected " + FIELDS + " fields but found "
          + fields.length);
    }
    double timestamp = Double.parseDouble(fields[0]);
    String code = fields[1].toLowerCase(US);
    long address = (long) Double.parseDouble(fields[2]);
    long size = (long) Double.parseDouble(fields[3]);
    Double.parseDouble(fields[5]);
    double serviceTime = Double.parseDouble(fields[6]);
    Double.parseDouble(fields[7]);

    return Optional.of(Request.builder()
        .address(address)
        .size(size)
        .timestamp((long) (timestamp * nanosPerTimestampUnit))
        .serviceTime((long) (Math.max(serviceTime, 0.0) * nanosPerTimestampUnit))
        .operation(readCodes.contains(code) ? Operation.READ : Operation.WRITE)
        .pattern(Pattern.of(fields[4]))
        .build());
  }
}
