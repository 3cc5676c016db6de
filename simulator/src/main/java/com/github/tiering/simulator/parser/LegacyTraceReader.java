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

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import com.github.tiering.simulator.BasicSettings.LegacySettings;
import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Request.Operation;
import com.github.tiering.simulator.Request.Zone;
import com.google.common.base.Splitter;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;

/**
 * A reader for delimited traces of {@code timestamp, id, size, operation} with configurable column
 * positions. A column configured as {@code -}, or a field holding {@code -}, falls back to the
 * default size or to a read. A trailing {@code hot} or {@code cold} field labels the request's
 * zone. Identifiers that are not numbers are hashed into an address.
 */
public final class LegacyTraceReader extends TextTraceReader {
  private static final String ABSENT = "-";

  private final OptionalInt operationColumn;
  private final OptionalInt timestampColumn;
  private final OptionalInt sizeColumn;
  private final OptionalInt idColumn;
  private final long nanosPerTimestampUnit;
  private final long bytesPerSizeUnit;
  private final long defaultSize;
  private final Splitter splitter;

  private long sequence;

  public LegacyTraceReader(Path filePath, LegacySettings settings, long skip, long limit) {
    super(filePath, skip, limit);
    this.splitter = Splitter.on(requireNonNull(settings.delimiter())).trimResults();
    this.nanosPerTimestampUnit = settings.nanosPerTimestampUnit();
    this.bytesPerSizeUnit = settings.bytesPerSizeUnit();
    this.operationColumn = settings.operationColumn();
    this.timestampColumn = settings.timestampColumn();
    this.defaultSize = settings.defaultSize();
    this.sizeColumn = settings.sizeColumn();
    this.idColumn = settings.idColumn();
  }

  @Override
  protected Optional<Request> parse(String line) {
    List<String> fields = splitter.splitToList(line.trim());
    long index = sequence++;

    Request.Builder builder = Request.builder()
        .address(idColumn.isPresent() ? address(fields.get(idColumn.getAsInt())) : index);
    if (timestampColumn.isPresent()) {
      double timestamp = Double.parseDouble(fields.get(timestampColumn.getAsInt()));
      builder.timestamp((long) (timestamp * nanosPerTimestampUnit));
    }
    String size = sizeColumn.isPresent() ? fields.get(sizeColumn.getAsInt()) : ABSENT;
    builder.size(size.equals(ABSENT)
        ? defaultSize
        : (long) Double.parseDouble(size) * bytesPerSizeUnit);
    String operation = operationColumn.isPresent()
        ? fields.get(operationColumn.getAsInt())
        : ABSENT;
    builder.operation(operation.equals(ABSENT) ? Operation.READ : Operation.of(operation));
    if (fields.size() > 1) {
      builder.zone(Zone.parse(fields.get(fields.size() - 1)).orElse(null));
    }
    return Optional.of(builder.build());
  }

  /** Returns the address of a trace identifier, hashing it if it is not a number. */
  static long address(String id) {
    String trimmed = id.trim();
    Long value = Longs.tryParse(trimmed);
    if (value != null) {
      return value;
    }
    return Hashing.murmur3_128().hashString(trimmed, StandardCharsets.UTF_8).asLong();
  }
}
