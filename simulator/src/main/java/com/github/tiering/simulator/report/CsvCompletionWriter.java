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
package com.github.tiering.simulator.report;

import static java.util.Locale.US;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes one {@code address,arrival_ms,departure_ms,served_ms,tier} row per completed request.
 */
public final class CsvCompletionWriter implements CompletionListener, Closeable {
  static final String HEADER = "address,arrival_ms,departure_ms,served_ms,tier";

  private final Writer writer;
  private long rows;

  public CsvCompletionWriter(Writer writer) {
    this.writer = (writer instanceof BufferedWriter) ? writer : new BufferedWriter(writer);
    write(HEADER);
  }

  public static CsvCompletionWriter open(Path path) throws IOException {
    return new CsvCompletionWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8));
  }

  @Override
  public void onCompletion(CompletionRecord record) {
    write(String.format(US, "%d,%.6f,%.6f,%.6f,%s", record.address(), record.arrivalMillis(),
        record.departureMillis(), record.servedMillis(), record.tier().device()));
    rows++;
  }

  /** Returns the number of rows written, excluding the header. */
  public long rows() {
    return rows;
  }

  private void write(String line) {
    try {
      writer.write(line);
      writer.write(System.lineSeparator());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void close() throws IOException {
    writer.close();
  }
}
