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
import java.nio.file.Paths;

import com.github.tiering.simulator.BasicSettings;
import com.github.tiering.simulator.BasicSettings.TraceSettings;

/**
 * The supported trace layouts. The layout is selected by configuration and never detected.
 */
public enum TraceFormat {
  LEGACY {
    @Override public TraceReader create(Path path, TraceSettings settings) {
      return new LegacyTraceReader(path, settings.legacy(), settings.skip(), settings.limit());
    }
  },
  EXTENDED {
    @Override public TraceReader create(Path path, TraceSettings settings) {
      return new ExtendedTraceReader(path, settings.extended(), settings.skip(), settings.limit());
    }
  };

  /** Returns a reader of the trace file in this layout. */
  public abstract TraceReader create(Path path, TraceSettings settings);

  /** Returns a reader of the configured trace. */
  public static TraceReader readerFor(BasicSettings settings) {
    TraceSettings trace = settings.trace();
    return trace.format().create(Paths.get(trace.path()), trace);
  }

  public static TraceFormat fromName(String name) {
    String normalized = name.trim().toUpperCase(US).replace('-', '_');
    for (TraceFormat format : values()) {
      if (format.name().equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unknown trace format: " + name);
  }
}
