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

import java.util.stream.Stream;

import com.github.tiering.simulator.Request;

/**
 * A source of requests, in trace order.
 */
public interface TraceReader {

  /** Returns a stream of the trace's requests. The caller must close it. */
  Stream<Request> requests();

  /** Returns the number of lines skipped because they could not be parsed. */
  long malformed();
}
