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
package com.github.tiering.simulator.placement;

/** Indicates that the configured placement oracle could not be made available. */
public final class OracleUnavailableException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public OracleUnavailableException(String message) {
    super(message);
  }

  public OracleUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
