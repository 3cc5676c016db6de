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

import com.github.tiering.simulator.Request;
import com.github.tiering.simulator.Tier;

/**
 * Selects the tier that serves each request. A policy may consult the current tier occupancy and
 * is told about every served request so that it can update residency, such as promoting an item
 * after a miss.
 */
public interface PlacementPolicy {

  /** Returns the tier that serves the request. */
  Tier select(Request request);

  /**
   * Records that the request was served.
   *
   * @param request the served request
   * @param placement the tier and transfer duration chosen at arrival
   * @param servedTime the virtual time from arrival to departure, including any channel wait
   * @param last whether this is the final request of the run
   */
  default void onServed(Request request, Placement placement, long servedTime, boolean last) {}
}
