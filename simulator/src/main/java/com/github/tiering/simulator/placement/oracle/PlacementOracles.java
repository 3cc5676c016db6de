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
package com.github.tiering.simulator.placement.oracle;

import static java.util.Locale.US;

import java.lang.reflect.InvocationTargetException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.tiering.simulator.BasicSettings;
import com.github.tiering.simulator.BasicSettings.OracleSettings;
import com.github.tiering.simulator.placement.OracleUnavailableException;
import com.github.tiering.simulator.placement.PlacementOracle;
import com.typesafe.config.Config;

/** Creates the placement oracle named by the configuration. */
public final class PlacementOracles {
  private static final Logger logger = LogManager.getLogger(PlacementOracles.class);

  private PlacementOracles() {}

  /**
   * Returns the configured oracle. A custom oracle is loaded by class name and constructed with
   * the simulator's {@link Config} if it declares such a constructor, otherwise with no arguments.
   *
   * @throws OracleUnavailableException if the oracle cannot be created
   */
  public static PlacementOracle create(BasicSettings settings) {
    OracleSettings oracle = settings.oracle();
    String type = oracle.type().trim().toLowerCase(US);
    switch (type) {
      case "epsilon-greedy":
        logger.info("Using an epsilon-greedy placement oracle (epsilon={}, seed={})",
            oracle.epsilon(), oracle.randomSeed());
        return new EpsilonGreedyOracle(oracle.epsilon(), oracle.randomSeed());
      case "class":
        return load(oracle.className(), settings.config());
      default:
        throw new OracleUnavailableException("Unknown oracle type: " + oracle.type());
    }
  }

  static PlacementOracle load(String className, Config config) {
    if (className.isBlank()) {
      throw new OracleUnavailableException("No oracle class is configured");
    }
    try {
      Class<? extends PlacementOracle> type =
          Class.forName(className).asSubclass(PlacementOracle.class);
      PlacementOracle oracle;
      try {
        oracle = type.getConstructor(Config.class).newInstance(config);
      } catch (NoSuchMethodException e) {
        oracle = type.getConstructor().newInstance();
      }
      logger.info("Using placement oracle {}", className);
      return oracle;
    } catch (InvocationTargetException e) {
      throw new OracleUnavailableException("Oracle " + className + " failed to start", e.getCause());
    } catch (ReflectiveOperationException | ClassCastException | LinkageError e) {
      throw new OracleUnavailableException("Oracle " + className + " is unavailable", e);
    }
  }
}
