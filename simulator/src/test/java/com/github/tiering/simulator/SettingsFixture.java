package com.github.tiering.simulator;

import java.util.HashMap;
import java.util.Map;

import com.typesafe.config.ConfigFactory;

/** Builds settings from overrides of the bundled reference configuration. */
public final class SettingsFixture {
  private final Map<String, Object> overrides = new HashMap<>();

  private SettingsFixture() {}

  public static SettingsFixture settings() {
    return new SettingsFixture();
  }

  /** Overrides a key relative to <tt>tiering.simulator</tt>. */
  public SettingsFixture with(String key, Object value) {
    overrides.put("tiering.simulator." + key, value);
    return this;
  }

  public BasicSettings build() {
    return BasicSettings.fromRoot(ConfigFactory.parseMap(overrides)
        .withFallback(ConfigFactory.defaultReference())
        .resolve());
  }
}
