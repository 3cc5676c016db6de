package com.github.tiering.simulator.migration;

import static java.util.Locale.US;

import org.apache.commons.lang3.StringUtils;

/** The access-frequency class of an address. */
public enum Hotness {
  HOT,
  WARM,
  COLD;

  public String label() {
    return StringUtils.capitalize(name().toLowerCase(US));
  }
}
