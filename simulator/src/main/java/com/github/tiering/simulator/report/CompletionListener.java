package com.github.tiering.simulator.report;

/** Receives every completed request, in completion order. */
@FunctionalInterface
public interface CompletionListener {

  void onCompletion(CompletionRecord record);

  /** A listener that ignores every completion. */
  static CompletionListener disabled() {
    return record -> {};
  }
}
