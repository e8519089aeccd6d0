package com.scholary.video.summarizer.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the state of one run. Transitions only move forward, and nothing leaves DONE or FAILED.
 */
class RunStateTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(RunStateTracker.class);

  private RunState current = RunState.IDLE;

  RunState current() {
    return current;
  }

  void transitionTo(RunState next) {
    if (current.isTerminal()) {
      throw new IllegalStateException(
          String.format("Run already finished in %s, cannot move to %s", current, next));
    }
    if (next.ordinal() <= current.ordinal()) {
      throw new IllegalStateException(
          String.format("Illegal run transition: %s -> %s", current, next));
    }
    LOGGER.debug("Run state: {} -> {}", current, next);
    current = next;
  }

  /** Move to FAILED from any non-terminal state; a no-op once the run has finished. */
  void fail() {
    if (current.isTerminal()) {
      LOGGER.warn("Ignoring failure after run finished in {}", current);
      return;
    }
    LOGGER.debug("Run state: {} -> {}", current, RunState.FAILED);
    current = RunState.FAILED;
  }
}
