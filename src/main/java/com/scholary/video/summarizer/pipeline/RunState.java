package com.scholary.video.summarizer.pipeline;

/**
 * States of an ingestion run, in pipeline order.
 *
 * <p>Object-store runs pass through DOWNLOADING, UPLOADING and WAITING_REMOTE; text runs skip them
 * and only transcript references pass through FETCHING_TRANSCRIPT. A cache hit goes straight from
 * IDLE to DONE.
 */
public enum RunState {
  IDLE,
  FETCHING_TRANSCRIPT,
  DOWNLOADING,
  UPLOADING,
  WAITING_REMOTE,
  GENERATING,
  SAVING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
