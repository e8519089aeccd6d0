package com.scholary.video.summarizer.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, single-consumer progress stream for one run.
 *
 * <p>Each event is flushed to the sink before {@link #emit} returns, so callers emit before every
 * blocking call and observers see real-time state. If the consumer disconnects, the failure is
 * logged once and the emitter stops writing; the run itself carries on.
 */
public class ProgressEmitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressEmitter.class);

  private final ProgressSink sink;
  private boolean disconnected;
  private boolean closed;
  private int emitted;

  public ProgressEmitter(ProgressSink sink) {
    this.sink = sink;
  }

  public synchronized void emit(ProgressEvent event) {
    if (disconnected || closed) {
      LOGGER.debug("Dropping {} event for closed consumer: {}", event.type(), event.message());
      return;
    }
    try {
      sink.send(event);
      emitted++;
    } catch (Exception e) {
      disconnected = true;
      LOGGER.warn(
          "Progress consumer disconnected after {} events, continuing without it: {}",
          emitted,
          e.getMessage());
    }
  }

  /** End the stream. Safe to call more than once. */
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      sink.close();
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to close progress stream: {}", e.getMessage());
    }
  }

  public synchronized boolean isDisconnected() {
    return disconnected;
  }
}
