package com.scholary.video.summarizer.progress;

import java.io.IOException;

/** The consumer end of a progress stream, typically an HTTP response. */
public interface ProgressSink {

  /**
   * Write and flush one event.
   *
   * @throws IOException if the consumer has gone away
   */
  void send(ProgressEvent event) throws IOException;

  /** End the stream. */
  void close();
}
