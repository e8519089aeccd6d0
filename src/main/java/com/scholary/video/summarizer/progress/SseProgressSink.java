package com.scholary.video.summarizer.progress;

import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes progress events as Server-Sent Events: one {@code data:<json>} frame per event.
 *
 * <p>SSE is the only framing the service uses for progress.
 */
public class SseProgressSink implements ProgressSink {

  private final SseEmitter emitter;

  public SseProgressSink(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public void send(ProgressEvent event) throws IOException {
    emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
  }

  @Override
  public void close() {
    emitter.complete();
  }
}
