package com.scholary.video.summarizer.gemini;

/** An uploaded file did not become active within the allowed wait. */
public class ProcessingTimeoutException extends RuntimeException {

  public ProcessingTimeoutException(String message) {
    super(message);
  }

  public ProcessingTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
