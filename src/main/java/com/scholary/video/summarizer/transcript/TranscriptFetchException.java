package com.scholary.video.summarizer.transcript;

/** Exception thrown when a transcript cannot be obtained for a video. */
public class TranscriptFetchException extends RuntimeException {

  public TranscriptFetchException(String message) {
    super(message);
  }

  public TranscriptFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
