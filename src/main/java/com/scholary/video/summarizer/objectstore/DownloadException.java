package com.scholary.video.summarizer.objectstore;

/**
 * Exception thrown when a source object cannot be downloaded.
 *
 * <p>The reason separates a missing key from transport or service failures so the message shown to
 * the caller can say which one happened.
 */
public class DownloadException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TRANSPORT
  }

  private final Reason reason;

  public DownloadException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
