package com.scholary.video.summarizer.gemini;

/** Starting a resumable upload session failed. */
public class UploadInitException extends RemoteFileException {

  public UploadInitException(String message, int statusCode, String responseBody) {
    super(message, statusCode, responseBody);
  }

  public UploadInitException(String message, Throwable cause) {
    super(message, cause);
  }
}
