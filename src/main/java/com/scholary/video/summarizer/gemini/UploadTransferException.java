package com.scholary.video.summarizer.gemini;

/** Sending the payload to an upload session, or finalizing it, failed. */
public class UploadTransferException extends RemoteFileException {

  public UploadTransferException(String message, int statusCode, String responseBody) {
    super(message, statusCode, responseBody);
  }

  public UploadTransferException(String message, Throwable cause) {
    super(message, cause);
  }
}
