package com.scholary.video.summarizer.gemini;

/**
 * Exception thrown when a call to the remote file service fails.
 *
 * <p>Carries the HTTP status (or -1 for transport failures) and the response body as returned, so
 * operators can see exactly what the service said.
 */
public class RemoteFileException extends RuntimeException {

  private final int statusCode;
  private final String responseBody;

  public RemoteFileException(String message, int statusCode, String responseBody) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public RemoteFileException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
    this.responseBody = null;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
