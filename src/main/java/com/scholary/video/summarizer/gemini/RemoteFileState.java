package com.scholary.video.summarizer.gemini;

/** Processing state reported by the remote file service for an uploaded file. */
public enum RemoteFileState {
  STATE_UNSPECIFIED,
  PROCESSING,
  ACTIVE,
  FAILED;

  /** Map the wire value, treating anything unknown as {@link #STATE_UNSPECIFIED}. */
  public static RemoteFileState fromWire(String value) {
    if (value == null || value.isBlank()) {
      return STATE_UNSPECIFIED;
    }
    try {
      return valueOf(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      return STATE_UNSPECIFIED;
    }
  }
}
