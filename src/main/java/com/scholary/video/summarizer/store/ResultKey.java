package com.scholary.video.summarizer.store;

/** Unique key of a stored result. Components are compared individually, never joined. */
public record ResultKey(String sourceId, String language) {

  public ResultKey {
    if (sourceId == null || language == null) {
      throw new IllegalArgumentException("Result key needs both sourceId and language");
    }
  }

  public static ResultKey of(StoredResult result) {
    return new ResultKey(result.sourceId(), result.language());
  }
}
