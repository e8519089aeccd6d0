package com.scholary.video.summarizer.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One event on a run's progress stream.
 *
 * <p>Serialized as JSON with null fields omitted. {@code progress} is a percentage (0-100);
 * completion events carry the result payload, error events a human-readable message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
    Type type,
    String message,
    Integer progress,
    String stage,
    Integer currentChunk,
    Integer totalChunks,
    String summary,
    String transcript,
    String summaryId,
    String title,
    String sourceId,
    String source,
    String warning) {

  public enum Type {
    PROGRESS,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
      return name().toLowerCase();
    }
  }

  public static ProgressEvent progress(String stage, String message, int progress) {
    return new ProgressEvent(
        Type.PROGRESS, message, progress, stage, null, null, null, null, null, null, null, null,
        null);
  }

  public static ProgressEvent chunkProgress(
      String stage, String message, int progress, int currentChunk, int totalChunks) {
    return new ProgressEvent(
        Type.PROGRESS,
        message,
        progress,
        stage,
        currentChunk,
        totalChunks,
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }

  public static ProgressEvent complete(
      String message,
      String summary,
      String transcript,
      String summaryId,
      String title,
      String sourceId,
      String source,
      String warning) {
    return new ProgressEvent(
        Type.COMPLETE,
        message,
        100,
        "complete",
        null,
        null,
        summary,
        transcript,
        summaryId,
        title,
        sourceId,
        source,
        warning);
  }

  public static ProgressEvent error(String message) {
    return new ProgressEvent(
        Type.ERROR, message, 0, "error", null, null, null, null, null, null, null, null, null);
  }
}
