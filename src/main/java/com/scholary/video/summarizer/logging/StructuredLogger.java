package com.scholary.video.summarizer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in the log
 * backend. Event fields are only present in the MDC for the duration of the log call; run context
 * fields stay until {@link #clearRunContext()}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a pipeline stage transition. */
  public void logStageStarted(String stage, Integer percent) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);
      MDC.put("percent", String.valueOf(percent));

      logger.info("Stage started: stage={}, progress={}%", stage, percent);
    } finally {
      clearEventFields();
    }
  }

  /** Log an upload state machine transition. */
  public void logUploadState(String from, String to, String displayName, long sizeBytes) {
    try {
      MDC.put("event_type", "upload_state");
      MDC.put("uploadFrom", from);
      MDC.put("uploadTo", to);
      MDC.put("sizeBytes", String.valueOf(sizeBytes));

      logger.debug(
          "Upload state: {} -> {}, displayName={}, size={} bytes", from, to, displayName, sizeBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log one remote readiness poll. */
  public void logPollStatus(String fileName, int attempt, String state, long elapsedMs) {
    try {
      MDC.put("event_type", "poll_status");
      MDC.put("remoteFile", fileName);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("remoteState", state);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Remote file status: name={}, attempt={}, state={}, elapsed={}ms",
          fileName,
          attempt,
          state,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of a remote file cleanup. */
  public void logCleanup(String fileName, boolean deleted) {
    try {
      MDC.put("event_type", "remote_cleanup");
      MDC.put("remoteFile", fileName);
      MDC.put("deleted", String.valueOf(deleted));

      if (deleted) {
        logger.info("Remote file deleted: name={}", fileName);
      } else {
        logger.warn("Remote file cleanup did not succeed: name={}", fileName);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a summarized transcript section. */
  public void logChunkSummarized(int chunkIndex, int totalChunks, int summaryChars, long elapsedMs) {
    try {
      MDC.put("event_type", "chunk_summarized");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("summaryChars", String.valueOf(summaryChars));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Chunk summarized: index={}/{}, summaryChars={}, elapsed={}ms",
          chunkIndex + 1,
          totalChunks,
          summaryChars,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId, String sourceId, String language) {
    MDC.put("runId", runId);
    MDC.put("sourceId", sourceId);
    MDC.put("language", language);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove("runId");
    MDC.remove("sourceId");
    MDC.remove("language");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("percent");
    MDC.remove("uploadFrom");
    MDC.remove("uploadTo");
    MDC.remove("sizeBytes");
    MDC.remove("remoteFile");
    MDC.remove("attempt");
    MDC.remove("remoteState");
    MDC.remove("elapsedMs");
    MDC.remove("deleted");
    MDC.remove("chunk_index");
    MDC.remove("totalChunks");
    MDC.remove("summaryChars");
  }
}
