package com.scholary.video.summarizer.gemini;

import com.scholary.video.summarizer.logging.StructuredLogger;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Waits for an uploaded file to leave the PROCESSING state.
 *
 * <p>Polls on a fixed interval with no backoff or jitter; remote processing normally completes in
 * well under a minute. Interval and maximum wait are always passed in by the caller.
 */
@Component
public class ProcessingStatePoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingStatePoller.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final RemoteFileService remoteFileService;
  private final Clock clock;
  private final Sleeper sleeper;

  @Autowired
  public ProcessingStatePoller(RemoteFileService remoteFileService) {
    this(remoteFileService, Clock.systemUTC(), Sleeper.THREAD);
  }

  public ProcessingStatePoller(RemoteFileService remoteFileService, Clock clock, Sleeper sleeper) {
    this.remoteFileService = remoteFileService;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Block until the file is ACTIVE.
   *
   * @param name the durable file name (not the file URI)
   * @param maxWaitMs the total time allowed
   * @param pollIntervalMs the fixed wait between status queries
   * @throws ProcessingFailedException as soon as the service reports FAILED
   * @throws ProcessingTimeoutException if the file is not ACTIVE within {@code maxWaitMs}
   */
  public void waitUntilActive(String name, long maxWaitMs, long pollIntervalMs) {
    LOGGER.info(
        "Waiting for file processing: name={}, maxWait={}ms, interval={}ms",
        name,
        maxWaitMs,
        pollIntervalMs);

    long start = clock.millis();
    int attempt = 0;

    while (clock.millis() - start < maxWaitMs) {
      attempt++;
      RemoteFileStatus status = remoteFileService.getStatus(name);
      structuredLogger.logPollStatus(
          name, attempt, status.state().name(), clock.millis() - start);

      if (status.state() == RemoteFileState.ACTIVE) {
        LOGGER.info("File processing completed: name={}, polls={}", name, attempt);
        return;
      }
      if (status.state() == RemoteFileState.FAILED) {
        throw new ProcessingFailedException(
            "File processing failed on the remote service: " + name);
      }

      try {
        sleeper.sleep(pollIntervalMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ProcessingTimeoutException("Interrupted while waiting for " + name, e);
      }
    }

    throw new ProcessingTimeoutException(
        String.format("File processing timeout after %d seconds", maxWaitMs / 1000));
  }
}
