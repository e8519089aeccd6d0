package com.scholary.video.summarizer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ingestion pipeline.
 *
 * <p>Controls chunking thresholds, remote readiness polling, output validation and resource
 * allocation for runs.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotNull @Valid ChunkingProperties chunking,
    @NotNull @Valid PollingProperties polling,
    @NotNull @Valid StoreProperties store,
    @Positive int minOutputChars,
    @Positive long streamTimeoutMs,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record ChunkingProperties(
      @Positive int thresholdChars, @Positive int chunkSizeChars, @Min(0) int overlapChars) {}

  public record PollingProperties(@Positive long intervalMs, @Positive long maxWaitMs) {}

  public record StoreProperties(@Positive int maxSize) {}
}
