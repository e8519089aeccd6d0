package com.scholary.video.summarizer.store;

import java.time.Instant;

/**
 * One persisted pipeline result, unique per {@code (sourceId, language)}.
 *
 * <p>{@code sourceLocation} is where the source came from, e.g. {@code s3://key} or the video URL.
 */
public record StoredResult(
    String id,
    String sourceId,
    String language,
    String title,
    String sourceLocation,
    String transcript,
    String summary,
    long durationSeconds,
    String model,
    Instant createdAt) {}
