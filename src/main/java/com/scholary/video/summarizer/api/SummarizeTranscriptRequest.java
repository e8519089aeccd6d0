package com.scholary.video.summarizer.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request to summarize a transcript supplied by the caller.
 *
 * <p>{@code sourceId} identifies the video for caching; the same id and language return the stored
 * result.
 */
public record SummarizeTranscriptRequest(
    @NotBlank String sourceId,
    @NotBlank String title,
    @NotBlank String transcript,
    @Pattern(regexp = LanguageTag.PATTERN, message = LanguageTag.MESSAGE) String language) {}
