package com.scholary.video.summarizer.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** Request to summarize a video by URL from its captions. */
public record SummarizeRequest(
    @NotBlank String url,
    @Pattern(regexp = LanguageTag.PATTERN, message = LanguageTag.MESSAGE) String language) {}
