package com.scholary.video.summarizer.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** Request to process a video already uploaded to object storage. */
public record ProcessObjectRequest(
    @NotBlank String s3Key,
    @NotBlank String fileName,
    @Pattern(regexp = LanguageTag.PATTERN, message = LanguageTag.MESSAGE) String language) {}
