package com.scholary.video.summarizer.transcript;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcript fetching.
 *
 * <p>{@code languages} is tried in order; the first caption track with text wins.
 */
@ConfigurationProperties(prefix = "transcript")
@Validated
public record TranscriptProperties(
    @NotBlank String baseUrl,
    @NotEmpty List<String> languages,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int minChars) {}
