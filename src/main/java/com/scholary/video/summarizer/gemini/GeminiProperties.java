package com.scholary.video.summarizer.gemini;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini file service and model endpoints.
 *
 * <p>The API key may be empty so the service can start without it; generation calls then fail
 * with a clear message and the status endpoint reports the model as unavailable.
 */
@ConfigurationProperties(prefix = "gemini")
@Validated
public record GeminiProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int uploadTimeout) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
