package com.scholary.video.summarizer.gemini;

import java.net.http.HttpRequest;

/** Request helpers shared by the Gemini HTTP clients. */
final class GeminiRequests {

  static final String API_KEY_HEADER = "x-goog-api-key";

  private GeminiRequests() {}

  /** Attach the API key header when one is configured. */
  static HttpRequest.Builder authorized(HttpRequest.Builder builder, GeminiProperties properties) {
    if (properties.hasApiKey()) {
      builder.header(API_KEY_HEADER, properties.apiKey());
    }
    return builder;
  }

  static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}
