package com.scholary.video.summarizer.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches caption tracks from the YouTube timed-text endpoint in {@code json3} format.
 *
 * <p>The response holds {@code events[].segs[].utf8} fragments; they are joined with single spaces
 * and whitespace is collapsed. An empty body means there is no track in the requested language.
 */
@Component
public class TimedTextTranscriptSource implements TranscriptSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimedTextTranscriptSource.class);

  private final HttpClient httpClient;
  private final TranscriptProperties properties;
  private final ObjectMapper objectMapper;

  public TimedTextTranscriptSource(TranscriptProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    LOGGER.info("Initialized timed-text transcript source: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String fetch(String videoId, String languageCode) {
    URI uri =
        URI.create(
            String.format(
                "%s?v=%s&lang=%s&fmt=json3",
                properties.baseUrl(), encode(videoId), encode(languageCode)));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TranscriptFetchException(
          String.format("Could not retrieve a transcript for %s: %s", videoId, e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptFetchException("Transcript fetch interrupted", e);
    }

    if (response.statusCode() == 404) {
      throw new TranscriptFetchException("Video unavailable: " + videoId);
    }
    if (response.statusCode() != 200) {
      throw new TranscriptFetchException(
          String.format(
              "Could not retrieve a transcript for %s: status %d", videoId, response.statusCode()));
    }

    String body = response.body();
    if (body == null || body.isBlank()) {
      return "";
    }
    return joinSegments(body, videoId);
  }

  private String joinSegments(String body, String videoId) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new TranscriptFetchException("Unreadable transcript response for " + videoId, e);
    }

    StringBuilder text = new StringBuilder();
    for (JsonNode event : root.path("events")) {
      for (JsonNode seg : event.path("segs")) {
        String fragment = seg.path("utf8").asText("").strip();
        if (!fragment.isEmpty()) {
          if (text.length() > 0) {
            text.append(' ');
          }
          text.append(fragment);
        }
      }
    }
    return text.toString().replaceAll("\\s+", " ").strip();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
