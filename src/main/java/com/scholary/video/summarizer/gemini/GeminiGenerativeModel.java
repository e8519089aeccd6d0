package com.scholary.video.summarizer.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Gemini {@code generateContent} endpoint.
 *
 * <p>Builds the request JSON by hand with Jackson's tree model and concatenates the text parts of
 * the first candidate. No retries: a failed call surfaces as {@link GenerationException} and the
 * caller decides what to do.
 */
@Component
public class GeminiGenerativeModel implements GenerativeModel {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiGenerativeModel.class);

  private final HttpClient httpClient;
  private final GeminiProperties properties;
  private final ObjectMapper objectMapper;

  public GeminiGenerativeModel(
      HttpClient geminiHttpClient, GeminiProperties properties, ObjectMapper objectMapper) {
    this.httpClient = geminiHttpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public String generateText(String prompt) {
    ObjectNode body = objectMapper.createObjectNode();
    ArrayNode parts = addUserContent(body);
    parts.addObject().put("text", prompt);
    return send(body);
  }

  @Override
  public String generateFromFile(String prompt, String fileUri, String mimeType) {
    ObjectNode body = objectMapper.createObjectNode();
    ArrayNode parts = addUserContent(body);
    parts.addObject().put("text", prompt);
    parts.addObject().putObject("file_data").put("mime_type", mimeType).put("file_uri", fileUri);
    return send(body);
  }

  @Override
  public String modelName() {
    return properties.model();
  }

  private ArrayNode addUserContent(ObjectNode body) {
    ObjectNode content = body.putArray("contents").addObject();
    content.put("role", "user");
    return content.putArray("parts");
  }

  private String send(ObjectNode body) {
    if (!properties.hasApiKey()) {
      throw new GenerationException(
          "Gemini API key is not configured. Please set GEMINI_API_KEY.");
    }

    HttpResponse<String> response;
    try {
      HttpRequest request =
          GeminiRequests.authorized(HttpRequest.newBuilder(), properties)
              .uri(
                  URI.create(
                      properties.baseUrl()
                          + "/v1beta/models/"
                          + properties.model()
                          + ":generateContent"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
              .build();

      LOGGER.debug("Sending generation request: model={}", properties.model());
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    } catch (IOException e) {
      LOGGER.error("Transport error calling model {}", properties.model(), e);
      throw new GenerationException("Generation request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Generation request interrupted", e);
    }

    if (!GeminiRequests.isSuccess(response.statusCode())) {
      LOGGER.error(
          "Model returned status {}: {}", response.statusCode(), response.body());
      throw new GenerationException(
          String.format(
              "Model returned status %d: %s", response.statusCode(), response.body()));
    }

    return extractText(response.body());
  }

  private String extractText(String responseBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(responseBody);
    } catch (IOException e) {
      throw new GenerationException("Unreadable model response", e);
    }

    JsonNode candidates = root.path("candidates");
    if (!candidates.isArray() || candidates.isEmpty()) {
      String blockReason = root.path("promptFeedback").path("blockReason").asText("none");
      throw new GenerationException(
          "Model returned no candidates (blockReason=" + blockReason + ")");
    }

    StringBuilder text = new StringBuilder();
    for (JsonNode part : candidates.get(0).path("content").path("parts")) {
      if (part.hasNonNull("text")) {
        text.append(part.get("text").asText());
      }
    }

    LOGGER.info("Received model response: {} chars", text.length());
    return text.toString();
  }
}
