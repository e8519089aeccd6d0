package com.scholary.video.summarizer.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for status and delete calls on the Gemini Files API.
 *
 * <p>Both calls address the file by its durable name ({@code files/...}) relative to
 * {@code {baseUrl}/v1beta/}.
 */
@Component
public class GeminiFilesClient implements RemoteFileService {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiFilesClient.class);

  private final HttpClient httpClient;
  private final GeminiProperties properties;
  private final ObjectMapper objectMapper;

  public GeminiFilesClient(
      HttpClient geminiHttpClient, GeminiProperties properties, ObjectMapper objectMapper) {
    this.httpClient = geminiHttpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public RemoteFileStatus getStatus(String name) {
    HttpRequest request =
        GeminiRequests.authorized(HttpRequest.newBuilder(), properties)
            .uri(fileUri(name))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      LOGGER.error("Transport error checking file status: name={}", name, e);
      throw new RemoteFileException("Failed to check file status: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteFileException("File status check interrupted", e);
    }

    if (!GeminiRequests.isSuccess(response.statusCode())) {
      LOGGER.error(
          "Failed to check file status: name={}, status={}, body={}",
          name,
          response.statusCode(),
          response.body());
      throw new RemoteFileException(
          String.format(
              "Failed to check file status: %d - %s", response.statusCode(), response.body()),
          response.statusCode(),
          response.body());
    }

    try {
      JsonNode file = objectMapper.readTree(response.body());
      return new RemoteFileStatus(
          file.path("name").asText(name),
          RemoteFileState.fromWire(file.path("state").asText(null)),
          file.path("mimeType").asText(null));
    } catch (IOException e) {
      throw new RemoteFileException("Unreadable file status response for " + name, e);
    }
  }

  @Override
  public boolean delete(String name) {
    LOGGER.info("Deleting remote file: name={}", name);

    HttpRequest request =
        GeminiRequests.authorized(HttpRequest.newBuilder(), properties)
            .uri(fileUri(name))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .DELETE()
            .build();

    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (GeminiRequests.isSuccess(response.statusCode())) {
        return true;
      }
      LOGGER.error(
          "Failed to delete remote file: name={}, status={}, body={}",
          name,
          response.statusCode(),
          response.body());
      return false;

    } catch (IOException e) {
      LOGGER.error("Error deleting remote file: name={}", name, e);
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.error("Interrupted while deleting remote file: name={}", name, e);
      return false;
    }
  }

  private URI fileUri(String name) {
    return URI.create(properties.baseUrl() + "/v1beta/" + name);
  }
}
