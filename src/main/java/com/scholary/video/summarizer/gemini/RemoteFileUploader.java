package com.scholary.video.summarizer.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.video.summarizer.logging.StructuredLogger;
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
 * Two-phase resumable upload to the Gemini Files API.
 *
 * <p>Phase one ({@link #initiate}) opens an upload session and returns its URL from the
 * {@code x-goog-upload-url} response header. Phase two ({@link #transfer}) posts the whole payload
 * to that URL at offset 0 with the {@code upload, finalize} command; the service handles chunked
 * wire transfer internally, so there is no client-side resumption.
 *
 * <p>Each upload moves through {@link UploadState}: INIT, SESSION_STARTED, UPLOADING, then COMPLETE
 * or FAILED.
 */
@Component
public class RemoteFileUploader {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteFileUploader.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String UPLOAD_URL_HEADER = "x-goog-upload-url";

  private final HttpClient httpClient;
  private final GeminiProperties properties;
  private final ObjectMapper objectMapper;

  public RemoteFileUploader(
      HttpClient geminiHttpClient, GeminiProperties properties, ObjectMapper objectMapper) {
    this.httpClient = geminiHttpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Upload a payload: start a session, then transfer and finalize.
   *
   * @return the handle of the finalized remote file
   * @throws UploadInitException if the session cannot be started
   * @throws UploadTransferException if the payload cannot be transferred
   */
  public RemoteFileHandle upload(byte[] bytes, String mimeType, String displayName) {
    UploadState state = UploadState.INIT;
    try {
      String sessionUrl = initiate(bytes.length, mimeType, displayName);
      state = transition(state, UploadState.SESSION_STARTED, displayName, bytes.length);

      state = transition(state, UploadState.UPLOADING, displayName, bytes.length);
      RemoteFileHandle handle = transfer(sessionUrl, bytes);

      transition(state, UploadState.COMPLETE, displayName, bytes.length);
      LOGGER.info(
          "File uploaded: name={}, mimeType={}, size={} bytes, state={}",
          handle.name(),
          handle.mimeType(),
          handle.sizeBytes(),
          handle.state());
      return handle;

    } catch (RemoteFileException e) {
      transition(state, UploadState.FAILED, displayName, bytes.length);
      throw e;
    }
  }

  /**
   * Open a resumable upload session.
   *
   * @param sizeBytes the exact payload length that will be transferred
   * @param mimeType the payload content type
   * @param displayName the human-readable name shown by the service
   * @return the session upload URL
   * @throws UploadInitException on a non-2xx response (status and body kept verbatim)
   */
  public String initiate(long sizeBytes, String mimeType, String displayName) {
    LOGGER.info(
        "Starting resumable upload session: displayName={}, size={} bytes, mimeType={}",
        displayName,
        sizeBytes,
        mimeType);

    ObjectNode body = objectMapper.createObjectNode();
    body.putObject("file").put("display_name", displayName);

    HttpRequest request;
    try {
      request =
          GeminiRequests.authorized(HttpRequest.newBuilder(), properties)
              .uri(URI.create(properties.baseUrl() + "/upload/v1beta/files"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("X-Goog-Upload-Protocol", "resumable")
              .header("X-Goog-Upload-Command", "start")
              .header("X-Goog-Upload-Header-Content-Length", String.valueOf(sizeBytes))
              .header("X-Goog-Upload-Header-Content-Type", mimeType)
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
              .build();
    } catch (IOException e) {
      throw new UploadInitException("Failed to encode upload metadata", e);
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      LOGGER.error("Transport error starting upload session", e);
      throw new UploadInitException("Failed to initiate upload: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UploadInitException("Upload initiation interrupted", e);
    }

    if (!GeminiRequests.isSuccess(response.statusCode())) {
      LOGGER.error(
          "Failed to initiate resumable upload: status={}, body={}",
          response.statusCode(),
          response.body());
      throw new UploadInitException(
          String.format(
              "Failed to initiate upload: %d - %s", response.statusCode(), response.body()),
          response.statusCode(),
          response.body());
    }

    String uploadUrl = response.headers().firstValue(UPLOAD_URL_HEADER).orElse(null);
    if (uploadUrl == null || uploadUrl.isBlank()) {
      throw new UploadInitException(
          "No upload URL received from remote file service",
          response.statusCode(),
          response.body());
    }

    LOGGER.debug("Upload session initiated: uploadUrl={}", uploadUrl);
    return uploadUrl;
  }

  /**
   * Send the whole payload to an upload session and finalize it.
   *
   * @param uploadSessionUrl the URL returned by {@link #initiate}
   * @param bytes the payload
   * @return the finalized remote file
   * @throws UploadTransferException on a non-2xx response or a malformed file object
   */
  public RemoteFileHandle transfer(String uploadSessionUrl, byte[] bytes) {
    LOGGER.info("Uploading file data: {} bytes", bytes.length);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(uploadSessionUrl))
            .timeout(Duration.ofSeconds(properties.uploadTimeout()))
            .header("X-Goog-Upload-Offset", "0")
            .header("X-Goog-Upload-Command", "upload, finalize")
            .POST(BodyPublishers.ofByteArray(bytes))
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      LOGGER.error("Transport error uploading file data", e);
      throw new UploadTransferException("Failed to upload file data: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UploadTransferException("File upload interrupted", e);
    }

    if (!GeminiRequests.isSuccess(response.statusCode())) {
      LOGGER.error(
          "Failed to upload file data: status={}, body={}", response.statusCode(), response.body());
      throw new UploadTransferException(
          String.format(
              "Failed to upload file data: %d - %s", response.statusCode(), response.body()),
          response.statusCode(),
          response.body());
    }

    JsonNode file;
    try {
      file = objectMapper.readTree(response.body()).path("file");
    } catch (IOException e) {
      throw new UploadTransferException("Remote file service returned unreadable response", e);
    }

    RemoteFileHandle handle = RemoteFileHandle.fromJson(file);
    if (handle.name() == null || handle.fileUri() == null) {
      LOGGER.error("Unexpected upload response format: {}", response.body());
      throw new UploadTransferException(
          "Remote file service returned unexpected response format",
          response.statusCode(),
          response.body());
    }
    return handle;
  }

  private UploadState transition(
      UploadState from, UploadState to, String displayName, long sizeBytes) {
    structuredLogger.logUploadState(from.name(), to.name(), displayName, sizeBytes);
    return to;
  }
}
