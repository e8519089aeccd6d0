package com.scholary.video.summarizer.gemini;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A file staged on the remote file service.
 *
 * <p>{@code name} (e.g. {@code files/abc123}) is the durable id for status and delete calls;
 * {@code fileUri} is only valid inside generation requests. Mixing them up is a programming error.
 */
public record RemoteFileHandle(
    String name, String fileUri, String mimeType, long sizeBytes, RemoteFileState state) {

  /** Parse the {@code file} object returned by the upload finalize call. */
  static RemoteFileHandle fromJson(JsonNode file) {
    return new RemoteFileHandle(
        file.path("name").asText(null),
        file.path("uri").asText(null),
        file.path("mimeType").asText(null),
        file.path("sizeBytes").asLong(0),
        RemoteFileState.fromWire(file.path("state").asText(null)));
  }

  public RemoteFileHandle withState(RemoteFileState newState) {
    return new RemoteFileHandle(name, fileUri, mimeType, sizeBytes, newState);
  }
}
