package com.scholary.video.summarizer.pipeline;

/**
 * Input of one run.
 *
 * @param sourceId cache key together with {@code language}, e.g. the object key or video id
 * @param language output language code
 * @param title display title; may be null for transcript references, where it is derived from the
 *     fetched captions
 * @param sourceLocation where the source came from, e.g. {@code s3://key} or the video URL
 * @param source the media to ingest
 */
public record IngestionRequest(
    String sourceId, String language, String title, String sourceLocation, SourceMedia source) {

  public static final String DEFAULT_LANGUAGE = "en";

  public IngestionRequest {
    if (sourceId == null || sourceId.isBlank()) {
      throw new IllegalArgumentException("Source id must not be blank");
    }
    if (source == null) {
      throw new IllegalArgumentException("Source media is required");
    }
    if (language == null || language.isBlank()) {
      language = DEFAULT_LANGUAGE;
    }
  }
}
