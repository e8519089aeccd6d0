package com.scholary.video.summarizer.objectstore;

/** Bytes of a downloaded object plus the metadata the uploader needs. */
public record DownloadedObject(byte[] bytes, String contentType, long contentLength) {

  public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  public DownloadedObject {
    if (contentType == null || contentType.isBlank()) {
      contentType = DEFAULT_CONTENT_TYPE;
    }
  }
}
