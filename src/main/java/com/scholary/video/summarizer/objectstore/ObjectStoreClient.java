package com.scholary.video.summarizer.objectstore;

/**
 * Abstraction for object storage reads.
 *
 * <p>The pipeline only ever needs to pull a whole source video out of the bucket before handing it
 * to the remote file service, so this is deliberately a single operation. Implementations read
 * from the bucket configured in {@link ObjectStoreProperties}.
 */
public interface ObjectStoreClient {

  /**
   * Download a full object into memory.
   *
   * <p>Videos are bounded in size by the calling layer, so buffering is acceptable here.
   *
   * @param key the object key
   * @return the object's bytes and metadata
   * @throws DownloadException if the object doesn't exist or retrieval fails
   */
  DownloadedObject download(String key);
}
