package com.scholary.video.summarizer.store;

import java.util.Optional;

/**
 * Persistence for pipeline results, keyed by {@code (sourceId, language)}.
 *
 * <p>The uniqueness of that key is the only coordination between concurrent runs: a second insert
 * for the same key is rejected, and the next request for it becomes a cache hit.
 */
public interface ResultStore {

  /**
   * Look up the stored result for a source in a language.
   *
   * @return the result, or empty if none has been stored
   */
  Optional<StoredResult> find(String sourceId, String language);

  /**
   * Store a new result.
   *
   * @return the stored row
   * @throws PersistenceException if a row for the key already exists or the write fails
   */
  StoredResult insert(StoredResult result);
}
