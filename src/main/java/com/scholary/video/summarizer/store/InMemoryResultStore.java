package com.scholary.video.summarizer.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.video.summarizer.config.PipelineProperties;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory ResultStore backed by a Caffeine cache.
 *
 * <p>{@code putIfAbsent} on the cache map gives the unique-key constraint atomically, so two
 * concurrent runs for the same key can never both write.
 *
 * <p>Size is bounded by {@code pipeline.store.max-size}. Once an entry is evicted its key is free
 * again, so "stored at most once per key" only holds while the entry is resident. A durable store
 * must not evict.
 */
@Repository
public class InMemoryResultStore implements ResultStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryResultStore.class);

  private final Cache<ResultKey, StoredResult> cache;

  @Autowired
  public InMemoryResultStore(PipelineProperties properties) {
    this(properties.store().maxSize());
  }

  public InMemoryResultStore(int maxSize) {
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();

    LOGGER.info("Initialized result store: maxSize={}", maxSize);
  }

  @Override
  public Optional<StoredResult> find(String sourceId, String language) {
    StoredResult result = cache.getIfPresent(new ResultKey(sourceId, language));
    if (result != null) {
      LOGGER.debug("Result store hit: sourceId={}, language={}", sourceId, language);
      return Optional.of(result);
    }
    LOGGER.debug("Result store miss: sourceId={}, language={}", sourceId, language);
    return Optional.empty();
  }

  @Override
  public StoredResult insert(StoredResult result) {
    StoredResult existing = cache.asMap().putIfAbsent(ResultKey.of(result), result);
    if (existing != null) {
      throw new PersistenceException(
          String.format(
              "Result already exists: sourceId=%s, language=%s, id=%s",
              result.sourceId(), result.language(), existing.id()));
    }
    LOGGER.info(
        "Stored result: id={}, sourceId={}, language={}",
        result.id(),
        result.sourceId(),
        result.language());
    return result;
  }
}
