package com.scholary.pipeline.document;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory document store using Caffeine, bounded by size only.
 *
 * <p>Instances are shared between callers, so a step that mutates a loaded document and saves it
 * simply replaces the stored entry.
 */
@Repository
public class CaffeineDocumentStore implements DocumentStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineDocumentStore.class);

  private final Cache<String, Document> cache;

  public CaffeineDocumentStore(@Value("${pipeline.document-store.max-size}") int maxSize) {
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();
    LOGGER.info("Initialized document store: maxSize={}", maxSize);
  }

  @Override
  public void save(Document document) {
    cache.put(document.getId(), document);
  }

  @Override
  public Optional<Document> findById(String documentId) {
    return Optional.ofNullable(cache.getIfPresent(documentId));
  }

  @Override
  public Optional<Document> findByIdAndOwner(String documentId, String ownerId) {
    return findById(documentId).filter(doc -> ownerId.equals(doc.getOwnerId()));
  }

  @Override
  public List<Document> findRecentByOwner(String ownerId, int limit) {
    return cache.asMap().values().stream()
        .filter(doc -> ownerId.equals(doc.getOwnerId()))
        .sorted(Comparator.comparing(Document::getCreatedAt).reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public long countByOwner(String ownerId) {
    return cache.asMap().values().stream().filter(doc -> ownerId.equals(doc.getOwnerId())).count();
  }
}
