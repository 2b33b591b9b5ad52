package com.scholary.pipeline.document;

import java.util.List;
import java.util.Optional;

/** Storage for documents. Writes are last-writer-wins; no isolation between jobs. */
public interface DocumentStore {

  void save(Document document);

  Optional<Document> findById(String documentId);

  /** Find a document only if it belongs to the given owner. */
  Optional<Document> findByIdAndOwner(String documentId, String ownerId);

  /** The owner's most recently created documents, newest first. */
  List<Document> findRecentByOwner(String ownerId, int limit);

  long countByOwner(String ownerId);
}
