package com.scholary.pipeline.service;

import com.scholary.pipeline.api.RegisterDocumentRequest;
import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.document.DocumentStore;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Registration and lookup of documents whose files were stored elsewhere. */
@Service
public class DocumentService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentService.class);

  static final int DEFAULT_LIST_LIMIT = 100;

  private final DocumentStore documentStore;

  public DocumentService(DocumentStore documentStore) {
    this.documentStore = documentStore;
  }

  public Document register(String ownerId, RegisterDocumentRequest request) {
    Document document =
        new Document(
            UUID.randomUUID().toString(), ownerId, request.originalName(), request.filePath());
    document.setMimeType(request.mimeType());
    document.setSizeBytes(request.sizeBytes());
    document.setTextContent(request.textContent());
    document.setLanguage(request.language());
    documentStore.save(document);

    LOGGER.info("Document registered: documentId={}, name={}", document.getId(), request.originalName());
    return document;
  }

  /** The owner's documents, newest first. */
  public List<Document> list(String ownerId, Integer limit) {
    int effective = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : limit;
    return documentStore.findRecentByOwner(ownerId, effective);
  }

  public Document get(String ownerId, String documentId) {
    return documentStore
        .findByIdAndOwner(documentId, ownerId)
        .orElseThrow(() -> new NotFoundException("not found"));
  }
}
