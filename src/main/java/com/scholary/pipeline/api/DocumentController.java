package com.scholary.pipeline.api;

import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.service.DocumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Registers documents by reference to an already stored file and reads them back. */
@RestController
@RequestMapping("/api/documents")
@Tag(name = "Documents", description = "Document registration")
public class DocumentController {

  private final DocumentService documentService;

  public DocumentController(DocumentService documentService) {
    this.documentService = documentService;
  }

  @PostMapping
  @Operation(summary = "Register a document")
  public ResponseEntity<Document> register(
      @RequestHeader(ProcessingController.OWNER_HEADER) String ownerId,
      @Valid @RequestBody RegisterDocumentRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(documentService.register(ownerId, request));
  }

  @GetMapping
  @Operation(summary = "List the caller's documents, newest first")
  public List<Document> list(
      @RequestHeader(ProcessingController.OWNER_HEADER) String ownerId,
      @RequestParam(value = "limit", required = false) Integer limit) {
    return documentService.list(ownerId, limit);
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get a document")
  public Document get(
      @RequestHeader(ProcessingController.OWNER_HEADER) String ownerId,
      @PathVariable("id") String documentId) {
    return documentService.get(ownerId, documentId);
  }
}
