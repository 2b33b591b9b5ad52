package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request to transcribe a document. {@code force} re-runs even if a transcript exists. */
public record TranscribeRequest(
    @JsonProperty("document_id") String documentId, @JsonProperty("force") boolean force) {}
