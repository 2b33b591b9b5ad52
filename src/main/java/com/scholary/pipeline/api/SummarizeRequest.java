package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request to summarize a document, ad-hoc text, or both. */
public record SummarizeRequest(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("text") String text,
    @JsonProperty("mode") String mode,
    @JsonProperty("force") boolean force) {}
