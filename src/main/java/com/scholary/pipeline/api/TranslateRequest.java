package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request to translate a document, ad-hoc text, or both. */
public record TranslateRequest(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("text") String text,
    @JsonProperty("target_lang") String targetLang,
    @JsonProperty("source_lang") String sourceLang,
    @JsonProperty("force") boolean force) {}
