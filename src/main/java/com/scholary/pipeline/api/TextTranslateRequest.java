package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TextTranslateRequest(
    @JsonProperty("text") String text,
    @JsonProperty("target_lang") String targetLang,
    @JsonProperty("source_lang") String sourceLang) {}
