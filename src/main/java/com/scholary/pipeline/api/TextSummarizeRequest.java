package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TextSummarizeRequest(
    @JsonProperty("text") String text, @JsonProperty("mode") String mode) {}
