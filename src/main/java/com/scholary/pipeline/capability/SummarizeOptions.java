package com.scholary.pipeline.capability;

/** Options for a summarization call. */
public record SummarizeOptions(String mode) {}
