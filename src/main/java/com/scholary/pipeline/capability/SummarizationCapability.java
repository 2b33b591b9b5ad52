package com.scholary.pipeline.capability;

/** Summarization backend. */
public interface SummarizationCapability {

  /**
   * Summarize a text.
   *
   * @throws CapabilityException if summarization fails
   */
  CapabilityResult summarize(String text, SummarizeOptions options);
}
