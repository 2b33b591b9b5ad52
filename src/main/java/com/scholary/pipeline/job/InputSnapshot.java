package com.scholary.pipeline.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Audit copy of what the caller sent with the job. Never mutated after creation.
 *
 * @param documentId the requested document, if any
 * @param textSnippet the ad-hoc text, truncated
 * @param filePath an ad-hoc audio reference for jobs without a document
 * @param createdAt when the snapshot was taken
 */
public record InputSnapshot(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("text_snippet") String textSnippet,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("created_at") Instant createdAt) {

  public static InputSnapshot of(
      String documentId, String text, String filePath, int maxSnippetChars, Instant now) {
    String snippet = null;
    if (text != null) {
      snippet = text.length() > maxSnippetChars ? text.substring(0, maxSnippetChars) : text;
    }
    return new InputSnapshot(documentId, snippet, filePath, now);
  }
}
