package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request to register a document whose file is already stored.
 *
 * @param filePath local path or {@code s3://bucket/key} of the uploaded file
 * @param textContent extracted text, when the file is a text document
 */
public record RegisterDocumentRequest(
    @JsonProperty("original_name") @NotBlank String originalName,
    @JsonProperty("file_path") @NotBlank String filePath,
    @JsonProperty("mime_type") String mimeType,
    @JsonProperty("size_bytes") @PositiveOrZero long sizeBytes,
    @JsonProperty("text_content") String textContent,
    @JsonProperty("language") String language) {}
