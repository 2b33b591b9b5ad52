package com.scholary.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * Request to run a composite job.
 *
 * <p>The operation list is checked by the service so that an empty list is reported with the same
 * message whether it is missing or empty.
 */
public record StartProcessingRequest(
    @JsonProperty("document_id") @Schema(description = "Document to process") String documentId,
    @JsonProperty("text") @Schema(description = "Ad-hoc text to process") String text,
    @JsonProperty("file_path") @Schema(description = "Ad-hoc audio reference, local path or s3://")
        String filePath,
    @JsonProperty("operations")
        @Schema(description = "Steps to run in order", example = "[\"transcribe\",\"summarize\"]")
        List<String> operations,
    @JsonProperty("mode") @Schema(description = "Summarizer mode", example = "concise") String mode,
    @JsonProperty("target_lang") @Schema(description = "Translation target", example = "en")
        String targetLang) {}
