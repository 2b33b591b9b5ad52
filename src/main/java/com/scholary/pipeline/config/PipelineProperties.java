package com.scholary.pipeline.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job processing.
 *
 * <p>Store sizes are read by the stores themselves; this holds what the processing layer needs.
 *
 * @param snippetMaxChars length at which ad-hoc text is cut in the job's input snapshot
 * @param tempDir where staged audio is written
 * @param defaultMode summarizer mode used when a request names none
 * @param defaultTargetLang translation target used when a request names none
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Positive int snippetMaxChars,
    @NotBlank String tempDir,
    @NotBlank String defaultMode,
    @NotBlank String defaultTargetLang) {}
