package com.scholary.pipeline.inference;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the text inference backends.
 *
 * <p>Timeouts are in seconds; backoff is the base delay between retries in milliseconds.
 */
@ConfigurationProperties(prefix = "inference")
@Validated
public record InferenceProperties(@Valid @NotNull Endpoint summarizer, @Valid @NotNull Endpoint translator) {

  public record Endpoint(
      @NotBlank String baseUrl,
      @NotBlank String path,
      @Positive int connectTimeout,
      @Positive int readTimeout,
      @Positive int maxRetries,
      @PositiveOrZero long backoffMs) {}
}
