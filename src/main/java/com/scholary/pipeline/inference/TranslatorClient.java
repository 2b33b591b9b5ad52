package com.scholary.pipeline.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.capability.CapabilityResponses;
import com.scholary.pipeline.capability.CapabilityResult;
import com.scholary.pipeline.capability.ResponseShape;
import com.scholary.pipeline.capability.TranslateOptions;
import com.scholary.pipeline.capability.TranslationCapability;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the translation backend.
 *
 * <p>Posts {@code {"text", "target_lang", "source_lang"}}; the source language is omitted when
 * the caller leaves it to detection.
 */
@Component
public class TranslatorClient extends HttpCapabilityClient implements TranslationCapability {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslatorClient.class);

  private final InferenceProperties.Endpoint endpoint;

  public TranslatorClient(InferenceProperties properties, ObjectMapper objectMapper) {
    super(
        "translate",
        properties.translator().connectTimeout(),
        properties.translator().maxRetries(),
        properties.translator().backoffMs(),
        objectMapper);
    this.endpoint = properties.translator();
    LOGGER.info("Initialized translator client: baseUrl={}", endpoint.baseUrl());
  }

  @Override
  public CapabilityResult translate(String text, TranslateOptions options) {
    LOGGER.info(
        "Translating text: chars={}, source={}, target={}",
        text.length(),
        options.sourceLang(),
        options.targetLang());

    ObjectNode body = objectMapper.createObjectNode();
    body.put("text", text);
    body.put("target_lang", options.targetLang());
    if (options.sourceLang() != null) {
      body.put("source_lang", options.sourceLang());
    }

    CapabilityResult result =
        CapabilityResponses.normalize(
            execute(
                () ->
                    HttpRequest.newBuilder()
                        .uri(URI.create(endpoint.baseUrl() + endpoint.path()))
                        .timeout(Duration.ofSeconds(endpoint.readTimeout()))
                        .header("Content-Type", "application/json")
                        .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                        .build()),
            ResponseShape.TRANSLATION);

    LOGGER.info(
        "Translation successful: chars={}, detectedSource={}", result.text().length(), result.language());
    return result;
  }
}
