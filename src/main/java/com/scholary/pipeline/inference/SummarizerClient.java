package com.scholary.pipeline.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.pipeline.capability.CapabilityResponses;
import com.scholary.pipeline.capability.CapabilityResult;
import com.scholary.pipeline.capability.ResponseShape;
import com.scholary.pipeline.capability.SummarizationCapability;
import com.scholary.pipeline.capability.SummarizeOptions;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the summarization backend.
 *
 * <p>Posts {@code {"text": ..., "mode": ...}} and accepts either a bare summary string or an
 * object with a {@code summary} (or {@code text}) field. Chunking long inputs is the backend's
 * concern.
 */
@Component
public class SummarizerClient extends HttpCapabilityClient implements SummarizationCapability {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummarizerClient.class);

  private final InferenceProperties.Endpoint endpoint;

  public SummarizerClient(InferenceProperties properties, ObjectMapper objectMapper) {
    super(
        "summarize",
        properties.summarizer().connectTimeout(),
        properties.summarizer().maxRetries(),
        properties.summarizer().backoffMs(),
        objectMapper);
    this.endpoint = properties.summarizer();
    LOGGER.info("Initialized summarizer client: baseUrl={}", endpoint.baseUrl());
  }

  @Override
  public CapabilityResult summarize(String text, SummarizeOptions options) {
    LOGGER.info("Summarizing text: chars={}, mode={}", text.length(), options.mode());

    ObjectNode body = objectMapper.createObjectNode();
    body.put("text", text);
    body.put("mode", options.mode());

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
            ResponseShape.SUMMARY);

    LOGGER.info("Summarization successful: chars={}", result.text().length());
    return result;
  }
}
