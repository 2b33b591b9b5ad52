package com.scholary.pipeline.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.pipeline.capability.CapabilityException;
import com.scholary.pipeline.logging.StructuredLogger;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for HTTP adapters of inference backends.
 *
 * <p>Sends a request, retries transient failures (I/O errors and 5xx answers) with exponential
 * backoff and jitter, and parses the body as JSON. A body that is not JSON is returned as a text
 * node so plain-text backends work too. Timeouts are enforced per request by the HTTP client.
 */
public abstract class HttpCapabilityClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpCapabilityClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  protected final HttpClient httpClient;
  protected final ObjectMapper objectMapper;
  private final String capability;
  private final int maxRetries;
  private final long backoffBaseMs;

  protected HttpCapabilityClient(
      String capability,
      int connectTimeoutSeconds,
      int maxRetries,
      long backoffBaseMs,
      ObjectMapper objectMapper) {
    this.capability = capability;
    this.maxRetries = Math.max(maxRetries, 1);
    this.backoffBaseMs = backoffBaseMs;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(connectTimeoutSeconds)).build();
  }

  /**
   * Send a request built by the supplier, retrying transient failures.
   *
   * @param requestFactory builds a fresh request for every attempt
   * @return the parsed response body
   * @throws CapabilityException if all attempts fail or the backend rejects the request
   */
  protected JsonNode execute(RequestFactory requestFactory) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxRetries) {
      try {
        return attemptOnce(requestFactory.create());
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < maxRetries) {
          long backoffMs = (long) (Math.pow(2, attempt) * backoffBaseMs + Math.random() * backoffBaseMs);
          structuredLogger.logCapabilityRetry(capability, attempt, maxRetries, backoffMs, e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CapabilityException(capability + " call interrupted", e);
      }
    }

    throw new CapabilityException(
        String.format("%s failed after %d attempts", capability, maxRetries), lastException);
  }

  private JsonNode attemptOnce(HttpRequest request) throws IOException, InterruptedException {
    LOGGER.debug("Sending {} request to {}", capability, request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();

    if (status >= 500) {
      throw new IOException(
          String.format("%s backend returned status %d: %s", capability, status, response.body()));
    }
    if (status >= 300) {
      throw new CapabilityException(
          String.format("%s backend rejected request with status %d: %s", capability, status, response.body()));
    }

    String body = response.body();
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      return objectMapper.getNodeFactory().textNode(body);
    }
  }

  private void sleep(long backoffMs) {
    try {
      Thread.sleep(backoffMs);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new CapabilityException(capability + " call interrupted", ie);
    }
  }

  /** Builds the request for one attempt. */
  @FunctionalInterface
  protected interface RequestFactory {
    HttpRequest create() throws IOException;
  }
}
